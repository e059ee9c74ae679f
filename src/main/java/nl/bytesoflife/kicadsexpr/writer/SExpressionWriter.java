package nl.bytesoflife.kicadsexpr.writer;

import nl.bytesoflife.kicadsexpr.model.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pretty-printer producing the layout KiCad writes.
 * <p>
 * A list without nested lists is written on one line: {@code (net 1 "GND")}.
 * Otherwise the head stays on the opening line, every nested list goes on its own
 * line one indent unit deeper, and the closing parenthesis gets a line of its own:
 * <pre>
 * (pts
 * 	(xy 0 0)
 * 	(xy 10 0)
 * )
 * </pre>
 */
public class SExpressionWriter {

    private static final Logger log = LoggerFactory.getLogger(SExpressionWriter.class);

    private final RenderStrategy strategy;

    public SExpressionWriter() {
        this(RenderStrategy.kicad());
    }

    public SExpressionWriter(RenderStrategy strategy) {
        this.strategy = strategy;
    }

    public RenderStrategy getStrategy() {
        return strategy;
    }

    public String render(SNode node) {
        StringBuilder sb = new StringBuilder();
        write(node, 0, sb);
        if (node instanceof SNode.SList list && list.head().filter(strategy.getRootMarkers()::contains).isPresent()) {
            sb.append('\n');
        }
        log.trace("Rendered {} characters", sb.length());
        return sb.toString();
    }

    private void write(SNode node, int level, StringBuilder sb) {
        if (node instanceof SNode.SAtom atom) {
            sb.append(strategy.getAtomFormatter().format(atom));
            return;
        }
        SNode.SList list = (SNode.SList) node;
        if (list.isEmpty()) {
            sb.append("()");
        } else if (!strategy.isPrettyPrint() || !hasNestedList(list)) {
            writeSingleLine(list, level, sb);
        } else if (strategy.getAtomPlacement() == AtomPlacement.HOIST_ATOMS) {
            writeHoisted(list, level, sb);
        } else {
            writeMultiLine(list, level, sb);
        }
    }

    private void writeSingleLine(SNode.SList list, int level, StringBuilder sb) {
        sb.append('(');
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) sb.append(' ');
            write(list.get(i), level, sb);
        }
        sb.append(')');
    }

    private void writeMultiLine(SNode.SList list, int level, StringBuilder sb) {
        sb.append('(');
        write(list.get(0), level, sb);
        int i = 1;
        while (i < list.size() && !(list.get(i) instanceof SNode.SList)) {
            sb.append(' ');
            write(list.get(i), level, sb);
            i++;
        }
        for (; i < list.size(); i++) {
            newLine(level + 1, sb);
            write(list.get(i), level + 1, sb);
        }
        newLine(level, sb);
        sb.append(')');
    }

    private void writeHoisted(SNode.SList list, int level, StringBuilder sb) {
        sb.append('(');
        write(list.get(0), level, sb);
        for (int i = 1; i < list.size(); i++) {
            if (!(list.get(i) instanceof SNode.SList)) {
                sb.append(' ');
                write(list.get(i), level, sb);
            }
        }
        for (int i = 1; i < list.size(); i++) {
            if (list.get(i) instanceof SNode.SList) {
                newLine(level + 1, sb);
                write(list.get(i), level + 1, sb);
            }
        }
        newLine(level, sb);
        sb.append(')');
    }

    private void newLine(int level, StringBuilder sb) {
        sb.append('\n');
        sb.append(strategy.getIndentUnit().repeat(level));
    }

    private static boolean hasNestedList(SNode.SList list) {
        for (int i = 1; i < list.size(); i++) {
            if (list.get(i) instanceof SNode.SList) {
                return true;
            }
        }
        return false;
    }
}
