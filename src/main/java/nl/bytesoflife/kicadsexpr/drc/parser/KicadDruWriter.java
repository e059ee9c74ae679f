package nl.bytesoflife.kicadsexpr.drc.parser;

import nl.bytesoflife.kicadsexpr.drc.model.*;
import nl.bytesoflife.kicadsexpr.model.SNode;
import nl.bytesoflife.kicadsexpr.writer.SExpressionWriter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link DrcRuleSet} as .kicad_dru text: the version line followed by one
 * expression per rule. Length limits are written in millimetres, counts without a unit.
 */
public class KicadDruWriter {

    private final SExpressionWriter writer = new SExpressionWriter();

    public String write(DrcRuleSet ruleSet) {
        StringBuilder sb = new StringBuilder();
        for (SNode node : toNodes(ruleSet)) {
            sb.append(writer.render(node)).append('\n');
        }
        return sb.toString();
    }

    public List<SNode> toNodes(DrcRuleSet ruleSet) {
        List<SNode> nodes = new ArrayList<>();
        nodes.add(SNode.named("version", SNode.integer(ruleSet.getVersion())));
        for (DrcRule rule : ruleSet.getRules()) {
            nodes.add(toNode(rule));
        }
        return nodes;
    }

    public SNode.SList toNode(DrcRule rule) {
        List<SNode> children = new ArrayList<>();
        children.add(SNode.symbol("rule"));
        children.add(SNode.string(rule.getName()));
        if (rule.hasExplicitSeverity()) {
            children.add(SNode.named("severity", SNode.symbol(rule.getSeverity().token())));
        }
        LayerSelector layer = rule.getLayer();
        if (layer != null && layer.getExpression() != null && !layer.getExpression().isEmpty()) {
            SNode value = layer.isKeyword()
                    ? SNode.symbol(layer.getExpression())
                    : SNode.string(layer.getExpression());
            children.add(SNode.named("layer", value));
        }
        if (rule.getConditionExpression() != null) {
            children.add(SNode.named("condition", SNode.string(rule.getConditionExpression())));
        }
        for (DrcConstraint constraint : rule.getConstraints()) {
            children.add(toNode(constraint));
        }
        return new SNode.SList(children);
    }

    public SNode.SList toNode(DrcConstraint constraint) {
        List<SNode> children = new ArrayList<>();
        children.add(SNode.symbol("constraint"));
        children.add(SNode.symbol(constraint.getType().token()));
        if (constraint.getType() == ConstraintType.DISALLOW) {
            for (String item : constraint.getDisallowed()) {
                children.add(SNode.symbol(item));
            }
            return new SNode.SList(children);
        }
        boolean unitless = constraint.getType().isUnitless();
        addLimit(children, "min", constraint.getMinMm(), unitless);
        addLimit(children, "opt", constraint.getOptMm(), unitless);
        addLimit(children, "max", constraint.getMaxMm(), unitless);
        return new SNode.SList(children);
    }

    private static void addLimit(List<SNode> children, String name, Double value, boolean unitless) {
        if (value != null) {
            children.add(SNode.named(name, unitless ? plainNumber(value) : SNode.symbol(formatMm(value))));
        }
    }

    // Counts go back as written: (min 2), not (min 2mm)
    static SNode plainNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 0x1p53) {
            return SNode.integer((long) value);
        }
        return SNode.decimal(value);
    }

    static String formatMm(double mm) {
        // Round away conversion noise such as 0.2032000000001 from mil values
        BigDecimal value = BigDecimal.valueOf(mm).setScale(6, RoundingMode.HALF_UP).stripTrailingZeros();
        if (value.signum() == 0) {
            return "0mm";
        }
        return value.toPlainString() + "mm";
    }
}
