package nl.bytesoflife.kicadsexpr.drc.model;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * The {@code (layer ...)} clause of a rule: {@code outer}, {@code inner}, a wildcard such as
 * {@code ?.Silkscreen}, or an exact layer name.
 */
public class LayerSelector {

    private static final Set<String> OUTER_LAYERS = Set.of("F.Cu", "B.Cu");

    private final String expression;

    public LayerSelector(String expression) {
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }

    public boolean matches(String kicadLayerName) {
        if (expression == null || expression.isEmpty()) {
            return true;
        }

        String expr = expression.trim();

        if (expr.equalsIgnoreCase("outer")) {
            return OUTER_LAYERS.contains(kicadLayerName);
        }
        if (expr.equalsIgnoreCase("inner")) {
            return kicadLayerName.startsWith("In") && kicadLayerName.endsWith(".Cu");
        }

        // "?.Cu" matches "F.Cu", "B.Cu"
        if (expr.contains("?") || expr.contains("*")) {
            return wildcardPattern(expr).matcher(kicadLayerName).matches();
        }

        return expr.equals(kicadLayerName);
    }

    private static Pattern wildcardPattern(String expr) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : expr.toCharArray()) {
            if (c == '?' || c == '*') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '?' ? "." : ".*");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    /**
     * Keywords are written as bare symbols, layer names as quoted strings.
     */
    public boolean isKeyword() {
        return "outer".equalsIgnoreCase(expression) || "inner".equalsIgnoreCase(expression);
    }

    @Override
    public String toString() {
        return expression != null ? expression : "(all layers)";
    }
}
