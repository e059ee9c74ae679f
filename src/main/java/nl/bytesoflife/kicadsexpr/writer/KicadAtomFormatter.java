package nl.bytesoflife.kicadsexpr.writer;

import nl.bytesoflife.kicadsexpr.model.SNode;

import java.math.BigDecimal;

public class KicadAtomFormatter implements AtomFormatter {

    public static final KicadAtomFormatter INSTANCE = new KicadAtomFormatter();

    @Override
    public String formatSymbol(SNode.SSymbol symbol) {
        return symbol.name();
    }

    @Override
    public String formatString(SNode.SString string) {
        String value = string.value();
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    @Override
    public String formatInteger(SNode.SInteger integer) {
        return Long.toString(integer.value());
    }

    /**
     * Plain decimal notation that always contains a '.', so the value reads back as a float.
     */
    @Override
    public String formatFloat(SNode.SFloat decimal) {
        double value = decimal.value();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            // BigDecimal has no negative zero
            return 1 / value < 0 ? "-0.0" : "0.0";
        }
        String text = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return text.indexOf('.') >= 0 ? text : text + ".0";
    }
}
