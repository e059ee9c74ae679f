package nl.bytesoflife.kicadsexpr.fields;

import nl.bytesoflife.kicadsexpr.lexer.SExpressionLexer;
import nl.bytesoflife.kicadsexpr.model.SNode;
import nl.bytesoflife.kicadsexpr.writer.KicadAtomFormatter;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Total conversions from atoms to Java values. None of them throws: a value that
 * is missing or cannot be converted gives {@link Optional#empty()}.
 */
public final class Coercions {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private Coercions() {
    }

    public static Optional<Double> toDouble(SNode node) {
        if (node instanceof SNode.SFloat decimal) {
            return Optional.of(decimal.value());
        }
        if (node instanceof SNode.SInteger integer) {
            return Optional.of((double) integer.value());
        }
        if (node instanceof SNode.SSymbol || node instanceof SNode.SString) {
            String text = ((SNode.SAtom) node).text().trim();
            if (SExpressionLexer.isNumber(text)) {
                return Optional.of(Double.parseDouble(text));
            }
        }
        return Optional.empty();
    }

    /**
     * Floats are truncated toward zero; text must be a plain integer literal.
     */
    public static Optional<Long> toLong(SNode node) {
        if (node instanceof SNode.SInteger integer) {
            return Optional.of(integer.value());
        }
        if (node instanceof SNode.SFloat decimal) {
            double value = decimal.value();
            if (Double.isFinite(value) && Math.abs(value) < 0x1p63) {
                return Optional.of((long) value);
            }
            return Optional.empty();
        }
        if (node instanceof SNode.SSymbol || node instanceof SNode.SString) {
            String text = ((SNode.SAtom) node).text().trim();
            if (INTEGER.matcher(text).matches()) {
                BigInteger value = new BigInteger(text);
                if (value.bitLength() < 64) {
                    return Optional.of(value.longValue());
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<Integer> toInt(SNode node) {
        return toLong(node)
                .filter(value -> value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE)
                .map(Long::intValue);
    }

    /**
     * Text of any atom; floats use the same notation the writer uses. Lists have no text.
     */
    public static Optional<String> toStr(SNode node) {
        if (node instanceof SNode.SFloat decimal) {
            return Optional.of(KicadAtomFormatter.INSTANCE.formatFloat(decimal));
        }
        if (node instanceof SNode.SAtom atom) {
            return Optional.of(atom.text());
        }
        return Optional.empty();
    }

    /**
     * Accepts {@code yes/no}, {@code true/false} and {@code 1/0}.
     */
    public static Optional<Boolean> toBool(SNode node) {
        if (!(node instanceof SNode.SAtom atom)) {
            return Optional.empty();
        }
        return switch (atom.text().trim().toLowerCase(Locale.ROOT)) {
            case "yes", "true", "1" -> Optional.of(Boolean.TRUE);
            case "no", "false", "0" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }
}
