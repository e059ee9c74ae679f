package nl.bytesoflife.kicadsexpr.fields;

import nl.bytesoflife.kicadsexpr.model.KicadToken;
import nl.bytesoflife.kicadsexpr.model.Position;
import nl.bytesoflife.kicadsexpr.model.SNode;
import nl.bytesoflife.kicadsexpr.model.Stroke;
import nl.bytesoflife.kicadsexpr.model.StrokeType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Lookup and coercion helpers used to map named lists to domain objects.
 * <p>
 * A "token" is a list whose first child is a symbol, e.g. {@code (width 0.15)}.
 * Lookups only inspect the direct children of the given list. Optional accessors
 * never throw; missing, unknown or malformed data gives {@link Optional#empty()}
 * or the caller's default, so files written by other KiCad versions keep loading.
 * The {@code getRequired*} accessors throw {@link MissingFieldException} only when
 * the token is absent and no default was passed.
 */
public final class SExprFields {

    private SExprFields() {
    }

    // --- Token lookup ---

    public static Optional<String> tokenName(SNode.SList list) {
        return list.head();
    }

    public static boolean isToken(SNode.SList list, String name) {
        return list.head().filter(name::equals).isPresent();
    }

    /**
     * First direct child list whose head symbol is {@code name}.
     */
    public static Optional<SNode.SList> findToken(SNode.SList list, String name) {
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList token && isToken(token, name)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * All direct child lists whose head symbol is {@code name}, in document order.
     */
    public static List<SNode.SList> findAllTokens(SNode.SList list, String name) {
        List<SNode.SList> result = new ArrayList<>();
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList token && isToken(token, name)) {
                result.add(token);
            }
        }
        return result;
    }

    public static boolean hasToken(SNode.SList list, String name) {
        return findToken(list, name).isPresent();
    }

    /**
     * True when a bare symbol such as {@code locked} or {@code hide} is a direct child.
     */
    public static boolean hasSymbol(SNode.SList list, String name) {
        for (SNode child : list.children()) {
            if (child instanceof SNode.SSymbol symbol && symbol.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Value directly following a bare symbol, e.g. {@code 1.27} for {@code offset} in
     * {@code (pin_names offset 1.27)}.
     */
    public static Optional<SNode> getSymbolValue(SNode.SList list, String name) {
        List<SNode> children = list.children();
        for (int i = 0; i < children.size() - 1; i++) {
            if (children.get(i) instanceof SNode.SSymbol symbol && symbol.name().equals(name)) {
                return Optional.of(children.get(i + 1));
            }
        }
        return Optional.empty();
    }

    // --- Positional access ---

    public static Optional<SNode> getValue(SNode.SList list, int index) {
        if (index < 0 || index >= list.size()) {
            return Optional.empty();
        }
        return Optional.of(list.get(index));
    }

    public static SNode getValue(SNode.SList list, int index, SNode defaultValue) {
        return getValue(list, index).orElse(defaultValue);
    }

    public static boolean hasMinLength(SNode.SList list, int minLength) {
        return list.size() >= minLength;
    }

    public static String safeGetStr(SNode.SList list, int index, String defaultValue) {
        return getValue(list, index).flatMap(Coercions::toStr).orElse(defaultValue);
    }

    public static int safeGetInt(SNode.SList list, int index, int defaultValue) {
        return getValue(list, index).flatMap(Coercions::toInt).orElse(defaultValue);
    }

    public static double safeGetFloat(SNode.SList list, int index, double defaultValue) {
        return getValue(list, index).flatMap(Coercions::toDouble).orElse(defaultValue);
    }

    // --- Optional fields ---

    public static Optional<String> getOptionalStr(SNode.SList list, String name) {
        return getOptionalStr(list, name, 1);
    }

    public static Optional<String> getOptionalStr(SNode.SList list, String name, int index) {
        return slot(list, name, index).flatMap(Coercions::toStr);
    }

    public static Optional<Double> getOptionalFloat(SNode.SList list, String name) {
        return getOptionalFloat(list, name, 1);
    }

    public static Optional<Double> getOptionalFloat(SNode.SList list, String name, int index) {
        return slot(list, name, index).flatMap(Coercions::toDouble);
    }

    public static Optional<Integer> getOptionalInt(SNode.SList list, String name) {
        return getOptionalInt(list, name, 1);
    }

    public static Optional<Integer> getOptionalInt(SNode.SList list, String name, int index) {
        return slot(list, name, index).flatMap(Coercions::toInt);
    }

    /**
     * Value of a {@code (NAME yes|no)} style token.
     */
    public static Optional<Boolean> getOptionalBool(SNode.SList list, String name) {
        return slot(list, name, 1).flatMap(Coercions::toBool);
    }

    /**
     * {@code Optional.of(true)} when the bare symbol is present, empty otherwise.
     */
    public static Optional<Boolean> getOptionalBoolFlag(SNode.SList list, String name) {
        return hasSymbol(list, name) ? Optional.of(Boolean.TRUE) : Optional.empty();
    }

    public static Optional<Position> getOptionalPosition(SNode.SList list, String name) {
        return findToken(list, name).map(SExprFields::toPosition);
    }

    /**
     * Coercible values following the head of the first {@code name} token; others are skipped.
     */
    public static <T> List<T> getValues(SNode.SList list, String name, Function<SNode, Optional<T>> coercion) {
        List<T> result = new ArrayList<>();
        findToken(list, name).ifPresent(token -> {
            for (int i = 1; i < token.size(); i++) {
                coercion.apply(token.get(i)).ifPresent(result::add);
            }
        });
        return result;
    }

    // --- Required fields ---

    public static String getRequiredStr(SNode.SList list, String name) {
        return getRequiredStr(list, name, null);
    }

    /**
     * @param defaultValue returned when the token is absent; {@code null} makes the token mandatory
     */
    public static String getRequiredStr(SNode.SList list, String name, String defaultValue) {
        SNode.SList token = requireToken(list, name, defaultValue != null);
        if (token == null) {
            return defaultValue;
        }
        return getValue(token, 1).flatMap(Coercions::toStr).orElse(defaultValue != null ? defaultValue : "");
    }

    public static double getRequiredFloat(SNode.SList list, String name) {
        return safeGetFloat(requireToken(list, name, false), 1, 0.0);
    }

    public static double getRequiredFloat(SNode.SList list, String name, double defaultValue) {
        return findToken(list, name)
                .map(token -> safeGetFloat(token, 1, defaultValue))
                .orElse(defaultValue);
    }

    public static int getRequiredInt(SNode.SList list, String name) {
        return safeGetInt(requireToken(list, name, false), 1, 0);
    }

    public static int getRequiredInt(SNode.SList list, String name, int defaultValue) {
        return findToken(list, name)
                .map(token -> safeGetInt(token, 1, defaultValue))
                .orElse(defaultValue);
    }

    public static Position getRequiredPosition(SNode.SList list, String name) {
        return toPosition(requireToken(list, name, false));
    }

    public static Position getRequiredPosition(SNode.SList list, String name, Position defaultValue) {
        return getOptionalPosition(list, name).orElse(defaultValue);
    }

    public static Position getPositionWithDefault(SNode.SList list, String name, double defaultX, double defaultY) {
        return findToken(list, name)
                .map(token -> new Position(
                        safeGetFloat(token, 1, defaultX),
                        safeGetFloat(token, 2, defaultY)))
                .orElseGet(() -> new Position(defaultX, defaultY));
    }

    private static SNode.SList requireToken(SNode.SList list, String name, boolean hasDefault) {
        Optional<SNode.SList> token = findToken(list, name);
        if (token.isEmpty() && !hasDefault) {
            throw new MissingFieldException(name);
        }
        return token.orElse(null);
    }

    private static Optional<SNode> slot(SNode.SList list, String name, int index) {
        return findToken(list, name).flatMap(token -> getValue(token, index));
    }

    // --- Positions ---

    /**
     * Reads {@code (TOKEN X Y [ANGLE])} or {@code (TOKEN (xyz X Y Z))}; missing or
     * malformed components are 0.
     */
    public static Position toPosition(SNode.SList token) {
        if (token.size() >= 2 && token.get(1) instanceof SNode.SList inner && isToken(inner, "xyz")) {
            return Position.xyz(
                    safeGetFloat(inner, 1, 0.0),
                    safeGetFloat(inner, 2, 0.0),
                    safeGetFloat(inner, 3, 0.0));
        }
        return new Position(
                safeGetFloat(token, 1, 0.0),
                safeGetFloat(token, 2, 0.0),
                safeGetFloat(token, 3, 0.0));
    }

    /**
     * Reads X, Y and an optional angle starting at {@code startIndex}; the origin when X or Y is missing.
     */
    public static Position safeGetPosition(SNode.SList list, int startIndex) {
        if (list.size() < startIndex + 2) {
            return Position.ORIGIN;
        }
        return new Position(
                safeGetFloat(list, startIndex, 0.0),
                safeGetFloat(list, startIndex + 1, 0.0),
                safeGetFloat(list, startIndex + 2, 0.0));
    }

    // --- Enumerations ---

    /**
     * Maps an atom onto one of {@code allowed} by its file token. Anything else,
     * including lists and tokens newer than this code, gives {@code fallback}.
     */
    public static <E extends Enum<E> & KicadToken> E parseEnum(SNode value, Set<E> allowed, E fallback) {
        if (!(value instanceof SNode.SAtom atom)) {
            return fallback;
        }
        return parseEnum(atom.text(), allowed, fallback);
    }

    public static <E extends Enum<E> & KicadToken> E parseEnum(String value, Set<E> allowed, E fallback) {
        if (value != null) {
            for (E candidate : allowed) {
                if (candidate.token().equals(value)) {
                    return candidate;
                }
            }
        }
        return fallback;
    }

    public static <E extends Enum<E> & KicadToken> E parseEnum(SNode value, Class<E> type, E fallback) {
        return parseEnum(value, EnumSet.allOf(type), fallback);
    }

    // --- Strokes ---

    /**
     * Stroke of a graphic item. A {@code (stroke ...)} token wins; older files only
     * carry a bare {@code (width W)}. When both are present the stroke is used and the
     * bare width is ignored.
     */
    public static Stroke getStrokeOrWidth(SNode.SList list, double defaultWidth) {
        Optional<SNode.SList> stroke = findToken(list, "stroke");
        if (stroke.isPresent()) {
            return toStroke(stroke.get(), defaultWidth);
        }
        return findToken(list, "width")
                .map(width -> new Stroke(safeGetFloat(width, 1, defaultWidth)))
                .orElseGet(() -> new Stroke(defaultWidth));
    }

    public static Stroke toStroke(SNode.SList token, double defaultWidth) {
        double width = getRequiredFloat(token, "width", defaultWidth);
        StrokeType type = findToken(token, "type")
                .flatMap(t -> getValue(t, 1))
                .map(v -> parseEnum(v, StrokeType.class, StrokeType.SOLID))
                .orElse(StrokeType.SOLID);
        Stroke.Color color = findToken(token, "color")
                .filter(c -> hasMinLength(c, 5))
                .map(c -> new Stroke.Color(
                        safeGetFloat(c, 1, 0.0),
                        safeGetFloat(c, 2, 0.0),
                        safeGetFloat(c, 3, 0.0),
                        safeGetFloat(c, 4, 0.0)))
                .orElse(null);
        return new Stroke(width, type, color);
    }
}
