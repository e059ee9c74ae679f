package nl.bytesoflife.kicadsexpr.fields;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalization of text written by older KiCad versions.
 */
public final class LegacyText {

    // ~TEXT~ overbar, but not the newer ~{TEXT}
    private static final Pattern OLD_OVERBAR = Pattern.compile("~([^~{}]+)~");

    private static final Map<String, String> PIN_TYPE_RENAMES = Map.of(
            "unconnected", "no_connect"
    );

    private LegacyText() {
    }

    /**
     * Old files wrote an empty string as {@code ~} and overbars as {@code ~TEXT~};
     * both are mapped to the current form ({@code ""} and {@code ~{TEXT}}).
     */
    public static String normalizeTextContent(String text) {
        if (text == null || text.isEmpty() || text.equals("~")) {
            return "";
        }
        return OLD_OVERBAR.matcher(text).replaceAll("~{$1}");
    }

    public static String formatTextForOutput(String text) {
        return text == null ? "" : text;
    }

    public static String normalizePinElectricalType(String pinType) {
        return PIN_TYPE_RENAMES.getOrDefault(pinType, pinType);
    }
}
