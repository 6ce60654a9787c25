package space.sparkradar.units;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient number parsing for upstream fields that may arrive as numbers,
 * numeric strings ("72", "29.92"), placeholders ("NA", "") or not at all.
 *
 * <p>
 * Every method returns {@code null} when nothing usable is present, never 0,
 * so "no data" stays distinct from a zero reading.
 * </p>
 */
public final class SafeParse {
    /**
     * Utility class; do not instantiate.
     */
    private SafeParse() {
    }

    public static Double parseDouble(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            double v = Double.parseDouble(s.trim());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Integer value of a string; a decimal string is truncated toward zero.
     */
    public static Integer parseInt(String s) {
        Double d = parseDouble(s);
        return d == null ? null : (int) d.doubleValue();
    }

    public static Double toDouble(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return null;
        if (node.isNumber()) {
            double v = node.asDouble();
            return Double.isFinite(v) ? v : null;
        }
        if (node.isTextual())
            return parseDouble(node.asText());
        return null;
    }

    public static Integer toInt(JsonNode node) {
        Double d = toDouble(node);
        return d == null ? null : (int) d.doubleValue();
    }

    public static Long toLong(JsonNode node) {
        Double d = toDouble(node);
        return d == null ? null : (long) d.doubleValue();
    }

    /**
     * Text of a node, or null when missing, null or blank.
     */
    public static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode())
            return null;
        String s = node.asText();
        return s == null || s.isBlank() ? null : s;
    }
}
