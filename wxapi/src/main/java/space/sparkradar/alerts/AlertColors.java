package space.sparkradar.alerts;

import java.util.Map;

/**
 * Display colors for NWS hazard events.
 *
 * <p>
 * Exact event names come from the fixed table; anything else falls back by
 * wording: "Warning" red, "Watch" orange, everything else yellow.
 * </p>
 */
public final class AlertColors {
    static final String DEFAULT_WARNING = "#FF0000";
    static final String DEFAULT_WATCH = "#FFA500";
    static final String DEFAULT_OTHER = "#FFCC00";

    private static final Map<String, String> BY_EVENT = Map.ofEntries(
            Map.entry("Air Quality Alert", "#768b00"),
            Map.entry("Avalanche Warning", "#ff00ff"),
            Map.entry("Dust Advisory", "#706e00"),
            Map.entry("Dust Storm Warning", "#776b00"),
            Map.entry("Flash Flood Emergency", "#00ff00"),
            Map.entry("Flash Flood Warning", "#00ff00"),
            Map.entry("Flood Advisory", "#00538b"),
            Map.entry("Flood Warning", "#1E90FF"),
            Map.entry("Flood Watch", "#60fd82"),
            Map.entry("Marine Weather Statement", "#690083"),
            Map.entry("PDS Tornado Warning", "#e900dd"),
            Map.entry("Severe Thunderstorm Warning", "#f1a500"),
            Map.entry("Severe Thunderstorm Watch", "#db7093"),
            Map.entry("Snow Squall Warning", "#0096aa"),
            Map.entry("Special Marine Warning", "#8b3300"),
            Map.entry("Special Weather Statement", "#eeff00"),
            Map.entry("Tornado Emergency", "#9f00e9"),
            Map.entry("Tornado Warning", "#e90000"),
            Map.entry("Tornado Watch", "#ffff00"),
            Map.entry("Tropical Storm Watch", "#3f0072"),
            Map.entry("Winter Storm Warning", "#00d4ff"),
            Map.entry("Winter Weather Advisory", "#0087af"),
            Map.entry("Winter Storm Watch", "#00aaff"),
            Map.entry("Ice Storm Warning", "#0047ab"),
            Map.entry("High Wind Warning", "#ff8000"),
            Map.entry("Extreme Cold Warning", "#00ffff"),
            Map.entry("Heat Advisory", "#ff7000"),
            Map.entry("Heat Warning", "#ff2000"),
            Map.entry("Red Flag Warning", "#ff00c8ff"),
            Map.entry("Extreme Wind Warning", "#d400ffff"));

    /**
     * Utility class; do not instantiate.
     */
    private AlertColors() {
    }

    public static String colorFor(String event) {
        String e = event == null ? "" : event;
        String exact = BY_EVENT.get(e);
        if (exact != null)
            return exact;
        if (e.contains("Warning"))
            return DEFAULT_WARNING;
        if (e.contains("Watch"))
            return DEFAULT_WATCH;
        return DEFAULT_OTHER;
    }
}
