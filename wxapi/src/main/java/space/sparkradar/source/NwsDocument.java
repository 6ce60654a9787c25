package space.sparkradar.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import space.sparkradar.units.SafeParse;

/**
 * Typed read-only view over a forecast.weather.gov {@code MapClick.php?FcstType=json}
 * document.
 *
 * <p>
 * Observation values arrive as strings in US units ("72", "29.92", "NA").
 * The forecast is four parallel flat arrays indexed by time segment
 * ({@code time.tempLabel}, {@code data.weather}, {@code data.temperature},
 * {@code data.pop}, {@code data.text}); reads past the end return null.
 * </p>
 */
public final class NwsDocument {
    public static final String LABEL_HIGH = "High";
    public static final String LABEL_LOW = "Low";

    private final JsonNode root;

    private NwsDocument(JsonNode root) {
        this.root = root;
    }

    public static NwsDocument of(JsonNode root) {
        return new NwsDocument(root == null ? MissingNode.getInstance() : root);
    }

    // ----------------------------
    // location
    // ----------------------------
    public String wfo() {
        return SafeParse.text(root.path("location").path("wfo"));
    }

    public String radar() {
        return SafeParse.text(root.path("location").path("radar"));
    }

    /** Public forecast zone, used upstream to fetch alerts. */
    public String zone() {
        return SafeParse.text(root.path("location").path("zone"));
    }

    public Observation observation() {
        return new Observation(root.path("currentobservation"));
    }

    // ----------------------------
    // flat time series
    // ----------------------------
    public String tempLabel(int i) {
        return SafeParse.text(slot(root.path("time").path("tempLabel"), i));
    }

    public String weather(int i) {
        return SafeParse.text(slot(root.path("data").path("weather"), i));
    }

    /** Segment temperature in °F. */
    public Double temperatureF(int i) {
        return SafeParse.toDouble(slot(root.path("data").path("temperature"), i));
    }

    /** Segment probability of precipitation in percent. */
    public Integer pop(int i) {
        return SafeParse.toInt(slot(root.path("data").path("pop"), i));
    }

    public String text(int i) {
        return SafeParse.text(slot(root.path("data").path("text"), i));
    }

    private static JsonNode slot(JsonNode arr, int i) {
        if (!arr.isArray() || i < 0 || i >= arr.size())
            return MissingNode.getInstance();
        return arr.get(i);
    }

    /**
     * Latest station observation ({@code currentobservation}).
     */
    public static final class Observation {
        private final JsonNode n;

        Observation(JsonNode n) {
            this.n = n;
        }

        public Double tempF() {
            return SafeParse.toDouble(n.path("Temp"));
        }

        public Double dewPointF() {
            return SafeParse.toDouble(n.path("Dewp"));
        }

        public Double windMph() {
            return SafeParse.toDouble(n.path("Winds"));
        }

        public Double gustMph() {
            return SafeParse.toDouble(n.path("Gust"));
        }

        public Integer windDeg() {
            return SafeParse.toInt(n.path("Windd"));
        }

        public Double visibilityMi() {
            return SafeParse.toDouble(n.path("Visibility"));
        }

        public Double seaLevelPressureInHg() {
            return SafeParse.toDouble(n.path("SLP"));
        }

        public String weather() {
            return SafeParse.text(n.path("Weather"));
        }
    }
}
