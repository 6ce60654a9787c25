package space.sparkradar.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import space.sparkradar.units.SafeParse;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Typed read-only view over an OpenWeatherMap One Call 3.0 response.
 *
 * <p>
 * Every getter tolerates a missing or mistyped field and returns null. Units
 * are the provider's defaults: Kelvin, m/s, hPa, metres, epoch seconds.
 * </p>
 */
public final class OwmDocument {
    private final JsonNode root;

    private OwmDocument(JsonNode root) {
        this.root = root;
    }

    /**
     * Wraps a parsed document; null becomes an empty document.
     */
    public static OwmDocument of(JsonNode root) {
        return new OwmDocument(root == null ? MissingNode.getInstance() : root);
    }

    public Current current() {
        return new Current(root.path("current"));
    }

    public List<Minute> minutely() {
        return items("minutely", Minute::new);
    }

    public List<Hour> hourly() {
        return items("hourly", Hour::new);
    }

    public List<Day> daily() {
        return items("daily", Day::new);
    }

    private <T> List<T> items(String field, Function<JsonNode, T> wrap) {
        JsonNode arr = root.path(field);
        List<T> out = new ArrayList<>();
        if (!arr.isArray())
            return out;
        for (JsonNode item : arr) {
            out.add(wrap.apply(item));
        }
        return out;
    }

    /**
     * {@code weather[0].description} of an item, or null.
     */
    static String firstDescription(JsonNode item) {
        JsonNode weather = item.path("weather");
        if (!weather.isArray() || weather.isEmpty())
            return null;
        return SafeParse.text(weather.get(0).path("description"));
    }

    /**
     * Current conditions block.
     */
    public static final class Current {
        private final JsonNode n;

        Current(JsonNode n) {
            this.n = n;
        }

        public Long sunrise() {
            return SafeParse.toLong(n.path("sunrise"));
        }

        public Long sunset() {
            return SafeParse.toLong(n.path("sunset"));
        }

        public Double temp() {
            return SafeParse.toDouble(n.path("temp"));
        }

        public Double dewPoint() {
            return SafeParse.toDouble(n.path("dew_point"));
        }

        public Integer humidity() {
            return SafeParse.toInt(n.path("humidity"));
        }

        public Integer clouds() {
            return SafeParse.toInt(n.path("clouds"));
        }

        public Double visibilityMeters() {
            return SafeParse.toDouble(n.path("visibility"));
        }

        public Double pressureHpa() {
            return SafeParse.toDouble(n.path("pressure"));
        }

        public Double windSpeed() {
            return SafeParse.toDouble(n.path("wind_speed"));
        }

        public Double windGust() {
            return SafeParse.toDouble(n.path("wind_gust"));
        }

        public Integer windDeg() {
            return SafeParse.toInt(n.path("wind_deg"));
        }

        public String description() {
            return firstDescription(n);
        }
    }

    /**
     * One minutely precipitation entry.
     */
    public static final class Minute {
        private final JsonNode n;

        Minute(JsonNode n) {
            this.n = n;
        }

        public Long dt() {
            return SafeParse.toLong(n.path("dt"));
        }

        public Double precipitation() {
            return SafeParse.toDouble(n.path("precipitation"));
        }
    }

    /**
     * One hourly forecast entry.
     */
    public static final class Hour {
        private final JsonNode n;

        Hour(JsonNode n) {
            this.n = n;
        }

        public Long dt() {
            return SafeParse.toLong(n.path("dt"));
        }

        public Double temp() {
            return SafeParse.toDouble(n.path("temp"));
        }

        public Double feelsLike() {
            return SafeParse.toDouble(n.path("feels_like"));
        }

        public Integer humidity() {
            return SafeParse.toInt(n.path("humidity"));
        }

        public Double windSpeed() {
            return SafeParse.toDouble(n.path("wind_speed"));
        }

        public Integer windDeg() {
            return SafeParse.toInt(n.path("wind_deg"));
        }

        public Integer clouds() {
            return SafeParse.toInt(n.path("clouds"));
        }

        /** Probability of precipitation, 0..1. */
        public Double pop() {
            return SafeParse.toDouble(n.path("pop"));
        }

        public String description() {
            return firstDescription(n);
        }
    }

    /**
     * One daily forecast entry; the spine of the merged daily forecast.
     */
    public static final class Day {
        private final JsonNode n;

        Day(JsonNode n) {
            this.n = n;
        }

        public Long dt() {
            return SafeParse.toLong(n.path("dt"));
        }

        public Long sunrise() {
            return SafeParse.toLong(n.path("sunrise"));
        }

        public Long sunset() {
            return SafeParse.toLong(n.path("sunset"));
        }

        public Double tempMax() {
            return SafeParse.toDouble(n.path("temp").path("max"));
        }

        public Double tempMin() {
            return SafeParse.toDouble(n.path("temp").path("min"));
        }

        public Double windSpeed() {
            return SafeParse.toDouble(n.path("wind_speed"));
        }

        public Integer windDeg() {
            return SafeParse.toInt(n.path("wind_deg"));
        }

        public String description() {
            return firstDescription(n);
        }
    }
}
