package space.sparkradar.condition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Standardized weather state.
 *
 * <p>
 * {@code code} is three digits: sky state (1 clear .. 5 cloudy, 6
 * precipitation, 7 haze, 8 fog), intensity (0 n/a, 1 light, 2 moderate, 3
 * heavy) and precipitation subtype (0 n/a, 1 snow, 2 rain, 3 storm). Code 0 is
 * reserved for {@link #unknown(String)}, which is the only variant that carries
 * the source text in {@code raw}.
 * </p>
 */
public record Condition(
        @JsonProperty("condition") String name,
        @JsonProperty("code") int code,
        @JsonProperty("raw") @JsonInclude(JsonInclude.Include.NON_NULL) String raw) {

    public static final String UNKNOWN = "Unknown";

    public static Condition of(String name, int code) {
        return new Condition(name, code, null);
    }

    /**
     * The fallback for text that could not be classified. {@code raw} may be
     * null when there was no text at all.
     */
    public static Condition unknown(String raw) {
        return new Condition(UNKNOWN, 0, raw);
    }

    public boolean isUnknown() {
        return code == 0;
    }
}
