package space.sparkradar.alerts;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A hazard alert reshaped for display: identity and timing in
 * {@code properties}, display text in {@code product}.
 */
public record Alert(
        @JsonProperty("properties") Timing properties,
        @JsonProperty("product") Product product) {

    /**
     * Identity and validity window, times as issued by NWS.
     */
    public record Timing(
            @JsonProperty("id") String id,
            @JsonProperty("issued") String issued,
            @JsonProperty("start") String start,
            @JsonProperty("end") String end,
            @JsonProperty("severity") String severity) {
    }

    /**
     * Display content; description and instructions are single-line.
     */
    public record Product(
            @JsonProperty("areas") String areas,
            @JsonProperty("event") String event,
            @JsonProperty("color") String color,
            @JsonProperty("headline") String headline,
            @JsonProperty("description") String description,
            @JsonProperty("instructions") String instructions) {
    }
}
