package space.sparkradar.spc;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Categorical severe-weather risk at the query point for one forecast day.
 */
public record RiskRecord(
        @JsonProperty("date") String date,
        @JsonProperty("level") String level,
        @JsonProperty("description") String description,
        @JsonProperty("color") String color,
        @JsonProperty("altcolor") String altcolor) {

    static final String NO_RISK_DESCRIPTION = "No thunderstorms forecast for this location.";

    /**
     * The record emitted when no outlook polygon contains the point.
     */
    public static RiskRecord none(String date) {
        return new RiskRecord(date, RiskLevel.NONE.name(), NO_RISK_DESCRIPTION, null, null);
    }

    /**
     * Sortable 0-5 severity of {@link #level()}.
     */
    public int severity() {
        return RiskLevel.severityOf(level);
    }
}
