package space.sparkradar.merge;

import com.fasterxml.jackson.annotation.JsonProperty;

import space.sparkradar.alerts.Alert;
import space.sparkradar.condition.Condition;
import space.sparkradar.spc.MesoscaleDiscussion;
import space.sparkradar.spc.RiskRecord;

import java.util.List;

/**
 * The merged, unit-normalized response for one point.
 *
 * <p>
 * Units: temperatures in Kelvin, speeds in m/s, visibility in km, pressure in
 * hPa, probabilities and cover in percent, directions in degrees. Times are
 * ISO-8601 UTC strings. Absent values are null.
 * </p>
 */
public record NormalizedForecast(
        @JsonProperty("location") Location location,
        @JsonProperty("current") Current current,
        @JsonProperty("alerts") List<Alert> alerts,
        @JsonProperty("mesoscale_discussions") List<MesoscaleDiscussion> mesoscaleDiscussions,
        @JsonProperty("forecasts") Forecasts forecasts) {

    public record Location(
            @JsonProperty("wfo") String wfo,
            @JsonProperty("nearest_radar") String nearestRadar,
            @JsonProperty("sunrise") String sunrise,
            @JsonProperty("sunset") String sunset) {
    }

    public record Current(
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("dew_point") Double dewPoint,
            @JsonProperty("humidity") Integer humidity,
            @JsonProperty("wind_speed") Double windSpeed,
            @JsonProperty("wind_gust") Double windGust,
            @JsonProperty("wind_direction") Integer windDirection,
            @JsonProperty("condition") Condition condition,
            @JsonProperty("cloud_cover") Integer cloudCover,
            @JsonProperty("visibility") Double visibility,
            @JsonProperty("pressure") Double pressure) {
    }

    public record Forecasts(
            @JsonProperty("spc") List<RiskRecord> spc,
            @JsonProperty("minutely") List<Minutely> minutely,
            @JsonProperty("hourly") List<Hourly> hourly,
            @JsonProperty("daily") List<Daily> daily) {
    }

    public record Minutely(
            @JsonProperty("time") String time,
            @JsonProperty("precipitation") double precipitation) {
    }

    public record Hourly(
            @JsonProperty("time") String time,
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("feels_like") Double feelsLike,
            @JsonProperty("humidity") Integer humidity,
            @JsonProperty("wind_speed") Double windSpeed,
            @JsonProperty("wind_direction") Integer windDirection,
            @JsonProperty("condition") Condition condition,
            @JsonProperty("cloud_cover") Integer cloudCover,
            @JsonProperty("precipitation_probability") int precipitationProbability) {
    }

    public record Daily(
            @JsonProperty("date") String date,
            @JsonProperty("condition") Condition condition,
            @JsonProperty("sunrise") String sunrise,
            @JsonProperty("sunset") String sunset,
            @JsonProperty("high") Double high,
            @JsonProperty("low") Double low,
            @JsonProperty("precipitation_probability") Integer precipitationProbability,
            @JsonProperty("wind_speed") Double windSpeed,
            @JsonProperty("wind_direction") Integer windDirection,
            @JsonProperty("description") String description,
            @JsonProperty("night") Night night) {
    }

    public record Night(
            @JsonProperty("condition") Condition condition,
            @JsonProperty("precipitation_probability") Integer precipitationProbability) {
    }
}
