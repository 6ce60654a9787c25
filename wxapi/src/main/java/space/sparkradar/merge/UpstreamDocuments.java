package space.sparkradar.merge;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The already-fetched inputs of one merge. Any member may be null.
 *
 * @param owm        OpenWeatherMap One Call document
 * @param nws        forecast.weather.gov MapClick JSON document
 * @param alerts     api.weather.gov active-alerts feature collection
 * @param outlooks   SPC categorical outlooks, day 1 first
 * @param mesoscale  SPC mesoscale discussion feature collection
 */
public record UpstreamDocuments(
        JsonNode owm,
        JsonNode nws,
        JsonNode alerts,
        List<JsonNode> outlooks,
        JsonNode mesoscale) {

    public UpstreamDocuments {
        outlooks = outlooks == null ? List.of() : outlooks;
    }
}
