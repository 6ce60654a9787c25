package space.sparkradar.upstream;

import com.fasterxml.jackson.databind.JsonNode;

import space.sparkradar.geo.GeoPoint;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * National Weather Service endpoints: the forecast.weather.gov point forecast
 * (MapClick JSON) and api.weather.gov active alerts by zone.
 */
public final class NwsClient {
    public static final String UPSTREAM = "NWS";
    public static final String UPSTREAM_ALERTS = "NWS_ALERTS";

    private final UpstreamFetcher fetcher;

    public NwsClient(UpstreamFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * Point forecast plus latest observation. Outside NWS coverage the page is
     * HTML, which surfaces as {@link UpstreamException#isNotJson()}.
     */
    public JsonNode pointForecast(GeoPoint point) {
        return fetcher.fetch(UPSTREAM, URI.create("https://forecast.weather.gov/MapClick.php?lat="
                + point.lat() + "&lon=" + point.lon() + "&FcstType=json"));
    }

    /**
     * Active alerts for a public forecast zone (e.g. "TXZ192").
     */
    public JsonNode activeAlertsForZone(String zone) {
        String z = zone == null ? "" : URLEncoder.encode(zone, StandardCharsets.UTF_8);
        return fetcher.fetch(UPSTREAM_ALERTS, URI.create("https://api.weather.gov/alerts/active/zone/" + z));
    }
}
