package space.sparkradar.upstream;

import com.fasterxml.jackson.databind.JsonNode;

import space.sparkradar.geo.GeoPoint;

import java.net.URI;

/**
 * OpenWeatherMap One Call 3.0 (current, minutely, hourly, daily).
 */
public final class OwmClient {
    public static final String UPSTREAM = "OWM";
    private static final String BASE = "https://api.openweathermap.org/data/3.0/onecall";

    private final UpstreamFetcher fetcher;
    private final String apiKey;

    public OwmClient(UpstreamFetcher fetcher, String apiKey) {
        this.fetcher = fetcher;
        this.apiKey = apiKey;
    }

    public JsonNode oneCall(GeoPoint point) {
        return fetcher.fetch(UPSTREAM, oneCallUri(point, apiKey));
    }

    static URI oneCallUri(GeoPoint point, String apiKey) {
        return URI.create(BASE + "?lat=" + point.lat() + "&lon=" + point.lon() + "&appid=" + apiKey);
    }
}
