package space.sparkradar.spc;

import com.fasterxml.jackson.databind.JsonNode;

import space.sparkradar.upstream.UpstreamFetcher;

import java.net.URI;

/**
 * Storm Prediction Center feeds: categorical convective outlooks (days 1-3)
 * and active mesoscale discussions.
 */
public final class SpcClient {
    public static final String UPSTREAM = "SPC";
    public static final int OUTLOOK_DAYS = 3;

    private static final String MESOSCALE_URL = "https://mapservices.weather.noaa.gov/vector/rest/services/"
            + "outlooks/spc_mesoscale_discussion/MapServer/0/query?where=1%3D1&outFields=*&f=geojson";

    private final UpstreamFetcher fetcher;

    public SpcClient(UpstreamFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * Categorical outlook for day 1..3 as a GeoJSON feature collection.
     */
    public JsonNode categoricalOutlook(int day) {
        if (day < 1 || day > OUTLOOK_DAYS)
            throw new IllegalArgumentException("outlook day must be 1.." + OUTLOOK_DAYS + ": " + day);
        return fetcher.fetch(UPSTREAM, URI.create(
                "https://www.spc.noaa.gov/products/outlook/day" + day + "otlk_cat.nolyr.geojson"));
    }

    public JsonNode mesoscaleDiscussions() {
        return fetcher.fetch(UPSTREAM, URI.create(MESOSCALE_URL));
    }
}
