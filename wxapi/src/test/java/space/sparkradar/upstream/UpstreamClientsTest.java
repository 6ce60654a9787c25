package space.sparkradar.upstream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import space.sparkradar.geo.GeoPoint;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UpstreamClientsTest {
    private final List<String> calls = new ArrayList<>();
    private final UpstreamFetcher recorder = (upstream, uri) -> {
        calls.add(upstream + " " + uri);
        return new ObjectMapper().createObjectNode();
    };

    @Test
    void owmOneCallUrl() {
        new OwmClient(recorder, "k123").oneCall(GeoPoint.ofLatLon(30.5, -97.25));
        assertEquals(List.of("OWM https://api.openweathermap.org/data/3.0/onecall?lat=30.5&lon=-97.25&appid=k123"),
                calls);
    }

    @Test
    void nwsUrls() {
        NwsClient nws = new NwsClient(recorder);
        nws.pointForecast(GeoPoint.ofLatLon(30.5, -97.25));
        nws.activeAlertsForZone("TXZ192");
        nws.activeAlertsForZone(null);
        assertEquals(List.of(
                "NWS https://forecast.weather.gov/MapClick.php?lat=30.5&lon=-97.25&FcstType=json",
                "NWS_ALERTS https://api.weather.gov/alerts/active/zone/TXZ192",
                "NWS_ALERTS https://api.weather.gov/alerts/active/zone/"), calls);
    }

    @Test
    void uriIsPassedThrough() {
        URI[] seen = new URI[1];
        UpstreamFetcher f = (upstream, uri) -> {
            seen[0] = uri;
            return null;
        };
        new NwsClient(f).activeAlertsForZone("TX Z/1");
        assertEquals("/alerts/active/zone/TX+Z%2F1", seen[0].getRawPath());
    }
}
