package space.sparkradar.alerts;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import space.sparkradar.support.RecordingDiagnostics;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertNormalizerTest {
    private final ObjectMapper om = new ObjectMapper();

    @Test
    void keepsWatchesAndDropsOutlooks() throws Exception {
        JsonNode feed = om.readTree("""
                {"features":[
                  {"properties":{"id":"a1","event":"Severe Thunderstorm Watch","areaDesc":"Travis",
                    "sent":"2024-05-01T18:00:00-05:00","effective":"2024-05-01T18:00:00-05:00",
                    "expires":"2024-05-02T01:00:00-05:00","severity":"Severe","headline":"STW 200",
                    "description":"Line one.\\n\\nLine two.\\nLine three.","instruction":null}},
                  {"properties":{"id":"a2","event":"Excessive Rainfall Outlook"}}
                ]}
                """);
        RecordingDiagnostics diag = new RecordingDiagnostics();
        List<Alert> alerts = AlertNormalizer.normalize(feed, diag);

        assertEquals(1, alerts.size());
        Alert a = alerts.get(0);
        assertEquals("a1", a.properties().id());
        assertEquals("2024-05-01T18:00:00-05:00", a.properties().issued());
        assertEquals("Severe Thunderstorm Watch", a.product().event());
        assertEquals("#db7093", a.product().color());
        assertEquals("Line one. Line two. Line three.", a.product().description());
        assertEquals(null, a.product().instructions());
        assertTrue(diag.skippedItems.isEmpty());
    }

    @Test
    void badFeatureIsSkippedAlone() throws Exception {
        JsonNode feed = om.readTree("""
                {"features":[ 42, {"properties":{"event":"Tornado Warning"}} ]}
                """);
        RecordingDiagnostics diag = new RecordingDiagnostics();
        List<Alert> alerts = AlertNormalizer.normalize(feed, diag);

        assertEquals(1, alerts.size());
        assertEquals("#e90000", alerts.get(0).product().color());
        assertEquals(List.of("alerts:#0"), diag.skippedItems);
    }

    @Test
    void missingFeedIsEmpty() {
        assertTrue(AlertNormalizer.normalize(null, new RecordingDiagnostics()).isEmpty());
        assertTrue(AlertNormalizer.normalize(om.createObjectNode(), new RecordingDiagnostics()).isEmpty());
    }

    @Test
    void colorFallsBackByWording() {
        assertEquals("#FF0000", AlertColors.colorFor("Storm Surge Warning"));
        assertEquals("#FFA500", AlertColors.colorFor("Hurricane Watch"));
        assertEquals("#FFCC00", AlertColors.colorFor("Wind Advisory"));
        assertEquals("#FFCC00", AlertColors.colorFor(null));
        assertEquals("#60fd82", AlertColors.colorFor("Flood Watch"));
    }
}
