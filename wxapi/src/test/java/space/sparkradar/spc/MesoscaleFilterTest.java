package space.sparkradar.spc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import space.sparkradar.geo.GeoPoint;
import space.sparkradar.support.Fixtures;
import space.sparkradar.support.RecordingDiagnostics;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MesoscaleFilterTest {
    private static final GeoPoint AUSTIN = GeoPoint.ofLatLon(30.27, -97.74);
    private static final Instant ISSUED = Instant.parse("2024-05-01T18:00:00Z");

    @Test
    void keepsActiveDiscussionsCoveringPoint() {
        RecordingDiagnostics diag = new RecordingDiagnostics();
        List<MesoscaleDiscussion> mds = MesoscaleFilter.filter(Fixtures.json("mcd.json"), AUSTIN,
                Instant.parse("2024-05-01T19:00:00Z"), diag);

        assertEquals(List.of(45, 46), mds.stream().map(MesoscaleDiscussion::number).collect(Collectors.toList()));
        MesoscaleDiscussion md45 = mds.get(0);
        assertEquals("2024-05-01T18:00:00.000Z", md45.issued());
        assertEquals("2024-05-01T23:45:00.000Z", md45.expires());
        assertEquals("https://www.spc.noaa.gov/products/md/md0045.html", md45.url());
        assertEquals("MD 0045 Active Till 2345 UTC", md45.title());
        assertEquals("Polygon", md45.geometry().path("type").asText());

        // "Till 25": expiry unknown, still shown
        assertNull(mds.get(1).expires());
        assertTrue(diag.failedSections.isEmpty());
    }

    @Test
    void onlyUnknownExpirySurvivesPastMidnight() {
        List<MesoscaleDiscussion> mds = MesoscaleFilter.filter(Fixtures.json("mcd.json"), AUSTIN,
                Instant.parse("2024-05-02T00:00:00Z"), new RecordingDiagnostics());
        assertEquals(1, mds.size());
        assertEquals(46, mds.get(0).number());
    }

    @Test
    void expiryBoundaryIsInclusive() {
        List<Integer> atExpiry = numbers(MesoscaleFilter.filter(Fixtures.json("mcd.json"), AUSTIN,
                Instant.parse("2024-05-01T23:45:00Z"), new RecordingDiagnostics()));
        List<Integer> justAfter = numbers(MesoscaleFilter.filter(Fixtures.json("mcd.json"), AUSTIN,
                Instant.parse("2024-05-01T23:45:00.001Z"), new RecordingDiagnostics()));

        assertEquals(List.of(45, 46), atExpiry);
        assertEquals(List.of(46), justAfter);
    }

    @Test
    void midnightRolloverExpiresNextDay() {
        ObjectNode feed = (ObjectNode) Fixtures.json("mcd.json");
        ObjectNode props = (ObjectNode) feed.path("features").get(0).path("properties");
        props.put("folderpath", "MD 0045 Active Till 2400 UTC");

        assertEquals(List.of(45, 46), numbers(MesoscaleFilter.filter(feed, AUSTIN,
                Instant.parse("2024-05-02T00:00:00Z"), new RecordingDiagnostics())));
        assertEquals(List.of(46), numbers(MesoscaleFilter.filter(feed, AUSTIN,
                Instant.parse("2024-05-02T00:01:00Z"), new RecordingDiagnostics())));
    }

    @Test
    void outputGeometryIsDetachedFromFeed() {
        JsonNode feed = Fixtures.json("mcd.json");
        JsonNode input = feed.path("features").get(0).path("geometry");

        List<MesoscaleDiscussion> mds = MesoscaleFilter.filter(feed, AUSTIN,
                Instant.parse("2024-05-01T19:00:00Z"), new RecordingDiagnostics());
        ((ObjectNode) mds.get(0).geometry()).put("type", "Point");

        assertNotSame(input, mds.get(0).geometry());
        assertEquals("Polygon", input.path("type").asText());
    }

    @Test
    void expiryParsing() {
        assertEquals(Instant.parse("2024-05-01T23:45:00Z"), MesoscaleFilter.expiry("MD 1 Till 2345 UTC", ISSUED));
        assertEquals(Instant.parse("2024-05-01T00:15:00Z"), MesoscaleFilter.expiry("Active Till 0015", ISSUED));
        assertEquals(Instant.parse("2024-05-02T00:00:00Z"), MesoscaleFilter.expiry("MD 0050 Active Till 2400 UTC", ISSUED));
        assertEquals(Instant.parse("2024-05-02T02:39:00Z"), MesoscaleFilter.expiry("Active Till 2599 UTC", ISSUED));
        assertEquals(Instant.parse("2024-05-02T01:00:00Z"), MesoscaleFilter.expiry("Active Till 2460 UTC", ISSUED));
        assertNull(MesoscaleFilter.expiry("Active Till 23:45 UTC", ISSUED));
        assertNull(MesoscaleFilter.expiry("Active Till 12 UTC", ISSUED));
        assertNull(MesoscaleFilter.expiry("MD 0045", ISSUED));
        assertNull(MesoscaleFilter.expiry("MD 0045 Active Till 2345 UTC", null));
    }

    @Test
    void issueTimeAndNumberParsing() {
        var f = new ObjectMapper().getNodeFactory();
        assertEquals(ISSUED, MesoscaleFilter.issuedAt(f.numberNode(1714586400000L)));
        assertEquals(ISSUED, MesoscaleFilter.issuedAt(f.textNode("1714586400000")));
        assertEquals(ISSUED, MesoscaleFilter.issuedAt(f.textNode("2024-05-01T13:00:00-05:00")));
        assertNull(MesoscaleFilter.issuedAt(f.textNode("yesterday")));
        assertNull(MesoscaleFilter.issuedAt(null));

        assertEquals(45, MesoscaleFilter.number("MD 0045"));
        assertNull(MesoscaleFilter.number("MD 0000"));
        assertNull(MesoscaleFilter.number("none"));
    }

    private static List<Integer> numbers(List<MesoscaleDiscussion> mds) {
        return mds.stream().map(MesoscaleDiscussion::number).collect(Collectors.toList());
    }

    @Test
    void missingFeedIsEmpty() {
        assertTrue(MesoscaleFilter.filter(null, AUSTIN, ISSUED, new RecordingDiagnostics()).isEmpty());
    }
}
