package space.sparkradar.spc;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import space.sparkradar.geo.GeoPoint;
import space.sparkradar.support.Fixtures;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RiskResolverTest {
    private static final GeoPoint AUSTIN = GeoPoint.ofLatLon(30.27, -97.74);
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 1);

    @Test
    void highestRankContainingPolygonWins() {
        JsonNode day1 = Fixtures.json("spc_day1.json");
        List<RiskRecord> risks = RiskResolver.resolve(List.of(day1), AUSTIN, TODAY);

        assertEquals(1, risks.size());
        RiskRecord r = risks.get(0);
        assertEquals("2024-05-01", r.date());
        assertEquals("SLGT", r.level());
        assertEquals("Slight Risk", r.description());
        assertEquals("#FFE066", r.color());
        assertEquals("#DDAA00", r.altcolor());
        assertEquals(2, r.severity());
    }

    @Test
    void pointOutsideEveryPolygonGetsNone() {
        JsonNode day1 = Fixtures.json("spc_day1.json");
        RiskRecord r = RiskResolver.resolve(List.of(day1), GeoPoint.ofLatLon(47.6, -122.3), TODAY).get(0);

        assertEquals(RiskLevel.NONE.name(), r.level());
        assertEquals("No thunderstorms forecast for this location.", r.description());
        assertNull(r.color());
        assertEquals(0, r.severity());
    }

    @Test
    void oneRecordPerDayDatedFromToday() {
        JsonNode day1 = Fixtures.json("spc_day1.json");
        List<RiskRecord> risks = RiskResolver.resolve(Arrays.asList(day1, null, day1), AUSTIN, TODAY);

        assertEquals(3, risks.size());
        assertEquals("2024-05-02", risks.get(1).date());
        assertEquals("NONE", risks.get(1).level());
        assertEquals("2024-05-03", risks.get(2).date());
        assertEquals("SLGT", risks.get(2).level());
    }

    @Test
    void noOutlooksMeansNoRecords() {
        assertTrue(RiskResolver.resolve(List.of(), AUSTIN, TODAY).isEmpty());
        assertTrue(RiskResolver.resolve(null, AUSTIN, TODAY).isEmpty());
    }

    @Test
    void labelSeverityOrdering() {
        assertEquals(5, RiskLevel.severityOf("HIGH"));
        assertEquals(3, RiskLevel.severityOf("ENH"));
        assertEquals(0, RiskLevel.severityOf("TSTM"));
        assertEquals(0, RiskLevel.severityOf(null));
    }
}
