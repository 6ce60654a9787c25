package space.sparkradar.spc;

import com.fasterxml.jackson.databind.JsonNode;

import space.sparkradar.geo.GeoJsonGeometry;
import space.sparkradar.geo.GeoPoint;
import space.sparkradar.units.SafeParse;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the highest-ranked SPC categorical outlook polygon containing a point,
 * one record per forecast day.
 *
 * <p>
 * Outlook documents are GeoJSON feature collections whose features carry
 * {@code DN} (numeric rank), {@code LABEL} ("MRGL", "SLGT", ...),
 * {@code LABEL2} (long description), {@code fill} and {@code stroke}.
 * Documents are assumed to be consecutive days starting today, so record
 * {@code i} is dated {@code today + i}. On equal rank the first containing
 * feature wins.
 * </p>
 */
public final class RiskResolver {
    /**
     * Utility class; do not instantiate.
     */
    private RiskResolver() {
    }

    public static List<RiskRecord> resolve(List<JsonNode> outlooks, GeoPoint point, LocalDate today) {
        List<RiskRecord> out = new ArrayList<>();
        if (outlooks == null)
            return out;
        for (int i = 0; i < outlooks.size(); i++) {
            out.add(resolveDay(outlooks.get(i), point, today.plusDays(i).toString()));
        }
        return out;
    }

    static RiskRecord resolveDay(JsonNode outlook, GeoPoint point, String date) {
        JsonNode best = null;
        double bestRank = 0;

        JsonNode features = outlook == null ? null : outlook.path("features");
        if (features != null && features.isArray()) {
            for (JsonNode feature : features) {
                JsonNode geometry = feature.get("geometry");
                JsonNode props = feature.get("properties");
                if (geometry == null || geometry.isNull() || props == null || props.isNull())
                    continue;
                if (!GeoJsonGeometry.contains(geometry, point))
                    continue;

                double rank = rank(props);
                if (best == null || rank > bestRank) {
                    best = props;
                    bestRank = rank;
                }
            }
        }

        if (best == null)
            return RiskRecord.none(date);

        return new RiskRecord(
                date,
                SafeParse.text(best.path("LABEL")),
                SafeParse.text(best.path("LABEL2")),
                SafeParse.text(best.path("fill")),
                SafeParse.text(best.path("stroke")));
    }

    private static double rank(JsonNode props) {
        Double dn = SafeParse.toDouble(props.path("DN"));
        return dn == null ? 0 : dn;
    }
}
