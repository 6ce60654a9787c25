package space.sparkradar.geo;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads GeoJSON {@code Polygon} and {@code MultiPolygon} geometry nodes into
 * ring lists for {@link Geometry}.
 *
 * <p>
 * Anything malformed (wrong node type, short coordinate pairs, non-numeric
 * values) reads as "no polygon" so containment quietly answers false.
 * </p>
 */
public final class GeoJsonGeometry {
    public static final String POLYGON = "Polygon";
    public static final String MULTI_POLYGON = "MultiPolygon";

    /**
     * Utility class; do not instantiate.
     */
    private GeoJsonGeometry() {
    }

    /**
     * Returns every polygon of a Polygon/MultiPolygon geometry. Other geometry
     * types yield an empty list.
     */
    public static List<List<List<GeoPoint>>> polygons(JsonNode geometry) {
        List<List<List<GeoPoint>>> out = new ArrayList<>();
        if (geometry == null || !geometry.isObject())
            return out;

        String type = geometry.path("type").asText("");
        JsonNode coords = geometry.path("coordinates");
        if (POLYGON.equals(type)) {
            List<List<GeoPoint>> poly = readPolygon(coords);
            if (!poly.isEmpty())
                out.add(poly);
        } else if (MULTI_POLYGON.equals(type) && coords.isArray()) {
            for (JsonNode polyNode : coords) {
                List<List<GeoPoint>> poly = readPolygon(polyNode);
                if (!poly.isEmpty())
                    out.add(poly);
            }
        }
        return out;
    }

    /**
     * Containment test straight from a GeoJSON geometry node.
     */
    public static boolean contains(JsonNode geometry, GeoPoint point) {
        return Geometry.pointInMultiPolygon(point, polygons(geometry));
    }

    private static List<List<GeoPoint>> readPolygon(JsonNode polyNode) {
        List<List<GeoPoint>> rings = new ArrayList<>();
        if (polyNode == null || !polyNode.isArray())
            return rings;
        for (JsonNode ringNode : polyNode) {
            List<GeoPoint> ring = readRing(ringNode);
            if (ring == null)
                return new ArrayList<>();
            rings.add(ring);
        }
        return rings;
    }

    private static List<GeoPoint> readRing(JsonNode ringNode) {
        if (ringNode == null || !ringNode.isArray())
            return null;
        List<GeoPoint> ring = new ArrayList<>(ringNode.size());
        for (JsonNode pos : ringNode) {
            if (!pos.isArray() || pos.size() < 2 || !pos.get(0).isNumber() || !pos.get(1).isNumber())
                return null;
            ring.add(new GeoPoint(pos.get(0).asDouble(), pos.get(1).asDouble()));
        }
        return ring;
    }
}
