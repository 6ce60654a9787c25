package space.sparkradar.geo;

import java.util.List;

/**
 * Even-odd ray-casting containment tests over linear rings and polygons with
 * holes.
 *
 * <p>
 * A ring is an ordered list of {@link GeoPoint}s and is treated as closed
 * whether or not the last vertex repeats the first. A polygon is its outer
 * ring followed by zero or more hole rings. Points lying exactly on an edge
 * may land either side.
 * </p>
 */
public final class Geometry {
    /**
     * Utility class; do not instantiate.
     */
    private Geometry() {
    }

    /**
     * Crossing-number test of a point against a single ring.
     */
    public static boolean pointInRing(GeoPoint point, List<GeoPoint> ring) {
        if (point == null || ring == null || ring.isEmpty())
            return false;

        double px = point.lon();
        double py = point.lat();
        boolean inside = false;
        int n = ring.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double xi = ring.get(i).lon();
            double yi = ring.get(i).lat();
            double xj = ring.get(j).lon();
            double yj = ring.get(j).lat();

            boolean straddles = (yi > py) != (yj > py);
            if (straddles && px < (xj - xi) * (py - yi) / (yj - yi) + xi) {
                inside = !inside;
            }
        }
        return inside;
    }

    /**
     * True when the point is inside the outer ring and outside every hole.
     * An empty polygon contains nothing.
     */
    public static boolean pointInPolygon(GeoPoint point, List<List<GeoPoint>> polygon) {
        if (polygon == null || polygon.isEmpty())
            return false;
        if (!pointInRing(point, polygon.get(0)))
            return false;
        for (int i = 1; i < polygon.size(); i++) {
            if (pointInRing(point, polygon.get(i)))
                return false;
        }
        return true;
    }

    /**
     * True when any member polygon contains the point.
     */
    public static boolean pointInMultiPolygon(GeoPoint point, List<List<List<GeoPoint>>> polygons) {
        if (polygons == null)
            return false;
        for (List<List<GeoPoint>> polygon : polygons) {
            if (pointInPolygon(point, polygon))
                return true;
        }
        return false;
    }
}
