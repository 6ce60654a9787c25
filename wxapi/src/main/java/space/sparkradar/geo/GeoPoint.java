package space.sparkradar.geo;

/**
 * A query point in decimal degrees.
 *
 * <p>
 * Component order is (longitude, latitude) to match GeoJSON coordinate order,
 * so a point can be compared directly against upstream polygon rings.
 * </p>
 */
public record GeoPoint(double lon, double lat) {

    /**
     * Builds a point from the usual "lat, lon" argument order used by query
     * strings.
     */
    public static GeoPoint ofLatLon(double lat, double lon) {
        return new GeoPoint(lon, lat);
    }
}
