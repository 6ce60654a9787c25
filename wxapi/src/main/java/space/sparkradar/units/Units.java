package space.sparkradar.units;

/**
 * Unit conversions into the response's unit system (Kelvin, m/s, hPa, km) and
 * the validity rules applied to converted readings.
 *
 * <p>
 * The NWS observation feed reports a missing reading as 0 in the source unit,
 * so 0 °F, 0 mph, 0 inHg and 0 mi come back as "absent" rather than as real
 * values. For temperature that is the converted value {@link #ZERO_F_IN_K}.
 * This misreads a genuine 0 °F observation; it is kept for compatibility with
 * existing consumers.
 * </p>
 */
public final class Units {
    private static final double MPH_TO_MS = 0.44704;
    private static final double INHG_TO_HPA = 33.8639;
    private static final double MI_TO_KM = 1.60934;

    /** {@code fToK(0)}, the converted "no reading" temperature (about 255.3722 K). */
    public static final double ZERO_F_IN_K = fToK(0.0);

    private static final double SENTINEL_TOLERANCE = 1e-9;

    /**
     * Utility class; do not instantiate.
     */
    private Units() {
    }

    public static double fToK(double f) {
        return (f - 32.0) * 5.0 / 9.0 + 273.15;
    }

    public static double kToF(double k) {
        return (k - 273.15) * 9.0 / 5.0 + 32.0;
    }

    public static double mphToMs(double mph) {
        return mph * MPH_TO_MS;
    }

    public static double inHgToHpa(double inHg) {
        return inHg * INHG_TO_HPA;
    }

    public static double miToKm(double mi) {
        return mi * MI_TO_KM;
    }

    /**
     * Fahrenheit reading to a valid Kelvin value, or null when absent or
     * sentinel.
     */
    public static Double fahrenheitToKelvin(Double f) {
        return f == null ? null : validKelvin(fToK(f));
    }

    public static Double mphToMetersPerSecond(Double mph) {
        return mph == null ? null : validNonZero(mphToMs(mph));
    }

    public static Double inHgToHectopascal(Double inHg) {
        return inHg == null ? null : validNonZero(inHgToHpa(inHg));
    }

    public static Double milesToKilometers(Double mi) {
        return mi == null ? null : validNonZero(miToKm(mi));
    }

    /**
     * A Kelvin temperature that is finite and not the 0 °F sentinel, else
     * null. Applies to either source.
     */
    public static Double validKelvin(Double k) {
        if (k == null || !Double.isFinite(k) || Math.abs(k - ZERO_F_IN_K) < SENTINEL_TOLERANCE)
            return null;
        return k;
    }

    /**
     * A finite, non-zero value, else null. Used for speed, visibility and
     * pressure where 0 means "not reported".
     */
    public static Double validNonZero(Double v) {
        if (v == null || !Double.isFinite(v) || v == 0.0)
            return null;
        return v;
    }

    /**
     * A finite value, else null.
     */
    public static Double finite(Double v) {
        if (v == null || !Double.isFinite(v))
            return null;
        return v;
    }

    /**
     * Half-up rounding to a number of decimal places; null stays null.
     */
    public static Double round(Double value, int places) {
        if (value == null)
            return null;
        if (places < 0)
            return value;
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
