package space.sparkradar.spc;

/**
 * SPC categorical outlook labels in increasing order of severity.
 */
public enum RiskLevel {
    NONE,
    MRGL,
    SLGT,
    ENH,
    MDT,
    HIGH;

    /**
     * 0 for NONE through 5 for HIGH.
     */
    public int severity() {
        return ordinal();
    }

    /**
     * Severity of a raw label; null and unrecognized labels (e.g. "TSTM")
     * map to 0.
     */
    public static int severityOf(String label) {
        if (label == null)
            return 0;
        for (RiskLevel level : values()) {
            if (level.name().equals(label))
                return level.severity();
        }
        return 0;
    }
}
