package space.sparkradar.diagnostics;

/**
 * Receives the problems the normalization engine recovers from.
 *
 * <p>
 * The engine never throws to its caller: a failed section is reported here and
 * left empty, a failed item is reported here and skipped.
 * </p>
 */
public interface Diagnostics {

    /**
     * A whole section (e.g. {@code "daily"}, {@code "alerts"}) failed and was
     * degraded to an empty value.
     */
    void sectionFailed(String section, Exception error);

    /**
     * One item of a section was dropped; the rest of the section carried on.
     */
    void itemSkipped(String section, String item, Exception error);
}
