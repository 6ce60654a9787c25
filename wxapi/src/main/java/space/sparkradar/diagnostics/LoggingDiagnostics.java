package space.sparkradar.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Diagnostics} that writes WARN lines through SLF4J. Stack traces go to
 * DEBUG so a noisy upstream does not flood the log.
 */
public final class LoggingDiagnostics implements Diagnostics {
    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnostics.class);

    @Override
    public void sectionFailed(String section, Exception error) {
        log.warn("Unable to parse {}: {}", section, error.getMessage());
        log.debug("Section {} failed", section, error);
    }

    @Override
    public void itemSkipped(String section, String item, Exception error) {
        log.warn("Skipped {} item {}: {}", section, item, error.getMessage());
        log.debug("Item {} in {} failed", item, section, error);
    }
}
