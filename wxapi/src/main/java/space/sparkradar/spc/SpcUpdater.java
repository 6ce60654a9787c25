package space.sparkradar.spc;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically refreshes the SPC outlooks and mesoscale discussions into
 * {@link SpcOutlookCache}.
 *
 * <p>
 * A document that fails to download keeps its previous copy; the snapshot is
 * only swapped after the whole pass so readers never see half a refresh.
 * </p>
 */
public final class SpcUpdater {
    private static final Logger log = LoggerFactory.getLogger(SpcUpdater.class);

    private final ScheduledExecutorService exec = Executors
            .newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "spc-updater");
                t.setDaemon(true);
                return t;
            });

    private final SpcClient client;
    private final SpcOutlookCache cache;
    private final Clock clock;
    private final Duration period;
    private ScheduledFuture<?> task;

    public SpcUpdater(SpcClient client, SpcOutlookCache cache, Clock clock, Duration period) {
        this.client = client;
        this.cache = cache;
        this.clock = clock;
        this.period = period;
    }

    public void start() {
        task = exec.scheduleWithFixedDelay(this::runSafely, 0, period.toSeconds(), TimeUnit.SECONDS);
        log.info("SPC updater started (every {})", period);
    }

    public void stop() {
        if (task != null)
            task.cancel(true);
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("spc-updater did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runSafely() {
        MDC.put("job", "spc-refresh");
        try {
            refresh();
        } catch (Exception e) {
            log.error("Scheduled job failed: spc-refresh", e);
        } finally {
            MDC.remove("job");
        }
    }

    /**
     * One refresh pass. Returns the number of documents updated.
     */
    public int refresh() {
        Instant now = clock.instant();
        SpcSnapshot next = cache.snapshot();
        int ok = 0;
        int fail = 0;

        for (int i = 0; i < SpcClient.OUTLOOK_DAYS; i++) {
            final int dayIndex = i;
            try {
                JsonNode doc = client.categoricalOutlook(dayIndex + 1);
                next = next.withOutlook(dayIndex, doc);
                ok++;
                persist(() -> cache.persistOutlook(dayIndex, doc, now), SpcOutlookCache.outlookFile(dayIndex));
            } catch (RuntimeException e) {
                fail++;
                log.warn("SPC day {} outlook refresh failed: {}", dayIndex + 1, e.getMessage());
            }
        }

        try {
            JsonNode doc = client.mesoscaleDiscussions();
            next = next.withMesoscale(doc);
            ok++;
            persist(() -> cache.persistMesoscale(doc, now), SpcOutlookCache.MESOSCALE_FILE);
        } catch (RuntimeException e) {
            fail++;
            log.warn("SPC mesoscale refresh failed: {}", e.getMessage());
        }

        if (ok > 0)
            cache.replace(next.withUpdatedAt(now));
        log.info("Finished SPC refresh: ok={} fail={}", ok, fail);
        return ok;
    }

    private void persist(IoAction action, String file) {
        try {
            action.run();
        } catch (IOException e) {
            log.warn("Unable to write SPC cache file {}: {}", file, e.getMessage());
        }
    }

    @FunctionalInterface
    interface IoAction {
        void run() throws IOException;
    }
}
