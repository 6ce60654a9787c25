package space.sparkradar.metrics;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks success/failure counts for upstream calls (OWM, NWS, NWS_ALERTS,
 * SPC).
 *
 * <p>
 * Uses a rolling 60-minute window of per-minute buckets to compute a basic
 * health status per upstream.
 * </p>
 */
public final class UpstreamMetrics {
    public static final int WINDOW_MINUTES = 60;

    private final Clock clock;
    private final Map<String, Buckets> upstreams = new ConcurrentHashMap<>();

    public UpstreamMetrics(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records one call outcome for a named upstream.
     */
    public void record(String upstream, boolean success) {
        if (upstream == null || upstream.isBlank())
            return;
        upstreams.computeIfAbsent(upstream, k -> new Buckets()).record(nowMinute(), success);
    }

    /**
     * Snapshot of call counts and failure rates by upstream, sorted by name.
     */
    public Map<String, Snapshot> snapshot() {
        long now = nowMinute();
        Map<String, Snapshot> out = new TreeMap<>();
        for (var e : upstreams.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot(now));
        }
        return out;
    }

    private long nowMinute() {
        return clock.millis() / 60000L;
    }

    /**
     * Summary metrics for a single upstream over the last hour.
     */
    public record Snapshot(long calls, long failures, double failurePct, String status) {
    }

    /**
     * Ring buffer of per-minute counts for one upstream.
     */
    private static final class Buckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(long nowMin, boolean success) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
            }
            total[idx] += 1L;
            if (!success) {
                fail[idx] += 1L;
            }
        }

        private synchronized Snapshot snapshot(long nowMin) {
            long totalSum = 0L;
            long failSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (total[i] == 0L)
                    continue;
                if ((nowMin - minute[i]) >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                failSum += fail[i];
            }
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            String status;
            if (totalSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new Snapshot(totalSum, failSum, failurePct, status);
        }
    }
}
