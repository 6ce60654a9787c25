package space.sparkradar.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.sparkradar.metrics.UpstreamMetrics;

/**
 * Upstream health over the last hour.
 */
final class ApiRoutesMetrics {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesMetrics() {
    }

    /**
     * Registers metric endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        UpstreamMetrics metrics = api.metrics();

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", UpstreamMetrics.WINDOW_MINUTES);
            ArrayNode services = out.putArray("services");

            for (var e : metrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("service", e.getKey());
                row.put("calls_last_hour", snap.calls());
                row.put("failures_last_hour", snap.failures());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
                services.add(row);
            }

            api.respond(ctx, out);
        });
    }
}
