package space.sparkradar.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.sparkradar.spc.SpcOutlookCache;
import space.sparkradar.spc.SpcSnapshot;

import java.time.Duration;
import java.time.Instant;

/**
 * Root and health endpoints for the API. Health reports the SPC cache age and
 * the last-hour status of each upstream.
 */
final class ApiRoutesRoot {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesRoot() {
    }

    /**
     * Registers root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        SpcOutlookCache spcCache = api.spcCache();

        app.get("/", ctx -> api.respond(ctx, om.createObjectNode().put("status", "OK")));

        app.get("/health", ctx -> {
            Instant now = api.clock().instant();
            ObjectNode out = om.createObjectNode();
            out.put("status", "ok");
            out.put("time", now.toString());

            SpcSnapshot snap = spcCache.snapshot();
            ObjectNode spc = out.putObject("spc");
            spc.put("outlook_days", snap.availableOutlooks().size());
            spc.put("mesoscale", snap.mesoscale() != null);
            if (snap.updatedAt() == null) {
                spc.putNull("updated");
                spc.putNull("age_seconds");
            } else {
                spc.put("updated", snap.updatedAt().toString());
                spc.put("age_seconds", Duration.between(snap.updatedAt(), now).toSeconds());
            }

            ObjectNode upstreams = out.putObject("upstreams");
            api.metrics().snapshot().forEach((name, snapshot) -> upstreams.put(name, snapshot.status()));

            api.respond(ctx, out);
        });
    }
}
