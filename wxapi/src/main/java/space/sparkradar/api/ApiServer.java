/*
* SparkRadar WX API server.
* Utilizes Javalin for the HTTP server and Jackson for JSON processing.
* Routes live in the ApiRoutes* classes; this class owns the Javalin instance,
* request logging, error handling and the shared collaborators the routes use.
*/

package space.sparkradar.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.sparkradar.config.AppConfig;
import space.sparkradar.merge.ForecastMerger;
import space.sparkradar.metrics.UpstreamMetrics;
import space.sparkradar.spc.SpcOutlookCache;
import space.sparkradar.upstream.NwsClient;
import space.sparkradar.upstream.OwmClient;

import java.time.Clock;
import java.util.UUID;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final OwmClient owm;
    private final NwsClient nws;
    private final SpcOutlookCache spcCache;
    private final ForecastMerger merger;
    private final UpstreamMetrics metrics;
    private final Clock clock;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, OwmClient owm, NwsClient nws, SpcOutlookCache spcCache,
            ForecastMerger merger, UpstreamMetrics metrics, Clock clock) {
        this.cfg = cfg;
        this.om = om;
        this.owm = owm;
        this.nws = nws;
        this.spcCache = spcCache;
        this.merger = merger;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Builds the Javalin app with all routes registered, without binding a
     * port.
     */
    public Javalin create() {
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            MDC.put("requestId", UUID.randomUUID().toString().substring(0, 8));
            log.debug("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
            MDC.remove("requestId");
        });

        // JSON error body instead of the default HTML error page
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Uncaught error at {} {}", ctx.method(), ctx.path(), e);
            error(ctx, 500, e.getMessage() == null ? "Unknown error" : e.getMessage());
        });

        ApiRoutesRoot.register(this);
        ApiRoutesMetrics.register(this);
        ApiRoutesOnecall.register(this);
        return app;
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        create().start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    // --------------------------------------------------------------------
    // Accessors for route classes
    // --------------------------------------------------------------------
    Javalin app() {
        return app;
    }

    AppConfig cfg() {
        return cfg;
    }

    ObjectMapper om() {
        return om;
    }

    OwmClient owm() {
        return owm;
    }

    NwsClient nws() {
        return nws;
    }

    SpcOutlookCache spcCache() {
        return spcCache;
    }

    ForecastMerger merger() {
        return merger;
    }

    UpstreamMetrics metrics() {
        return metrics;
    }

    Clock clock() {
        return clock;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------
    /**
     * Writes the standard error body {@code {"status":"ERROR","code":..,"message":..}}.
     */
    void error(Context ctx, int code, String message) {
        ObjectNode body = om.createObjectNode()
                .put("status", "ERROR")
                .put("code", code)
                .put("message", message);
        ctx.status(code);
        respond(ctx, body);
    }

    /**
     * Serializes with the server's mapper so null fields are kept.
     */
    void respond(Context ctx, JsonNode body) {
        try {
            ctx.contentType("application/json");
            ctx.result(om.writeValueAsString(body));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to serialize response", e);
        }
    }

    static boolean isLatLonValid(Double lat, Double lon) {
        if (lat == null || lon == null)
            return false;
        return lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }
}
