package space.sparkradar.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.sparkradar.geo.GeoPoint;
import space.sparkradar.merge.NormalizedForecast;
import space.sparkradar.merge.UpstreamDocuments;
import space.sparkradar.source.NwsDocument;
import space.sparkradar.spc.SpcSnapshot;
import space.sparkradar.units.SafeParse;
import space.sparkradar.upstream.UpstreamException;

/**
 * The merged forecast endpoint.
 *
 * <p>
 * Fetches the model and NWS documents for the point, the NWS zone alerts when
 * the point has NWS coverage, and reads the cached SPC documents. The body is
 * {@code {"status":{"owm","nws","alerts"},"data":<forecast>}}.
 * </p>
 */
final class ApiRoutesOnecall {
    private static final Logger log = LoggerFactory.getLogger(ApiRoutesOnecall.class);

    static final String OK = "OK";
    static final String NO_DATA = "NO DATA";
    static final String NOT_FETCHED = "NOT FETCHED";

    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesOnecall() {
    }

    /**
     * Registers the /onecall endpoint.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/onecall", ctx -> {
            String key = ctx.queryParam("key");
            if (key == null || !key.equals(api.cfg().apiKey())) {
                log.warn("Unauthorized access attempt to /onecall from {}", ctx.ip());
                api.error(ctx, 401, "Invalid API key");
                return;
            }

            String latRaw = ctx.queryParam("lat");
            String lonRaw = ctx.queryParam("lon");
            if (latRaw == null || latRaw.isBlank() || lonRaw == null || lonRaw.isBlank()) {
                api.error(ctx, 400, "Missing lat or lon parameter");
                return;
            }

            Double lat = SafeParse.parseDouble(latRaw);
            Double lon = SafeParse.parseDouble(lonRaw);
            if (!ApiServer.isLatLonValid(lat, lon)) {
                api.error(ctx, 400, "Invalid lat or lon parameter");
                return;
            }
            GeoPoint point = GeoPoint.ofLatLon(lat, lon);

            JsonNode owm;
            try {
                owm = api.owm().oneCall(point);
            } catch (UpstreamException e) {
                log.error("Error fetching data from OpenWeatherMap: {}", e.getMessage());
                api.error(ctx, 500, "Failed to fetch data from OpenWeatherMap");
                return;
            }

            JsonNode nws;
            String nwsStatus;
            try {
                nws = api.nws().pointForecast(point);
                nwsStatus = OK;
            } catch (UpstreamException e) {
                if (!e.isNotJson()) {
                    log.error("Error fetching data from NWS: {}", e.getMessage());
                    api.error(ctx, 500, "Failed to fetch data from NWS");
                    return;
                }
                log.debug("No NWS data available for lat={}, lon={}", lat, lon);
                nws = om.createObjectNode();
                nwsStatus = NO_DATA;
            }

            JsonNode alerts;
            String alertsStatus;
            if (OK.equals(nwsStatus)) {
                try {
                    alerts = api.nws().activeAlertsForZone(NwsDocument.of(nws).zone());
                    alertsStatus = OK;
                } catch (UpstreamException e) {
                    log.error("Error fetching alert data from NWS: {}", e.getMessage());
                    api.error(ctx, 500, "Failed to fetch data from NWS API (alerts)");
                    return;
                }
            } else {
                alerts = om.createObjectNode();
                alertsStatus = NOT_FETCHED;
            }

            SpcSnapshot spc = api.spcCache().snapshot();
            NormalizedForecast forecast = api.merger().merge(point,
                    new UpstreamDocuments(owm, nws, alerts, spc.availableOutlooks(), spc.mesoscale()));

            ObjectNode out = om.createObjectNode();
            out.putObject("status")
                    .put("owm", OK)
                    .put("nws", nwsStatus)
                    .put("alerts", alertsStatus);
            out.set("data", om.valueToTree(forecast));
            api.respond(ctx, out);
        });
    }
}
