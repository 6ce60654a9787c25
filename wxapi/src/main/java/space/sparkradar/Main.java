/*
* Main application entry point for SparkRadar WX API, a weather aggregation service.
*
* Loads configuration, builds the upstream HTTP clients, seeds the SPC outlook cache
* from disk, starts the SPC updater and the API server, and handles a graceful shutdown.
*/

package space.sparkradar;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.sparkradar.api.ApiServer;
import space.sparkradar.config.AppConfig;
import space.sparkradar.diagnostics.LoggingDiagnostics;
import space.sparkradar.merge.ForecastMerger;
import space.sparkradar.metrics.UpstreamMetrics;
import space.sparkradar.spc.SpcClient;
import space.sparkradar.spc.SpcOutlookCache;
import space.sparkradar.spc.SpcUpdater;
import space.sparkradar.upstream.NwsClient;
import space.sparkradar.upstream.OwmClient;
import space.sparkradar.upstream.UpstreamHttp;

import java.nio.file.Path;
import java.time.Clock;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        log.info("OWM API key initialized as {}****", cfg.owmApiKey().substring(0, Math.min(4, cfg.owmApiKey().length())));

        Clock clock = Clock.system(cfg.clockZoneId());
        ObjectMapper om = new ObjectMapper();
        UpstreamMetrics metrics = new UpstreamMetrics(clock);

        // Upstream clients share one HTTP stack
        UpstreamHttp http = new UpstreamHttp(UpstreamHttp.defaultClient(cfg.httpTimeout()), om, metrics,
                cfg.httpTimeout(), cfg.httpRetries(), cfg.nwsUserAgent());
        OwmClient owm = new OwmClient(http, cfg.owmApiKey());
        NwsClient nws = new NwsClient(http);
        SpcClient spc = new SpcClient(http);

        // SPC cache: last known documents first, then keep them fresh in the background
        SpcOutlookCache spcCache = new SpcOutlookCache(Path.of(cfg.spcCacheDir()), om);
        spcCache.loadFromDisk();
        SpcUpdater updater = new SpcUpdater(spc, spcCache, clock, cfg.spcRefresh());
        updater.start();

        ForecastMerger merger = new ForecastMerger(clock, new LoggingDiagnostics());
        ApiServer api = new ApiServer(cfg, om, owm, nws, spcCache, merger, metrics, clock);
        api.start();
        log.info("SparkRadarWXAPI running on port {}", cfg.apiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                updater.stop();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
