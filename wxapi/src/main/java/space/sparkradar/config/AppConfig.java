package space.sparkradar.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;
import java.util.function.Function;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups the runtime settings for the API, the upstream clients
 * and the SPC outlook cache.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,
        String apiKey,

        // Upstreams
        String owmApiKey,
        String nwsUserAgent,
        Duration httpTimeout,
        int httpRetries,

        // SPC outlook cache
        Duration spcRefresh,
        String spcCacheDir,

        // Time
        ZoneId clockZoneId) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read application.properties", e);
        }
        return from(p, System::getenv);
    }

    /**
     * Builds the config from a properties fallback and an environment lookup.
     */
    static AppConfig from(Properties p, Function<String, String> env) {
        int port = Integer.parseInt(envOr(p, env, "PORT", "api.port", "3000"));
        String apiKey = requireNonBlank("API_KEY", envOr(p, env, "API_KEY", "api.key", ""));

        String owmKey = requireNonBlank("OWM_API_KEY", envOr(p, env, "OWM_API_KEY", "owm.apiKey", ""));
        String ua = envOr(p, env, "NWS_USER_AGENT", "nws.userAgent", "SparkRadarWXAPI");
        Duration timeout = Duration.parse(envOr(p, env, "HTTP_TIMEOUT", "http.timeout", "PT10S"));
        int retries = Integer.parseInt(envOr(p, env, "HTTP_RETRIES", "http.retries", "2"));

        Duration spcRefresh = Duration.parse(envOr(p, env, "SPC_REFRESH", "spc.refresh", "PT10M"));
        String spcCacheDir = envOr(p, env, "SPC_CACHE_DIR", "spc.cacheDir", "data/spc");

        ZoneId zoneId = ZoneId.of(envOr(p, env, "CLOCK_ZONE", "clock.zone", "UTC"));

        return new AppConfig(
                port,
                apiKey,

                owmKey,
                ua,
                timeout,
                retries,

                spcRefresh,
                spcCacheDir,

                zoneId);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, Function<String, String> env, String envKey, String propKey,
            String def) {
        String v = env.apply(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String name, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + name + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
