package space.sparkradar.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.sparkradar.metrics.UpstreamMetrics;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Shared outbound GET for every upstream: per-request timeout, retry on IO
 * errors and 5xx, JSON parsing and metrics.
 */
public final class UpstreamHttp implements UpstreamFetcher {
    private static final Logger log = LoggerFactory.getLogger(UpstreamHttp.class);

    private final HttpClient http;
    private final ObjectMapper om;
    private final UpstreamMetrics metrics;
    private final Duration timeout;
    private final int attempts;
    private final String userAgent;

    public UpstreamHttp(HttpClient http, ObjectMapper om, UpstreamMetrics metrics, Duration timeout, int attempts,
            String userAgent) {
        this.http = http;
        this.om = om;
        this.metrics = metrics;
        this.timeout = timeout;
        this.attempts = Math.max(1, attempts);
        this.userAgent = userAgent;
    }

    /**
     * Builds the default JDK client (connect timeout, follow redirects).
     */
    public static HttpClient defaultClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public JsonNode fetch(String upstream, URI uri) {
        UpstreamException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                JsonNode body = fetchOnce(upstream, uri);
                metrics.record(upstream, true);
                return body;
            } catch (UpstreamException e) {
                metrics.record(upstream, false);
                last = e;
                if (!retryable(e) || attempt == attempts || Thread.currentThread().isInterrupted())
                    break;
                log.debug("{} attempt {} failed, retrying: {}", upstream, attempt, e.getMessage());
            }
        }
        throw last;
    }

    private JsonNode fetchOnce(String upstream, URI uri) {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/geo+json,application/json")
                .GET()
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamException(upstream, null, false,
                    upstream + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(upstream, null, false, upstream + " request interrupted", e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new UpstreamException(upstream, status, false,
                    upstream + " request failed: " + status + " url=" + redact(uri), null);
        }
        try {
            return om.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new UpstreamException(upstream, status, true,
                    upstream + " response is not valid JSON", e);
        }
    }

    private static boolean retryable(UpstreamException e) {
        if (e.isNotJson())
            return false;
        return e.status() == null || e.status() >= 500;
    }

    /**
     * Drops the query string so API keys never reach the log.
     */
    static String redact(URI uri) {
        String s = uri.toString();
        int q = s.indexOf('?');
        return q < 0 ? s : s.substring(0, q) + "?...";
    }
}
