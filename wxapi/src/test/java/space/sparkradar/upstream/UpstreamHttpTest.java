package space.sparkradar.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.sparkradar.metrics.UpstreamMetrics;
import space.sparkradar.support.MutableClock;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpstreamHttpTest {
    private HttpServer server;
    private String base;
    private UpstreamMetrics metrics;
    private UpstreamHttp http;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
        metrics = new UpstreamMetrics(new MutableClock(Instant.parse("2024-05-01T18:00:00Z"), ZoneOffset.UTC));
        http = new UpstreamHttp(UpstreamHttp.defaultClient(Duration.ofSeconds(2)), new ObjectMapper(), metrics,
                Duration.ofSeconds(2), 3, "SparkRadarWXAPI-test");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void parsesJsonAndSendsUserAgent() {
        AtomicReference<String> ua = new AtomicReference<>();
        server.createContext("/ok", ex -> {
            ua.set(ex.getRequestHeaders().getFirst("User-Agent"));
            write(ex, 200, "{\"a\":1}");
        });

        JsonNode body = http.fetch("OWM", URI.create(base + "/ok"));

        assertEquals(1, body.path("a").asInt());
        assertEquals("SparkRadarWXAPI-test", ua.get());
        assertEquals(1, metrics.snapshot().get("OWM").calls());
    }

    @Test
    void retriesServerErrors() {
        AtomicInteger hits = new AtomicInteger();
        server.createContext("/flaky", ex -> {
            if (hits.incrementAndGet() < 3)
                write(ex, 503, "busy");
            else
                write(ex, 200, "[]");
        });

        JsonNode body = http.fetch("SPC", URI.create(base + "/flaky"));

        assertTrue(body.isArray());
        assertEquals(3, hits.get());
        assertEquals(2, metrics.snapshot().get("SPC").failures());
    }

    @Test
    void clientErrorsAreNotRetried() {
        AtomicInteger hits = new AtomicInteger();
        server.createContext("/missing", ex -> {
            hits.incrementAndGet();
            write(ex, 404, "{}");
        });

        UpstreamException e = assertThrows(UpstreamException.class,
                () -> http.fetch("NWS_ALERTS", URI.create(base + "/missing?key=secret")));

        assertEquals(1, hits.get());
        assertEquals(404, e.status());
        assertFalse(e.isNotJson());
        assertFalse(e.getMessage().contains("secret"));
    }

    @Test
    void htmlBodyIsFlaggedNotJson() {
        AtomicInteger hits = new AtomicInteger();
        server.createContext("/html", ex -> {
            hits.incrementAndGet();
            write(ex, 200, "<html><body>No forecast for this point</body></html>");
        });

        UpstreamException e = assertThrows(UpstreamException.class,
                () -> http.fetch("NWS", URI.create(base + "/html")));

        assertTrue(e.isNotJson());
        assertEquals("NWS", e.upstream());
        assertEquals(1, hits.get());
    }

    @Test
    void interruptedCallerIsNotRetried() {
        AtomicInteger hits = new AtomicInteger();
        server.createContext("/slow", ex -> {
            hits.incrementAndGet();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            write(ex, 503, "busy");
        });

        Thread.currentThread().interrupt();
        try {
            assertThrows(UpstreamException.class, () -> http.fetch("OWM", URI.create(base + "/slow")));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertTrue(hits.get() <= 1);
        assertEquals(1, metrics.snapshot().get("OWM").calls());
        assertEquals(1, metrics.snapshot().get("OWM").failures());
    }

    @Test
    void redactsQueryString() {
        assertEquals("https://x.test/onecall?...",
                UpstreamHttp.redact(URI.create("https://x.test/onecall?lat=1&appid=abc")));
        assertEquals("https://x.test/a", UpstreamHttp.redact(URI.create("https://x.test/a")));
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
