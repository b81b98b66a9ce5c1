package in.optionsnap.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.optionsnap.bootstrap.App;
import in.optionsnap.domain.model.QuoteRecord;
import in.optionsnap.infrastructure.common.NetworkException;
import in.optionsnap.infrastructure.metrics.PrometheusMetricsHandler;
import in.optionsnap.infrastructure.metrics.PrometheusSnapshotMetrics;
import in.optionsnap.infrastructure.vendor.RateLimiter;
import in.optionsnap.service.snapshot.QuoteSnapshotStore;
import in.optionsnap.service.symbols.SymbolUniverse;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Integration test for the HTTP routes on an embedded Undertow server.
 */
@ExtendWith(MockitoExtension.class)
class QuoteApiHandlersTest {

    private static final int TEST_PORT = 19183;
    private static final Instant AT = Instant.parse("2024-03-01T15:00:00Z");
    private static final ObjectMapper JSON = new ObjectMapper();

    @Mock
    private SymbolUniverse universe;

    private Undertow server;
    private HttpClient httpClient;
    private QuoteSnapshotStore store;
    private PrometheusSnapshotMetrics metrics;

    @BeforeEach
    void setUp() {
        store = new QuoteSnapshotStore();
        metrics = new PrometheusSnapshotMetrics(new CollectorRegistry());
        RateLimiter rateLimiter = new RateLimiter(120, Duration.ofSeconds(60), metrics);

        QuoteApiHandlers api = new QuoteApiHandlers(store, universe, null, rateLimiter, metrics);
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(App.routes(api, new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/healthz");

        assertEquals(200, response.statusCode());
        assertTrue(JSON.readTree(response.body()).get("ok").asBoolean());
    }

    @Test
    void testSnapshotUnfiltered() throws Exception {
        publishSample();

        JsonNode body = JSON.readTree(get("/v1/markets/quotes/snapshot").body());

        assertEquals(2, body.get("count").asInt());
        assertEquals(2, body.get("results").size());
        assertEquals("2024-03-01T15:00:00Z", body.get("last_update").asText(), "ISO-8601 timestamp");
        assertFalse(body.get("results").get(0).has("exchange"), "Core fields only");
    }

    @Test
    void testSnapshotFiltered() throws Exception {
        publishSample();

        JsonNode body = JSON.readTree(get("/v1/markets/quotes/snapshot?symbols=aapl,ZZZZ").body());

        assertEquals(1, body.get("count").asInt());
        assertEquals("AAPL", body.get("results").get(0).get("symbol").asText());
        assertEquals(180.5, body.get("results").get(0).get("last").asDouble());
    }

    @Test
    void testSnapshotBeforeFirstCycle() throws Exception {
        JsonNode body = JSON.readTree(get("/v1/markets/quotes/snapshot").body());

        assertEquals(0, body.get("count").asInt());
        assertTrue(body.get("last_update").isNull());
    }

    @Test
    void testLastUpdate() throws Exception {
        publishSample();

        JsonNode body = JSON.readTree(get("/v1/markets/quotes/last_update").body());

        assertEquals(2, body.get("count").asInt());
        assertEquals("2024-03-01T15:00:00Z", body.get("last_update").asText());
    }

    @Test
    void testStatus() throws Exception {
        when(universe.getSymbolCount()).thenReturn(4200);
        when(universe.getLastUpdate()).thenReturn(AT);

        JsonNode body = JSON.readTree(get("/v1/markets/quotes/status").body());

        assertEquals(120, body.get("rate_limiter").get("max_requests").asInt());
        assertEquals(4200, body.get("symbols").asInt());
        assertTrue(body.has("metrics"));
    }

    @Test
    void testSymbols() throws Exception {
        when(universe.getSymbols()).thenReturn(new TreeSet<>(Set.of("MSFT", "AAPL")));
        when(universe.getLastUpdate()).thenReturn(AT);

        JsonNode body = JSON.readTree(get("/v1/markets/options/symbols").body());

        assertEquals(2, body.get("count").asInt());
        assertEquals("AAPL", body.get("symbols").get(0).asText(), "Sorted");
        assertEquals("MSFT", body.get("symbols").get(1).asText());
        assertTrue(body.has("note"));
    }

    @Test
    void testSymbolAvailability() throws Exception {
        when(universe.isSymbolAvailable("aapl")).thenReturn(true);

        JsonNode body = JSON.readTree(get("/v1/markets/options/symbols/aapl").body());

        assertEquals("AAPL", body.get("symbol").asText());
        assertTrue(body.get("available").asBoolean());
    }

    @Test
    void testRefreshSuccess() throws Exception {
        when(universe.refresh(true)).thenReturn(
            new SymbolUniverse.RefreshResult(true, 4200, AT, Duration.ofSeconds(3), null));

        HttpResponse<String> response = post("/v1/markets/options/symbols/refresh");
        JsonNode body = JSON.readTree(response.body());

        assertEquals(200, response.statusCode());
        assertEquals("success", body.get("status").asText());
        assertEquals(4200, body.get("count").asInt());
        assertTrue(body.has("message"));
    }

    @Test
    void testRefreshFailureReturns500() throws Exception {
        when(universe.refresh(true)).thenThrow(new NetworkException("OCC", 503, "Download returned HTTP 503"));

        HttpResponse<String> response = post("/v1/markets/options/symbols/refresh");

        assertEquals(500, response.statusCode());
        assertTrue(JSON.readTree(response.body()).get("detail").asText().contains("503"));
    }

    @Test
    void testParseSymbolsUppercasesWithRootLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            List<String> symbols = QuoteApiHandlers.parseSymbols(new ArrayDeque<>(List.of(" bili , spy,,")));

            assertEquals(List.of("BILI", "SPY"), symbols);
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void testUnknownPathReturns404() throws Exception {
        assertEquals(404, get("/v1/nothing-here").statusCode());
    }

    @Test
    void testMetricsEndpoint() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("rate_limit_max_requests"));
    }

    private void publishSample() {
        store.publish(List.of(
            QuoteRecord.core("AAPL", "Apple Inc", 180.5, 180.4, 180.6, 1_000_000),
            QuoteRecord.core("MSFT", "Microsoft Corp", 410.0, 409.9, 410.1, 500_000)
        ), AT);
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
