package in.optionsnap.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.optionsnap.infrastructure.metrics.SnapshotMetrics;
import in.optionsnap.infrastructure.vendor.RateLimiter;
import in.optionsnap.service.snapshot.QuoteSnapshotStore;
import in.optionsnap.service.snapshot.SnapshotRefresher;
import in.optionsnap.service.symbols.SymbolUniverse;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP handlers for the quote snapshot and symbol universe.
 *
 * Endpoints:
 * - GET  /healthz
 * - GET  /v1/markets/quotes/snapshot[?symbols=AAPL,MSFT]
 * - GET  /v1/markets/quotes/last_update
 * - GET  /v1/markets/quotes/status
 * - GET  /v1/markets/options/symbols
 * - GET  /v1/markets/options/symbols/{symbol}
 * - POST /v1/markets/options/symbols/refresh
 *
 * Reads are served from memory and never call the vendor.
 */
public final class QuoteApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(QuoteApiHandlers.class);
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String SYMBOLS_NOTE =
        "Underlying symbols with listed options, refreshed daily from the OCC";

    private final QuoteSnapshotStore store;
    private final SymbolUniverse universe;
    private final SnapshotRefresher refresher;
    private final RateLimiter rateLimiter;
    private final SnapshotMetrics metrics;

    public QuoteApiHandlers(
        QuoteSnapshotStore store,
        SymbolUniverse universe,
        SnapshotRefresher refresher,
        RateLimiter rateLimiter,
        SnapshotMetrics metrics
    ) {
        this.store = store;
        this.universe = universe;
        this.refresher = refresher;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
    }

    /**
     * GET /healthz
     */
    public void health(HttpServerExchange exchange) {
        sendJson(exchange, StatusCodes.OK, Map.of("ok", true));
    }

    /**
     * GET /v1/markets/quotes/snapshot
     *
     * Optional {@code symbols} query parameter, comma-separated, case-insensitive.
     */
    public void snapshot(HttpServerExchange exchange) {
        try {
            List<String> symbols = parseSymbols(exchange.getQueryParameters().get("symbols"));
            sendJson(exchange, StatusCodes.OK, store.getSnapshot(symbols));
        } catch (Exception e) {
            log.error("[QuoteApi] Failed to retrieve quotes snapshot", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR,
                "Failed to retrieve quotes snapshot: " + e.getMessage());
        }
    }

    /**
     * GET /v1/markets/quotes/last_update
     */
    public void lastUpdate(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, store.getLastUpdateMeta());
        } catch (Exception e) {
            log.error("[QuoteApi] Failed to retrieve quotes last update", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR,
                "Failed to retrieve quotes last update: " + e.getMessage());
        }
    }

    /**
     * GET /v1/markets/quotes/status
     */
    public void status(HttpServerExchange exchange) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("background_task", refresher != null ? refresher.getBackgroundTaskStatus() : null);
        status.put("rate_limiter", rateLimiter != null ? rateLimiter.getStats() : null);
        status.put("symbols", universe.getSymbolCount());
        status.put("symbols_last_update", universe.getLastUpdate());
        if (metrics != null) {
            status.put("metrics", metrics.getSummary());
        }
        sendJson(exchange, StatusCodes.OK, status);
    }

    /**
     * GET /v1/markets/options/symbols
     */
    public void symbols(HttpServerExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        List<String> symbols = new ArrayList<>(universe.getSymbols());
        body.put("symbols", symbols);
        body.put("count", symbols.size());
        body.put("last_update", universe.getLastUpdate());
        body.put("note", SYMBOLS_NOTE);
        sendJson(exchange, StatusCodes.OK, body);
    }

    /**
     * GET /v1/markets/options/symbols/{symbol}
     */
    public void symbolAvailable(HttpServerExchange exchange) {
        String symbol = pathParam(exchange, "symbol");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", symbol == null ? "" : symbol.toUpperCase(Locale.ROOT));
        body.put("available", universe.isSymbolAvailable(symbol));
        sendJson(exchange, StatusCodes.OK, body);
    }

    /**
     * POST /v1/markets/options/symbols/refresh
     *
     * Downloads the OCC feed synchronously, so runs off the IO thread.
     */
    public void refreshSymbols(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::refreshSymbols);
            return;
        }

        try {
            SymbolUniverse.RefreshResult result = universe.refresh(true);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "success");
            body.put("count", result.symbolCount());
            body.put("last_update", result.lastUpdate());
            body.put("message", "Refreshed " + result.symbolCount() + " symbols");
            sendJson(exchange, StatusCodes.OK, body);
        } catch (Exception e) {
            log.error("[QuoteApi] Manual symbol refresh failed", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to refresh symbols: " + e.getMessage());
        }
    }

    /**
     * Split a comma-separated parameter; blanks dropped, null when absent.
     */
    static List<String> parseSymbols(Deque<String> param) {
        if (param == null || param.isEmpty()) {
            return null;
        }
        List<String> symbols = new ArrayList<>();
        for (String value : param) {
            for (String part : value.split(",")) {
                String symbol = part.trim();
                if (!symbol.isEmpty()) {
                    symbols.add(symbol.toUpperCase(Locale.ROOT));
                }
            }
        }
        return symbols;
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        if (match != null && match.getParameters().containsKey(name)) {
            return match.getParameters().get(name);
        }
        Deque<String> fromQuery = exchange.getQueryParameters().get(name);
        return fromQuery == null ? null : fromQuery.peekFirst();
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) {
        String json;
        try {
            json = MAPPER.writeValueAsString(data);
        } catch (Exception e) {
            log.error("[QuoteApi] Failed to serialize response", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to serialize response");
            return;
        }
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        String json;
        try {
            json = MAPPER.writeValueAsString(Map.of("detail", message == null ? "" : message));
        } catch (Exception e) {
            log.error("[QuoteApi] Failed to serialize error response", e);
            json = "{\"detail\":\"internal error\"}";
        }
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }
}
