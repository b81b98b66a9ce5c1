package in.optionsnap.bootstrap;

import in.optionsnap.config.AppConfig;
import in.optionsnap.infrastructure.feed.OccSymbolFeed;
import in.optionsnap.infrastructure.metrics.PrometheusMetricsHandler;
import in.optionsnap.infrastructure.metrics.PrometheusSnapshotMetrics;
import in.optionsnap.infrastructure.vendor.RateLimiter;
import in.optionsnap.infrastructure.vendor.TradierQuoteClient;
import in.optionsnap.service.snapshot.QuoteSnapshotStore;
import in.optionsnap.service.snapshot.SnapshotRefresher;
import in.optionsnap.service.symbols.SymbolRefreshScheduler;
import in.optionsnap.service.symbols.SymbolUniverse;
import in.optionsnap.transport.http.QuoteApiHandlers;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires:
 * - OCC symbol universe with daily refresh
 * - Tradier quotes client behind a shared rate limiter
 * - Background snapshot refresher
 * - Undertow HTTP API and Prometheus /metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== optionsnap Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        AppConfig config = AppConfig.fromEnv();

        PrometheusSnapshotMetrics metrics = new PrometheusSnapshotMetrics();

        // Symbol universe
        OccSymbolFeed feed = new OccSymbolFeed(config.occSymbolsUrl(), config.occTimeout());
        SymbolUniverse universe = new SymbolUniverse(feed, metrics);
        SymbolRefreshScheduler symbolScheduler = new SymbolRefreshScheduler(universe);
        symbolScheduler.setRefreshTime(config.occRefreshTime());
        symbolScheduler.setTimezone(config.occRefreshZone());

        // Quote vendor
        RateLimiter rateLimiter = new RateLimiter(config.tradierRateLimit(), config.rateLimitWindow(), metrics);
        TradierQuoteClient tradier = new TradierQuoteClient(
            config.tradierBaseUrl(), config.tradierApiToken(), rateLimiter, metrics);
        log.info("[App] Tradier {} at {} ({} requests/min)",
            config.isSandbox() ? "sandbox" : "production", config.tradierBaseUrl(), config.tradierRateLimit());

        // Snapshot
        QuoteSnapshotStore store = new QuoteSnapshotStore();
        SnapshotRefresher refresher = new SnapshotRefresher(
            universe,
            tradier,
            store,
            metrics,
            config.batchSize(),
            config.maxConcurrency(),
            config.refreshInterval(),
            config.snapshotStartDelay()
        );

        QuoteApiHandlers api = new QuoteApiHandlers(store, universe, refresher, rateLimiter, metrics);
        RoutingHandler routes = routes(api, new PrometheusMetricsHandler(metrics.getRegistry()));

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();

        symbolScheduler.start();

        if (config.snapshotEnabled() && config.hasTradierToken()) {
            refresher.startBackgroundTask();
        } else if (config.snapshotEnabled()) {
            log.warn("[App] TRADIER_API_TOKEN not set, quote snapshot refresher disabled");
        } else {
            log.info("[App] Snapshot refresher disabled (SNAPSHOT_ENABLED=false)");
        }

        server.start();
        log.info("✓ HTTP API server started on port {}", config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[App] Shutting down");
            refresher.stopBackgroundTask();
            symbolScheduler.stop();
            server.stop();
            log.info("[App] Shutdown complete");
        }, "shutdown"));
    }

    /**
     * HTTP routes, shared with the handler tests.
     */
    public static RoutingHandler routes(QuoteApiHandlers api, HttpHandler metricsHandler) {
        return Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/healthz", api::health)
            .get("/v1/markets/quotes/snapshot", api::snapshot)
            .get("/v1/markets/quotes/last_update", api::lastUpdate)
            .get("/v1/markets/quotes/status", api::status)
            .get("/v1/markets/options/symbols", api::symbols)
            .post("/v1/markets/options/symbols/refresh", api::refreshSymbols)
            .get("/v1/markets/options/symbols/{symbol}", api::symbolAvailable)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.getResponseSender().send("{\"detail\":\"Not Found\"}");
            });
    }
}
