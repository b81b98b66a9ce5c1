package in.optionsnap.config;

import in.optionsnap.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Immutable process configuration, read once at startup from the environment.
 *
 * Environment variables:
 * - PORT: HTTP listen port
 * - TRADIER_BASE_URL / TRADIER_API_TOKEN: quote vendor endpoint and credentials
 * - TRADIER_RATE_LIMIT: requests per minute (defaults to 60 on sandbox, 120 on production)
 * - OCC_SYMBOLS_URL / OCC_TIMEOUT_SEC: reference symbol feed
 * - OCC_REFRESH_TIME / OCC_REFRESH_ZONE: daily symbol refresh schedule
 * - BATCH_SIZE / MAX_CONCURRENCY / REFRESH_INTERVAL_SEC / SNAPSHOT_START_DELAY_MS: snapshot loop
 * - SNAPSHOT_ENABLED: set to false to serve symbols only
 */
public record AppConfig(
    int port,
    String tradierBaseUrl,
    String tradierApiToken,
    int tradierRateLimit,
    Duration rateLimitWindow,
    String occSymbolsUrl,
    Duration occTimeout,
    LocalTime occRefreshTime,
    ZoneId occRefreshZone,
    int batchSize,
    int maxConcurrency,
    Duration refreshInterval,
    Duration snapshotStartDelay,
    boolean snapshotEnabled
) {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String DEFAULT_TRADIER_BASE_URL = "https://api.tradier.com/v1";
    public static final String DEFAULT_OCC_SYMBOLS_URL =
        "https://marketdata.theocc.com/delo-download?prodType=ALL&downloadFields=US;OS;SN;EXCH;PL;ONN&format=txt";

    public static final int SANDBOX_RATE_LIMIT = 60;
    public static final int PRODUCTION_RATE_LIMIT = 120;

    public static AppConfig fromEnv() {
        String baseUrl = Env.get("TRADIER_BASE_URL", DEFAULT_TRADIER_BASE_URL);

        AppConfig config = new AppConfig(
            Env.getInt("PORT", 8080),
            baseUrl,
            Env.get("TRADIER_API_TOKEN", ""),
            Env.getInt("TRADIER_RATE_LIMIT", defaultRateLimit(baseUrl)),
            Duration.ofSeconds(60),
            Env.get("OCC_SYMBOLS_URL", DEFAULT_OCC_SYMBOLS_URL),
            Env.getSeconds("OCC_TIMEOUT_SEC", 30),
            Env.getTime("OCC_REFRESH_TIME", LocalTime.of(2, 0)),
            zoneOrDefault(Env.get("OCC_REFRESH_ZONE", "America/New_York")),
            Env.getInt("BATCH_SIZE", 860),
            Env.getInt("MAX_CONCURRENCY", 8),
            Env.getSeconds("REFRESH_INTERVAL_SEC", 61),
            Env.getMillis("SNAPSHOT_START_DELAY_MS", 1000),
            Env.getBool("SNAPSHOT_ENABLED", true)
        );
        config.validate();
        return config;
    }

    /**
     * Sandbox accounts get half the production quota.
     */
    public static int defaultRateLimit(String baseUrl) {
        return baseUrl != null && baseUrl.toLowerCase(Locale.ROOT).contains("sandbox")
            ? SANDBOX_RATE_LIMIT
            : PRODUCTION_RATE_LIMIT;
    }

    public boolean isSandbox() {
        return tradierBaseUrl.toLowerCase(Locale.ROOT).contains("sandbox");
    }

    public boolean hasTradierToken() {
        return tradierApiToken != null && !tradierApiToken.isBlank();
    }

    /**
     * Rejects settings the refresh loop cannot run with.
     *
     * @throws IllegalStateException listing every invalid setting
     */
    public void validate() {
        StringBuilder errors = new StringBuilder();
        if (port <= 0 || port > 65535) errors.append("PORT must be 1-65535; ");
        if (tradierRateLimit <= 0) errors.append("TRADIER_RATE_LIMIT must be positive; ");
        if (batchSize <= 0) errors.append("BATCH_SIZE must be positive; ");
        if (maxConcurrency <= 0) errors.append("MAX_CONCURRENCY must be positive; ");
        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            errors.append("REFRESH_INTERVAL_SEC must be positive; ");
        }
        if (occTimeout.isNegative() || occTimeout.isZero()) {
            errors.append("OCC_TIMEOUT_SEC must be positive; ");
        }
        if (snapshotStartDelay.isNegative()) errors.append("SNAPSHOT_START_DELAY_MS must not be negative; ");
        if (errors.length() > 0) {
            throw new IllegalStateException("Invalid configuration: " + errors.toString().trim());
        }
    }

    private static ZoneId zoneOrDefault(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (Exception e) {
            log.warn("[Config] Invalid OCC_REFRESH_ZONE '{}', using America/New_York: {}", zone, e.getMessage());
            return ZoneId.of("America/New_York");
        }
    }
}
