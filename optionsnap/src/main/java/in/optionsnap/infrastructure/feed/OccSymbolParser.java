package in.optionsnap.infrastructure.feed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Extracts underlying tickers from the OCC listing.
 *
 * Each line is split on tabs, falling back to runs of whitespace for lines
 * without any tab. The second field is the underlying; it is stripped to
 * ASCII letters and digits, upper-cased, and kept when 1 to 4 characters long.
 * Malformed lines are skipped, never thrown.
 */
public final class OccSymbolParser {
    private static final Logger log = LoggerFactory.getLogger(OccSymbolParser.class);

    public static final int MIN_SYMBOL_LENGTH = 1;
    public static final int MAX_SYMBOL_LENGTH = 4;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private OccSymbolParser() {
    }

    public static ParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return new ParseResult(Set.of(), 0, 0, 0);
        }

        String[] lines = LINE_BREAK.split(text.strip());
        log.debug("[OccSymbolParser] Parsing {} lines", lines.length);

        Set<String> symbols = new TreeSet<>();
        int accepted = 0;
        int skipped = 0;
        int lineNumber = 0;

        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }

            String[] parts = line.split("\t", -1);
            if (parts.length < 2 && line.indexOf('\t') < 0) {
                parts = WHITESPACE.split(line.strip());
            }
            if (parts.length < 2) {
                log.debug("[OccSymbolParser] Skipping line {}: insufficient columns", lineNumber);
                skipped++;
                continue;
            }

            String symbol = NON_ALPHANUMERIC.matcher(parts[1]).replaceAll("").toUpperCase(Locale.ROOT);
            if (symbol.length() < MIN_SYMBOL_LENGTH || symbol.length() > MAX_SYMBOL_LENGTH) {
                log.debug("[OccSymbolParser] Skipping invalid symbol on line {}: '{}'", lineNumber, parts[1]);
                skipped++;
                continue;
            }

            symbols.add(symbol);
            accepted++;
        }

        return new ParseResult(Collections.unmodifiableSet(symbols), lineNumber, accepted, skipped);
    }

    /**
     * Parsed symbols (sorted, unique) and line counts. {@code accepted} counts
     * lines, so it exceeds {@code symbols.size()} when underlyings repeat.
     */
    public record ParseResult(Set<String> symbols, int lines, int accepted, int skipped) {
    }
}
