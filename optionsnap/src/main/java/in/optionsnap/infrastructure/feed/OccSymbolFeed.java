package in.optionsnap.infrastructure.feed;

import in.optionsnap.infrastructure.common.NetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Downloads the OCC "delo-download" listing of optionable underlyings.
 *
 * URL: https://marketdata.theocc.com/delo-download?prodType=ALL&downloadFields=US;OS;SN;EXCH;PL;ONN&format=txt
 *
 * Body is plain text, one series per line:
 * <pre>
 * 1AAL  	AAL   	American Airlines Group, Inc. (AMER/FLEX)	ABCPX	25000000	EF
 * </pre>
 */
public class OccSymbolFeed {
    private static final Logger log = LoggerFactory.getLogger(OccSymbolFeed.class);

    public static final String SOURCE = "OCC";

    private final String url;
    private final Duration timeout;
    private final HttpClient httpClient;

    public OccSymbolFeed(String url, Duration timeout) {
        this(url, timeout, HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    public OccSymbolFeed(String url, Duration timeout, HttpClient httpClient) {
        this.url = url;
        this.timeout = timeout;
        this.httpClient = httpClient;
    }

    /**
     * Fetch the raw feed text.
     *
     * @throws NetworkException on transport failure, timeout or non-2xx status
     * @throws InterruptedException if interrupted while waiting for the response
     */
    public String download() throws InterruptedException {
        log.info("[OccSymbolFeed] Downloading OCC symbols from {}", url);
        long startTime = System.currentTimeMillis();

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Accept", "text/plain")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NetworkException(SOURCE, "Download failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new NetworkException(SOURCE, status, "Download returned HTTP " + status);
        }

        String body = response.body() == null ? "" : response.body();
        log.info("[OccSymbolFeed] Downloaded {}KB in {}ms",
            body.length() / 1024, System.currentTimeMillis() - startTime);
        return body;
    }

    public String getUrl() {
        return url;
    }
}
