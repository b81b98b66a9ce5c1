package in.optionsnap.infrastructure.common;

/**
 * Exception thrown when an upstream source (reference feed or quote vendor)
 * cannot be reached or answers with a non-2xx status.
 */
public class NetworkException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final String source;
    private final int statusCode;

    public NetworkException(String source, int statusCode, String message) {
        super(String.format("[%s] %s", source, message));
        this.source = source;
        this.statusCode = statusCode;
    }

    public NetworkException(String source, String message, Throwable cause) {
        super(String.format("[%s] %s", source, message), cause);
        this.source = source;
        this.statusCode = NO_STATUS;
    }

    public String getSource() {
        return source;
    }

    /**
     * HTTP status of the failed response, or {@link #NO_STATUS} for transport failures.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isHttpError() {
        return statusCode != NO_STATUS;
    }
}
