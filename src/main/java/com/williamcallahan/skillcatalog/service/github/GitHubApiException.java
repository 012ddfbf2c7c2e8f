package com.williamcallahan.skillcatalog.service.github;

/**
 * Metadata provider failure. Not-found responses are never reported this way.
 */
public class GitHubApiException extends RuntimeException {
    private static final int STATUS_TIMEOUT = 408;
    private static final int STATUS_CONFLICT = 409;
    private static final int STATUS_RATE_LIMITED = 429;
    private static final int STATUS_SERVER_ERROR_MIN = 500;

    private final int statusCode;

    /**
     * @param message description of the failed call
     * @param statusCode HTTP status, or 0 when no response was received
     * @param cause underlying failure
     */
    public GitHubApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public GitHubApiException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Returns true for I/O failures, timeouts, rate limits, secondary rate limits and server errors.
     */
    public boolean isTransient() {
        return statusCode == 0
                || statusCode == STATUS_TIMEOUT
                || statusCode == STATUS_CONFLICT
                || statusCode == STATUS_RATE_LIMITED
                || statusCode == 403 && getMessage() != null && getMessage().contains("rate limit")
                || statusCode >= STATUS_SERVER_ERROR_MIN;
    }

    /**
     * Retry classifier for {@link com.williamcallahan.skillcatalog.support.RetrySupport}.
     */
    public static boolean isTransient(RuntimeException exception) {
        return exception instanceof GitHubApiException apiException && apiException.isTransient();
    }
}
