package com.kbhealth.backend.exception;

/**
 * Failure to fetch or parse a single page.
 */
public class PageFetchException extends KbHealthException {

    private final String url;
    private final boolean transientFailure;
    private final Integer statusCode;

    public PageFetchException(String url, String message, boolean transientFailure, Integer statusCode, Throwable cause) {
        super("FETCH_FAILED", message, cause);
        this.url = url;
        this.transientFailure = transientFailure;
        this.statusCode = statusCode;
    }

    public static PageFetchException httpStatus(String url, int statusCode) {
        boolean retryable = statusCode == 429 || statusCode >= 500;
        return new PageFetchException(url, "HTTP " + statusCode + " for " + url, retryable, statusCode, null);
    }

    public static PageFetchException network(String url, Throwable cause) {
        return new PageFetchException(url, "Network error for " + url + ": " + cause.getMessage(), true, null, cause);
    }

    public static PageFetchException permanent(String url, String message, Throwable cause) {
        return new PageFetchException(url, message, false, null, cause);
    }

    public String getUrl() {
        return url;
    }

    /**
     * Timeouts, connection failures, 5xx and 429 responses.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
