package com.example.bilitracker.common.exception;

/**
 * Remote request that still failed after all retry attempts.
 */
public class RemoteApiException extends RuntimeException {

    private final String url;
    private final Integer statusCode;

    public RemoteApiException(String message, String url, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    /**
     * HTTP status of the last attempt, or null when the last attempt failed before a response arrived.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
