package com.kakomon.fetch;

import java.io.IOException;

/**
 * Request failed after the retry budget, or failed with a status that is not worth retrying.
 */
public class NetworkException extends IOException {
    private final String url;
    private final int statusCode;
    private final boolean transientFailure;

    public NetworkException(String message, String url, int statusCode, boolean transientFailure) {
        super(message);
        this.url = url == null ? "" : url;
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public NetworkException(String message, String url, Throwable cause) {
        super(message, cause);
        this.url = url == null ? "" : url;
        this.statusCode = -1;
        this.transientFailure = true;
    }

    public String url() {
        return url;
    }

    /**
     * HTTP status of the last attempt, -1 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
