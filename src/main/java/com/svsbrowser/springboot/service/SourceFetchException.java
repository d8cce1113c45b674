package com.svsbrowser.springboot.service;

import java.util.Set;

/**
 * Terminal failure of a request to the source site, after any retries.
 */
public class SourceFetchException extends RuntimeException {

    public static final int NETWORK_ERROR = -1;
    static final Set<Integer> TRANSIENT_STATUS = Set.of(429, 500, 502, 503, 504);

    private final int statusCode;

    public SourceFetchException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the last response, or {@link #NETWORK_ERROR} when no response arrived.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return statusCode == NETWORK_ERROR || TRANSIENT_STATUS.contains(statusCode);
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
