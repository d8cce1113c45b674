package com.svsbrowser.springboot.service;

/**
 * Upstream throttling that outlasted the retry budget.
 */
public class ThrottledException extends RuntimeException {

    public ThrottledException(String message) {
        super(message);
    }

    public ThrottledException(String message, Throwable cause) {
        super(message, cause);
    }
}
