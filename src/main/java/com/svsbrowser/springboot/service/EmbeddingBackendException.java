package com.svsbrowser.springboot.service;

/**
 * The embedding backend failed or returned something unusable.
 */
public class EmbeddingBackendException extends RuntimeException {

    public EmbeddingBackendException(String message) {
        super(message);
    }

    public EmbeddingBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
