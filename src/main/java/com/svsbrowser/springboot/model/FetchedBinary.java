package com.svsbrowser.springboot.model;

/**
 * A downloaded binary body and the content type the server reported for it (may be null).
 */
public record FetchedBinary(byte[] body, String contentType) {
}
