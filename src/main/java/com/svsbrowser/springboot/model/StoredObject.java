package com.svsbrowser.springboot.model;

public record StoredObject(byte[] data, String contentType) {
}
