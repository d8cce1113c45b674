package com.svsbrowser.springboot.model;

import java.util.UUID;

public record PendingChunk(UUID chunkId, String content) {
}
