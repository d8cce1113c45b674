package com.svsbrowser.springboot.dto;

public record EmbeddingRunSummary(String chunkType, int totalProcessed, double elapsedSeconds,
                                  double chunksPerSecond, String model) {
}
