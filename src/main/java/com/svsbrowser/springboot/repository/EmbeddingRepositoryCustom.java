package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.ChunkType;
import com.svsbrowser.springboot.model.PendingChunk;

import java.util.List;
import java.util.UUID;

public interface EmbeddingRepositoryCustom {

    List<PendingChunk> findPendingChunks(ChunkType chunkType, String modelName, int limit);

    long countPendingChunks(ChunkType chunkType, String modelName);

    void insertCurrent(UUID chunkId, ChunkType chunkType, String modelName, String modelVersion, float[] vector);
}
