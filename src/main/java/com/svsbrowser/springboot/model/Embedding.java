package com.svsbrowser.springboot.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Metadata view of an embedding row. The vector column itself is only written and read through
 * native SQL in {@code EmbeddingRepositoryImpl}, so this entity is never persisted directly.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "embedding")
public class Embedding {

    @Id
    @Column(name = "embedding_id", updatable = false, nullable = false)
    private UUID embeddingId;

    @Column(name = "chunk_id", nullable = false)
    private UUID chunkId;

    @Column(name = "chunk_type", nullable = false)
    private String chunkType;

    @Column(name = "model_name", nullable = false)
    private String modelName;

    @Column(name = "model_version")
    private String modelVersion;

    @Column(name = "dims", nullable = false)
    private int dims;

    @Column(name = "is_current", nullable = false)
    private boolean current;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
