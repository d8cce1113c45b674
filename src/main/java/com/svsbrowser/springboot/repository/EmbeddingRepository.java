package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.Embedding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.UUID;

@Repository
public interface EmbeddingRepository extends JpaRepository<Embedding, UUID>, EmbeddingRepositoryCustom {

    /**
     * Retires the current embeddings of chunks that are about to be deleted. Rows are kept for audit.
     */
    @Modifying
    @Query("UPDATE Embedding e SET e.current = false " +
            "WHERE e.chunkType = :chunkType AND e.chunkId IN :chunkIds AND e.current = true")
    int markNotCurrent(@Param("chunkType") String chunkType, @Param("chunkIds") Collection<UUID> chunkIds);
}
