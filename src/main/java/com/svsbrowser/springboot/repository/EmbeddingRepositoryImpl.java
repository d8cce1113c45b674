package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.ChunkType;
import com.svsbrowser.springboot.model.PendingChunk;
import com.svsbrowser.springboot.service.VectorFormat;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Repository
public class EmbeddingRepositoryImpl implements EmbeddingRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<PendingChunk> findPendingChunks(ChunkType chunkType, String modelName, int limit) {
        // Table name comes from the enum, never from input
        String sql = "SELECT c.chunk_id, c.content FROM " + chunkType.getTableName() + " c " +
                "WHERE NOT EXISTS (SELECT 1 FROM embedding e WHERE e.chunk_id = c.chunk_id " +
                "AND e.chunk_type = :chunkType AND e.model_name = :model AND e.is_current = true) " +
                "ORDER BY c.chunk_id";

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("chunkType", chunkType.getValue());
        query.setParameter("model", modelName);
        query.setMaxResults(Math.max(1, limit));

        @SuppressWarnings("unchecked")
        List<Object[]> rows = query.getResultList();
        List<PendingChunk> pending = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            pending.add(new PendingChunk(PageTextChunkRepositoryImpl.toUuid(row[0]), (String) row[1]));
        }
        return pending;
    }

    @Override
    public long countPendingChunks(ChunkType chunkType, String modelName) {
        String sql = "SELECT COUNT(*) FROM " + chunkType.getTableName() + " c " +
                "WHERE NOT EXISTS (SELECT 1 FROM embedding e WHERE e.chunk_id = c.chunk_id " +
                "AND e.chunk_type = :chunkType AND e.model_name = :model AND e.is_current = true)";

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("chunkType", chunkType.getValue());
        query.setParameter("model", modelName);
        return ((Number) query.getSingleResult()).longValue();
    }

    @Override
    public void insertCurrent(UUID chunkId, ChunkType chunkType, String modelName, String modelVersion, float[] vector) {
        String sql = "INSERT INTO embedding (embedding_id, chunk_id, chunk_type, model_name, model_version, dims, " +
                "embedding, is_current, created_at) " +
                "VALUES (:id, :chunkId, :chunkType, :model, :version, :dims, CAST(:vector AS vector), true, now())";

        entityManager.createNativeQuery(sql)
                .setParameter("id", UUID.randomUUID())
                .setParameter("chunkId", chunkId)
                .setParameter("chunkType", chunkType.getValue())
                .setParameter("model", modelName)
                .setParameter("version", modelVersion)
                .setParameter("dims", vector.length)
                .setParameter("vector", VectorFormat.toLiteral(vector))
                .executeUpdate();
    }
}
