package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.ScoredChunkRow;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Repository
public class PageTextChunkRepositoryImpl implements PageTextChunkRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<ScoredChunkRow> keywordSearch(String textQuery, int limit) {
        String sql = "SELECT c.chunk_id, c.svs_id, p.title, c.section, c.content, " +
                "ts_rank(to_tsvector('english', c.content), websearch_to_tsquery('english', :query)) AS score " +
                "FROM page_text_chunk c JOIN svs_page p ON p.svs_id = c.svs_id " +
                "WHERE to_tsvector('english', c.content) @@ websearch_to_tsquery('english', :query) " +
                "ORDER BY score DESC";

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("query", textQuery);
        query.setMaxResults(Math.max(1, limit));
        return toRows(query);
    }

    @Override
    public List<ScoredChunkRow> vectorSearch(String vectorLiteral, String modelName, int limit) {
        String sql = "SELECT c.chunk_id, c.svs_id, p.title, c.section, c.content, " +
                "1 - (e.embedding <=> CAST(:vector AS vector)) AS similarity " +
                "FROM page_text_chunk c " +
                "JOIN embedding e ON e.chunk_id = c.chunk_id AND e.chunk_type = 'page' " +
                "AND e.is_current = true AND e.model_name = :model " +
                "JOIN svs_page p ON p.svs_id = c.svs_id " +
                "ORDER BY e.embedding <=> CAST(:vector AS vector)";

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("vector", vectorLiteral);
        query.setParameter("model", modelName);
        query.setMaxResults(Math.max(1, limit));
        return toRows(query);
    }

    @Override
    public List<ScoredChunkRow> vectorSearchWithinPage(String vectorLiteral, String modelName, long svsId, int limit) {
        String sql = "SELECT c.chunk_id, c.svs_id, p.title, c.section, c.content, " +
                "1 - (e.embedding <=> CAST(:vector AS vector)) AS similarity " +
                "FROM page_text_chunk c " +
                "JOIN embedding e ON e.chunk_id = c.chunk_id AND e.chunk_type = 'page' " +
                "AND e.is_current = true AND e.model_name = :model " +
                "JOIN svs_page p ON p.svs_id = c.svs_id " +
                "WHERE c.svs_id = :svsId " +
                "ORDER BY e.embedding <=> CAST(:vector AS vector)";

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("vector", vectorLiteral);
        query.setParameter("model", modelName);
        query.setParameter("svsId", svsId);
        query.setMaxResults(Math.max(1, limit));
        return toRows(query);
    }

    private List<ScoredChunkRow> toRows(Query query) {
        @SuppressWarnings("unchecked")
        List<Object[]> rows = query.getResultList();
        List<ScoredChunkRow> results = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            results.add(new ScoredChunkRow(
                    toUuid(row[0]),
                    ((Number) row[1]).longValue(),
                    (String) row[2],
                    (String) row[3],
                    (String) row[4],
                    row[5] == null ? 0.0 : ((Number) row[5]).doubleValue()));
        }
        return results;
    }

    static UUID toUuid(Object value) {
        if (value instanceof UUID uuid) {
            return uuid;
        }
        return UUID.fromString(String.valueOf(value));
    }
}
