package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.PageSearchRow;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class SvsPageRepositoryImpl implements SvsPageRepositoryCustom {

    private static final String PAGE_DOCUMENT =
            "to_tsvector('english', COALESCE(title, '') || ' ' || COALESCE(description, '') || ' ' || COALESCE(summary, ''))";

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<PageSearchRow> searchPagesFullText(String textQuery, int limit) {
        String sql = "SELECT svs_id, title, description, summary FROM svs_page " +
                "WHERE status = 'active' AND " + PAGE_DOCUMENT + " @@ plainto_tsquery('english', :query) " +
                "ORDER BY ts_rank(" + PAGE_DOCUMENT + ", plainto_tsquery('english', :query)) DESC";

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("query", textQuery);
        query.setMaxResults(Math.max(1, limit));

        @SuppressWarnings("unchecked")
        List<Object[]> rows = query.getResultList();
        List<PageSearchRow> results = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            results.add(new PageSearchRow(((Number) row[0]).longValue(),
                    (String) row[1], (String) row[2], (String) row[3]));
        }
        return results;
    }
}
