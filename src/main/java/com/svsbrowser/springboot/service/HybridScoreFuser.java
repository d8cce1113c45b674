package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.RetrievedChunk;
import com.svsbrowser.springboot.model.ScoredChunkRow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Merges full-text and vector candidates into one ranking.
 *
 * <p>Full-text ranks are divided by the best rank of the batch; vector scores are used as they are.
 * A chunk's score is {@code keywordWeight * keyword + vectorWeight * vector}, multiplied by
 * {@value #BOTH_SIDES_BOOST} when both searches returned it and capped at 1.0.</p>
 */
@Component
public class HybridScoreFuser {

    public static final double BOTH_SIDES_BOOST = 1.2;

    public List<RetrievedChunk> fuse(List<ScoredChunkRow> keywordRows,
                                     List<ScoredChunkRow> vectorRows,
                                     double keywordWeight,
                                     double vectorWeight,
                                     double minScore,
                                     int topK) {
        Map<UUID, ScoredChunkRow> keyword = byChunkId(normalizeByMax(keywordRows));
        Map<UUID, ScoredChunkRow> vector = byChunkId(vectorRows);

        Set<UUID> chunkIds = new LinkedHashSet<>(keyword.keySet());
        chunkIds.addAll(vector.keySet());

        List<RetrievedChunk> combined = new ArrayList<>(chunkIds.size());
        for (UUID chunkId : chunkIds) {
            ScoredChunkRow keywordRow = keyword.get(chunkId);
            ScoredChunkRow vectorRow = vector.get(chunkId);
            double keywordScore = keywordRow != null ? keywordRow.getScore() : 0.0;
            double vectorScore = vectorRow != null ? vectorRow.getScore() : 0.0;

            double score = keywordWeight * keywordScore + vectorWeight * vectorScore;
            if (keywordRow != null && vectorRow != null) {
                score *= BOTH_SIDES_BOOST;
            }

            ScoredChunkRow source = vectorRow != null ? vectorRow : keywordRow;
            combined.add(RetrievedChunk.builder()
                    .chunkId(chunkId)
                    .svsId(source.getSvsId())
                    .pageTitle(source.getPageTitle())
                    .section(source.getSection())
                    .content(source.getContent())
                    .keywordScore(keywordScore)
                    .vectorScore(vectorScore)
                    .combinedScore(Math.min(score, 1.0))
                    .build());
        }

        return combined.stream()
                .filter(chunk -> chunk.getCombinedScore() >= minScore)
                .sorted(Comparator.comparingDouble(RetrievedChunk::getCombinedScore).reversed())
                .limit(Math.max(0, topK))
                .collect(Collectors.toList());
    }

    static List<ScoredChunkRow> normalizeByMax(List<ScoredChunkRow> rows) {
        double max = rows.stream().mapToDouble(ScoredChunkRow::getScore).max().orElse(0.0);
        return rows.stream()
                .map(row -> row.withScore(max > 0 ? row.getScore() / max : 0.0))
                .collect(Collectors.toList());
    }

    private static Map<UUID, ScoredChunkRow> byChunkId(List<ScoredChunkRow> rows) {
        Map<UUID, ScoredChunkRow> map = new LinkedHashMap<>();
        for (ScoredChunkRow row : rows) {
            map.putIfAbsent(row.getChunkId(), row);
        }
        return map;
    }
}
