package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.TextChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkingServiceTest {

    private ContentHashingService hashingService;
    private TextChunkingService chunkingService;

    @BeforeEach
    void setUp() {
        hashingService = new ContentHashingService();
        chunkingService = new TextChunkingService(hashingService);
    }

    @Test
    void blankInputYieldsNoChunks() {
        assertThat(chunkingService.chunk(null, "description")).isEmpty();
        assertThat(chunkingService.chunk("   \n\t ", "description")).isEmpty();
    }

    @Test
    void textBelowMinimumIsDropped() {
        assertThat(chunkingService.chunk("Too short to be useful on its own.", "description")).isEmpty();
    }

    @Test
    void textUnderMaximumBecomesSingleChunk() {
        String text = sentences(4);

        List<TextChunk> chunks = chunkingService.chunk("  " + text + "  ", "description");

        assertThat(chunks).hasSize(1);
        TextChunk chunk = chunks.get(0);
        assertThat(chunk.getContent()).isEqualTo(text);
        assertThat(chunk.getSection()).isEqualTo("description");
        assertThat(chunk.getChunkIndex()).isZero();
        assertThat(chunk.getTokenCount()).isEqualTo(text.length() / 4);
        assertThat(chunk.getContentHash()).isEqualTo(hashingService.hash(text)).hasSize(64);
    }

    @Test
    void longTextChunksStayWithinTokenBounds() {
        List<TextChunk> chunks = chunkingService.chunk(sentences(80), "description");

        assertThat(chunks).hasSizeGreaterThan(2);
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.getTokenCount()).isBetween(50, 768);
            assertThat(chunk.getTokenCount()).isEqualTo(TextChunkingService.estimateTokens(chunk.getContent()));
        });
        assertThat(chunks).extracting(TextChunk::getChunkIndex)
                .containsExactlyElementsOf(IntStream.range(0, chunks.size()).boxed().collect(Collectors.toList()));
    }

    @Test
    void adjacentChunksShareOverlapTail() {
        List<TextChunk> chunks = chunkingService.chunk(sentences(80), "description");

        for (int i = 0; i + 1 < chunks.size(); i++) {
            String tail = chunkingService.overlapTail(chunks.get(i).getContent()).trim();
            assertThat(chunks.get(i + 1).getContent()).startsWith(tail);
            assertThat(TextChunkingService.estimateTokens(tail)).isGreaterThanOrEqualTo(60);
        }
    }

    @Test
    void chunkingIsDeterministic() {
        String text = sentences(60);

        assertThat(chunkingService.chunk(text, "credits")).isEqualTo(chunkingService.chunk(text, "credits"));
    }

    @Test
    void overlongSentenceIsSplitOnClauses() {
        String clause = "the visualization shows ice thinning along the coast of Greenland in the late summer";
        String sentence = IntStream.range(0, 60).mapToObj(i -> clause + " " + i).collect(Collectors.joining(", "));

        List<TextChunk> chunks = chunkingService.chunk(sentence, "caption");

        assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.getTokenCount()).isLessThanOrEqualTo(768));
        assertThat(chunks.get(0).getContent()).startsWith(clause + " 0");
        assertThat(chunks.get(chunks.size() - 1).getContent()).endsWith(clause + " 59");
    }

    @Test
    void shortSentenceBeforeOverlongSentenceIsNotEmittedAlone() {
        String clause = "the plume drifts east over the Atlantic and thins out near the Azores";
        String overlong = IntStream.range(0, 45).mapToObj(i -> clause + " " + i).collect(Collectors.joining(", "));
        String text = "Short intro sentence here. " + "The " + overlong + ".";

        List<TextChunk> chunks = chunkingService.chunk(text, "description");

        assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.getTokenCount()).isBetween(50, 768));
        assertThat(chunks.get(0).getContent()).startsWith("Short intro sentence here.");
        assertThat(chunks.get(chunks.size() - 1).getContent()).endsWith(clause + " 44.");
    }

    @Test
    void undersizedPiecesFoldIntoTheirNeighbour() {
        String small = "Tail clause of ten tokens or so.";
        String large = "word ".repeat(600).trim();

        List<String> merged = chunkingService.mergeUndersized(List.of(large, small));
        List<String> rebalanced = chunkingService.mergeUndersized(List.of(small, "word ".repeat(610).trim()));

        assertThat(merged).containsExactly(large + " " + small);
        assertThat(rebalanced).hasSize(2);
        assertThat(rebalanced).allSatisfy(piece ->
                assertThat(TextChunkingService.estimateTokens(piece)).isBetween(50, 768));
        assertThat(rebalanced.get(0)).startsWith(small);
    }

    @Test
    void sectionIndicesRestartPerSection() {
        Map<String, String> sections = new LinkedHashMap<>();
        sections.put("description", sentences(80));
        sections.put("credits", sentences(4));

        List<TextChunk> chunks = chunkingService.chunkSections(sections);

        List<TextChunk> credits = chunks.stream()
                .filter(chunk -> chunk.getSection().equals("credits"))
                .collect(Collectors.toList());
        assertThat(credits).hasSize(1);
        assertThat(credits.get(0).getChunkIndex()).isZero();
        assertThat(chunks.get(0).getSection()).isEqualTo("description");
        assertThat(chunks.get(0).getChunkIndex()).isZero();
    }

    @Test
    void rejectsInconsistentSizes() {
        assertThatThrownBy(() -> new TextChunkingService(hashingService, 100, 50, 10, 20))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static String sentences(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "Sentence number " + i + " describes how the Arctic sea ice extent changed during the summer melt season.")
                .collect(Collectors.joining(" "));
    }
}
