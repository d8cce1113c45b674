package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.TextChunk;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits section text into overlapping, sentence-aligned chunks sized for embedding.
 *
 * <p>Token counts are estimated as {@code length / 4}. The same estimate drives every boundary
 * decision and is stored on each chunk.</p>
 */
@Service
public class TextChunkingService {

    public static final int CHARS_PER_TOKEN = 4;

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+(?=[A-Z])|(?<=[.!?])\\s*$");
    private static final Pattern CLAUSE_BOUNDARY = Pattern.compile("[,;:]\\s+");

    private final ContentHashingService hashingService;
    private final int targetTokens;
    private final int maxTokens;
    private final int overlapTokens;
    private final int minTokens;

    @Autowired
    public TextChunkingService(ContentHashingService hashingService,
                               @Value("${app.chunking.target-tokens:512}") int targetTokens,
                               @Value("${app.chunking.max-tokens:768}") int maxTokens,
                               @Value("${app.chunking.overlap-tokens:64}") int overlapTokens,
                               @Value("${app.chunking.min-tokens:50}") int minTokens) {
        if (minTokens > targetTokens || targetTokens > maxTokens) {
            throw new IllegalArgumentException("Chunk sizes must satisfy min <= target <= max");
        }
        this.hashingService = hashingService;
        this.targetTokens = targetTokens;
        this.maxTokens = maxTokens;
        this.overlapTokens = Math.max(0, overlapTokens);
        this.minTokens = Math.max(0, minTokens);
    }

    public TextChunkingService(ContentHashingService hashingService) {
        this(hashingService, 512, 768, 64, 50);
    }

    public static int estimateTokens(String text) {
        return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
    }

    /**
     * Chunks each section independently; indices restart at zero for every section.
     *
     * @param sections section label to text, iterated in map order
     */
    public List<TextChunk> chunkSections(Map<String, String> sections) {
        List<TextChunk> chunks = new ArrayList<>();
        for (Map.Entry<String, String> entry : sections.entrySet()) {
            chunks.addAll(chunk(entry.getValue(), entry.getKey()));
        }
        return chunks;
    }

    public List<TextChunk> chunk(String text, String section) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        String trimmed = text.trim();
        int totalTokens = estimateTokens(trimmed);
        if (totalTokens <= maxTokens) {
            if (totalTokens < minTokens) {
                return Collections.emptyList();
            }
            return List.of(toChunk(trimmed, section, 0));
        }

        List<String> contents = new ArrayList<>();
        String current = "";
        String seed = "";

        for (String sentence : splitSentences(trimmed)) {
            int sentenceTokens = estimateTokens(sentence);

            if (sentenceTokens > maxTokens) {
                if (!current.isEmpty()) {
                    contents.add(current);
                }
                contents.addAll(splitLongSentence(sentence));
                current = "";
                seed = "";
                continue;
            }

            int currentTokens = estimateTokens(current);
            if (!current.isEmpty() && currentTokens + sentenceTokens > targetTokens && currentTokens >= minTokens) {
                contents.add(current);
                String overlap = overlapTail(current);
                String seeded = overlap + sentence;
                if (estimateTokens(seeded) <= maxTokens) {
                    current = seeded;
                    seed = overlap;
                } else {
                    current = sentence;
                    seed = "";
                }
                continue;
            }

            String combined = current.isEmpty() ? sentence : current + " " + sentence;
            if (estimateTokens(combined) > maxTokens) {
                // current is under the minimum and cannot stand alone
                contents.addAll(splitLongSentence(combined));
                current = "";
                seed = "";
            } else {
                current = combined;
            }
        }

        if (!current.isBlank()) {
            if (estimateTokens(current) >= minTokens || contents.isEmpty()) {
                contents.add(current);
            } else {
                String remainder = !seed.isEmpty() && current.startsWith(seed)
                        ? current.substring(seed.length())
                        : current;
                int lastIndex = contents.size() - 1;
                String merged = contents.get(lastIndex) + " " + remainder.trim();
                if (estimateTokens(merged) <= maxTokens) {
                    contents.set(lastIndex, merged);
                } else {
                    contents.add(remainder.trim());
                }
            }
        }

        List<String> pieces = mergeUndersized(contents);
        List<TextChunk> chunks = new ArrayList<>(pieces.size());
        for (String content : pieces) {
            chunks.add(toChunk(content, section, chunks.size()));
        }
        return chunks;
    }

    /**
     * Folds every piece under the minimum into its predecessor. When the pair would exceed the
     * maximum it is cut in two at the word boundary nearest its middle instead.
     */
    List<String> mergeUndersized(List<String> contents) {
        List<String> result = new ArrayList<>(contents.size());
        for (String content : contents) {
            String value = content.trim();
            if (value.isEmpty()) {
                continue;
            }
            int lastIndex = result.size() - 1;
            if (lastIndex < 0
                    || (estimateTokens(result.get(lastIndex)) >= minTokens && estimateTokens(value) >= minTokens)) {
                result.add(value);
                continue;
            }
            String merged = result.get(lastIndex) + " " + value;
            if (estimateTokens(merged) <= maxTokens) {
                result.set(lastIndex, merged);
            } else {
                result.remove(lastIndex);
                result.addAll(splitNearMiddle(merged));
            }
        }
        return result;
    }

    private static List<String> splitNearMiddle(String text) {
        int middle = text.length() / 2;
        int cut = text.lastIndexOf(' ', middle);
        if (cut <= 0) {
            cut = text.indexOf(' ', middle);
        }
        if (cut <= 0) {
            cut = middle;
        }
        return List.of(text.substring(0, cut).trim(), text.substring(cut).trim());
    }

    private TextChunk toChunk(String content, String section, int index) {
        return new TextChunk(content, section, index, estimateTokens(content), hashingService.hash(content));
    }

    private List<String> splitSentences(String text) {
        List<String> sentences = new ArrayList<>();
        for (String sentence : SENTENCE_BOUNDARY.split(text)) {
            String value = sentence.trim();
            if (!value.isEmpty()) {
                sentences.add(value);
            }
        }
        return sentences;
    }

    /**
     * Splits an over-long sentence on clause punctuation. Pieces carry no overlap.
     */
    private List<String> splitLongSentence(String sentence) {
        List<String> pieces = new ArrayList<>();
        String current = "";
        for (String rawPart : CLAUSE_BOUNDARY.split(sentence)) {
            String part = rawPart.trim();
            if (part.isEmpty()) {
                continue;
            }
            if (estimateTokens(part) > maxTokens) {
                if (!current.isEmpty()) {
                    pieces.add(current);
                    current = "";
                }
                pieces.addAll(splitOnWords(part));
                continue;
            }
            String candidate = current.isEmpty() ? part : current + ", " + part;
            if (estimateTokens(candidate) <= maxTokens) {
                current = candidate;
            } else {
                pieces.add(current);
                current = part;
            }
        }
        if (!current.isEmpty()) {
            pieces.add(current);
        }
        return pieces;
    }

    // Last resort for a clause with no punctuation at all.
    private List<String> splitOnWords(String text) {
        int maxChars = maxTokens * CHARS_PER_TOKEN;
        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split("\\s+")) {
            while (word.length() > maxChars) {
                if (current.length() > 0) {
                    pieces.add(current.toString());
                    current.setLength(0);
                }
                pieces.add(word.substring(0, maxChars));
                word = word.substring(maxChars);
            }
            if (current.length() > 0 && current.length() + 1 + word.length() > maxChars) {
                pieces.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        if (current.length() > 0) {
            pieces.add(current.toString());
        }
        return pieces;
    }

    /**
     * The last {@code overlapTokens} worth of text, cut forward to the next word boundary,
     * followed by a space.
     */
    String overlapTail(String text) {
        int overlapChars = overlapTokens * CHARS_PER_TOKEN;
        if (overlapChars == 0) {
            return "";
        }
        if (text.length() <= overlapChars) {
            return text + " ";
        }
        String tail = text.substring(text.length() - overlapChars);
        int space = tail.indexOf(' ');
        if (space > 0) {
            tail = tail.substring(space + 1);
        }
        return tail + " ";
    }
}
