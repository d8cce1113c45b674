package com.svsbrowser.springboot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.svsbrowser.springboot.model.PageRelation;
import com.svsbrowser.springboot.model.ParsedAsset;
import com.svsbrowser.springboot.model.ParsedPage;
import com.svsbrowser.springboot.model.RelatedPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static com.svsbrowser.springboot.service.HtmlSupport.cleanText;
import static com.svsbrowser.springboot.service.HtmlSupport.textOf;

/**
 * Parses an SVS page into a {@link ParsedPage}. Does no I/O and never throws on odd markup;
 * whatever cannot be found comes back null or empty.
 */
@Service
public class HtmlPageParser {

    public static final String UNTITLED = "Untitled";

    private static final int MIN_PARAGRAPH_LENGTH = 20;
    private static final int DEDUP_PREFIX_LENGTH = 100;
    private static final int MAX_SUMMARY_LENGTH = 500;
    private static final String CORRUPT_DESCRIPTION_MARKER = "||";

    private static final Pattern STANDALONE_DESCRIPTION_CLASS = Pattern.compile("px-0|description");
    private static final Pattern DOWNLOAD_NOTES_CLASS = Pattern.compile("download-notes|usage");
    private static final Pattern RELATED_SECTION_ID = Pattern.compile("related|see.*also", Pattern.CASE_INSENSITIVE);

    // Tried in order; the first that parses wins
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ENGLISH));

    private final ObjectMapper objectMapper;
    private final CreditExtractor creditExtractor;
    private final AssetExtractor assetExtractor;
    private final String baseUrl;

    @Autowired
    public HtmlPageParser(ObjectMapper objectMapper,
                          CreditExtractor creditExtractor,
                          AssetExtractor assetExtractor,
                          @Value("${app.source.base-url:https://svs.gsfc.nasa.gov}") String baseUrl) {
        this.objectMapper = objectMapper;
        this.creditExtractor = creditExtractor;
        this.assetExtractor = assetExtractor;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public ParsedPage parse(String html, long svsId) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUrl + "/");
        JsonNode jsonLd = HtmlSupport.jsonLd(doc, objectMapper);

        String description = extractDescription(doc, jsonLd);
        List<String> tags = extractTags(doc);

        ParsedPage.ParsedPageBuilder page = ParsedPage.builder()
                .svsId(svsId)
                .title(extractTitle(doc))
                .description(description)
                .summary(summarize(description))
                .contentJson(extractRichContent(doc))
                .publishedDate(extractPublishedDate(doc))
                .thumbnailUrl(extractThumbnail(doc, jsonLd))
                .downloadNotes(extractDownloadNotes(doc))
                .credits(creditExtractor.extract(doc, jsonLd))
                .tags(tags)
                .missions(TagVocabulary.classify(tags, TagVocabulary.MISSIONS))
                .targets(TagVocabulary.classify(tags, TagVocabulary.TARGETS))
                .domains(TagVocabulary.classify(tags, TagVocabulary.DOMAINS))
                .assets(extractAssets(doc))
                .relatedPages(extractRelatedPages(doc, svsId));
        return page.build();
    }

    String extractTitle(Document doc) {
        String title = textOf(doc.selectFirst("h1#title"));
        if (!title.isEmpty()) {
            return title;
        }
        title = textOf(doc.selectFirst("h1.title"));
        if (!title.isEmpty()) {
            return title;
        }
        Element titleTag = doc.selectFirst("title");
        if (titleTag != null) {
            title = textOf(titleTag);
            int prefix = title.indexOf("NASA SVS |");
            if (prefix >= 0) {
                title = title.substring(prefix + "NASA SVS |".length()).trim();
            }
            int suffix = title.indexOf(" - NASA");
            if (suffix >= 0) {
                title = title.substring(0, suffix).trim();
            }
            if (!title.isEmpty()) {
                return title;
            }
        }
        return UNTITLED;
    }

    String extractDescription(Document doc, JsonNode jsonLd) {
        List<String> paragraphs = new ArrayList<>();
        for (Element group : HtmlSupport.mediaGroups(doc)) {
            for (Element paragraph : descriptionParagraphs(group)) {
                paragraphs.add(cleanText(paragraph.text()));
            }
        }
        if (!paragraphs.isEmpty()) {
            Set<String> seen = new HashSet<>();
            List<String> unique = new ArrayList<>();
            for (String text : paragraphs) {
                String key = text.toLowerCase(Locale.ROOT).trim();
                if (key.length() > DEDUP_PREFIX_LENGTH) {
                    key = key.substring(0, DEDUP_PREFIX_LENGTH);
                }
                if (seen.add(key)) {
                    unique.add(text);
                }
            }
            return String.join(" ", unique);
        }

        String fallback = HtmlSupport.jsonText(jsonLd, "description");
        if (fallback != null && !fallback.contains(CORRUPT_DESCRIPTION_MARKER)) {
            return fallback;
        }
        return null;
    }

    /**
     * {@code {"format_version":1,"sections":[{"type":"description","paragraphs":[{"html","text"}]}]}},
     * one section per media group, or null when no group has qualifying text.
     */
    Map<String, Object> extractRichContent(Document doc) {
        List<Map<String, Object>> sections = new ArrayList<>();
        for (Element group : HtmlSupport.mediaGroups(doc)) {
            List<Map<String, String>> paragraphs = new ArrayList<>();
            Set<String> texts = new HashSet<>();
            for (Element paragraph : descriptionParagraphs(group)) {
                String text = cleanText(paragraph.text());
                if (!texts.add(text)) {
                    continue;
                }
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("html", HtmlSupport.sanitizeParagraph(paragraph, baseUrl + "/"));
                entry.put("text", text);
                paragraphs.add(entry);
            }
            if (!paragraphs.isEmpty()) {
                Map<String, Object> section = new LinkedHashMap<>();
                section.put("type", "description");
                section.put("paragraphs", paragraphs);
                sections.add(section);
            }
        }
        if (sections.isEmpty()) {
            return null;
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("format_version", 1);
        content.put("sections", sections);
        return content;
    }

    /**
     * Paragraphs of a media group's card body and of its standalone description block, skipping
     * download menus and fragments shorter than {@value #MIN_PARAGRAPH_LENGTH} characters.
     */
    private List<Element> descriptionParagraphs(Element group) {
        Set<Element> candidates = new LinkedHashSet<>();
        Element cardBody = group.selectFirst("div.card-body");
        if (cardBody != null) {
            candidates.addAll(cardBody.select("p"));
        }
        Elements standalone = HtmlSupport.withClassMatching(group, "div", STANDALONE_DESCRIPTION_CLASS);
        if (!standalone.isEmpty()) {
            candidates.addAll(standalone.first().select("p"));
        }
        List<Element> paragraphs = new ArrayList<>();
        for (Element paragraph : candidates) {
            if (HtmlSupport.insideDropdown(paragraph)) {
                continue;
            }
            if (cleanText(paragraph.text()).length() >= MIN_PARAGRAPH_LENGTH) {
                paragraphs.add(paragraph);
            }
        }
        return paragraphs;
    }

    static String summarize(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        int end = description.indexOf(". ");
        String summary = end >= 0 ? description.substring(0, end) : description;
        if (!summary.endsWith(".")) {
            summary = summary + ".";
        }
        return summary.length() > MAX_SUMMARY_LENGTH ? summary.substring(0, MAX_SUMMARY_LENGTH) : summary;
    }

    /**
     * The {@code article:published_time} meta tag wins over a {@code <time>} element.
     */
    LocalDate extractPublishedDate(Document doc) {
        Element meta = doc.selectFirst("meta[property=article:published_time]");
        if (meta != null && !meta.attr("content").isBlank()) {
            return parseDate(meta.attr("content"));
        }
        Element time = doc.selectFirst("time");
        if (time != null) {
            String value = time.hasAttr("datetime") && !time.attr("datetime").isBlank()
                    ? time.attr("datetime")
                    : time.text();
            return parseDate(value);
        }
        return null;
    }

    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = parseOrNull(text, format);
            if (date != null) {
                return date;
            }
        }
        // Fractional seconds or odd zones after a plain local timestamp
        return text.length() >= 19 ? parseOrNull(text.substring(0, 19), DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null;
    }

    private static LocalDate parseOrNull(String text, DateTimeFormatter format) {
        try {
            return LocalDate.from(format.parse(text));
        } catch (DateTimeException e) {
            return null;
        }
    }

    String extractThumbnail(Document doc, JsonNode jsonLd) {
        Element ogImage = doc.selectFirst("meta[property=og:image]");
        if (ogImage != null && !ogImage.attr("content").isBlank()) {
            return HtmlSupport.resolveUrl(baseUrl, ogImage.attr("content"));
        }
        Element video = doc.selectFirst("video[poster]");
        if (video != null && !video.attr("poster").isBlank()) {
            return HtmlSupport.resolveUrl(baseUrl, video.attr("poster"));
        }
        return HtmlSupport.resolveUrl(baseUrl, HtmlSupport.jsonText(jsonLd, "thumbnailUrl"));
    }

    /**
     * {@code article:tag} metas plus the comma separated keywords meta, without duplicates.
     */
    List<String> extractTags(Document doc) {
        Set<String> tags = new LinkedHashSet<>();
        for (Element meta : doc.select("meta[property=article:tag]")) {
            String value = meta.attr("content").trim();
            if (!value.isEmpty()) {
                tags.add(value);
            }
        }
        Element keywords = doc.selectFirst("meta[name=keywords]");
        if (keywords != null) {
            for (String keyword : keywords.attr("content").split(",")) {
                String value = keyword.trim();
                if (!value.isEmpty()) {
                    tags.add(value);
                }
            }
        }
        return new ArrayList<>(tags);
    }

    List<ParsedAsset> extractAssets(Document doc) {
        List<ParsedAsset> assets = new ArrayList<>();
        for (Element group : HtmlSupport.mediaGroups(doc)) {
            ParsedAsset asset = assetExtractor.extract(group, assets.size(), baseUrl);
            if (asset != null) {
                assets.add(asset);
            }
        }
        return assets;
    }

    List<RelatedPage> extractRelatedPages(Document doc, long svsId) {
        Set<RelatedPage> related = new LinkedHashSet<>();

        Element container = findRelatedContainer(doc);
        if (container != null) {
            for (Element link : container.select("a[href]")) {
                addRelation(related, link, svsId, PageRelation.RELATED);
            }
        }

        Element nav = doc.selectFirst("nav.row");
        if (nav != null) {
            for (Element link : nav.select("a[href]")) {
                if (!textOf(link).startsWith("bi-")) {
                    addRelation(related, link, svsId, PageRelation.SEQUENCE);
                }
            }
        }
        return new ArrayList<>(related);
    }

    private void addRelation(Set<RelatedPage> related, Element link, long svsId, String type) {
        Long targetId = HtmlSupport.trailingPageId(link.attr("href"));
        String title = textOf(link);
        if (targetId != null && targetId != svsId && !title.isEmpty()) {
            related.add(new RelatedPage(targetId, title, type));
        }
    }

    private Element findRelatedContainer(Document doc) {
        for (Element section : doc.select("section[id]")) {
            if (RELATED_SECTION_ID.matcher(section.id()).find()) {
                return section;
            }
        }
        for (Element heading : doc.select("h2, h3, h4")) {
            String text = heading.text().toLowerCase(Locale.ROOT);
            if (!text.contains("related") && !text.contains("see also")) {
                continue;
            }
            Element section = heading.closest("section");
            if (section != null) {
                return section;
            }
            for (Element sibling : heading.nextElementSiblings()) {
                if (sibling.normalName().equals("ul")) {
                    return sibling;
                }
                Element nested = sibling.selectFirst("ul");
                if (nested != null) {
                    return nested;
                }
            }
            return null;
        }
        return null;
    }

    String extractDownloadNotes(Document doc) {
        Elements notes = HtmlSupport.withClassMatching(doc, "div", DOWNLOAD_NOTES_CLASS);
        if (notes.isEmpty()) {
            return null;
        }
        String text = textOf(notes.first());
        return text.isEmpty() ? null : text;
    }
}
