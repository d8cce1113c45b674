package com.svsbrowser.springboot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Safelist;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small helpers shared by the page, asset and credit extractors.
 */
final class HtmlSupport {

    private static final Logger logger = LoggerFactory.getLogger(HtmlSupport.class);

    static final Pattern MEDIA_GROUP_ID = Pattern.compile("media_group_\\d+");
    static final Pattern TRAILING_PAGE_ID = Pattern.compile("/(\\d+)/?$");
    static final Pattern TRAILING_ORG = Pattern.compile("\\(([^)]+)\\)\\s*$");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern INTERNAL_LINK = Pattern.compile("^/(\\d+)/?$");

    private static final Safelist RICH_TEXT = Safelist.none()
            .addTags("p", "br", "a", "strong", "b", "em", "i", "ul", "ol", "li", "span")
            .addAttributes("a", "href", "title", "data-internal")
            .addProtocols("a", "href", "http", "https", "mailto")
            .preserveRelativeLinks(true);
    private static final Document.OutputSettings COMPACT = new Document.OutputSettings().prettyPrint(false);

    private HtmlSupport() {}

    static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    static String textOf(Element element) {
        return element == null ? "" : cleanText(element.text());
    }

    static Elements mediaGroups(Document doc) {
        Elements groups = new Elements();
        for (Element section : doc.select("section[id]")) {
            if (MEDIA_GROUP_ID.matcher(section.id()).find()) {
                groups.add(section);
            }
        }
        return groups;
    }

    /**
     * Elements matching {@code cssQuery} whose class attribute contains a match of {@code classPattern}.
     */
    static Elements withClassMatching(Element root, String cssQuery, Pattern classPattern) {
        Elements matches = new Elements();
        for (Element element : root.select(cssQuery)) {
            if (classPattern.matcher(element.className()).find()) {
                matches.add(element);
            }
        }
        return matches;
    }

    /**
     * Sanitized HTML of a paragraph. Links to other pages ({@code /1234/}) are rewritten to the
     * in-app route and flagged with {@code data-internal="true"}. Links that do not resolve to
     * http, https or mailto against {@code baseUri} lose their href. The source element is not modified.
     */
    static String sanitizeParagraph(Element paragraph, String baseUri) {
        Element copy = paragraph.clone();
        for (Element link : copy.select("a[href]")) {
            Matcher matcher = INTERNAL_LINK.matcher(link.attr("href").trim());
            if (matcher.matches()) {
                link.attr("href", "/svs/" + matcher.group(1));
                link.attr("data-internal", "true");
            }
        }
        return Jsoup.clean(copy.outerHtml(), baseUri, RICH_TEXT, COMPACT);
    }

    static boolean insideDropdown(Element element) {
        for (Element parent : element.parents()) {
            if (parent.hasClass("dropdown-menu")) {
                return true;
            }
        }
        return false;
    }

    static Long trailingPageId(String href) {
        if (href == null) {
            return null;
        }
        Matcher matcher = TRAILING_PAGE_ID.matcher(href.trim());
        if (!matcher.find()) {
            return null;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Resolves a possibly relative URL against the site root. Returns the input unchanged when
     * it cannot be parsed.
     */
    static String resolveUrl(String baseUrl, String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URL(new URL(baseUrl + "/"), url.trim()).toString();
        } catch (MalformedURLException e) {
            return url.trim();
        }
    }

    /**
     * The first JSON-LD object on the page, or null when there is none or it does not parse.
     */
    static JsonNode jsonLd(Document doc, ObjectMapper objectMapper) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            try {
                JsonNode node = objectMapper.readTree(script.data());
                if (node != null && node.isArray() && node.size() > 0) {
                    node = node.get(0);
                }
                if (node != null && node.isObject()) {
                    return node;
                }
            } catch (JsonProcessingException e) {
                logger.debug("Skipping unparseable JSON-LD block: {}", e.getMessage());
            }
        }
        return null;
    }

    static String jsonText(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> items = new ArrayList<>();
        if (node == null || node.isNull()) {
            return items;
        }
        if (node.isArray()) {
            node.forEach(items::add);
        } else {
            items.add(node);
        }
        return items;
    }
}
