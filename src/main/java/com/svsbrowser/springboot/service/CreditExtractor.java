package com.svsbrowser.springboot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.svsbrowser.springboot.model.ParsedCredit;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.svsbrowser.springboot.service.HtmlSupport.TRAILING_ORG;
import static com.svsbrowser.springboot.service.HtmlSupport.textOf;

/**
 * Pulls credits out of a page. Each strategy reads one place where SVS pages put attribution and
 * is independent of the others; {@link #extract} runs them all and keeps the first record for
 * every (role, name) pair.
 */
@Component
public class CreditExtractor {

    private static final Pattern CREDIT_LIST_CLASS = Pattern.compile("hstack.*list-unstyled|credit");
    private static final Pattern HEADER_CREDIT_CLASS = Pattern.compile("credit|author");
    private static final Pattern ROLE_AND_NAME = Pattern.compile("^([^:]+):\\s*(.+)$");
    private static final Pattern CREDIT_SENTENCE = Pattern.compile("^Credits?:\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CREDIT_SEPARATOR = Pattern.compile("[;,]");
    private static final List<String> ROLE_KEYWORDS =
            List.of("animator", "visualiz", "lead", "director", "producer", "scientist");

    public List<ParsedCredit> extract(Document doc, JsonNode jsonLd) {
        List<ParsedCredit> candidates = new ArrayList<>();
        candidates.addAll(fromJsonLd(jsonLd));
        candidates.addAll(fromCreditLists(doc));
        candidates.addAll(fromHeader(doc));
        candidates.addAll(fromCreditsSection(doc));
        candidates.addAll(fromCaptionSentences(doc));
        return deduplicate(candidates);
    }

    public static List<ParsedCredit> deduplicate(List<ParsedCredit> credits) {
        Map<String, ParsedCredit> unique = new LinkedHashMap<>();
        for (ParsedCredit credit : credits) {
            unique.putIfAbsent(credit.dedupKey(), credit);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * JSON-LD {@code author} (role "Author") and {@code contributor} (role from {@code jobTitle}).
     */
    public List<ParsedCredit> fromJsonLd(JsonNode jsonLd) {
        List<ParsedCredit> credits = new ArrayList<>();
        if (jsonLd == null) {
            return credits;
        }
        for (JsonNode author : HtmlSupport.asList(jsonLd.get("author"))) {
            if (author.isTextual() && !author.asText().isBlank()) {
                credits.add(new ParsedCredit("Author", author.asText().trim(), null));
            } else if (author.isObject()) {
                String name = HtmlSupport.jsonText(author, "name");
                if (name != null) {
                    credits.add(new ParsedCredit("Author", name, HtmlSupport.jsonText(author.get("affiliation"), "name")));
                }
            }
        }
        for (JsonNode contributor : HtmlSupport.asList(jsonLd.get("contributor"))) {
            if (!contributor.isObject()) {
                continue;
            }
            String name = HtmlSupport.jsonText(contributor, "name");
            if (name != null) {
                String role = HtmlSupport.jsonText(contributor, "jobTitle");
                credits.add(new ParsedCredit(role == null ? "Contributor" : role, name,
                        HtmlSupport.jsonText(contributor.get("affiliation"), "name")));
            }
        }
        return credits;
    }

    /**
     * Header lists: a bold label ending in a colon gives the role, people-search links give names.
     */
    public List<ParsedCredit> fromCreditLists(Document doc) {
        List<ParsedCredit> credits = new ArrayList<>();
        Set<Element> lists = new LinkedHashSet<>(HtmlSupport.withClassMatching(doc, "ul", CREDIT_LIST_CLASS));
        for (Element list : lists) {
            Element label = list.selectFirst(".fw-bold");
            if (label == null) {
                label = list.selectFirst("strong");
            }
            String labelText = textOf(label);
            if (!labelText.endsWith(":")) {
                continue;
            }
            String role = labelText.substring(0, labelText.length() - 1).trim();
            if (role.isEmpty()) {
                continue;
            }
            for (Element link : list.select("a[href]")) {
                if (!link.attr("href").contains("/search?people=")) {
                    continue;
                }
                String name = textOf(link);
                if (!name.isEmpty()) {
                    credits.add(new ParsedCredit(role, name, null));
                }
            }
        }
        return credits;
    }

    /**
     * Header spans or divs with a credit/author class reading "Role: Name (Org)".
     */
    public List<ParsedCredit> fromHeader(Document doc) {
        List<ParsedCredit> credits = new ArrayList<>();
        Element header = doc.selectFirst("header");
        if (header == null) {
            header = doc.selectFirst("div.header");
        }
        if (header == null) {
            return credits;
        }
        for (Element element : HtmlSupport.withClassMatching(header, "span, div", HEADER_CREDIT_CLASS)) {
            Matcher matcher = ROLE_AND_NAME.matcher(textOf(element));
            if (!matcher.matches()) {
                continue;
            }
            String[] nameAndOrg = splitOrganization(matcher.group(2));
            if (!nameAndOrg[0].isEmpty()) {
                credits.add(new ParsedCredit(matcher.group(1).trim(), nameAndOrg[0], nameAndOrg[1]));
            }
        }
        return credits;
    }

    /**
     * The dedicated credits section: dt/h4/h5 set the current role, following dd/li/p give names.
     */
    public List<ParsedCredit> fromCreditsSection(Document doc) {
        List<ParsedCredit> credits = new ArrayList<>();
        Element section = doc.selectFirst("section#section_credits");
        if (section == null) {
            return credits;
        }
        String currentRole = null;
        for (Element element : section.select("dt, dd, h4, h5, li, p")) {
            String tag = element.normalName();
            if (tag.equals("dt") || tag.equals("h4") || tag.equals("h5")) {
                currentRole = stripTrailingColons(textOf(element));
                continue;
            }
            if (currentRole == null || currentRole.isEmpty()) {
                continue;
            }
            Element link = element.selectFirst("a");
            String name = link != null ? textOf(link) : textOf(element);
            if (name.length() > 1) {
                String[] nameAndOrg = splitOrganization(name);
                credits.add(new ParsedCredit(currentRole, nameAndOrg[0], nameAndOrg[1]));
            }
        }
        return credits;
    }

    /**
     * "Credit: A (Animator), B (NASA)" sentences in media group text. A parenthesised suffix is a
     * role when it names one, otherwise an organization.
     */
    public List<ParsedCredit> fromCaptionSentences(Document doc) {
        List<ParsedCredit> credits = new ArrayList<>();
        for (Element group : HtmlSupport.mediaGroups(doc)) {
            Element cardBody = group.selectFirst("div.card-body");
            if (cardBody == null) {
                continue;
            }
            for (Element paragraph : cardBody.select("p")) {
                Matcher matcher = CREDIT_SENTENCE.matcher(textOf(paragraph));
                if (!matcher.matches()) {
                    continue;
                }
                for (String rawPart : CREDIT_SEPARATOR.split(matcher.group(1))) {
                    String part = rawPart.trim();
                    if (part.isEmpty()) {
                        continue;
                    }
                    Matcher suffix = TRAILING_ORG.matcher(part);
                    if (!suffix.find()) {
                        credits.add(new ParsedCredit("Credit", part, null));
                        continue;
                    }
                    String qualifier = suffix.group(1).trim();
                    String name = part.substring(0, suffix.start()).trim();
                    if (looksLikeRole(qualifier)) {
                        credits.add(new ParsedCredit(qualifier, name, null));
                    } else {
                        credits.add(new ParsedCredit("Credit", name, qualifier));
                    }
                }
            }
        }
        return credits;
    }

    private static boolean looksLikeRole(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : ROLE_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    // {name, organization-or-null}
    private static String[] splitOrganization(String text) {
        Matcher matcher = TRAILING_ORG.matcher(text);
        if (matcher.find()) {
            return new String[]{text.substring(0, matcher.start()).trim(), matcher.group(1).trim()};
        }
        return new String[]{text.trim(), null};
    }

    private static String stripTrailingColons(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == ':') {
            end--;
        }
        return text.substring(0, end).trim();
    }
}
