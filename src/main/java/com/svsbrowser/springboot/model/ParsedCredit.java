package com.svsbrowser.springboot.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ParsedCredit {
    private final String role;
    private final String name;
    private final String organization;

    /**
     * Key used to collapse the same person credited by several extraction strategies.
     */
    public String dedupKey() {
        return normalize(role) + "|" + normalize(name);
    }

    /**
     * Renders the credit the way it appears in chunk text: {@code Role: Name (Org)}.
     */
    public String toLine() {
        StringBuilder line = new StringBuilder();
        line.append(role).append(": ").append(name);
        if (organization != null && !organization.isBlank()) {
            line.append(" (").append(organization).append(")");
        }
        return line.toString();
    }

    public Map<String, String> toJson() {
        Map<String, String> json = new LinkedHashMap<>();
        json.put("role", role);
        json.put("name", name);
        json.put("organization", organization);
        return json;
    }

    public static ParsedCredit fromJson(Map<String, String> json) {
        return new ParsedCredit(json.get("role"), json.get("name"), json.get("organization"));
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
