package com.example.fleet.core.executor;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{args.name}}} and {@code {{secrets.NAME}}} placeholders.
 * Placeholders without a value are left untouched.
 */
public class TemplateEngine {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(args|secrets)\\.([A-Za-z0-9_.-]+)}}");

    public String render(String tpl, JsonNode args, Map<String, String> secrets) {
        if (tpl == null) return null;
        Matcher m = PLACEHOLDER.matcher(tpl);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = "args".equals(m.group(1)) ? argValue(args, m.group(2)) : secretValue(secrets, m.group(2));
            m.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String argValue(JsonNode args, String key) {
        if (args == null || !args.has(key)) return null;
        JsonNode v = args.get(key);
        return v.isTextual() ? v.asText() : v.toString();
    }

    private String secretValue(Map<String, String> secrets, String key) {
        return secrets == null ? null : secrets.get(key);
    }
}
