package com.pandora.orchestrator.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{path.to.value}}} placeholders in a model prompt.
 *
 * <p>The first path segment is looked up in the step outputs, then in the
 * business context. Unresolvable placeholders are left verbatim so the gap is
 * visible in the prompt. Lists longer than {@value #MAX_LIST_ITEMS} items are
 * cut down, and any rendered value longer than {@value #MAX_VALUE_CHARS}
 * characters is truncated.
 */
@Component
public class PromptRenderer {

    static final int MAX_LIST_ITEMS  = 20;
    static final int MAX_VALUE_CHARS = 8000;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([\\w\\-]+(?:\\.[\\w\\-]+)*)\\s*}}");

    private final ObjectMapper json;

    public PromptRenderer(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public String render(String template, Map<String, Object> stepOutputs, Map<String, Object> businessContext) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String path = m.group(1);
            Object value = lookup(path, stepOutputs);
            if (value == null) value = lookup(path, businessContext);
            String replacement = value == null ? m.group(0) : format(value);
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    static Object lookup(String path, Map<String, Object> root) {
        if (root == null) return null;
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && segment.chars().allMatch(Character::isDigit)) {
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
            if (current == null) return null;
        }
        return current;
    }

    String format(Object value) {
        if (value instanceof String s) return truncate(s);
        if (value instanceof Number || value instanceof Boolean) return value.toString();

        Object shown = value;
        String note = "";
        if (value instanceof List<?> list && list.size() > MAX_LIST_ITEMS) {
            shown = new ArrayList<>(list.subList(0, MAX_LIST_ITEMS));
            note = "\n(" + (list.size() - MAX_LIST_ITEMS) + " more items not shown, " + list.size() + " total)";
        }
        try {
            return truncate(json.writerWithDefaultPrettyPrinter().writeValueAsString(shown)) + note;
        } catch (JsonProcessingException e) {
            return truncate(String.valueOf(shown)) + note;
        }
    }

    private static String truncate(String s) {
        return s.length() <= MAX_VALUE_CHARS ? s : s.substring(0, MAX_VALUE_CHARS) + "...(truncated)";
    }
}
