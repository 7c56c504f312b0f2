package org.iceforge.saga.analytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.saga.analytics.model.SubQuestionPlan;
import org.iceforge.saga.analytics.model.SubQuestionPlan.Source;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads the model's sub-question list. Expects {@code {"questions": [...]}}; anything else is
 * read line by line, skipping {@code #} headings and stripping bullet markers.
 */
@Component
public class SubQuestionParser {

    private static final Pattern FENCE_START = Pattern.compile("(?i)^```(?:json)?\\s*");
    private static final Pattern FENCE_END = Pattern.compile("```\\s*$");
    private static final Pattern BULLET = Pattern.compile("^[•\\-*]+\\s*");

    private final ObjectMapper objectMapper;

    public SubQuestionParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper);
    }

    public SubQuestionPlan parse(String raw) {
        String text = raw == null ? "" : raw.trim();
        List<String> parsed = parseJson(stripFences(text));
        if (parsed != null) {
            return new SubQuestionPlan(parsed, Source.PARSED);
        }
        return new SubQuestionPlan(parseLines(text), Source.FALLBACK);
    }

    private List<String> parseJson(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (root == null) return null;

        JsonNode list = root.isObject() ? root.get("questions") : root;
        if (root.isObject() && (list == null || !list.isArray())) return List.of();
        if (list == null || !list.isArray()) return null;

        List<String> out = new ArrayList<>();
        for (JsonNode q : list) {
            if (!q.isTextual()) return null;
            if (!q.asText().isBlank()) out.add(q.asText().trim());
        }
        return out;
    }

    private static List<String> parseLines(String text) {
        List<String> out = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String t = line.trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            t = BULLET.matcher(t).replaceFirst("").trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static String stripFences(String s) {
        return FENCE_END.matcher(FENCE_START.matcher(s).replaceFirst("")).replaceFirst("").trim();
    }
}
