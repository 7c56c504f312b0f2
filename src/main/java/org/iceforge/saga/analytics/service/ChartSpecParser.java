package org.iceforge.saga.analytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads the model's chart list: a JSON array, possibly wrapped in markdown fences. Elements are
 * returned as raw nodes so a malformed element fails only its own chart.
 */
@Component
public class ChartSpecParser {

    static final int RAW_EXCERPT_LENGTH = 500;

    private static final Pattern FENCE_START = Pattern.compile("(?m)^```(?:json)?\\s*");
    private static final Pattern FENCE_END = Pattern.compile("(?m)```\\s*$");

    private final ObjectMapper objectMapper;

    public ChartSpecParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper);
    }

    public List<JsonNode> parse(String raw) {
        String text = raw == null ? "" : raw.trim();
        text = FENCE_START.matcher(text).replaceAll("");
        text = FENCE_END.matcher(text).replaceAll("").trim();

        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Model returned invalid JSON: " + e.getOriginalMessage(), excerpt(text));
        }
        if (root == null || !root.isArray()) {
            throw new GenerationException("Model returned invalid JSON: expected a JSON array", excerpt(text));
        }

        List<JsonNode> out = new ArrayList<>(root.size());
        root.forEach(out::add);
        return out;
    }

    private static String excerpt(String s) {
        return s.length() <= RAW_EXCERPT_LENGTH ? s : s.substring(0, RAW_EXCERPT_LENGTH);
    }
}
