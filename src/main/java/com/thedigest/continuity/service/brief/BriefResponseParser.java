package com.thedigest.continuity.service.brief;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thedigest.continuity.dto.Brief;
import com.thedigest.continuity.model.DepthConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a brief out of free-text model output. The text is parsed strictly first, then
 * from the first '{' to the last '}'. Each field is validated on its own and replaced by
 * the fallback value when missing or malformed.
 */
public class BriefResponseParser {

    private final ObjectMapper objectMapper;

    public BriefResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> parseJsonObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        Optional<JsonNode> direct = readObject(trimmed);
        if (direct.isPresent()) {
            return direct;
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start == -1 || end <= start) {
            return Optional.empty();
        }
        return readObject(trimmed.substring(start, end + 1));
    }

    /**
     * Merges the parsed object with the fallback at field granularity and caps list
     * lengths to the depth's limits.
     */
    public Brief toBrief(String text, Brief fallback, DepthConfig config) {
        Optional<JsonNode> parsed = parseJsonObject(text);
        if (parsed.isEmpty()) {
            return fallback;
        }
        JsonNode obj = parsed.get();
        return new Brief(
                asString(obj.get("headline"), fallback.headline()),
                asString(obj.get("summary"), fallback.summary()),
                cap(asStringList(obj.get("changed"), fallback.changed()), config.changedBulletLimit()),
                cap(asStringList(obj.get("unchanged"), fallback.unchanged()), FallbackBriefBuilder.UNCHANGED_LIMIT),
                cap(asStringList(obj.get("watchNext"), fallback.watchNext()), config.watchNextLimit())
        );
    }

    private Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    static String asString(JsonNode value, String fallback) {
        if (value == null || !value.isTextual()) {
            return fallback;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? fallback : text;
    }

    static List<String> asStringList(JsonNode value, List<String> fallback) {
        if (value == null || !value.isArray()) {
            return fallback;
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (item.isTextual() && !item.asText().isBlank()) {
                items.add(item.asText().trim());
            }
        }
        return items.isEmpty() ? fallback : items;
    }

    private static List<String> cap(List<String> values, int limit) {
        return values.size() > limit ? values.subList(0, limit) : values;
    }
}
