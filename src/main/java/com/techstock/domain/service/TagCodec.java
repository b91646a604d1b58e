package com.techstock.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techstock.domain.exception.InternalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Converts between a resource's tag map and its persisted JSON blob.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TagCodec {

    private final ObjectMapper objectMapper;

    public String encode(Map<String, String> tags) {
        try {
            return objectMapper.writeValueAsString(tags != null ? new TreeMap<>(tags) : Collections.emptyMap());
        } catch (JsonProcessingException e) {
            throw new InternalException("Failed to serialize tags", e);
        }
    }

    /**
     * Decodes a blob into a flat string map.
     *
     * Missing, blank and literal {@code null} blobs decode to an empty map.
     * Anything that is not a JSON object yields {@link Optional#empty()}.
     * Non-string values are kept in their JSON text form; null values are
     * dropped.
     */
    public Optional<Map<String, String>> decode(String blob) {
        if (blob == null || blob.isBlank() || blob.trim().equals("null")) {
            return Optional.of(Collections.emptyMap());
        }
        try {
            JsonNode node = objectMapper.readTree(blob);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            Map<String, String> tags = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value == null || value.isNull()) {
                    continue;
                }
                tags.put(field.getKey(), value.isTextual() ? value.asText() : value.toString());
            }
            return Optional.of(tags);

        } catch (JsonProcessingException e) {
            log.debug("Unparseable tag blob: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Lenient decode for display: unparseable blobs become an empty map.
     */
    public Map<String, String> decodeOrEmpty(String blob) {
        return decode(blob).orElse(Collections.emptyMap());
    }
}
