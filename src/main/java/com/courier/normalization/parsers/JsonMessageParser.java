package com.courier.normalization.parsers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parser for messages carrying a native JSON object.
 *
 * Only text that starts with '{' and ends with '}' is considered. Top-level
 * scalar fields are returned as Java values; nested objects and arrays are
 * kept as their JSON text.
 */
public class JsonMessageParser implements MessageParser<Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(JsonMessageParser.class);

    public static final String CACHE_KEY = "json";

    private final ObjectMapper objectMapper;

    public JsonMessageParser() {
        this(new ObjectMapper());
    }

    public JsonMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String cacheKey() {
        return CACHE_KEY;
    }

    @Override
    public Map<String, Object> parse(String message) {
        if (message == null) {
            return null;
        }
        String trimmed = message.trim();
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return null;
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            log.debug("Message looks like JSON but does not parse: {}", e.getOriginalMessage());
            return null;
        }
        if (json == null || !json.isObject()) {
            return null;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        json.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isTextual()) {
                result.put(entry.getKey(), value.asText());
            } else if (value.isNumber()) {
                result.put(entry.getKey(), value.numberValue());
            } else if (value.isBoolean()) {
                result.put(entry.getKey(), value.asBoolean());
            } else if (value.isNull()) {
                result.put(entry.getKey(), null);
            } else {
                result.put(entry.getKey(), value.toString());
            }
        });
        return result;
    }
}
