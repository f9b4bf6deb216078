package com.trustmail.config;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Accepts a single string, a comma-joined string or an array of strings and always
 * yields a list. Blank entries are dropped.
 *
 * <p>Use {@link Verbatim} for values that may legitimately contain commas; it also
 * unwraps a JSON array passed as a string ({@code "[\"A\",\"B\"]"}).
 */
public class StringOrListDeserializer extends JsonDeserializer<List<String>> {

    private static final ObjectMapper JSON = new ObjectMapper();

    protected boolean splitOnComma() {
        return true;
    }

    @Override
    public List<String> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        List<String> values = new ArrayList<>();
        collect(node, values);
        return values;
    }

    @Override
    public List<String> getNullValue(DeserializationContext ctxt) {
        return new ArrayList<>();
    }

    private void collect(JsonNode node, List<String> values) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            node.forEach(element -> collect(element, values));
            return;
        }
        String text = node.asText();
        if (!splitOnComma() && text.trim().startsWith("[")) {
            JsonNode parsed = parseQuietly(text);
            if (parsed != null && parsed.isArray()) {
                collect(parsed, values);
                return;
            }
        }
        if (splitOnComma()) {
            for (String part : text.split(",")) {
                add(part, values);
            }
        } else {
            add(text, values);
        }
    }

    /** Returns null when {@code text} is not valid JSON; the caller then keeps it as one value. */
    private static JsonNode parseQuietly(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static void add(String value, List<String> values) {
        String trimmed = value.trim();
        if (!trimmed.isEmpty()) {
            values.add(trimmed);
        }
    }

    public static class Verbatim extends StringOrListDeserializer {

        @Override
        protected boolean splitOnComma() {
            return false;
        }
    }
}
