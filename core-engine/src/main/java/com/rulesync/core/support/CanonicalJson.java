package com.rulesync.core.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Canonical JSON encoding for record payloads.
 *
 * <p>
 * Object keys are written in sorted order and without insignificant
 * whitespace, so two payloads are equal as strings exactly when they are
 * equal as values. Both the loaders and the downstream channels go through
 * this class, which keeps the published-set diff a plain string comparison.
 * </p>
 *
 * @since 1.0.0
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CanonicalJson() {
        // utility class, not instantiable
    }

    /**
     * Encode a tree of maps, lists and scalars.
     *
     * @param tree value to encode
     * @return canonical JSON
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    public static String write(Object tree) {
        try {
            return MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Re-encode a parsed JSON document canonically.
     *
     * @param node parsed document
     * @return canonical JSON
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    public static String write(JsonNode node) {
        try {
            return write(MAPPER.treeToValue(node, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode a payload back into maps, lists and scalars.
     *
     * @param json JSON text
     * @return decoded value
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static Object read(String json) {
        try {
            return MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return shared mapper; callers must not reconfigure it
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
