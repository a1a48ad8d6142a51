package com.glyphvault.core.hash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical serialization and SHA-256 hashing of structured payloads.
 *
 * Object keys are sorted recursively and output is compact JSON. Every
 * non-integral number is written as a plain decimal: floats and doubles by
 * their shortest decimal text, {@code BigDecimal} exactly. Two payloads that
 * differ only in key insertion order hash identically; any change to a value
 * changes the digest.
 *
 * {@link #normalize(Map)} maps a payload onto the values its canonical text
 * parses back to, so a normalized payload survives a JSON round trip
 * unchanged and keeps its digest.
 */
public final class ContentHasher {

    private static final JsonMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
            .build();

    private static final JsonMapper PARSING_MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
            .build();

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private ContentHasher() {
    }

    /**
     * Hashes the canonical form of {@code data}.
     *
     * @return lowercase hex SHA-256 digest, 64 characters
     */
    public static String hash(Object data) {
        return sha256Hex(canonicalize(data).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Produces the canonical JSON text of a map, record, list or scalar.
     */
    public static String canonicalize(Object data) {
        Objects.requireNonNull(data, "Data cannot be null");
        try {
            JsonNode tree = CANONICAL_MAPPER.valueToTree(data);
            return CANONICAL_MAPPER.writeValueAsString(sorted(tree));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new IllegalArgumentException("Data cannot be canonically serialized: " + e.getMessage(), e);
        }
    }

    /**
     * Deep, unmodifiable copy of {@code data} holding exactly what its
     * canonical text parses back to: integers as the narrowest of
     * {@code Integer}, {@code Long} and {@code BigInteger}, other numbers as
     * {@code BigDecimal}. Keys come out sorted. Hashing the result gives the
     * same digest as hashing {@code data}.
     */
    public static Map<String, Object> normalize(Map<String, Object> data) {
        String canonical = canonicalize(data);
        try {
            return immutableMap(PARSING_MAPPER.readValue(canonical, PAYLOAD_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Canonical payload could not be parsed back", e);
        }
    }

    public static String sha256Hex(byte[] input) {
        return HexFormat.of().formatHex(sha256(input));
    }

    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode ordered = CANONICAL_MAPPER.getNodeFactory().objectNode();
            for (String name : names) {
                ordered.set(name, sorted(node.get(name)));
            }
            return ordered;
        }
        if (node.isArray()) {
            ArrayNode copy = CANONICAL_MAPPER.getNodeFactory().arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(sorted(element));
            }
            return copy;
        }
        if (node.isFloat() || node.isDouble()) {
            double value = node.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Non-finite number has no JSON form: " + value);
            }
            BigDecimal decimal = node.isFloat()
                    ? new BigDecimal(Float.toString(node.floatValue()))
                    : BigDecimal.valueOf(value);
            return CANONICAL_MAPPER.getNodeFactory().numberNode(decimal);
        }
        return node;
    }

    @SuppressWarnings("unchecked")
    private static Object immutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(immutableCopy(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Map<String, Object> immutableMap(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(key, immutableCopy(value)));
        return Collections.unmodifiableMap(copy);
    }
}
