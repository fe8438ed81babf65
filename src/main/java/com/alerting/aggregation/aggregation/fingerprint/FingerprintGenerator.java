package com.alerting.aggregation.aggregation.fingerprint;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Content-addressed grouping key for a dimension map: MD5 over the key-sorted
 * {@code key:value} pairs joined with {@code |}. Not a security boundary.
 */
@Component
public class FingerprintGenerator {

    public String fingerprint(Map<String, String> dimensions) {
        String canonical = dimensions == null || dimensions.isEmpty()
                ? ""
                : new TreeMap<>(dimensions).entrySet().stream()
                        .map(e -> e.getKey() + ":" + e.getValue())
                        .collect(Collectors.joining("|"));
        return md5Hex(canonical);
    }

    /**
     * Rejects maps with null or blank keys, and values that are not non-blank strings.
     *
     * @throws IllegalArgumentException on the first offending entry
     */
    public void validateDimensions(Map<?, ?> dimensions) {
        if (dimensions == null) {
            throw new IllegalArgumentException("Dimensions must not be null");
        }
        for (Map.Entry<?, ?> entry : dimensions.entrySet()) {
            if (!(entry.getKey() instanceof String) || ((String) entry.getKey()).isBlank()) {
                throw new IllegalArgumentException("Dimension key must be a non-empty string: " + entry.getKey());
            }
            String key = (String) entry.getKey();
            if (!(entry.getValue() instanceof String) || ((String) entry.getValue()).isBlank()) {
                throw new IllegalArgumentException("Dimension value for '" + key + "' must be a non-empty string");
            }
        }
    }

    private static String md5Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
