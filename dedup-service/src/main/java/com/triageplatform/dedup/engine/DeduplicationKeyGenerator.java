package com.triageplatform.dedup.engine;

import com.triageplatform.dedup.model.DeduplicationRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Stable fingerprint of a source event:
 * {@code prefix + first 16 hex chars of SHA-256("sourceId|eventType|sourceSystem|severity")},
 * where an absent or blank part keeps its slot as an empty string, so {@code a|x||} and
 * {@code a||x|} stay distinct.
 */
public final class DeduplicationKeyGenerator {

    private static final int KEY_HEX_LENGTH = 16;
    private static final int EXECUTION_ID_HEX_LENGTH = 12;

    private final String prefix;

    public DeduplicationKeyGenerator(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public String keyFor(DeduplicationRequest request) {
        StringJoiner joiner = new StringJoiner("|");
        joiner.add(request.sourceId());
        joiner.add(slot(request.eventType()));
        joiner.add(slot(request.sourceSystem()));
        joiner.add(slot(request.severity()));
        return prefix + sha256Hex(joiner.toString()).substring(0, KEY_HEX_LENGTH);
    }

    public static String newExecutionId() {
        return "exec_" + UUID.randomUUID().toString().replace("-", "").substring(0, EXECUTION_ID_HEX_LENGTH);
    }

    private static String slot(String part) {
        return part == null || part.isBlank() ? "" : part;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
