package com.libragraph.revisions.util;

import org.apache.commons.codec.digest.Blake3;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * BLAKE3-256 digest of a revision payload (32 bytes).
 * Stored next to the revision metadata and checked on every content read.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 32;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                    "Content hash must be 32 bytes (BLAKE3-256), got: " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /** Hashes a payload. */
    public static ContentHash of(byte[] payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        return new ContentHash(Blake3.hash(payload));
    }

    /**
     * Parses a 64-character lowercase or uppercase hex string.
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException(
                    "BLAKE3-256 hex string must be 64 characters, got: " + hex.length());
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /** True when {@code payload} hashes to this value. */
    public boolean matches(byte[] payload) {
        return payload != null && Arrays.equals(bytes, Blake3.hash(payload));
    }

    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
