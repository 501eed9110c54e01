package com.libragraph.revisions.util;

import java.util.Objects;
import java.util.Optional;

/**
 * Blob key convention for revision payloads:
 * {@code documents/{documentId}/{version}/content.json}.
 *
 * <p>The key is a pure function of (documentId, version); it must stay stable because
 * existing blobs are addressed by it.
 */
public final class StorageKeys {

    public static final String PREFIX = "documents/";
    public static final String CONTENT_FILE = "content.json";

    private StorageKeys() {
    }

    /** Parsed form of a revision blob key. */
    public record RevisionKey(String documentId, String version) {}

    public static String contentKey(String documentId, String version) {
        requireSegment(documentId, "documentId");
        requireSegment(version, "version");
        return PREFIX + documentId + "/" + version + "/" + CONTENT_FILE;
    }

    /**
     * Parses a key produced by {@link #contentKey}. Returns empty for anything else.
     */
    public static Optional<RevisionKey> parse(String key) {
        if (key == null || !key.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String[] parts = key.substring(PREFIX.length()).split("/", -1);
        if (parts.length != 3 || !CONTENT_FILE.equals(parts[2])
                || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RevisionKey(parts[0], parts[1]));
    }

    private static void requireSegment(String value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isBlank() || value.contains("/") || value.equals("..") || value.equals(".")) {
            throw new IllegalArgumentException("Invalid " + name + " for storage key: '" + value + "'");
        }
    }
}
