package com.libragraph.revisions.core.storage;

/**
 * Thrown when a write targets a key that is already occupied. Blobs are write-once,
 * so this is a conflict and is never retried.
 */
public class BlobAlreadyExistsException extends RuntimeException {

    private final String key;

    public BlobAlreadyExistsException(String key) {
        super("Blob already exists: key=" + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
