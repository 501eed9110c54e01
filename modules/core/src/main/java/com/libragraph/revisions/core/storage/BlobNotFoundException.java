package com.libragraph.revisions.core.storage;

/**
 * Thrown when a read or delete targets a blob that does not exist.
 */
public class BlobNotFoundException extends RuntimeException {

    private final String key;

    public BlobNotFoundException(String key) {
        super("Blob not found: key=" + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
