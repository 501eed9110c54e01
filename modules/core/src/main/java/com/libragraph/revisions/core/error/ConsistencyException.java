package com.libragraph.revisions.core.error;

/**
 * Blob storage and revision metadata disagree: a blob was written but its metadata
 * insert failed, or a stored payload no longer matches its recorded hash.
 */
public class ConsistencyException extends RuntimeException {

    private final String documentId;
    private final String version;
    private final String storageKey;

    public ConsistencyException(String message, String documentId, String version,
                                String storageKey, Throwable cause) {
        super(message + ": document=" + documentId + " version=" + version
                + " key=" + storageKey, cause);
        this.documentId = documentId;
        this.version = version;
        this.storageKey = storageKey;
    }

    public String documentId() {
        return documentId;
    }

    public String version() {
        return version;
    }

    public String storageKey() {
        return storageKey;
    }
}
