package com.libragraph.revisions.core.storage;

/**
 * Wraps I/O and backend failures from storage operations. Treated as transient:
 * callers retry with backoff before surfacing it.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
