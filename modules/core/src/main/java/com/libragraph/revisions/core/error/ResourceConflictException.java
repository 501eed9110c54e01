package com.libragraph.revisions.core.error;

/**
 * The write collided with an existing row or blob: a duplicate version, a duplicate
 * link, or a concurrent writer that committed first. Callers may retry.
 */
public class ResourceConflictException extends RuntimeException {

    public ResourceConflictException(String message) {
        super(message);
    }

    public ResourceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
