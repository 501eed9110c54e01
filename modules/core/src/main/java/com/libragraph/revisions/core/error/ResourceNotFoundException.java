package com.libragraph.revisions.core.error;

/**
 * A document, revision, node or link that the caller addressed does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException document(String documentId) {
        return new ResourceNotFoundException("Document not found: " + documentId);
    }

    public static ResourceNotFoundException revision(String documentId, String version) {
        return new ResourceNotFoundException(
                "Revision not found: document=" + documentId + " version=" + version);
    }
}
