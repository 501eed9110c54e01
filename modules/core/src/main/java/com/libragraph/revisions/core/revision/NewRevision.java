package com.libragraph.revisions.core.revision;

/** Metadata for a revision whose blob has already been written. */
public record NewRevision(
        String documentId,
        String version,
        String storageKey,
        String contentHash,
        String changeSummary,
        String createdBy
) {}
