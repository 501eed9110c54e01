package com.libragraph.revisions.api.model;

import com.libragraph.revisions.core.dao.RevisionRecord;

import java.time.Instant;

public record RevisionResponse(String documentId, String version, String storageKey,
                               String contentHash, String changeSummary, String createdBy,
                               Instant createdAt) {

    public static RevisionResponse from(RevisionRecord record) {
        if (record == null) {
            return null;
        }
        return new RevisionResponse(record.documentId(), record.version(), record.storageKey(),
                record.contentHash(), record.changeSummary(), record.createdBy(), record.createdAt());
    }
}
