package com.libragraph.revisions.api.model;

import com.libragraph.revisions.core.dao.DocumentRecord;

import java.time.Instant;

public record DocumentResponse(String id, String title, String description,
                               Instant createdAt, Instant updatedAt) {

    public static DocumentResponse from(DocumentRecord record) {
        return new DocumentResponse(record.id(), record.title(), record.description(),
                record.createdAt(), record.updatedAt());
    }
}
