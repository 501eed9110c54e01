package com.libragraph.revisions.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record RevisionRecord(
        @ColumnName("id") long id,
        @ColumnName("document_id") String documentId,
        @ColumnName("version") String version,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("content_hash") String contentHash,
        @ColumnName("change_summary") String changeSummary,
        @ColumnName("created_by") String createdBy,
        @ColumnName("created_at") Instant createdAt
) {}
