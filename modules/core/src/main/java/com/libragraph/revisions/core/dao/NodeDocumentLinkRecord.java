package com.libragraph.revisions.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record NodeDocumentLinkRecord(
        @ColumnName("id") long id,
        @ColumnName("node_id") String nodeId,
        @ColumnName("document_id") String documentId,
        @ColumnName("order_position") Integer orderPosition,
        @ColumnName("relation_type") String relationType,
        @ColumnName("created_at") Instant createdAt
) {}
