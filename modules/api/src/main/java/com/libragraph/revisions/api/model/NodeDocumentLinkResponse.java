package com.libragraph.revisions.api.model;

import com.libragraph.revisions.core.dao.NodeDocumentLinkRecord;

import java.time.Instant;

public record NodeDocumentLinkResponse(String nodeId, String documentId, Integer orderPosition,
                                       String relationType, Instant createdAt) {

    public static NodeDocumentLinkResponse from(NodeDocumentLinkRecord record) {
        return new NodeDocumentLinkResponse(record.nodeId(), record.documentId(),
                record.orderPosition(), record.relationType(), record.createdAt());
    }
}
