package com.libragraph.revisions.api.model;

import com.libragraph.revisions.core.dao.DocumentRecord;
import com.libragraph.revisions.core.revision.DocumentDetail;

import java.time.Instant;

/** {@code latestRevision} is null for a document without revisions. */
public record DocumentDetailResponse(String id, String title, String description,
                                     Instant createdAt, Instant updatedAt,
                                     RevisionResponse latestRevision) {

    public static DocumentDetailResponse from(DocumentDetail detail) {
        DocumentRecord doc = detail.document();
        return new DocumentDetailResponse(doc.id(), doc.title(), doc.description(),
                doc.createdAt(), doc.updatedAt(), RevisionResponse.from(detail.latestRevision()));
    }
}
