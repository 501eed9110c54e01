package com.libragraph.revisions.api.model;

import com.libragraph.revisions.core.revision.RevisionContent;
import com.libragraph.revisions.types.DocumentContent;

import java.time.Instant;

public record RevisionContentResponse(String documentId, String version, String changeSummary,
                                      String createdBy, Instant createdAt, DocumentContent content) {

    public static RevisionContentResponse from(RevisionContent rc) {
        return new RevisionContentResponse(rc.revision().documentId(), rc.revision().version(),
                rc.revision().changeSummary(), rc.revision().createdBy(), rc.revision().createdAt(),
                rc.content());
    }
}
