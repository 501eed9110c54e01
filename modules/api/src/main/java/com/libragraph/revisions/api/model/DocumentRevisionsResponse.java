package com.libragraph.revisions.api.model;

import java.util.List;

public record DocumentRevisionsResponse(DocumentResponse document, List<RevisionResponse> revisions) {}
