package com.libragraph.revisions.api.model;

import java.util.List;

public record NodeDocumentsResponse(String nodeId, List<NodeDocumentLinkResponse> documents) {}
