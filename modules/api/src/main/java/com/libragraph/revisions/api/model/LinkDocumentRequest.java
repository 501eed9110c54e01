package com.libragraph.revisions.api.model;

public record LinkDocumentRequest(String documentId, String relationType, Integer orderPosition) {}
