package com.libragraph.revisions.api.model;

import com.libragraph.revisions.types.DocumentContent;

/** {@code content} is optional; when present it becomes revision 1.0.0. */
public record CreateDocumentRequest(String title, String description, DocumentContent content) {}
