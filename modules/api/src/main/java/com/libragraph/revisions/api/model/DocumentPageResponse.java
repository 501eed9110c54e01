package com.libragraph.revisions.api.model;

import com.libragraph.revisions.core.revision.DocumentPage;

import java.util.List;

public record DocumentPageResponse(List<DocumentResponse> items, PageMeta meta) {

    public record PageMeta(int currentPage, int totalPages, long totalItems, int itemsPerPage) {}

    public static DocumentPageResponse from(DocumentPage page) {
        return new DocumentPageResponse(
                page.items().stream().map(DocumentResponse::from).toList(),
                new PageMeta(page.page(), page.totalPages(), page.totalItems(), page.perPage()));
    }
}
