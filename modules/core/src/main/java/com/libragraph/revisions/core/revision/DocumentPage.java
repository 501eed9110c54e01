package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.DocumentRecord;

import java.util.List;

/** One page of documents; {@code page} is 1-based. */
public record DocumentPage(List<DocumentRecord> items, int page, int perPage, long totalItems) {

    public int totalPages() {
        return totalItems == 0 ? 0 : (int) ((totalItems + perPage - 1) / perPage);
    }
}
