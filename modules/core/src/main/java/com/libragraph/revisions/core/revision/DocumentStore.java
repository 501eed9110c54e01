package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.DocumentRecord;

import java.util.Optional;

/** Relational document rows; owners of revision histories. */
public interface DocumentStore {

    DocumentRecord insert(String id, String title, String description);

    Optional<DocumentRecord> findById(String id);

    /**
     * Lists documents, most recently updated first.
     *
     * @param titleContains case-insensitive title filter, or null for all
     */
    DocumentPage list(int page, int perPage, String titleContains);
}
