package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.RevisionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Relational revision metadata. The unique constraint on {@code (document_id, version)}
 * behind {@link #insert} is the only serialization point between concurrent writers.
 *
 * <p>Implementations translate lost connections into {@code StorageException} so that
 * callers can retry reads.
 */
public interface RevisionStore {

    /**
     * Appends a revision and advances the owning document's {@code updated_at}.
     *
     * @throws com.libragraph.revisions.core.error.ResourceConflictException if the version exists
     * @throws com.libragraph.revisions.core.error.ResourceNotFoundException if the document does not
     */
    RevisionRecord insert(NewRevision revision);

    /** Revisions of a document in creation order. */
    List<RevisionRecord> listByDocument(String documentId);

    Optional<RevisionRecord> findByVersion(String documentId, String version);

    /** The most recently created revision, by insertion order. */
    Optional<RevisionRecord> findLatest(String documentId);

    boolean exists(String documentId, String version);
}
