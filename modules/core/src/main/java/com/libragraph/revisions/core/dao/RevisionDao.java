package com.libragraph.revisions.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Append-only access to {@code document_revision}. There is deliberately no update or
 * delete; the table trigger rejects both anyway.
 */
@RegisterConstructorMapper(RevisionRecord.class)
public interface RevisionDao {

    @SqlUpdate("INSERT INTO document_revision " +
            "(document_id, version, storage_key, content_hash, change_summary, created_by) " +
            "VALUES (:documentId, :version, :storageKey, :contentHash, :changeSummary, :createdBy)")
    @GetGeneratedKeys
    RevisionRecord insert(@Bind("documentId") String documentId,
                          @Bind("version") String version,
                          @Bind("storageKey") String storageKey,
                          @Bind("contentHash") String contentHash,
                          @Bind("changeSummary") String changeSummary,
                          @Bind("createdBy") String createdBy);

    @SqlQuery("SELECT * FROM document_revision WHERE document_id = :documentId ORDER BY id")
    List<RevisionRecord> listByDocument(@Bind("documentId") String documentId);

    @SqlQuery("SELECT * FROM document_revision WHERE document_id = :documentId AND version = :version")
    Optional<RevisionRecord> findByVersion(@Bind("documentId") String documentId,
                                           @Bind("version") String version);

    @SqlQuery("SELECT * FROM document_revision WHERE document_id = :documentId " +
            "ORDER BY id DESC LIMIT 1")
    Optional<RevisionRecord> findLatest(@Bind("documentId") String documentId);

    @SqlQuery("SELECT EXISTS (SELECT 1 FROM document_revision " +
            "WHERE document_id = :documentId AND version = :version)")
    boolean exists(@Bind("documentId") String documentId, @Bind("version") String version);
}
