package com.libragraph.revisions.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(NodeDocumentLinkRecord.class)
public interface NodeDocumentLinkDao {

    @SqlUpdate("INSERT INTO node_document_link (node_id, document_id, order_position, relation_type) " +
            "VALUES (:nodeId, :documentId, :orderPosition, :relationType)")
    @GetGeneratedKeys
    NodeDocumentLinkRecord insert(@Bind("nodeId") String nodeId,
                                  @Bind("documentId") String documentId,
                                  @Bind("orderPosition") Integer orderPosition,
                                  @Bind("relationType") String relationType);

    @SqlUpdate("DELETE FROM node_document_link WHERE node_id = :nodeId AND document_id = :documentId")
    int delete(@Bind("nodeId") String nodeId, @Bind("documentId") String documentId);

    @SqlQuery("SELECT * FROM node_document_link WHERE node_id = :nodeId " +
            "ORDER BY order_position NULLS LAST, created_at, id")
    List<NodeDocumentLinkRecord> listByNode(@Bind("nodeId") String nodeId);

    @SqlQuery("SELECT * FROM node_document_link WHERE document_id = :documentId ORDER BY created_at, id")
    List<NodeDocumentLinkRecord> listByDocument(@Bind("documentId") String documentId);
}
