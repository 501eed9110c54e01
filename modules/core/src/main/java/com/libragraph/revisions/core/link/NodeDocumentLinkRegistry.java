package com.libragraph.revisions.core.link;

import com.libragraph.revisions.core.dao.DocumentDao;
import com.libragraph.revisions.core.dao.NodeDocumentLinkDao;
import com.libragraph.revisions.core.dao.NodeDocumentLinkRecord;
import com.libragraph.revisions.core.db.SqlStates;
import com.libragraph.revisions.core.error.ResourceConflictException;
import com.libragraph.revisions.core.error.ResourceNotFoundException;
import com.libragraph.revisions.core.error.ValidationException;
import com.libragraph.revisions.core.storage.StorageException;
import com.libragraph.revisions.core.storage.StorageRetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.extension.ExtensionCallback;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Many-to-many association between roadmap nodes and documents.
 *
 * <p>Links have their own lifecycle: removing one never touches the document or its
 * revisions. The pair {@code (node_id, document_id)} is unique in the schema.
 */
@ApplicationScoped
public class NodeDocumentLinkRegistry {

    private static final Logger log = Logger.getLogger(NodeDocumentLinkRegistry.class);

    public static final String DEFAULT_RELATION = "primary";
    static final int MAX_RELATION_LENGTH = 50;

    @Inject
    Jdbi jdbi;

    @Inject
    NodeCatalog nodeCatalog;

    @Inject
    StorageRetry retry;

    /**
     * @param relationType defaults to {@value #DEFAULT_RELATION} when null or blank
     * @param orderPosition nullable; unpositioned links sort last
     * @throws ResourceConflictException if the document is already linked to the node
     * @throws ResourceNotFoundException if the node or the document does not exist
     */
    public NodeDocumentLinkRecord link(String nodeId, String documentId,
                                       String relationType, Integer orderPosition) {
        String relation = relationType == null || relationType.isBlank()
                ? DEFAULT_RELATION : relationType.strip();
        List<String> violations = new ArrayList<>();
        if (nodeId == null || nodeId.isBlank()) {
            violations.add("node_id must not be blank");
        }
        if (documentId == null || documentId.isBlank()) {
            violations.add("document_id must not be blank");
        }
        if (relation.length() > MAX_RELATION_LENGTH) {
            violations.add("relation_type must be at most " + MAX_RELATION_LENGTH + " characters");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        if (!nodeCatalog.exists(nodeId)) {
            throw new ResourceNotFoundException("Node not found: " + nodeId);
        }
        try {
            NodeDocumentLinkRecord link = jdbi.withExtension(NodeDocumentLinkDao.class,
                    dao -> dao.insert(nodeId, documentId, orderPosition, relation));
            log.infof("Linked document %s to node %s (%s)", documentId, nodeId, relation);
            return link;
        } catch (JdbiException e) {
            if (SqlStates.isUniqueViolation(e)) {
                throw new ResourceConflictException(
                        "Document " + documentId + " is already linked to node " + nodeId, e);
            }
            if (SqlStates.isForeignKeyViolation(e)) {
                throw ResourceNotFoundException.document(documentId);
            }
            throw unavailable(e);
        }
    }

    /**
     * @throws ResourceNotFoundException if no such link exists
     */
    public void unlink(String nodeId, String documentId) {
        int removed = retry.call(
                () -> withDao(NodeDocumentLinkDao.class, dao -> dao.delete(nodeId, documentId)),
                "unlink " + documentId + " from " + nodeId);
        if (removed == 0) {
            throw new ResourceNotFoundException(
                    "Link not found: node=" + nodeId + " document=" + documentId);
        }
        log.infof("Unlinked document %s from node %s", documentId, nodeId);
    }

    /** Links of a node by order position; unpositioned links last, then by creation. */
    public List<NodeDocumentLinkRecord> listByNode(String nodeId) {
        return retry.call(() -> withDao(NodeDocumentLinkDao.class, dao -> dao.listByNode(nodeId)),
                "links of node " + nodeId);
    }

    /** Links pointing at a document, oldest first. */
    public List<NodeDocumentLinkRecord> listByDocument(String documentId) {
        return retry.call(() -> {
            if (!withDao(DocumentDao.class, dao -> dao.exists(documentId))) {
                throw ResourceNotFoundException.document(documentId);
            }
            return withDao(NodeDocumentLinkDao.class, dao -> dao.listByDocument(documentId));
        }, "links of document " + documentId);
    }

    private <T, D> T withDao(Class<D> daoType, ExtensionCallback<T, D, RuntimeException> callback) {
        try {
            return jdbi.withExtension(daoType, callback);
        } catch (JdbiException e) {
            throw unavailable(e);
        }
    }

    private static RuntimeException unavailable(JdbiException e) {
        if (SqlStates.isConnectionFailure(e)) {
            return new StorageException("Link metadata unavailable", e);
        }
        return e;
    }
}
