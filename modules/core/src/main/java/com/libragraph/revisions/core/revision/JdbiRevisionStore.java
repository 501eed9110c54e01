package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.DocumentDao;
import com.libragraph.revisions.core.dao.RevisionDao;
import com.libragraph.revisions.core.dao.RevisionRecord;
import com.libragraph.revisions.core.db.SqlStates;
import com.libragraph.revisions.core.error.ResourceConflictException;
import com.libragraph.revisions.core.error.ResourceNotFoundException;
import com.libragraph.revisions.core.storage.StorageException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.extension.ExtensionCallback;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class JdbiRevisionStore implements RevisionStore {

    private static final Logger log = Logger.getLogger(JdbiRevisionStore.class);

    @Inject
    Jdbi jdbi;

    @Override
    public RevisionRecord insert(NewRevision revision) {
        try {
            RevisionRecord inserted = jdbi.inTransaction(handle -> {
                RevisionRecord rec = handle.attach(RevisionDao.class).insert(
                        revision.documentId(), revision.version(), revision.storageKey(),
                        revision.contentHash(), revision.changeSummary(), revision.createdBy());
                handle.attach(DocumentDao.class).touch(revision.documentId());
                return rec;
            });
            log.debugf("Inserted revision id=%d document=%s version=%s",
                    inserted.id(), inserted.documentId(), inserted.version());
            return inserted;
        } catch (JdbiException e) {
            if (SqlStates.isUniqueViolation(e)) {
                throw new ResourceConflictException("Revision " + revision.version()
                        + " of document " + revision.documentId() + " already exists", e);
            }
            if (SqlStates.isForeignKeyViolation(e)) {
                throw ResourceNotFoundException.document(revision.documentId());
            }
            throw e;
        }
    }

    @Override
    public List<RevisionRecord> listByDocument(String documentId) {
        return read(dao -> dao.listByDocument(documentId));
    }

    @Override
    public Optional<RevisionRecord> findByVersion(String documentId, String version) {
        return read(dao -> dao.findByVersion(documentId, version));
    }

    @Override
    public Optional<RevisionRecord> findLatest(String documentId) {
        return read(dao -> dao.findLatest(documentId));
    }

    @Override
    public boolean exists(String documentId, String version) {
        return read(dao -> dao.exists(documentId, version));
    }

    private <T> T read(ExtensionCallback<T, RevisionDao, RuntimeException> callback) {
        try {
            return jdbi.withExtension(RevisionDao.class, callback);
        } catch (JdbiException e) {
            if (SqlStates.isConnectionFailure(e)) {
                throw new StorageException("Revision metadata unavailable", e);
            }
            throw e;
        }
    }
}
