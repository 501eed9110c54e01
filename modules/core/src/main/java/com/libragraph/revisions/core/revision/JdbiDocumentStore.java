package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.DocumentDao;
import com.libragraph.revisions.core.dao.DocumentRecord;
import com.libragraph.revisions.core.db.SqlStates;
import com.libragraph.revisions.core.error.ResourceConflictException;
import com.libragraph.revisions.core.storage.StorageException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.extension.ExtensionCallback;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class JdbiDocumentStore implements DocumentStore {

    @Inject
    Jdbi jdbi;

    @Override
    public DocumentRecord insert(String id, String title, String description) {
        try {
            return jdbi.withExtension(DocumentDao.class, dao -> dao.insert(id, title, description));
        } catch (JdbiException e) {
            if (SqlStates.isUniqueViolation(e)) {
                throw new ResourceConflictException("Document already exists: " + id, e);
            }
            throw unavailable(e);
        }
    }

    @Override
    public Optional<DocumentRecord> findById(String id) {
        return read(dao -> dao.findById(id));
    }

    @Override
    public DocumentPage list(int page, int perPage, String titleContains) {
        String pattern = titleContains == null || titleContains.isBlank()
                ? null
                : "%" + escapeLike(titleContains.strip()) + "%";
        long offset = (long) (page - 1) * perPage;
        return read(dao -> {
            long total = dao.count(pattern);
            List<DocumentRecord> items = dao.list(pattern, perPage, offset);
            return new DocumentPage(items, page, perPage, total);
        });
    }

    // ILIKE treats % and _ as wildcards; backslash is the default escape
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private <T> T read(ExtensionCallback<T, DocumentDao, RuntimeException> callback) {
        try {
            return jdbi.withExtension(DocumentDao.class, callback);
        } catch (JdbiException e) {
            throw unavailable(e);
        }
    }

    private static RuntimeException unavailable(JdbiException e) {
        if (SqlStates.isConnectionFailure(e)) {
            return new StorageException("Document metadata unavailable", e);
        }
        return e;
    }
}
