package com.libragraph.revisions.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(DocumentRecord.class)
public interface DocumentDao {

    @SqlUpdate("INSERT INTO document (id, title, description) VALUES (:id, :title, :description)")
    @GetGeneratedKeys
    DocumentRecord insert(@Bind("id") String id,
                          @Bind("title") String title,
                          @Bind("description") String description);

    @SqlQuery("SELECT * FROM document WHERE id = :id")
    Optional<DocumentRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT EXISTS (SELECT 1 FROM document WHERE id = :id)")
    boolean exists(@Bind("id") String id);

    @SqlUpdate("UPDATE document SET updated_at = now() WHERE id = :id")
    int touch(@Bind("id") String id);

    @SqlQuery("SELECT * FROM document " +
            "WHERE CAST(:pattern AS TEXT) IS NULL OR title ILIKE CAST(:pattern AS TEXT) " +
            "ORDER BY updated_at DESC, id LIMIT :limit OFFSET :offset")
    List<DocumentRecord> list(@Bind("pattern") String pattern,
                              @Bind("limit") int limit,
                              @Bind("offset") long offset);

    @SqlQuery("SELECT COUNT(*) FROM document " +
            "WHERE CAST(:pattern AS TEXT) IS NULL OR title ILIKE CAST(:pattern AS TEXT)")
    long count(@Bind("pattern") String pattern);
}
