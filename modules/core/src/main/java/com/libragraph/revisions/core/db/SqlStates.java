package com.libragraph.revisions.core.db;

import org.jdbi.v3.core.ConnectionException;
import org.postgresql.util.PSQLState;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Classifies JDBI failures by the PostgreSQL SQLSTATE buried in their cause chain.
 */
public final class SqlStates {

    private SqlStates() {}

    public static Optional<String> sqlState(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof SQLException sql && sql.getSQLState() != null) {
                return Optional.of(sql.getSQLState());
            }
        }
        return Optional.empty();
    }

    public static boolean isUniqueViolation(Throwable t) {
        return sqlState(t).filter(PSQLState.UNIQUE_VIOLATION.getState()::equals).isPresent();
    }

    public static boolean isForeignKeyViolation(Throwable t) {
        return sqlState(t).filter(PSQLState.FOREIGN_KEY_VIOLATION.getState()::equals).isPresent();
    }

    /** Connection-class failures (SQLSTATE 08xxx) are transient and worth retrying. */
    public static boolean isConnectionFailure(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof ConnectionException) {
                return true;
            }
        }
        return sqlState(t).filter(s -> s.startsWith("08")).isPresent();
    }
}
