package com.libragraph.revisions.core.dao;

import org.jdbi.v3.sqlobject.statement.SqlQuery;

public interface DatabaseDao {

    @SqlQuery("SELECT version()")
    String pgVersion();
}
