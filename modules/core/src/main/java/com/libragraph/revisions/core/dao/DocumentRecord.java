package com.libragraph.revisions.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record DocumentRecord(
        @ColumnName("id") String id,
        @ColumnName("title") String title,
        @ColumnName("description") String description,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {}
