package com.libragraph.revisions.core.storage;

import java.time.Instant;

/** A stored key and its last-modified time, as returned by listing. */
public record BlobEntry(String key, Instant lastModified) {}
