package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.RevisionRecord;
import com.libragraph.revisions.types.DocumentContent;

/** A revision together with its decoded payload. */
public record RevisionContent(RevisionRecord revision, DocumentContent content) {}
