package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.dao.DocumentRecord;
import com.libragraph.revisions.core.dao.RevisionRecord;

/** A document and its latest revision, which is null until the first one is written. */
public record DocumentDetail(DocumentRecord document, RevisionRecord latestRevision) {}
