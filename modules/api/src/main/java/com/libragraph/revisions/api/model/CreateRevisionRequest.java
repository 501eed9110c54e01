package com.libragraph.revisions.api.model;

import com.libragraph.revisions.types.DocumentContent;

/** {@code versionType} is one of major, minor, patch; minor when omitted. */
public record CreateRevisionRequest(DocumentContent content, String changeSummary, String versionType) {}
