package com.libragraph.revisions.core.diff;

import com.libragraph.revisions.types.Section;

/** A section present on both sides under the same title, with different content. */
public record SectionChange(Section oldSection, Section newSection) {}
