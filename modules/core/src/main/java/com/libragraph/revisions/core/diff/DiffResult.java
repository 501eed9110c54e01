package com.libragraph.revisions.core.diff;

import com.libragraph.revisions.types.Section;

import java.util.List;

/**
 * Section-level changes between two contents. Unchanged sections are not reported.
 * The version fields are null until {@link #annotate} is called.
 */
public record DiffResult(
        String fromVersion,
        String toVersion,
        List<Section> sectionsAdded,
        List<Section> sectionsRemoved,
        List<SectionChange> sectionsModified
) {

    public DiffResult {
        sectionsAdded = List.copyOf(sectionsAdded);
        sectionsRemoved = List.copyOf(sectionsRemoved);
        sectionsModified = List.copyOf(sectionsModified);
    }

    public DiffResult annotate(String from, String to) {
        return new DiffResult(from, to, sectionsAdded, sectionsRemoved, sectionsModified);
    }

    public boolean hasChanges() {
        return !sectionsAdded.isEmpty() || !sectionsRemoved.isEmpty() || !sectionsModified.isEmpty();
    }
}
