package com.libragraph.revisions.types;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blob payload of a revision: {@code {title, sections[], metadata?}}.
 *
 * <p>{@code sections} keeps a null when the field was absent so validation can
 * reject it; it is never silently defaulted. {@code metadata} is the extension map
 * for forward-compatible fields and is normalised to an empty map.
 */
public record DocumentContent(
        String title,
        List<Section> sections,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> metadata) {

    public DocumentContent {
        sections = sections == null ? null : Collections.unmodifiableList(new ArrayList<>(sections));
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static DocumentContent of(String title, List<Section> sections) {
        return new DocumentContent(title, sections, null);
    }
}
