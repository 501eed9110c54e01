package com.libragraph.revisions.core.revision;

import com.libragraph.revisions.core.error.ValidationException;
import com.libragraph.revisions.types.DocumentContent;
import com.libragraph.revisions.types.Section;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on revision content: a non-blank title and a (possibly empty)
 * section list whose entries all carry a title, content and order.
 */
@ApplicationScoped
public class ContentValidator {

    static final int MAX_TITLE_LENGTH = 200;

    public void validate(DocumentContent content) {
        List<String> violations = new ArrayList<>();
        if (content == null) {
            throw new ValidationException("content is required");
        }
        if (content.title() == null || content.title().isBlank()) {
            violations.add("title must not be blank");
        } else if (content.title().length() > MAX_TITLE_LENGTH) {
            violations.add("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (content.sections() == null) {
            violations.add("sections is required");
        } else {
            List<Section> sections = content.sections();
            for (int i = 0; i < sections.size(); i++) {
                Section s = sections.get(i);
                String at = "sections[" + i + "]";
                if (s == null) {
                    violations.add(at + " must not be null");
                    continue;
                }
                if (s.title() == null || s.title().isBlank()) {
                    violations.add(at + ".title must not be blank");
                }
                if (s.content() == null) {
                    violations.add(at + ".content is required");
                }
                if (s.order() == null) {
                    violations.add(at + ".order is required");
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    /** Document metadata: non-blank title within the column width. */
    public void validateDocument(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title must not be blank");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
    }
}
