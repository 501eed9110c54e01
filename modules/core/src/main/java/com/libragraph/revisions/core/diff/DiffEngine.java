package com.libragraph.revisions.core.diff;

import com.libragraph.revisions.types.DocumentContent;
import com.libragraph.revisions.types.Section;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural diff over document sections.
 *
 * <p>Sections are matched by title, since titles are business headings rather than
 * positional slots. When a title occurs more than once, candidates are paired greedily
 * by closest {@code order}; remaining ties go to the earlier section on either side.
 * Unpaired sections on the {@code from} side are removed, on the {@code to} side added.
 * Paired sections whose content differs are modified.
 *
 * <p>Result ordering: added and modified follow the {@code to} document, removed
 * follows the {@code from} document.
 */
@ApplicationScoped
public class DiffEngine {

    private record Candidate(int fromIndex, int toIndex, long distance) {}

    private static final Comparator<Candidate> CLOSEST_FIRST = Comparator
            .comparingLong(Candidate::distance)
            .thenComparingInt(Candidate::fromIndex)
            .thenComparingInt(Candidate::toIndex);

    public DiffResult compute(DocumentContent from, DocumentContent to) {
        List<Section> before = sectionsOf(from);
        List<Section> after = sectionsOf(to);

        int[] matchOfAfter = new int[after.size()];
        Arrays.fill(matchOfAfter, -1);
        boolean[] beforeMatched = new boolean[before.size()];

        Map<String, List<Integer>> beforeByTitle = indexByTitle(before);
        Map<String, List<Integer>> afterByTitle = indexByTitle(after);

        for (Map.Entry<String, List<Integer>> entry : beforeByTitle.entrySet()) {
            List<Integer> targets = afterByTitle.get(entry.getKey());
            if (targets == null) {
                continue;
            }
            List<Candidate> candidates = new ArrayList<>();
            for (int i : entry.getValue()) {
                for (int j : targets) {
                    long distance = Math.abs((long) orderOf(before, i) - orderOf(after, j));
                    candidates.add(new Candidate(i, j, distance));
                }
            }
            candidates.sort(CLOSEST_FIRST);
            for (Candidate c : candidates) {
                if (!beforeMatched[c.fromIndex()] && matchOfAfter[c.toIndex()] < 0) {
                    beforeMatched[c.fromIndex()] = true;
                    matchOfAfter[c.toIndex()] = c.fromIndex();
                }
            }
        }

        List<Section> added = new ArrayList<>();
        List<SectionChange> modified = new ArrayList<>();
        for (int j = 0; j < after.size(); j++) {
            int i = matchOfAfter[j];
            if (i < 0) {
                added.add(after.get(j));
            } else if (!Objects.equals(before.get(i).content(), after.get(j).content())) {
                modified.add(new SectionChange(before.get(i), after.get(j)));
            }
        }
        List<Section> removed = new ArrayList<>();
        for (int i = 0; i < before.size(); i++) {
            if (!beforeMatched[i]) {
                removed.add(before.get(i));
            }
        }
        return new DiffResult(null, null, added, removed, modified);
    }

    private static List<Section> sectionsOf(DocumentContent content) {
        if (content == null || content.sections() == null) {
            return List.of();
        }
        return content.sections();
    }

    // Insertion-ordered so pairing is deterministic
    private static Map<String, List<Integer>> indexByTitle(List<Section> sections) {
        Map<String, List<Integer>> index = new LinkedHashMap<>();
        for (int i = 0; i < sections.size(); i++) {
            index.computeIfAbsent(sections.get(i).title(), k -> new ArrayList<>()).add(i);
        }
        return index;
    }

    // Sections without an order fall back to their position
    private static int orderOf(List<Section> sections, int index) {
        Integer order = sections.get(index).order();
        return order != null ? order : index;
    }
}
