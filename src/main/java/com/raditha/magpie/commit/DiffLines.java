package com.raditha.magpie.commit;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Lines added and removed between two versions of a file. Unchanged context is dropped.
 * Uses java-diff-utils.
 *
 * @param added   Lines present only in the new version
 * @param removed Lines present only in the old version
 */
public record DiffLines(List<String> added, List<String> removed) {

    public DiffLines {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
    }

    public static DiffLines empty() {
        return new DiffLines(List.of(), List.of());
    }

    /**
     * Diff two file versions. A null version stands for a file that did not exist.
     */
    public static DiffLines between(String oldText, String newText) {
        List<String> original = lines(oldText);
        List<String> revised = lines(newText);

        Patch<String> patch = DiffUtils.diff(original, revised);

        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            removed.addAll(delta.getSource().getLines());
            added.addAll(delta.getTarget().getLines());
        }
        return new DiffLines(added, removed);
    }

    /**
     * Concatenate the changes of several files.
     */
    public DiffLines plus(DiffLines other) {
        List<String> allAdded = new ArrayList<>(added);
        allAdded.addAll(other.added);
        List<String> allRemoved = new ArrayList<>(removed);
        allRemoved.addAll(other.removed);
        return new DiffLines(allAdded, allRemoved);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }

    private static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\\R"));
    }
}
