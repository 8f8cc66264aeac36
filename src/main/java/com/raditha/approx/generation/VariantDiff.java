package com.raditha.approx.generation;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.DeltaType;
import com.github.difflib.patch.Patch;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Line-level comparison of a variant against the kernel it came from.
 * Uses java-diff-utils.
 */
public final class VariantDiff {

    private VariantDiff() {
    }

    /**
     * Physical indices of the original that the variant changed or removed.
     */
    public static List<Integer> modifiedLines(List<String> original, List<String> variant) {
        Patch<String> patch = DiffUtils.diff(original, variant);
        SortedSet<Integer> changed = new TreeSet<>();
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            if (delta.getType() == DeltaType.INSERT) {
                continue;
            }
            int position = delta.getSource().getPosition();
            for (int i = 0; i < delta.getSource().size(); i++) {
                changed.add(position + i);
            }
        }
        return List.copyOf(changed);
    }

    /**
     * Unified diff with {@code contextLines} lines of context.
     */
    public static String unifiedDiff(String fileName, List<String> original, List<String> variant, int contextLines) {
        Patch<String> patch = DiffUtils.diff(original, variant);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                original,
                patch,
                contextLines);
        return String.join("\n", unified);
    }
}
