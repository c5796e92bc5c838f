package com.scipatom.atomizer.span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Function spans of one file, with impls, traits, modules and item-list macros made
 * transparent. Siblings are sorted by start line; nested functions sit in
 * {@link ItemSpan#children()}.
 */
public class FileSpanIndex {

    private static final Comparator<ItemSpan> BY_START = Comparator.comparingInt(ItemSpan::startLine);

    private final List<ItemSpan> functions;

    private FileSpanIndex(List<ItemSpan> functions) {
        this.functions = functions;
    }

    public static FileSpanIndex of(List<ItemSpan> items) {
        return new FileSpanIndex(functionsOf(items));
    }

    private static List<ItemSpan> functionsOf(List<ItemSpan> items) {
        List<ItemSpan> out = new ArrayList<>();
        collect(items, out);
        out.sort(BY_START);
        return Collections.unmodifiableList(out);
    }

    private static void collect(List<ItemSpan> items, List<ItemSpan> out) {
        for (ItemSpan item : items) {
            if (item.kind() == ItemKind.FUNCTION) {
                out.add(new ItemSpan(item.kind(), item.name(), item.startLine(), item.endLine(),
                    functionsOf(item.children())));
            } else {
                collect(item.children(), out);
            }
        }
    }

    public List<ItemSpan> functions() {
        return functions;
    }

    /**
     * Innermost function containing {@code anchorLine}: at each level, the sibling with the
     * latest start at or before the anchor, kept only if it still ends at or after it.
     * Among siblings sharing that start line, one called {@code name} is preferred.
     *
     * @return the innermost containing function, or null if none contains the anchor
     */
    public ItemSpan lookup(int anchorLine, String name) {
        ItemSpan found = null;
        List<ItemSpan> level = functions;
        while (!level.isEmpty()) {
            int idx = latestStartAtOrBefore(level, anchorLine);
            if (idx < 0) break;
            ItemSpan candidate = level.get(idx);
            if (name != null) {
                for (int k = idx; k >= 0 && level.get(k).startLine() == candidate.startLine(); k--) {
                    if (level.get(k).name().equals(name)) {
                        candidate = level.get(k);
                        break;
                    }
                }
            }
            if (candidate.endLine() < anchorLine) break;
            found = candidate;
            level = candidate.children();
        }
        return found;
    }

    private static int latestStartAtOrBefore(List<ItemSpan> level, int line) {
        int lo = 0;
        int hi = level.size() - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (level.get(mid).startLine() <= line) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return found;
    }
}
