package com.scipatom.atomizer.span;

import java.util.List;

/**
 * Grammar-agnostic shape of one structural item: what it is, what it is called,
 * the inclusive 1-based line range it occupies (leading doc comments and attributes
 * included), and the items nested inside it.
 */
public record ItemSpan(ItemKind kind, String name, int startLine, int endLine, List<ItemSpan> children) {

    public boolean contains(int line) {
        return startLine <= line && line <= endLine;
    }
}
