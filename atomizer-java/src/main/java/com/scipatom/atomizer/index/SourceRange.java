package com.scipatom.atomizer.index;

import java.util.List;

/**
 * A decoded SCIP range. Lines and characters are 0-based, as in the index.
 */
public record SourceRange(int startLine, int startChar, int endLine, int endChar) {

    /**
     * Decodes the 3-element ({@code [line, startChar, endChar]}) or 4-element
     * ({@code [startLine, startChar, endLine, endChar]}) SCIP encoding.
     *
     * @throws IllegalArgumentException if the list has another length or negative values
     */
    public static SourceRange fromScip(List<Integer> range) {
        if (range == null || (range.size() != 3 && range.size() != 4)) {
            throw new IllegalArgumentException("range must have 3 or 4 elements: " + range);
        }
        for (Integer v : range) {
            if (v == null || v < 0) {
                throw new IllegalArgumentException("range must hold non-negative integers: " + range);
            }
        }
        if (range.size() == 3) {
            return new SourceRange(range.get(0), range.get(1), range.get(0), range.get(2));
        }
        return new SourceRange(range.get(0), range.get(1), range.get(2), range.get(3));
    }

    /** 1-based line of the start position. */
    public int anchorLine() {
        return startLine + 1;
    }

    public boolean contains(SourceRange other) {
        return compare(startLine, startChar, other.startLine, other.startChar) <= 0
            && compare(other.endLine, other.endChar, endLine, endChar) <= 0;
    }

    private static int compare(int lineA, int charA, int lineB, int charB) {
        return lineA != lineB ? Integer.compare(lineA, lineB) : Integer.compare(charA, charB);
    }
}
