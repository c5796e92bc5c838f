package com.scipatom.atomizer.span;

/**
 * How a function span was obtained.
 */
public enum Confidence {
    /** From the structural parse of the file. */
    EXACT("exact"),
    /** From the brace-counting heuristic after the file failed to parse. */
    APPROXIMATE_FALLBACK("approximate-fallback"),
    /** No textual item contains the anchor; the atom carries no body. */
    NOT_FOUND("not-found");

    private final String wireName;

    Confidence(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
