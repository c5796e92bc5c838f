package com.scipatom.atomizer.span;

/**
 * Located body of one function. Lines are 1-based and inclusive; both are 0 when
 * nothing was found.
 */
public record SpanResult(int startLine, int endLine, String text, Confidence confidence) {

    private static final SpanResult NOT_FOUND = new SpanResult(0, 0, "", Confidence.NOT_FOUND);

    public static SpanResult notFound() {
        return NOT_FOUND;
    }

    public boolean found() {
        return confidence != Confidence.NOT_FOUND;
    }
}
