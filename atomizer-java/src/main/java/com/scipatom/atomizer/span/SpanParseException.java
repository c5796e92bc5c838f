package com.scipatom.atomizer.span;

/**
 * The structural parse of one file failed. Recoverable: the file is served by the
 * fallback heuristic and counted as degraded.
 */
public class SpanParseException extends RuntimeException {

    private final int line;

    public SpanParseException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public int getLine() { return line; }
}
