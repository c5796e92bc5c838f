package com.scipatom.atomizer.span;

/**
 * One function to locate in a file.
 *
 * @param name       the function's display name, or null when unknown
 * @param anchorLine 1-based line of the definition occurrence
 */
public record SpanRequest(String symbol, String name, int anchorLine) {}
