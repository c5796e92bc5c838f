package com.scipatom.atomizer.span;

import java.util.Map;

/**
 * Everything the extraction phase learned about one file.
 *
 * @param degraded true if the file could not be read or failed to parse
 * @param reason   why the file is degraded, null otherwise
 * @param spans    located span per requested symbol
 */
public record FileExtraction(String path, boolean degraded, String reason, Map<String, SpanResult> spans) {

    public SpanResult spanFor(String symbol) {
        SpanResult r = spans.get(symbol);
        return r != null ? r : SpanResult.notFound();
    }
}
