package com.scipatom.atomizer.span;

import com.scipatom.atomizer.source.SourceTree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Locates the source span of every function anchored in one file. The structural
 * parse is tried first; a file that fails it is served by the fallback heuristic and
 * reported as degraded.
 */
public class SpanExtractor {

    private final SpanCache cache;
    private final FallbackSpanLocator fallback;

    public SpanExtractor(SourceTree tree, RustItemParser parser, FallbackSpanLocator fallback) {
        this.cache = new SpanCache(tree, parser);
        this.fallback = fallback;
    }

    public FileExtraction extract(String path, List<SpanRequest> requests) {
        SpanCache.Entry entry = cache.get(path);
        Map<String, SpanResult> spans = new LinkedHashMap<>();

        if (!entry.readable()) {
            System.err.println("[atomizer] WARNING: " + entry.failure());
            for (SpanRequest r : requests) {
                spans.put(r.symbol(), SpanResult.notFound());
            }
            return new FileExtraction(path, true, entry.failure(), spans);
        }

        if (entry.index() == null) {
            System.err.println("[atomizer] WARNING: " + entry.failure() + "; using fallback spans");
            for (SpanRequest r : requests) {
                spans.put(r.symbol(), fallback.locate(entry.lines(), r.anchorLine()));
            }
            return new FileExtraction(path, true, entry.failure(), spans);
        }

        for (SpanRequest r : requests) {
            spans.put(r.symbol(), exact(entry, r));
        }
        return new FileExtraction(path, false, null, spans);
    }

    private SpanResult exact(SpanCache.Entry entry, SpanRequest request) {
        String name = stripRawPrefix(request.name());
        ItemSpan span = entry.index().lookup(request.anchorLine(), name);
        if (span == null) {
            return SpanResult.notFound();
        }
        // A different function around the anchor means the symbol has no item of its own (macro output)
        if (name != null && !span.name().equals(name)) {
            return SpanResult.notFound();
        }
        List<String> lines = entry.lines();
        int end = Math.min(span.endLine(), lines.size());
        return new SpanResult(span.startLine(), end,
            String.join("\n", lines.subList(span.startLine() - 1, end)), Confidence.EXACT);
    }

    private static String stripRawPrefix(String name) {
        if (name == null || name.isEmpty()) return null;
        return name.startsWith("r#") ? name.substring(2) : name;
    }

    /** Number of files parsed so far in this run. */
    public int parsedFiles() {
        return cache.parseCount();
    }
}
