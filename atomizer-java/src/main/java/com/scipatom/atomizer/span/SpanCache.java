package com.scipatom.atomizer.span;

import com.scipatom.atomizer.source.SourceTree;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run cache of parsed files keyed by index-relative path. Each file is read and
 * parsed at most once, however many symbols are anchored in it and whichever worker
 * asks first.
 */
public class SpanCache {

    private final SourceTree tree;
    private final RustItemParser parser;
    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger parses = new AtomicInteger();

    public SpanCache(SourceTree tree, RustItemParser parser) {
        this.tree = tree;
        this.parser = parser;
    }

    /**
     * Loads outside the map so a slow parse never blocks other workers. Each file is
     * requested by a single extraction task, so two loads of one path only happen when
     * callers share a path, and then the first stored entry wins.
     */
    public Entry get(String path) {
        Entry cached = entries.get(path);
        if (cached != null) return cached;
        Entry loaded = load(path);
        Entry raced = entries.putIfAbsent(path, loaded);
        return raced != null ? raced : loaded;
    }

    /** Number of files actually parsed so far. */
    public int parseCount() {
        return parses.get();
    }

    private Entry load(String path) {
        String content;
        try {
            content = tree.read(path);
        } catch (IOException e) {
            return Entry.unreadable("cannot read " + path + ": " + e.getMessage());
        }
        List<String> lines = splitLines(content);
        parses.incrementAndGet();
        try {
            return Entry.parsed(lines, FileSpanIndex.of(parser.parse(content)));
        } catch (SpanParseException e) {
            return Entry.unparsed(lines, "parse failed in " + path + ": " + e.getMessage());
        }
    }

    static List<String> splitLines(String content) {
        String[] raw = content.split("\n", -1);
        List<String> lines = new ArrayList<>(raw.length);
        for (String line : raw) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return Collections.unmodifiableList(lines);
    }

    /**
     * Outcome of loading one file. {@code index} is null when the file failed to parse;
     * {@code lines} is null when it could not be read.
     */
    public record Entry(List<String> lines, FileSpanIndex index, String failure) {

        static Entry parsed(List<String> lines, FileSpanIndex index) {
            return new Entry(lines, index, null);
        }

        static Entry unparsed(List<String> lines, String failure) {
            return new Entry(lines, null, failure);
        }

        static Entry unreadable(String failure) {
            return new Entry(null, null, failure);
        }

        public boolean readable() {
            return lines != null;
        }
    }
}
