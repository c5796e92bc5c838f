package com.scipatom.atomizer.resolve;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates deterministic, stable atom IDs following the convention:
 *   folder:<relative-dir>                       (folder; the source root is "folder:")
 *   file:<relative-path>                        (file)
 *   fn:<package>/<scope>/.../<name>             (function or method)
 *   external                                    (the synthetic external atom)
 */
public final class AtomIds {

    public static final String EXTERNAL = "external";

    private AtomIds() {}

    public static String forFolder(String relativeDir) {
        return "folder:" + relativeDir;
    }

    public static String forFile(String relativePath) {
        return "file:" + relativePath;
    }

    /**
     * Produce a function ID from a SCIP symbol: scheme, manager and version are dropped,
     * descriptor names become path segments (type parameters included, so
     * {@code impl#[Foo][Display]fmt().} keeps the implementing type and trait), and the
     * display name is appended when the descriptors do not already end with it.
     */
    public static String forFunction(String symbol, String displayName) {
        ScipSymbol parsed = ScipSymbol.parse(symbol);
        List<String> segments = new ArrayList<>();
        if (!parsed.packageName().isEmpty() && !parsed.packageName().equals(".")) {
            segments.add(clean(parsed.packageName()));
        }
        for (ScipSymbol.Descriptor d : parsed.descriptors()) {
            String name = clean(d.name());
            if (!name.isEmpty()) segments.add(name);
        }
        if (segments.isEmpty()) {
            segments.add(clean(symbol));
        }
        if (displayName != null && !displayName.isEmpty()
                && !segments.get(segments.size() - 1).equals(clean(displayName))) {
            segments.add(clean(displayName));
        }
        return "fn:" + String.join("/", segments);
    }

    /** Strips generic arguments and characters that carry no naming information. */
    static String clean(String name) {
        StringBuilder out = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '<') { depth++; continue; }
            if (c == '>') { if (depth > 0) depth--; continue; }
            if (depth > 0) continue;
            if (c == '`' || c == '(' || c == ')' || c == '[' || c == ']') continue;
            out.append(Character.isWhitespace(c) ? '_' : c);
        }
        return out.toString();
    }
}
