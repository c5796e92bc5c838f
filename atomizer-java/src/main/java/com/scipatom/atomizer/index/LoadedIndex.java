package com.scipatom.atomizer.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated, in-memory form of a decoded index: documents in declaration order,
 * the merged symbol information table, and the set of symbols declared as external.
 * Instances are built through {@link Builder}, which enforces structural consistency.
 */
public final class LoadedIndex {

    private final String projectRoot;
    private final List<DocumentRecord> documents;
    private final Map<String, ScipIndex.SymbolInformation> symbolInfo;
    private final Set<String> externalSymbols;

    private LoadedIndex(String projectRoot,
                        List<DocumentRecord> documents,
                        Map<String, ScipIndex.SymbolInformation> symbolInfo,
                        Set<String> externalSymbols) {
        this.projectRoot = projectRoot;
        this.documents = documents;
        this.symbolInfo = symbolInfo;
        this.externalSymbols = externalSymbols;
    }

    public String projectRoot()                                  { return projectRoot; }
    public List<DocumentRecord> documents()                      { return documents; }
    public Map<String, ScipIndex.SymbolInformation> symbolInfo() { return symbolInfo; }
    public Set<String> externalSymbols()                         { return externalSymbols; }

    public int occurrenceCount() {
        int n = 0;
        for (DocumentRecord d : documents) n += d.occurrences().size();
        return n;
    }

    public static Builder builder(String projectRoot) {
        return new Builder(projectRoot);
    }

    /**
     * Normalizes an index-relative path: forward slashes, no leading slash or "./".
     *
     * @throws MalformedIndexException if the path is blank or climbs out of the project root
     */
    public static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new MalformedIndexException("document has no relative_path");
        }
        String p = rawPath.replace('\\', '/');
        while (p.startsWith("/")) p = p.substring(1);
        while (p.startsWith("./")) p = p.substring(2);
        List<String> parts = new ArrayList<>();
        for (String segment : p.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                if (parts.isEmpty()) {
                    throw new MalformedIndexException("document path escapes project root: " + rawPath);
                }
                parts.remove(parts.size() - 1);
                continue;
            }
            parts.add(segment);
        }
        if (parts.isEmpty()) {
            throw new MalformedIndexException("document path is empty: " + rawPath);
        }
        return String.join("/", parts);
    }

    public static class Builder {

        private final String projectRoot;
        private final Map<String, String> languages = new LinkedHashMap<>();
        private final Map<String, List<ScipIndex.SymbolInformation>> symbols = new LinkedHashMap<>();
        private final Map<String, List<OccurrenceRecord>> occurrences = new LinkedHashMap<>();
        private final Map<String, ScipIndex.SymbolInformation> symbolInfo = new LinkedHashMap<>();
        private final Set<String> externalSymbols = new LinkedHashSet<>();

        private Builder(String projectRoot) {
            this.projectRoot = projectRoot != null ? projectRoot : "";
        }

        /** Declares a document and returns its normalized path. */
        public String document(String rawPath, String language) {
            String path = normalizePath(rawPath);
            if (languages.containsKey(path)) {
                throw new MalformedIndexException("document declared twice: " + path);
            }
            languages.put(path, language);
            symbols.put(path, new ArrayList<>());
            occurrences.put(path, new ArrayList<>());
            return path;
        }

        public Builder symbol(String path, ScipIndex.SymbolInformation info) {
            requireDeclared(path, "symbol " + (info != null ? info.symbol : null));
            requireSymbolName(info != null ? info.symbol : null, "symbol information in " + path);
            symbols.get(path).add(info);
            symbolInfo.putIfAbsent(info.symbol, info);
            return this;
        }

        public Builder occurrence(OccurrenceRecord occurrence) {
            requireSymbolName(occurrence.symbol(), "occurrence in " + occurrence.path());
            requireDeclared(occurrence.path(), "occurrence of " + occurrence.symbol());
            occurrences.get(occurrence.path()).add(occurrence);
            return this;
        }

        public Builder externalSymbol(ScipIndex.SymbolInformation info) {
            requireSymbolName(info != null ? info.symbol : null, "external symbol");
            externalSymbols.add(info.symbol);
            symbolInfo.putIfAbsent(info.symbol, info);
            return this;
        }

        public LoadedIndex build() {
            List<DocumentRecord> docs = new ArrayList<>();
            for (Map.Entry<String, String> e : languages.entrySet()) {
                String path = e.getKey();
                docs.add(new DocumentRecord(
                    path,
                    e.getValue(),
                    Collections.unmodifiableList(symbols.get(path)),
                    Collections.unmodifiableList(occurrences.get(path))
                ));
            }
            return new LoadedIndex(
                projectRoot,
                Collections.unmodifiableList(docs),
                Collections.unmodifiableMap(symbolInfo),
                Collections.unmodifiableSet(externalSymbols)
            );
        }

        private void requireDeclared(String path, String what) {
            if (path == null || !languages.containsKey(path)) {
                throw new MalformedIndexException(what + " references undeclared document: " + path);
            }
        }

        private static void requireSymbolName(String symbol, String what) {
            if (symbol == null || symbol.isBlank()) {
                throw new MalformedIndexException(what + " has no symbol");
            }
        }
    }
}
