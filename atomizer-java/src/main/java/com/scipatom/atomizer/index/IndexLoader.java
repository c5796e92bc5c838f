package com.scipatom.atomizer.index;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the decoded index (the JSON form written by {@code scip print --json})
 * and turns it into a validated {@link LoadedIndex}.
 */
public class IndexLoader {

    private static final Gson GSON = new Gson();

    /**
     * @throws MalformedIndexException if the file is missing, not JSON, or structurally inconsistent
     */
    public LoadedIndex load(Path indexPath) {
        if (!Files.isRegularFile(indexPath)) {
            throw new MalformedIndexException("Index file not found: " + indexPath);
        }
        ScipIndex.Root root;
        try (Reader reader = Files.newBufferedReader(indexPath, StandardCharsets.UTF_8)) {
            root = GSON.fromJson(reader, ScipIndex.Root.class);
        } catch (JsonParseException e) {
            throw new MalformedIndexException("Index is not valid JSON: " + indexPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedIndexException("Failed to read index: " + indexPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new MalformedIndexException("Index file is empty: " + indexPath);
        }
        return fromRoot(root);
    }

    /**
     * Validates an already-decoded index.
     */
    public LoadedIndex fromRoot(ScipIndex.Root root) {
        String projectRoot = root.metadata != null ? stripScheme(root.metadata.projectRoot) : "";
        LoadedIndex.Builder builder = LoadedIndex.builder(projectRoot);

        for (ScipIndex.Document doc : root.getDocuments()) {
            if (doc == null) {
                throw new MalformedIndexException("null document entry");
            }
            String path = builder.document(doc.relativePath, doc.language);
            for (ScipIndex.SymbolInformation info : doc.getSymbols()) {
                builder.symbol(path, info);
            }
            List<ScipIndex.Occurrence> occurrences = doc.getOccurrences();
            for (int i = 0; i < occurrences.size(); i++) {
                ScipIndex.Occurrence occ = occurrences.get(i);
                if (occ == null) {
                    throw new MalformedIndexException("null occurrence #" + i + " in " + path);
                }
                builder.occurrence(new OccurrenceRecord(
                    occ.symbol,
                    path,
                    range(occ.range, path, i),
                    occ.symbolRoles != null ? occ.symbolRoles : 0,
                    occ.enclosingRange == null || occ.enclosingRange.isEmpty()
                        ? null
                        : range(occ.enclosingRange, path, i)
                ));
            }
        }
        for (ScipIndex.SymbolInformation info : root.getExternalSymbols()) {
            builder.externalSymbol(info);
        }
        return builder.build();
    }

    private static SourceRange range(List<Integer> raw, String path, int index) {
        try {
            return SourceRange.fromScip(raw);
        } catch (IllegalArgumentException e) {
            throw new MalformedIndexException(
                "occurrence #" + index + " in " + path + " has a bad range: " + e.getMessage(), e);
        }
    }

    static String stripScheme(String projectRoot) {
        if (projectRoot == null) return "";
        return projectRoot.startsWith("file://") ? projectRoot.substring("file://".length()) : projectRoot;
    }
}
