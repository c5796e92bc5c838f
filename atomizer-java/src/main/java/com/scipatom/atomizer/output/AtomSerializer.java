package com.scipatom.atomizer.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.scipatom.atomizer.graph.AtomGraph;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes the atom graph to JSON. The graph arrives already ordered, so the output
 * is byte-identical for identical input. Nulls are written out so every atom carries
 * the same field set.
 */
public class AtomSerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .disableHtmlEscaping()
        .create();

    /**
     * Writes {@code graph} to {@code output}, creating parent directories as needed.
     */
    public void write(AtomGraph graph, Path output) {
        writeJson(graph.toRoot(), output);
        System.err.println("[atomizer] atoms written: " + output);
    }

    public String toJson(AtomGraph graph) {
        return GSON.toJson(graph.toRoot());
    }

    static void writeJson(Object value, Path output) {
        createParent(output);
        try (Writer w = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            GSON.toJson(value, w);
            w.write('\n');
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + output + ": " + e.getMessage(), e);
        }
    }

    static void createParent(Path output) {
        Path parent = output.toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + parent, e);
        }
    }
}
