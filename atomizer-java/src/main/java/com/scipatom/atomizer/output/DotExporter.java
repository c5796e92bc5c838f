package com.scipatom.atomizer.output;

import com.scipatom.atomizer.graph.AtomGraph;
import com.scipatom.atomizer.graph.AtomModel;
import com.scipatom.atomizer.graph.AtomModel.Atom;
import com.scipatom.atomizer.graph.AtomModel.Dependency;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders the function call graph as Graphviz DOT, one cluster per file.
 *
 * With a file filter, only functions of the matching files are clustered; their direct
 * callers and callees from other files are drawn unclustered in grey. With a function
 * filter, the named functions (highlighted) and everything they transitively call are
 * drawn, plus their transitive callers when asked for.
 */
public class DotExporter {

    public static class DotExportException extends RuntimeException {
        public DotExportException(String msg) { super(msg); }
    }

    /**
     * What to draw. Empty lists mean no restriction.
     *
     * @param files          relative paths or path suffixes
     * @param functions      function names, atom ids, or atom id suffixes such as {@code Counter/new}
     * @param includeCallers also follow dependencies backwards from the named functions
     */
    public record Selection(List<String> files, List<String> functions, boolean includeCallers) {

        public static Selection all() {
            return new Selection(List.of(), List.of(), false);
        }

        public static Selection ofFiles(List<String> files) {
            return new Selection(files, List.of(), false);
        }
    }

    private static final int TOOLTIP_LIMIT = 200;

    public void write(String dot, Path output) {
        AtomSerializer.createParent(output);
        try {
            Files.writeString(output, dot, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AtomSerializer.SerializerException("Failed to write " + output + ": " + e.getMessage(), e);
        }
        System.err.println("[atomizer] call graph written: " + output);
    }

    /**
     * @throws DotExportException if a non-empty filter matches no function
     */
    public String render(AtomGraph graph, Selection selection) {
        Map<String, Atom> functions = new LinkedHashMap<>();
        for (Atom a : graph.atoms()) {
            if (AtomModel.FUNCTION.equals(a.kind)) functions.put(a.id, a);
        }
        List<Dependency> internal = new ArrayList<>();
        for (Dependency d : graph.dependencies()) {
            if (functions.containsKey(d.sourceId) && functions.containsKey(d.targetId)) internal.add(d);
        }

        Set<String> seeds = new LinkedHashSet<>();
        Set<String> selected = new LinkedHashSet<>();
        boolean byFunction = !selection.functions().isEmpty();
        if (byFunction) {
            for (Atom a : functions.values()) {
                if (namesFunction(a, selection.functions())) seeds.add(a.id);
            }
            if (seeds.isEmpty()) {
                throw new DotExportException("No functions found matching: " + selection.functions());
            }
            for (String id : reachable(seeds, internal, selection.includeCallers())) {
                Atom a = functions.get(id);
                if (selection.files().isEmpty() || matches(a.path, selection.files())) selected.add(id);
            }
            if (selected.isEmpty()) {
                throw new DotExportException("No functions reachable from " + selection.functions()
                    + " in files: " + selection.files());
            }
        } else {
            for (Atom a : functions.values()) {
                if (selection.files().isEmpty() || matches(a.path, selection.files())) selected.add(a.id);
            }
            if (selected.isEmpty() && !functions.isEmpty()) {
                throw new DotExportException("No functions found in files: " + selection.files());
            }
        }

        List<Dependency> edges = new ArrayList<>();
        Set<String> neighbours = new LinkedHashSet<>();
        for (Dependency d : internal) {
            boolean fromSelected = selected.contains(d.sourceId);
            boolean toSelected = selected.contains(d.targetId);
            if (byFunction ? !(fromSelected && toSelected) : !(fromSelected || toSelected)) continue;
            edges.add(d);
            if (!fromSelected) neighbours.add(d.sourceId);
            if (!toSelected) neighbours.add(d.targetId);
        }

        StringBuilder dot = new StringBuilder(byFunction ? "digraph function_subgraph {\n" : "digraph call_graph {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box, style=filled, fontname=Helvetica];\n");
        dot.append("  edge [color=gray];\n\n");

        Map<String, List<Atom>> byFile = new LinkedHashMap<>();
        for (String id : selected) {
            Atom a = functions.get(id);
            byFile.computeIfAbsent(a.path, k -> new ArrayList<>()).add(a);
        }
        int cluster = 0;
        for (Map.Entry<String, List<Atom>> e : byFile.entrySet()) {
            dot.append("  subgraph cluster_").append(cluster++).append(" {\n");
            dot.append("    label = ").append(quote(e.getKey())).append(";\n");
            dot.append("    style=filled;\n");
            dot.append("    color=lightblue;\n");
            dot.append("    fontname=Helvetica;\n");
            for (Atom a : e.getValue()) {
                dot.append("    ").append(quote(a.id))
                   .append(" [label=").append(quote(a.name))
                   .append(", tooltip=").append(quote(tooltip(a.sourceText)))
                   .append(", fillcolor=").append(seeds.contains(a.id) ? "gold" : "white").append("]\n");
            }
            dot.append("  }\n");
        }
        for (String id : neighbours) {
            dot.append("  ").append(quote(id))
               .append(" [label=").append(quote(functions.get(id).name))
               .append(", fillcolor=lightgray]\n");
        }
        dot.append("\n");
        for (Dependency d : edges) {
            dot.append("  ").append(quote(d.sourceId)).append(" -> ").append(quote(d.targetId));
            if ("implements".equals(d.kind)) {
                dot.append(" [style=dashed]");
            } else if (d.weight > 1) {
                dot.append(" [label=\"").append(d.weight).append("\"]");
            }
            dot.append("\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    /** Breadth-first closure over callees, and over callers when {@code backwards} is set. */
    public static Set<String> reachable(Set<String> seeds, List<Dependency> edges, boolean backwards) {
        Map<String, List<String>> next = new HashMap<>();
        for (Dependency d : edges) {
            next.computeIfAbsent(d.sourceId, k -> new ArrayList<>()).add(d.targetId);
            if (backwards) next.computeIfAbsent(d.targetId, k -> new ArrayList<>()).add(d.sourceId);
        }
        Set<String> seen = new LinkedHashSet<>(seeds);
        Deque<String> queue = new ArrayDeque<>(seeds);
        while (!queue.isEmpty()) {
            for (String n : next.getOrDefault(queue.poll(), List.of())) {
                if (seen.add(n)) queue.add(n);
            }
        }
        return seen;
    }

    private static boolean namesFunction(Atom a, Collection<String> names) {
        for (String n : names) {
            if (a.name.equals(n) || a.id.equals(n) || a.id.endsWith("/" + n)) return true;
        }
        return false;
    }

    private static boolean matches(String path, Collection<String> filter) {
        for (String f : filter) {
            if (path.equals(f) || path.endsWith("/" + f)) return true;
        }
        return false;
    }

    private static String tooltip(String text) {
        if (text == null) return "";
        String plain = text.replace('\n', ' ').replace('\r', ' ');
        return plain.length() > TOOLTIP_LIMIT ? plain.substring(0, TOOLTIP_LIMIT) + "..." : plain;
    }

    static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
