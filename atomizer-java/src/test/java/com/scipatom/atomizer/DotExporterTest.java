package com.scipatom.atomizer;

import com.scipatom.atomizer.graph.AtomGraph;
import com.scipatom.atomizer.graph.AtomModel;
import com.scipatom.atomizer.output.DotExporter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DotExporterTest {

    private static AtomModel.Atom fn(String id, String name, String path) {
        AtomModel.Atom a = new AtomModel.Atom();
        a.id = id;
        a.kind = AtomModel.FUNCTION;
        a.name = name;
        a.path = path;
        a.parentId = "file:" + path;
        a.sourceText = "fn " + name + "() { \"quoted\" }";
        return a;
    }

    private static AtomModel.Dependency dep(String from, String to, String kind, int weight) {
        AtomModel.Dependency d = new AtomModel.Dependency();
        d.sourceId = from;
        d.targetId = to;
        d.kind = kind;
        d.weight = weight;
        return d;
    }

    private AtomGraph makeGraph() {
        AtomModel.Atom external = new AtomModel.Atom();
        external.id = "external";
        external.kind = AtomModel.EXTERNAL;
        external.name = "external";
        return new AtomGraph(
            List.of(
                fn("fn:demo/run", "run", "src/lib.rs"),
                fn("fn:demo/a/helper", "helper", "src/a.rs"),
                fn("fn:demo/b/Counter/fmt", "fmt", "src/b.rs"),
                fn("fn:demo/b/Show/fmt", "fmt", "src/b.rs"),
                external),
            List.of(
                dep("fn:demo/b/Counter/fmt", "fn:demo/b/Show/fmt", "implements", 1),
                dep("fn:demo/run", "external", "external", 1),
                dep("fn:demo/run", "fn:demo/a/helper", "calls", 2)));
    }

    @Test
    void oneClusterPerFile() {
        String dot = new DotExporter().render(makeGraph(), DotExporter.Selection.all());
        assertTrue(dot.startsWith("digraph call_graph {"));
        assertTrue(dot.contains("label = \"src/a.rs\""));
        assertTrue(dot.contains("label = \"src/b.rs\""));
        assertTrue(dot.contains("label = \"src/lib.rs\""));
        assertTrue(dot.contains("subgraph cluster_2"));
        assertFalse(dot.contains("subgraph cluster_3"));
    }

    @Test
    void edgesToExternalAtomAreLeftOut() {
        String dot = new DotExporter().render(makeGraph(), DotExporter.Selection.all());
        assertFalse(dot.contains("\"external\""));
    }

    @Test
    void weightsAndImplementsEdgesAreStyled() {
        String dot = new DotExporter().render(makeGraph(), DotExporter.Selection.all());
        assertTrue(dot.contains("\"fn:demo/run\" -> \"fn:demo/a/helper\" [label=\"2\"]"));
        assertTrue(dot.contains("\"fn:demo/b/Counter/fmt\" -> \"fn:demo/b/Show/fmt\" [style=dashed]"));
    }

    @Test
    void tooltipsEscapeQuotes() {
        String dot = new DotExporter().render(makeGraph(), DotExporter.Selection.all());
        assertTrue(dot.contains("tooltip=\"fn run() { \\\"quoted\\\" }\""));
    }

    @Test
    void filterKeepsNeighboursUnclustered() {
        String dot = new DotExporter().render(makeGraph(), DotExporter.Selection.ofFiles(List.of("a.rs")));
        assertTrue(dot.contains("label = \"src/a.rs\""));
        assertFalse(dot.contains("label = \"src/lib.rs\""));
        assertTrue(dot.contains("\"fn:demo/run\" [label=\"run\", fillcolor=lightgray]"));
        assertFalse(dot.contains("Counter"));
    }

    @Test
    void filterMatchingNothingFails() {
        assertThrows(DotExporter.DotExportException.class,
            () -> new DotExporter().render(makeGraph(), DotExporter.Selection.ofFiles(List.of("missing.rs"))));
    }

    @Test
    void writeCreatesFile(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("graphs/call.dot");
        DotExporter exporter = new DotExporter();
        exporter.write(exporter.render(makeGraph(), DotExporter.Selection.all()), out);
        assertTrue(Files.readString(out).endsWith("}\n"));
    }

    private static DotExporter.Selection functions(boolean includeCallers, String... names) {
        return new DotExporter.Selection(List.of(), List.of(names), includeCallers);
    }

    @Test
    void functionSelectionFollowsCallees() {
        String dot = new DotExporter().render(makeGraph(), functions(false, "run"));
        assertTrue(dot.startsWith("digraph function_subgraph {"));
        assertTrue(dot.contains("\"fn:demo/run\" [label=\"run\", tooltip="));
        assertTrue(dot.contains("fillcolor=gold]"));
        assertTrue(dot.contains("\"fn:demo/run\" -> \"fn:demo/a/helper\" [label=\"2\"]"));
        assertFalse(dot.contains("Counter"));
        assertFalse(dot.contains("\"external\""));
    }

    @Test
    void calleeAloneLeavesCallerOut() {
        String dot = new DotExporter().render(makeGraph(), functions(false, "helper"));
        assertTrue(dot.contains("\"fn:demo/a/helper\""));
        assertFalse(dot.contains("\"fn:demo/run\""));
    }

    @Test
    void includeCallersWalksBackwards() {
        String dot = new DotExporter().render(makeGraph(), functions(true, "helper"));
        assertTrue(dot.contains("\"fn:demo/run\" [label=\"run\", tooltip="));
        assertTrue(dot.contains("\"fn:demo/run\" -> \"fn:demo/a/helper\""));
        assertFalse(dot.contains("lightgray"));
    }

    @Test
    void functionsMatchByIdSuffix() {
        String dot = new DotExporter().render(makeGraph(), functions(false, "Counter/fmt"));
        assertTrue(dot.contains("\"fn:demo/b/Counter/fmt\""));
        assertTrue(dot.contains("\"fn:demo/b/Show/fmt\""), "implements edges are followed too");
        assertTrue(dot.contains("[style=dashed]"));
    }

    @Test
    void unknownFunctionFails() {
        DotExporter.DotExportException e = assertThrows(DotExporter.DotExportException.class,
            () -> new DotExporter().render(makeGraph(), functions(true, "nowhere")));
        assertTrue(e.getMessage().contains("nowhere"));
    }

    @Test
    void functionAndFileFiltersCombine() {
        DotExporter.Selection selection = new DotExporter.Selection(List.of("a.rs"), List.of("run"), false);
        String dot = new DotExporter().render(makeGraph(), selection);
        assertTrue(dot.contains("\"fn:demo/a/helper\""));
        assertFalse(dot.contains("\"fn:demo/run\""));
    }

    @Test
    void reachableIsABreadthFirstClosure() {
        List<AtomModel.Dependency> edges = List.of(
            dep("a", "b", "calls", 1), dep("b", "c", "calls", 1), dep("x", "a", "calls", 1));
        assertEquals(Set.of("a", "b", "c"), DotExporter.reachable(Set.of("a"), edges, false));
        assertEquals(Set.of("a", "b", "c", "x"), DotExporter.reachable(Set.of("a"), edges, true));
        assertEquals(Set.of("c"), DotExporter.reachable(Set.of("c"), edges, false));
    }
}
