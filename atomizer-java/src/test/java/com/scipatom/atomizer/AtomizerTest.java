package com.scipatom.atomizer;

import com.scipatom.atomizer.config.AtomizerConfig;
import com.scipatom.atomizer.graph.AtomModel.Atom;
import com.scipatom.atomizer.graph.AtomModel.Dependency;
import com.scipatom.atomizer.output.AtomSerializer;
import com.scipatom.atomizer.output.DotExporter;
import com.scipatom.atomizer.output.RunSummary;
import com.scipatom.atomizer.source.SourceTree;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: runs the whole pipeline on the verus-sample fixture.
 */
class AtomizerTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/verus-sample");

    private static final Path INDEX = FIXTURE_ROOT.resolve("index.json");

    private static Atomizer.Result result;

    @BeforeAll
    static void runPipeline() {
        result = new Atomizer(withThreads(2)).analyze(INDEX, FIXTURE_ROOT);
    }

    private static AtomizerConfig withThreads(int n) {
        AtomizerConfig config = AtomizerConfig.defaults();
        config.setWorkerThreads(n);
        return config;
    }

    private static Atom atom(String id) {
        Optional<Atom> found = result.graph().atoms().stream().filter(a -> a.id.equals(id)).findFirst();
        assertTrue(found.isPresent(), "missing atom " + id);
        return found.get();
    }

    private static Dependency edge(String source, String target, String kind) {
        Optional<Dependency> found = result.graph().dependencies().stream()
            .filter(d -> d.sourceId.equals(source) && d.targetId.equals(target) && d.kind.equals(kind))
            .findFirst();
        assertTrue(found.isPresent(), "missing edge " + source + " -> " + target + " (" + kind + ")");
        return found.get();
    }

    @Test
    void summaryCountsEverythingThatHappened() {
        RunSummary s = result.summary();
        assertEquals(21, s.atoms);
        assertEquals(13, s.functionAtoms);
        assertEquals(9, s.edges);
        assertEquals(1, s.degradedFiles, "broken.rs fails the structural parse");
        assertEquals(1, s.notFoundSpans, "generated_getter has no item of its own");
        assertEquals(3, s.fallbackSpans);
        assertEquals(1, s.duplicateDefinitions);
        assertEquals(1, s.unresolvedSymbols, "gone.rs is indexed but not on disk");
    }

    @Test
    void forestHasFolderRootAndExternalRoot() {
        Atom root = result.graph().atoms().get(0);
        assertEquals("folder:", root.id);
        assertEquals("verus-sample", root.name);
        assertNull(root.parentId);

        Atom external = result.graph().atoms().get(result.graph().atoms().size() - 1);
        assertEquals("external", external.id);
        assertNull(external.parentId);
    }

    @Test
    void everyParentExists() {
        Set<String> ids = result.graph().atoms().stream().map(a -> a.id).collect(Collectors.toSet());
        for (Atom a : result.graph().atoms()) {
            if (a.parentId != null) {
                assertTrue(ids.contains(a.parentId), "dangling parent of " + a.id);
            }
        }
    }

    @Test
    void missingFileGetsNoAtom() {
        Set<String> ids = result.graph().atoms().stream().map(a -> a.id).collect(Collectors.toSet());
        assertFalse(ids.contains("file:src/gone.rs"));
        assertFalse(ids.contains("fn:sample/gone/vanished"));
    }

    @Test
    void exactSpansIncludeDocComments() {
        Atom run = atom("fn:sample/run");
        assertEquals(6, run.startLine);
        assertEquals(12, run.endLine);
        assertEquals("exact", run.confidence);
        assertTrue(run.sourceText.startsWith("/// Entry point."));

        Atom helper = atom("fn:sample/a/helper");
        assertEquals(1, helper.startLine);
        assertEquals(5, helper.endLine);
        assertEquals("file:src/a.rs", helper.parentId);
    }

    @Test
    void nestedFunctionHasItsOwnSpan() {
        Atom outer = atom("fn:sample/a/outer");
        Atom inner = atom("fn:sample/a/outer/inner");
        assertEquals(7, outer.startLine);
        assertEquals(12, outer.endLine);
        assertEquals(8, inner.startLine);
        assertEquals(10, inner.endLine);
    }

    @Test
    void methodsInsideImplBlock() {
        Atom bump = atom("fn:sample/b/Counter/bump");
        assertEquals(10, bump.startLine);
        assertEquals(13, bump.endLine);
        Atom ctor = atom("fn:sample/b/Counter/new");
        assertEquals(6, ctor.startLine);
        assertEquals(8, ctor.endLine);
    }

    @Test
    void verusFunctionsInsideMacroAreExact() {
        Atom lemma = atom("fn:sample/verified/lemma_double");
        assertEquals(9, lemma.startLine);
        assertEquals(19, lemma.endLine);
        assertEquals("exact", lemma.confidence);
        assertTrue(lemma.sourceText.contains("decreases x,"));

        Atom triple = atom("fn:sample/verified/exec_triple");
        assertEquals(21, triple.startLine);
        assertEquals(27, triple.endLine);

        Atom dbl = atom("fn:sample/verified/double");
        assertEquals(5, dbl.startLine);
        assertEquals(7, dbl.endLine);
    }

    @Test
    void macroGeneratedFunctionIsNotFound() {
        Atom gen = atom("fn:sample/b/generated_getter");
        assertEquals("not-found", gen.confidence);
        assertNull(gen.startLine);
        assertEquals("", gen.sourceText);
    }

    @Test
    void brokenFileFallsBackToHeuristicSpans() {
        Atom ok = atom("fn:sample/broken/ok_before");
        assertEquals("approximate-fallback", ok.confidence);
        assertEquals(1, ok.startLine);
        assertEquals(3, ok.endLine);

        Atom unbalanced = atom("fn:sample/broken/unbalanced");
        assertEquals(5, unbalanced.startLine);
        assertEquals(10, unbalanced.endLine);

        Atom after = atom("fn:sample/broken/after");
        assertEquals(12, after.startLine);
        assertEquals(14, after.endLine);
    }

    @Test
    void callEdgesCarryDistinctSiteWeights() {
        assertEquals(2, edge("fn:sample/run", "fn:sample/a/helper", "calls").weight);
        assertEquals(1, edge("fn:sample/run", "fn:sample/b/Counter/new", "calls").weight);
        assertEquals(1, edge("fn:sample/run", "fn:sample/b/Counter/bump", "calls").weight);
        assertEquals(1, edge("fn:sample/a/outer", "fn:sample/a/outer/inner", "calls").weight);
        assertEquals(1, edge("fn:sample/a/outer", "fn:sample/a/helper", "calls").weight);
        assertEquals(1, edge("fn:sample/broken/after", "fn:sample/broken/ok_before", "calls").weight);
        // one reference is recorded twice in the index
        assertEquals(3, edge("fn:sample/verified/lemma_double", "fn:sample/verified/double", "calls").weight);
    }

    @Test
    void externalAndUnresolvedTargets() {
        assertEquals(1, edge("fn:sample/b/Counter/bump", "external", "external").weight);
        assertEquals(1, edge("fn:sample/run", "external", "unresolved").weight);
    }

    @Test
    void typeReferencesProduceNoEdges() {
        Set<String> targets = new HashSet<>();
        for (Dependency d : result.graph().dependencies()) targets.add(d.targetId);
        for (String t : targets) {
            assertTrue(t.equals("external") || t.startsWith("fn:"), "unexpected target " + t);
        }
    }

    @Test
    void outputIsIdenticalAcrossThreadCounts() {
        AtomSerializer serializer = new AtomSerializer();
        String single = serializer.toJson(new Atomizer(withThreads(1)).analyze(INDEX, FIXTURE_ROOT).graph());
        String many = serializer.toJson(new Atomizer(withThreads(4)).analyze(INDEX, FIXTURE_ROOT).graph());
        assertEquals(single, many);
    }

    @Test
    void atomizeWritesAllConfiguredOutputs(@TempDir Path tmp) throws Exception {
        AtomizerConfig config = withThreads(2);
        config.setSummaryPath(tmp.resolve("out/summary.json").toString());
        config.setDotPath(tmp.resolve("out/graph.dot").toString());

        new Atomizer(config).atomize(INDEX, FIXTURE_ROOT, tmp.resolve("out/atoms.json"));

        assertTrue(Files.exists(tmp.resolve("out/atoms.json")));
        assertTrue(Files.readString(tmp.resolve("out/summary.json")).contains("\"function_atoms\": 13"));
        assertTrue(Files.readString(tmp.resolve("out/graph.dot")).startsWith("digraph call_graph {"));
    }

    @Test
    void unmatchedDotSelectionWritesNothing(@TempDir Path tmp) {
        AtomizerConfig config = withThreads(2);
        config.setSummaryPath(tmp.resolve("summary.json").toString());
        config.setDotPath(tmp.resolve("graph.dot").toString());
        config.setDotFunctions(List.of("no_such_function"));
        Path output = tmp.resolve("atoms.json");

        assertThrows(DotExporter.DotExportException.class,
            () -> new Atomizer(config).atomize(INDEX, FIXTURE_ROOT, output));
        assertFalse(Files.exists(output));
        assertFalse(Files.exists(tmp.resolve("summary.json")));
        assertFalse(Files.exists(tmp.resolve("graph.dot")));
    }

    @Test
    void dotFunctionsDrawsReachableSubgraph(@TempDir Path tmp) throws Exception {
        AtomizerConfig config = withThreads(2);
        config.setDotPath(tmp.resolve("graph.dot").toString());
        config.setDotFunctions(List.of("outer"));

        new Atomizer(config).atomize(INDEX, FIXTURE_ROOT, tmp.resolve("atoms.json"));

        String dot = Files.readString(tmp.resolve("graph.dot"));
        assertTrue(dot.startsWith("digraph function_subgraph {"));
        assertTrue(dot.contains("\"fn:sample/a/outer\" -> \"fn:sample/a/outer/inner\""));
        assertTrue(dot.contains("\"fn:sample/a/outer\" -> \"fn:sample/a/helper\""));
        assertFalse(dot.contains("\"fn:sample/run\""));
    }

    @Test
    void missingSourceRootIsFatal(@TempDir Path tmp) {
        Path output = tmp.resolve("atoms.json");
        assertThrows(SourceTree.SourceTreeException.class,
            () -> new Atomizer(withThreads(1)).atomize(INDEX, tmp.resolve("nope"), output));
        assertFalse(Files.exists(output), "nothing is written on a fatal error");
    }
}
