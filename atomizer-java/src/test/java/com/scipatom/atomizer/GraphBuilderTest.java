package com.scipatom.atomizer;

import com.scipatom.atomizer.graph.AtomGraph;
import com.scipatom.atomizer.graph.AtomModel;
import com.scipatom.atomizer.graph.AtomModel.Atom;
import com.scipatom.atomizer.graph.AtomModel.Dependency;
import com.scipatom.atomizer.graph.GraphBuilder;
import com.scipatom.atomizer.index.OccurrenceRecord;
import com.scipatom.atomizer.index.SourceRange;
import com.scipatom.atomizer.resolve.CandidateEdge;
import com.scipatom.atomizer.resolve.EdgeKind;
import com.scipatom.atomizer.resolve.ResolvedIndex;
import com.scipatom.atomizer.resolve.ResolvedSymbol;
import com.scipatom.atomizer.resolve.SymbolKind;
import com.scipatom.atomizer.resolve.SymbolTarget;
import com.scipatom.atomizer.span.Confidence;
import com.scipatom.atomizer.span.FileExtraction;
import com.scipatom.atomizer.span.SpanResult;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    private static ResolvedSymbol fn(String name, String path, int line) {
        String symbol = "rust-analyzer cargo demo 0.1.0 " + name + "().";
        OccurrenceRecord def = new OccurrenceRecord(symbol, path,
            new SourceRange(line - 1, 7, line - 1, 7 + name.length()), OccurrenceRecord.ROLE_DEFINITION, null);
        return new ResolvedSymbol(symbol, SymbolKind.FUNCTION, SymbolKind.FUNCTION, name,
            def, "fn:demo/" + name);
    }

    private static CandidateEdge call(ResolvedSymbol from, ResolvedSymbol to, String site) {
        return new CandidateEdge(from.atomId(), new SymbolTarget.Local(to.atomId(), to.symbol()), EdgeKind.CALLS, site);
    }

    private static ResolvedIndex resolved(List<ResolvedSymbol> functions, List<CandidateEdge> candidates,
                                          List<String> documents) {
        Map<String, ResolvedSymbol> symbols = new LinkedHashMap<>();
        for (ResolvedSymbol f : functions) symbols.put(f.symbol(), f);
        return new ResolvedIndex(symbols, functions, candidates, documents, List.of(), 0, 0);
    }

    private static Map<String, FileExtraction> spans(String path, Map<String, SpanResult> bySymbol) {
        return Map.of(path, new FileExtraction(path, false, null, bySymbol));
    }

    private final ResolvedSymbol caller = fn("caller", "src/app/a.rs", 3);
    private final ResolvedSymbol helper = fn("helper", "src/app/a.rs", 10);
    private final ResolvedSymbol generated = fn("generated", "src/app/a.rs", 1);

    private AtomGraph sample() {
        List<CandidateEdge> candidates = List.of(
            call(caller, helper, "src/app/a.rs:4:8"),
            call(caller, helper, "src/app/a.rs:5:8"),
            call(caller, helper, "src/app/a.rs:6:8"),
            call(caller, helper, "src/app/a.rs:6:8"),
            new CandidateEdge(caller.atomId(), new SymbolTarget.Unresolved("ghost"), EdgeKind.UNRESOLVED, "src/app/a.rs:7:4"),
            new CandidateEdge(caller.atomId(), new SymbolTarget.External("std"), EdgeKind.EXTERNAL, "src/app/a.rs:7:20"));
        Map<String, SpanResult> bySymbol = new LinkedHashMap<>();
        bySymbol.put(caller.symbol(), new SpanResult(3, 8, "fn caller() {}", Confidence.EXACT));
        bySymbol.put(helper.symbol(), new SpanResult(10, 12, "fn helper() {}", Confidence.EXACT));
        bySymbol.put(generated.symbol(), SpanResult.notFound());
        return new GraphBuilder().build(
            resolved(List.of(generated, caller, helper), candidates, List.of("src/app/a.rs", "src/lib.rs")),
            spans("src/app/a.rs", bySymbol),
            "demo");
    }

    private static Atom atom(AtomGraph g, String id) {
        return g.atoms().stream().filter(a -> a.id.equals(id)).findFirst().orElseThrow();
    }

    @Test
    void everyNonRootAtomHasItsParentInTheGraph() {
        AtomGraph g = sample();
        Set<String> ids = g.atoms().stream().map(a -> a.id).collect(Collectors.toSet());
        assertEquals(g.atoms().size(), ids.size(), "atom ids must be unique");
        for (Atom a : g.atoms()) {
            if (a.parentId == null) {
                assertTrue(a.id.equals("folder:") || a.id.equals("external"), "unexpected root " + a.id);
            } else {
                assertTrue(ids.contains(a.parentId), "dangling parent of " + a.id);
            }
        }
    }

    @Test
    void treeIsWrittenInPreOrder() {
        List<String> ids = sample().atoms().stream().map(a -> a.id).collect(Collectors.toList());
        assertEquals(List.of(
            "folder:",
            "folder:src",
            "folder:src/app",
            "file:src/app/a.rs",
            "fn:demo/caller",
            "fn:demo/helper",
            "fn:demo/generated",
            "file:src/lib.rs",
            "external"), ids);
    }

    @Test
    void rootFolderCarriesSourceRootName() {
        Atom root = atom(sample(), "folder:");
        assertEquals("demo", root.name);
        assertEquals("", root.path);
        assertEquals(AtomModel.FOLDER, root.kind);
    }

    @Test
    void functionWithoutSpanIsStillEmitted() {
        Atom gen = atom(sample(), "fn:demo/generated");
        assertEquals(AtomModel.FUNCTION, gen.kind);
        assertEquals("not-found", gen.confidence);
        assertEquals("", gen.sourceText);
        assertNull(gen.startLine);
        assertNull(gen.endLine);
        assertEquals("file:src/app/a.rs", gen.parentId);
    }

    @Test
    void repeatedCallsCollapseIntoOneWeightedEdge() {
        List<Dependency> deps = sample().dependencies();
        List<Dependency> toHelper = deps.stream()
            .filter(d -> d.targetId.equals("fn:demo/helper"))
            .collect(Collectors.toList());
        assertEquals(1, toHelper.size());
        assertEquals(3, toHelper.get(0).weight, "duplicate site records count once");
        assertEquals("calls", toHelper.get(0).kind);
    }

    @Test
    void externalAndUnresolvedTargetsPointAtTheExternalAtom() {
        List<Dependency> deps = sample().dependencies();
        Set<String> kindsToExternal = new HashSet<>();
        for (Dependency d : deps) {
            if (d.targetId.equals("external")) kindsToExternal.add(d.kind);
        }
        assertEquals(Set.of("external", "unresolved"), kindsToExternal);
    }

    @Test
    void dependenciesSortedBySourceTargetKind() {
        List<Dependency> deps = sample().dependencies();
        assertEquals(3, deps.size());
        assertEquals("external", deps.get(0).targetId);
        assertEquals("external", deps.get(0).kind);
        assertEquals("unresolved", deps.get(1).kind);
        assertEquals("fn:demo/helper", deps.get(2).targetId);
    }

    @Test
    void fileWithoutFunctionsStillGetsAnAtom() {
        Atom lib = atom(sample(), "file:src/lib.rs");
        assertEquals("folder:src", lib.parentId);
        assertEquals("lib.rs", lib.name);
    }
}
