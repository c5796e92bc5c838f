package com.scipatom.atomizer.graph;

import com.scipatom.atomizer.graph.AtomModel.Atom;
import com.scipatom.atomizer.graph.AtomModel.Dependency;
import com.scipatom.atomizer.resolve.AtomIds;
import com.scipatom.atomizer.resolve.CandidateEdge;
import com.scipatom.atomizer.resolve.ResolvedIndex;
import com.scipatom.atomizer.resolve.ResolvedSymbol;
import com.scipatom.atomizer.resolve.SymbolTarget;
import com.scipatom.atomizer.span.FileExtraction;
import com.scipatom.atomizer.span.SpanResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Assembles the atom forest and the deduplicated dependency list.
 *
 * The tree is root folder, then folders, then files, then functions. Every function
 * symbol becomes an atom whether or not its span was found. The synthetic external
 * atom is a second root and absorbs every External and Unresolved target.
 */
public class GraphBuilder {

    private static final String ROOT_ID = AtomIds.forFolder("");

    private static final Comparator<Atom> BY_NAME = Comparator.comparing((Atom a) -> a.name)
        .thenComparing(a -> a.id);

    public AtomGraph build(ResolvedIndex resolved, Map<String, FileExtraction> extractions, String rootName) {
        Map<String, Atom> byId = new HashMap<>();
        Map<String, List<Atom>> children = new HashMap<>();

        Atom root = new Atom();
        root.id = ROOT_ID;
        root.kind = AtomModel.FOLDER;
        root.name = rootName;
        root.path = "";
        byId.put(root.id, root);

        // --- Folders and files ---
        Set<String> files = new TreeSet<>(resolved.documentPaths());
        for (ResolvedSymbol fn : resolved.functions()) {
            files.add(fn.path());
        }
        for (String path : files) {
            String parent = ensureFolders(parentDir(path), byId, children);
            Atom file = new Atom();
            file.id = AtomIds.forFile(path);
            file.kind = AtomModel.FILE;
            file.name = baseName(path);
            file.path = path;
            file.parentId = parent;
            add(file, byId, children);
        }

        // --- Functions ---
        Map<String, Integer> anchors = new HashMap<>();
        for (ResolvedSymbol fn : resolved.functions()) {
            FileExtraction extraction = extractions.get(fn.path());
            SpanResult span = extraction != null ? extraction.spanFor(fn.symbol()) : SpanResult.notFound();

            Atom atom = new Atom();
            atom.id = fn.atomId();
            atom.kind = AtomModel.FUNCTION;
            atom.name = fn.displayName();
            atom.path = fn.path();
            atom.parentId = AtomIds.forFile(fn.path());
            atom.startLine = span.found() ? span.startLine() : null;
            atom.endLine = span.found() ? span.endLine() : null;
            atom.sourceText = span.text();
            atom.confidence = span.confidence().wireName();
            atom.symbol = fn.symbol();
            add(atom, byId, children);
            anchors.put(atom.id, fn.anchorLine());
        }

        // --- Pre-order walk with deterministic sibling order ---
        List<Atom> ordered = new ArrayList<>();
        walk(root, children, anchors, ordered);

        Atom external = new Atom();
        external.id = AtomIds.EXTERNAL;
        external.kind = AtomModel.EXTERNAL;
        external.name = AtomIds.EXTERNAL;
        ordered.add(external);
        byId.put(external.id, external);

        return new AtomGraph(ordered, dependencies(resolved.candidates(), byId));
    }

    private List<Dependency> dependencies(List<CandidateEdge> candidates, Map<String, Atom> atoms) {
        // (source, target, kind) -> distinct call sites
        Map<List<String>, Set<String>> sites = new TreeMap<>(
            Comparator.comparing((List<String> k) -> k.get(0))
                      .thenComparing(k -> k.get(1))
                      .thenComparing(k -> k.get(2)));
        for (CandidateEdge c : candidates) {
            String target = targetAtomId(c.target());
            if (!atoms.containsKey(c.sourceAtomId()) || !atoms.containsKey(target)) {
                throw new IllegalStateException("edge endpoint has no atom: " + c.sourceAtomId() + " -> " + target);
            }
            sites.computeIfAbsent(List.of(c.sourceAtomId(), target, c.kind().wireName()), k -> new LinkedHashSet<>())
                 .add(c.siteKey());
        }
        List<Dependency> out = new ArrayList<>();
        for (Map.Entry<List<String>, Set<String>> e : sites.entrySet()) {
            Dependency d = new Dependency();
            d.sourceId = e.getKey().get(0);
            d.targetId = e.getKey().get(1);
            d.kind = e.getKey().get(2);
            d.weight = e.getValue().size();
            out.add(d);
        }
        return out;
    }

    static String targetAtomId(SymbolTarget target) {
        if (target instanceof SymbolTarget.Local local) return local.atomId();
        if (target instanceof SymbolTarget.External) return AtomIds.EXTERNAL;
        if (target instanceof SymbolTarget.Unresolved) return AtomIds.EXTERNAL;
        throw new IllegalStateException("unhandled target: " + target);
    }

    private void walk(Atom atom, Map<String, List<Atom>> children, Map<String, Integer> anchors, List<Atom> out) {
        out.add(atom);
        List<Atom> kids = children.getOrDefault(atom.id, List.of());
        List<Atom> sorted = new ArrayList<>(kids);
        sorted.sort(AtomModel.FILE.equals(atom.kind) ? byPosition(anchors) : BY_NAME);
        for (Atom kid : sorted) {
            walk(kid, children, anchors, out);
        }
    }

    /** Located functions by start line; not-found ones after them by anchor line. */
    private static Comparator<Atom> byPosition(Map<String, Integer> anchors) {
        return Comparator.comparing((Atom a) -> a.startLine == null)
            .thenComparingInt(a -> a.startLine != null ? a.startLine : anchors.getOrDefault(a.id, 0))
            .thenComparing(a -> a.id);
    }

    /** Creates folder atoms for {@code dir} and its ancestors; returns the id of {@code dir}'s atom. */
    private String ensureFolders(String dir, Map<String, Atom> byId, Map<String, List<Atom>> children) {
        if (dir.isEmpty()) return ROOT_ID;
        String id = AtomIds.forFolder(dir);
        if (byId.containsKey(id)) return id;
        Atom folder = new Atom();
        folder.id = id;
        folder.kind = AtomModel.FOLDER;
        folder.name = baseName(dir);
        folder.path = dir;
        folder.parentId = ensureFolders(parentDir(dir), byId, children);
        add(folder, byId, children);
        return id;
    }

    private void add(Atom atom, Map<String, Atom> byId, Map<String, List<Atom>> children) {
        if (byId.putIfAbsent(atom.id, atom) != null) {
            throw new IllegalStateException("duplicate atom id: " + atom.id);
        }
        children.computeIfAbsent(atom.parentId, k -> new ArrayList<>()).add(atom);
    }

    private static String parentDir(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    private static String baseName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
