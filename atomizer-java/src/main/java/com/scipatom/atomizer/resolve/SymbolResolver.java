package com.scipatom.atomizer.resolve;

import com.scipatom.atomizer.index.DocumentRecord;
import com.scipatom.atomizer.index.LoadedIndex;
import com.scipatom.atomizer.index.OccurrenceRecord;
import com.scipatom.atomizer.index.ScipIndex;
import com.scipatom.atomizer.index.SourceRange;
import com.scipatom.atomizer.source.SourceTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the symbol table from a loaded index: picks each symbol's definition,
 * classifies it, assigns function atom IDs, and emits candidate dependency edges
 * from the function enclosing each reference.
 *
 * Static IR is the source of truth for definitions: the first occurrence claiming the
 * Definition role wins and later claims only produce warnings.
 */
public class SymbolResolver {

    private static final Comparator<OccurrenceRecord> BY_POSITION =
        Comparator.comparingInt((OccurrenceRecord o) -> o.range().startLine())
                  .thenComparingInt(o -> o.range().startChar());

    public ResolvedIndex resolve(LoadedIndex index, SourceTree tree) {
        List<String> warnings = new ArrayList<>();
        Map<String, ScipIndex.SymbolInformation> infos = index.symbolInfo();

        // --- Every non-local symbol the index mentions ---
        Set<String> allSymbols = new LinkedHashSet<>();
        for (Map.Entry<String, ScipIndex.SymbolInformation> e : infos.entrySet()) {
            if (ScipSymbol.isLocal(e.getKey())) continue;
            allSymbols.add(e.getKey());
            for (ScipIndex.Relationship rel : e.getValue().getRelationships()) {
                if (rel.symbol != null && !ScipSymbol.isLocal(rel.symbol)) {
                    allSymbols.add(rel.symbol);
                }
            }
        }
        for (DocumentRecord doc : index.documents()) {
            for (OccurrenceRecord occ : doc.occurrences()) {
                if (!ScipSymbol.isLocal(occ.symbol())) {
                    allSymbols.add(occ.symbol());
                }
            }
        }

        // --- Definition selection: first claim wins ---
        Map<String, OccurrenceRecord> definitions = new HashMap<>();
        int duplicates = 0;
        for (DocumentRecord doc : index.documents()) {
            for (OccurrenceRecord occ : doc.occurrences()) {
                if (!occ.isDefinition() || ScipSymbol.isLocal(occ.symbol())) continue;
                OccurrenceRecord first = definitions.get(occ.symbol());
                if (first == null) {
                    definitions.put(occ.symbol(), occ);
                } else if (!first.siteKey().equals(occ.siteKey())) {
                    duplicates++;
                    warn(warnings, "duplicate definition of " + occ.symbol() + " at " + occ.siteKey()
                        + " ignored (first at " + first.siteKey() + ")");
                }
            }
        }

        // --- Documents present on disk ---
        Set<String> presentDocs = new TreeSet<>();
        for (DocumentRecord doc : index.documents()) {
            if (tree.exists(doc.path())) {
                presentDocs.add(doc.path());
            } else {
                warn(warnings, "indexed document not found in source tree: " + doc.path());
            }
        }

        Set<String> localPackages = new HashSet<>();
        for (String symbol : definitions.keySet()) {
            localPackages.add(ScipSymbol.parse(symbol).packageName());
        }

        // --- Classification ---
        Map<String, SymbolKind> structuralKinds = new HashMap<>();
        Map<String, SymbolKind> kinds = new HashMap<>();
        int unresolved = 0;
        for (String symbol : allSymbols) {
            SymbolKind structural = SymbolClassifier.classify(symbol, infos.get(symbol));
            OccurrenceRecord def = definitions.get(symbol);
            SymbolKind kind;
            if (def == null) {
                ScipSymbol parsed = ScipSymbol.parse(symbol);
                kind =index.externalSymbols().contains(symbol) || !localPackages.contains(parsed.packageName())
                    ? SymbolKind.EXTERNAL
                    : SymbolKind.UNRESOLVED;
            } else if (!presentDocs.contains(def.path())) {
                kind = SymbolKind.UNRESOLVED;
                if (structural.isFunctionLike()) {
                    warn(warnings, "definition of " + symbol + " is in a missing file: " + def.path());
                }
            } else {
                kind = structural;
            }
            if (kind == SymbolKind.UNRESOLVED) unresolved++;
            structuralKinds.put(symbol, structural);
            kinds.put(symbol, kind);
        }

        // --- Function atom IDs, assigned in (path, anchor, symbol) order ---
        List<String> functionSymbols = new ArrayList<>();
        for (String symbol : allSymbols) {
            if (kinds.get(symbol).isFunctionLike()) functionSymbols.add(symbol);
        }
        functionSymbols.sort(Comparator
            .comparing((String s) -> definitions.get(s).path())
            .thenComparingInt(s -> definitions.get(s).range().startLine())
            .thenComparingInt(s -> definitions.get(s).range().startChar())
            .thenComparing(s -> s));

        Map<String, String> atomIds = new HashMap<>();
        Set<String> usedIds = new HashSet<>();
        for (String symbol : functionSymbols) {
            String base = AtomIds.forFunction(symbol, displayName(symbol, infos.get(symbol)));
            String id = base;
            for (int n = 2; usedIds.contains(id); n++) {
                id = base + "~" + n;
            }
            usedIds.add(id);
            atomIds.put(symbol, id);
        }

        Map<String, ResolvedSymbol> symbols = new LinkedHashMap<>();
        for (String symbol : allSymbols) {
            symbols.put(symbol, new ResolvedSymbol(
                symbol,
                kinds.get(symbol),
                structuralKinds.get(symbol),
                displayName(symbol, infos.get(symbol)),
                definitions.get(symbol),
                atomIds.get(symbol)
            ));
        }
        List<ResolvedSymbol> functions = new ArrayList<>();
        for (String symbol : functionSymbols) {
            functions.add(symbols.get(symbol));
        }

        // --- Candidate edges ---
        List<CandidateEdge> candidates = new ArrayList<>();
        for (DocumentRecord doc : index.documents()) {
            if (!presentDocs.contains(doc.path())) continue;
            collectReferences(doc, symbols, candidates);
        }
        for (ResolvedSymbol fn : functions) {
            ScipIndex.SymbolInformation info = infos.get(fn.symbol());
            if (info == null) continue;
            for (ScipIndex.Relationship rel : info.getRelationships()) {
                if (!rel.isImplementation || rel.symbol == null || rel.symbol.equals(fn.symbol())) continue;
                ResolvedSymbol target = symbols.get(rel.symbol);
                if (target == null || !target.structuralKind().isFunctionLike()) continue;
                candidates.add(new CandidateEdge(
                    fn.atomId(), targetFor(target), EdgeKind.IMPLEMENTS,
                    "impl:" + fn.symbol() + "->" + rel.symbol));
            }
        }

        return new ResolvedIndex(
            Collections.unmodifiableMap(symbols),
            Collections.unmodifiableList(functions),
            Collections.unmodifiableList(candidates),
            List.copyOf(presentDocs),
            Collections.unmodifiableList(warnings),
            duplicates,
            unresolved
        );
    }

    private void collectReferences(DocumentRecord doc,
                                   Map<String, ResolvedSymbol> symbols,
                                   List<CandidateEdge> candidates) {
        // Scope boundaries: every non-local definition except parameters
        List<OccurrenceRecord> boundaries = new ArrayList<>();
        List<OccurrenceRecord> functionDefs = new ArrayList<>();
        for (OccurrenceRecord occ : doc.occurrences()) {
            if (!occ.isDefinition() || ScipSymbol.isLocal(occ.symbol())) continue;
            ScipSymbol.Descriptor last = ScipSymbol.parse(occ.symbol()).last();
            if (last != null && (last.suffix() == ScipSymbol.Suffix.PARAMETER
                    || last.suffix() == ScipSymbol.Suffix.TYPE_PARAMETER)) {
                continue;
            }
            boundaries.add(occ);
            ResolvedSymbol sym = symbols.get(occ.symbol());
            if (sym != null && sym.kind().isFunctionLike()) {
                functionDefs.add(occ);
            }
        }
        boundaries.sort(BY_POSITION);

        boolean useEnclosingRanges = !functionDefs.isEmpty()
            && functionDefs.stream().allMatch(o -> o.enclosingRange() != null);

        for (OccurrenceRecord occ : doc.occurrences()) {
            if (occ.isDefinition() || occ.isImport() || ScipSymbol.isLocal(occ.symbol())) continue;
            ResolvedSymbol target = symbols.get(occ.symbol());
            if (target == null || !target.structuralKind().isFunctionLike()) continue;

            ResolvedSymbol enclosing = useEnclosingRanges
                ? innermostEnclosing(functionDefs, occ, symbols)
                : nearestPrecedingFunction(boundaries, occ, symbols);
            if (enclosing == null) continue;

            SymbolTarget t = targetFor(target);
            if (t instanceof SymbolTarget.Local local && local.atomId().equals(enclosing.atomId())) {
                continue;
            }
            candidates.add(new CandidateEdge(enclosing.atomId(), t, edgeKindFor(t), occ.siteKey()));
        }
    }

    private ResolvedSymbol innermostEnclosing(List<OccurrenceRecord> functionDefs,
                                              OccurrenceRecord occ,
                                              Map<String, ResolvedSymbol> symbols) {
        OccurrenceRecord best = null;
        for (OccurrenceRecord def : functionDefs) {
            SourceRange r = def.enclosingRange();
            if (!r.contains(occ.range())) continue;
            if (best == null || best.enclosingRange().contains(r)) {
                best = def;
            }
        }
        return best != null ? symbols.get(best.symbol()) : null;
    }

    private ResolvedSymbol nearestPrecedingFunction(List<OccurrenceRecord> boundaries,
                                                    OccurrenceRecord occ,
                                                    Map<String, ResolvedSymbol> symbols) {
        int lo = 0;
        int hi = boundaries.size() - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (BY_POSITION.compare(boundaries.get(mid), occ) <= 0) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        if (found < 0) return null;
        ResolvedSymbol sym = symbols.get(boundaries.get(found).symbol());
        return sym != null && sym.kind().isFunctionLike() ? sym : null;
    }

    static SymbolTarget targetFor(ResolvedSymbol symbol) {
        return switch (symbol.kind()) {
            case FUNCTION, METHOD -> new SymbolTarget.Local(symbol.atomId(), symbol.symbol());
            case EXTERNAL -> new SymbolTarget.External(symbol.symbol());
            case UNRESOLVED, TYPE, MODULE, FILE, VALUE -> new SymbolTarget.Unresolved(symbol.symbol());
        };
    }

    static EdgeKind edgeKindFor(SymbolTarget target) {
        if (target instanceof SymbolTarget.Local) return EdgeKind.CALLS;
        if (target instanceof SymbolTarget.External) return EdgeKind.EXTERNAL;
        if (target instanceof SymbolTarget.Unresolved) return EdgeKind.UNRESOLVED;
        throw new IllegalStateException("unhandled target: " + target);
    }

    private static String displayName(String symbol, ScipIndex.SymbolInformation info) {
        if (info != null && info.displayName != null && !info.displayName.isEmpty()) {
            return info.displayName;
        }
        ScipSymbol.Descriptor last = ScipSymbol.parse(symbol).last();
        return last != null && !last.name().isEmpty() ? last.name() : symbol;
    }

    private static void warn(List<String> warnings, String message) {
        warnings.add(message);
        System.err.println("[atomizer] WARNING: " + message);
    }
}
