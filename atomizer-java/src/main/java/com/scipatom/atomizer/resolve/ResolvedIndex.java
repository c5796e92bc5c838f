package com.scipatom.atomizer.resolve;

import java.util.List;
import java.util.Map;

/**
 * Aggregate result of the resolution phase.
 *
 * @param functions     function symbols ordered by (path, anchor line, symbol)
 * @param documentPaths indexed documents present in the source tree, sorted
 * @param warnings      recoverable problems, in discovery order
 */
public record ResolvedIndex(
    Map<String, ResolvedSymbol> symbols,
    List<ResolvedSymbol> functions,
    List<CandidateEdge> candidates,
    List<String> documentPaths,
    List<String> warnings,
    int duplicateDefinitions,
    int unresolvedSymbols
) {}
