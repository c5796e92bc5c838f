package com.scipatom.atomizer.resolve;

/**
 * One dependency observation before deduplication.
 *
 * @param siteKey identity of the call site; observations sharing a key count once
 */
public record CandidateEdge(
    String sourceAtomId,
    SymbolTarget target,
    EdgeKind kind,
    String siteKey
) {}
