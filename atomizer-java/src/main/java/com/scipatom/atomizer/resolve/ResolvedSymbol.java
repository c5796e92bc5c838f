package com.scipatom.atomizer.resolve;

import com.scipatom.atomizer.index.OccurrenceRecord;

/**
 * Best-known facts about one symbol after resolution.
 *
 * @param definition winning definition occurrence; null for EXTERNAL and never-defined symbols
 * @param atomId     function atom id; non-null only for FUNCTION and METHOD
 */
public record ResolvedSymbol(
    String symbol,
    SymbolKind kind,
    SymbolKind structuralKind,
    String displayName,
    OccurrenceRecord definition,
    String atomId
) {

    public String path() {
        return definition != null ? definition.path() : null;
    }

    /** 1-based line the index reports for the definition. */
    public int anchorLine() {
        return definition != null ? definition.range().anchorLine() : 0;
    }
}
