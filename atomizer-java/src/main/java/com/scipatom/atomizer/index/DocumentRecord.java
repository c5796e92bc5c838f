package com.scipatom.atomizer.index;

import java.util.List;

/**
 * Per-document view of the index: the symbols it declares and every occurrence in it,
 * in index order.
 */
public record DocumentRecord(
    String path,
    String language,
    List<ScipIndex.SymbolInformation> symbols,
    List<OccurrenceRecord> occurrences
) {}
