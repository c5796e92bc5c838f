package com.scipatom.atomizer.output;

import com.google.gson.annotations.SerializedName;

/**
 * Counters describing one run. Everything recoverable that happened shows up here.
 */
public class RunSummary {
    @SerializedName("atoms")                 public int atoms;
    @SerializedName("function_atoms")        public int functionAtoms;
    @SerializedName("edges")                 public int edges;
    @SerializedName("degraded_files")        public int degradedFiles;
    @SerializedName("unresolved_symbols")    public int unresolvedSymbols;
    @SerializedName("duplicate_definitions") public int duplicateDefinitions;
    @SerializedName("not_found_spans")       public int notFoundSpans;
    @SerializedName("fallback_spans")        public int fallbackSpans;

    /** One-line rendering for the log. */
    public String describe() {
        return atoms + " atoms (" + functionAtoms + " functions), "
            + edges + " edges, "
            + degradedFiles + " degraded files, "
            + unresolvedSymbols + " unresolved symbols, "
            + duplicateDefinitions + " duplicate definitions, "
            + notFoundSpans + " spans not found, "
            + fallbackSpans + " fallback spans";
    }
}
