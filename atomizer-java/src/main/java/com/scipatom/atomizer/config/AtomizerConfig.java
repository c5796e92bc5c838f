package com.scipatom.atomizer.config;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of the optional atomizer.json run configuration.
 * Every field may be absent; getters supply the defaults.
 */
public class AtomizerConfig {

    /** Size of the span extraction pool (default: available processors). */
    @SerializedName("worker_threads")
    private Integer workerThreads;

    /**
     * Macro names whose brace-delimited arguments are parsed as item lists,
     * e.g. {@code verus! { ... }} (default: ["verus"]).
     */
    @SerializedName("item_list_macros")
    private List<String> itemListMacros;

    /** How many lines above the anchor the fallback scan looks for a fn header (default: 50). */
    @SerializedName("fallback_search_window")
    private Integer fallbackSearchWindow;

    /** Upper bound on the length of a fallback span (default: 400). */
    @SerializedName("fallback_max_lines")
    private Integer fallbackMaxLines;

    @SerializedName("summary_path")
    private String summaryPath;

    @SerializedName("dot_path")
    private String dotPath;

    /** Restricts the DOT call graph to these files (default: all files). */
    @SerializedName("dot_files")
    private List<String> dotFiles;

    /** Restricts the DOT call graph to these functions and their transitive callees. */
    @SerializedName("dot_functions")
    private List<String> dotFunctions;

    /** With dot_functions, also draw the transitive callers (default: false). */
    @SerializedName("dot_include_callers")
    private Boolean dotIncludeCallers;

    public int getWorkerThreads() {
        return workerThreads != null && workerThreads > 0
                ? workerThreads
                : Runtime.getRuntime().availableProcessors();
    }

    public List<String> getItemListMacros() {
        return itemListMacros != null ? itemListMacros : Collections.singletonList("verus");
    }

    public int getFallbackSearchWindow() { return fallbackSearchWindow != null ? fallbackSearchWindow : 50; }
    public int getFallbackMaxLines()     { return fallbackMaxLines != null ? fallbackMaxLines : 400; }
    public String getSummaryPath()       { return summaryPath; }
    public String getDotPath()           { return dotPath; }
    public List<String> getDotFiles()    { return dotFiles != null ? dotFiles : Collections.emptyList(); }
    public List<String> getDotFunctions() { return dotFunctions != null ? dotFunctions : Collections.emptyList(); }
    public boolean isDotIncludeCallers() { return dotIncludeCallers != null && dotIncludeCallers; }

    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public void setSummaryPath(String summaryPath)  { this.summaryPath = summaryPath; }
    public void setDotPath(String dotPath)          { this.dotPath = dotPath; }
    public void setDotFunctions(List<String> dotFunctions)  { this.dotFunctions = dotFunctions; }
    public void setDotIncludeCallers(boolean include)       { this.dotIncludeCallers = include; }

    public static AtomizerConfig defaults() {
        return new AtomizerConfig();
    }
}
