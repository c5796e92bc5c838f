package com.scipatom.atomizer.graph;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs matching the atoms.json output.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class AtomModel {

    private AtomModel() {}

    public static final String FOLDER = "folder";
    public static final String FILE = "file";
    public static final String FUNCTION = "function";
    public static final String EXTERNAL = "external";

    public static class AtomRoot {
        @SerializedName("atoms")        public List<Atom> atoms;
        @SerializedName("dependencies") public List<Dependency> dependencies;
    }

    public static class Atom {
        @SerializedName("id")          public String id;
        @SerializedName("kind")        public String kind;        // folder, file, function, external
        @SerializedName("name")        public String name;
        @SerializedName("path")        public String path;        // null for the external atom
        @SerializedName("parent_id")   public String parentId;    // null for forest roots
        @SerializedName("start_line")  public Integer startLine;  // functions only, 1-based
        @SerializedName("end_line")    public Integer endLine;    // functions only, inclusive
        @SerializedName("source_text") public String sourceText;  // functions only; "" when not found
        @SerializedName("confidence")  public String confidence;  // exact, approximate-fallback, not-found
        @SerializedName("symbol")      public String symbol;      // raw SCIP symbol, functions only
    }

    public static class Dependency {
        @SerializedName("source_id") public String sourceId;
        @SerializedName("target_id") public String targetId;
        @SerializedName("kind")      public String kind;    // calls, implements, external, unresolved
        @SerializedName("weight")    public int weight;     // distinct call sites
    }
}
