package com.scipatom.atomizer.index;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * POJOs matching the JSON produced by {@code scip print --json}.
 * Field names use @SerializedName for the snake_case mapping.
 */
public final class ScipIndex {

    private ScipIndex() {}

    public static class Root {
        @SerializedName("metadata")         public Metadata metadata;
        @SerializedName("documents")        public List<Document> documents;
        @SerializedName("external_symbols") public List<SymbolInformation> externalSymbols;

        public List<Document> getDocuments() {
            return documents != null ? documents : Collections.emptyList();
        }

        public List<SymbolInformation> getExternalSymbols() {
            return externalSymbols != null ? externalSymbols : Collections.emptyList();
        }
    }

    public static class Metadata {
        @SerializedName("version")      public Integer version;
        @SerializedName("tool_info")    public ToolInfo toolInfo;
        @SerializedName("project_root") public String projectRoot;
    }

    public static class ToolInfo {
        @SerializedName("name")    public String name;
        @SerializedName("version") public String version;
    }

    public static class Document {
        @SerializedName("language")      public String language;
        @SerializedName("relative_path") public String relativePath;
        @SerializedName("occurrences")   public List<Occurrence> occurrences;
        @SerializedName("symbols")       public List<SymbolInformation> symbols;

        public List<Occurrence> getOccurrences() {
            return occurrences != null ? occurrences : Collections.emptyList();
        }

        public List<SymbolInformation> getSymbols() {
            return symbols != null ? symbols : Collections.emptyList();
        }
    }

    public static class Occurrence {
        @SerializedName("range")           public List<Integer> range;
        @SerializedName("symbol")          public String symbol;
        @SerializedName("symbol_roles")    public Integer symbolRoles;
        @SerializedName("enclosing_range") public List<Integer> enclosingRange;
    }

    public static class SymbolInformation {
        @SerializedName("symbol")           public String symbol;
        @JsonAdapter(ScipKindAdapter.class)
        @SerializedName("kind")             public Integer kind;
        @SerializedName("display_name")     public String displayName;
        @SerializedName("documentation")    public List<String> documentation;
        @SerializedName("enclosing_symbol") public String enclosingSymbol;
        @SerializedName("relationships")    public List<Relationship> relationships;

        public List<Relationship> getRelationships() {
            return relationships != null ? relationships : Collections.emptyList();
        }
    }

    public static class Relationship {
        @SerializedName("symbol")             public String symbol;
        @SerializedName("is_reference")       public boolean isReference;
        @SerializedName("is_implementation")  public boolean isImplementation;
        @SerializedName("is_type_definition") public boolean isTypeDefinition;
        @SerializedName("is_definition")      public boolean isDefinition;
    }
}
