package com.scipatom.atomizer.resolve;

import com.scipatom.atomizer.index.ScipIndex;

import java.util.Set;

/**
 * Structural classification of a symbol from its SCIP kind, falling back to the
 * shape of its last descriptor when the analyzer left the kind unspecified.
 */
public final class SymbolClassifier {

    private SymbolClassifier() {}

    private static final Set<Integer> FUNCTION_KINDS = Set.of(
        17,  // Function
        25   // Macro
    );

    private static final Set<Integer> METHOD_KINDS = Set.of(
        9,   // Constructor
        26,  // Method
        66,  // AbstractMethod
        67,  // MethodSpecification
        68,  // ProtocolMethod
        69,  // PureVirtualMethod
        70,  // TraitMethod
        71,  // TypeClassMethod
        74,  // MethodAlias
        76,  // SingletonMethod
        80   // StaticMethod
    );

    private static final Set<Integer> TYPE_KINDS = Set.of(
        3,   // AssociatedType
        7,   // Class
        11,  // Enum
        21,  // Interface
        33,  // Object
        42,  // Protocol
        49,  // Struct
        53,  // Trait
        54,  // Type
        55,  // TypeAlias
        56,  // TypeClass
        59   // Union
    );

    private static final Set<Integer> MODULE_KINDS = Set.of(
        29,  // Module
        30,  // Namespace
        35,  // Package
        64   // Library
    );

    private static final int FILE_KIND = 16;

    public static SymbolKind classify(String symbol, ScipIndex.SymbolInformation info) {
        if (ScipSymbol.isLocal(symbol)) {
            return SymbolKind.VALUE;
        }
        Integer kind = info != null ? info.kind : null;
        if (kind != null && kind != 0) {
            if (FUNCTION_KINDS.contains(kind)) return SymbolKind.FUNCTION;
            if (METHOD_KINDS.contains(kind))   return SymbolKind.METHOD;
            if (TYPE_KINDS.contains(kind))     return SymbolKind.TYPE;
            if (MODULE_KINDS.contains(kind))   return SymbolKind.MODULE;
            if (kind == FILE_KIND)             return SymbolKind.FILE;
            return SymbolKind.VALUE;
        }
        return classifyByDescriptor(ScipSymbol.parse(symbol));
    }

    static SymbolKind classifyByDescriptor(ScipSymbol parsed) {
        ScipSymbol.Descriptor last = parsed.last();
        if (last == null) {
            return SymbolKind.VALUE;
        }
        switch (last.suffix()) {
            case METHOD: {
                int n = parsed.descriptors().size();
                if (n >= 2) {
                    ScipSymbol.Suffix owner = parsed.descriptors().get(n - 2).suffix();
                    if (owner == ScipSymbol.Suffix.TYPE || owner == ScipSymbol.Suffix.TYPE_PARAMETER) {
                        return SymbolKind.METHOD;
                    }
                }
                return SymbolKind.FUNCTION;
            }
            case MACRO:
                return SymbolKind.FUNCTION;
            case TYPE:
                return SymbolKind.TYPE;
            case NAMESPACE:
                return SymbolKind.MODULE;
            default:
                return SymbolKind.VALUE;
        }
    }
}
