package com.scipatom.atomizer.resolve;

/**
 * Classification of an index symbol. Only FUNCTION and METHOD symbols become function atoms;
 * TYPE and MODULE contribute scope path segments; VALUE covers fields, constants and
 * parameters; EXTERNAL and UNRESOLVED describe symbols with no definition in the tree.
 */
public enum SymbolKind {
    FUNCTION,
    METHOD,
    TYPE,
    MODULE,
    FILE,
    VALUE,
    EXTERNAL,
    UNRESOLVED;

    public boolean isFunctionLike() {
        return this == FUNCTION || this == METHOD;
    }
}
