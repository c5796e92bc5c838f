package com.scipatom.atomizer.resolve;

/**
 * Where a reference points. Every consumer has to handle all three cases;
 * there is no null target.
 */
public sealed interface SymbolTarget permits SymbolTarget.Local, SymbolTarget.External, SymbolTarget.Unresolved {

    String symbol();

    /** A function defined in the analyzed tree, identified by its atom id. */
    record Local(String atomId, String symbol) implements SymbolTarget {}

    /** A symbol the index declares but defines outside the analyzed tree. */
    record External(String symbol) implements SymbolTarget {}

    /** A symbol with no resolvable definition anywhere. */
    record Unresolved(String symbol) implements SymbolTarget {}
}
