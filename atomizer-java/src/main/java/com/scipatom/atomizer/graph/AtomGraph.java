package com.scipatom.atomizer.graph;

import java.util.List;

/**
 * The finished graph: atoms in tree pre-order followed by the external atom, and
 * dependencies sorted by (source, target, kind).
 */
public record AtomGraph(List<AtomModel.Atom> atoms, List<AtomModel.Dependency> dependencies) {

    public long functionAtomCount() {
        return atoms.stream().filter(a -> AtomModel.FUNCTION.equals(a.kind)).count();
    }

    public AtomModel.AtomRoot toRoot() {
        AtomModel.AtomRoot root = new AtomModel.AtomRoot();
        root.atoms = atoms;
        root.dependencies = dependencies;
        return root;
    }
}
