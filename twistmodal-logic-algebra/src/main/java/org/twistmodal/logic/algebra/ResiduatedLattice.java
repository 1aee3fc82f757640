package org.twistmodal.logic.algebra;

import org.twistmodal.logic.common.UndefinedOperationException;

/**
 * A lattice known under a second name, the one of the residuated lattice. The algebra is that of
 * the wrapped lattice; the implication table plays the role of the residuum.
 */
public interface ResiduatedLattice extends Lattice {

    String residuatedName();

    Lattice lattice();

    default String requireImplication(String a, String b) {
        return implication(a, b).orElseThrow(() -> new UndefinedOperationException(
                "Implication definition missing in base lattice '" + name() + "' for (" + a + ", " + b + ")"));
    }
}
