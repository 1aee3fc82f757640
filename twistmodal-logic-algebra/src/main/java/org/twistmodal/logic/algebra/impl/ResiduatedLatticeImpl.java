package org.twistmodal.logic.algebra.impl;

import org.twistmodal.logic.algebra.LabelPair;
import org.twistmodal.logic.algebra.Lattice;
import org.twistmodal.logic.algebra.ResiduatedLattice;

import java.util.*;

public class ResiduatedLatticeImpl implements ResiduatedLattice {
    private final String residuatedName;
    private final Lattice lattice;

    public ResiduatedLatticeImpl(String residuatedName, Lattice lattice) {
        this.residuatedName = Objects.requireNonNull(residuatedName);
        this.lattice = Objects.requireNonNull(lattice);
    }

    public ResiduatedLatticeImpl(String residuatedName,
                                 String latticeName,
                                 Collection<String> elements,
                                 Set<LabelPair> order,
                                 Map<LabelPair, String> implicationTable) {
        this(residuatedName, new LatticeImpl(latticeName, elements, order, implicationTable));
    }

    @Override
    public String residuatedName() {
        return residuatedName;
    }

    @Override
    public Lattice lattice() {
        return lattice;
    }

    @Override
    public String name() {
        return lattice.name();
    }

    @Override
    public Set<String> elements() {
        return lattice.elements();
    }

    @Override
    public Set<LabelPair> order() {
        return lattice.order();
    }

    @Override
    public Map<LabelPair, String> implicationTable() {
        return lattice.implicationTable();
    }

    @Override
    public boolean contains(String label) {
        return lattice.contains(label);
    }

    @Override
    public boolean lessOrEqual(String a, String b) {
        return lattice.lessOrEqual(a, b);
    }

    @Override
    public String meet(String a, String b) {
        return lattice.meet(a, b);
    }

    @Override
    public String join(String a, String b) {
        return lattice.join(a, b);
    }

    @Override
    public String meetSet(Collection<String> labels) {
        return lattice.meetSet(labels);
    }

    @Override
    public String joinSet(Collection<String> labels) {
        return lattice.joinSet(labels);
    }

    @Override
    public Optional<String> implication(String a, String b) {
        return lattice.implication(a, b);
    }

    @Override
    public boolean isImplicationTotal() {
        return lattice.isImplicationTotal();
    }

    @Override
    public String top() {
        return lattice.top();
    }

    @Override
    public String bottom() {
        return lattice.bottom();
    }

    @Override
    public String toString() {
        return residuatedName;
    }
}
