package org.twistmodal.logic.algebra.impl;

import org.twistmodal.logic.algebra.Lattice;
import org.twistmodal.logic.algebra.ResiduatedLattice;
import org.twistmodal.logic.common.UndefinedOperationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestResiduatedLattice extends CommonAlgebra {

    @Test
    public void test1() {
        Lattice lattice = fourElementLattice();
        ResiduatedLattice rl = new ResiduatedLatticeImpl("Boolean4", lattice);
        assertEquals("Boolean4", rl.residuatedName());
        assertEquals("M2", rl.name());
        assertSame(lattice, rl.lattice());
        assertEquals(lattice.elements(), rl.elements());
        assertEquals(lattice.top(), rl.top());
        assertEquals("b", rl.requireImplication("a", "0"));
        assertEquals("1", rl.requireImplication("a", "a"));
        assertEquals("0", rl.meetSet(List.of("a", "b")));
    }

    @Test
    public void test2() {
        ResiduatedLattice rl = new ResiduatedLatticeImpl("Empty", "E", List.of("x"), reflexive(List.of("x")),
                java.util.Map.of());
        assertEquals("x", rl.top());
        assertEquals("x", rl.bottom());
        assertThrows(UndefinedOperationException.class, () -> rl.requireImplication("x", "x"));
    }
}
