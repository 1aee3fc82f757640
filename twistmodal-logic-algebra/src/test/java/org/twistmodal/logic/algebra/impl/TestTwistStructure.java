package org.twistmodal.logic.algebra.impl;

import org.twistmodal.logic.algebra.LabelPair;
import org.twistmodal.logic.algebra.ResiduatedLattice;
import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.common.UndefinedOperationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestTwistStructure extends CommonAlgebra {

    private static TruthPair p(String t, String f) {
        return TruthPair.of(t, f);
    }

    @Test
    public void test1() {
        TwistStructure twist = twist(twoElementLattice());
        assertEquals(Set.of(p("0", "0"), p("0", "1"), p("1", "0"), p("1", "1")), twist.elements());
        assertEquals(p("1", "0"), twist.truthTop());
        assertEquals(p("0", "1"), twist.truthBottom());
        assertEquals("RL2", twist.name());
    }

    @Test
    public void testOrders() {
        TwistStructure twist = twist(twoElementLattice());
        assertTrue(twist.truthLessOrEqual(p("0", "1"), p("1", "0")));
        assertFalse(twist.truthLessOrEqual(p("1", "0"), p("0", "1")));
        assertTrue(twist.truthLessOrEqual(p("0", "1"), p("0", "0")));
        assertTrue(twist.infoLessOrEqual(p("0", "0"), p("1", "1")));
        assertFalse(twist.infoLessOrEqual(p("0", "1"), p("1", "0")));
        // four-element carrier: 9 pairs in each order (a product of two 3-pair chains)
        assertEquals(9, twist.truthOrder().size());
        assertEquals(9, twist.infoOrder().size());
        assertTrue(twist.truthOrder().contains(new TwistStructure.OrderedPair(p("0", "1"), p("1", "0"))));
        assertTrue(twist.infoOrder().contains(new TwistStructure.OrderedPair(p("0", "0"), p("1", "1"))));
        for (TwistStructure.OrderedPair pair : twist.truthOrder()) {
            assertTrue(twist.truthLessOrEqual(pair.lower(), pair.upper()));
        }
    }

    @Test
    public void testNegationIsInvolution() {
        TwistStructure twist = twist(fourElementLattice());
        for (TruthPair pair : twist.elements()) {
            assertEquals(pair, twist.negation(twist.negation(pair)));
        }
        assertEquals(p("b", "a"), twist.negation(p("a", "b")));
    }

    @Test
    public void testWeakOperations() {
        TwistStructure twist = twist(fourElementLattice());
        assertEquals(p("0", "1"), twist.weakMeet(p("a", "a"), p("b", "b")));
        assertEquals(p("1", "0"), twist.weakJoin(p("a", "a"), p("b", "b")));
        assertEquals(p("0", "0"), twist.consensus(p("a", "a"), p("b", "b")));
        assertEquals(p("1", "1"), twist.acceptAll(p("a", "a"), p("b", "b")));
        // De Morgan through the negation
        for (TruthPair x : twist.elements()) {
            for (TruthPair y : twist.elements()) {
                assertEquals(twist.negation(twist.weakMeet(x, y)),
                        twist.weakJoin(twist.negation(x), twist.negation(y)));
            }
        }
    }

    @Test
    public void testSetAggregation() {
        TwistStructure twist = twist(fourElementLattice());
        assertEquals(p("1", "0"), twist.weakMeetSet(List.of()));
        assertEquals(p("0", "1"), twist.weakJoinSet(List.of()));
        List<TruthPair> pairs = List.of(p("a", "0"), p("b", "a"), p("1", "b"));
        assertEquals(p("0", "1"), twist.weakMeetSet(pairs));
        assertEquals(p("1", "0"), twist.weakJoinSet(pairs));
        TruthPair folded = twist.weakJoin(twist.weakJoin(pairs.get(0), pairs.get(1)), pairs.get(2));
        assertEquals(folded, twist.weakJoinSet(pairs));
        assertEquals(p("a", "b"), twist.weakMeetSet(List.of(p("a", "b"))));
    }

    @Test
    public void testResidueMeetAndImplication() {
        TwistStructure twist = twist(twoElementLattice());
        // (meet(1,1), meet(1=>0, 1=>0))
        assertEquals(p("1", "0"), twist.residueMeet(p("1", "0"), p("1", "0")));
        assertEquals(p("0", "1"), twist.residueMeet(p("1", "0"), p("0", "1")));
        // a zero-strength edge contributes nothing for, and full evidence against
        assertEquals(p("0", "1"), twist.residueMeet(p("0", "1"), p("1", "0")));
        assertEquals(p("1", "0"), twist.implication(p("0", "1"), p("0", "1")));
        assertEquals(p("0", "1"), twist.implication(p("1", "0"), p("0", "1")));
        assertEquals(p("1", "0"), twist.implication(p("1", "0"), p("1", "0")));
    }

    @Test
    public void testMissingImplication() {
        ResiduatedLattice rl = new ResiduatedLatticeImpl("RP", "P", List.of("0", "1"),
                reflexive(List.of("0", "1"), LabelPair.of("0", "1")),
                Map.of(LabelPair.of("1", "1"), "1"));
        TwistStructure twist = new TwistStructureImpl(rl);
        UndefinedOperationException e = assertThrows(UndefinedOperationException.class,
                () -> twist.residueMeet(p("1", "0"), p("1", "0")));
        assertTrue(e.getMessage().contains("(1, 0)"), e.getMessage());
        assertThrows(UndefinedOperationException.class, () -> twist.implication(p("0", "0"), p("1", "1")));
        // the weak operations do not need the table
        assertEquals(p("0", "1"), twist.weakMeet(p("0", "0"), p("1", "1")));
    }

    @Test
    public void testWithName() {
        TwistStructure twist = twist(twoElementLattice());
        TwistStructure named = twist.withName("T2");
        assertEquals("T2", named.name());
        assertEquals("RL2", twist.name());
        assertSame(twist.elements(), named.elements());
        assertSame(twist.residuatedLattice(), named.residuatedLattice());
    }
}
