package org.twistmodal.logic.model.impl;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.model.AccessibilityRelation;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TestAccessibilityRelation {
    private final TruthPair tt = TruthPair.of("1", "0");
    private final TruthPair ff = TruthPair.of("0", "1");

    @Test
    public void test1() {
        AccessibilityRelation relation = new AccessibilityRelationImpl.Builder("a")
                .addTransition("u", "v", tt)
                .addTransition("u", "w", ff)
                .addTransition("v", "v", tt)
                .build();
        assertEquals("a", relation.action());
        assertEquals(3, relation.size());
        assertFalse(relation.isEmpty());
        assertEquals(2, relation.sources().size());
        assertEquals(Map.of("v", tt, "w", ff), relation.successors("u"));
        assertEquals(tt, relation.weight("v", "v").orElseThrow());
        assertTrue(relation.weight("w", "u").isEmpty());
        assertTrue(relation.successors("w").isEmpty());

        Map<String, Integer> outDegree = new HashMap<>();
        relation.visit((source, targets) -> outDegree.put(source, targets.size()));
        assertEquals(Map.of("u", 2, "v", 1), outDegree);
        assertEquals("[a]\nu --> v:(1, 0), w:(0, 1)\nv --> v:(1, 0)\n", relation.toString());
    }

    @Test
    public void test2() {
        AccessibilityRelationImpl.Builder builder = new AccessibilityRelationImpl.Builder("a")
                .addTransition("u", "v", tt);
        AccessibilityRelation relation = builder.addTransition("u", "v", ff).build();
        assertEquals(1, relation.size());
        assertEquals(ff, relation.weight("u", "v").orElseThrow());
        assertTrue(new AccessibilityRelationImpl.Builder("b").build().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> relation.successors("u").put("x", tt));

        assertThrows(IllegalStateException.class, () -> builder.addTransition("v", "u", tt));
        assertThrows(IllegalStateException.class, builder::build);
        assertEquals(1, relation.size());
    }
}
