package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.common.ErrorKind;
import org.twistmodal.logic.common.UndefinedActionException;
import org.twistmodal.logic.common.UndefinedAtomException;
import org.twistmodal.logic.formula.CommonFormula;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TestModal extends CommonFormula {

    World w1, w2, w3;

    @BeforeEach
    public void beforeEach() {
        w1 = makeWorld("w1", Map.of("p", "(1, 0)", "q", "(0, 1)"));
        w2 = makeWorld("w2", Map.of("p", "(0, 1)", "q", "(1, 0)"));
        w3 = makeWorld("w3", Map.of("p", "(1, 0)", "q", "(0, 1)"));
    }

    private Model oneEdge(TruthPair weight) {
        return new Model.Builder("M", twist).addWorld(w1).addWorld(w2)
                .addTransition("a", w1, w2, weight)
                .build();
    }

    @Test
    public void test1() {
        Model model = oneEdge(tt);
        // residue meet of (1,0) and (1,0): (meet(1,1), meet(1 => 0, 1 => 0)) = (1, 0)
        assertEquals(tt, eval("<a>q", model, w1));
        assertEquals(ff, eval("<a>p", model, w1));
        assertEquals(tt, eval("[a]q", model, w1));
        assertEquals(ff, eval("[a]p", model, w1));
    }

    @Test
    public void testNoSuccessors() {
        Model model = oneEdge(tt);
        // w2 has no a-transitions: possibility fails, necessity holds vacuously
        assertEquals(ff, eval("<a>q", model, w2));
        assertEquals(tt, eval("[a]q", model, w2));
        assertEquals(tt, eval("[a]0", model, w2));
    }

    @Test
    public void testWeights() {
        // a transition with evidence against it carries no possibility
        assertEquals(ff, eval("<a>q", oneEdge(ff), w1));
        assertEquals(none, eval("<a>q", oneEdge(none), w1));
        assertEquals(tt, eval("<a>q", oneEdge(both), w1));
        // an edge with evidence against it acts like no transition for the box
        assertEquals(tt, eval("[a]p", oneEdge(ff), w1));
        assertEquals(tt, eval("[a]p", oneEdge(ff), w2));
        // an edge without any evidence does not
        assertEquals(none, eval("[a]p", oneEdge(none), w1));
    }

    @Test
    public void testMultipleSuccessors() {
        Model model = new Model.Builder("M", twist).addWorld(w1).addWorld(w2).addWorld(w3)
                .addTransition("a", w1, w2, tt)
                .addTransition("a", w1, w3, tt)
                .build();
        // q holds in w2 only: possible, not necessary
        assertEquals(tt, eval("<a>q", model, w1));
        assertEquals(ff, eval("[a]q", model, w1));
        assertEquals(tt, eval("[a](p | q)", model, w1));
        assertEquals(tt, eval("<a>q & <a>p", model, w1));
    }

    @Test
    public void testNested() {
        Model model = new Model.Builder("M", twist).addWorld(w1).addWorld(w2)
                .addTransition("a", w1, w2, tt)
                .addTransition("b", w2, w1, tt)
                .build();
        assertEquals(tt, eval("<a><b>p", model, w1));
        assertEquals(ff, eval("<a><a>p", model, w1));
        assertEquals(tt, eval("[a][a]p", model, w1));
        assertEquals(tt, eval("<b>(p & <a>q)", model, w2));
    }

    @Test
    public void testBoxDiamondDuality() {
        Model model = new Model.Builder("M", twist).addWorld(w1).addWorld(w2).addWorld(w3)
                .addTransition("a", w1, w2, tt)
                .addTransition("a", w1, w3, both)
                .addTransition("a", w2, w2, none)
                .addTransition("a", w3, w1, ff)
                .build();
        for (String child : List.of("p", "q", "~p & q", "p -> <a>q", "TOP")) {
            Formula phi = parser.parse(child);
            Box box = new Box(phi, "a");
            for (World w : model.worlds()) {
                TruthPair diamondOfNegation = new Diamond(new Not(phi), "a").evaluate(model, w, twist);
                assertEquals(twist.negation(diamondOfNegation), box.evaluate(model, w, twist), child + " at " + w);
                assertEquals(eval("~<a>~(" + child + ")", model, w), eval("[a](" + child + ")", model, w));
            }
        }
    }

    @Test
    public void testUndefinedAction() {
        Model model = oneEdge(tt);
        UndefinedActionException e = assertThrows(UndefinedActionException.class,
                () -> eval("<b>q", model, w1));
        assertEquals(ErrorKind.UNDEFINED_ACTION, e.kind());
        assertEquals("b", e.getAction());
        assertEquals("Action 'b' is not defined in PLTS 'M'", e.getMessage());
        assertThrows(UndefinedActionException.class, () -> eval("p & [b]q", model, w1));
    }

    @Test
    public void testDeclaredActionWithoutTransitions() {
        Model model = new Model.Builder("M", twist).addWorld(w1).addAction("c").build();
        assertEquals(ff, eval("<c>p", model, w1));
        assertEquals(tt, eval("[c]~p", model, w1));
    }

    @Test
    public void testAtomMissingInSuccessor() {
        World bare = makeWorld("bare", Map.of());
        Model model = new Model.Builder("M", twist).addWorld(w1).addWorld(bare)
                .addTransition("a", w1, bare, tt)
                .build();
        UndefinedAtomException e = assertThrows(UndefinedAtomException.class, () -> eval("<a>p", model, w1));
        assertEquals("bare", e.getWorld());
    }
}
