package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.Objects;
import java.util.Set;

/*
(A -> B) & (B -> A), both directions as material implications
 */
public record MaterialIff(Formula left, Formula right) implements Formula {

    public MaterialIff {
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
    }

    @Override
    public TruthPair evaluate(Model model, World world, TwistStructure twist) {
        TruthPair l = left.evaluate(model, world, twist);
        TruthPair r = right.evaluate(model, world, twist);
        TruthPair leftToRight = twist.weakJoin(twist.negation(l), r);
        TruthPair rightToLeft = twist.weakJoin(twist.negation(r), l);
        return twist.weakMeet(leftToRight, rightToLeft);
    }

    @Override
    public Set<String> atoms() {
        return Formula.union(left, right);
    }

    @Override
    public String print() {
        return "(" + left.print() + " <-> " + right.print() + ")";
    }
}
