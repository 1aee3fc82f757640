package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.Objects;
import java.util.Set;

/*
(A => B) & (B => A), with the residuated implication
 */
public record Iff(Formula left, Formula right) implements Formula {

    public Iff {
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
    }

    @Override
    public TruthPair evaluate(Model model, World world, TwistStructure twist) {
        TruthPair l = left.evaluate(model, world, twist);
        TruthPair r = right.evaluate(model, world, twist);
        return twist.weakMeet(twist.implication(l, r), twist.implication(r, l));
    }

    @Override
    public Set<String> atoms() {
        return Formula.union(left, right);
    }

    @Override
    public String print() {
        return "(" + left.print() + " <=> " + right.print() + ")";
    }
}
