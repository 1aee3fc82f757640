package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.Objects;
import java.util.Set;

/*
~A | B
 */
public record MaterialImplies(Formula left, Formula right) implements Formula {

    public MaterialImplies {
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
    }

    @Override
    public TruthPair evaluate(Model model, World world, TwistStructure twist) {
        TruthPair notLeft = twist.negation(left.evaluate(model, world, twist));
        return twist.weakJoin(notLeft, right.evaluate(model, world, twist));
    }

    @Override
    public Set<String> atoms() {
        return Formula.union(left, right);
    }

    @Override
    public String print() {
        return "(" + left.print() + " -> " + right.print() + ")";
    }
}
