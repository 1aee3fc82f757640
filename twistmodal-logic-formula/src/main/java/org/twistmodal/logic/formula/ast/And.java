package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.Objects;
import java.util.Set;

// weak meet
public record And(Formula left, Formula right) implements Formula {

    public And {
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
    }

    @Override
    public TruthPair evaluate(Model model, World world, TwistStructure twist) {
        return twist.weakMeet(left.evaluate(model, world, twist), right.evaluate(model, world, twist));
    }

    @Override
    public Set<String> atoms() {
        return Formula.union(left, right);
    }

    @Override
    public String print() {
        return "(" + left.print() + " & " + right.print() + ")";
    }
}
