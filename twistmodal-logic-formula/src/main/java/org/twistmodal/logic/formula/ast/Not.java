package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.Objects;
import java.util.Set;

public record Not(Formula child) implements Formula {

    public Not {
        Objects.requireNonNull(child);
    }

    @Override
    public TruthPair evaluate(Model model, World world, TwistStructure twist) {
        return twist.negation(child.evaluate(model, world, twist));
    }

    @Override
    public Set<String> atoms() {
        return child.atoms();
    }

    @Override
    public String print() {
        return "~" + child.print();
    }
}
