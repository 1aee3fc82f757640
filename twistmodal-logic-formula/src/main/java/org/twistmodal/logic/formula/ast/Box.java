package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.Objects;
import java.util.Set;

/*
[a]A is always computed as ~<a>~A
 */
public record Box(Formula child, String action) implements Formula {

    public Box {
        Objects.requireNonNull(child);
        Objects.requireNonNull(action);
    }

    @Override
    public TruthPair evaluate(Model model, World world, TwistStructure twist) {
        Diamond dual = new Diamond(new Not(child), action);
        return twist.negation(dual.evaluate(model, world, twist));
    }

    @Override
    public Set<String> atoms() {
        return child.atoms();
    }

    @Override
    public String print() {
        return "[" + action + "]" + child.print();
    }
}
