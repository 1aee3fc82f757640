package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.common.UndefinedActionException;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Weighted possibility {@code <a>A}: the weak join, over all stored {@code a}-transitions leaving the world,
 * of the residue meet of the transition's weight with the value of {@code A} in the target.
 * Without transitions the result is {@code (bottom, top)}.
 */
public record Diamond(Formula child, String action) implements Formula {

    public Diamond {
        Objects.requireNonNull(child);
        Objects.requireNonNull(action);
    }

    @Override
    public TruthPair evaluate(Model model, World world, TwistStructure twist) {
        if (!model.hasAction(action)) {
            throw new UndefinedActionException(action, model.name());
        }
        Map<String, TruthPair> successors = model.successors(action, world);
        List<TruthPair> results = new ArrayList<>(successors.size());
        for (Map.Entry<String, TruthPair> entry : successors.entrySet()) {
            // the model checks at construction that every target is one of its worlds
            World target = model.world(entry.getKey()).orElseThrow();
            TruthPair valueInTarget = child.evaluate(model, target, twist);
            results.add(twist.residueMeet(entry.getValue(), valueInTarget));
        }
        return twist.weakJoinSet(results);
    }

    @Override
    public Set<String> atoms() {
        return child.atoms();
    }

    @Override
    public String print() {
        return "<" + action + ">" + child.print();
    }
}
