package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Abstract syntax of a formula. The set of node kinds is closed; nodes are immutable and never shared
 * between trees by the parser.
 * <p>
 * Evaluation is a side-effect free walk over the tree. Its cost is bounded by the size of the formula
 * times the branching of the model for every nested modal operator, so deeply nested modalities over densely
 * connected models grow exponentially; callers that need a bound impose it themselves.
 */
public sealed interface Formula permits Atom, Not, And, Or, MaterialImplies, MaterialIff, Implies, Iff,
        Diamond, Box {

    /**
     * @return the value of the formula in {@code world}, as an element of {@code twist}
     * @throws org.twistmodal.logic.common.UndefinedAtomException      when a proposition is not assigned
     * @throws org.twistmodal.logic.common.UndefinedActionException    when a modality uses an unknown action
     * @throws org.twistmodal.logic.common.UndefinedOperationException when the implication table is incomplete
     */
    TruthPair evaluate(Model model, World world, TwistStructure twist);

    /**
     * @return the propositions occurring in the formula, without TOP and BOT
     */
    Set<String> atoms();

    /**
     * @return formula text which parses back to an equal tree; binary nodes are parenthesized
     */
    String print();

    static Set<String> union(Formula left, Formula right) {
        Set<String> set = new LinkedHashSet<>(left.atoms());
        set.addAll(right.atoms());
        return Collections.unmodifiableSet(set);
    }
}
