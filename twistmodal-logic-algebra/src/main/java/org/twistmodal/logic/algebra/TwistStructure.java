package org.twistmodal.logic.algebra;

import java.util.List;
import java.util.Set;

/**
 * The four-valued algebra L x L over a residuated lattice L. Every operation is computed from the meet,
 * join and implication of the base; nothing is stored beyond the carrier and the two derived orders.
 */
public interface TwistStructure {

    record OrderedPair(TruthPair lower, TruthPair upper) {
    }

    /*
    external name, not part of the algebra; defaults to the residuated lattice's name
     */
    String name();

    TwistStructure withName(String name);

    ResiduatedLattice residuatedLattice();

    Set<TruthPair> elements();

    boolean contains(TruthPair pair);

    /*
    (t1,f1) <= (t2,f2) iff t1 <= t2 and f2 <= f1
     */
    Set<OrderedPair> truthOrder();

    /*
    (t1,f1) <= (t2,f2) iff t1 <= t2 and f1 <= f2
     */
    Set<OrderedPair> infoOrder();

    boolean truthLessOrEqual(TruthPair p1, TruthPair p2);

    boolean infoLessOrEqual(TruthPair p1, TruthPair p2);

    // (top, bottom)
    TruthPair truthTop();

    // (bottom, top)
    TruthPair truthBottom();

    TruthPair negation(TruthPair pair);

    TruthPair weakMeet(TruthPair p1, TruthPair p2);

    TruthPair weakJoin(TruthPair p1, TruthPair p2);

    /**
     * Combines the weight of a transition with the value of its target:
     * {@code (t1 ∧ t2, (t1 ⇒ f2) ∧ (t2 ⇒ f1))}.
     *
     * @throws org.twistmodal.logic.common.UndefinedOperationException when one of the implications is not in
     *                                                                   the table
     */
    TruthPair residueMeet(TruthPair p1, TruthPair p2);

    /**
     * {@code ((t1 ⇒ t2) ∧ (f2 ⇒ f1), t1 ∧ f2)}
     *
     * @throws org.twistmodal.logic.common.UndefinedOperationException when one of the implications is not in
     *                                                                   the table
     */
    TruthPair implication(TruthPair p1, TruthPair p2);

    TruthPair consensus(TruthPair p1, TruthPair p2);

    TruthPair acceptAll(TruthPair p1, TruthPair p2);

    // (top, bottom) for an empty list
    TruthPair weakMeetSet(List<TruthPair> pairs);

    // (bottom, top) for an empty list
    TruthPair weakJoinSet(List<TruthPair> pairs);
}
