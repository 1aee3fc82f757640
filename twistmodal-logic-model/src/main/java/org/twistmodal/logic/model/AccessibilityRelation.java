package org.twistmodal.logic.model;

import org.twistmodal.logic.algebra.TruthPair;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * The weighted transitions of one action, keyed by the long names of the worlds.
 * An absent (source, target) entry means "no transition", which differs from a transition of bottom weight.
 */
public interface AccessibilityRelation {

    String action();

    // number of transitions
    int size();

    boolean isEmpty();

    Set<String> sources();

    /**
     * @return target long name to weight, in insertion order; empty when the source has no transitions
     */
    Map<String, TruthPair> successors(String source);

    Optional<TruthPair> weight(String source, String target);

    void visit(BiConsumer<String, Map<String, TruthPair>> consumer);
}
