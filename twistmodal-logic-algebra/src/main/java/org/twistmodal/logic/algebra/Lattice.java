package org.twistmodal.logic.algebra;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A finite lattice given by its elements, a partial order and an explicit implication table.
 * Meet and join are derived from the order when asked for; they are not stored.
 * <p>
 * Instances are immutable. Construction fails with an
 * {@link org.twistmodal.logic.common.InvalidAlgebraException} when some pair of elements lacks a unique
 * meet or join.
 */
public interface Lattice {

    String name();

    Set<String> elements();

    Set<LabelPair> order();

    Map<LabelPair, String> implicationTable();

    boolean contains(String label);

    /*
    raw lookup in the order relation; reflexivity and transitivity are assumed, not enforced
     */
    boolean lessOrEqual(String a, String b);

    String meet(String a, String b);

    String join(String a, String b);

    /**
     * @return the meet of all labels; {@link #top()} for an empty collection
     */
    String meetSet(Collection<String> labels);

    /**
     * @return the join of all labels; {@link #bottom()} for an empty collection
     */
    String joinSet(Collection<String> labels);

    /**
     * @return the table entry for {@code (a, b)}, empty when the table has no such entry.
     * There is no default value: callers must treat an empty result as an error.
     */
    Optional<String> implication(String a, String b);

    boolean isImplicationTotal();

    String top();

    String bottom();
}
