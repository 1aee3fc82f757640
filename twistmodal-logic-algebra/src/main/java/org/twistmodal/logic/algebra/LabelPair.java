package org.twistmodal.logic.algebra;

import java.util.Objects;

/**
 * Ordered pair of lattice labels; used both for the order relation ({@code first <= second})
 * and as the key of the implication table ({@code first => second}).
 */
public record LabelPair(String first, String second) {

    public LabelPair {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
    }

    public static LabelPair of(String first, String second) {
        return new LabelPair(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
