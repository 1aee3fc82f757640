package org.twistmodal.logic.algebra;

import java.util.Objects;

/**
 * An element of a twist structure: evidence for ({@code t}) and evidence against ({@code f}),
 * both labels of the underlying lattice.
 */
public record TruthPair(String t, String f) {

    public TruthPair {
        Objects.requireNonNull(t);
        Objects.requireNonNull(f);
    }

    public static TruthPair of(String t, String f) {
        return new TruthPair(t, f);
    }

    // a bare label v stands for (v, v)
    public static TruthPair diagonal(String label) {
        return new TruthPair(label, label);
    }

    public TruthPair swap() {
        return new TruthPair(f, t);
    }

    @Override
    public String toString() {
        return "(" + t + ", " + f + ")";
    }
}
