package org.twistmodal.logic.formula.ast;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;

import java.util.Objects;
import java.util.Set;

public record Atom(String name) implements Formula {
    public static final Atom TOP = new Atom("TOP");
    public static final Atom BOT = new Atom("BOT");

    public Atom {
        Objects.requireNonNull(name);
    }

    public boolean isTop() {
        return "TOP".equals(name) || "1".equals(name);
    }

    public boolean isBottom() {
        return "BOT".equals(name) || "0".equals(name);
    }

    @Override
    public TruthPair evaluate(Model model, World world, TwistStructure twist) {
        if (isBottom()) return twist.truthBottom();
        if (isTop()) return twist.truthTop();
        return world.valueOf(name);
    }

    @Override
    public Set<String> atoms() {
        if (isTop() || isBottom()) return Set.of();
        return Set.of(name);
    }

    @Override
    public String print() {
        return name;
    }
}
