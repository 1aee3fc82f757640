package org.twistmodal.logic.algebra.impl;

import org.twistmodal.logic.algebra.ResiduatedLattice;
import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;

import java.util.*;
import java.util.function.BiPredicate;

public class TwistStructureImpl implements TwistStructure {

    private final String name;
    private final ResiduatedLattice rl;
    private final Set<TruthPair> elements;
    private final Set<OrderedPair> truthOrder;
    private final Set<OrderedPair> infoOrder;

    public TwistStructureImpl(ResiduatedLattice residuatedLattice) {
        this(residuatedLattice.residuatedName(), residuatedLattice);
    }

    public TwistStructureImpl(String name, ResiduatedLattice residuatedLattice) {
        this.name = Objects.requireNonNull(name);
        this.rl = Objects.requireNonNull(residuatedLattice);
        Set<TruthPair> pairs = new LinkedHashSet<>();
        for (String e1 : rl.elements()) {
            for (String e2 : rl.elements()) {
                pairs.add(new TruthPair(e1, e2));
            }
        }
        elements = Collections.unmodifiableSet(pairs);
        truthOrder = buildOrder(this::truthLessOrEqual);
        infoOrder = buildOrder(this::infoLessOrEqual);
    }

    private TwistStructureImpl(String name, TwistStructureImpl other) {
        this.name = Objects.requireNonNull(name);
        this.rl = other.rl;
        this.elements = other.elements;
        this.truthOrder = other.truthOrder;
        this.infoOrder = other.infoOrder;
    }

    private Set<OrderedPair> buildOrder(BiPredicate<TruthPair, TruthPair> lessOrEqual) {
        Set<OrderedPair> relation = new LinkedHashSet<>();
        for (TruthPair p1 : elements) {
            for (TruthPair p2 : elements) {
                if (lessOrEqual.test(p1, p2)) relation.add(new OrderedPair(p1, p2));
            }
        }
        return Collections.unmodifiableSet(relation);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TwistStructure withName(String name) {
        return new TwistStructureImpl(name, this);
    }

    @Override
    public ResiduatedLattice residuatedLattice() {
        return rl;
    }

    @Override
    public Set<TruthPair> elements() {
        return elements;
    }

    @Override
    public boolean contains(TruthPair pair) {
        return elements.contains(pair);
    }

    @Override
    public Set<OrderedPair> truthOrder() {
        return truthOrder;
    }

    @Override
    public Set<OrderedPair> infoOrder() {
        return infoOrder;
    }

    @Override
    public boolean truthLessOrEqual(TruthPair p1, TruthPair p2) {
        return rl.lessOrEqual(p1.t(), p2.t()) && rl.lessOrEqual(p2.f(), p1.f());
    }

    @Override
    public boolean infoLessOrEqual(TruthPair p1, TruthPair p2) {
        return rl.lessOrEqual(p1.t(), p2.t()) && rl.lessOrEqual(p1.f(), p2.f());
    }

    @Override
    public TruthPair truthTop() {
        return new TruthPair(rl.top(), rl.bottom());
    }

    @Override
    public TruthPair truthBottom() {
        return new TruthPair(rl.bottom(), rl.top());
    }

    @Override
    public TruthPair negation(TruthPair pair) {
        return pair.swap();
    }

    @Override
    public TruthPair weakMeet(TruthPair p1, TruthPair p2) {
        return new TruthPair(rl.meet(p1.t(), p2.t()), rl.join(p1.f(), p2.f()));
    }

    @Override
    public TruthPair weakJoin(TruthPair p1, TruthPair p2) {
        return new TruthPair(rl.join(p1.t(), p2.t()), rl.meet(p1.f(), p2.f()));
    }

    @Override
    public TruthPair residueMeet(TruthPair p1, TruthPair p2) {
        String meetT = rl.meet(p1.t(), p2.t());
        String imp1 = rl.requireImplication(p1.t(), p2.f());
        String imp2 = rl.requireImplication(p2.t(), p1.f());
        return new TruthPair(meetT, rl.meet(imp1, imp2));
    }

    @Override
    public TruthPair implication(TruthPair p1, TruthPair p2) {
        String impT = rl.requireImplication(p1.t(), p2.t());
        String impF = rl.requireImplication(p2.f(), p1.f());
        return new TruthPair(rl.meet(impT, impF), rl.meet(p1.t(), p2.f()));
    }

    @Override
    public TruthPair consensus(TruthPair p1, TruthPair p2) {
        return new TruthPair(rl.meet(p1.t(), p2.t()), rl.meet(p1.f(), p2.f()));
    }

    @Override
    public TruthPair acceptAll(TruthPair p1, TruthPair p2) {
        return new TruthPair(rl.join(p1.t(), p2.t()), rl.join(p1.f(), p2.f()));
    }

    @Override
    public TruthPair weakMeetSet(List<TruthPair> pairs) {
        if (pairs.isEmpty()) return truthTop();
        List<String> ts = pairs.stream().map(TruthPair::t).toList();
        List<String> fs = pairs.stream().map(TruthPair::f).toList();
        return new TruthPair(rl.meetSet(ts), rl.joinSet(fs));
    }

    @Override
    public TruthPair weakJoinSet(List<TruthPair> pairs) {
        if (pairs.isEmpty()) return truthBottom();
        List<String> ts = pairs.stream().map(TruthPair::t).toList();
        List<String> fs = pairs.stream().map(TruthPair::f).toList();
        return new TruthPair(rl.joinSet(ts), rl.meetSet(fs));
    }

    @Override
    public String toString() {
        return name;
    }
}
