package org.twistmodal.logic.algebra.impl;

import org.twistmodal.logic.algebra.LabelPair;
import org.twistmodal.logic.algebra.Lattice;
import org.twistmodal.logic.common.InvalidAlgebraException;
import org.twistmodal.logic.common.UndefinedOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BiPredicate;

public class LatticeImpl implements Lattice {
    private static final Logger LOGGER = LoggerFactory.getLogger(LatticeImpl.class);

    private final String name;
    private final Set<String> elements;
    private final Set<LabelPair> order;
    private final Map<LabelPair, String> implicationTable;
    private final String top;
    private final String bottom;

    public LatticeImpl(String name, Collection<String> elements, Set<LabelPair> order) {
        this(name, elements, order, Map.of());
    }

    public LatticeImpl(String name,
                       Collection<String> elements,
                       Set<LabelPair> order,
                       Map<LabelPair, String> implicationTable) {
        this.name = Objects.requireNonNull(name);
        this.elements = Collections.unmodifiableSet(new LinkedHashSet<>(elements));
        this.order = Set.copyOf(order);
        this.implicationTable = Map.copyOf(implicationTable);
        if (this.elements.isEmpty()) {
            throw new InvalidAlgebraException(name, "no elements");
        }
        checkLabels();
        checkIsLattice();
        // the element set is not empty, so we can fold without the empty-set identities
        Iterator<String> iterator = this.elements.iterator();
        String first = iterator.next();
        String b = first;
        String t = first;
        while (iterator.hasNext()) {
            String next = iterator.next();
            b = meet(b, next);
            t = join(t, next);
        }
        bottom = b;
        top = t;
        LOGGER.debug("Lattice {}: {} elements, top {}, bottom {}", name, this.elements.size(), top, bottom);
        if (!isImplicationTotal()) {
            LOGGER.debug("Lattice {}: implication table has {} of {} entries", name, this.implicationTable.size(),
                    this.elements.size() * this.elements.size());
        }
    }

    private void checkLabels() {
        for (LabelPair pair : order) {
            if (!elements.contains(pair.first()) || !elements.contains(pair.second())) {
                throw new InvalidAlgebraException(name, "order pair " + pair + " refers to an unknown element");
            }
        }
        for (Map.Entry<LabelPair, String> entry : implicationTable.entrySet()) {
            LabelPair key = entry.getKey();
            if (!elements.contains(key.first()) || !elements.contains(key.second())) {
                throw new InvalidAlgebraException(name, "implication entry " + key + " refers to an unknown element");
            }
            if (!elements.contains(entry.getValue())) {
                throw new InvalidAlgebraException(name, "implication " + key + " => " + entry.getValue()
                                                        + " is not an element");
            }
        }
    }

    /*
    every pair must have a meet and a join; O(n^2) bound-set computations
     */
    private void checkIsLattice() {
        for (String x : elements) {
            for (String y : elements) {
                try {
                    meet(x, y);
                    join(x, y);
                } catch (UndefinedOperationException e) {
                    LOGGER.debug("Lattice check failed: {}", e.getMessage());
                    throw new InvalidAlgebraException(name, e);
                }
            }
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> elements() {
        return elements;
    }

    @Override
    public Set<LabelPair> order() {
        return order;
    }

    @Override
    public Map<LabelPair, String> implicationTable() {
        return implicationTable;
    }

    @Override
    public boolean contains(String label) {
        return elements.contains(label);
    }

    @Override
    public boolean lessOrEqual(String a, String b) {
        return order.contains(new LabelPair(a, b));
    }

    @Override
    public String meet(String a, String b) {
        ensureElements(a, b);
        return extremalBound(a, b, this::lessOrEqual, "Meet", "lower");
    }

    @Override
    public String join(String a, String b) {
        ensureElements(a, b);
        return extremalBound(a, b, (x, y) -> lessOrEqual(y, x), "Join", "upper");
    }

    /*
    'below' is the order for a meet, its reverse for a join.
    Collect the bounds of a and b, then keep the bound which has all other bounds below it.
     */
    private String extremalBound(String a, String b, BiPredicate<String, String> below, String what, String side) {
        List<String> bounds = new ArrayList<>();
        for (String x : elements) {
            if (below.test(x, a) && below.test(x, b)) bounds.add(x);
        }
        if (bounds.isEmpty()) {
            throw new UndefinedOperationException("No common " + side + " bounds found for '" + a + "' and '"
                                                  + b + "'");
        }
        String found = null;
        for (String x : bounds) {
            if (bounds.stream().allMatch(y -> below.test(y, x))) {
                if (found != null) {
                    throw new UndefinedOperationException("No unique " + what + " found for '" + a + "' and '"
                                                          + b + "'");
                }
                found = x;
            }
        }
        if (found == null) {
            throw new UndefinedOperationException("No unique " + what + " found for '" + a + "' and '" + b + "'");
        }
        return found;
    }

    private void ensureElements(String a, String b) {
        if (!elements.contains(a) || !elements.contains(b)) {
            throw new UndefinedOperationException("Elements '" + a + "' or '" + b + "' not in the lattice '"
                                                  + name + "'");
        }
    }

    @Override
    public String meetSet(Collection<String> labels) {
        String result = null;
        for (String label : labels) {
            result = result == null ? meet(label, label) : meet(result, label);
        }
        return result == null ? top : result;
    }

    @Override
    public String joinSet(Collection<String> labels) {
        String result = null;
        for (String label : labels) {
            result = result == null ? join(label, label) : join(result, label);
        }
        return result == null ? bottom : result;
    }

    @Override
    public Optional<String> implication(String a, String b) {
        return Optional.ofNullable(implicationTable.get(new LabelPair(a, b)));
    }

    @Override
    public boolean isImplicationTotal() {
        return implicationTable.size() == elements.size() * elements.size();
    }

    @Override
    public String top() {
        return top;
    }

    @Override
    public String bottom() {
        return bottom;
    }

    @Override
    public String toString() {
        return name;
    }
}
