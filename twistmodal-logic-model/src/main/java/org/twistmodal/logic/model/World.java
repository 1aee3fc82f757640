package org.twistmodal.logic.model;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.common.InvalidValueException;
import org.twistmodal.logic.common.UndefinedAtomException;

import java.util.*;
import java.util.function.Function;

/**
 * A state of a model. Identity is the long name; the short name is for display.
 * The twist structure is shared with the model and the other worlds, the assignment map is owned and immutable.
 */
public class World {
    private final String longName;
    private final String shortName;
    private final TwistStructure twistStructure;
    private final Map<String, RawValue> assignments;

    public World(String longName, String shortName, TwistStructure twistStructure, Map<String, String> assignments) {
        this(longName, shortName, twistStructure, rawValues(assignments, RawValue::of));
    }

    private World(String longName, String shortName, TwistStructure twistStructure,
                  LinkedHashMap<String, RawValue> assignments) {
        this.longName = Objects.requireNonNull(longName);
        this.shortName = Objects.requireNonNull(shortName);
        this.twistStructure = Objects.requireNonNull(twistStructure);
        this.assignments = Collections.unmodifiableMap(assignments);
    }

    public static World withValues(String longName, String shortName, TwistStructure twistStructure,
                                   Map<String, TruthPair> values) {
        return new World(longName, shortName, twistStructure, rawValues(values, RawValue::of));
    }

    private static <V> LinkedHashMap<String, RawValue> rawValues(Map<String, V> values,
                                                                 Function<V, RawValue> toRawValue) {
        LinkedHashMap<String, RawValue> map = new LinkedHashMap<>();
        values.forEach((prop, value) -> map.put(prop, toRawValue.apply(value)));
        return map;
    }

    public String longName() {
        return longName;
    }

    public String shortName() {
        return shortName;
    }

    public TwistStructure twistStructure() {
        return twistStructure;
    }

    public Map<String, RawValue> assignments() {
        return assignments;
    }

    public boolean isAssigned(String prop) {
        return assignments.containsKey(prop);
    }

    public Optional<RawValue> assignment(String prop) {
        return Optional.ofNullable(assignments.get(prop));
    }

    /**
     * @throws UndefinedAtomException when the proposition has no assignment in this world
     * @throws InvalidValueException  when the stored value does not denote an element of the twist structure
     */
    public TruthPair valueOf(String prop) {
        RawValue raw = assignments.get(prop);
        if (raw == null) {
            throw new UndefinedAtomException(shortName, List.of(prop));
        }
        TruthPair pair = raw.resolve();
        if (!twistStructure.contains(pair)) {
            throw new InvalidValueException(raw.text(), "atom '" + prop + "' in state '" + shortName
                                                        + "' is not an element of " + twistStructure.name());
        }
        return pair;
    }

    /*
    sorted, so that error messages are stable
     */
    public List<String> missingAssignments(Collection<String> props) {
        return props.stream().filter(p -> !assignments.containsKey(p)).sorted().distinct().toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof World world)) return false;
        return longName.equals(world.longName);
    }

    @Override
    public int hashCode() {
        return longName.hashCode();
    }

    @Override
    public String toString() {
        return shortName;
    }
}
