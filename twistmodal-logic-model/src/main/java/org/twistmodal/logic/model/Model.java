package org.twistmodal.logic.model;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.common.InvalidModelException;
import org.twistmodal.logic.model.impl.AccessibilityRelationImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
A paraconsistent labelled transition system (W, R, V) over one twist structure.

Worlds are registered by long name, and all relation maps are keyed by that name.
Everything is fixed at construction; evaluation only reads.
 */
public class Model {
    private static final Logger LOGGER = LoggerFactory.getLogger(Model.class);

    private final String name;
    private final TwistStructure twistStructure;
    private final Map<String, World> worlds;
    private final Set<String> actions;
    private final Map<String, AccessibilityRelation> relations;
    private final Set<String> props;
    private final String description;

    /**
     * @param accessibilityRelations action to source long name to target long name to weight;
     *                               {@code null} weights are skipped
     * @param actions                declared actions; the actions of the relation map are added
     */
    public Model(String name,
                 TwistStructure twistStructure,
                 Collection<World> worlds,
                 Map<String, Map<String, Map<String, TruthPair>>> accessibilityRelations,
                 Set<String> props,
                 Set<String> actions,
                 String description) {
        this.name = Objects.requireNonNull(name);
        this.twistStructure = Objects.requireNonNull(twistStructure);
        this.description = description == null ? "" : description;
        this.props = props == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(props));

        Map<String, World> worldMap = new LinkedHashMap<>();
        for (World world : worlds) {
            if (world.twistStructure().residuatedLattice() != twistStructure.residuatedLattice()) {
                throw new InvalidModelException(name, "state '" + world.shortName()
                                                      + "' is defined over twist structure "
                                                      + world.twistStructure().name() + ", not "
                                                      + twistStructure.name());
            }
            if (worldMap.put(world.longName(), world) != null) {
                throw new InvalidModelException(name, "duplicate state '" + world.longName() + "'");
            }
        }
        this.worlds = Collections.unmodifiableMap(worldMap);

        Set<String> allActions = new TreeSet<>();
        if (actions != null) allActions.addAll(actions);
        Map<String, AccessibilityRelation> relationMap = new TreeMap<>();
        if (accessibilityRelations != null) {
            accessibilityRelations.forEach((action, sourceMap) -> {
                allActions.add(action);
                relationMap.put(action, buildRelation(action, sourceMap));
            });
        }
        this.actions = Collections.unmodifiableSet(allActions);
        this.relations = Collections.unmodifiableMap(relationMap);
        LOGGER.debug("PLTS {}: {} states, actions {}, {} transitions", name, this.worlds.size(), this.actions,
                relationMap.values().stream().mapToInt(AccessibilityRelation::size).sum());
    }

    private AccessibilityRelation buildRelation(String action, Map<String, Map<String, TruthPair>> sourceMap) {
        AccessibilityRelationImpl.Builder builder = new AccessibilityRelationImpl.Builder(action);
        sourceMap.forEach((source, targetMap) -> {
            checkWorld(source, action);
            targetMap.forEach((target, weight) -> {
                if (weight != null) {
                    checkWorld(target, action);
                    if (!twistStructure.contains(weight)) {
                        throw new InvalidModelException(name, "weight " + weight + " of transition " + source
                                                              + " -[" + action + "]-> " + target
                                                              + " is not an element of " + twistStructure.name());
                    }
                    builder.addTransition(source, target, weight);
                }
            });
        });
        return builder.build();
    }

    private void checkWorld(String longName, String action) {
        if (!worlds.containsKey(longName)) {
            throw new InvalidModelException(name, "transition for action '" + action + "' refers to unknown state '"
                                                  + longName + "'");
        }
    }

    public static class Builder {
        private final String name;
        private final TwistStructure twistStructure;
        private final List<World> worlds = new ArrayList<>();
        private final Map<String, Map<String, Map<String, TruthPair>>> relations = new LinkedHashMap<>();
        private final Set<String> props = new LinkedHashSet<>();
        private final Set<String> actions = new LinkedHashSet<>();
        private String description;

        public Builder(String name, TwistStructure twistStructure) {
            this.name = name;
            this.twistStructure = twistStructure;
        }

        public Builder addWorld(World world) {
            worlds.add(world);
            return this;
        }

        public Builder addWorlds(Collection<World> worlds) {
            this.worlds.addAll(worlds);
            return this;
        }

        public Builder addAction(String action) {
            actions.add(action);
            return this;
        }

        public Builder addProp(String prop) {
            props.add(prop);
            return this;
        }

        public Builder addTransition(String action, World source, World target, TruthPair weight) {
            return addTransition(action, source.longName(), target.longName(), weight);
        }

        public Builder addTransition(String action, String source, String target, TruthPair weight) {
            relations.computeIfAbsent(action, a -> new LinkedHashMap<>())
                    .computeIfAbsent(source, s -> new LinkedHashMap<>())
                    .put(target, weight);
            return this;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        public Model build() {
            return new Model(name, twistStructure, worlds, relations, props, actions, description);
        }
    }

    public String name() {
        return name;
    }

    public TwistStructure twistStructure() {
        return twistStructure;
    }

    // ordered as supplied
    public Collection<World> worlds() {
        return worlds.values();
    }

    public Optional<World> world(String longName) {
        return Optional.ofNullable(worlds.get(longName));
    }

    public Optional<World> worldByShortName(String shortName) {
        return worlds.values().stream().filter(w -> w.shortName().equals(shortName)).findFirst();
    }

    public Set<String> actions() {
        return actions;
    }

    public boolean hasAction(String action) {
        return actions.contains(action);
    }

    public Optional<AccessibilityRelation> relation(String action) {
        return Optional.ofNullable(relations.get(action));
    }

    /**
     * @return the explicitly stored transitions of {@code action} leaving {@code source}, target long name
     * to weight; empty for a declared action without transitions
     */
    public Map<String, TruthPair> successors(String action, World source) {
        AccessibilityRelation relation = relations.get(action);
        if (relation == null) return Map.of();
        return relation.successors(source.longName());
    }

    /**
     * @return the weight of the transition, or {@code (bottom, top)} when there is none
     */
    public TruthPair relationWeight(String action, World source, World target) {
        AccessibilityRelation relation = relations.get(action);
        if (relation == null) return twistStructure.truthBottom();
        return relation.weight(source.longName(), target.longName()).orElseGet(twistStructure::truthBottom);
    }

    public Set<String> props() {
        return props;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return name;
    }
}
