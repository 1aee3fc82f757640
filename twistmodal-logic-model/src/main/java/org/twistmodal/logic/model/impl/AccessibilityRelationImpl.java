package org.twistmodal.logic.model.impl;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.model.AccessibilityRelation;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

public class AccessibilityRelationImpl implements AccessibilityRelation {

    private final String action;
    private final Map<String, Node> nodeMap;
    private final int size;

    private static class Node {
        final String source;
        final Map<String, TruthPair> targets = new LinkedHashMap<>();

        private Node(String source) {
            this.source = source;
        }
    }

    private AccessibilityRelationImpl(String action, Map<String, Node> nodeMap) {
        this.action = action;
        this.nodeMap = nodeMap;
        this.size = nodeMap.values().stream().mapToInt(n -> n.targets.size()).sum();
    }

    public static class Builder {
        private final String action;
        private final Map<String, Node> nodeMap = new LinkedHashMap<>();
        private boolean frozen;

        public Builder(String action) {
            this.action = Objects.requireNonNull(action);
        }

        /*
        a second transition between the same worlds replaces the first
         */
        public Builder addTransition(String source, String target, TruthPair weight) {
            ensureNotFrozen();
            Objects.requireNonNull(target);
            Objects.requireNonNull(weight);
            nodeMap.computeIfAbsent(Objects.requireNonNull(source), Node::new).targets.put(target, weight);
            return this;
        }

        private void ensureNotFrozen() {
            if (frozen) throw new IllegalStateException("Relation for action '" + action + "' has been built");
        }

        public AccessibilityRelation build() {
            ensureNotFrozen();
            frozen = true;
            Map<String, Node> frozen = new LinkedHashMap<>();
            nodeMap.forEach((source, node) -> {
                Node copy = new Node(source);
                copy.targets.putAll(node.targets);
                frozen.put(source, copy);
            });
            return new AccessibilityRelationImpl(action, Collections.unmodifiableMap(frozen));
        }
    }

    @Override
    public String action() {
        return action;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public Set<String> sources() {
        return nodeMap.keySet();
    }

    @Override
    public Map<String, TruthPair> successors(String source) {
        Node node = nodeMap.get(source);
        if (node == null) return Map.of();
        return Collections.unmodifiableMap(node.targets);
    }

    @Override
    public Optional<TruthPair> weight(String source, String target) {
        Node node = nodeMap.get(source);
        if (node == null) return Optional.empty();
        return Optional.ofNullable(node.targets.get(target));
    }

    @Override
    public void visit(BiConsumer<String, Map<String, TruthPair>> consumer) {
        nodeMap.values().forEach(n -> consumer.accept(n.source, Collections.unmodifiableMap(n.targets)));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[" + action + "]\n");
        nodeMap.forEach((source, node) -> sb.append(source).append(" --> ")
                .append(node.targets.entrySet().stream().map(e -> e.getKey() + ":" + e.getValue()).sorted()
                        .collect(Collectors.joining(", "))).append("\n"));
        return sb.toString();
    }
}
