/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.DomainValue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The compiled constraint graph of one configuration identity.
 *
 * <p>Holds the value nodes, aggregation nodes and edges produced by the rule compiler, plus the
 * indices the evaluator walks:
 * <ul>
 *   <li>{@code DomainValue -> node id} lookup for resolving candidate values</li>
 *   <li>constraint edges grouped by source node</li>
 *   <li>parent aggregations of every node, for upward traversal from asserted values</li>
 *   <li>unconditional roots: aggregations that hold under an empty assignment and carry
 *       constraints (e.g. the source of {@code ALWAYS} rules)</li>
 * </ul>
 *
 * <p>Immutable and thread-safe once built. A configuration change produces a new instance; an
 * existing instance is never updated in place.
 */
public final class CompiledGraph implements Serializable {
    private static final long serialVersionUID = 1L;

    private final ConfigurationIdentity identity;
    private final String fingerprint;
    private final GraphNode[] nodes;
    private final RelationEdge[] edges;
    private final Object2IntMap<DomainValue> valueIndex;
    private final IntList[] constraintsBySource;
    private final IntList[] parents;
    private final IntList unconditionalRoots;
    private final int valueNodeCount;
    private final GraphStats stats;

    private CompiledGraph(Builder builder, GraphStats stats) {
        this.identity = builder.identity;
        this.fingerprint = builder.fingerprint;
        this.nodes = builder.nodes.toArray(new GraphNode[0]);
        this.edges = builder.edges.toArray(new RelationEdge[0]);
        this.valueIndex = new Object2IntOpenHashMap<>(builder.valueIndex);
        this.valueIndex.defaultReturnValue(-1);
        this.valueNodeCount = builder.valueNodeCount;
        this.stats = stats;

        IntArrayList[] bySource = new IntArrayList[nodes.length];
        IntArrayList[] parentLists = new IntArrayList[nodes.length];
        for (RelationEdge edge : edges) {
            if (edge.isConstraint()) {
                bucket(bySource, edge.source()).add(edge.id());
            } else {
                bucket(parentLists, edge.source()).add(edge.target());
            }
        }
        this.constraintsBySource = freeze(bySource);
        this.parents = freeze(parentLists);
        this.unconditionalRoots = IntLists.unmodifiable(findUnconditionalRoots());
    }

    public static Builder builder(ConfigurationIdentity identity, String fingerprint) {
        return new Builder(identity, fingerprint);
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public ConfigurationIdentity identity() {
        return identity;
    }

    public String fingerprint() {
        return fingerprint;
    }

    public GraphStats stats() {
        return stats;
    }

    public int nodeCount() {
        return nodes.length;
    }

    public int valueNodeCount() {
        return valueNodeCount;
    }

    public int edgeCount() {
        return edges.length;
    }

    public GraphNode node(int id) {
        return nodes[id];
    }

    public RelationEdge edge(int id) {
        return edges[id];
    }

    /**
     * Resolves a domain value to its node id.
     *
     * @return the node id, or -1 when no rule of this graph mentions the value
     */
    public int lookup(DomainValue value) {
        return valueIndex.getInt(value);
    }

    public Optional<ValueNode> findValueNode(DomainValue value) {
        int id = lookup(value);
        return id < 0 ? Optional.empty() : Optional.of((ValueNode) nodes[id]);
    }

    /**
     * Constraint edge ids whose source is the given node, in edge id order.
     */
    public IntList constraintsFrom(int nodeId) {
        return constraintsBySource[nodeId];
    }

    /**
     * Aggregations that list the given node as a child.
     */
    public IntList parentsOf(int nodeId) {
        return parents[nodeId];
    }

    public IntList unconditionalRoots() {
        return unconditionalRoots;
    }

    public List<ValueNode> valueNodes() {
        List<ValueNode> result = new ArrayList<>(valueNodeCount);
        for (GraphNode node : nodes) {
            if (node instanceof ValueNode valueNode) {
                result.add(valueNode);
            }
        }
        return result;
    }

    public List<AggregationNode> aggregationNodes() {
        List<AggregationNode> result = new ArrayList<>(nodes.length - valueNodeCount);
        for (GraphNode node : nodes) {
            if (node instanceof AggregationNode aggregation) {
                result.add(aggregation);
            }
        }
        return result;
    }

    public List<RelationEdge> edges() {
        return List.of(edges);
    }

    public List<RelationEdge> constraintEdges() {
        List<RelationEdge> result = new ArrayList<>();
        for (RelationEdge edge : edges) {
            if (edge.isConstraint()) {
                result.add(edge);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "CompiledGraph{identity=" + identity + ", fingerprint=" + fingerprint
                + ", nodes=" + nodes.length + ", edges=" + edges.length + "}";
    }

    // ========================================================================
    // INDEX CONSTRUCTION
    // ========================================================================

    /**
     * Aggregations are created after their children, so a single pass in id order evaluates
     * every node under the empty assignment.
     */
    private IntList findUnconditionalRoots() {
        boolean[] holdsWhenEmpty = new boolean[nodes.length];
        IntArrayList roots = new IntArrayList();
        for (GraphNode node : nodes) {
            if (!(node instanceof AggregationNode aggregation)) {
                continue;
            }
            boolean holds = switch (aggregation.aggregator()) {
                case ALL -> {
                    boolean all = true;
                    for (int i = 0; i < aggregation.childCount() && all; i++) {
                        all = holdsWhenEmpty[aggregation.child(i)];
                    }
                    yield all;
                }
                case ANY -> {
                    boolean any = false;
                    for (int i = 0; i < aggregation.childCount() && !any; i++) {
                        any = holdsWhenEmpty[aggregation.child(i)];
                    }
                    yield any;
                }
                case NOT -> !holdsWhenEmpty[aggregation.child(0)];
            };
            holdsWhenEmpty[aggregation.id()] = holds;
            if (holds && !constraintsBySource[aggregation.id()].isEmpty()) {
                roots.add(aggregation.id());
            }
        }
        return roots;
    }

    private static IntArrayList bucket(IntArrayList[] buckets, int index) {
        IntArrayList list = buckets[index];
        if (list == null) {
            list = new IntArrayList(2);
            buckets[index] = list;
        }
        return list;
    }

    private static IntList[] freeze(IntArrayList[] buckets) {
        IntList[] frozen = new IntList[buckets.length];
        for (int i = 0; i < buckets.length; i++) {
            frozen[i] = buckets[i] == null ? IntLists.emptyList() : IntLists.unmodifiable(buckets[i]);
        }
        return frozen;
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Accumulates nodes and edges for one graph. Not thread-safe; used by a single compilation.
     *
     * <p>Value nodes are deduplicated by domain value and aggregations by their combinator and
     * sorted child set, so rules that mention the same value or the same combination share
     * one node.
     */
    public static final class Builder {
        private final ConfigurationIdentity identity;
        private final String fingerprint;
        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<RelationEdge> edges = new ArrayList<>();
        private final Object2IntMap<DomainValue> valueIndex = new Object2IntOpenHashMap<>();
        private final Object2IntMap<AggregationKey> aggregationIndex = new Object2IntOpenHashMap<>();
        private int valueNodeCount;
        private int constraintEdgeCount;

        private Builder(ConfigurationIdentity identity, String fingerprint) {
            this.identity = Objects.requireNonNull(identity, "identity must not be null");
            this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint must not be null");
            valueIndex.defaultReturnValue(-1);
            aggregationIndex.defaultReturnValue(-1);
        }

        /**
         * Registers a value node and returns its id. Registering an existing value returns the
         * existing id; a sensitive registration marks the existing node sensitive.
         */
        public int valueNode(DomainValue value, NodeOrigin origin, boolean sensitive) {
            int existing = valueIndex.getInt(value);
            if (existing >= 0) {
                ValueNode node = (ValueNode) nodes.get(existing);
                if (sensitive && !node.sensitive()) {
                    nodes.set(existing, new ValueNode(existing, value, node.origin(), true));
                }
                return existing;
            }
            int id = nodes.size();
            nodes.add(new ValueNode(id, value, origin, sensitive));
            valueIndex.put(value, id);
            valueNodeCount++;
            return id;
        }

        public int valueNodeId(DomainValue value) {
            return valueIndex.getInt(value);
        }

        /**
         * Registers an aggregation over existing nodes and returns its id, adding one membership
         * edge per child. {@code ALL}/{@code ANY} over a single child collapse to the child itself.
         */
        public int aggregation(Aggregator aggregator, int... children) {
            for (int child : children) {
                requireNode(child);
            }
            IntArrayList canonical = new IntArrayList(children);
            if (aggregator != Aggregator.NOT) {
                canonical.sort(null);
                removeAdjacentDuplicates(canonical);
                if (canonical.size() == 1) {
                    return canonical.getInt(0);
                }
            }
            AggregationKey key = new AggregationKey(aggregator, canonical);
            int existing = aggregationIndex.getInt(key);
            if (existing >= 0) {
                return existing;
            }
            int id = nodes.size();
            int[] childIds = canonical.toIntArray();
            nodes.add(new AggregationNode(id, aggregator, childIds));
            aggregationIndex.put(key, id);
            RelationKind membership = RelationKind.membershipOf(aggregator);
            for (int child : childIds) {
                edges.add(new RelationEdge(edges.size(), membership, child, id, List.of(), false));
            }
            return id;
        }

        /**
         * Adds a {@code REQUIRES} or {@code EXCLUDES} edge between existing nodes.
         */
        public int constraint(RelationKind kind, int source, int target, List<String> ruleIds, boolean symmetric) {
            if (!kind.isConstraint()) {
                throw new IllegalArgumentException("Not a constraint relation: " + kind);
            }
            if (symmetric && kind != RelationKind.EXCLUDES) {
                throw new IllegalArgumentException("Only EXCLUDES relations can be symmetric");
            }
            requireNode(source);
            requireNode(target);
            int id = edges.size();
            edges.add(new RelationEdge(id, kind, source, target, ruleIds, symmetric));
            constraintEdgeCount++;
            return id;
        }

        public int nodeCount() {
            return nodes.size();
        }

        public int valueNodeCount() {
            return valueNodeCount;
        }

        public int aggregationCount() {
            return nodes.size() - valueNodeCount;
        }

        public int constraintEdgeCount() {
            return constraintEdgeCount;
        }

        public int membershipEdgeCount() {
            return edges.size() - constraintEdgeCount;
        }

        public CompiledGraph build(GraphStats stats) {
            return new CompiledGraph(this, stats);
        }

        private void requireNode(int id) {
            if (id < 0 || id >= nodes.size()) {
                throw new IllegalArgumentException("Edge references node " + id
                        + " which is not part of this graph (" + nodes.size() + " nodes)");
            }
        }

        private static void removeAdjacentDuplicates(IntArrayList sorted) {
            int write = 0;
            for (int read = 0; read < sorted.size(); read++) {
                if (write == 0 || sorted.getInt(read) != sorted.getInt(write - 1)) {
                    sorted.set(write++, sorted.getInt(read));
                }
            }
            sorted.size(write);
        }
    }

    private record AggregationKey(Aggregator aggregator, IntList children) implements Serializable {
        AggregationKey {
            children = IntLists.unmodifiable(new IntArrayList(children));
        }
    }
}
