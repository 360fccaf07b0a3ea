/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.analysis;

import com.kgraph.eligibility.api.exceptions.CompileException;
import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.api.spi.ValueMasker;
import com.kgraph.eligibility.runtime.model.AggregationNode;
import com.kgraph.eligibility.runtime.model.Aggregator;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import com.kgraph.eligibility.runtime.model.GraphNode;
import com.kgraph.eligibility.runtime.model.RelationEdge;
import com.kgraph.eligibility.runtime.model.RelationKind;
import com.kgraph.eligibility.runtime.model.ValueNode;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Detects constraint graphs that can never be satisfied.
 *
 * <p>The analysis computes forced closures. Starting from a seed set of value nodes, the closure
 * repeatedly adds the target of every {@code REQUIRES} edge whose source is satisfied by the
 * closure. A closure is contradictory when a satisfied {@code EXCLUDES} edge hits one of its
 * members, or when a satisfied one-of requirement has every option excluded. Negated
 * preconditions are never used for forcing.
 *
 * <p>A contradiction on the empty seed means the unconditional rules can never be met, and
 * compilation fails. A contradiction on seed {@code {v}} only means that {@code v} can never be
 * part of an eligible candidate, which is often intended ({@code ALWAYS EXCLUDE currency=JPY});
 * those are reported by {@link #unreachableValues(CompiledGraph)} for diagnostics.
 *
 * <p>Descriptions render values through a {@link ValueMasker}, so sensitive values never appear
 * in exception messages or logs.
 */
public class ConsistencyAnalyzer {

    private static final int NO_EDGE = -1;
    private static final int EMPTY_SEED = -1;

    private final ValueMasker masker;

    public ConsistencyAnalyzer() {
        this(ValueMasker.redacting());
    }

    public ConsistencyAnalyzer(ValueMasker masker) {
        this.masker = Objects.requireNonNull(masker, "masker must not be null");
    }

    /**
     * @throws CompileException with kind {@code UNSATISFIABLE_CONSTRAINT} when the unconditional
     *                          rules contradict each other
     */
    public void check(CompiledGraph graph) {
        Optional<Contradiction> contradiction = analyse(graph, graph.constraintEdges(), EMPTY_SEED);
        if (contradiction.isPresent()) {
            Contradiction c = contradiction.get();
            throw CompileException.unsatisfiable(c.conflicting(), c.ruleChain(), c.description());
        }
    }

    /**
     * Values that can never be part of an eligible candidate, in node order.
     */
    public List<Contradiction> unreachableValues(CompiledGraph graph) {
        List<RelationEdge> constraints = graph.constraintEdges();
        List<Contradiction> unreachable = new ArrayList<>();
        if (constraints.isEmpty()) {
            return unreachable;
        }
        for (ValueNode node : graph.valueNodes()) {
            analyse(graph, constraints, node.id()).ifPresent(unreachable::add);
        }
        return unreachable;
    }

    private Optional<Contradiction> analyse(CompiledGraph graph, List<RelationEdge> constraints, int seed) {
        Closure closure = new Closure(graph);
        if (seed != EMPTY_SEED) {
            closure.add(seed, NO_EDGE);
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (RelationEdge edge : constraints) {
                if (edge.kind() == RelationKind.REQUIRES
                        && !graph.node(edge.target()).isAggregation()
                        && !closure.contains(edge.target())
                        && closure.satisfies(edge.source())) {
                    closure.add(edge.target(), edge.id());
                    changed = true;
                }
            }
        }

        // Value node id -> id of the edge that rules it out.
        Int2IntOpenHashMap excluded = new Int2IntOpenHashMap();
        excluded.defaultReturnValue(NO_EDGE);
        for (RelationEdge edge : constraints) {
            if (edge.kind() != RelationKind.EXCLUDES) {
                continue;
            }
            if (closure.satisfies(edge.source())) {
                excluded.putIfAbsent(edge.target(), edge.id());
            }
            if (edge.symmetric() && closure.contains(edge.target())) {
                excluded.putIfAbsent(edge.source(), edge.id());
            }
        }

        for (int member : closure.members()) {
            int excludingEdge = excluded.get(member);
            if (excludingEdge != NO_EDGE) {
                return Optional.of(describe(graph, closure, seed, member, graph.edge(excludingEdge), null));
            }
        }

        for (RelationEdge edge : constraints) {
            if (edge.kind() != RelationKind.REQUIRES
                    || !(graph.node(edge.target()) instanceof AggregationNode options)
                    || !closure.satisfies(edge.source())) {
                continue;
            }
            boolean anyOpen = false;
            for (int i = 0; i < options.childCount() && !anyOpen; i++) {
                anyOpen = excluded.get(options.child(i)) == NO_EDGE;
            }
            if (!anyOpen) {
                int firstOption = options.child(0);
                return Optional.of(describe(graph, closure, seed, firstOption,
                        graph.edge(excluded.get(firstOption)), edge));
            }
        }
        return Optional.empty();
    }

    private Contradiction describe(CompiledGraph graph, Closure closure, int seed, int member,
                                          RelationEdge excluding, RelationEdge oneOf) {
        Set<String> chain = new LinkedHashSet<>();
        if (oneOf != null) {
            closure.collectSourceChain(oneOf.source(), chain);
            chain.addAll(oneOf.ruleIds());
        } else {
            closure.collectChain(member, chain);
        }
        closure.collectSourceChain(excluding.source(), chain);
        if (excluding.symmetric()) {
            closure.collectChain(excluding.target(), chain);
        }
        chain.addAll(excluding.ruleIds());

        DomainValue memberValue = valueOf(graph, member);
        String conflict = oneOf != null
                ? "every option of the one-of requirement (rule " + String.join(", ", oneOf.ruleIds()) + ") is excluded"
                : render(graph, member) + " is both required and excluded (rule " + String.join(", ", excluding.ruleIds()) + ")";

        if (seed == EMPTY_SEED) {
            return new Contradiction(null, memberValue, new ArrayList<>(chain),
                    "unconditional rules can never be satisfied: " + conflict + "; rule chain " + chain);
        }
        DomainValue seedValue = valueOf(graph, seed);
        return new Contradiction(seedValue, memberValue, new ArrayList<>(chain),
                render(graph, seed) + " can never be part of an eligible candidate: " + conflict + "; rule chain " + chain);
    }

    private static DomainValue valueOf(CompiledGraph graph, int valueNode) {
        return ((ValueNode) graph.node(valueNode)).value();
    }

    private String render(CompiledGraph graph, int valueNode) {
        return masker.render((ValueNode) graph.node(valueNode));
    }

    /**
     * A forced closure with the edge that forced each member in.
     */
    private static final class Closure {
        private final CompiledGraph graph;
        private final IntSet members = new IntOpenHashSet();
        private final IntArrayList order = new IntArrayList();
        private final Int2IntOpenHashMap forcedBy = new Int2IntOpenHashMap();
        private final IntSet explained = new IntOpenHashSet();

        Closure(CompiledGraph graph) {
            this.graph = graph;
            forcedBy.defaultReturnValue(NO_EDGE);
        }

        void add(int valueNode, int edgeId) {
            if (members.add(valueNode)) {
                order.add(valueNode);
                forcedBy.put(valueNode, edgeId);
            }
        }

        boolean contains(int valueNode) {
            return members.contains(valueNode);
        }

        IntArrayList members() {
            return order;
        }

        boolean satisfies(int nodeId) {
            GraphNode node = graph.node(nodeId);
            if (!(node instanceof AggregationNode aggregation)) {
                return members.contains(nodeId);
            }
            return switch (aggregation.aggregator()) {
                case ALL -> {
                    boolean all = true;
                    for (int i = 0; i < aggregation.childCount() && all; i++) {
                        all = satisfies(aggregation.child(i));
                    }
                    yield all;
                }
                case ANY -> {
                    boolean any = false;
                    for (int i = 0; i < aggregation.childCount() && !any; i++) {
                        any = satisfies(aggregation.child(i));
                    }
                    yield any;
                }
                case NOT -> false;
            };
        }

        /**
         * Rules that forced the value node into the closure, earliest first.
         */
        void collectChain(int valueNode, Set<String> chain) {
            int edgeId = forcedBy.get(valueNode);
            if (edgeId == NO_EDGE || !explained.add(valueNode)) {
                return;
            }
            RelationEdge edge = graph.edge(edgeId);
            collectSourceChain(edge.source(), chain);
            chain.addAll(edge.ruleIds());
        }

        void collectSourceChain(int nodeId, Set<String> chain) {
            GraphNode node = graph.node(nodeId);
            if (node instanceof AggregationNode aggregation) {
                if (aggregation.aggregator() == Aggregator.NOT) {
                    return;
                }
                for (int i = 0; i < aggregation.childCount(); i++) {
                    if (satisfies(aggregation.child(i))) {
                        collectSourceChain(aggregation.child(i), chain);
                    }
                }
            } else if (members.contains(nodeId)) {
                collectChain(nodeId, chain);
            }
        }
    }
}
