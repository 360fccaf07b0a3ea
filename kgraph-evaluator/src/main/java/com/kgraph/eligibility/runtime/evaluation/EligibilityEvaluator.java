/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.evaluation;

import com.kgraph.eligibility.api.IEligibilityEvaluator;
import com.kgraph.eligibility.api.model.CandidateAssignment;
import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.api.model.EligibilityResult;
import com.kgraph.eligibility.api.model.Violation;
import com.kgraph.eligibility.api.spi.ConstraintGraphEngine;
import com.kgraph.eligibility.api.spi.ValueMasker;
import com.kgraph.eligibility.runtime.context.EvaluationContext;
import com.kgraph.eligibility.runtime.engine.DefaultConstraintGraphEngine;
import com.kgraph.eligibility.runtime.masking.OpaqueTokenMasker;
import com.kgraph.eligibility.runtime.model.AggregationNode;
import com.kgraph.eligibility.runtime.model.Aggregator;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import com.kgraph.eligibility.runtime.model.GraphNode;
import com.kgraph.eligibility.runtime.model.RelationEdge;
import com.kgraph.eligibility.runtime.model.RelationKind;
import com.kgraph.eligibility.runtime.model.ValueNode;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates candidate assignments against compiled graphs.
 *
 * <h2>Algorithm</h2>
 * <ol>
 * <li>Resolve candidate values to value nodes. Values the graph does not mention are
 * unconstrained; a candidate that resolves to nothing is eligible.</li>
 * <li>Collect the relevant sources: asserted value nodes, the aggregations above them and the
 * graph's unconditional roots.</li>
 * <li>For every relevant source that holds, check its constraint edges. {@code REQUIRES} is
 * violated when the target does not hold, {@code EXCLUDES} when it does.</li>
 * </ol>
 *
 * <p>Every constraint edge has exactly one source, so each edge is checked at most once and the
 * collected reasons are free of duplicates. They are ordered by edge id.
 *
 * <h2>Thread Safety</h2>
 * <p>Fully thread-safe. Per-evaluation state lives in a pooled, thread-local
 * {@link EvaluationContext}.
 */
public final class EligibilityEvaluator implements IEligibilityEvaluator {

    private final ConstraintGraphEngine engine;
    private final ValueMasker masker;

    /**
     * Thread-local object pool for EvaluationContext.
     */
    private final ThreadLocal<EvaluationContext> contextPool =
            ThreadLocal.withInitial(EvaluationContext::new);

    public EligibilityEvaluator() {
        this(new DefaultConstraintGraphEngine(), new OpaqueTokenMasker());
    }

    public EligibilityEvaluator(ConstraintGraphEngine engine, ValueMasker masker) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.masker = Objects.requireNonNull(masker, "masker must not be null");
    }

    @Override
    public EligibilityResult evaluate(CompiledGraph graph, CandidateAssignment candidate, boolean explain) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");

        EvaluationContext context = contextPool.get();
        context.reset(graph.nodeCount());

        for (DomainValue value : candidate.values()) {
            int nodeId = graph.lookup(value);
            if (nodeId >= 0) {
                context.assertValue(nodeId);
            }
        }
        if (context.assertedCount() == 0) {
            return EligibilityResult.eligible(graph.fingerprint(), explain);
        }

        List<Violation> violations = explain ? new ArrayList<>() : null;
        IntList sources = context.relevantSources(graph);
        for (int s = 0; s < sources.size(); s++) {
            int source = sources.getInt(s);
            IntList edgeIds = graph.constraintsFrom(source);
            if (edgeIds.isEmpty() || !engine.holds(graph, source, context)) {
                continue;
            }
            for (int e = 0; e < edgeIds.size(); e++) {
                RelationEdge edge = graph.edge(edgeIds.getInt(e));
                if (isViolated(graph, edge, context)) {
                    if (!explain) {
                        return EligibilityResult.ineligibleUnexplained(graph.fingerprint());
                    }
                    violations.add(toViolation(graph, edge));
                }
            }
        }

        if (!explain || violations.isEmpty()) {
            return EligibilityResult.eligible(graph.fingerprint(), explain);
        }
        violations.sort(Comparator.comparingInt(Violation::edgeId));
        return EligibilityResult.ineligible(graph.fingerprint(), violations);
    }

    private boolean isViolated(CompiledGraph graph, RelationEdge edge, EvaluationContext context) {
        boolean targetHolds = engine.holds(graph, edge.target(), context);
        return edge.kind() == RelationKind.REQUIRES ? !targetHolds : targetHolds;
    }

    private Violation toViolation(CompiledGraph graph, RelationEdge edge) {
        return new Violation(
                edge.kind(),
                edge.ruleIds(),
                edge.id(),
                edge.source(),
                describe(graph, edge.source()),
                edge.target(),
                describe(graph, edge.target()));
    }

    /**
     * Renders a node for a reason. Aggregations render as their combinator over the masked
     * children in text order; the negation of an ANY renders as NONE.
     */
    private String describe(CompiledGraph graph, int nodeId) {
        GraphNode node = graph.node(nodeId);
        if (node instanceof ValueNode valueNode) {
            return masker.render(valueNode);
        }
        AggregationNode aggregation = (AggregationNode) node;
        if (aggregation.isUnconditional()) {
            return "ALWAYS";
        }
        if (aggregation.aggregator() == Aggregator.NOT
                && graph.node(aggregation.child(0)) instanceof AggregationNode negated
                && negated.aggregator() == Aggregator.ANY) {
            return "NONE" + describeChildren(graph, negated);
        }
        return aggregation.aggregator().name() + describeChildren(graph, aggregation);
    }

    private String describeChildren(CompiledGraph graph, AggregationNode aggregation) {
        List<String> children = new ArrayList<>(aggregation.childCount());
        for (int i = 0; i < aggregation.childCount(); i++) {
            children.add(describe(graph, aggregation.child(i)));
        }
        // Node ids depend on rule order; sorted text does not.
        Collections.sort(children);
        return "(" + String.join(", ", children) + ")";
    }
}
