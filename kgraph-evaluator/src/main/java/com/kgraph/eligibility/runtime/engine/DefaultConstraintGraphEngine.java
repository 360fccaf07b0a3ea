/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.engine;

import com.kgraph.eligibility.api.spi.ConstraintGraphEngine;
import com.kgraph.eligibility.api.spi.GraphQuery;
import com.kgraph.eligibility.runtime.model.AggregationNode;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import com.kgraph.eligibility.runtime.model.GraphNode;

/**
 * Memoized recursive evaluation of node truth values.
 *
 * <p>Each node is evaluated at most once per query. ALL and ANY short-circuit, which does not
 * change the result since both are commutative. The engine is stateless and thread-safe; all
 * per-evaluation state lives in the {@link GraphQuery}.
 */
public final class DefaultConstraintGraphEngine implements ConstraintGraphEngine {

    @Override
    public boolean holds(CompiledGraph graph, int nodeId, GraphQuery query) {
        byte memoized = query.memo(nodeId);
        if (memoized != GraphQuery.UNKNOWN) {
            return memoized == GraphQuery.TRUE;
        }
        GraphNode node = graph.node(nodeId);
        boolean holds = node instanceof AggregationNode aggregation
                ? aggregate(graph, aggregation, query)
                : query.isAsserted(nodeId);
        query.memoize(nodeId, holds);
        return holds;
    }

    private boolean aggregate(CompiledGraph graph, AggregationNode node, GraphQuery query) {
        switch (node.aggregator()) {
            case ALL:
                for (int i = 0; i < node.childCount(); i++) {
                    if (!holds(graph, node.child(i), query)) {
                        return false;
                    }
                }
                return true;
            case ANY:
                for (int i = 0; i < node.childCount(); i++) {
                    if (holds(graph, node.child(i), query)) {
                        return true;
                    }
                }
                return false;
            case NOT:
                return !holds(graph, node.child(0), query);
            default:
                throw new IllegalStateException("Unknown aggregator: " + node.aggregator());
        }
    }
}
