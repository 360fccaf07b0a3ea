/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Compilation statistics of a graph.
 *
 * @param ruleCount             enabled rules translated into the graph
 * @param valueNodeCount        distinct value nodes
 * @param aggregationCount      aggregation nodes
 * @param constraintEdgeCount   {@code REQUIRES} and {@code EXCLUDES} edges
 * @param membershipEdgeCount   edges wiring aggregations to their children
 * @param overriddenStatements  statements dropped because a later rule contradicted them
 * @param mergedStatements      statements folded into an existing identical or symmetric relation
 * @param compilationTimeNanos  wall time spent compiling
 * @param metadata              stage-specific extras
 */
public record GraphStats(
        int ruleCount,
        int valueNodeCount,
        int aggregationCount,
        int constraintEdgeCount,
        int membershipEdgeCount,
        int overriddenStatements,
        int mergedStatements,
        long compilationTimeNanos,
        Map<String, Object> metadata
) implements Serializable {

    public GraphStats {
        metadata = Map.copyOf(metadata);
    }

    public static GraphStats empty() {
        return new GraphStats(0, 0, 0, 0, 0, 0, 0, 0L, Map.of());
    }

    public int nodeCount() {
        return valueNodeCount + aggregationCount;
    }
}
