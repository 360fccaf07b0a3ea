/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.spi;

import com.kgraph.eligibility.runtime.model.CompiledGraph;

/**
 * Answers truth-value queries for nodes of a compiled graph.
 *
 * <p>A value node holds when the candidate asserts it. An {@code ALL} aggregation holds when
 * every child holds, an {@code ANY} aggregation when some child holds and a {@code NOT}
 * aggregation when its single child does not hold. Results must not depend on child order.
 * Implementations may use the query's memo table and must be thread-safe.
 */
public interface ConstraintGraphEngine {

    boolean holds(CompiledGraph graph, int nodeId, GraphQuery query);
}
