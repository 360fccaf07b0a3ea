/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api;

import com.kgraph.eligibility.api.model.CandidateAssignment;
import com.kgraph.eligibility.api.model.EligibilityResult;
import com.kgraph.eligibility.runtime.model.CompiledGraph;

/**
 * Contract for answering eligibility queries against a compiled graph.
 *
 * <p>Implementations are thread-safe: the same evaluator instance can be used concurrently,
 * and evaluation never mutates the graph or the candidate.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CandidateAssignment candidate = CandidateAssignment.builder()
 *     .with("payment_method", "wallet")
 *     .with("country", "DE")
 *     .build();
 *
 * EligibilityResult result = evaluator.evaluate(graph, candidate, true);
 * if (!result.eligible()) {
 *     result.reasons().forEach(v -> System.out.println(v.describe()));
 * }
 * }</pre>
 */
public interface IEligibilityEvaluator {

    /**
     * Evaluates a candidate assignment.
     *
     * <p>Values the graph does not know are unconstrained. A candidate that touches no node of
     * the graph is eligible.
     *
     * @param graph the compiled graph (must not be null)
     * @param candidate the candidate values (must not be null)
     * @param explain when true every violation is collected, ordered by edge id; when false
     *                evaluation stops at the first violation and the result carries no reasons
     * @return the eligibility decision
     * @throws NullPointerException if graph or candidate is null
     */
    EligibilityResult evaluate(CompiledGraph graph, CandidateAssignment candidate, boolean explain);

    default boolean isEligible(CompiledGraph graph, CandidateAssignment candidate) {
        return evaluate(graph, candidate, false).eligible();
    }
}
