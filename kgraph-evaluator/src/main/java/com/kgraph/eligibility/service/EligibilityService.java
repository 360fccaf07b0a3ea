/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.service;

import com.kgraph.eligibility.api.IEligibilityEvaluator;
import com.kgraph.eligibility.api.IGraphCache;
import com.kgraph.eligibility.api.exceptions.ConfigurationNotFoundException;
import com.kgraph.eligibility.api.model.CandidateAssignment;
import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.EligibilityResult;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.api.spi.ConfigurationProvider;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Query facade: resolves the configuration for an identity, fetches the compiled graph from the
 * cache (compiling on miss or on fingerprint mismatch) and evaluates the candidate.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EligibilityService service = new EligibilityService(provider, cache, new EligibilityEvaluator(), tracer);
 *
 * EligibilityResult result = service.evaluate(
 *     ConfigurationIdentity.of("merchant-1", "stripe"),
 *     CandidateAssignment.builder().with("payment_method", "wallet").with("country", "DE").build(),
 *     true);
 * }</pre>
 */
public class EligibilityService {
    private static final Logger logger = Logger.getLogger(EligibilityService.class.getName());

    private final ConfigurationProvider provider;
    private final IGraphCache cache;
    private final IEligibilityEvaluator evaluator;
    private final Tracer tracer;

    public EligibilityService(ConfigurationProvider provider, IGraphCache cache,
                              IEligibilityEvaluator evaluator, Tracer tracer) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    /**
     * Evaluates a candidate against the current configuration of an identity.
     *
     * @throws ConfigurationNotFoundException if the provider knows no configuration for the identity
     * @throws com.kgraph.eligibility.api.exceptions.CompileException if the configuration does not compile
     */
    public EligibilityResult evaluate(ConfigurationIdentity identity, CandidateAssignment candidate, boolean explain) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");
        return traced(identity, 1, explain, () -> evaluator.evaluate(resolve(identity), candidate, explain));
    }

    /**
     * Evaluates a candidate against a configuration the caller already holds. The compiled graph
     * is still cached under the configuration's identity.
     */
    public EligibilityResult evaluate(RuleConfiguration configuration, CandidateAssignment candidate, boolean explain) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");
        ConfigurationIdentity identity = configuration.identity();
        return traced(identity, 1, explain,
                () -> evaluator.evaluate(cache.getOrCompile(identity, configuration), candidate, explain));
    }

    /**
     * Evaluates several candidates against one graph snapshot. Results are in candidate order.
     */
    public List<EligibilityResult> evaluateBatch(ConfigurationIdentity identity,
                                                 List<CandidateAssignment> candidates, boolean explain) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");
        return traced(identity, candidates.size(), explain, () -> {
            CompiledGraph graph = resolve(identity);
            List<EligibilityResult> results = new ArrayList<>(candidates.size());
            for (CandidateAssignment candidate : candidates) {
                results.add(evaluator.evaluate(graph, candidate, explain));
            }
            return results;
        });
    }

    private CompiledGraph resolve(ConfigurationIdentity identity) {
        RuleConfiguration configuration = provider.find(identity)
                .orElseThrow(() -> new ConfigurationNotFoundException(identity));
        return cache.getOrCompile(identity, configuration);
    }

    private <T> T traced(ConfigurationIdentity identity, int candidateCount, boolean explain,
                         Supplier<T> call) {
        Span span = tracer.spanBuilder("evaluate-eligibility").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("identity", identity.toString());
            span.setAttribute("candidateCount", candidateCount);
            span.setAttribute("explain", explain);
            return call.get();
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.warning("Eligibility evaluation failed for " + identity + ": " + e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }
}
