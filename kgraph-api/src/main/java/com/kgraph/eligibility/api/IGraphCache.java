/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api;

import com.kgraph.eligibility.api.exceptions.CompileException;
import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.runtime.model.CompiledGraph;

import java.util.Optional;

/**
 * Per-identity cache of compiled graphs.
 *
 * <p>A cached graph is returned only while its fingerprint matches the fingerprint of the
 * configuration passed in; otherwise the configuration is recompiled and the new graph replaces
 * the old one. Implementations must be safe for concurrent use and must never block lookups for
 * one identity while another identity compiles.
 */
public interface IGraphCache {

    /**
     * Returns the graph for the identity, compiling it when absent or stale.
     *
     * @throws CompileException if compilation fails; the failure is not cached and any stale
     *                          graph for the identity is dropped
     */
    CompiledGraph getOrCompile(ConfigurationIdentity identity, RuleConfiguration configuration);

    Optional<CompiledGraph> getIfPresent(ConfigurationIdentity identity);

    void invalidate(ConfigurationIdentity identity);

    void invalidateAll();

    CacheMetrics getMetrics();

    /**
     * Cache performance metrics.
     */
    record CacheMetrics(
            long size,
            long hitCount,
            long missCount,
            long evictionCount,
            long compileCount,
            long compileFailureCount,
            long staleReplacementCount,
            double hitRate
    ) {
        public static CacheMetrics empty() {
            return new CacheMetrics(0, 0, 0, 0, 0, 0, 0, 0.0);
        }
    }
}
