/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kgraph.eligibility.api.IGraphCache;
import com.kgraph.eligibility.api.IRuleCompiler;
import com.kgraph.eligibility.api.exceptions.CompileException;
import com.kgraph.eligibility.api.model.ConfigurationFingerprint;
import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.infrastructure.telemetry.TracingService;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * {@link IGraphCache} backed by Caffeine.
 *
 * <p>Lookups are lock-free: a cached graph is returned when its fingerprint equals the
 * fingerprint of the configuration passed in. Misses and stale entries are compiled under a
 * per-identity lock, so concurrent callers for one identity compile once and callers for other
 * identities are never blocked. The compiled graph is published with a single {@code put}.
 *
 * <p>Compilation failures are not cached. When a changed configuration fails to compile, the
 * stale graph is dropped so that callers never keep evaluating against rules that no longer
 * reflect the configuration.
 *
 * <p>Size is bounded by identity count or by total node count ({@link GraphCacheConfig}).
 * Evaluations hold their own reference to the graph, so eviction never affects an evaluation in
 * progress.
 */
public final class CaffeineGraphCache implements IGraphCache {
    private static final Logger logger = Logger.getLogger(CaffeineGraphCache.class.getName());

    private final IRuleCompiler compiler;
    private final Tracer tracer;
    private final Cache<ConfigurationIdentity, CachedGraph> cache;
    private final Cache<ConfigurationIdentity, ReentrantLock> locks;
    private final boolean statsEnabled;

    private final LongAdder hitCount = new LongAdder();
    private final LongAdder missCount = new LongAdder();
    private final LongAdder compileCount = new LongAdder();
    private final LongAdder compileFailureCount = new LongAdder();
    private final LongAdder staleReplacementCount = new LongAdder();

    public CaffeineGraphCache(IRuleCompiler compiler, GraphCacheConfig config) {
        this(compiler, config, TracingService.getInstance().getTracer());
    }

    public CaffeineGraphCache(IRuleCompiler compiler, GraphCacheConfig config, Tracer tracer) {
        this(compiler, config, tracer, ForkJoinPool.commonPool());
    }

    CaffeineGraphCache(IRuleCompiler compiler, GraphCacheConfig config, Tracer tracer, Executor executor) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");

        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder().executor(executor);
        if (config.getEvictionPolicy() == GraphCacheConfig.EvictionPolicy.NODE_COUNT) {
            cacheBuilder.maximumWeight(config.getMaxNodes())
                    .weigher((ConfigurationIdentity identity, CachedGraph entry) -> entry.graph().nodeCount());
        } else {
            cacheBuilder.maximumSize(config.getMaxIdentities());
        }

        config.getExpireAfterAccess().ifPresent(cacheBuilder::expireAfterAccess);

        this.statsEnabled = config.isRecordStats();
        if (statsEnabled) {
            cacheBuilder.recordStats();
        }

        if (config.isLogEvictions()) {
            cacheBuilder.removalListener((identity, entry, cause) -> {
                if (cause.wasEvicted()) {
                    logger.fine(String.format("Graph cache eviction: identity=%s, cause=%s", identity, cause));
                }
            });
        }

        this.cache = cacheBuilder.build();
        this.locks = Caffeine.newBuilder().weakValues().build();

        logger.info("CaffeineGraphCache initialized: " + config);
    }

    @Override
    public CompiledGraph getOrCompile(ConfigurationIdentity identity, RuleConfiguration configuration) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(configuration, "configuration must not be null");
        if (!identity.equals(configuration.identity())) {
            throw new IllegalArgumentException("Configuration " + configuration.identity()
                    + " cannot be cached under identity " + identity);
        }

        String fingerprint = ConfigurationFingerprint.of(configuration);
        CachedGraph cached = cache.getIfPresent(identity);
        if (cached != null && cached.fingerprint().equals(fingerprint)) {
            hitCount.increment();
            return cached.graph();
        }
        missCount.increment();

        ReentrantLock lock = locks.get(identity, key -> new ReentrantLock());
        lock.lock();
        try {
            // Another thread may have compiled this fingerprint while we waited.
            CachedGraph current = cache.asMap().get(identity);
            if (current != null && current.fingerprint().equals(fingerprint)) {
                return current.graph();
            }
            CompiledGraph graph = load(identity, configuration, fingerprint, current);
            cache.put(identity, new CachedGraph(fingerprint, graph));
            return graph;
        } finally {
            lock.unlock();
        }
    }

    private CompiledGraph load(ConfigurationIdentity identity, RuleConfiguration configuration,
                               String fingerprint, CachedGraph stale) {
        Span span = tracer.spanBuilder("graph-cache-load").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("identity", identity.toString());
            span.setAttribute("fingerprint", fingerprint);
            span.setAttribute("stale", stale != null);

            compileCount.increment();
            CompiledGraph graph = compiler.compile(configuration);
            if (stale != null) {
                staleReplacementCount.increment();
                logger.info(String.format("Replaced graph for %s: fingerprint %s -> %s",
                        identity, stale.fingerprint(), fingerprint));
            } else {
                logger.fine(String.format("Compiled graph for %s: fingerprint %s, %d nodes",
                        identity, fingerprint, graph.nodeCount()));
            }
            return graph;
        } catch (CompileException e) {
            compileFailureCount.increment();
            span.recordException(e);
            if (stale != null) {
                cache.invalidate(identity);
                logger.warning(String.format("Dropped stale graph for %s (fingerprint %s) after failed recompile: %s",
                        identity, stale.fingerprint(), e.getMessage()));
            }
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Optional<CompiledGraph> getIfPresent(ConfigurationIdentity identity) {
        CachedGraph cached = cache.getIfPresent(identity);
        return cached == null ? Optional.empty() : Optional.of(cached.graph());
    }

    @Override
    public void invalidate(ConfigurationIdentity identity) {
        // Waits for an in-flight compile so its put cannot resurrect the entry.
        ReentrantLock lock = locks.get(identity, key -> new ReentrantLock());
        lock.lock();
        try {
            cache.invalidate(identity);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public CacheMetrics getMetrics() {
        long hits = hitCount.sum();
        long misses = missCount.sum();
        long requests = hits + misses;
        long evictions = statsEnabled ? cache.stats().evictionCount() : 0L;

        return new CacheMetrics(
                cache.estimatedSize(),
                hits,
                misses,
                evictions,
                compileCount.sum(),
                compileFailureCount.sum(),
                staleReplacementCount.sum(),
                requests == 0 ? 0.0 : (double) hits / requests
        );
    }

    /**
     * Force synchronous cleanup of evicted entries.
     * Not part of the IGraphCache interface.
     */
    public void cleanUp() {
        cache.cleanUp();
    }

    private record CachedGraph(String fingerprint, CompiledGraph graph) {
    }
}
