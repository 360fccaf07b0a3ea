/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.benchmark;

import com.kgraph.eligibility.api.IGraphCache;
import com.kgraph.eligibility.api.model.ConfigurationFingerprint;
import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.api.spi.DomainCatalog;
import com.kgraph.eligibility.cache.CaffeineGraphCache;
import com.kgraph.eligibility.cache.GraphCacheConfig;
import com.kgraph.eligibility.compiler.RuleCompiler;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Cost of resolving a graph through the cache once it is warm. Every lookup recomputes the
 * configuration fingerprint, so {@link #fingerprintOnly()} is the floor for {@link #cacheHit()}.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g", "-XX:+UseG1GC"})
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 2)
public class GraphCacheBenchmark {

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");

    @Param({"16", "256"})
    private int identityCount;

    @Param({"100", "1000"})
    private int rulesPerIdentity;

    private IGraphCache cache;
    private List<RuleConfiguration> configurations;
    private int cursor;

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("io.opentelemetry")
                .setLevel(java.util.logging.Level.OFF);

        GraphCacheConfig config = GraphCacheConfig.builder()
                .maxIdentities(identityCount * 2L)
                .recordStats(true)
                .build();
        cache = new CaffeineGraphCache(new RuleCompiler(DomainCatalog.permissive(), NOOP_TRACER), config, NOOP_TRACER);

        SyntheticWorkload workload = new SyntheticWorkload(7);
        configurations = new ArrayList<>(identityCount);
        for (int i = 0; i < identityCount; i++) {
            ConfigurationIdentity identity = ConfigurationIdentity.of("merchant-" + i, "stripe");
            RuleConfiguration configuration = workload.configuration(identity, rulesPerIdentity);
            configurations.add(configuration);
            cache.getOrCompile(identity, configuration);
        }
    }

    @TearDown(Level.Trial)
    public void teardownTrial() {
        System.out.printf("%n%s%n", cache.getMetrics());
    }

    @Benchmark
    public CompiledGraph cacheHit() {
        RuleConfiguration configuration = next();
        return cache.getOrCompile(configuration.identity(), configuration);
    }

    @Benchmark
    public String fingerprintOnly() {
        return ConfigurationFingerprint.of(next());
    }

    private RuleConfiguration next() {
        RuleConfiguration configuration = configurations.get(cursor);
        cursor = cursor + 1 == configurations.size() ? 0 : cursor + 1;
        return configuration;
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(GraphCacheBenchmark.class.getSimpleName())
                .forks(1)
                .build();
        new Runner(options).run();
    }
}
