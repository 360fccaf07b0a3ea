/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.benchmark;

import com.kgraph.eligibility.api.model.CandidateAssignment;
import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.EligibilityResult;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.api.spi.DomainCatalog;
import com.kgraph.eligibility.compiler.RuleCompiler;
import com.kgraph.eligibility.runtime.evaluation.EligibilityEvaluator;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Eligibility evaluation throughput and latency over synthetic payment-routing graphs.
 * <p>
 * USAGE:
 * # Build the benchmark jar
 * mvn clean package -pl kgraph-benchmarks -am -DskipTests
 * <p>
 * # Standard run
 * java -cp kgraph-benchmarks/target/classes:... com.kgraph.eligibility.benchmark.EvaluationBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : short warmup and measurement for rapid iteration
 */
@BenchmarkMode({Mode.Throughput, Mode.SampleTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g", "-XX:+UseG1GC", "-XX:+AlwaysPreTouch"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class EvaluationBenchmark {

    // ========================================================================
    // CONFIGURATION
    // ========================================================================

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    private static final int WARMUP_ITERATIONS = QUICK_MODE ? 2 : 5;
    private static final int MEASUREMENT_ITERATIONS = QUICK_MODE ? 5 : 10;
    private static final int CANDIDATE_POOL_SIZE = 4_096;

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");

    @Param({"50", "500", "5000"})
    private int ruleCount;

    // ========================================================================
    // STATE
    // ========================================================================

    private CompiledGraph graph;
    private EligibilityEvaluator evaluator;
    private List<CandidateAssignment> candidates;
    private int cursor;

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("io.opentelemetry")
                .setLevel(java.util.logging.Level.OFF);

        SyntheticWorkload workload = new SyntheticWorkload(42);
        RuleConfiguration configuration =
                workload.configuration(ConfigurationIdentity.of("bench", "stripe"), ruleCount);

        long compileStart = System.nanoTime();
        graph = new RuleCompiler(DomainCatalog.permissive(), NOOP_TRACER).compile(configuration);
        long compileNanos = System.nanoTime() - compileStart;

        evaluator = new EligibilityEvaluator();
        candidates = workload.candidates(CANDIDATE_POOL_SIZE);

        System.out.printf("%nRules: %,d  Nodes: %,d  Constraint edges: %,d  Compile: %.2f ms%n",
                ruleCount, graph.stats().nodeCount(), graph.stats().constraintEdgeCount(),
                compileNanos / 1_000_000.0);
    }

    // ========================================================================
    // BENCHMARK METHODS
    // ========================================================================

    @Benchmark
    public EligibilityResult evaluateExplained() {
        return evaluator.evaluate(graph, nextCandidate(), true);
    }

    @Benchmark
    public EligibilityResult evaluateFirstViolation() {
        return evaluator.evaluate(graph, nextCandidate(), false);
    }

    /**
     * Batch of 100 candidates against the same graph, as an API caller filtering its options
     * would issue.
     */
    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.SECONDS)
    public void evaluateBatch100(Blackhole bh) {
        for (int i = 0; i < 100; i++) {
            bh.consume(evaluator.evaluate(graph, nextCandidate(), true));
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @Threads(4)
    public void evaluateConcurrent(Blackhole bh) {
        int index = (int) (Thread.currentThread().getId() * 31 + System.nanoTime()) & (CANDIDATE_POOL_SIZE - 1);
        bh.consume(evaluator.evaluate(graph, candidates.get(index), true));
    }

    private CandidateAssignment nextCandidate() {
        CandidateAssignment candidate = candidates.get(cursor);
        cursor = (cursor + 1) & (CANDIDATE_POOL_SIZE - 1);
        return candidate;
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(EvaluationBenchmark.class.getSimpleName())
                .warmupIterations(WARMUP_ITERATIONS)
                .measurementIterations(MEASUREMENT_ITERATIONS)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 3))
                .forks(1)
                .build();
        new Runner(options).run();
    }
}
