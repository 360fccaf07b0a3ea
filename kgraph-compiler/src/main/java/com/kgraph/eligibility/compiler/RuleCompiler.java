/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler;

import com.kgraph.eligibility.api.CompilationListener;
import com.kgraph.eligibility.api.IRuleCompiler;
import com.kgraph.eligibility.api.exceptions.CompileException;
import com.kgraph.eligibility.api.model.ConfigurationFingerprint;
import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.api.model.RuleDefinition;
import com.kgraph.eligibility.api.model.RuleDefinition.MatchMode;
import com.kgraph.eligibility.api.model.ValueRef;
import com.kgraph.eligibility.api.spi.DomainCatalog;
import com.kgraph.eligibility.api.spi.ValueMasker;
import com.kgraph.eligibility.compiler.analysis.ConsistencyAnalyzer;
import com.kgraph.eligibility.compiler.analysis.Contradiction;
import com.kgraph.eligibility.compiler.io.JsonConfigurationReader;
import com.kgraph.eligibility.compiler.layering.LayeringResult;
import com.kgraph.eligibility.compiler.layering.PreconditionKey;
import com.kgraph.eligibility.compiler.layering.RelationLayering;
import com.kgraph.eligibility.compiler.layering.Statement;
import com.kgraph.eligibility.runtime.model.Aggregator;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import com.kgraph.eligibility.runtime.model.GraphStats;
import com.kgraph.eligibility.runtime.model.NodeOrigin;
import com.kgraph.eligibility.runtime.model.RelationKind;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles configuration records into immutable constraint graphs.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>VALIDATION - structure of every rule, and every referenced value against the catalog</li>
 *   <li>NODE_DEDUPLICATION - one value node per canonical domain value, in first-reference order</li>
 *   <li>RELATION_LAYERING - single-target statements, later statements override earlier ones</li>
 *   <li>GRAPH_BUILDING - shared aggregations for preconditions and one-of options, typed edges</li>
 *   <li>CONSISTENCY_CHECK - forced-closure analysis, see {@link ConsistencyAnalyzer}</li>
 * </ol>
 *
 * <p>Compilation is deterministic and has no side effects apart from logging and tracing. The
 * compiler itself is stateless between calls and may be shared, but listener callbacks run on
 * the compiling thread.
 */
public class RuleCompiler implements IRuleCompiler {
    private static final Logger logger = Logger.getLogger(RuleCompiler.class.getName());

    static final String VALIDATION = "VALIDATION";
    static final String NODE_DEDUPLICATION = "NODE_DEDUPLICATION";
    static final String RELATION_LAYERING = "RELATION_LAYERING";
    static final String GRAPH_BUILDING = "GRAPH_BUILDING";
    static final String CONSISTENCY_CHECK = "CONSISTENCY_CHECK";
    private static final int TOTAL_STAGES = 5;

    private final DomainCatalog catalog;
    private final ConsistencyAnalyzer consistencyAnalyzer = new ConsistencyAnalyzer();
    private Tracer tracer;
    private CompilationListener listener;

    public RuleCompiler(DomainCatalog catalog, Tracer tracer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    /**
     * Reads the configuration from a JSON file and compiles it.
     */
    public CompiledGraph compile(Path configurationPath) {
        return compile(new JsonConfigurationReader().read(configurationPath));
    }

    @Override
    public CompiledGraph compile(RuleConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        Span span = tracer.spanBuilder("compile-graph").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            span.setAttribute("identity", String.valueOf(configuration.identity()));

            Validated validated = runStage(VALIDATION, 1,
                    () -> validate(configuration),
                    v -> Map.of("ruleCount", v.totalRules(), "enabledRules", v.enabledRules().size(),
                            "referencedValues", v.lookups().size()));
            span.setAttribute("ruleCount", validated.totalRules());

            String fingerprint = ConfigurationFingerprint.of(configuration);
            CompiledGraph.Builder builder = CompiledGraph.builder(configuration.identity(), fingerprint);

            runStage(NODE_DEDUPLICATION, 2,
                    () -> deduplicateNodes(validated, builder),
                    b -> Map.of("valueNodes", b.valueNodeCount()));

            LayeringResult layering = runStage(RELATION_LAYERING, 3,
                    () -> new RelationLayering(validated.sensitiveValues()::contains).layer(validated.enabledRules()),
                    r -> Map.of("derivedStatements", r.derivedStatements(),
                            "statements", r.statements().size(),
                            "overriddenStatements", r.overriddenStatements(),
                            "mergedStatements", r.mergedStatements()));

            runStage(GRAPH_BUILDING, 4,
                    () -> buildGraph(layering.statements(), builder),
                    b -> Map.of("aggregations", b.aggregationCount(),
                            "constraintEdges", b.constraintEdgeCount(),
                            "membershipEdges", b.membershipEdgeCount()));

            long compilationTime = System.nanoTime() - startTime;
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("disabledRules", validated.totalRules() - validated.enabledRules().size());
            metadata.put("derivedStatements", layering.derivedStatements());
            metadata.put("revision", String.valueOf(configuration.revision()));

            GraphStats stats = new GraphStats(
                    validated.totalRules(),
                    builder.valueNodeCount(),
                    builder.aggregationCount(),
                    builder.constraintEdgeCount(),
                    builder.membershipEdgeCount(),
                    layering.overriddenStatements(),
                    layering.mergedStatements(),
                    compilationTime,
                    metadata);
            CompiledGraph graph = builder.build(stats);

            List<Contradiction> unreachable = runStage(CONSISTENCY_CHECK, 5,
                    () -> {
                        consistencyAnalyzer.check(graph);
                        return consistencyAnalyzer.unreachableValues(graph);
                    },
                    u -> Map.of("unreachableValues", u.size()));
            for (Contradiction contradiction : unreachable) {
                logger.fine(() -> configuration.identity() + ": " + contradiction.description());
            }

            span.setAttribute("nodeCount", graph.nodeCount());
            span.setAttribute("edgeCount", graph.edgeCount());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
            logger.info(String.format("Compiled %s: %d rules -> %d value nodes, %d aggregations, %d constraints "
                            + "(%d overridden, %d merged) in %d us",
                    configuration.identity(), stats.ruleCount(), stats.valueNodeCount(), stats.aggregationCount(),
                    stats.constraintEdgeCount(), stats.overriddenStatements(), stats.mergedStatements(),
                    TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - startTime)));
            return graph;
        } catch (CompileException e) {
            span.recordException(e);
            logger.warning("Compilation failed for " + configuration.identity() + ": " + e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> T runStage(String stageName, int stageNumber, Supplier<T> body,
                           Function<T, Map<String, Object>> metrics) {
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        Span span = tracer.spanBuilder(stageName.toLowerCase(Locale.ROOT).replace('_', '-')).startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            T result = body.get();
            long duration = System.nanoTime() - start;
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CompilationListener.StageResult(stageName, duration, metrics.apply(result)));
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private Validated validate(RuleConfiguration configuration) {
        if (configuration.identity() == null) {
            throw CompileException.malformedRule(null, "configuration has no identity");
        }
        if (configuration.rules() == null) {
            throw CompileException.malformedRule(null, "configuration " + configuration.identity() + " has no rule list");
        }

        Set<String> seenIds = new HashSet<>();
        Map<DomainValue, DomainCatalog.Lookup> lookups = new HashMap<>();
        Set<DomainValue> sensitiveValues = new HashSet<>();
        List<RuleDefinition> enabled = new ArrayList<>();
        List<RuleDefinition> rules = configuration.rules();

        for (int index = 0; index < rules.size(); index++) {
            RuleDefinition rule = rules.get(index);
            if (rule == null) {
                throw CompileException.malformedRule(null, "rule at index " + index + " is null");
            }
            String ruleId = rule.ruleId();
            if (ruleId == null || ruleId.isBlank()) {
                throw CompileException.malformedRule(null, "rule at index " + index + " has a missing or empty rule_id");
            }
            if (!seenIds.add(ruleId)) {
                throw CompileException.malformedRule(ruleId, "duplicate rule_id");
            }
            validatePrecondition(rule);
            validateConsequence(rule);
            collectSensitive(rule.when().values(), sensitiveValues);
            collectSensitive(rule.then().values(), sensitiveValues);
        }

        // Catalog checks run once every sensitive flag is known.
        for (RuleDefinition rule : rules) {
            checkCatalog(rule, rule.when().values(), lookups, sensitiveValues);
            checkCatalog(rule, rule.then().values(), lookups, sensitiveValues);

            if (rule.enabled()) {
                enabled.add(rule);
            } else {
                logger.warning("Rule '" + rule.ruleId() + "' of " + configuration.identity() + " is disabled - skipping");
            }
        }
        return new Validated(rules.size(), List.copyOf(enabled), lookups, sensitiveValues);
    }

    private static void validatePrecondition(RuleDefinition rule) {
        RuleDefinition.Precondition when = rule.when();
        if (when == null) {
            throw CompileException.malformedRule(rule.ruleId(), "missing precondition ('when')");
        }
        if (when.match() == null) {
            throw CompileException.malformedRule(rule.ruleId(), "precondition has no match mode");
        }
        boolean empty = when.values() == null || when.values().isEmpty();
        if (when.match() == MatchMode.ALWAYS) {
            if (!empty) {
                throw CompileException.malformedRule(rule.ruleId(), "ALWAYS precondition takes no values");
            }
        } else if (empty) {
            throw CompileException.malformedRule(rule.ruleId(),
                    when.match() + " precondition needs at least one value");
        }
        validateRefs(rule, "when", when.values());
    }

    private static void validateConsequence(RuleDefinition rule) {
        RuleDefinition.Consequence then = rule.then();
        if (then == null) {
            throw CompileException.malformedRule(rule.ruleId(), "missing consequence ('then')");
        }
        if (then.type() == null) {
            throw CompileException.malformedRule(rule.ruleId(), "consequence has no type");
        }
        if (then.values() == null || then.values().isEmpty()) {
            throw CompileException.malformedRule(rule.ruleId(), then.type() + " consequence needs at least one value");
        }
        validateRefs(rule, "then", then.values());
    }

    private static void validateRefs(RuleDefinition rule, String side, List<ValueRef> refs) {
        if (refs == null) {
            return;
        }
        for (int i = 0; i < refs.size(); i++) {
            ValueRef ref = refs.get(i);
            if (ref == null || !ref.isComplete()) {
                throw CompileException.malformedRule(rule.ruleId(),
                        "incomplete value reference at " + side + "[" + i + "]: category and value are required");
            }
        }
    }

    private void collectSensitive(List<ValueRef> refs, Set<DomainValue> sensitiveValues) {
        for (ValueRef ref : refs) {
            DomainValue value = ref.toDomainValue();
            if (ref.sensitive() || catalog.isSensitive(value.category())) {
                sensitiveValues.add(value);
            }
        }
    }

    /**
     * Error messages name the category but never the raw value of a sensitive reference.
     */
    private void checkCatalog(RuleDefinition rule, List<ValueRef> refs, Map<DomainValue, DomainCatalog.Lookup> lookups,
                              Set<DomainValue> sensitiveValues) {
        for (ValueRef ref : refs) {
            DomainValue value = ref.toDomainValue();
            DomainCatalog.Lookup lookup = lookups.computeIfAbsent(value, catalog::lookup);
            String shown = sensitiveValues.contains(value) ? ValueMasker.REDACTED : value.value();
            switch (lookup) {
                case UNKNOWN_CATEGORY -> throw CompileException.unknownDomainValue(rule.ruleId(), value,
                        "unknown category '" + value.category() + "' (value '" + shown + "')");
                case UNKNOWN_VALUE -> throw CompileException.unknownDomainValue(rule.ruleId(), value,
                        "value '" + shown + "' is not a member of category '" + value.category() + "'");
                default -> {
                }
            }
        }
    }

    // ========================================================================
    // NODE DEDUPLICATION
    // ========================================================================

    private CompiledGraph.Builder deduplicateNodes(Validated validated, CompiledGraph.Builder builder) {
        for (RuleDefinition rule : validated.enabledRules()) {
            registerValues(rule.when().values(), validated, builder);
            registerValues(rule.then().values(), validated, builder);
        }
        return builder;
    }

    private void registerValues(List<ValueRef> refs, Validated validated, CompiledGraph.Builder builder) {
        for (ValueRef ref : refs) {
            DomainValue value = ref.toDomainValue();
            NodeOrigin origin = validated.lookups().get(value) == DomainCatalog.Lookup.RECOGNIZED_FIXED
                    ? NodeOrigin.CATALOG
                    : NodeOrigin.CONFIGURATION;
            builder.valueNode(value, origin, validated.sensitiveValues().contains(value));
        }
    }

    // ========================================================================
    // GRAPH BUILDING
    // ========================================================================

    private CompiledGraph.Builder buildGraph(List<Statement> statements, CompiledGraph.Builder builder) {
        for (Statement statement : statements) {
            int source = sourceNode(statement.precondition(), builder);
            switch (statement.kind()) {
                case REQUIRES -> builder.constraint(RelationKind.REQUIRES, source,
                        valueNode(statement.target(), builder), statement.ruleIds(), false);
                case EXCLUDES -> builder.constraint(RelationKind.EXCLUDES, source,
                        valueNode(statement.target(), builder), statement.ruleIds(), statement.symmetric());
                case ONE_OF -> builder.constraint(RelationKind.REQUIRES, source,
                        builder.aggregation(Aggregator.ANY, valueNodes(statement.targets(), builder)),
                        statement.ruleIds(), false);
            }
        }
        return builder;
    }

    private static int sourceNode(PreconditionKey precondition, CompiledGraph.Builder builder) {
        int[] children = valueNodes(precondition.values(), builder);
        return switch (precondition.match()) {
            case ALWAYS -> builder.aggregation(Aggregator.ALL);
            case ALL -> builder.aggregation(Aggregator.ALL, children);
            case ANY -> builder.aggregation(Aggregator.ANY, children);
            case NONE -> builder.aggregation(Aggregator.NOT, builder.aggregation(Aggregator.ANY, children));
        };
    }

    private static int[] valueNodes(List<DomainValue> values, CompiledGraph.Builder builder) {
        int[] ids = new int[values.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = valueNode(values.get(i), builder);
        }
        return ids;
    }

    private static int valueNode(DomainValue value, CompiledGraph.Builder builder) {
        int id = builder.valueNodeId(value);
        if (id < 0) {
            throw new IllegalStateException("No value node in category " + value.category() + " after deduplication");
        }
        return id;
    }

    private record Validated(int totalRules, List<RuleDefinition> enabledRules,
                             Map<DomainValue, DomainCatalog.Lookup> lookups, Set<DomainValue> sensitiveValues) {
    }
}
