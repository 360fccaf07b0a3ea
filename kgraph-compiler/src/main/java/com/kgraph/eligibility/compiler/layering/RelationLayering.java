/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.layering;

import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.api.model.RuleDefinition;
import com.kgraph.eligibility.api.model.ValueRef;
import com.kgraph.eligibility.api.spi.ValueMasker;
import com.kgraph.eligibility.compiler.layering.Statement.StatementKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Splits validated rules into single-target statements and resolves overlaps between them.
 *
 * <p>Statements are keyed by (canonical precondition, target). Configuration order is
 * authoritative:
 * <ul>
 *   <li>a later statement with the same key and the same kind merges its rule ids into the
 *       earlier one;</li>
 *   <li>a later statement with the same key and a different kind replaces the earlier one;</li>
 *   <li>a pairwise exclusion {@code a EXCLUDES b} is the same constraint as {@code b EXCLUDES a}.
 *       Both fold into one symmetric statement, and it contradicts both {@code a REQUIRES b} and
 *       {@code b REQUIRES a}; whichever comes later wins.</li>
 * </ul>
 *
 * <p>Values flagged sensitive are redacted in log output.
 *
 * <p>Not thread-safe; use one instance per compilation.
 */
public final class RelationLayering {
    private static final Logger logger = Logger.getLogger(RelationLayering.class.getName());

    private final Map<StatementKey, Statement> layered = new LinkedHashMap<>();
    private final Function<DomainValue, String> renderer;
    private int derived;
    private int overridden;
    private int merged;

    public RelationLayering() {
        this(value -> false);
    }

    public RelationLayering(Predicate<DomainValue> sensitive) {
        this.renderer = value -> sensitive.test(value) ? ValueMasker.redact(value) : value.toString();
    }

    public LayeringResult layer(List<RuleDefinition> rules) {
        layered.clear();
        derived = 0;
        overridden = 0;
        merged = 0;

        for (RuleDefinition rule : rules) {
            for (Statement statement : split(rule)) {
                derived++;
                if (statement.isPairwiseExclusion()) {
                    applyPairwiseExclusion(statement);
                } else {
                    apply(statement);
                }
            }
        }
        return new LayeringResult(new ArrayList<>(layered.values()), derived, overridden, merged);
    }

    static List<Statement> split(RuleDefinition rule) {
        PreconditionKey precondition = PreconditionKey.of(rule.when());
        List<String> ruleIds = List.of(rule.ruleId());
        List<Statement> statements = new ArrayList<>();
        TreeSet<DomainValue> targets = new TreeSet<>();
        for (ValueRef ref : rule.then().values()) {
            targets.add(ref.toDomainValue());
        }

        switch (rule.then().type()) {
            case REQUIRE -> targets.forEach(target ->
                    statements.add(new Statement(precondition, StatementKind.REQUIRES, List.of(target), ruleIds, false)));
            case EXCLUDE -> targets.forEach(target ->
                    statements.add(new Statement(precondition, StatementKind.EXCLUDES, List.of(target), ruleIds, false)));
            case ONE_OF -> {
                if (targets.size() == 1) {
                    statements.add(new Statement(precondition, StatementKind.REQUIRES, List.copyOf(targets), ruleIds, false));
                } else {
                    statements.add(new Statement(precondition, StatementKind.ONE_OF, List.copyOf(targets), ruleIds, false));
                }
            }
        }
        return statements;
    }

    private void apply(Statement statement) {
        StatementKey key = statement.key();

        if (statement.kind() == StatementKind.REQUIRES && statement.precondition().isSingleValue()) {
            // The canonical key of a symmetric exclusion may be the mirrored pair.
            StatementKey mirror = StatementKey.pair(statement.target(), statement.precondition().singleValue());
            Statement previous = layered.get(mirror);
            if (previous != null && previous.symmetric()) {
                layered.remove(mirror);
                override(previous, statement);
            }
        }

        Statement previous = layered.get(key);
        if (previous == null) {
            layered.put(key, statement);
        } else if (previous.kind() == statement.kind()) {
            layered.put(key, previous.withRuleIds(union(previous.ruleIds(), statement.ruleIds())));
            merged++;
            logger.fine(() -> "Merged duplicate statement " + statement.render(renderer)
                    + " into " + previous.render(renderer));
        } else {
            layered.remove(key);
            layered.put(key, statement);
            override(previous, statement);
        }
    }

    private void applyPairwiseExclusion(Statement statement) {
        DomainValue a = statement.precondition().singleValue();
        DomainValue b = statement.target();
        List<String> ruleIds = new ArrayList<>();

        for (StatementKey key : List.of(StatementKey.pair(a, b), StatementKey.pair(b, a))) {
            Statement previous = layered.remove(key);
            if (previous == null) {
                continue;
            }
            if (previous.kind() == StatementKind.EXCLUDES) {
                ruleIds.addAll(previous.ruleIds());
                merged++;
                logger.fine(() -> "Folded exclusion " + previous.render(renderer)
                        + " with " + statement.render(renderer));
            } else {
                override(previous, statement);
            }
        }
        ruleIds.addAll(statement.ruleIds());

        DomainValue low = a.compareTo(b) <= 0 ? a : b;
        DomainValue high = low == a ? b : a;
        layered.put(StatementKey.pair(low, high), new Statement(
                PreconditionKey.single(low), StatementKind.EXCLUDES, List.of(high), ruleIds, true));
    }

    private void override(Statement previous, Statement winner) {
        overridden++;
        logger.fine(() -> "Statement " + previous.render(renderer)
                + " overridden by later " + winner.render(renderer));
    }

    private static List<String> union(List<String> first, List<String> second) {
        TreeSet<String> ids = new TreeSet<>(first);
        ids.addAll(second);
        return List.copyOf(ids);
    }
}
