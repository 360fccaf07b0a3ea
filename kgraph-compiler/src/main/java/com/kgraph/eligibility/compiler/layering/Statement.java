/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.layering;

import com.kgraph.eligibility.api.model.DomainValue;

import java.util.List;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A single-target relation derived from one or more rules.
 *
 * <p>{@code REQUIRES} and {@code EXCLUDES} statements have exactly one target. A {@code ONE_OF}
 * statement keeps all its options, sorted, and always has at least two of them.
 *
 * @param precondition canonical precondition
 * @param kind         relation kind
 * @param targets      target values
 * @param ruleIds      contributing rules, sorted
 * @param symmetric    true for a pairwise exclusion stored once for the unordered pair
 */
public record Statement(
        PreconditionKey precondition,
        StatementKind kind,
        List<DomainValue> targets,
        List<String> ruleIds,
        boolean symmetric
) {

    public Statement {
        targets = List.copyOf(targets);
        ruleIds = List.copyOf(new TreeSet<>(ruleIds));
        if (kind != StatementKind.ONE_OF && targets.size() != 1) {
            throw new IllegalArgumentException(kind + " statement needs exactly one target, got " + targets.size());
        }
    }

    public DomainValue target() {
        return targets.get(0);
    }

    StatementKey key() {
        return new StatementKey(precondition, kind == StatementKind.ONE_OF, targets);
    }

    /**
     * A single-value exclusion: "a excludes b" is the same constraint as "b excludes a".
     */
    boolean isPairwiseExclusion() {
        return kind == StatementKind.EXCLUDES && precondition.isSingleValue();
    }

    Statement withRuleIds(List<String> mergedRuleIds) {
        return new Statement(precondition, kind, targets, mergedRuleIds, symmetric);
    }

    public String render(Function<DomainValue, String> renderer) {
        String rendered = kind == StatementKind.ONE_OF
                ? targets.stream().map(renderer).collect(Collectors.joining(", ", "[", "]"))
                : renderer.apply(target());
        return precondition.render(renderer) + " " + kind + " " + rendered + " " + ruleIds;
    }

    @Override
    public String toString() {
        return render(DomainValue::toString);
    }

    record StatementKey(PreconditionKey precondition, boolean oneOf, List<DomainValue> targets) {

        static StatementKey pair(DomainValue source, DomainValue target) {
            return new StatementKey(PreconditionKey.single(source), false, List.of(target));
        }
    }
}
