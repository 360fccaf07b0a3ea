/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.layering;

import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.api.model.RuleDefinition.MatchMode;
import com.kgraph.eligibility.api.model.RuleDefinition.Precondition;
import com.kgraph.eligibility.api.model.ValueRef;

import java.util.List;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Canonical form of a precondition: values de-duplicated and sorted, and a single-value
 * {@code ANY} folded into {@code ALL}, since both hold exactly when that value is present.
 */
public record PreconditionKey(MatchMode match, List<DomainValue> values) {

    public PreconditionKey {
        values = List.copyOf(values);
    }

    public static PreconditionKey of(Precondition precondition) {
        TreeSet<DomainValue> canonical = new TreeSet<>();
        for (ValueRef ref : precondition.values()) {
            canonical.add(ref.toDomainValue());
        }
        MatchMode match = precondition.match();
        if (match == MatchMode.ANY && canonical.size() == 1) {
            match = MatchMode.ALL;
        }
        return new PreconditionKey(match, List.copyOf(canonical));
    }

    public static PreconditionKey single(DomainValue value) {
        return new PreconditionKey(MatchMode.ALL, List.of(value));
    }

    public static PreconditionKey always() {
        return new PreconditionKey(MatchMode.ALWAYS, List.of());
    }

    public boolean isSingleValue() {
        return match == MatchMode.ALL && values.size() == 1;
    }

    public DomainValue singleValue() {
        if (!isSingleValue()) {
            throw new IllegalStateException("Not a single-value precondition: " + match + " over " + values.size() + " values");
        }
        return values.get(0);
    }

    /**
     * Renders the precondition with each value passed through {@code renderer}.
     */
    public String render(Function<DomainValue, String> renderer) {
        if (match == MatchMode.ALWAYS) {
            return "ALWAYS";
        }
        if (isSingleValue()) {
            return renderer.apply(values.get(0));
        }
        return values.stream().map(renderer)
                .collect(Collectors.joining(", ", match + "(", ")"));
    }

    @Override
    public String toString() {
        return render(DomainValue::toString);
    }
}
