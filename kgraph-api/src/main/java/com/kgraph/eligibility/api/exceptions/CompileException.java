/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.exceptions;

import com.kgraph.eligibility.api.model.DomainValue;

import java.util.List;

/**
 * Exception thrown when a configuration cannot be compiled into a constraint graph.
 *
 * <p>This is a RuntimeException to avoid forcing checked exception handling through the cache
 * and the query facade, while still carrying structured detail: the {@link CompileErrorKind},
 * the offending rule (when one can be named) and the offending domain value (when one can be
 * named). Compilation is deterministic, so retrying with the same configuration fails again.
 */
public class CompileException extends RuntimeException {

    private final CompileErrorKind kind;
    private final String ruleId;
    private final DomainValue domainValue;
    private final List<String> involvedRules;

    public CompileException(CompileErrorKind kind, String ruleId, DomainValue domainValue,
                            List<String> involvedRules, String message) {
        super(format(kind, ruleId, message));
        this.kind = kind;
        this.ruleId = ruleId;
        this.domainValue = domainValue;
        this.involvedRules = involvedRules != null ? List.copyOf(involvedRules) : List.of();
    }

    public static CompileException malformedRule(String ruleId, String message) {
        return new CompileException(CompileErrorKind.MALFORMED_RULE, ruleId, null,
                ruleId != null ? List.of(ruleId) : List.of(), message);
    }

    public static CompileException unknownDomainValue(String ruleId, DomainValue value, String message) {
        return new CompileException(CompileErrorKind.UNKNOWN_DOMAIN_VALUE, ruleId, value, List.of(ruleId), message);
    }

    public static CompileException unsatisfiable(DomainValue value, List<String> involvedRules, String message) {
        String primaryRule = involvedRules.isEmpty() ? null : involvedRules.get(involvedRules.size() - 1);
        return new CompileException(CompileErrorKind.UNSATISFIABLE_CONSTRAINT, primaryRule, value, involvedRules, message);
    }

    public CompileErrorKind kind() {
        return kind;
    }

    /**
     * The rule the failure is attributed to, or null when it concerns the configuration as a whole.
     */
    public String ruleId() {
        return ruleId;
    }

    /**
     * The domain value the failure concerns, or null.
     */
    public DomainValue domainValue() {
        return domainValue;
    }

    /**
     * Every rule that takes part in the failure, e.g. the requires-chain and the exclusion of an
     * unsatisfiable value.
     */
    public List<String> involvedRules() {
        return involvedRules;
    }

    private static String format(CompileErrorKind kind, String ruleId, String message) {
        return ruleId != null
                ? "[" + kind + "] rule '" + ruleId + "': " + message
                : "[" + kind + "] " + message;
    }
}
