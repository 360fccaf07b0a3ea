/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

/**
 * Kinds of directed edges in a compiled graph.
 */
public enum RelationKind {
    /** Source holds, so target must hold. */
    REQUIRES(true),
    /** Source holds, so target must not hold. */
    EXCLUDES(true),
    /** Child of an {@link Aggregator#ALL} node. */
    IMPLIED_BY_ALL(false),
    /** Child of an {@link Aggregator#ANY} node. */
    IMPLIED_BY_ANY(false),
    /** Child of a {@link Aggregator#NOT} node. */
    NEGATED_BY(false);

    private final boolean constraint;

    RelationKind(boolean constraint) {
        this.constraint = constraint;
    }

    /**
     * Constraint edges can be violated by a candidate; membership edges only wire aggregations.
     */
    public boolean isConstraint() {
        return constraint;
    }

    public static RelationKind membershipOf(Aggregator aggregator) {
        return switch (aggregator) {
            case ALL -> IMPLIED_BY_ALL;
            case ANY -> IMPLIED_BY_ANY;
            case NOT -> NEGATED_BY;
        };
    }
}
