/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Synthetic node combining child nodes with {@code ALL}, {@code ANY} or {@code NOT}.
 *
 * <p>An {@code ALL} node without children always holds; the compiler uses it as the source of
 * unconditional rules. Children always have lower ids than their aggregation.
 */
public final class AggregationNode implements GraphNode, Serializable {
    private static final long serialVersionUID = 1L;

    private final int id;
    private final Aggregator aggregator;
    private final int[] children;

    public AggregationNode(int id, Aggregator aggregator, int[] children) {
        if (aggregator == Aggregator.NOT && children.length != 1) {
            throw new IllegalArgumentException("NOT aggregation requires exactly one child, got " + children.length);
        }
        this.id = id;
        this.aggregator = aggregator;
        this.children = children.clone();
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public boolean isAggregation() {
        return true;
    }

    public Aggregator aggregator() {
        return aggregator;
    }

    public int childCount() {
        return children.length;
    }

    public int child(int index) {
        return children[index];
    }

    public int[] children() {
        return children.clone();
    }

    public boolean isUnconditional() {
        return aggregator == Aggregator.ALL && children.length == 0;
    }

    @Override
    public String toString() {
        return "AggregationNode{id=" + id + ", " + aggregator + Arrays.toString(children) + "}";
    }
}
