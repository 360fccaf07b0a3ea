/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

import java.io.Serializable;
import java.util.List;

/**
 * Directed edge of a compiled graph.
 *
 * <p>Constraint edges ({@code REQUIRES}, {@code EXCLUDES}) carry the ids of the rules that
 * produced them. Membership edges point from a child to its aggregation and carry no rule ids.
 * A symmetric {@code EXCLUDES} edge stands for both directions of a mutual exclusion between two
 * value nodes.
 */
public record RelationEdge(
        int id,
        RelationKind kind,
        int source,
        int target,
        List<String> ruleIds,
        boolean symmetric
) implements Serializable {

    public RelationEdge {
        ruleIds = List.copyOf(ruleIds);
    }

    public boolean isConstraint() {
        return kind.isConstraint();
    }
}
