/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kgraph.eligibility.runtime.model.RelationKind;

import java.io.Serializable;
import java.util.List;

/**
 * One violated relation found while evaluating a candidate.
 *
 * <p>The {@code source} and {@code target} descriptions have already been passed through the
 * value masker; sensitive configuration values never appear here in clear text.
 *
 * @param relation   kind of the violated relation ({@code REQUIRES} or {@code EXCLUDES})
 * @param ruleIds    ids of the configuration rules that produced the relation
 * @param edgeId     id of the violated edge in its graph
 * @param sourceNode id of the node whose truth activated the relation
 * @param source     masked description of the source node
 * @param targetNode id of the node the relation constrains
 * @param target     masked description of the target node
 */
public record Violation(
        @JsonProperty("relation") RelationKind relation,
        @JsonProperty("rule_ids") List<String> ruleIds,
        @JsonProperty("edge_id") int edgeId,
        @JsonProperty("source_node") int sourceNode,
        @JsonProperty("source") String source,
        @JsonProperty("target_node") int targetNode,
        @JsonProperty("target") String target
) implements Serializable {

    public Violation {
        ruleIds = List.copyOf(ruleIds);
    }

    /**
     * Returns a human-readable explanation of the denial.
     */
    public String describe() {
        String rules = String.join(", ", ruleIds);
        return switch (relation) {
            case REQUIRES -> String.format("%s requires %s, which is not satisfied (rule %s)",
                    source, target, rules);
            case EXCLUDES -> String.format("%s excludes %s, which is present (rule %s)",
                    source, target, rules);
            default -> String.format("%s %s %s violated (rule %s)", source, relation, target, rules);
        };
    }
}
