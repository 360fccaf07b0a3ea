/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * One business rule of a configuration record: "when the precondition holds, the consequence
 * must hold".
 *
 * <p>Example: "a WALLET payment requires the country to be US" is
 * <pre>{@code
 * RuleDefinition.of("wallet-us",
 *     Precondition.allOf(ValueRef.of("payment_method", "wallet")),
 *     Consequence.requires(ValueRef.of("country", "US")));
 * }</pre>
 *
 * <p>The JSON form uses snake_case names: {@code rule_id}, {@code when}, {@code then},
 * {@code description}, {@code enabled}.
 */
public record RuleDefinition(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("when") Precondition when,
        @JsonProperty("then") Consequence then,
        @JsonProperty("description") String description,
        @JsonProperty("enabled") Boolean enabled
) {

    public static RuleDefinition of(String ruleId, Precondition when, Consequence then) {
        return new RuleDefinition(ruleId, when, then, null, true);
    }

    public Boolean enabled() {
        return enabled != null ? enabled : true;
    }

    /**
     * How the precondition values combine.
     */
    public enum MatchMode {
        /** Every listed value is present in the candidate. */
        ALL,
        /** At least one listed value is present. */
        ANY,
        /** None of the listed values is present. */
        NONE,
        /** Always holds; takes no values. */
        ALWAYS
    }

    /**
     * What the consequence demands of the candidate.
     */
    public enum ConsequenceType {
        /** Every listed value must be present. */
        REQUIRE,
        /** No listed value may be present. */
        EXCLUDE,
        /** At least one listed value must be present. */
        ONE_OF
    }

    public record Precondition(
            @JsonProperty("match") MatchMode match,
            @JsonProperty("values") List<ValueRef> values
    ) {

        public Precondition {
            values = values != null ? values : List.of();
        }

        public static Precondition always() {
            return new Precondition(MatchMode.ALWAYS, List.of());
        }

        public static Precondition allOf(ValueRef... values) {
            return new Precondition(MatchMode.ALL, Arrays.asList(values));
        }

        public static Precondition anyOf(ValueRef... values) {
            return new Precondition(MatchMode.ANY, Arrays.asList(values));
        }

        public static Precondition noneOf(ValueRef... values) {
            return new Precondition(MatchMode.NONE, Arrays.asList(values));
        }
    }

    public record Consequence(
            @JsonProperty("type") ConsequenceType type,
            @JsonProperty("values") List<ValueRef> values
    ) {

        public Consequence {
            values = values != null ? values : List.of();
        }

        public static Consequence requires(ValueRef... values) {
            return new Consequence(ConsequenceType.REQUIRE, Arrays.asList(values));
        }

        public static Consequence excludes(ValueRef... values) {
            return new Consequence(ConsequenceType.EXCLUDE, Arrays.asList(values));
        }

        public static Consequence oneOf(ValueRef... values) {
            return new Consequence(ConsequenceType.ONE_OF, Arrays.asList(values));
        }
    }
}
