/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A configuration record: the ordered rule list of one configuration identity.
 *
 * <p>Rule order is authoritative. When two rules contradict each other on the same pair of
 * values under the same precondition, the later one wins.
 *
 * @param identity configuration identity the rules belong to
 * @param revision optional version marker of the record content, folded into the fingerprint
 * @param rules    ordered business rules
 */
public record RuleConfiguration(
        @JsonProperty("identity") ConfigurationIdentity identity,
        @JsonProperty("revision") @JsonAlias("version") String revision,
        @JsonProperty("rules") List<RuleDefinition> rules
) {

    public static RuleConfiguration of(ConfigurationIdentity identity, List<RuleDefinition> rules) {
        return new RuleConfiguration(identity, null, rules);
    }

    public static Builder builder(ConfigurationIdentity identity) {
        return new Builder(identity);
    }

    /**
     * Returns a copy of this configuration with a different rule list, used to resubmit changed
     * rules under the same identity.
     */
    public RuleConfiguration withRules(List<RuleDefinition> newRules) {
        return new RuleConfiguration(identity, revision, newRules);
    }

    public static final class Builder {
        private final ConfigurationIdentity identity;
        private final List<RuleDefinition> rules = new ArrayList<>();
        private String revision;

        private Builder(ConfigurationIdentity identity) {
            this.identity = identity;
        }

        public Builder revision(String revision) {
            this.revision = revision;
            return this;
        }

        public Builder rule(RuleDefinition rule) {
            rules.add(rule);
            return this;
        }

        public Builder rule(String ruleId, RuleDefinition.Precondition when, RuleDefinition.Consequence then) {
            return rule(RuleDefinition.of(ruleId, when, then));
        }

        public RuleConfiguration build() {
            return new RuleConfiguration(identity, revision, List.copyOf(rules));
        }
    }
}
