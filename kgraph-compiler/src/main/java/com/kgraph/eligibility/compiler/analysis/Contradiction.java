/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.analysis;

import com.kgraph.eligibility.api.model.DomainValue;

import java.util.List;

/**
 * A contradictory forced closure.
 *
 * @param seed        seed value, or null for the empty seed (unconditional rules only)
 * @param conflicting the value that is both forced and ruled out, or the first option of a
 *                    one-of requirement whose options are all ruled out
 * @param ruleChain   rules taking part, earliest forcing rule first and the excluding rule last
 * @param description human-readable account of the conflict
 */
public record Contradiction(
        DomainValue seed,
        DomainValue conflicting,
        List<String> ruleChain,
        String description
) {
    public Contradiction {
        ruleChain = List.copyOf(ruleChain);
    }

    /**
     * The masked description; the raw values stay available through the accessors only.
     */
    @Override
    public String toString() {
        return description;
    }
}
