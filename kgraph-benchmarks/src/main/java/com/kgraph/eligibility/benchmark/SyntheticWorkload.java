/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.benchmark;

import com.kgraph.eligibility.api.model.CandidateAssignment;
import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.api.model.RuleDefinition;
import com.kgraph.eligibility.api.model.RuleDefinition.Consequence;
import com.kgraph.eligibility.api.model.RuleDefinition.Precondition;
import com.kgraph.eligibility.api.model.ValueRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded generator of payment-routing configurations and candidate pools.
 *
 * <p>Preconditions are always drawn from a different category than the consequence, and no rule
 * is unconditional, so every generated configuration compiles.
 */
final class SyntheticWorkload {

    private static final String[] PAYMENT_METHODS = {
            "CARD", "WALLET", "BANK_TRANSFER", "PAY_LATER", "CRYPTO", "VOUCHER", "UPI", "SEPA"};
    private static final String[] COUNTRIES = {
            "US", "CA", "UK", "DE", "FR", "JP", "AU", "BR", "IN", "NL", "SE", "ES", "IT", "MX", "SG", "CN"};
    private static final String[] CURRENCIES = {
            "USD", "EUR", "GBP", "JPY", "CAD", "AUD", "BRL", "INR", "SGD", "SEK"};
    private static final String[] CARD_NETWORKS = {"VISA", "MASTERCARD", "AMEX", "DISCOVER", "JCB"};

    private static final String[][] DOMAIN = {PAYMENT_METHODS, COUNTRIES, CURRENCIES, CARD_NETWORKS};
    private static final String[] CATEGORIES = {"payment_method", "country", "currency", "card_network"};

    private final Random random;

    SyntheticWorkload(long seed) {
        this.random = new Random(seed);
    }

    /**
     * Mix: 50% single-value REQUIRE/EXCLUDE, 30% ANY preconditions, 20% multi-value ALL with
     * ONE_OF consequences.
     */
    RuleConfiguration configuration(ConfigurationIdentity identity, int ruleCount) {
        RuleConfiguration.Builder builder = RuleConfiguration.builder(identity).revision("bench-" + ruleCount);
        for (int i = 0; i < ruleCount; i++) {
            int whenCategory = random.nextInt(CATEGORIES.length);
            int thenCategory = (whenCategory + 1 + random.nextInt(CATEGORIES.length - 1)) % CATEGORIES.length;
            int shape = random.nextInt(10);

            Precondition when;
            Consequence then;
            if (shape < 5) {
                when = Precondition.allOf(ref(whenCategory));
                then = random.nextBoolean()
                        ? Consequence.requires(ref(thenCategory))
                        : Consequence.excludes(ref(thenCategory));
            } else if (shape < 8) {
                when = Precondition.anyOf(ref(whenCategory), ref(whenCategory));
                then = Consequence.excludes(ref(thenCategory));
            } else {
                int secondCategory = (whenCategory + 1) % CATEGORIES.length == thenCategory
                        ? whenCategory
                        : (whenCategory + 1) % CATEGORIES.length;
                when = Precondition.allOf(ref(whenCategory), ref(secondCategory));
                then = Consequence.oneOf(ref(thenCategory), ref(thenCategory), ref(thenCategory));
            }
            builder.rule(RuleDefinition.of("R" + i, when, then));
        }
        return builder.build();
    }

    /**
     * Candidates carry one value per category, with a second currency on every tenth candidate.
     */
    List<CandidateAssignment> candidates(int count) {
        List<CandidateAssignment> pool = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            CandidateAssignment.Builder candidate = CandidateAssignment.builder();
            for (int c = 0; c < CATEGORIES.length; c++) {
                candidate.with(CATEGORIES[c], pick(DOMAIN[c]));
            }
            if (i % 10 == 0) {
                candidate.with("currency", pick(CURRENCIES));
            }
            pool.add(candidate.build());
        }
        return pool;
    }

    private ValueRef ref(int category) {
        return ValueRef.of(CATEGORIES[category], pick(DOMAIN[category]));
    }

    private String pick(String[] values) {
        return values[random.nextInt(values.length)];
    }
}
