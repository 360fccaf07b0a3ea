/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one eligibility query.
 *
 * <p>A result is either eligible, or ineligible with the ordered list of violated relations.
 * When the query was run without explanation ({@code explain=false}) an ineligible result carries
 * no reasons and {@link #explained()} is {@code false}.
 *
 * <h2>Usage</h2>
 * <pre>
 * EligibilityResult result = service.evaluate(identity, candidate, true);
 * if (!result.eligible()) {
 *     result.reasons().forEach(v -&gt; System.out.println(v.describe()));
 * }
 * </pre>
 *
 * @param eligible         whether the candidate satisfies every applicable relation
 * @param reasons          violated relations ordered by edge id, empty when eligible or unexplained
 * @param explained        whether the reasons were collected
 * @param graphFingerprint fingerprint of the compiled graph the result was computed on
 */
public record EligibilityResult(
        @JsonProperty("eligible") boolean eligible,
        @JsonProperty("reasons") List<Violation> reasons,
        @JsonProperty("explained") boolean explained,
        @JsonProperty("graph_fingerprint") String graphFingerprint
) implements Serializable {

    public EligibilityResult {
        reasons = List.copyOf(reasons);
    }

    public static EligibilityResult eligible(String graphFingerprint, boolean explained) {
        return new EligibilityResult(true, List.of(), explained, graphFingerprint);
    }

    public static EligibilityResult ineligible(String graphFingerprint, List<Violation> reasons) {
        return new EligibilityResult(false, reasons, true, graphFingerprint);
    }

    public static EligibilityResult ineligibleUnexplained(String graphFingerprint) {
        return new EligibilityResult(false, List.of(), false, graphFingerprint);
    }

    public int violationCount() {
        return reasons.size();
    }

    /**
     * Returns a multi-line denial explanation, or "ELIGIBLE".
     */
    public String toDetailedString() {
        if (eligible) {
            return "ELIGIBLE";
        }
        if (!explained) {
            return "INELIGIBLE";
        }
        return reasons.stream()
                .map(v -> "  - " + v.describe())
                .collect(Collectors.joining("\n", "INELIGIBLE:\n", ""));
    }
}
