/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A proposed combination of domain values submitted for an eligibility query.
 *
 * <p>Immutable. A category may appear with several values (e.g. a payment link that offers more
 * than one currency).
 *
 * @param values the asserted domain values
 */
public record CandidateAssignment(Set<DomainValue> values) {

    public CandidateAssignment {
        Objects.requireNonNull(values, "values must not be null");
        values = Set.copyOf(values);
    }

    public static CandidateAssignment of(DomainValue... values) {
        return new CandidateAssignment(new LinkedHashSet<>(Arrays.asList(values)));
    }

    public static CandidateAssignment empty() {
        return new CandidateAssignment(Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(DomainValue value) {
        return values.contains(value);
    }

    public int size() {
        return values.size();
    }

    public static final class Builder {
        private final Set<DomainValue> values = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder with(String category, String value) {
            values.add(DomainValue.of(category, value));
            return this;
        }

        public Builder with(DomainValue value) {
            values.add(value);
            return this;
        }

        public CandidateAssignment build() {
            return new CandidateAssignment(values);
        }
    }
}
