/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to a domain value as written in a configuration record.
 *
 * <p>Kept in raw form so that the compiler can report malformed references instead of failing
 * inside a constructor. {@link #toDomainValue()} produces the canonical value.
 */
public record ValueRef(
        @JsonProperty("category") String category,
        @JsonProperty("value") String value,
        @JsonProperty("sensitive") Boolean sensitive
) {

    public static ValueRef of(String category, String value) {
        return new ValueRef(category, value, false);
    }

    public static ValueRef sensitive(String category, String value) {
        return new ValueRef(category, value, true);
    }

    public Boolean sensitive() {
        return sensitive != null ? sensitive : false;
    }

    @JsonIgnore
    public boolean isComplete() {
        return category != null && !category.isBlank() && value != null && !value.isBlank();
    }

    public DomainValue toDomainValue() {
        return DomainValue.of(category, value);
    }
}
