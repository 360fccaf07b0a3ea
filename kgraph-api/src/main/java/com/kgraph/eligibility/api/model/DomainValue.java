/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * One concrete option within a named category, e.g. {@code COUNTRY=US}.
 *
 * <p>Both parts are stored in canonical form: the category is trimmed, upper-cased and has
 * {@code '-'} replaced by {@code '_'}; the value is trimmed and upper-cased. Two values that differ
 * only in case or surrounding whitespace are therefore the same domain value.
 *
 * @param category canonical category name
 * @param value    canonical value within the category
 */
public record DomainValue(String category, String value) implements Serializable, Comparable<DomainValue> {

    public DomainValue {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(value, "value must not be null");
        category = canonicalCategory(category);
        value = canonicalValue(value);
    }

    public static DomainValue of(String category, String value) {
        return new DomainValue(category, value);
    }

    public static String canonicalCategory(String category) {
        return category.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    }

    public static String canonicalValue(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public int compareTo(DomainValue other) {
        int byCategory = category.compareTo(other.category);
        return byCategory != 0 ? byCategory : value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return category + "=" + value;
    }
}
