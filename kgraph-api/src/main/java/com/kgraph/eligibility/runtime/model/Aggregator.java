/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

/**
 * Boolean combinator of an {@link AggregationNode}.
 */
public enum Aggregator {
    ALL,
    ANY,
    NOT
}
