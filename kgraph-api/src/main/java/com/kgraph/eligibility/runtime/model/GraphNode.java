/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

/**
 * A node of a compiled graph. Value nodes and aggregation nodes share one id space.
 */
public interface GraphNode {

    int id();

    boolean isAggregation();
}
