/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.spi;

/**
 * Per-evaluation view handed to a {@link ConstraintGraphEngine}: which value nodes the candidate
 * asserts, plus a memo table for node truth values.
 */
public interface GraphQuery {

    byte UNKNOWN = 0;
    byte TRUE = 1;
    byte FALSE = 2;

    boolean isAsserted(int valueNodeId);

    /**
     * @return {@link #UNKNOWN}, {@link #TRUE} or {@link #FALSE}
     */
    byte memo(int nodeId);

    void memoize(int nodeId, boolean holds);
}
