/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.api.spi.ValueMasker;

import java.io.Serializable;

/**
 * One distinct domain value of a graph. A candidate asserts a value node by containing its value.
 *
 * @param id        node id, unique within the owning graph
 * @param value     canonical domain value
 * @param origin    whether the value comes from a fixed catalog or from configuration
 * @param sensitive whether the value must be masked before leaving the engine
 */
public record ValueNode(int id, DomainValue value, NodeOrigin origin, boolean sensitive)
        implements GraphNode, Serializable {

    @Override
    public boolean isAggregation() {
        return false;
    }

    @Override
    public String toString() {
        return "ValueNode[id=" + id + ", value=" + (sensitive ? ValueMasker.redact(value) : value)
                + ", origin=" + origin + ", sensitive=" + sensitive + "]";
    }
}
