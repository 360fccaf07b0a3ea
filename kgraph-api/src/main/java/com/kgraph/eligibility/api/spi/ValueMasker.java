/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.spi;

import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.runtime.model.ValueNode;

/**
 * Renders value nodes for human consumption. Sensitive values must never be rendered in clear
 * text.
 */
@FunctionalInterface
public interface ValueMasker {

    String REDACTED = "[REDACTED]";

    String render(ValueNode node);

    /**
     * Renders non-sensitive values in clear text and sensitive ones as {@code CATEGORY=[REDACTED]}.
     */
    static ValueMasker redacting() {
        return node -> node.sensitive() ? redact(node.value()) : node.value().toString();
    }

    /**
     * {@code CATEGORY=[REDACTED]}: the category stays readable, the value does not.
     */
    static String redact(DomainValue value) {
        return value.category() + "=" + REDACTED;
    }
}
