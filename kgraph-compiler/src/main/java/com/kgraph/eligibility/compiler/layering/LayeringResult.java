/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.layering;

import java.util.List;

/**
 * Outcome of relation layering.
 *
 * @param statements           surviving statements; a statement that overrides another takes the last position
 * @param derivedStatements    statements split out of the rules before layering
 * @param overriddenStatements statements replaced by a later, contradicting statement
 * @param mergedStatements     statements folded into an equivalent earlier statement
 */
public record LayeringResult(
        List<Statement> statements,
        int derivedStatements,
        int overriddenStatements,
        int mergedStatements
) {
    public LayeringResult {
        statements = List.copyOf(statements);
    }
}
