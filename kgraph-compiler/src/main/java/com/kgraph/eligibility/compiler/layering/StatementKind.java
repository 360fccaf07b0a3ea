/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.layering;

public enum StatementKind {
    REQUIRES,
    EXCLUDES,
    /** At least one of the targets must hold. */
    ONE_OF
}
