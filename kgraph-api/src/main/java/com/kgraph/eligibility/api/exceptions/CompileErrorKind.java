/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.exceptions;

/**
 * Classification of compilation failures. All of them are defects of the configuration data.
 */
public enum CompileErrorKind {
    /** A rule references a category or value the domain catalog does not recognise. */
    UNKNOWN_DOMAIN_VALUE,
    /** The consistency pass proved that some part of the graph can never be satisfied. */
    UNSATISFIABLE_CONSTRAINT,
    /** A rule is missing its id, precondition, consequence or values. */
    MALFORMED_RULE
}
