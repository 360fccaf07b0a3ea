/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.model;

/**
 * Where a value node's value comes from.
 */
public enum NodeOrigin {
    /** A member of a fixed catalog enumeration (country codes, currencies, ...). */
    CATALOG,
    /** A value of an open category, introduced by the configuration itself. */
    CONFIGURATION
}
