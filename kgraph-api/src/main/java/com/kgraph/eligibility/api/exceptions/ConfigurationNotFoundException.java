/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.exceptions;

import com.kgraph.eligibility.api.model.ConfigurationIdentity;

/**
 * Thrown when an eligibility query names an identity the configuration provider does not know.
 */
public class ConfigurationNotFoundException extends RuntimeException {

    private final ConfigurationIdentity identity;

    public ConfigurationNotFoundException(ConfigurationIdentity identity) {
        super("No configuration found for identity " + identity);
        this.identity = identity;
    }

    public ConfigurationIdentity identity() {
        return identity;
    }
}
