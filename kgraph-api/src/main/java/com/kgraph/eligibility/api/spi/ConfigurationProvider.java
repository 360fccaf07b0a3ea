/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.spi;

import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.RuleConfiguration;

import java.util.Optional;

/**
 * Supplies the current configuration for an identity.
 */
public interface ConfigurationProvider {

    Optional<RuleConfiguration> find(ConfigurationIdentity identity);
}
