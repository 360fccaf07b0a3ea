/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.service;

import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.api.spi.ConfigurationProvider;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe {@link ConfigurationProvider} holding configurations in memory.
 */
public final class InMemoryConfigurationProvider implements ConfigurationProvider {
    private static final Logger logger = Logger.getLogger(InMemoryConfigurationProvider.class.getName());

    private final Map<ConfigurationIdentity, RuleConfiguration> configurations = new ConcurrentHashMap<>();

    public InMemoryConfigurationProvider() {
    }

    public InMemoryConfigurationProvider(Collection<RuleConfiguration> initial) {
        initial.forEach(this::put);
    }

    /**
     * Stores a configuration under its own identity, replacing any previous one.
     */
    public void put(RuleConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        Objects.requireNonNull(configuration.identity(), "configuration identity must not be null");
        RuleConfiguration previous = configurations.put(configuration.identity(), configuration);
        logger.fine(() -> (previous == null ? "Registered" : "Replaced") + " configuration " + configuration.identity());
    }

    public boolean remove(ConfigurationIdentity identity) {
        return configurations.remove(identity) != null;
    }

    @Override
    public Optional<RuleConfiguration> find(ConfigurationIdentity identity) {
        return Optional.ofNullable(configurations.get(identity));
    }

    public int size() {
        return configurations.size();
    }
}
