/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.kgraph.eligibility.api.exceptions.ConfigurationReadException;
import com.kgraph.eligibility.api.model.RuleConfiguration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads configuration records from their JSON form.
 *
 * <p>Enum names are matched case-insensitively, so {@code "match": "all"} and
 * {@code "type": "require"} are accepted. Unknown properties are rejected.
 */
public class JsonConfigurationReader {

    private final ObjectMapper objectMapper;

    public JsonConfigurationReader() {
        this(JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public JsonConfigurationReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RuleConfiguration read(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigurationReadException("Failed to read configuration file " + path, e);
        }
        return read(content);
    }

    public RuleConfiguration read(String json) {
        try {
            RuleConfiguration configuration = objectMapper.readValue(json, RuleConfiguration.class);
            if (configuration == null) {
                throw new ConfigurationReadException("Configuration document is empty");
            }
            return configuration;
        } catch (JsonProcessingException e) {
            throw new ConfigurationReadException("Malformed configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a JSON array of configuration records.
     */
    public List<RuleConfiguration> readAll(Path path) {
        try {
            return objectMapper.readValue(Files.readString(path),
                    objectMapper.getTypeFactory().constructCollectionType(List.class, RuleConfiguration.class));
        } catch (JsonProcessingException e) {
            throw new ConfigurationReadException("Malformed configuration JSON in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationReadException("Failed to read configuration file " + path, e);
        }
    }

    public String write(RuleConfiguration configuration) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(configuration);
        } catch (JsonProcessingException e) {
            throw new ConfigurationReadException("Failed to serialise configuration " + configuration.identity(), e);
        }
    }
}
