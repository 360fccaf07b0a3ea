/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Key under which a compiled graph is cached: merchant, connector and configuration version.
 *
 * @param merchantId merchant owning the configuration (required)
 * @param connector  connector the configuration applies to (required)
 * @param version    configuration version, empty when the caller does not version configurations
 */
public record ConfigurationIdentity(
        @JsonProperty("merchant_id") String merchantId,
        @JsonProperty("connector") String connector,
        @JsonProperty("version") String version
) implements Serializable {

    public ConfigurationIdentity {
        Objects.requireNonNull(merchantId, "merchantId must not be null");
        Objects.requireNonNull(connector, "connector must not be null");
        version = version != null ? version : "";
    }

    public static ConfigurationIdentity of(String merchantId, String connector) {
        return new ConfigurationIdentity(merchantId, connector, "");
    }

    public static ConfigurationIdentity of(String merchantId, String connector, String version) {
        return new ConfigurationIdentity(merchantId, connector, version);
    }

    @Override
    public String toString() {
        return version.isEmpty()
                ? merchantId + "/" + connector
                : merchantId + "/" + connector + "@" + version;
    }
}
