/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.exceptions;

/**
 * Thrown when a configuration record or catalog cannot be read or parsed.
 */
public class ConfigurationReadException extends RuntimeException {

    public ConfigurationReadException(String message) {
        super(message);
    }

    public ConfigurationReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
