/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.infrastructure.telemetry;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the tracer used by the compiler, the graph cache and the query facade.
 *
 * <p>The SDK and exporters are wired by the hosting process, which registers its
 * {@link OpenTelemetry} instance globally; this service only looks it up. Without a registered
 * SDK the global instance is a no-op, so tracing costs nothing.
 *
 * Configuration via environment variables (falling back to system properties):
 * - OTEL_DISABLED: force the no-op tracer (default: false)
 * - OTEL_INSTRUMENTATION_NAME: tracer name (default: com.kgraph.eligibility)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String DEFAULT_INSTRUMENTATION_NAME = "com.kgraph.eligibility";

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, String instrumentationName, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(instrumentationName);
        this.isNoop = isNoop;
    }

    /**
     * Get singleton instance with double-checked locking.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    private static TracingService initialize() {
        String name = getEnvOrProperty("OTEL_INSTRUMENTATION_NAME", DEFAULT_INSTRUMENTATION_NAME);
        if (isTracingDisabled()) {
            logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
            return new TracingService(OpenTelemetry.noop(), name, true);
        }
        try {
            OpenTelemetry global = GlobalOpenTelemetry.get();
            logger.info("Using globally registered OpenTelemetry for instrumentation " + name);
            return new TracingService(global, name, false);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to resolve OpenTelemetry - falling back to noop", e);
            return new TracingService(OpenTelemetry.noop(), name, true);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    private static boolean isTracingDisabled() {
        return Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"));
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
