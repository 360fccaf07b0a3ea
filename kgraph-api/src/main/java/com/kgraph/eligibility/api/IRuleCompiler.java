/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api;

import com.kgraph.eligibility.api.exceptions.CompileException;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.runtime.model.CompiledGraph;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for compiling a rule configuration into an immutable constraint graph.
 */
public interface IRuleCompiler {

    /**
     * Compiles a configuration.
     *
     * @param configuration the configuration to compile (must not be null)
     * @return compiled graph, ready to be shared across threads
     * @throws CompileException if the configuration is malformed, references unknown
     *                          domain values or can never be satisfied
     */
    CompiledGraph compile(RuleConfiguration configuration);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
