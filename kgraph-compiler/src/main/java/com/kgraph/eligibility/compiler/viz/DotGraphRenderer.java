/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.viz;

import com.kgraph.eligibility.api.spi.ValueMasker;
import com.kgraph.eligibility.runtime.model.AggregationNode;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import com.kgraph.eligibility.runtime.model.RelationEdge;
import com.kgraph.eligibility.runtime.model.ValueNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Renders a compiled graph in Graphviz DOT format.
 *
 * <p>Value nodes are ellipses, aggregations are boxes. Constraint edges are labelled with their
 * kind and rule ids; membership edges are dotted. Every value label goes through the
 * {@link ValueMasker}, so sensitive values are never written in clear text.
 */
public class DotGraphRenderer {

    private final ValueMasker masker;

    public DotGraphRenderer() {
        this(ValueMasker.redacting());
    }

    public DotGraphRenderer(ValueMasker masker) {
        this.masker = masker;
    }

    public String render(CompiledGraph graph) {
        StringBuilder dot = new StringBuilder(256 + graph.nodeCount() * 48 + graph.edgeCount() * 64);
        dot.append("digraph \"").append(escape(graph.identity().toString())).append("\" {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [fontname=\"Helvetica\"];\n");

        for (ValueNode node : graph.valueNodes()) {
            dot.append("  n").append(node.id())
                    .append(" [shape=ellipse, label=\"").append(escape(masker.render(node))).append('"');
            if (node.sensitive()) {
                dot.append(", style=filled, fillcolor=\"#eeeeee\"");
            }
            dot.append("];\n");
        }
        for (AggregationNode node : graph.aggregationNodes()) {
            String label = node.isUnconditional() ? "ALWAYS" : node.aggregator().name();
            dot.append("  n").append(node.id())
                    .append(" [shape=box, label=\"").append(label).append("\"];\n");
        }

        for (RelationEdge edge : graph.edges()) {
            dot.append("  n").append(edge.source()).append(" -> n").append(edge.target());
            switch (edge.kind()) {
                case REQUIRES -> dot.append(" [color=blue, label=\"").append(constraintLabel(edge)).append("\"]");
                case EXCLUDES -> {
                    dot.append(" [color=red, style=dashed, label=\"").append(constraintLabel(edge)).append('"');
                    if (edge.symmetric()) {
                        dot.append(", dir=both");
                    }
                    dot.append(']');
                }
                case IMPLIED_BY_ALL, IMPLIED_BY_ANY, NEGATED_BY ->
                        dot.append(" [style=dotted, color=gray, arrowhead=empty]");
            }
            dot.append(";\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    public void write(CompiledGraph graph, Path target) {
        try {
            Files.writeString(target, render(graph));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write DOT file " + target, e);
        }
    }

    private static String constraintLabel(RelationEdge edge) {
        return edge.kind().name().toLowerCase(Locale.ROOT) + "\\n" + escape(String.join(",", edge.ruleIds()));
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
