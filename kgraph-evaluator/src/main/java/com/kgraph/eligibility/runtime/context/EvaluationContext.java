/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.context;

import com.kgraph.eligibility.api.spi.GraphQuery;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Thread-local evaluation state: the value nodes a candidate asserts, the memo table of node
 * truth values and scratch buffers for collecting relevant sources.
 *
 * THREAD SAFETY: One instance per thread (ThreadLocal), no synchronization needed.
 * MEMORY: Pooled and reused via reset(), no allocations in steady state once the buffers have
 * grown to the largest graph seen by the thread.
 */
public final class EvaluationContext implements GraphQuery {

    private static final int INITIAL_CAPACITY = 64;

    private final IntSet asserted;
    private final IntArrayList written;
    private final IntSet visited;
    private final IntArrayList sources;
    private byte[] memo;
    private int nodeCount;

    public EvaluationContext() {
        this.asserted = new IntOpenHashSet(16);
        this.written = new IntArrayList(INITIAL_CAPACITY);
        this.visited = new IntOpenHashSet(INITIAL_CAPACITY);
        this.sources = new IntArrayList(INITIAL_CAPACITY);
        this.memo = new byte[INITIAL_CAPACITY];
    }

    /**
     * Prepares the context for a graph with the given node count.
     * Only memo slots written by the previous evaluation are cleared.
     */
    public void reset(int graphNodeCount) {
        if (memo.length < graphNodeCount) {
            memo = new byte[Math.max(graphNodeCount, memo.length * 2)];
        } else {
            for (int i = 0; i < written.size(); i++) {
                memo[written.getInt(i)] = UNKNOWN;
            }
        }
        written.clear();
        asserted.clear();
        visited.clear();
        sources.clear();
        nodeCount = graphNodeCount;
    }

    public void assertValue(int valueNodeId) {
        asserted.add(valueNodeId);
    }

    public int assertedCount() {
        return asserted.size();
    }

    @Override
    public boolean isAsserted(int valueNodeId) {
        return asserted.contains(valueNodeId);
    }

    @Override
    public byte memo(int nodeId) {
        return memo[nodeId];
    }

    @Override
    public void memoize(int nodeId, boolean holds) {
        if (memo[nodeId] == UNKNOWN) {
            written.add(nodeId);
        }
        memo[nodeId] = holds ? TRUE : FALSE;
    }

    /**
     * Collects the nodes whose constraint edges can apply to the asserted values: the asserted
     * value nodes, every aggregation reachable upward from them, and the graph's unconditional
     * roots. Returned in ascending id order; the list is owned by this context.
     */
    public IntList relevantSources(CompiledGraph graph) {
        if (graph.nodeCount() != nodeCount) {
            throw new IllegalStateException("Context was reset for " + nodeCount
                    + " nodes but the graph has " + graph.nodeCount());
        }
        IntArrayList frontier = new IntArrayList(asserted);
        while (!frontier.isEmpty()) {
            int node = frontier.popInt();
            if (!visited.add(node)) {
                continue;
            }
            sources.add(node);
            IntList parents = graph.parentsOf(node);
            for (int i = 0; i < parents.size(); i++) {
                frontier.add(parents.getInt(i));
            }
        }
        IntList roots = graph.unconditionalRoots();
        for (int i = 0; i < roots.size(); i++) {
            if (visited.add(roots.getInt(i))) {
                sources.add(roots.getInt(i));
            }
        }
        IntArrays.quickSort(sources.elements(), 0, sources.size());
        return sources;
    }

    public int memoizedCount() {
        return written.size();
    }
}
