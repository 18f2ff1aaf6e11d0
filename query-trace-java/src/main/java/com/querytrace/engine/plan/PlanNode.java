package com.querytrace.engine.plan;

import java.util.List;
import java.util.Optional;

/**
 * A node of a finished plan-execution tree. The host owns the tree; the trace engine only
 * reads it and never retains a node past the end of the statement.
 *
 * Every node shape (leaf, left/right, N-way list, wrapped subplan) reports its children
 * through {@link #children()}, so walkers never dispatch on the node type.
 */
public interface PlanNode {

    /** Node type tag, e.g. {@code SeqScan}, {@code HashJoin}, {@code Append}. */
    String nodeType();

    /** Runtime counters; empty when the node was never executed (e.g. a pruned branch). */
    Optional<Instrumentation> instrumentation();

    /** Children in execution order. Never null, never contains null. */
    List<PlanNode> children();

    default Optional<PlanEstimate> estimate() {
        return Optional.empty();
    }

    default Optional<String> relationName() {
        return Optional.empty();
    }

    default Optional<String> indexName() {
        return Optional.empty();
    }
}
