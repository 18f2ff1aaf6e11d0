package com.querytrace.engine.plan;

import java.util.Optional;

/**
 * Common state of the ready-made node shapes. Subclasses only decide how children are held.
 */
public abstract class AbstractPlanNode implements PlanNode {

    private final String nodeType;
    private final Instrumentation instrumentation;
    private PlanEstimate estimate;
    private String relationName;
    private String indexName;

    protected AbstractPlanNode(String nodeType, Instrumentation instrumentation) {
        this.nodeType = nodeType;
        this.instrumentation = instrumentation;
    }

    @Override
    public String nodeType() {
        return nodeType;
    }

    @Override
    public Optional<Instrumentation> instrumentation() {
        return Optional.ofNullable(instrumentation);
    }

    @Override
    public Optional<PlanEstimate> estimate() {
        return Optional.ofNullable(estimate);
    }

    @Override
    public Optional<String> relationName() {
        return Optional.ofNullable(relationName);
    }

    @Override
    public Optional<String> indexName() {
        return Optional.ofNullable(indexName);
    }

    public AbstractPlanNode withEstimate(PlanEstimate estimate) {
        this.estimate = estimate;
        return this;
    }

    public AbstractPlanNode withRelation(String relationName) {
        this.relationName = relationName;
        return this;
    }

    public AbstractPlanNode withIndex(String indexName) {
        this.indexName = indexName;
        return this;
    }

    @Override
    public String toString() {
        return nodeType;
    }
}
