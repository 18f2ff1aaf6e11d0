package com.querytrace.engine.plan;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * N-way shape: Append, MergeAppend, BitmapAnd and BitmapOr hold a list of subplans
 * instead of left/right inputs.
 */
public class MultiPlanNode extends AbstractPlanNode {

    private final List<PlanNode> subplans;

    public MultiPlanNode(String nodeType, Instrumentation instrumentation, List<? extends PlanNode> subplans) {
        super(nodeType, instrumentation);
        this.subplans = subplans == null
            ? List.of()
            : subplans.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public List<PlanNode> children() {
        return subplans;
    }
}
