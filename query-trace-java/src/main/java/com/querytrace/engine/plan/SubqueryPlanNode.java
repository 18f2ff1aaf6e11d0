package com.querytrace.engine.plan;

import java.util.List;

/**
 * Wrapped-subplan shape (SubqueryScan). The subplan is reported after any outer input.
 */
public class SubqueryPlanNode extends AbstractPlanNode {

    private final PlanNode outer;
    private final PlanNode subplan;

    public SubqueryPlanNode(String nodeType, Instrumentation instrumentation, PlanNode subplan) {
        this(nodeType, instrumentation, null, subplan);
    }

    public SubqueryPlanNode(String nodeType, Instrumentation instrumentation, PlanNode outer, PlanNode subplan) {
        super(nodeType, instrumentation);
        this.outer = outer;
        this.subplan = subplan;
    }

    @Override
    public List<PlanNode> children() {
        if (outer != null && subplan != null) return List.of(outer, subplan);
        if (outer != null) return List.of(outer);
        if (subplan != null) return List.of(subplan);
        return List.of();
    }
}
