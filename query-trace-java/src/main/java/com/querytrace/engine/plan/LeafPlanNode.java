package com.querytrace.engine.plan;

import java.util.List;

/** A scan or other node without inputs. */
public class LeafPlanNode extends AbstractPlanNode {

    public LeafPlanNode(String nodeType, Instrumentation instrumentation) {
        super(nodeType, instrumentation);
    }

    @Override
    public List<PlanNode> children() {
        return List.of();
    }
}
