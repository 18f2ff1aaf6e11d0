package com.querytrace.engine.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Left/right shape used by joins, sorts, limits and most other operators.
 * Either side may be absent; a single-input operator only has a left (outer) child.
 */
public class BinaryPlanNode extends AbstractPlanNode {

    private final PlanNode left;
    private final PlanNode right;

    public BinaryPlanNode(String nodeType, Instrumentation instrumentation, PlanNode left, PlanNode right) {
        super(nodeType, instrumentation);
        this.left = left;
        this.right = right;
    }

    public static BinaryPlanNode unary(String nodeType, Instrumentation instrumentation, PlanNode child) {
        return new BinaryPlanNode(nodeType, instrumentation, child, null);
    }

    public PlanNode left()  { return left; }
    public PlanNode right() { return right; }

    @Override
    public List<PlanNode> children() {
        if (left == null && right == null) return List.of();
        List<PlanNode> out = new ArrayList<>(2);
        if (left != null) out.add(left);
        if (right != null) out.add(right);
        return Collections.unmodifiableList(out);
    }
}
