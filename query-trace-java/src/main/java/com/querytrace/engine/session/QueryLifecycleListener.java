package com.querytrace.engine.session;

import com.querytrace.engine.io.BlockAccess;
import com.querytrace.engine.plan.PlanNode;

import java.util.List;

/**
 * Callback points the host engine invokes, in lifecycle order, for every statement:
 * plan start, plan end, bind, execute start/end (possibly repeated for fetches),
 * block accesses during execution, and execution end.
 *
 * Implementations must never throw into the host.
 */
public interface QueryLifecycleListener {

    void onPlanStart(String statementText);

    void onPlanEnd();

    void onBind(List<BindParameter> parameters);

    void onExecuteStart();

    void onExecuteEnd(long rowsProcessed);

    void onBlockAccess(BlockAccess access);

    /** @param finishedPlan root of the instrumented plan tree, or null when the host has none */
    void onExecutionEnd(PlanNode finishedPlan);
}
