package com.querytrace.engine.plan;

/** Planner estimates for a node. */
public record PlanEstimate(double startupCost, double totalCost, double rows, int width) {}
