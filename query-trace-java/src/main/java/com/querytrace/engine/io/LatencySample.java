package com.querytrace.engine.io;

/** A classified block access. The tier is always derived by {@link IoTierClassifier}. */
public record LatencySample(String blockIdentifier, double latencyUs, IoTier tier) {}
