package com.scholary.refinery.generation;

/** Estimated cost of sending a prompt to the configured model. */
public record CostEstimate(
    double estimatedCost, int tokenCount, String model, double costPer1kTokens, boolean withinLimit) {}
