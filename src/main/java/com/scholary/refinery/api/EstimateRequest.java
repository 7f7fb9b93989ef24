package com.scholary.refinery.api;

import jakarta.validation.constraints.NotNull;

/** Text whose generation cost should be estimated. */
public record EstimateRequest(@NotNull String text) {}
