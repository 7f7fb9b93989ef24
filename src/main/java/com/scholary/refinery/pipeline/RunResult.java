package com.scholary.refinery.pipeline;

/** Result payload of a finished pipeline run. */
public sealed interface RunResult permits ClusterRunResult, DocumentRunResult {}
