package com.scholary.refinery.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for cluster storage, task tracking and the run executor.
 *
 * @param clusterRetention how long a cluster lives after its last write
 * @param clusterMaxSize most clusters held by the in-memory store
 * @param taskRetention how long a task handle stays pollable after its last update
 * @param taskMaxSize most task handles held at once
 * @param executorThreads threads running pipelines
 * @param executorQueueSize runs that may wait for a thread before submissions are rejected
 * @param store cluster store backend, {@code redis} or {@code memory}
 */
@ConfigurationProperties(prefix = "refinery")
@Validated
public record RefineryProperties(
    @NotNull Duration clusterRetention,
    @Positive long clusterMaxSize,
    @NotNull Duration taskRetention,
    @Positive long taskMaxSize,
    @Positive int executorThreads,
    @Positive int executorQueueSize,
    @NotNull @Pattern(regexp = "redis|memory") String store) {}
