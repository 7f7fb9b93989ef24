package com.scholary.refinery.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.refinery.cluster.ClusterState;
import com.scholary.refinery.cluster.ClusterStatus;
import java.time.Instant;

/** One row of the cluster listing, without documents or report. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClusterSummaryResponse(
    String sessionId,
    String name,
    ClusterStatus status,
    int videoCount,
    int transcriptCount,
    boolean cleanRequested,
    String error,
    Instant createdAt,
    Instant updatedAt) {

  static ClusterSummaryResponse from(ClusterState cluster) {
    return new ClusterSummaryResponse(
        cluster.getSessionId(),
        cluster.getName(),
        cluster.getStatus(),
        cluster.getSourceRefs().size(),
        cluster.transcriptCount(),
        cluster.isCleanRequested(),
        cluster.getError(),
        cluster.getCreatedAt(),
        cluster.getUpdatedAt());
  }
}
