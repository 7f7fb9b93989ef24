package com.scholary.refinery.pipeline;

import com.scholary.refinery.cluster.ClusterStatus;
import java.util.List;

/**
 * Result of a completed cluster run.
 *
 * @param sessionId the cluster
 * @param status final cluster status
 * @param processedCount sources whose transcript was collected
 * @param totalCount sources submitted
 * @param keywords terms linked in the report
 * @param report the linked research report
 */
public record ClusterRunResult(
    String sessionId,
    ClusterStatus status,
    int processedCount,
    int totalCount,
    List<String> keywords,
    String report)
    implements RunResult {

  public ClusterRunResult {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }
}
