package com.scholary.refinery.api;

import com.scholary.refinery.cluster.ClusterNotFoundException;
import com.scholary.refinery.cluster.ClusterState;
import com.scholary.refinery.store.ClusterStore;
import com.scholary.refinery.task.Submission;
import com.scholary.refinery.task.TaskDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for research clusters.
 *
 * <p>Creating or resuming a cluster starts a background task and returns its id immediately;
 * clients poll {@code /api/tasks/{taskId}} for progress and the final report.
 */
@RestController
@RequestMapping("/api/clusters")
@Tag(name = "Clusters", description = "Multi-video research synthesis")
public class ClusterController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClusterController.class);

  private final TaskDispatcher taskDispatcher;
  private final ClusterStore clusterStore;

  public ClusterController(TaskDispatcher taskDispatcher, ClusterStore clusterStore) {
    this.taskDispatcher = taskDispatcher;
    this.clusterStore = clusterStore;
  }

  @PostMapping
  @Operation(
      summary = "Create cluster",
      description = "Create a cluster from video URLs and start synthesizing its research report")
  public ResponseEntity<TaskSubmissionResponse> create(
      @Valid @RequestBody CreateClusterRequest request) {
    LOGGER.info(
        "Cluster request: name={}, videos={}, clean={}",
        request.name(),
        request.urls().size(),
        request.cleanTranscripts());
    Submission submission =
        taskDispatcher.submitCluster(request.name(), request.urls(), request.cleanTranscripts());
    return ResponseEntity.accepted().body(TaskSubmissionResponse.from(submission));
  }

  @PostMapping("/{sessionId}/resume")
  @Operation(
      summary = "Resume cluster",
      description = "Run an interrupted cluster again, skipping videos already processed")
  public ResponseEntity<TaskSubmissionResponse> resume(@PathVariable String sessionId) {
    Submission submission = taskDispatcher.resumeCluster(sessionId);
    return ResponseEntity.accepted().body(TaskSubmissionResponse.from(submission));
  }

  @GetMapping
  @Operation(summary = "List clusters", description = "All live clusters, newest first")
  public List<ClusterSummaryResponse> list() {
    return clusterStore.listAll().stream().map(ClusterSummaryResponse::from).toList();
  }

  @GetMapping("/{sessionId}")
  @Operation(
      summary = "Get cluster",
      description = "Full cluster state including transcripts and, once completed, the report")
  public ClusterState get(@PathVariable String sessionId) {
    return clusterStore.get(sessionId).orElseThrow(() -> new ClusterNotFoundException(sessionId));
  }
}
