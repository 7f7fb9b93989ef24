package com.scholary.refinery.api;

import com.scholary.refinery.generation.CostEstimate;
import com.scholary.refinery.generation.CostEstimator;
import com.scholary.refinery.task.Submission;
import com.scholary.refinery.task.TaskDispatcher;
import com.scholary.refinery.task.TaskHandle;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for single-video runs, task polling and cost estimates.
 */
@RestController
@Tag(name = "Tasks", description = "Single-video processing and task status")
public class TaskController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskController.class);

  private final TaskDispatcher taskDispatcher;
  private final CostEstimator costEstimator;

  public TaskController(TaskDispatcher taskDispatcher, CostEstimator costEstimator) {
    this.taskDispatcher = taskDispatcher;
    this.costEstimator = costEstimator;
  }

  @PostMapping("/api/videos")
  @Operation(
      summary = "Process video",
      description = "Fetch, optionally clean and summarize one video's transcript")
  public ResponseEntity<TaskSubmissionResponse> processVideo(
      @Valid @RequestBody SingleVideoRequest request) {
    LOGGER.info("Video request: url={}, clean={}", request.url(), request.cleanTranscript());
    Submission submission = taskDispatcher.submitDocument(request.url(), request.cleanTranscript());
    return ResponseEntity.accepted().body(TaskSubmissionResponse.from(submission));
  }

  /**
   * Get task status.
   *
   * <p>Includes the result once the task has succeeded, or the reason once it has failed.
   */
  @GetMapping("/api/tasks/{taskId}")
  @Operation(summary = "Get task status", description = "Poll a submitted task")
  public ResponseEntity<TaskHandle> getTask(@PathVariable String taskId) {
    return taskDispatcher
        .queryStatus(taskId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/api/estimate")
  @Operation(
      summary = "Estimate cost",
      description = "Estimate the generation cost of a text against the configured ceiling")
  public CostEstimate estimate(@Valid @RequestBody EstimateRequest request) {
    return costEstimator.estimate(request.text());
  }
}
