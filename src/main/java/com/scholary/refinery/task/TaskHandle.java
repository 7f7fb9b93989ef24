package com.scholary.refinery.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.refinery.pipeline.RunResult;
import com.scholary.refinery.progress.ProgressEvent;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a submitted task as seen by pollers.
 *
 * <p>Handles are immutable; each state change stores a new one. Once a handle is terminal it is
 * never replaced, so polling a finished task always returns the same payload.
 *
 * @param taskId task id
 * @param kind what the task runs
 * @param state lifecycle state
 * @param progress latest progress event, null until the run reports one
 * @param result run result, set only when {@code state} is succeeded
 * @param error failure reason, set only when {@code state} is failed
 * @param sessionId cluster the task runs against, null for single-video tasks
 * @param createdAt submission time
 * @param updatedAt time of the latest change
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskHandle(
    String taskId,
    TaskKind kind,
    TaskState state,
    ProgressEvent progress,
    RunResult result,
    String error,
    String sessionId,
    Instant createdAt,
    Instant updatedAt) {

  public TaskHandle {
    Objects.requireNonNull(taskId, "taskId");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(state, "state");
  }

  public static TaskHandle pending(String taskId, TaskKind kind, String sessionId, Instant now) {
    return new TaskHandle(taskId, kind, TaskState.PENDING, null, null, null, sessionId, now, now);
  }

  public TaskHandle running(Instant now) {
    return new TaskHandle(
        taskId, kind, TaskState.RUNNING, progress, null, null, sessionId, createdAt, now);
  }

  public TaskHandle withProgress(ProgressEvent event, Instant now) {
    return new TaskHandle(taskId, kind, state, event, result, error, sessionId, createdAt, now);
  }

  public TaskHandle succeeded(RunResult runResult, Instant now) {
    return new TaskHandle(
        taskId, kind, TaskState.SUCCEEDED, progress, runResult, null, sessionId, createdAt, now);
  }

  public TaskHandle failed(String reason, Instant now) {
    return new TaskHandle(
        taskId, kind, TaskState.FAILED, progress, null, reason, sessionId, createdAt, now);
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }
}
