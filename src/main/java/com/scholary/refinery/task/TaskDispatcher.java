package com.scholary.refinery.task;

import com.scholary.refinery.cluster.ClusterNotFoundException;
import com.scholary.refinery.cluster.ClusterState;
import com.scholary.refinery.logging.StructuredLogger;
import com.scholary.refinery.pipeline.ClusterPipeline;
import com.scholary.refinery.pipeline.DocumentPipeline;
import com.scholary.refinery.pipeline.RunResult;
import com.scholary.refinery.progress.MonotonicProgressReporter;
import com.scholary.refinery.progress.ProgressReporter;
import com.scholary.refinery.store.ClusterStore;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs pipelines in the background and tracks them as pollable tasks.
 *
 * <p>The handle of a task is stored as pending before the run is handed to the executor, so a
 * caller can poll it as soon as it has the task id. Only one run per cluster may be in flight;
 * the session is claimed at submission and released when the run ends.
 */
@Service
public class TaskDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskDispatcher.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ClusterPipeline clusterPipeline;
  private final DocumentPipeline documentPipeline;
  private final ClusterStore clusterStore;
  private final TaskRepository taskRepository;
  private final Executor executor;
  private final Clock clock;

  private final Set<String> activeSessions = ConcurrentHashMap.newKeySet();

  public TaskDispatcher(
      ClusterPipeline clusterPipeline,
      DocumentPipeline documentPipeline,
      ClusterStore clusterStore,
      TaskRepository taskRepository,
      @Qualifier("taskExecutor") Executor executor,
      Clock clock) {
    this.clusterPipeline = clusterPipeline;
    this.documentPipeline = documentPipeline;
    this.clusterStore = clusterStore;
    this.taskRepository = taskRepository;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Create a cluster and start its first run.
   *
   * @return the task id and the new cluster's session id
   */
  public Submission submitCluster(String name, List<String> sourceRefs, boolean cleanRequested) {
    ClusterState cluster = clusterPipeline.create(name, sourceRefs, cleanRequested);
    String sessionId = cluster.getSessionId();
    return schedule(
        TaskKind.CLUSTER, sessionId, progress -> clusterPipeline.run(sessionId, progress));
  }

  /**
   * Start another run of an existing cluster.
   *
   * @throws ClusterNotFoundException if the cluster does not exist or has expired
   * @throws SessionBusyException if the cluster already has a run in flight
   */
  public Submission resumeCluster(String sessionId) {
    if (clusterStore.get(sessionId).isEmpty()) {
      throw new ClusterNotFoundException(sessionId);
    }
    return schedule(
        TaskKind.CLUSTER_RESUME, sessionId, progress -> clusterPipeline.run(sessionId, progress));
  }

  /** Start a single-video run. */
  public Submission submitDocument(String sourceRef, boolean cleanRequested) {
    return schedule(
        TaskKind.SINGLE_DOCUMENT,
        null,
        progress -> documentPipeline.run(sourceRef, cleanRequested, progress));
  }

  public Optional<TaskHandle> queryStatus(String taskId) {
    return taskRepository.findById(taskId);
  }

  private Submission schedule(
      TaskKind kind, String sessionId, Function<ProgressReporter, RunResult> work) {
    if (sessionId != null && !activeSessions.add(sessionId)) {
      throw new SessionBusyException(sessionId);
    }

    String taskId = UUID.randomUUID().toString();
    taskRepository.save(TaskHandle.pending(taskId, kind, sessionId, clock.instant()));
    LOGGER.info("Submitted task: taskId={}, kind={}, sessionId={}", taskId, kind, sessionId);

    try {
      executor.execute(() -> execute(taskId, sessionId, work));
    } catch (RejectedExecutionException e) {
      LOGGER.error("Executor rejected task {}", taskId, e);
      release(sessionId);
      taskRepository.update(
          taskId, handle -> handle.failed("Server busy, task was not started", clock.instant()));
    }
    return new Submission(taskId, sessionId);
  }

  private void execute(String taskId, String sessionId, Function<ProgressReporter, RunResult> work) {
    StructuredLogger.setRunContext(taskId, sessionId);
    boolean released = false;
    try {
      taskRepository.update(taskId, handle -> handle.running(clock.instant()));
      ProgressReporter reporter =
          new MonotonicProgressReporter(
              event -> {
                taskRepository.update(taskId, handle -> handle.withProgress(event, clock.instant()));
                structuredLogger.logTaskProgress(
                    taskId, event.current(), event.total(), event.label());
              });

      RunResult result = work.apply(reporter);
      // the session is free before pollers can observe the terminal state
      release(sessionId);
      released = true;
      taskRepository.update(taskId, handle -> handle.succeeded(result, clock.instant()));
      LOGGER.info("Task {} succeeded", taskId);

    } catch (RuntimeException e) {
      LOGGER.error("Task {} failed", taskId, e);
      String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      if (!released) {
        release(sessionId);
        released = true;
      }
      taskRepository.update(taskId, handle -> handle.failed(reason, clock.instant()));
    } finally {
      // a later run may already hold the session, so only release our own claim
      if (!released) {
        release(sessionId);
      }
      StructuredLogger.clearRunContext();
    }
  }

  private void release(String sessionId) {
    if (sessionId != null) {
      activeSessions.remove(sessionId);
    }
  }
}
