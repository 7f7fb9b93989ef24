package com.scholary.refinery.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event method puts its fields in the MDC for the duration of one log call, so log
 * shippers can index them next to the run context ({@code taskId}, {@code sessionId}).
 */
public class StructuredLogger {

  private static final String[] EVENT_FIELDS = {
    "event_type", "documentId", "sourceRef", "stage", "reason", "durationMs", "current", "total",
    "fromStatus", "toStatus", "contentChars"
  };

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a transcript collected for a cluster or single video. */
  public void logSourceFetched(String sourceRef, String documentId, int contentChars) {
    try {
      MDC.put("event_type", "source_fetched");
      MDC.put("sourceRef", sourceRef);
      MDC.put("documentId", documentId);
      MDC.put("contentChars", String.valueOf(contentChars));

      logger.info(
          "Source fetched: source={}, documentId={}, chars={}", sourceRef, documentId, contentChars);
    } finally {
      clearEventFields();
    }
  }

  /** Log a source skipped because it was invalid or its transcript unavailable. */
  public void logSourceSkipped(String sourceRef, String reason) {
    try {
      MDC.put("event_type", "source_skipped");
      MDC.put("sourceRef", sourceRef);
      MDC.put("reason", reason);

      logger.warn("Source skipped: source={}, reason={}", sourceRef, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a stage that returned content. */
  public void logStageCompleted(String stage, String documentId, long durationMs) {
    try {
      MDC.put("event_type", "stage_completed");
      MDC.put("stage", stage);
      putIfPresent("documentId", documentId);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info("Stage completed: stage={}, documentId={}, took={}ms", stage, documentId, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a stage that failed. */
  public void logStageFailed(String stage, String documentId, String reason) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      putIfPresent("documentId", documentId);
      MDC.put("reason", reason);

      logger.warn("Stage failed: stage={}, documentId={}, reason={}", stage, documentId, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a cluster status transition. */
  public void logStatusTransition(String sessionId, String fromStatus, String toStatus) {
    try {
      MDC.put("event_type", "status_transition");
      MDC.put("fromStatus", fromStatus);
      MDC.put("toStatus", toStatus);

      logger.info("Cluster status: sessionId={}, {} -> {}", sessionId, fromStatus, toStatus);
    } finally {
      clearEventFields();
    }
  }

  /** Log task progress. */
  public void logTaskProgress(String taskId, int current, int total, String label) {
    try {
      MDC.put("event_type", "task_progress");
      MDC.put("current", String.valueOf(current));
      MDC.put("total", String.valueOf(total));

      logger.info("Task progress: taskId={}, {}/{}, {}", taskId, current, total, label);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String taskId, String sessionId) {
    MDC.put("taskId", taskId);
    if (sessionId != null) {
      MDC.put("sessionId", sessionId);
    }
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove("taskId");
    MDC.remove("sessionId");
  }

  private void putIfPresent(String key, String value) {
    if (value != null) {
      MDC.put(key, value);
    }
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    for (String field : EVENT_FIELDS) {
      MDC.remove(field);
    }
  }
}
