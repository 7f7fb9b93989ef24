package com.scholary.refinery.task;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What a task runs. */
public enum TaskKind {
  /** First run of a newly created cluster. */
  CLUSTER,
  /** Another run of an existing cluster, continuing from its last finished step. */
  CLUSTER_RESUME,
  /** Single-video transcript and summary. */
  SINGLE_DOCUMENT;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
