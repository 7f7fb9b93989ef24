package com.scholary.refinery.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.refinery.task.Submission;

/** Response for an accepted submission; poll {@code /api/tasks/{taskId}} for progress. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskSubmissionResponse(String taskId, String sessionId) {

  static TaskSubmissionResponse from(Submission submission) {
    return new TaskSubmissionResponse(submission.taskId(), submission.sessionId());
  }
}
