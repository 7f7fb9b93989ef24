package com.scholary.refinery.task;

/**
 * Identifiers handed back when work is submitted.
 *
 * @param taskId poll this for status, progress and result
 * @param sessionId the cluster the task runs against; null for single-video tasks
 */
public record Submission(String taskId, String sessionId) {}
