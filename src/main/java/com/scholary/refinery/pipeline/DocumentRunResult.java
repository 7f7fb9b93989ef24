package com.scholary.refinery.pipeline;

/**
 * Result of a single-video run.
 *
 * @param documentId the video id
 * @param transcript the transcript the summary was generated from
 * @param summary the generated summary
 * @param wordCount words in the transcript
 * @param characterCount characters in the transcript
 * @param cleaned whether the transcript was cleaned before summarizing
 * @param model model that produced the summary
 */
public record DocumentRunResult(
    String documentId,
    String transcript,
    String summary,
    int wordCount,
    int characterCount,
    boolean cleaned,
    String model)
    implements RunResult {}
