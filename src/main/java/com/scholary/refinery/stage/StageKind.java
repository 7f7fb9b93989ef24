package com.scholary.refinery.stage;

/** The text transforms the pipelines run through the generation backend. */
public enum StageKind {
  /** Tidy one transcript. Callers keep the original when this fails. */
  CLEAN,
  /** Summarize one transcript. */
  SUMMARIZE,
  /** Merge many transcripts into one research report. Failure ends the run. */
  SYNTHESIZE,
  /** Pull linkable terms out of a report. Failure means no links. */
  EXTRACT_KEYWORDS;

  private static final int MIN_CLEAN_TOKENS = 256;

  /** Completion budget for this stage over the given input. */
  public int maxTokens(StageInput input) {
    switch (this) {
      case CLEAN:
        return Math.max(MIN_CLEAN_TOKENS, input.wordCount() * 2);
      case SUMMARIZE:
        return 1000;
      case SYNTHESIZE:
        return 3000;
      case EXTRACT_KEYWORDS:
        return 500;
      default:
        throw new IllegalStateException("Unknown stage " + this);
    }
  }
}
