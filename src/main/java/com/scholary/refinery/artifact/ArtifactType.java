package com.scholary.refinery.artifact;

/** Kinds of Markdown artifact the pipelines publish, with their object keys. */
public enum ArtifactType {
  TRANSCRIPT("videos/%s/transcript.md"),
  SUMMARY("videos/%s/summary.md"),
  REPORT("clusters/%s/report.md");

  private final String keyPattern;

  ArtifactType(String keyPattern) {
    this.keyPattern = keyPattern;
  }

  /**
   * Object key for an artifact.
   *
   * @param id video id for transcripts and summaries, session id for reports
   */
  public String keyFor(String id) {
    if (id == null || id.isBlank() || id.contains("/") || id.contains("..")) {
      throw new IllegalArgumentException("Invalid artifact id: " + id);
    }
    return String.format(keyPattern, id);
  }
}
