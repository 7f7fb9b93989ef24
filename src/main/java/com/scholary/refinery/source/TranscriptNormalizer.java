package com.scholary.refinery.source;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Deterministic transcript cleanup that needs no generation backend.
 *
 * <p>Drops bracketed and parenthesised cues ({@code [Music]}, {@code (applause)}), common filler
 * words and channel boilerplate, then collapses whitespace.
 */
@Component
public class TranscriptNormalizer {

  private static final List<Pattern> REMOVALS =
      List.of(
          Pattern.compile("\\[.*?]"),
          Pattern.compile("\\(.*?\\)"),
          Pattern.compile(
              "\\b(?:um|uh|ah|er|hmm|you know|i mean|basically|actually|literally)\\b",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile("please like and subscribe", Pattern.CASE_INSENSITIVE),
          Pattern.compile("thanks for watching", Pattern.CASE_INSENSITIVE),
          Pattern.compile("hit the bell icon", Pattern.CASE_INSENSITIVE),
          Pattern.compile("comment below", Pattern.CASE_INSENSITIVE));

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public String normalize(String transcript) {
    String cleaned = transcript;
    for (Pattern pattern : REMOVALS) {
      cleaned = pattern.matcher(cleaned).replaceAll("");
    }
    return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
  }
}
