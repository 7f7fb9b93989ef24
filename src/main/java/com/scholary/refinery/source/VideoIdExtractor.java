package com.scholary.refinery.source;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts YouTube video ids from the URL forms people paste.
 *
 * <p>Handles {@code watch?v=}, {@code youtu.be/}, {@code embed/}, {@code shorts/} and watch URLs
 * where {@code v} is not the first query parameter.
 */
public final class VideoIdExtractor {

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile(
              "(?:youtube\\.com/watch\\?v=|youtu\\.be/|youtube\\.com/embed/|youtube\\.com/shorts/)"
                  + "([^&\\n?#/]+)"),
          Pattern.compile("youtube\\.com/watch\\?(?:.*?&)?v=([^&\\n?#]+)"));

  private VideoIdExtractor() {}

  public static Optional<String> extract(String url) {
    if (url == null || url.isBlank()) {
      return Optional.empty();
    }
    for (Pattern pattern : PATTERNS) {
      Matcher matcher = pattern.matcher(url.trim());
      if (matcher.find()) {
        return Optional.of(matcher.group(1));
      }
    }
    return Optional.empty();
  }
}
