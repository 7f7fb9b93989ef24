package com.scholary.refinery.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Wraps salient terms of a report in {@code [[wiki links]]} for knowledge-graph tools.
 *
 * <p>Terms are applied longest first and every link, new or already in the text, is protected from
 * later terms. So {@code "neural network"} is linked as one unit and the {@code "network"} inside
 * it is left alone, and linking already-linked text changes nothing.
 */
@Component
public class KeywordLinker {

  private static final int MIN_KEYWORD_LENGTH = 3;

  private static final Pattern EXISTING_LINK = Pattern.compile("\\[\\[.*?]]", Pattern.DOTALL);
  private static final Pattern KEYWORD_SEPARATOR = Pattern.compile("[,\\n]");
  private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•]|\\d+[.)])\\s*");
  private static final String WORD_CHAR = "[\\p{L}\\p{N}_]";

  /**
   * Parse the keyword stage's reply into terms.
   *
   * @param reply comma or newline separated terms, possibly as a bulleted list
   * @return distinct terms in reply order, without very short ones
   */
  public List<String> parseKeywords(String reply) {
    List<String> keywords = new ArrayList<>();
    for (String part : KEYWORD_SEPARATOR.split(reply)) {
      String term = LIST_MARKER.matcher(part.trim()).replaceFirst("");
      term = term.replace("[[", "").replace("]]", "");
      term = stripQuotes(term.trim());
      keywords.add(term);
    }
    return distinct(keywords);
  }

  /**
   * Link every whole-word, case-insensitive occurrence of each keyword.
   *
   * @param text the report
   * @param keywords terms to link
   * @return the text with occurrences replaced by {@code [[keyword]]}
   */
  public String link(String text, Collection<String> keywords) {
    List<String> ordered = distinct(keywords);
    ordered.sort(Comparator.comparingInt(String::length).reversed());

    List<Segment> segments = splitExistingLinks(text);
    for (String keyword : ordered) {
      Pattern pattern =
          Pattern.compile(
              "(?<!" + WORD_CHAR + ")" + Pattern.quote(keyword) + "(?!" + WORD_CHAR + ")",
              Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
      String link = "[[" + keyword + "]]";

      List<Segment> next = new ArrayList<>();
      for (Segment segment : segments) {
        if (segment.linked()) {
          next.add(segment);
        } else {
          splitOnMatches(segment.text(), pattern, link, next);
        }
      }
      segments = next;
    }

    StringBuilder result = new StringBuilder(text.length());
    for (Segment segment : segments) {
      result.append(segment.text());
    }
    return result.toString();
  }

  private List<Segment> splitExistingLinks(String text) {
    List<Segment> segments = new ArrayList<>();
    Matcher matcher = EXISTING_LINK.matcher(text);
    int last = 0;
    while (matcher.find()) {
      if (matcher.start() > last) {
        segments.add(new Segment(text.substring(last, matcher.start()), false));
      }
      segments.add(new Segment(matcher.group(), true));
      last = matcher.end();
    }
    if (last < text.length()) {
      segments.add(new Segment(text.substring(last), false));
    }
    return segments;
  }

  private void splitOnMatches(String text, Pattern pattern, String link, List<Segment> out) {
    Matcher matcher = pattern.matcher(text);
    int last = 0;
    while (matcher.find()) {
      if (matcher.start() > last) {
        out.add(new Segment(text.substring(last, matcher.start()), false));
      }
      out.add(new Segment(link, true));
      last = matcher.end();
    }
    if (last < text.length()) {
      out.add(new Segment(text.substring(last), false));
    }
  }

  private List<String> distinct(Collection<String> keywords) {
    Map<String, String> byLowerCase = new LinkedHashMap<>();
    for (String keyword : keywords) {
      if (keyword == null) {
        continue;
      }
      String trimmed = keyword.trim();
      if (trimmed.length() < MIN_KEYWORD_LENGTH) {
        continue;
      }
      byLowerCase.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
    return new ArrayList<>(byLowerCase.values());
  }

  private String stripQuotes(String term) {
    String stripped = term;
    while (stripped.length() >= 2
        && isQuote(stripped.charAt(0))
        && isQuote(stripped.charAt(stripped.length() - 1))) {
      stripped = stripped.substring(1, stripped.length() - 1).trim();
    }
    return stripped;
  }

  private boolean isQuote(char c) {
    return c == '"' || c == '\'' || c == '`';
  }

  private record Segment(String text, boolean linked) {}
}
