package com.scholary.refinery.stage;

import java.util.List;
import org.springframework.stereotype.Component;

/** Builds the prompt sent to the generation backend for each stage. */
@Component
public class PromptTemplates {

  public String render(StageKind kind, StageInput input) {
    switch (kind) {
      case CLEAN:
        return clean(input.first().content());
      case SUMMARIZE:
        return summarize(input.subject(), input.first().content());
      case SYNTHESIZE:
        return synthesize(input.subject(), input.documents());
      case EXTRACT_KEYWORDS:
        return extractKeywords(input.first().content());
      default:
        throw new IllegalArgumentException("No prompt for stage " + kind);
    }
  }

  private String clean(String transcript) {
    return "Clean up the following video transcript. Remove filler words, sponsor segments and "
        + "advertisements, channel boilerplate (like and subscribe, notification reminders), "
        + "repeated passages and bracketed non-speech cues. Keep all substantive content and "
        + "make it read well. Reply with the cleaned transcript only.\n\n"
        + "Transcript:\n"
        + transcript;
  }

  private String summarize(String title, String transcript) {
    return "Summarize the following video transcript.\n\n"
        + "Video: " + title + "\n\n"
        + "Cover the main topics and key points, notable insights, any actionable advice, and "
        + "the overall conclusion. Write clear, well-structured paragraphs.\n\n"
        + "Transcript:\n"
        + transcript;
  }

  private String synthesize(String topic, List<StageInput.Document> documents) {
    StringBuilder transcripts = new StringBuilder();
    for (int i = 0; i < documents.size(); i++) {
      StageInput.Document document = documents.get(i);
      transcripts
          .append("Video ")
          .append(i + 1)
          .append(" (")
          .append(document.documentId())
          .append("):\n")
          .append(document.content())
          .append("\n\n");
    }

    return "Write a research report from the following collection of video transcripts.\n\n"
        + "Research topic: " + topic + "\n"
        + "Number of videos: " + documents.size() + "\n\n"
        + "Use these Markdown sections: Introduction, Key Takeaways, Detailed Analysis, "
        + "Contradictions and Debates, Actionable Steps, Conclusion. Point out where sources "
        + "disagree. Use headings, bullet points and emphasis where they help.\n\n"
        + "Video transcripts:\n"
        + transcripts;
  }

  private String extractKeywords(String report) {
    return "List the important concepts, technical terms, named people, places, organizations "
        + "and methodologies in the following text that deserve their own page in a knowledge "
        + "graph. Reply with a comma-separated list of terms and nothing else.\n\n"
        + "Text:\n"
        + report;
  }
}
