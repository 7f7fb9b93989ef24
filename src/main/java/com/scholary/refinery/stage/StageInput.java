package com.scholary.refinery.stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Documents handed to a stage.
 *
 * @param subject what the documents are about (cluster name, video label); may be empty
 * @param documents the documents in the order they should appear in the prompt
 */
public record StageInput(String subject, List<Document> documents) {

  public StageInput {
    subject = subject == null ? "" : subject;
    documents = List.copyOf(documents);
  }

  public static StageInput single(String documentId, String content) {
    return new StageInput("", List.of(new Document(documentId, content)));
  }

  public static StageInput of(String subject, Map<String, String> documents) {
    List<Document> list = new ArrayList<>();
    documents.forEach((id, content) -> list.add(new Document(id, content)));
    return new StageInput(subject, list);
  }

  /** The first document, for single-document stages. */
  public Document first() {
    if (documents.isEmpty()) {
      throw new IllegalStateException("Stage input has no documents");
    }
    return documents.get(0);
  }

  public int wordCount() {
    int words = 0;
    for (Document document : documents) {
      String trimmed = document.content().trim();
      if (!trimmed.isEmpty()) {
        words += trimmed.split("\\s+").length;
      }
    }
    return words;
  }

  /** One identified document. */
  public record Document(String documentId, String content) {}
}
