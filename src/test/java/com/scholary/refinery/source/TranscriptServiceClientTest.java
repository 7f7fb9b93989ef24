package com.scholary.refinery.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class TranscriptServiceClientTest {

  private final TranscriptServiceClient client =
      new TranscriptServiceClient(
          new TranscriptSourceProperties("http://localhost:1", "en", 1, 1), new ObjectMapper());

  @Test
  void joinSegments_shouldJoinSegmentTextWithSpaces() throws Exception {
    String json =
        """
        {"videoId":"aaa","language":"en","segments":[
          {"text":"Hello ","start":0.0,"duration":1.0},
          {"text":"","start":1.0,"duration":0.5},
          {"text":"world","start":1.5,"duration":1.0}]}
        """;

    assertThat(client.joinSegments(json)).contains("Hello world");
  }

  @Test
  void joinSegments_shouldTreatNoSegmentsAsUnavailable() throws Exception {
    assertThat(client.joinSegments("{\"videoId\":\"aaa\",\"segments\":[]}")).isEmpty();
  }

  @Test
  void joinSegments_shouldRejectMalformedBody() {
    assertThatThrownBy(() -> client.joinSegments("not json"))
        .isInstanceOf(IOException.class);
  }

  @Test
  void resolveDocumentId_shouldUseVideoUrl() {
    assertThat(client.resolveDocumentId("https://youtu.be/abc123")).contains("abc123");
    assertThat(client.resolveDocumentId("https://example.com")).isEmpty();
  }

  @Test
  void fetchDocument_shouldReportUnreachableServiceAsUnavailable() {
    assertThat(client.fetchDocument("abc123")).isEmpty();
  }
}
