package com.scholary.refinery.source;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class VideoIdExtractorTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "https://www.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://youtube.com/watch?v=dQw4w9WgXcQ&t=42s",
        "https://youtu.be/dQw4w9WgXcQ",
        "https://youtu.be/dQw4w9WgXcQ?si=abc",
        "https://www.youtube.com/embed/dQw4w9WgXcQ",
        "https://www.youtube.com/shorts/dQw4w9WgXcQ",
        "https://www.youtube.com/watch?feature=share&v=dQw4w9WgXcQ",
        "  https://youtu.be/dQw4w9WgXcQ  "
      })
  void extract_shouldFindIdInKnownUrlForms(String url) {
    assertThat(VideoIdExtractor.extract(url)).contains("dQw4w9WgXcQ");
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"https://vimeo.com/12345", "not a url", "https://www.youtube.com/"})
  void extract_shouldRejectOtherInput(String url) {
    assertThat(VideoIdExtractor.extract(url)).isEmpty();
  }
}
