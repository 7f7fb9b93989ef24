package com.scholary.refinery.api;

import jakarta.validation.constraints.NotBlank;

/** Request for transcribing and summarizing one video. */
public record SingleVideoRequest(@NotBlank String url, Boolean cleanTranscript) {

  public SingleVideoRequest {
    if (cleanTranscript == null) {
      cleanTranscript = false;
    }
  }
}
