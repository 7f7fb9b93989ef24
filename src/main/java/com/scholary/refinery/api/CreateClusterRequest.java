package com.scholary.refinery.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Request for creating a research cluster.
 *
 * <p>Videos are processed in the order given. Cleaning is optional and off by default.
 */
public record CreateClusterRequest(
    @NotBlank @Size(max = 100) String name,
    @NotEmpty List<@NotBlank String> urls,
    Boolean cleanTranscripts) {

  public CreateClusterRequest {
    if (cleanTranscripts == null) {
      cleanTranscripts = false;
    }
  }
}
