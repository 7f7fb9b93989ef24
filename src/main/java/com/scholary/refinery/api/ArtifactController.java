package com.scholary.refinery.api;

import com.scholary.refinery.artifact.ArtifactType;
import com.scholary.refinery.artifact.ArtifactWriter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Serves the Markdown artifacts written by finished runs. */
@RestController
@RequestMapping("/api/artifacts")
@Tag(name = "Artifacts", description = "Transcripts, summaries and research reports")
public class ArtifactController {

  private static final MediaType MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

  private final ArtifactWriter artifactWriter;

  public ArtifactController(ArtifactWriter artifactWriter) {
    this.artifactWriter = artifactWriter;
  }

  @GetMapping("/videos/{videoId}/transcript")
  @Operation(summary = "Get transcript", description = "Transcript saved by a single-video run")
  public ResponseEntity<String> transcript(@PathVariable String videoId) {
    return markdown(ArtifactType.TRANSCRIPT, videoId);
  }

  @GetMapping("/videos/{videoId}/summary")
  @Operation(summary = "Get summary", description = "Summary saved by a single-video run")
  public ResponseEntity<String> summary(@PathVariable String videoId) {
    return markdown(ArtifactType.SUMMARY, videoId);
  }

  @GetMapping("/clusters/{sessionId}/report")
  @Operation(summary = "Get report", description = "Research report of a completed cluster")
  public ResponseEntity<String> report(@PathVariable String sessionId) {
    return markdown(ArtifactType.REPORT, sessionId);
  }

  private ResponseEntity<String> markdown(ArtifactType type, String id) {
    return artifactWriter
        .read(type, id)
        .map(body -> ResponseEntity.ok().contentType(MARKDOWN).body(body))
        .orElse(ResponseEntity.notFound().build());
  }
}
