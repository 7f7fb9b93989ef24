package com.scholary.refinery.stage;

import com.scholary.refinery.generation.CostEstimate;
import com.scholary.refinery.generation.CostEstimator;
import com.scholary.refinery.generation.GenerationResponse;
import com.scholary.refinery.generation.TextGenerationClient;
import com.scholary.refinery.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one stage against the text-generation backend.
 *
 * <p>The budget check happens before the call: a prompt whose estimated cost is over the ceiling is
 * rejected as {@link StageResult#BUDGET_EXCEEDED} without contacting the backend. Nothing thrown by
 * the backend escapes; it comes back as {@link StageResult.Failed}. There are no retries here.
 */
@Service
public class StageExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(StageExecutor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TextGenerationClient generationClient;
  private final CostEstimator costEstimator;
  private final PromptTemplates promptTemplates;

  public StageExecutor(
      TextGenerationClient generationClient,
      CostEstimator costEstimator,
      PromptTemplates promptTemplates) {
    this.generationClient = generationClient;
    this.costEstimator = costEstimator;
    this.promptTemplates = promptTemplates;
  }

  /**
   * Run a stage.
   *
   * @param kind the stage to run
   * @param input the documents to run it on
   * @return the produced text, or the reason the stage failed
   */
  public StageResult runStage(StageKind kind, StageInput input) {
    String documentId = input.documents().size() == 1 ? input.first().documentId() : null;

    if (input.documents().isEmpty()) {
      structuredLogger.logStageFailed(kind.name(), null, "no input documents");
      return StageResult.failed("no input documents");
    }

    String prompt;
    try {
      prompt = promptTemplates.render(kind, input);
    } catch (RuntimeException e) {
      structuredLogger.logStageFailed(kind.name(), documentId, "malformed input: " + e.getMessage());
      return StageResult.failed("malformed input: " + e.getMessage());
    }

    CostEstimate estimate = costEstimator.estimate(prompt);
    if (!estimate.withinLimit()) {
      LOGGER.warn(
          "Rejecting {} call: estimated cost {} for {} tokens",
          kind,
          estimate.estimatedCost(),
          estimate.tokenCount());
      structuredLogger.logStageFailed(kind.name(), documentId, StageResult.BUDGET_EXCEEDED);
      return StageResult.failed(StageResult.BUDGET_EXCEEDED);
    }

    long startTime = System.currentTimeMillis();
    try {
      GenerationResponse response = generationClient.complete(prompt, kind.maxTokens(input));
      structuredLogger.logStageCompleted(
          kind.name(), documentId, System.currentTimeMillis() - startTime);
      return StageResult.ok(response.text(), response.model());
    } catch (RuntimeException e) {
      String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      structuredLogger.logStageFailed(kind.name(), documentId, reason);
      return StageResult.failed(reason);
    }
  }
}
