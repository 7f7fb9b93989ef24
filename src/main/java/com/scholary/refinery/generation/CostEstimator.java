package com.scholary.refinery.generation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Rough prompt-cost estimation used for the per-call budget check.
 *
 * <p>Tokens are approximated as one per four characters, which is close enough for a ceiling check
 * across providers without pulling in a tokenizer.
 */
@Component
public class CostEstimator {

  private static final int CHARS_PER_TOKEN = 4;

  private final GenerationProperties properties;

  public CostEstimator(GenerationProperties properties) {
    this.properties = properties;
  }

  public int estimateTokens(String text) {
    return text.length() / CHARS_PER_TOKEN;
  }

  public CostEstimate estimate(String text) {
    int tokens = estimateTokens(text);
    double cost =
        BigDecimal.valueOf(tokens)
            .multiply(BigDecimal.valueOf(properties.costPer1kTokens()))
            .divide(BigDecimal.valueOf(1000), 4, RoundingMode.HALF_UP)
            .doubleValue();
    return new CostEstimate(
        cost,
        tokens,
        properties.model(),
        properties.costPer1kTokens(),
        cost <= properties.maxCostLimit());
  }
}
