package com.scholary.refinery.stage;

/**
 * Outcome of one stage: either the produced text or the reason it failed.
 *
 * <p>Stages never throw; every failure of the backend is reported as {@link Failed}.
 */
public sealed interface StageResult permits StageResult.Ok, StageResult.Failed {

  /** Reason reported when the estimated cost of a call is over the configured ceiling. */
  String BUDGET_EXCEEDED = "budget_exceeded";

  static StageResult ok(String content, String model) {
    return new Ok(content, model);
  }

  static StageResult failed(String reason) {
    return new Failed(reason);
  }

  boolean isOk();

  /** Successful stage output. */
  record Ok(String content, String model) implements StageResult {
    @Override
    public boolean isOk() {
      return true;
    }
  }

  /** Failed stage. */
  record Failed(String reason) implements StageResult {
    @Override
    public boolean isOk() {
      return false;
    }

    public boolean isBudgetExceeded() {
      return BUDGET_EXCEEDED.equals(reason);
    }
  }
}
