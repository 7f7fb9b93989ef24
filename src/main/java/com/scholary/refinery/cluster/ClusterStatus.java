package com.scholary.refinery.cluster;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a research cluster.
 *
 * <p>Statuses only move forward in declaration order ({@link #CLEANED_READY} may be skipped), or
 * sideways to {@link #FAILED} from any non-terminal status.
 */
public enum ClusterStatus {
  PENDING,
  PROCESSING,
  TRANSCRIPTS_READY,
  CLEANED_READY,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Whether a cluster in this status may move to {@code next}.
   *
   * @param next the requested status
   * @return true if the move is the next pipeline step or into FAILED
   */
  public boolean canTransitionTo(ClusterStatus next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    if (this == TRANSCRIPTS_READY && next == COMPLETED) {
      // cleaning not requested
      return true;
    }
    return next.ordinal() == ordinal() + 1;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ClusterStatus fromWireName(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
