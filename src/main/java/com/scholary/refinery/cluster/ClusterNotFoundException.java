package com.scholary.refinery.cluster;

/** Thrown when a session id does not name a live cluster. */
public class ClusterNotFoundException extends IllegalArgumentException {

  public ClusterNotFoundException(String sessionId) {
    super("Cluster not found: " + sessionId);
  }
}
