package com.scholary.refinery.task;

/** Thrown when a run is requested for a cluster that already has one in flight. */
public class SessionBusyException extends RuntimeException {

  public SessionBusyException(String sessionId) {
    super("Cluster " + sessionId + " already has a run in progress");
  }
}
