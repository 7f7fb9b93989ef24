package com.scholary.refinery.store;

/**
 * Thrown when cluster state cannot be written to or read from the backing store.
 *
 * <p>A pipeline step whose state could not be recorded must not be continued, so this propagates
 * to the run instead of being logged and dropped.
 */
public class ClusterStoreException extends RuntimeException {

  public ClusterStoreException(String message) {
    super(message);
  }

  public ClusterStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
