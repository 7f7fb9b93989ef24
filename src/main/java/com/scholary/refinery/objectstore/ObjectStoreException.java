package com.scholary.refinery.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: a missing bucket or bad credentials cannot be fixed by the caller, and artifact
 * writers decide for themselves whether a failed write matters.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
