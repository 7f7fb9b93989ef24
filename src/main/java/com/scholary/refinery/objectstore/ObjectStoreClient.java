package com.scholary.refinery.objectstore;

import java.io.InputStream;

/**
 * Abstraction for the object storage that holds generated artifacts.
 *
 * <p>Keeps S3 specifics out of the artifact code and lets tests mock storage.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream, replacing any previous version.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Check whether an object exists.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return true if the object exists
   * @throws ObjectStoreException if the check itself fails
   */
  boolean objectExists(String bucket, String key);

  /**
   * Create the bucket if it does not exist yet.
   *
   * @param bucket the bucket name
   * @throws ObjectStoreException if the bucket cannot be checked or created
   */
  void ensureBucket(String bucket);
}
