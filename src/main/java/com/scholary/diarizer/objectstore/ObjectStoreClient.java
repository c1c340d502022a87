package com.scholary.diarizer.objectstore;

import java.io.InputStream;

/**
 * Abstraction for object storage reads.
 *
 * <p>Recordings can be submitted by reference to a bucket and key instead of a multipart upload.
 * The submission path uses this client to check the object's size and copy it into the upload
 * directory, after which the job owns a local file like any other upload.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream.
   *
   * <p>The caller is responsible for closing the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Get object metadata without downloading the content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return object metadata
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
