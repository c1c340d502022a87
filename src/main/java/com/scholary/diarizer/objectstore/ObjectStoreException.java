package com.scholary.diarizer.objectstore;

/**
 * A recording could not be read from the object store.
 *
 * <p>Thrown before a job record exists, so it surfaces directly as the submission's error
 * response: 404 when the object is missing, 503 otherwise.
 */
public class ObjectStoreException extends RuntimeException {

  private final boolean notFound;

  public ObjectStoreException(String message, Throwable cause) {
    this(message, cause, false);
  }

  private ObjectStoreException(String message, Throwable cause, boolean notFound) {
    super(message, cause);
    this.notFound = notFound;
  }

  public static ObjectStoreException notFound(String bucket, String key, Throwable cause) {
    return new ObjectStoreException(
        String.format("Object not found: bucket=%s, key=%s", bucket, key), cause, true);
  }

  public boolean isNotFound() {
    return notFound;
  }
}
