package com.scholary.diarizer.objectstore;

import java.io.InputStream;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>Works against real S3 and S3-compatible services; MinIO needs the endpoint override and
 * path-style access. The SDK retries transient failures itself, so missing objects and
 * permission errors are the only ones surfaced here.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, region={}, defaultBucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.region(),
        properties.bucket(),
        properties.pathStyleAccess());

    StaticCredentialsProvider credentialsProvider =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()));

    this.s3Client =
        S3Client.builder()
            .region(Region.of(properties.region()))
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess())
            .build();
  }

  S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  @Override
  public InputStream getObjectStream(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      InputStream stream = s3Client.getObject(request);
      LOGGER.info("Retrieved object: bucket={}, key={}", bucket, key);
      return stream;

    } catch (NoSuchKeyException e) {
      throw notFound(bucket, key, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error retrieving object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String bucket, String key) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", bucket, key);

    try {
      HeadObjectResponse response =
          s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());

      LOGGER.info(
          "Retrieved metadata: bucket={}, key={}, size={} bytes, contentType={}",
          bucket,
          key,
          response.contentLength(),
          response.contentType());

      return new ObjectMetadata(response.contentLength(), response.contentType());

    } catch (NoSuchKeyException e) {
      throw notFound(bucket, key, e);

    } catch (S3Exception e) {
      // HEAD responses carry no error body, so a missing key shows up as a bare 404
      if (e.statusCode() == 404) {
        throw notFound(bucket, key, e);
      }
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error getting metadata: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  private static ObjectStoreException notFound(String bucket, String key, Exception cause) {
    ObjectStoreException exception = ObjectStoreException.notFound(bucket, key, cause);
    LOGGER.error(exception.getMessage());
    return exception;
  }

  /** Release connections and threads held by the SDK client. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
