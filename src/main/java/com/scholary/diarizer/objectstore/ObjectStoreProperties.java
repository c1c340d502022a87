package com.scholary.diarizer.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the bucket recordings are imported from ("objectstore.*").
 *
 * @param bucket used when a submission names only a key
 * @param region signing region; MinIO ignores it, so it defaults to us-east-1
 * @param pathStyleAccess required by MinIO
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {

  static final String DEFAULT_REGION = "us-east-1";

  public ObjectStoreProperties {
    region = region == null || region.isBlank() ? DEFAULT_REGION : region;
  }

  /** The requested bucket, or the configured one when none was given. */
  public String bucketOrDefault(String requested) {
    return requested == null || requested.isBlank() ? bucket : requested;
  }
}
