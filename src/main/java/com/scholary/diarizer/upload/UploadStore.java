package com.scholary.diarizer.upload;

import com.scholary.diarizer.config.PipelineProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Local directory holding recordings between submission and the end of their job.
 *
 * <p>Files are named {@code <jobId>_<original name>}. Only the last path element of the client's
 * file name is kept, so a name cannot point outside the directory.
 */
@Component
public class UploadStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadStore.class);

  static final int MAX_FILENAME_LENGTH = 100;

  private final Path directory;

  @Autowired
  public UploadStore(PipelineProperties properties) {
    this(Path.of(properties.uploadDir()));
  }

  public UploadStore(Path directory) {
    this.directory = directory.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.directory);
    } catch (IOException e) {
      throw new UploadException("Cannot create upload directory " + this.directory, e);
    }
    LOGGER.info("Upload directory: {}", this.directory);
  }

  /**
   * Copy a recording into the upload directory.
   *
   * @param jobId the job that will own the file
   * @param originalFilename the client's file name, may be null
   * @param content the recording bytes; not closed by this method
   * @return the stored file
   * @throws UploadException if the file cannot be written
   */
  public Path store(String jobId, String originalFilename, InputStream content) {
    Path target = pathFor(jobId, originalFilename);
    try {
      long bytes = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.info("Stored upload: jobId={}, file={}, bytes={}", jobId, target.getFileName(), bytes);
      return target;
    } catch (IOException e) {
      deleteQuietly(target);
      throw new UploadException("Failed to save file: " + e.getMessage(), e);
    }
  }

  /** Location for a job's upload. */
  public Path pathFor(String jobId, String originalFilename) {
    return directory.resolve(jobId + "_" + sanitize(originalFilename));
  }

  /**
   * Delete a file if it exists. Failures are logged, never thrown.
   *
   * @return true if the file is gone afterwards
   */
  public boolean deleteQuietly(Path file) {
    if (file == null) {
      return true;
    }
    try {
      if (Files.deleteIfExists(file)) {
        LOGGER.debug("Deleted {}", file);
      }
      return true;
    } catch (IOException e) {
      LOGGER.warn("Could not delete {}: {}", file, e.getMessage());
      return false;
    }
  }

  static String sanitize(String originalFilename) {
    if (originalFilename == null) {
      return "unknown";
    }
    String name = originalFilename;
    int separator = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (separator >= 0) {
      name = name.substring(separator + 1);
    }
    name = name.replaceAll("[\\p{Cntrl}:*?\"<>|]", "_").strip();
    if (name.isEmpty() || name.equals(".") || name.equals("..")) {
      return "unknown";
    }
    return name.length() > MAX_FILENAME_LENGTH ? name.substring(0, MAX_FILENAME_LENGTH) : name;
  }
}
