package com.scholary.diarizer.upload;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UploadStoreTest {

  @TempDir Path tempDir;

  private UploadStore uploads;

  @BeforeEach
  void setUp() {
    uploads = new UploadStore(tempDir.resolve("uploads"));
  }

  @Test
  void store_shouldWriteFilePrefixedWithJobId() throws IOException {
    Path stored =
        uploads.store(
            "job-1",
            "meeting.mp3",
            new ByteArrayInputStream("audio".getBytes(StandardCharsets.UTF_8)));

    assertThat(stored.getFileName().toString()).isEqualTo("job-1_meeting.mp3");
    assertThat(stored.getParent()).isEqualTo(tempDir.resolve("uploads").toAbsolutePath());
    assertThat(Files.readString(stored)).isEqualTo("audio");
  }

  @Test
  void pathFor_shouldKeepFileInsideUploadDirectory() {
    Path path = uploads.pathFor("job-1", "../../etc/passwd");

    assertThat(path.getFileName().toString()).isEqualTo("job-1_passwd");
    assertThat(path.startsWith(tempDir.resolve("uploads").toAbsolutePath())).isTrue();
  }

  @Test
  void sanitize_shouldHandleUnusableNames() {
    assertThat(UploadStore.sanitize(null)).isEqualTo("unknown");
    assertThat(UploadStore.sanitize("  ")).isEqualTo("unknown");
    assertThat(UploadStore.sanitize("dir/..")).isEqualTo("unknown");
    assertThat(UploadStore.sanitize("C:\\calls\\a?b.wav")).isEqualTo("a_b.wav");
  }

  @Test
  void sanitize_shouldTruncateLongNames() {
    String name = "x".repeat(150) + ".mp3";

    assertThat(UploadStore.sanitize(name)).hasSize(UploadStore.MAX_FILENAME_LENGTH);
  }

  @Test
  void deleteQuietly_shouldRemoveFileAndTolerateMissing() throws IOException {
    Path file = Files.writeString(tempDir.resolve("gone.wav"), "x");

    assertThat(uploads.deleteQuietly(file)).isTrue();
    assertThat(file).doesNotExist();
    assertThat(uploads.deleteQuietly(file)).isTrue();
    assertThat(uploads.deleteQuietly(null)).isTrue();
  }

  @Test
  void deleteQuietly_shouldReportFailureForNonEmptyDirectory() throws IOException {
    Path directory = Files.createDirectory(tempDir.resolve("busy"));
    Files.writeString(directory.resolve("inner.txt"), "x");

    assertThat(uploads.deleteQuietly(directory)).isFalse();
  }
}
