package com.scholary.diarizer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.diarizer.config.PipelineProperties;
import com.scholary.diarizer.job.JobOptions;
import com.scholary.diarizer.job.JobRecord;
import com.scholary.diarizer.job.JobRecordStore;
import com.scholary.diarizer.job.JobStatus;
import com.scholary.diarizer.job.JobStoreException;
import com.scholary.diarizer.objectstore.ObjectStoreClient;
import com.scholary.diarizer.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.diarizer.objectstore.ObjectStoreProperties;
import com.scholary.diarizer.output.ResponseFormat;
import com.scholary.diarizer.upload.UploadStore;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

@ExtendWith(MockitoExtension.class)
class JobSubmissionServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final JobOptions DEFAULT_OPTIONS =
      new JobOptions(null, ResponseFormat.JSON, false);

  @TempDir Path tempDir;

  @Mock private JobRecordStore store;
  @Mock private JobDispatcher dispatcher;
  @Mock private ObjectStoreClient objectStoreClient;

  private Path uploadDir;
  private JobSubmissionService service;

  @BeforeEach
  void setUp() {
    uploadDir = tempDir.resolve("uploads");
    PipelineProperties pipeline =
        new PipelineProperties(uploadDir.toString(), 16000, 0.15, 2.0, 7200, 1000L, 1, 10);
    ObjectStoreProperties objectStore =
        new ObjectStoreProperties(
            "http://localhost:9002", "key", "secret", "recordings", "us-east-1", true);
    service =
        new JobSubmissionService(
            store,
            new UploadStore(uploadDir),
            dispatcher,
            objectStoreClient,
            Clock.fixed(NOW, ZoneOffset.UTC),
            pipeline,
            objectStore);
  }

  @Test
  void submitUpload_shouldStoreFileCreateRecordAndDispatch() throws IOException {
    when(store.find(anyString())).thenReturn(Optional.empty());
    MockMultipartFile file = audio("standup.mp3", "audio/mpeg", "mp3 bytes");

    JobRecord job = service.submitUpload(file, new JobOptions(4, ResponseFormat.SRT, true));

    assertThat(job.status()).isEqualTo(JobStatus.PENDING);
    assertThat(job.createdAt()).isEqualTo(NOW);
    assertThat(job.expectedSpeakers()).isEqualTo(4);
    assertThat(job.responseFormat()).isEqualTo(ResponseFormat.SRT);
    assertThat(job.enableLlmAnalysis()).isTrue();

    Path stored = Path.of(job.filePath());
    assertThat(stored.getFileName().toString()).isEqualTo(job.jobId() + "_standup.mp3");
    assertThat(Files.readString(stored)).isEqualTo("mp3 bytes");
    verify(store).create(job);
    verify(dispatcher).dispatch(job.jobId(), stored);
  }

  @Test
  void submitUpload_shouldReturnStoredStateAfterDispatch() {
    when(store.find(anyString()))
        .thenAnswer(
            invocation ->
                Optional.of(
                    new JobRecord(
                        invocation.getArgument(0),
                        JobStatus.FAILED,
                        NOW,
                        NOW,
                        null,
                        null,
                        "queue full",
                        null,
                        null,
                        null,
                        ResponseFormat.JSON,
                        false)));

    JobRecord job = service.submitUpload(audio("a.wav", "audio/wav", "x"), DEFAULT_OPTIONS);

    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
  }

  @Test
  void submitUpload_shouldRejectNonAudioContentType() throws IOException {
    MockMultipartFile file = audio("notes.txt", "text/plain", "hello");

    assertThatThrownBy(() -> service.submitUpload(file, DEFAULT_OPTIONS))
        .isInstanceOf(InvalidSubmissionException.class)
        .hasMessage("File must be an audio file");
    assertThat(uploadedFiles()).isZero();
    verifyNoInteractions(store, dispatcher);
  }

  @Test
  void submitUpload_shouldRejectEmptyFile() {
    MockMultipartFile file = audio("empty.mp3", "audio/mpeg", "");

    assertThatThrownBy(() -> service.submitUpload(file, DEFAULT_OPTIONS))
        .isInstanceOf(InvalidSubmissionException.class)
        .hasMessage("File is empty");
  }

  @Test
  void submitUpload_shouldRejectFileOverSizeLimit() throws IOException {
    MockMultipartFile file = audio("big.mp3", "audio/mpeg", "x".repeat(1001));

    assertThatThrownBy(() -> service.submitUpload(file, DEFAULT_OPTIONS))
        .isInstanceOf(SubmissionTooLargeException.class)
        .hasMessageContaining("1001");
    assertThat(uploadedFiles()).isZero();
  }

  @Test
  void submitUpload_shouldRejectSpeakerHintOutOfRange() {
    MockMultipartFile file = audio("a.mp3", "audio/mpeg", "x");

    assertThatThrownBy(
            () -> service.submitUpload(file, new JobOptions(1, ResponseFormat.JSON, false)))
        .isInstanceOf(InvalidSubmissionException.class)
        .hasMessage("expectedSpeakers must be between 2 and 10");
    assertThatThrownBy(
            () -> service.submitUpload(file, new JobOptions(11, ResponseFormat.JSON, false)))
        .isInstanceOf(InvalidSubmissionException.class);
  }

  @Test
  void submitUpload_shouldRemoveUploadWhenRecordCannotBeCreated() throws IOException {
    doThrow(new JobStoreException("store down")).when(store).create(any());

    assertThatThrownBy(
            () -> service.submitUpload(audio("a.mp3", "audio/mpeg", "x"), DEFAULT_OPTIONS))
        .isInstanceOf(JobStoreException.class);
    assertThat(uploadedFiles()).isZero();
    verifyNoInteractions(dispatcher);
  }

  @Test
  void submitFromObjectStore_shouldDownloadFromDefaultBucket() throws IOException {
    when(objectStoreClient.getObjectMetadata("recordings", "calls/standup.mp3"))
        .thenReturn(new ObjectMetadata(9, "audio/mpeg"));
    when(objectStoreClient.getObjectStream("recordings", "calls/standup.mp3"))
        .thenReturn(new ByteArrayInputStream("mp3 bytes".getBytes(StandardCharsets.UTF_8)));
    when(store.find(anyString())).thenReturn(Optional.empty());

    JobRecord job = service.submitFromObjectStore(" ", "calls/standup.mp3", DEFAULT_OPTIONS);

    Path stored = Path.of(job.filePath());
    assertThat(stored.getFileName().toString()).isEqualTo(job.jobId() + "_standup.mp3");
    assertThat(Files.readString(stored)).isEqualTo("mp3 bytes");
    verify(dispatcher).dispatch(eq(job.jobId()), eq(stored));
  }

  @Test
  void submitFromObjectStore_shouldCheckSizeBeforeDownloading() {
    when(objectStoreClient.getObjectMetadata("archive", "long.mp3"))
        .thenReturn(new ObjectMetadata(5000, "audio/mpeg"));

    assertThatThrownBy(() -> service.submitFromObjectStore("archive", "long.mp3", DEFAULT_OPTIONS))
        .isInstanceOf(SubmissionTooLargeException.class);
    verify(objectStoreClient, never()).getObjectStream(anyString(), anyString());
    verifyNoInteractions(store);
  }

  @Test
  void delete_shouldRemoveRecordAndUpload() throws IOException {
    Files.createDirectories(uploadDir);
    Path upload = Files.writeString(uploadDir.resolve("job-1_a.mp3"), "x");
    when(store.find("job-1"))
        .thenReturn(
            Optional.of(JobRecord.pending("job-1", NOW, upload.toString(), DEFAULT_OPTIONS)));

    service.delete("job-1");

    assertThat(upload).doesNotExist();
    verify(store).delete("job-1");
  }

  @Test
  void delete_shouldRejectUnknownJob() {
    when(store.find("nope")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.delete("nope"))
        .isInstanceOf(JobNotFoundException.class)
        .hasMessage("Job not found: nope");
    verify(store, never()).delete(anyString());
  }

  private static MockMultipartFile audio(String name, String contentType, String content) {
    return new MockMultipartFile(
        "file", name, contentType, content.getBytes(StandardCharsets.UTF_8));
  }

  private long uploadedFiles() throws IOException {
    if (!Files.exists(uploadDir)) {
      return 0;
    }
    try (Stream<Path> files = Files.list(uploadDir)) {
      return files.count();
    }
  }
}
