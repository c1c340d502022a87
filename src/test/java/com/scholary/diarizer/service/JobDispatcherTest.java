package com.scholary.diarizer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.scholary.diarizer.job.JobRecordStore;
import com.scholary.diarizer.job.JobStatus;
import com.scholary.diarizer.pipeline.JobPipeline;
import com.scholary.diarizer.upload.UploadStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobDispatcherTest {

  private static final Path UPLOAD = Path.of("/uploads/job-1_talk.mp3");
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

  @Mock private JobPipeline pipeline;
  @Mock private JobRecordStore store;
  @Mock private UploadStore uploads;
  @Mock private Executor rejectingExecutor;

  @Test
  void dispatch_shouldRunJobOnExecutor() {
    Executor direct = Runnable::run;
    JobDispatcher dispatcher = new JobDispatcher(direct, pipeline, store, uploads, CLOCK);

    assertThat(dispatcher.dispatch("job-1", UPLOAD)).isTrue();

    verify(pipeline).run("job-1");
    verify(uploads, never()).deleteQuietly(any());
  }

  @Test
  void dispatch_shouldFailJobWhenQueueIsFull() {
    doThrow(new RejectedExecutionException("queue full")).when(rejectingExecutor).execute(any());
    JobDispatcher dispatcher =
        new JobDispatcher(rejectingExecutor, pipeline, store, uploads, CLOCK);

    assertThat(dispatcher.dispatch("job-1", UPLOAD)).isFalse();

    verify(store)
        .update(
            eq("job-1"),
            argThat(
                update ->
                    update.status() == JobStatus.FAILED
                        && update.error().contains("worker queue is full")));
    verify(uploads).deleteQuietly(UPLOAD);
    verify(pipeline, never()).run(any());
  }
}
