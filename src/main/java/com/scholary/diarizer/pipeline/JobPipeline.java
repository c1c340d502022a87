package com.scholary.diarizer.pipeline;

import com.scholary.diarizer.audio.AudioBuffer;
import com.scholary.diarizer.audio.AudioClip;
import com.scholary.diarizer.audio.AudioPreprocessor;
import com.scholary.diarizer.audio.AudioSegmenter;
import com.scholary.diarizer.audio.PreprocessedAudio;
import com.scholary.diarizer.audio.WavAudioReader;
import com.scholary.diarizer.diarization.DiarizationException;
import com.scholary.diarizer.diarization.DiarizationTurn;
import com.scholary.diarizer.diarization.SpeakerDiarizer;
import com.scholary.diarizer.diarization.SpeakerLabels;
import com.scholary.diarizer.job.JobRecord;
import com.scholary.diarizer.job.JobRecordStore;
import com.scholary.diarizer.job.JobStatus;
import com.scholary.diarizer.job.JobUpdate;
import com.scholary.diarizer.llm.LlmEnhancements;
import com.scholary.diarizer.llm.TranscriptEnhancer;
import com.scholary.diarizer.logging.StructuredLogger;
import com.scholary.diarizer.output.TranscriptFormatter;
import com.scholary.diarizer.transcript.ClipTranscriber;
import com.scholary.diarizer.transcript.SegmentMerger;
import com.scholary.diarizer.transcript.TranscribedSegment;
import com.scholary.diarizer.upload.UploadStore;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one job from upload to formatted transcript.
 *
 * <p>Stages run in a fixed order on the calling worker thread:
 *
 * <ol>
 *   <li>Preprocess: normalize the upload and check its duration
 *   <li>Diarize: find speaker turns; no turns fails the job
 *   <li>Segment and transcribe: one padded clip per turn, transcribed in turn order
 *   <li>Merge: join consecutive clips from the same speaker
 *   <li>LLM analysis, only when the job asked for it; never fails the job
 *   <li>Format: render the transcript in the job's response format
 * </ol>
 *
 * <p>Any exception that escapes a stage marks the job failed with the stage name and cause. The
 * upload and the normalized intermediate file are deleted after the final status is written,
 * whether the job succeeded or not.
 */
@Service
public class JobPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobPipeline.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final int PERCENT_STARTED = 5;
  private static final int PERCENT_PREPROCESSING = 10;
  private static final int PERCENT_PREPROCESSED = 15;
  private static final int PERCENT_DIARIZING = 25;
  private static final int PERCENT_DIARIZED = 40;
  private static final int PERCENT_TRANSCRIBING = 45;
  private static final int PERCENT_TRANSCRIBED = 70;
  private static final int PERCENT_LLM_CHECK = 75;
  private static final int PERCENT_LLM_RUNNING = 80;
  private static final int PERCENT_LLM_DONE = 90;
  private static final int PERCENT_FORMATTING = 95;

  private final JobRecordStore store;
  private final AudioPreprocessor preprocessor;
  private final WavAudioReader audioReader;
  private final SpeakerDiarizer diarizer;
  private final AudioSegmenter segmenter;
  private final ClipTranscriber transcriber;
  private final SegmentMerger merger;
  private final TranscriptEnhancer enhancer;
  private final TranscriptFormatter formatter;
  private final UploadStore uploads;
  private final Clock clock;

  public JobPipeline(
      JobRecordStore store,
      AudioPreprocessor preprocessor,
      WavAudioReader audioReader,
      SpeakerDiarizer diarizer,
      AudioSegmenter segmenter,
      ClipTranscriber transcriber,
      SegmentMerger merger,
      TranscriptEnhancer enhancer,
      TranscriptFormatter formatter,
      UploadStore uploads,
      Clock clock) {
    this.store = store;
    this.preprocessor = preprocessor;
    this.audioReader = audioReader;
    this.diarizer = diarizer;
    this.segmenter = segmenter;
    this.transcriber = transcriber;
    this.merger = merger;
    this.enhancer = enhancer;
    this.formatter = formatter;
    this.uploads = uploads;
    this.clock = clock;
  }

  /**
   * Run a queued job to completion or failure.
   *
   * <p>Never throws: every outcome is recorded in the job store.
   *
   * @param jobId the job to run
   */
  public void run(String jobId) {
    Optional<JobRecord> found = store.find(jobId);
    if (found.isEmpty()) {
      LOGGER.warn("Job {} no longer exists, skipping", jobId);
      return;
    }

    JobRecord job = found.get();
    if (job.status().isTerminal()) {
      LOGGER.warn("Job {} is already {}, skipping", jobId, job.status().value());
      return;
    }
    Path original = Path.of(job.filePath());
    Path processed = preprocessor.outputPathFor(original);
    StructuredLogger.setJobContext(jobId, original.getFileName().toString());

    ProgressTracker progress = new ProgressTracker(jobId, store);
    PipelineStage stage = PipelineStage.PREPROCESS;
    long startTime = System.currentTimeMillis();

    try {
      LOGGER.info(
          "Starting job: format={}, expectedSpeakers={}, llm={}",
          job.responseFormat().value(),
          job.expectedSpeakers(),
          job.enableLlmAnalysis());
      progress.update(JobStatus.PROCESSING, "Job started", PERCENT_STARTED);

      long stageStartedAt = startStage(stage);
      progress.update(JobStatus.PREPROCESSING, "Preprocessing audio", PERCENT_PREPROCESSING);
      PreprocessedAudio preprocessed = preprocessor.preprocess(original);
      AudioBuffer audio = audioReader.read(preprocessed.path());
      progress.update(
          JobStatus.PREPROCESSING,
          String.format("Audio preprocessed (%.1fs)", preprocessed.durationSeconds()),
          PERCENT_PREPROCESSED);
      finishStage(stage, stageStartedAt);

      stage = PipelineStage.DIARIZE;
      stageStartedAt = startStage(stage);
      progress.update(JobStatus.DIARIZING, "Running speaker diarization", PERCENT_DIARIZING);
      List<DiarizationTurn> turns =
          SpeakerLabels.canonicalize(
              diarizer.diarize(preprocessed.path(), job.expectedSpeakers()));
      if (turns.isEmpty()) {
        throw new DiarizationException("No speakers detected in audio");
      }
      int speakersDetected = SpeakerLabels.countSpeakers(turns);
      progress.update(
          JobStatus.DIARIZING,
          String.format("Detected %d speakers in %d turns", speakersDetected, turns.size()),
          PERCENT_DIARIZED);
      finishStage(stage, stageStartedAt);

      stage = PipelineStage.SEGMENT;
      List<AudioClip> clips = segmenter.segment(audio, turns);

      stage = PipelineStage.TRANSCRIBE;
      stageStartedAt = startStage(stage);
      progress.update(
          JobStatus.TRANSCRIBING,
          String.format("Transcribing %d segments", clips.size()),
          PERCENT_TRANSCRIBING);
      List<TranscribedSegment> segments =
          transcriber.transcribe(
              clips,
              audio.sampleRate(),
              (completed, total) ->
                  progress.update(
                      JobStatus.TRANSCRIBING,
                      String.format("Transcribed %d of %d segments", completed, total),
                      transcriptionPercent(completed, total)));
      finishStage(stage, stageStartedAt);

      stage = PipelineStage.MERGE;
      List<TranscribedSegment> utterances = merger.merge(segments);
      structuredLogger.logMerge(segments.size(), utterances.size());
      progress.update(
          JobStatus.TRANSCRIBING,
          String.format("Merged into %d utterances", utterances.size()),
          PERCENT_TRANSCRIBED);

      LlmEnhancements enhancements = null;
      if (job.enableLlmAnalysis()) {
        stage = PipelineStage.LLM_ENHANCE;
        stageStartedAt = startStage(stage);
        enhancements = enhance(utterances, progress);
        finishStage(stage, stageStartedAt);
      }

      stage = PipelineStage.FORMAT;
      stageStartedAt = startStage(stage);
      progress.update(JobStatus.FORMATTING, "Formatting response", PERCENT_FORMATTING);
      String result =
          formatter.format(
              job.responseFormat(),
              utterances,
              preprocessed.durationSeconds(),
              speakersDetected,
              enhancements);
      finishStage(stage, stageStartedAt);

      stage = PipelineStage.FINALIZE;
      store.update(jobId, JobUpdate.completed(result, clock.instant()));
      LOGGER.info(
          "Job completed: utterances={}, speakers={}, elapsed={}ms",
          utterances.size(),
          speakersDetected,
          System.currentTimeMillis() - startTime);

    } catch (Exception e) {
      fail(jobId, stage, e);
    } finally {
      uploads.deleteQuietly(original);
      uploads.deleteQuietly(processed);
      StructuredLogger.clearJobContext();
    }
  }

  private long startStage(PipelineStage stage) {
    structuredLogger.logStageStarted(stage.displayName());
    return System.currentTimeMillis();
  }

  private void finishStage(PipelineStage stage, long startedAt) {
    structuredLogger.logStageFinished(stage.displayName(), System.currentTimeMillis() - startedAt);
  }

  /** Run LLM analysis; any problem is reported as progress text and yields null. */
  private LlmEnhancements enhance(List<TranscribedSegment> utterances, ProgressTracker progress) {
    progress.update(JobStatus.LLM_ANALYSIS, "Checking LLM availability", PERCENT_LLM_CHECK);
    try {
      if (!enhancer.isAvailable()) {
        structuredLogger.logLlmOutcome("unavailable");
        progress.update(JobStatus.LLM_ANALYSIS, "LLM analysis unavailable", PERCENT_LLM_DONE);
        return null;
      }

      progress.update(JobStatus.LLM_ANALYSIS, "Generating LLM analysis", PERCENT_LLM_RUNNING);
      Optional<LlmEnhancements> enhancements = enhancer.enhance(utterances);
      if (enhancements.isPresent()) {
        structuredLogger.logLlmOutcome("completed");
        progress.update(JobStatus.LLM_ANALYSIS, "LLM analysis completed", PERCENT_LLM_DONE);
        return enhancements.get();
      }

      structuredLogger.logLlmOutcome("empty");
      progress.update(
          JobStatus.LLM_ANALYSIS, "LLM analysis returned no results", PERCENT_LLM_DONE);
      return null;

    } catch (RuntimeException e) {
      LOGGER.warn("LLM analysis failed, continuing without it: {}", e.getMessage(), e);
      structuredLogger.logLlmOutcome("failed");
      progress.update(
          JobStatus.LLM_ANALYSIS, "LLM analysis failed: " + describe(e), PERCENT_LLM_DONE);
      return null;
    }
  }

  private void fail(String jobId, PipelineStage stage, Exception cause) {
    structuredLogger.logStageFailed(stage.displayName(), cause);
    String error =
        String.format("Job %s failed during %s: %s", jobId, stage.displayName(), describe(cause));
    try {
      store.update(jobId, JobUpdate.failed(error, clock.instant()));
    } catch (RuntimeException e) {
      LOGGER.error("Could not record failure of job {}: {}", jobId, e.getMessage());
    }
  }

  static int transcriptionPercent(int completed, int total) {
    if (total <= 0) {
      return PERCENT_TRANSCRIBING;
    }
    int span = PERCENT_TRANSCRIBED - PERCENT_TRANSCRIBING - 1;
    return PERCENT_TRANSCRIBING + (int) ((long) span * completed / total);
  }

  private static String describe(Throwable e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
