package com.scholary.diarizer.pipeline;

/** Steps of a pipeline run, named as they appear in failure messages. */
public enum PipelineStage {
  PREPROCESS("preprocessing"),
  DIARIZE("diarization"),
  SEGMENT("segmentation"),
  TRANSCRIBE("transcription"),
  MERGE("merge"),
  LLM_ENHANCE("LLM analysis"),
  FORMAT("formatting"),
  FINALIZE("finalization");

  private final String displayName;

  PipelineStage(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
