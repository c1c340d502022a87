package com.scholary.diarizer.diarization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the diarization service.
 *
 * <pre>
 * {"segments": [{"start": 0.0, "end": 4.2, "speaker": "SPEAKER_00"}]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record DiarizationResponse(List<Segment> segments) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Segment(Double start, Double end, String speaker) {}
}
