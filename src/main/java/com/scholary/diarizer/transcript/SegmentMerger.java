package com.scholary.diarizer.transcript;

import com.scholary.diarizer.config.PipelineProperties;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Collapses consecutive clip segments from the same speaker into utterances.
 *
 * <p>Single left-to-right pass. A segment joins the current utterance when it has the same speaker
 * and starts no more than {@code maxGapSeconds} after the utterance ends; otherwise the utterance
 * is emitted and the segment starts a new one.
 *
 * <p>When both sides carry a confidence, the merged confidence is the mean of the two. This is a
 * pairwise running mean, so earlier clips weigh less than later ones in a long utterance.
 * Otherwise the utterance keeps the confidence it already had, which may be null.
 */
@Component
public class SegmentMerger {

  public static final double DEFAULT_MAX_GAP_SECONDS = 2.0;

  private final double maxGapSeconds;

  @Autowired
  public SegmentMerger(PipelineProperties properties) {
    this(properties.mergeGapSeconds());
  }

  public SegmentMerger(double maxGapSeconds) {
    this.maxGapSeconds = maxGapSeconds;
  }

  /**
   * Merge segments given in clip order.
   *
   * @param segments one segment per clip, in timeline order
   * @return utterances in the same order; empty when the input is empty
   */
  public List<TranscribedSegment> merge(List<TranscribedSegment> segments) {
    List<TranscribedSegment> merged = new ArrayList<>();
    if (segments.isEmpty()) {
      return merged;
    }

    TranscribedSegment current = segments.get(0);
    for (TranscribedSegment segment : segments.subList(1, segments.size())) {
      if (segment.speaker().equals(current.speaker())
          && segment.start() - current.end() <= maxGapSeconds) {
        current = join(current, segment);
      } else {
        merged.add(current);
        current = segment;
      }
    }
    merged.add(current);
    return merged;
  }

  private static TranscribedSegment join(TranscribedSegment current, TranscribedSegment next) {
    List<WordTimestamp> words = new ArrayList<>(current.words().size() + next.words().size());
    words.addAll(current.words());
    words.addAll(next.words());

    Double confidence = current.confidence();
    if (current.confidence() != null && next.confidence() != null) {
      confidence = (current.confidence() + next.confidence()) / 2;
    }

    return new TranscribedSegment(
        current.speaker(),
        current.start(),
        next.end(),
        current.text() + " " + next.text(),
        confidence,
        words);
  }
}
