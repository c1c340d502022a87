package com.scholary.diarizer.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.diarizer.diarization.DiarizationTurn;
import java.util.List;
import org.junit.jupiter.api.Test;

class AudioSegmenterTest {

  private static final int SAMPLE_RATE = 16000;

  @Test
  void segment_shouldPadEachClipButKeepTurnBounds() {
    AudioSegmenter segmenter = new AudioSegmenter(0.15);
    AudioBuffer audio = new AudioBuffer(new float[10 * SAMPLE_RATE], SAMPLE_RATE);

    List<AudioClip> clips =
        segmenter.segment(audio, List.of(new DiarizationTurn(2.0, 4.0, "Speaker A")));

    AudioClip clip = clips.get(0);
    assertThat(clip.startSample()).isEqualTo(32000 - 2400);
    assertThat(clip.endSample()).isEqualTo(64000 + 2400);
    assertThat(clip.samples().length).isEqualTo(36800);
    assertThat(clip.start()).isEqualTo(2.0);
    assertThat(clip.end()).isEqualTo(4.0);
    assertThat(clip.speaker()).isEqualTo("Speaker A");
  }

  @Test
  void segment_shouldClampPaddingToBufferBounds() {
    AudioSegmenter segmenter = new AudioSegmenter(0.5);
    AudioBuffer audio = new AudioBuffer(new float[3 * SAMPLE_RATE], SAMPLE_RATE);

    List<AudioClip> clips =
        segmenter.segment(
            audio,
            List.of(
                new DiarizationTurn(0.1, 1.0, "Speaker A"),
                new DiarizationTurn(2.0, 3.0, "Speaker B")));

    assertThat(clips.get(0).startSample()).isZero();
    assertThat(clips.get(1).endSample()).isEqualTo(3 * SAMPLE_RATE);
  }

  @Test
  void segment_shouldCopySamplesFromPaddedWindow() {
    float[] samples = new float[4];
    samples[1] = 0.25f;
    samples[2] = 0.5f;
    AudioBuffer audio = new AudioBuffer(samples, 2);

    List<AudioClip> clips =
        new AudioSegmenter(0.0)
            .segment(audio, List.of(new DiarizationTurn(0.5, 1.5, "Speaker A")));

    assertThat(clips.get(0).samples()).containsExactly(0.25f, 0.5f);
  }

  @Test
  void segment_shouldAllowOverlappingPaddedWindows() {
    AudioSegmenter segmenter = new AudioSegmenter(0.5);
    AudioBuffer audio = new AudioBuffer(new float[5 * SAMPLE_RATE], SAMPLE_RATE);

    List<AudioClip> clips =
        segmenter.segment(
            audio,
            List.of(
                new DiarizationTurn(1.0, 2.0, "Speaker A"),
                new DiarizationTurn(2.0, 3.0, "Speaker B")));

    assertThat(clips).hasSize(2);
    assertThat(clips.get(0).endSample()).isGreaterThan(clips.get(1).startSample());
  }

  @Test
  void segment_shouldProduceEmptyClipForTurnPastEndOfAudio() {
    AudioSegmenter segmenter = new AudioSegmenter(0.0);
    AudioBuffer audio = new AudioBuffer(new float[SAMPLE_RATE], SAMPLE_RATE);

    List<AudioClip> clips =
        segmenter.segment(audio, List.of(new DiarizationTurn(5.0, 6.0, "Speaker A")));

    assertThat(clips.get(0).samples().length).isZero();
    assertThat(clips.get(0).endSample()).isGreaterThanOrEqualTo(clips.get(0).startSample());
  }

  @Test
  void segment_shouldReturnNoClipsForNoTurns() {
    AudioBuffer audio = new AudioBuffer(new float[SAMPLE_RATE], SAMPLE_RATE);
    assertThat(new AudioSegmenter(0.15).segment(audio, List.of())).isEmpty();
  }

  @Test
  void constructor_shouldRejectNegativePadding() {
    assertThatThrownBy(() -> new AudioSegmenter(-0.1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }
}
