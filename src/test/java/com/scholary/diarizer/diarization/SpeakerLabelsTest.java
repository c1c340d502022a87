package com.scholary.diarizer.diarization;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SpeakerLabelsTest {

  @Test
  void canonicalize_shouldSortAndRelabelInOrderOfFirstAppearance() {
    List<DiarizationTurn> turns =
        SpeakerLabels.canonicalize(
            List.of(
                new DiarizationTurn(5.0, 7.0, "SPEAKER_00"),
                new DiarizationTurn(0.0, 2.0, "SPEAKER_01"),
                new DiarizationTurn(2.5, 4.0, "SPEAKER_00"),
                new DiarizationTurn(8.0, 9.0, "SPEAKER_02")));

    assertThat(turns).extracting(DiarizationTurn::start).containsExactly(0.0, 2.5, 5.0, 8.0);
    assertThat(turns)
        .extracting(DiarizationTurn::speaker)
        .containsExactly("Speaker A", "Speaker B", "Speaker B", "Speaker C");
  }

  @Test
  void canonicalize_shouldReturnEmptyForNoTurns() {
    assertThat(SpeakerLabels.canonicalize(List.of())).isEmpty();
  }

  @Test
  void countSpeakers_shouldCountDistinctLabels() {
    List<DiarizationTurn> turns =
        List.of(
            new DiarizationTurn(0.0, 1.0, "Speaker A"),
            new DiarizationTurn(1.0, 2.0, "Speaker B"),
            new DiarizationTurn(2.0, 3.0, "Speaker A"));

    assertThat(SpeakerLabels.countSpeakers(turns)).isEqualTo(2);
  }

  @Test
  void label_shouldContinuePastZ() {
    assertThat(SpeakerLabels.label(0)).isEqualTo("Speaker A");
    assertThat(SpeakerLabels.label(25)).isEqualTo("Speaker Z");
    assertThat(SpeakerLabels.label(26)).isEqualTo("Speaker AA");
    assertThat(SpeakerLabels.label(27)).isEqualTo("Speaker AB");
  }
}
