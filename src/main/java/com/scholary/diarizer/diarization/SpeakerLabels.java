package com.scholary.diarizer.diarization;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Helpers for the speaker labels carried by diarization turns. */
public final class SpeakerLabels {

  private SpeakerLabels() {}

  /**
   * Sort turns by start and rename speakers to "Speaker A", "Speaker B", ... in the order they
   * first speak. Raw model labels such as {@code SPEAKER_01} are discarded.
   */
  public static List<DiarizationTurn> canonicalize(List<DiarizationTurn> turns) {
    List<DiarizationTurn> sorted = new ArrayList<>(turns);
    sorted.sort(Comparator.comparingDouble(DiarizationTurn::start));

    Map<String, String> mapping = new HashMap<>();
    List<DiarizationTurn> relabeled = new ArrayList<>(sorted.size());
    for (DiarizationTurn turn : sorted) {
      String label = mapping.computeIfAbsent(turn.speaker(), k -> label(mapping.size()));
      relabeled.add(new DiarizationTurn(turn.start(), turn.end(), label));
    }
    return relabeled;
  }

  /** Number of distinct speakers among the turns. */
  public static int countSpeakers(List<DiarizationTurn> turns) {
    Set<String> speakers = new HashSet<>();
    for (DiarizationTurn turn : turns) {
      speakers.add(turn.speaker());
    }
    return speakers.size();
  }

  /** Label for the n-th speaker, zero-based: A..Z, then AA, AB, ... */
  public static String label(int index) {
    StringBuilder letters = new StringBuilder();
    int n = index;
    do {
      letters.insert(0, (char) ('A' + n % 26));
      n = n / 26 - 1;
    } while (n >= 0);
    return "Speaker " + letters;
  }
}
