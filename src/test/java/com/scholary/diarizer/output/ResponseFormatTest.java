package com.scholary.diarizer.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ResponseFormatTest {

  @Test
  void fromValue_shouldIgnoreCase() {
    assertThat(ResponseFormat.fromValue("SRT")).isEqualTo(ResponseFormat.SRT);
    assertThat(ResponseFormat.fromValue(" vtt ")).isEqualTo(ResponseFormat.VTT);
  }

  @Test
  void fromValue_shouldDefaultToJson() {
    assertThat(ResponseFormat.fromValue(null)).isEqualTo(ResponseFormat.JSON);
    assertThat(ResponseFormat.fromValue("")).isEqualTo(ResponseFormat.JSON);
  }

  @Test
  void fromValue_shouldRejectUnknownFormat() {
    assertThatThrownBy(() -> ResponseFormat.fromValue("xml"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported response format: xml");
  }
}
