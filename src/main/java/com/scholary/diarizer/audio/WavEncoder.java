package com.scholary.diarizer.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Encodes float samples as a mono 16-bit PCM WAV file in memory. */
public final class WavEncoder {

  private static final int HEADER_BYTES = 44;

  private WavEncoder() {}

  /**
   * Encode samples in [-1, 1]; values outside the range are clipped.
   *
   * @param samples mono samples
   * @param sampleRate samples per second
   * @return a complete RIFF/WAVE file
   */
  public static byte[] encode(float[] samples, int sampleRate) {
    int dataBytes = samples.length * 2;
    ByteBuffer buffer =
        ByteBuffer.allocate(HEADER_BYTES + dataBytes).order(ByteOrder.LITTLE_ENDIAN);

    buffer.put(new byte[] {'R', 'I', 'F', 'F'});
    buffer.putInt(36 + dataBytes);
    buffer.put(new byte[] {'W', 'A', 'V', 'E'});

    buffer.put(new byte[] {'f', 'm', 't', ' '});
    buffer.putInt(16); // fmt chunk size
    buffer.putShort((short) 1); // PCM
    buffer.putShort((short) 1); // mono
    buffer.putInt(sampleRate);
    buffer.putInt(sampleRate * 2); // byte rate
    buffer.putShort((short) 2); // block align
    buffer.putShort((short) 16); // bits per sample

    buffer.put(new byte[] {'d', 'a', 't', 'a'});
    buffer.putInt(dataBytes);
    for (float sample : samples) {
      float clipped = Math.max(-1f, Math.min(1f, sample));
      buffer.putShort((short) Math.round(clipped * 32767f));
    }
    return buffer.array();
  }
}
