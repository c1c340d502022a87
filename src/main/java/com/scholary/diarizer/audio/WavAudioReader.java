package com.scholary.diarizer.audio;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.springframework.stereotype.Component;

/**
 * Loads 16-bit PCM WAV files into float sample buffers.
 *
 * <p>Multi-channel input is averaged down to mono. The file's own sample rate is kept; the
 * preprocessor is responsible for resampling.
 */
@Component
public class WavAudioReader {

  /**
   * Read a whole WAV file.
   *
   * @throws AudioProcessingException if the file is missing, not WAV, or not 16-bit PCM
   */
  public AudioBuffer read(Path file) {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(file));
        AudioInputStream audio = AudioSystem.getAudioInputStream(in)) {
      AudioFormat format = audio.getFormat();
      requirePcm16(format, file);

      byte[] bytes = audio.readAllBytes();
      int channels = format.getChannels();
      int frameSize = 2 * channels;
      int frames = bytes.length / frameSize;
      boolean bigEndian = format.isBigEndian();

      float[] samples = new float[frames];
      for (int frame = 0; frame < frames; frame++) {
        float sum = 0f;
        for (int channel = 0; channel < channels; channel++) {
          int offset = frame * frameSize + channel * 2;
          sum += toShort(bytes[offset], bytes[offset + 1], bigEndian) / 32768f;
        }
        samples[frame] = sum / channels;
      }
      return new AudioBuffer(samples, Math.round(format.getSampleRate()));

    } catch (UnsupportedAudioFileException e) {
      throw new AudioProcessingException("Not a readable WAV file: " + file.getFileName(), e);
    } catch (IOException e) {
      throw new AudioProcessingException("Failed to load audio: " + e.getMessage(), e);
    }
  }

  /**
   * Duration of a WAV file read from its header.
   *
   * @throws AudioProcessingException if the header cannot be read
   */
  public double durationSeconds(Path file) {
    try {
      AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(file.toFile());
      AudioFormat format = fileFormat.getFormat();
      long frames = fileFormat.getFrameLength();
      if (frames < 0 || format.getFrameRate() <= 0) {
        throw new AudioProcessingException("WAV header has no length: " + file.getFileName());
      }
      return frames / (double) format.getFrameRate();
    } catch (UnsupportedAudioFileException | IOException e) {
      throw new AudioProcessingException("Failed to read WAV header: " + e.getMessage(), e);
    }
  }

  private static void requirePcm16(AudioFormat format, Path file) {
    if (format.getEncoding() != AudioFormat.Encoding.PCM_SIGNED
        || format.getSampleSizeInBits() != 16) {
      throw new AudioProcessingException(
          String.format(
              "Unsupported WAV encoding in %s: %s, %d bits",
              file.getFileName(), format.getEncoding(), format.getSampleSizeInBits()));
    }
  }

  private static short toShort(byte first, byte second, boolean bigEndian) {
    return bigEndian
        ? (short) ((first << 8) | (second & 0xff))
        : (short) ((second << 8) | (first & 0xff));
  }
}
