/*
 * This file is licensed under the GNU General Public License v3.0.
 *
 * You may obtain a copy of the License at
 * https://www.gnu.org/licenses/gpl-3.0.html
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU General Public License for more details.
 */
package io.github.fskmodem.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

import io.github.fskmodem.InputFormatException;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes PCM WAV files through {@code javax.sound.sampled}.
 * <p>
 * Writing: mono, 16-bit signed little-endian, samples clipped to [-1, 1] and scaled by 32767.
 * Reading: 8 or 16-bit PCM, any channel count (channels are averaged), scaled to [-1, 1).
 */
@Slf4j
public final class WavFiles {

  private static final int BITS_PER_SAMPLE = 16;
  private static final float FULL_SCALE = 32767f;

  private WavFiles() {}

  /**
   * Write {@code samples} as a mono 16-bit WAV file.
   */
  public static void write(Path path, float[] samples, int sampleRate) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(samples, "samples");
    byte[] pcm = new byte[samples.length * 2];
    for (int i = 0; i < samples.length; i++) {
      float s = Math.max(-1f, Math.min(1f, samples[i]));
      short v = (short) Math.round(s * FULL_SCALE);
      pcm[2 * i] = (byte) (v & 0xFF);
      pcm[2 * i + 1] = (byte) ((v >>> 8) & 0xFF);
    }
    AudioFormat format = new AudioFormat(sampleRate, BITS_PER_SAMPLE, 1, true, false);
    try (AudioInputStream ais = new AudioInputStream(new ByteArrayInputStream(pcm), format, samples.length)) {
      AudioSystem.write(ais, AudioFileFormat.Type.WAVE, path.toFile());
    }
    log.debug("Wrote {} samples at {} Hz to {}", samples.length, sampleRate, path);
  }

  /**
   * Read a PCM WAV file into mono float samples.
   *
   * @throws InputFormatException if the file is not a supported PCM WAV file
   */
  public static WavAudio read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (AudioInputStream ais = AudioSystem.getAudioInputStream(path.toFile())) {
      AudioFormat af = ais.getFormat();
      log.debug("Audio format of {}: {}", path, af);
      int channels = af.getChannels();
      int bytesPerSample = af.getSampleSizeInBits() / 8;
      if (channels < 1 || (bytesPerSample != 1 && bytesPerSample != 2)) {
        throw new InputFormatException(String.format(
          "Unsupported WAV format in %s: %d bits, %d channels", path, af.getSampleSizeInBits(), channels));
      }
      AudioFormat.Encoding enc = af.getEncoding();
      if (!AudioFormat.Encoding.PCM_SIGNED.equals(enc) && !AudioFormat.Encoding.PCM_UNSIGNED.equals(enc)) {
        throw new InputFormatException("Unsupported WAV encoding in " + path + ": " + enc);
      }
      byte[] data = ais.readAllBytes();
      int frameSize = bytesPerSample * channels;
      int frames = data.length / frameSize;
      float[] samples = new float[frames];
      boolean signed = AudioFormat.Encoding.PCM_SIGNED.equals(enc);
      for (int f = 0; f < frames; f++) {
        float sum = 0f;
        for (int c = 0; c < channels; c++) {
          int off = f * frameSize + c * bytesPerSample;
          sum += decodeSample(data, off, bytesPerSample, signed, af.isBigEndian());
        }
        samples[f] = sum / channels;
      }
      return new WavAudio(samples, Math.round(af.getSampleRate()));
    } catch (UnsupportedAudioFileException e) {
      throw new InputFormatException("Not a readable audio file: " + path, e);
    }
  }

  private static float decodeSample(byte[] data, int off, int bytesPerSample, boolean signed, boolean bigEndian) {
    if (bytesPerSample == 1) {
      int v = signed ? data[off] : (data[off] & 0xFF) - 128;
      return v / 128f;
    }
    int lo = bigEndian ? data[off + 1] : data[off];
    int hi = bigEndian ? data[off] : data[off + 1];
    int v = (hi << 8) | (lo & 0xFF);
    if (!signed) {
      v = (v & 0xFFFF) - 32768;
    } else {
      v = (short) v;
    }
    return v / 32768f;
  }
}
