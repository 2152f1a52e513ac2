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
package io.github.fskmodem;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.BiConsumer;

import io.github.fskmodem.dsp.DdsOscillator;
import io.github.fskmodem.util.BitSequence;
import lombok.Getter;

/**
 * Binary FSK modulator with phase continuity across bit boundaries.
 * <p>
 * Every bit lasts exactly {@link ModulationParameters#getSamplesPerBit()} samples, so a buffer
 * of {@code n} bits has {@code n * samplesPerBit} samples. The oscillator phase starts at 0
 * for every call and is carried from one bit into the next.
 * Stateless between calls; one instance may be shared by several threads.
 */
public class FskModulator {

  @Getter private final ModulationParameters parameters;
  @Getter private final float amplitude;

  /**
   * Create a modulator with unit peak amplitude.
   */
  public FskModulator(ModulationParameters parameters) {
    this(parameters, 1.0f);
  }

  /**
   * @param parameters tones, baud rate and sample rate
   * @param amplitude  peak amplitude in (0, 1]
   */
  public FskModulator(ModulationParameters parameters, float amplitude) {
    this.parameters = Objects.requireNonNull(parameters, "parameters");
    if (!(amplitude > 0f && amplitude <= 1f)) {
      throw new ConfigurationException("amplitude must be in (0, 1], got " + amplitude);
    }
    this.amplitude = amplitude;
  }

  /**
   * Modulate the bits into a new sample buffer.
   *
   * @return {@code bits.size() * samplesPerBit} samples; empty for an empty sequence
   */
  public float[] modulate(BitSequence bits) {
    Objects.requireNonNull(bits, "bits");
    long length = parameters.bufferLength(bits.size());
    if (length > Integer.MAX_VALUE - 8) {
      throw new ConfigurationException("signal of " + length + " samples does not fit in one buffer");
    }
    float[] out = new float[(int) length];
    if (out.length > 0) {
      // single chunk spanning the whole output, so samples land in place
      modulate(bits, out, out.length, (buf, len) -> { });
    }
    return out;
  }

  /**
   * Modulate the bits into chunks of {@code chunkSize} samples.
   * <p>
   * {@code callback} receives {@code (buffer, validLength)} every time the buffer fills up and
   * once more for a final partial chunk. The buffer is reused between calls.
   *
   * @param bits      bits to send
   * @param buffer    audio buffer of at least {@code chunkSize} samples
   * @param chunkSize samples per callback
   * @param callback  receives each chunk
   */
  public void modulate(BitSequence bits, float[] buffer, int chunkSize, BiConsumer<float[], Integer> callback) {
    Objects.requireNonNull(bits, "bits");
    if (chunkSize < 1 || chunkSize > buffer.length) {
      throw new IllegalArgumentException("chunkSize must be in [1, " + buffer.length + "], got " + chunkSize);
    }
    int samplesPerBit = parameters.getSamplesPerBit();
    double space = parameters.getSpaceFrequency();
    double mark = parameters.getMarkFrequency();
    DdsOscillator osc = new DdsOscillator(parameters.getSampleRate(), space);
    int chunkIndex = 0;
    for (int bit : bits) {
      osc.setFrequency(bit != 0 ? mark : space);
      for (int i = 0; i < samplesPerBit; i++) {
        buffer[chunkIndex++] = amplitude * osc.sin();
        osc.next();
        if (chunkIndex == chunkSize) {
          callback.accept(buffer, chunkIndex);
          chunkIndex = 0;
        }
      }
    }
    if (chunkIndex > 0) {
      callback.accept(buffer, chunkIndex);
    }
  }

  /**
   * Like {@link #modulate(BitSequence, float[], int, BiConsumer)}, but every chunk holds exactly
   * {@code buffer.length} samples; the last one is padded with silence.
   */
  public void modulateToFixedLengthChunks(BitSequence bits, float[] buffer, BiConsumer<float[], Integer> callback) {
    modulate(bits, buffer, buffer.length, (chunk, len) -> {
      if (len < chunk.length) {
        Arrays.fill(chunk, len, chunk.length, 0f);
      }
      callback.accept(chunk, chunk.length);
    });
  }
}
