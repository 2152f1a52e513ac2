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

import java.util.Objects;

import lombok.Getter;

/**
 * Immutable parameter set shared by {@link FskModulator} and {@link FskDemodulator}.
 * <p>
 * Encoder and decoder must be given the same values; the decoder cannot detect a mismatch.
 * Bit 0 is sent on the space tone ({@code center - deviation}), bit 1 on the mark tone
 * ({@code center + deviation}).
 */
@Getter
public final class ModulationParameters {

  public static final double DEFAULT_CENTER_FREQUENCY = 10_000;
  public static final double DEFAULT_DEVIATION = 500;
  public static final double DEFAULT_BAUD_RATE = 100;
  public static final int DEFAULT_SAMPLE_RATE = 44_100;

  /** 10 kHz centre, 500 Hz deviation, 100 baud, 44.1 kHz. */
  public static final ModulationParameters DEFAULT = new ModulationParameters(
    DEFAULT_CENTER_FREQUENCY, DEFAULT_DEVIATION, DEFAULT_BAUD_RATE, DEFAULT_SAMPLE_RATE);

  private final double centerFrequency;
  private final double deviation;
  private final double baudRate;
  private final int sampleRate;
  private final int samplesPerBit;

  /**
   * @param centerFrequency centre frequency in Hz
   * @param deviation       offset of each tone from the centre in Hz
   * @param baudRate        bits per second
   * @param sampleRate      sample rate in Hz
   * @throws ConfigurationException if the combination cannot be modulated
   */
  public ModulationParameters(double centerFrequency, double deviation, double baudRate, int sampleRate) {
    requirePositive("centerFrequency", centerFrequency);
    requirePositive("deviation", deviation);
    requirePositive("baudRate", baudRate);
    if (sampleRate <= 0) {
      throw new ConfigurationException("sampleRate must be positive, got " + sampleRate);
    }
    if (deviation >= centerFrequency) {
      throw new ConfigurationException(String.format(
        "deviation (%.1f Hz) must be below centerFrequency (%.1f Hz)", deviation, centerFrequency));
    }
    if (sampleRate <= 2.0 * (centerFrequency + deviation)) {
      throw new ConfigurationException(String.format(
        "sampleRate %d Hz violates Nyquist for mark tone %.1f Hz (need > %.1f Hz)",
        sampleRate, centerFrequency + deviation, 2.0 * (centerFrequency + deviation)));
    }
    long spb = Math.round(sampleRate / baudRate);
    if (spb < 1) {
      throw new ConfigurationException(String.format(
        "bit duration %.6f s at %d Hz gives no samples per bit", 1.0 / baudRate, sampleRate));
    }
    if (spb > Integer.MAX_VALUE) {
      throw new ConfigurationException("bit duration too long: " + spb + " samples per bit");
    }
    this.centerFrequency = centerFrequency;
    this.deviation = deviation;
    this.baudRate = baudRate;
    this.sampleRate = sampleRate;
    this.samplesPerBit = (int) spb;
  }

  /**
   * Builds parameters from a bit duration instead of a baud rate.
   */
  public static ModulationParameters ofBitDuration(double centerFrequency, double deviation, double bitDuration, int sampleRate) {
    requirePositive("bitDuration", bitDuration);
    return new ModulationParameters(centerFrequency, deviation, 1.0 / bitDuration, sampleRate);
  }

  /** Bit duration in seconds. */
  public double getBitDuration() {
    return 1.0 / baudRate;
  }

  /** Tone for bit 0. */
  public double getSpaceFrequency() {
    return centerFrequency - deviation;
  }

  /** Tone for bit 1. */
  public double getMarkFrequency() {
    return centerFrequency + deviation;
  }

  /** Exact length of a modulated buffer holding {@code bitCount} bits. */
  public long bufferLength(int bitCount) {
    return (long) bitCount * samplesPerBit;
  }

  public ModulationParameters withCenterFrequency(double value) {
    return new ModulationParameters(value, deviation, baudRate, sampleRate);
  }

  public ModulationParameters withDeviation(double value) {
    return new ModulationParameters(centerFrequency, value, baudRate, sampleRate);
  }

  public ModulationParameters withBaudRate(double value) {
    return new ModulationParameters(centerFrequency, deviation, value, sampleRate);
  }

  public ModulationParameters withSampleRate(int value) {
    return new ModulationParameters(centerFrequency, deviation, baudRate, value);
  }

  private static void requirePositive(String name, double value) {
    if (!(value > 0) || Double.isInfinite(value)) {
      throw new ConfigurationException(name + " must be a positive finite number, got " + value);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ModulationParameters other)) {
      return false;
    }
    return Double.compare(centerFrequency, other.centerFrequency) == 0
      && Double.compare(deviation, other.deviation) == 0
      && Double.compare(baudRate, other.baudRate) == 0
      && sampleRate == other.sampleRate;
  }

  @Override
  public int hashCode() {
    return Objects.hash(centerFrequency, deviation, baudRate, sampleRate);
  }

  @Override
  public String toString() {
    return String.format("center=%.1f Hz, deviation=%.1f Hz, baud=%.2f, sampleRate=%d Hz, samplesPerBit=%d",
      centerFrequency, deviation, baudRate, sampleRate, samplesPerBit);
  }
}
