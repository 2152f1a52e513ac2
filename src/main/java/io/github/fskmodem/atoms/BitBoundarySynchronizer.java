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
package io.github.fskmodem.atoms;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Partitions a frame sequence into bit windows and classifies each window.
 * <ul>
 *   <li>Bit {@code k} covers samples {@code [k * samplesPerBit, (k + 1) * samplesPerBit)}; the
 *   buffer must start on a bit boundary.</li>
 *   <li>A frame belongs to a bit when its whole analysis window lies inside the bit window.</li>
 *   <li>Frames without a frequency, or weaker than {@code relativeThreshold} times the strongest
 *   frame of the buffer, are ignored.</li>
 *   <li>A bit window left without frames is reported as missing, never guessed.</li>
 * </ul>
 */
@Slf4j
public class BitBoundarySynchronizer {

  @Getter private final int samplesPerBit;
  @Getter private final FrequencyAggregation aggregation;
  @Getter private final double relativeThreshold;

  public BitBoundarySynchronizer(int samplesPerBit, FrequencyAggregation aggregation, double relativeThreshold) {
    if (samplesPerBit < 1) {
      throw new IllegalArgumentException("samplesPerBit must be positive, got " + samplesPerBit);
    }
    if (relativeThreshold < 0.0 || relativeThreshold >= 1.0) {
      throw new IllegalArgumentException("relativeThreshold must be in [0, 1), got " + relativeThreshold);
    }
    this.samplesPerBit = samplesPerBit;
    this.aggregation = aggregation;
    this.relativeThreshold = relativeThreshold;
  }

  /** Number of bit windows in a buffer; a trailing partial window counts. */
  public int bitCount(int totalSamples) {
    return (int) ((totalSamples + (long) samplesPerBit - 1) / samplesPerBit);
  }

  /**
   * @param frames       frames in time order
   * @param totalSamples length of the analysed buffer
   * @param classifier   tone to bit mapping
   * @return one decision per bit window, in bit order
   */
  public List<BitDecision> decode(List<FrequencyFrame> frames, int totalSamples, ToneClassifier classifier) {
    int bits = bitCount(totalSamples);
    List<BitDecision> decisions = new ArrayList<>(bits);
    double floor = relativeThreshold * strongest(frames);
    int cursor = 0;
    double[] freqs = new double[16];
    double[] mags = new double[16];
    for (int k = 0; k < bits; k++) {
      long bitStart = (long) k * samplesPerBit;
      long bitEnd = Math.min(bitStart + samplesPerBit, totalSamples);
      // skip frames starting before this bit
      while (cursor < frames.size() && frames.get(cursor).getStartSample() < bitStart) {
        cursor++;
      }
      int n = 0;
      for (int j = cursor; j < frames.size(); j++) {
        FrequencyFrame f = frames.get(j);
        if (f.getStartSample() >= bitEnd) {
          break;
        }
        if (f.getEndSample() > bitEnd || !f.isValid() || f.getMagnitude() < floor) {
          continue;
        }
        if (n == freqs.length) {
          freqs = Arrays.copyOf(freqs, n * 2);
          mags = Arrays.copyOf(mags, n * 2);
        }
        freqs[n] = f.getFrequency();
        mags[n] = f.getMagnitude();
        n++;
      }
      BitDecision decision;
      if (n == 0) {
        decision = BitDecision.missing(k, (int) bitStart);
      } else {
        double frequency = aggregation.aggregate(freqs, mags, n);
        decision = new BitDecision(k, (int) bitStart, n, frequency, classifier.classify(frequency));
      }
      if (log.isTraceEnabled()) {
        log.trace("{}", decision);
      }
      decisions.add(decision);
    }
    return decisions;
  }

  private static double strongest(List<FrequencyFrame> frames) {
    double max = 0.0;
    for (FrequencyFrame f : frames) {
      if (f.isValid() && f.getMagnitude() > max) {
        max = f.getMagnitude();
      }
    }
    return max;
  }
}
