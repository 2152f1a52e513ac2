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

import java.util.Arrays;

/**
 * How the frame estimates inside one bit window are reduced to a single frequency.
 */
public enum FrequencyAggregation {

  /** Median of the frame frequencies; a single outlier frame cannot flip the bit. */
  MEDIAN {
    @Override
    public double aggregate(double[] frequencies, double[] magnitudes, int n) {
      double[] sorted = Arrays.copyOf(frequencies, n);
      Arrays.sort(sorted);
      int mid = n / 2;
      return (n & 1) == 1 ? sorted[mid] : 0.5 * (sorted[mid - 1] + sorted[mid]);
    }
  },

  MEAN {
    @Override
    public double aggregate(double[] frequencies, double[] magnitudes, int n) {
      double sum = 0.0;
      for (int i = 0; i < n; i++) {
        sum += frequencies[i];
      }
      return sum / n;
    }
  },

  /** Mean weighted by peak magnitude, so weak frames count less. */
  MAGNITUDE_WEIGHTED {
    @Override
    public double aggregate(double[] frequencies, double[] magnitudes, int n) {
      double sum = 0.0;
      double weight = 0.0;
      for (int i = 0; i < n; i++) {
        sum += frequencies[i] * magnitudes[i];
        weight += magnitudes[i];
      }
      return weight > 0.0 ? sum / weight : MEAN.aggregate(frequencies, magnitudes, n);
    }
  };

  /**
   * @param frequencies frame frequencies, first {@code n} entries used
   * @param magnitudes  matching peak magnitudes
   * @param n           number of frames, at least 1
   */
  public abstract double aggregate(double[] frequencies, double[] magnitudes, int n);
}
