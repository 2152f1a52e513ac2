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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BitBoundarySynchronizerTest {

  private static final int SPB = 100;
  private static final int WINDOW = 40;
  private final ToneClassifier classifier = new ToneClassifier(1000, 2000);
  private final BitBoundarySynchronizer sync = new BitBoundarySynchronizer(SPB, FrequencyAggregation.MEDIAN, 0.1);

  private static List<FrequencyFrame> frames(int totalSamples, int hop, double... bitFrequencies) {
    List<FrequencyFrame> out = new ArrayList<>();
    for (int start = 0, i = 0; start + WINDOW <= totalSamples; start += hop, i++) {
      int bit = Math.min(bitFrequencies.length - 1, (start + WINDOW / 2) / SPB);
      out.add(new FrequencyFrame(i, start, WINDOW, bitFrequencies[bit], 1.0));
    }
    return out;
  }

  @ParameterizedTest(name = "{0} samples -> {1} bits")
  @CsvSource({"0, 0", "1, 1", "100, 1", "101, 2", "400, 4", "450, 5"})
  void testBitCount(int samples, int bits) {
    assertEquals(bits, sync.bitCount(samples));
  }

  @Test
  @DisplayName("One decision per bit window, in order")
  void testDecode() {
    List<BitDecision> d = sync.decode(frames(400, 10, 2000, 1000, 2000, 2000), 400, classifier);
    assertEquals(4, d.size());
    int[] expected = {1, 0, 1, 1};
    for (int k = 0; k < 4; k++) {
      assertEquals(k, d.get(k).getIndex());
      assertEquals(k * SPB, d.get(k).getStartSample());
      assertEquals(expected[k], d.get(k).getBit());
      assertFalse(d.get(k).isMissing());
    }
  }

  @Test
  @DisplayName("Frames straddling a bit boundary are not used")
  void testStraddlingFramesIgnored() {
    List<FrequencyFrame> fs = new ArrayList<>();
    fs.add(new FrequencyFrame(0, 10, WINDOW, 2000, 1.0));   // inside bit 0
    fs.add(new FrequencyFrame(1, 80, WINDOW, 1000, 5.0));   // crosses into bit 1
    fs.add(new FrequencyFrame(2, 120, WINDOW, 1000, 1.0));  // inside bit 1
    List<BitDecision> d = sync.decode(fs, 200, classifier);
    assertEquals(1, d.get(0).getFrameCount());
    assertEquals(2000, d.get(0).getFrequency(), 1e-9);
    assertEquals(1, d.get(1).getFrameCount());
  }

  @Test
  @DisplayName("A bit without a full window is missing, never guessed")
  void testTrailingPartialBit() {
    List<BitDecision> d = sync.decode(frames(330, 10, 1000, 2000, 1000, 2000), 330, classifier);
    assertEquals(4, d.size());
    assertTrue(d.get(3).isMissing());
    assertEquals(BitDecision.MISSING, d.get(3).getBit());
    assertTrue(Double.isNaN(d.get(3).getFrequency()));
    assertEquals(0, d.get(3).getFrameCount());
  }

  @Test
  @DisplayName("Weak and invalid frames do not count")
  void testThreshold() {
    List<FrequencyFrame> fs = new ArrayList<>();
    fs.add(new FrequencyFrame(0, 0, WINDOW, 2000, 1.0));
    fs.add(new FrequencyFrame(1, 100, WINDOW, 1000, 0.05));
    fs.add(new FrequencyFrame(2, 150, WINDOW, Double.NaN, 0.0));
    fs.add(new FrequencyFrame(3, 200, WINDOW, 1000, 0.5));
    List<BitDecision> d = sync.decode(fs, 300, classifier);
    assertEquals(1, d.get(0).getBit());
    assertTrue(d.get(1).isMissing());
    assertEquals(0, d.get(2).getBit());
  }

  @Test
  void testNoFrames() {
    List<BitDecision> d = sync.decode(List.of(), 250, classifier);
    assertEquals(3, d.size());
    assertTrue(d.stream().allMatch(BitDecision::isMissing));
  }

  @Test
  void testInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new BitBoundarySynchronizer(0, FrequencyAggregation.MEAN, 0.1));
    assertThrows(IllegalArgumentException.class, () -> new BitBoundarySynchronizer(10, FrequencyAggregation.MEAN, 1.0));
  }
}
