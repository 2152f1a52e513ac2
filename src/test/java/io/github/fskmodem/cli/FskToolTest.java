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
package io.github.fskmodem.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FskToolTest {

  @ParameterizedTest(name = "--debug {0} -> {1}")
  @CsvSource({
    "10, debug",
    "20, info",
    "30, warn",
    "40, error",
    "50, error",
    "DEBUG, debug",
    "warning, warn",
    "trace, trace",
    "bogus, info"
  })
  void testLevelNames(String value, String level) {
    assertEquals(level, FskTool.toLevelName(value));
    assertEquals(level, FskTool.logLevel(new String[] {"decode", "x.wav", "--debug", value}));
    assertEquals(level, FskTool.logLevel(new String[] {"decode", "--debug=" + value, "x.wav"}));
  }

  @Test
  void testNoLevel() {
    assertNull(FskTool.logLevel(new String[] {"decode", "x.wav"}));
  }
}
