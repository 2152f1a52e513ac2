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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.github.fskmodem.cli.CommandLineOptions.UsageException;

class CommandLineOptionsTest {

  private static final Set<String> VALUES = Set.of("frequency", "output");
  private static final Set<String> FLAGS = Set.of("no-filter");

  private static CommandLineOptions parse(String... args) {
    return CommandLineOptions.parse(args, VALUES, FLAGS);
  }

  @Test
  void testParse() {
    CommandLineOptions o = parse("decode", "in.wav", "--frequency", "1200", "--no-filter", "--output=x.wav");
    assertEquals("decode", o.getCommand());
    assertEquals(List.of("in.wav"), o.getPositional());
    assertEquals(1200.0, o.getDouble("frequency", 0));
    assertEquals("x.wav", o.getString("output", null));
    assertTrue(o.hasFlag("no-filter"));
    assertFalse(o.has("no-filter"));
    assertEquals(7, o.getInt("missing", 7));
  }

  @Test
  void testErrors() {
    assertThrows(UsageException.class, () -> parse());
    assertThrows(UsageException.class, () -> parse("decode", "--unknown", "1"));
    assertThrows(UsageException.class, () -> parse("decode", "--frequency"));
    assertThrows(UsageException.class, () -> parse("decode", "--no-filter=yes"));
    assertThrows(UsageException.class, () -> parse("decode", "--frequency", "high").getDouble("frequency", 0));
    assertThrows(UsageException.class, () -> parse("decode", "--frequency", "1.5").getInt("frequency", 0));
  }
}
