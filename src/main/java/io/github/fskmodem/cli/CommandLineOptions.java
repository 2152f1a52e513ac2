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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Getter;

/**
 * Parsed command line: {@code <command> [positional...] [--option value...] [--flag...]}.
 * Options may also be written {@code --option=value}.
 */
public final class CommandLineOptions {

  /** Bad command line; the message is shown with the usage text. */
  public static class UsageException extends RuntimeException {
    public UsageException(String message) {
      super(message);
    }
  }

  @Getter private final String command;
  @Getter private final List<String> positional;
  private final Map<String, String> options;
  private final Set<String> flags;

  private CommandLineOptions(String command, List<String> positional, Map<String, String> options, Set<String> flags) {
    this.command = command;
    this.positional = Collections.unmodifiableList(positional);
    this.options = options;
    this.flags = flags;
  }

  /**
   * @param args         raw arguments, command first
   * @param valueOptions option names (without dashes) that take a value
   * @param flagOptions  option names that take none
   */
  public static CommandLineOptions parse(String[] args, Set<String> valueOptions, Set<String> flagOptions) {
    if (args.length == 0) {
      throw new UsageException("missing command");
    }
    List<String> positional = new ArrayList<>();
    Map<String, String> options = new HashMap<>();
    Set<String> flags = new HashSet<>();
    for (int i = 1; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        positional.add(arg);
        continue;
      }
      String name = arg.substring(2);
      String value = null;
      int eq = name.indexOf('=');
      if (eq >= 0) {
        value = name.substring(eq + 1);
        name = name.substring(0, eq);
      }
      if (flagOptions.contains(name)) {
        if (value != null) {
          throw new UsageException("option --" + name + " takes no value");
        }
        flags.add(name);
      } else if (valueOptions.contains(name)) {
        if (value == null) {
          if (i + 1 >= args.length) {
            throw new UsageException("option --" + name + " needs a value");
          }
          value = args[++i];
        }
        options.put(name, value);
      } else {
        throw new UsageException("unknown option --" + name);
      }
    }
    return new CommandLineOptions(args[0], positional, options, flags);
  }

  public boolean has(String name) {
    return options.containsKey(name);
  }

  public boolean hasFlag(String name) {
    return flags.contains(name);
  }

  public String getString(String name, String defaultValue) {
    return options.getOrDefault(name, defaultValue);
  }

  public double getDouble(String name, double defaultValue) {
    String v = options.get(name);
    if (v == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(v);
    } catch (NumberFormatException e) {
      throw new UsageException("option --" + name + " expects a number, got '" + v + "'");
    }
  }

  public int getInt(String name, int defaultValue) {
    String v = options.get(name);
    if (v == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new UsageException("option --" + name + " expects an integer, got '" + v + "'");
    }
  }
}
