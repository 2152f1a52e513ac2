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

import java.util.Locale;

import org.slf4j.bridge.SLF4JBridgeHandler;

/**
 * Command line entry point: {@code encode}, {@code decode} and {@code estimate}.
 * <p>
 * Has no logger of its own: the log level from {@code --debug} must be in place before
 * the first SLF4J logger is created.
 */
public final class FskTool {

  private static final String LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  private FskTool() {}

  public static void main(String[] args) {
    String level = logLevel(args);
    if (level != null) {
      System.setProperty(LEVEL_PROPERTY, level);
    }
    // javax.sound providers log through JUL
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
    System.exit(new FskCommands(System.out).run(args));
  }

  /**
   * Level name from {@code --debug}: numeric levels 10 (debug) to 50 (critical), or a level name.
   */
  static String logLevel(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String value = null;
      if (args[i].equals("--debug") && i + 1 < args.length) {
        value = args[i + 1];
      } else if (args[i].startsWith("--debug=")) {
        value = args[i].substring("--debug=".length());
      }
      if (value != null) {
        return toLevelName(value);
      }
    }
    return null;
  }

  static String toLevelName(String value) {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "10": case "debug": return "debug";
      case "20": case "info": return "info";
      case "30": case "warn": case "warning": return "warn";
      case "40": case "50": case "error": case "critical": return "error";
      case "trace": return "trace";
      default: return "info";
    }
  }
}
