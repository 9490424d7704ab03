// ******************************************************************************
//
// Title:       SpinDry.
// Description: SpinDry - Rigid-Body Host-Guest Conformer Search.
// Copyright:   Copyright (c) SpinDry developers 2021.
//
// This file is part of SpinDry.
//
// SpinDry is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// SpinDry is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// SpinDry; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package spd;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import spd.utilities.LogFormatter;
import spd.utilities.SpdCommand;

/**
 * The Main class is the entry point to the SpinDry command line.
 *
 * <br>
 * Usage:
 * <br>
 * spd [-Dkey=value ...] &lt;command&gt; [command options]
 *
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  private static boolean printVersionAndExit = false;

  private Main() {
  }

  /**
   * Run a SpinDry command.
   *
   * @param args The command name followed by its arguments.
   */
  public static void main(String[] args) {
    // Process any "-D" command line flags.
    args = processProperties(args);

    // Configure our logging.
    startLogging();

    header();
    if (printVersionAndExit) {
      return;
    }

    if (args.length == 0) {
      logger.info(" Usage: spd [-Dkey=value ...] <command> [options]\n Commands:\n  Spin");
      return;
    }

    SpdCommand command = createCommand(args[0], Arrays.copyOfRange(args, 1, args.length));
    if (command == null) {
      System.exit(1);
    }
    try {
      command.run();
    } catch (Throwable t) {
      int statusCode = 1;
      logger.log(Level.SEVERE, " Uncaught exception: exiting with status code " + statusCode, t);
      System.exit(statusCode);
    }
  }

  /**
   * Instantiate a command by name.
   *
   * @param name The command name (e.g. Spin) or fully qualified class name.
   * @param args The command arguments.
   * @return The command, or null if it could not be created.
   */
  public static SpdCommand createCommand(String name, String[] args) {
    Class<? extends SpdCommand> commandClass = SpdCommand.getCommand(name);
    if (commandClass == null) {
      return null;
    }
    try {
      return commandClass.getConstructor(String[].class).newInstance((Object) args);
    } catch (ReflectiveOperationException e) {
      logger.log(Level.SEVERE, format(" Could not create command %s.", name), e);
      return null;
    }
  }

  /**
   * Set "-Dkey=value" arguments as system properties and return the remaining arguments.
   *
   * @param args The command line arguments.
   * @return The arguments that are not "-D" flags.
   */
  static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();

      // Version requested before the command name.
      if (newArgs.isEmpty() && (arg.equals("-V") || arg.equals("--version"))) {
        printVersionAndExit = true;
        continue;
      }

      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        if (arg.contains("=")) {
          int equalsPosition = arg.indexOf("=");
          String key = arg.substring(0, equalsPosition);
          String value = arg.substring(equalsPosition + 1);
          System.setProperty(key, value);
        } else if (arg.length() > 0) {
          System.setProperty(arg, "");
        }
      } else {
        // Collect non "-D" arguments.
        newArgs.add(arg);
      }
    }
    return newArgs.toArray(new String[0]);
  }

  /** Replace the default console handler with one that uses the LogFormatter. */
  private static void startLogging() {
    // Remove all log handlers from the default logger.
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    String logLevel = System.getProperty("spd.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (IllegalArgumentException e) {
      level = Level.INFO;
    }

    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(level);
    handler.setFormatter(new LogFormatter(level.intValue() < Level.INFO.intValue()));

    Logger spdLogger = Logger.getLogger("spd");
    for (Handler h : spdLogger.getHandlers()) {
      spdLogger.removeHandler(h);
    }
    spdLogger.addHandler(handler);
    spdLogger.setLevel(level);
  }

  private static void header() {
    String version = Main.class.getPackage().getImplementationVersion();
    logger.info(format("\n SpinDry %s\n Rigid-body Monte Carlo conformer search.\n",
        (version == null) ? "(development build)" : version));
  }
}
