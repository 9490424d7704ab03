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
package spd.utilities;

import static java.lang.String.format;
import static picocli.CommandLine.usage;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Base SpinDry Command class.
 */
public abstract class SpdCommand {

  /** The logger for this class. */
  public static final Logger logger = Logger.getLogger(SpdCommand.class.getName());

  /** Package searched for commands given by their short name. */
  public static final String COMMAND_PACKAGE = "spd.algorithms.commands.";

  /** Help output is rendered without ANSI color codes so it can be logged. */
  public final Ansi color = Ansi.OFF;

  /** The array of args passed into the Command. */
  public String[] args;

  /** Parse Result. */
  public ParseResult parseResult = null;

  /** -V or --version Prints the SpinDry version and exits. */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the SpinDry version and exit.")
  public boolean version;

  /** -h or --help Prints a help message. */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /**
   * Create a Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public SpdCommand(String[] args) {
    this.args = (args == null) ? new String[0] : args;
  }

  /**
   * Use the ClassLoader to find the requested Command.
   *
   * @param name Name of the Command to load (e.g., Spin).
   * @return The Command, if found, or null.
   */
  public static Class<? extends SpdCommand> getCommand(String name) {
    ClassLoader loader = SpdCommand.class.getClassLoader();
    Class<?> command;
    try {
      // First try to load the class directly.
      command = loader.loadClass(name);
    } catch (ClassNotFoundException e) {
      // Next, try to load a Command from the Algorithms commands package.
      try {
        command = loader.loadClass(COMMAND_PACKAGE + name);
      } catch (ClassNotFoundException e2) {
        logger.warning(format(" %s was not found.", name));
        return null;
      }
    }
    if (!SpdCommand.class.isAssignableFrom(command)) {
      logger.warning(format(" %s is not a SpinDry command.", name));
      return null;
    }
    return command.asSubclass(SpdCommand.class);
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (PrintStream printStream = new PrintStream(baos, true, StandardCharsets.UTF_8)) {
      usage(this, printStream, color);
    }
    return " " + baos.toString(StandardCharsets.UTF_8);
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   */
  public boolean init() {
    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is when long-form arguments (such as --ns) are only preceded by one dash (such as -ns, which is an error).");
      throw uae;
    }

    // Print help info exit.
    if (help) {
      logger.info(helpString());
      return false;
    }

    // Version info is handled by the Main class.
    return !version;
  }

  /**
   * Execute this Command.
   *
   * @return The current SpdCommand.
   */
  public SpdCommand run() {
    logger.info(helpString());
    return this;
  }
}
