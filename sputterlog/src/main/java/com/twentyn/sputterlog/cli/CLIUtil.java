/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.sputterlog.cli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Option parsing for the command line tools: a help option is always available, and parse failures print the usage
 * and exit.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  public static final String OPTION_HELP = "h";

  private static final int HELP_WIDTH = 100;

  private final String toolName;
  private final String helpMessage;
  private final Options opts = new Options();

  public CLIUtil(Class<?> tool, String helpMessage, List<Option.Builder> optionBuilders) {
    this.toolName = tool.getCanonicalName();
    this.helpMessage = helpMessage;
    for (Option.Builder b : optionBuilders) {
      opts.addOption(b.build());
    }
    opts.addOption(Option.builder(OPTION_HELP).desc("Prints this help message").longOpt("help").build());
  }

  /**
   * Parses {@code args} without exiting, so that parse errors reach the caller.
   */
  public CommandLine parse(String[] args) throws ParseException {
    return new DefaultParser().parse(opts, args);
  }

  /**
   * Parses {@code args}, printing the usage and exiting on a parse error or when help is requested.
   */
  public CommandLine parseCommandLine(String[] args) {
    if (requestsHelp(args)) {
      printHelp();
      System.exit(0);
    }
    try {
      return parse(args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s", e.getMessage());
      printHelp();
      System.exit(1);
      return null;
    }
  }

  /** Whether help was asked for; required options need not be present for that. */
  boolean requestsHelp(String[] args) {
    for (String arg : args) {
      if (("-" + OPTION_HELP).equals(arg) || "--help".equals(arg)) {
        return true;
      }
    }
    return false;
  }

  public void printHelp() {
    HelpFormatter formatter = new HelpFormatter();
    formatter.setWidth(HELP_WIDTH);
    formatter.printHelp(toolName, helpMessage, opts, null, true);
  }

  public void failWithMessage(String format, Object... args) {
    LOGGER.error(format, args);
    printHelp();
    System.exit(1);
  }
}
