/*************************************************************************
*                                                                        *
*  This file is part of the FCSys chemistry project.                     *
*  FCSys models fuel cell systems from first principles.                 *
*  Copyright (C) 2026 the FCSys authors.                                 *
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

package com.fcsys.utils;

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
 * Option handling for the command line tools.  Every tool gets -h/--help, and bad arguments print usage and exit.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  private static final int HELP_WIDTH = 100;
  public static final String OPTION_HELP = "h";

  private final Class<?> callingClass;
  private final String helpMessage;
  private final Options opts = new Options();

  public CLIUtil(Class<?> callingClass, String helpMessage, List<Option.Builder> optionBuilders) {
    this.callingClass = callingClass;
    this.helpMessage = helpMessage;

    for (Option.Builder b : optionBuilders) {
      opts.addOption(b.build());
    }
    opts.addOption(Option.builder(OPTION_HELP)
        .desc("Prints this help message")
        .longOpt("help")
        .build());
  }

  /**
   * Parses arguments without exiting, for callers that handle bad arguments themselves.
   */
  public CommandLine parse(String[] args) throws ParseException {
    return new DefaultParser().parse(opts, args);
  }

  /**
   * Parses arguments, printing usage and exiting on bad arguments or when help is requested.
   */
  public CommandLine parseCommandLine(String[] args) {
    CommandLine cl = null;
    try {
      cl = parse(args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s", e.getMessage());
      printHelp();
      System.exit(1);
    }

    if (cl.hasOption(OPTION_HELP)) {
      printHelp();
      System.exit(0);
    }
    return cl;
  }

  public void printHelp() {
    HelpFormatter formatter = new HelpFormatter();
    formatter.setWidth(HELP_WIDTH);
    formatter.printHelp(callingClass.getCanonicalName(), helpMessage, opts, null, true);
  }

  public void failWithMessage(String format, Object... args) {
    System.err.println(String.format(format, args));
    printHelp();
    System.exit(1);
  }
}
