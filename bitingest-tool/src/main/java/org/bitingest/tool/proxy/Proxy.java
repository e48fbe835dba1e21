/**
 * bitingest: Bitmap Index Ingestion.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of bitingest.
 *
 * bitingest is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.bitingest.tool.proxy;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.bitingest.tool.ToolFunction;
import org.bitingest.tool.ToolFunctionName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a proxy in front of the index server which translates identifiers in query results back to their values.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Proxy.FUNCTION_NAME)
public class Proxy implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Proxy.class);

  public static final String FUNCTION_NAME = "proxy";

  private static final String OPT_HELP = "h";
  private static final String OPT_BIND = "b";
  private static final String OPT_UPSTREAM = "u";

  @Override
  public void execute(String[] args) {
    Options cliOpt = createCliOptions();
    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = null;
    boolean showHelp = false;
    try {
      cmd = parser.parse(cliOpt, args);
      showHelp |= cmd.hasOption(OPT_HELP);
    } catch (ParseException e) {
      logger.error(e.getMessage());
      showHelp = true;
    }

    if (showHelp) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp(Proxy.FUNCTION_NAME + " [options]",
          "\nForwards all requests to the index server and replaces row and column identifiers in query results with "
              + "the values they were translated from. Runs until the process is terminated.\n\n",
          cliOpt, "");
      return;
    }

    new ProxyImplementation(cmd.getOptionValue(OPT_BIND), cmd.getOptionValue(OPT_UPSTREAM)).run();
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_BIND).longOpt("bind").numberOfArgs(1).argName("host:port")
        .desc("Address to listen on.").build());
    res.addOption(Option.builder(OPT_UPSTREAM).longOpt("upstream").numberOfArgs(1).argName("host:port")
        .desc("Address of the index server.").build());
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
