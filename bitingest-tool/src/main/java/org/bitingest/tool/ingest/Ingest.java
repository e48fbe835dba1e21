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
package org.bitingest.tool.ingest;

import java.io.File;

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
 * Ingests records of a JSON or CSV file into the index.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Ingest.FUNCTION_NAME)
public class Ingest implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Ingest.class);

  public static final String FUNCTION_NAME = "ingest";

  private static final String OPT_HELP = "h";
  private static final String OPT_INPUT = "i";
  private static final String OPT_FORMAT = "f";
  private static final String OPT_SUBJECT = "s";
  private static final String OPT_CONCURRENCY = "c";
  private static final String OPT_INDEX = "x";
  private static final String OPT_HOSTS = "H";

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
      formatter.printHelp(Ingest.FUNCTION_NAME + " [options]",
          "\nReads records from a file (or stdin), translates their values to row identifiers and sets the "
              + "corresponding bits and values in the index.\n\n",
          cliOpt, "");
      return;
    }

    File inputFile = null;
    if (cmd.hasOption(OPT_INPUT) && !"-".equals(cmd.getOptionValue(OPT_INPUT))) {
      inputFile = new File(cmd.getOptionValue(OPT_INPUT));
      if (!inputFile.isFile()) {
        logger.error("{} does not exist or is a directory.", inputFile.getAbsolutePath());
        return;
      }
    }

    String format = cmd.getOptionValue(OPT_FORMAT, IngestImplementation.FORMAT_JSON);
    if (!IngestImplementation.FORMAT_JSON.equals(format) && !IngestImplementation.FORMAT_CSV.equals(format)) {
      logger.error("Unknown format '{}'.", format);
      return;
    }

    Integer concurrency = null;
    if (cmd.hasOption(OPT_CONCURRENCY)) {
      try {
        concurrency = Integer.parseInt(cmd.getOptionValue(OPT_CONCURRENCY));
      } catch (NumberFormatException e) {
        logger.error("Invalid concurrency '{}'.", cmd.getOptionValue(OPT_CONCURRENCY));
        return;
      }
    }

    new IngestImplementation(inputFile, format, cmd.getOptionValue(OPT_SUBJECT), concurrency,
        cmd.getOptionValue(OPT_HOSTS), cmd.getOptionValue(OPT_INDEX)).ingest();
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_INPUT).longOpt("input").numberOfArgs(1).argName("file")
        .desc("The input file to read from, '-' or none for stdin.").build());
    res.addOption(Option.builder(OPT_FORMAT).longOpt("format").numberOfArgs(1).argName("json|csv")
        .desc("Format of the input (default: json).").build());
    res.addOption(Option.builder(OPT_SUBJECT).longOpt("subject").numberOfArgs(1).argName("property")
        .desc("Dot separated path of the property identifying a record. If not set, records are numbered.").build());
    res.addOption(Option.builder(OPT_CONCURRENCY).longOpt("concurrency").numberOfArgs(1).argName("n")
        .desc("Number of threads parsing and mapping records.").build());
    res.addOption(Option.builder(OPT_INDEX).longOpt("index").numberOfArgs(1).argName("name")
        .desc("Name of the index to import into.").build());
    res.addOption(Option.builder(OPT_HOSTS).longOpt("hosts").numberOfArgs(1).argName("host:port,...")
        .desc("Index servers to connect to.").build());
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
