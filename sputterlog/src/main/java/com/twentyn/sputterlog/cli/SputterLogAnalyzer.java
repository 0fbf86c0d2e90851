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

import com.twentyn.sputterlog.LogProcessingException;
import com.twentyn.sputterlog.SputterLogReader;
import com.twentyn.sputterlog.SputterLogResult;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.report.JsonReportSink;
import com.twentyn.sputterlog.report.ReportSink;
import com.twentyn.sputterlog.report.TextReportSink;
import com.twentyn.sputterlog.report.TimelineWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.apache.commons.io.filefilter.SuffixFileFilter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileFilter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Derives the process quantities of one sputter log or of every log in a directory, writing one report per log.
 */
public class SputterLogAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SputterLogAnalyzer.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_OUTPUT_DIR = "o";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_TEXT_REPORT = "t";
  public static final String OPTION_TIMELINE = "l";

  public static final String LOG_FILE_EXTENSION = ".CSV";
  public static final String TIMELINE_SUFFIX = "_timeline.tsv";

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("log file or directory")
        .desc("A sputter log CSV, or a directory whose *.CSV files are all processed")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT_DIR)
        .argName("directory")
        .desc("Where to write the reports (default: the directory of the input logs)")
        .hasArg()
        .longOpt("output-dir")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("thresholds json")
        .desc("Segmentation thresholds overriding the packaged defaults")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_TEXT_REPORT)
        .desc("Also write a human readable report next to the JSON one")
        .longOpt("text")
    );
    add(Option.builder(OPTION_TIMELINE)
        .desc("Also write a TSV timeline of every event occurrence")
        .longOpt("timeline")
    );
  }};

  public static final String HELP_MESSAGE = StringUtils.join(
      "This class segments sputter deposition logs into process events (source ramp up, presputtering, ",
      "deposition, rate measurements, substrate ramps) and writes the derived quantities of each log as JSON.");

  private static final CLIUtil CLI_UTIL = new CLIUtil(SputterLogAnalyzer.class, HELP_MESSAGE, OPTION_BUILDERS);

  private final SputterLogReader reader;
  private final List<ReportSink> sinks;
  private final File timelineDir;

  /**
   * @param timelineDir where to write the timelines, or null to skip them
   */
  public SputterLogAnalyzer(SputterLogReader reader, List<ReportSink> sinks, File timelineDir) {
    this.reader = reader;
    this.sinks = sinks;
    this.timelineDir = timelineDir;
  }

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    File input = new File(cl.getOptionValue(OPTION_INPUT));
    if (!input.exists()) {
      CLI_UTIL.failWithMessage("Input %s does not exist", input.getAbsolutePath());
    }
    List<File> logs = findLogs(input);
    if (logs.isEmpty()) {
      CLI_UTIL.failWithMessage("No %s log found in %s", LOG_FILE_EXTENSION, input.getAbsolutePath());
    }

    File outputDir = cl.hasOption(OPTION_OUTPUT_DIR) ? new File(cl.getOptionValue(OPTION_OUTPUT_DIR))
        : (input.isDirectory() ? input : input.getAbsoluteFile().getParentFile());
    if (!outputDir.exists() && !outputDir.mkdirs()) {
      CLI_UTIL.failWithMessage("Unable to create output directory %s", outputDir.getAbsolutePath());
    }

    SegmentationThresholds thresholds;
    if (cl.hasOption(OPTION_CONFIG)) {
      File config = new File(cl.getOptionValue(OPTION_CONFIG));
      LOGGER.info("Loading segmentation thresholds from %s", config.getAbsolutePath());
      thresholds = SegmentationThresholds.fromFile(config);
    } else {
      thresholds = SegmentationThresholds.loadDefaults();
    }

    List<ReportSink> sinks = new ArrayList<>();
    sinks.add(new JsonReportSink(outputDir));
    if (cl.hasOption(OPTION_TEXT_REPORT)) {
      sinks.add(new TextReportSink(outputDir));
    }
    File timelineDir = cl.hasOption(OPTION_TIMELINE) ? outputDir : null;

    SputterLogAnalyzer analyzer = new SputterLogAnalyzer(new SputterLogReader(thresholds), sinks, timelineDir);
    int failures = analyzer.processAll(logs);
    if (failures > 0) {
      LOGGER.error("%d of %d logs failed", failures, logs.size());
      System.exit(1);
    }
    LOGGER.info("Processed %d logs", logs.size());
  }

  /** The input itself if it is a file, otherwise the *.CSV files of the directory sorted by name. */
  public static List<File> findLogs(File input) {
    if (!input.isDirectory()) {
      return Collections.singletonList(input);
    }
    File[] files = input.listFiles((FileFilter) new SuffixFileFilter(LOG_FILE_EXTENSION, IOCase.INSENSITIVE));
    if (files == null) {
      return Collections.emptyList();
    }
    List<File> logs = new ArrayList<>(Arrays.asList(files));
    Collections.sort(logs);
    return logs;
  }

  /**
   * Processes every log independently; a log that fails is logged with its stage and does not stop the others.
   *
   * @return the number of logs that failed
   */
  public int processAll(List<File> logs) {
    int failures = 0;
    for (File log : logs) {
      try {
        process(log);
      } catch (LogProcessingException e) {
        LOGGER.error("Failed to process %s at stage %s: %s", log.getName(), e.getStage(), e.getMessage());
        failures++;
      } catch (IOException e) {
        LOGGER.error("I/O error while processing %s: %s", log.getName(), e.getMessage());
        failures++;
      }
    }
    return failures;
  }

  public SputterLogResult process(File log) throws IOException, LogProcessingException {
    LOGGER.info("Processing %s", log.getAbsolutePath());
    SputterLogResult result = reader.read(log);
    for (ReportSink sink : sinks) {
      sink.write(result.getLogName(), result.getMainParameters(), result.getStepParameters());
    }
    if (timelineDir != null) {
      File out = new File(timelineDir, FilenameUtils.getBaseName(log.getName()) + TIMELINE_SUFFIX);
      try (TimelineWriter writer = new TimelineWriter()) {
        writer.open(out);
        writer.append(result.getTimeline());
      }
      LOGGER.info("Wrote timeline of %s to %s", log.getName(), out.getAbsolutePath());
    }
    return result;
  }
}
