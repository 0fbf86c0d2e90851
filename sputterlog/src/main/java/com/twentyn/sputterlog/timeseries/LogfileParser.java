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

package com.twentyn.sputterlog.timeseries;

import com.twentyn.sputterlog.LogProcessingException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.joda.time.LocalDateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * Reads the CSV recording sets written by the deposition chamber's process computer.  Lines above the header (the
 * one containing a "Time Stamp" cell) are skipped, as are non-timestamped unit rows right below it.
 */
public class LogfileParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LogfileParser.class);

  public static final String STAGE = "load";

  // e.g. "Aug-02-2024 10:52:28.123456 AM".  Joda keeps millisecond precision, extra digits are truncated.
  public static final DateTimeFormatter TIME_STAMP_FORMATTER =
      DateTimeFormat.forPattern("MMM-dd-yyyy hh:mm:ss.SSSSSS a").withLocale(Locale.US);
  // Some older recording sets drop the fractional seconds.
  private static final DateTimeFormatter TIME_STAMP_FORMATTER_NO_FRACTION =
      DateTimeFormat.forPattern("MMM-dd-yyyy hh:mm:ss a").withLocale(Locale.US);

  public static final CSVFormat LOG_FORMAT = CSVFormat.DEFAULT.
      withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true);

  private static final String[][] LEGACY_CRACKER_RENAMES = new String[][] {
      {Channels.LEGACY_CRACKER_PULSE_WIDTH, Channels.CRACKER_PULSE_WIDTH},
      {Channels.LEGACY_CRACKER_VALVE_SETPOINT, Channels.CRACKER_VALVE_SETPOINT},
  };

  public TimeSeries parse(File file) throws IOException, LogProcessingException {
    try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
      return parse(reader, file.getName());
    }
  }

  public TimeSeries parse(Reader reader, String logName) throws IOException, LogProcessingException {
    List<String> header = null;
    int timeStampIndex = -1;
    List<LocalDateTime> timestamps = new ArrayList<>();
    List<String[]> rows = new ArrayList<>();

    try (CSVParser parser = new CSVParser(reader, LOG_FORMAT)) {
      for (CSVRecord record : parser) {
        if (header == null) {
          int index = indexOf(record, Channels.TIME_STAMP);
          if (index >= 0) {
            header = new ArrayList<>(record.size());
            for (String cell : record) {
              header.add(cell.trim());
            }
            timeStampIndex = index;
          } else {
            LOGGER.debug("Skipping preamble line %d of %s", record.getRecordNumber(), logName);
          }
          continue;
        }

        String cell = record.size() > timeStampIndex ? record.get(timeStampIndex) : "";
        LocalDateTime timestamp = parseTimeStamp(cell);
        if (timestamp == null) {
          if (rows.isEmpty()) {
            LOGGER.debug("Skipping unit row %d of %s", record.getRecordNumber(), logName);
            continue;
          }
          throw new LogProcessingException(STAGE, logName, String.format(
              "unparseable time stamp '%s' on record %d", cell, record.getRecordNumber()));
        }
        String[] values = new String[header.size()];
        for (int i = 0; i < header.size() && i < record.size(); i++) {
          values[i] = record.get(i);
        }
        timestamps.add(timestamp);
        rows.add(values);
      }
    }

    if (header == null) {
      throw new LogProcessingException(STAGE, logName, String.format("no '%s' column found", Channels.TIME_STAMP));
    }
    if (rows.isEmpty()) {
      throw new LogProcessingException(STAGE, logName, "the log contains no samples");
    }

    Integer[] order = sortedOrder(timestamps, logName);
    long[] times = new long[order.length];
    for (int i = 0; i < order.length; i++) {
      times[i] = TimeSeries.toMillis(timestamps.get(order[i]));
    }

    LinkedHashMap<String, double[]> numeric = new LinkedHashMap<>();
    LinkedHashMap<String, String[]> text = new LinkedHashMap<>();
    for (int col = 0; col < header.size(); col++) {
      String name = header.get(col);
      if (col == timeStampIndex || name.isEmpty()) {
        continue;
      }
      if (numeric.containsKey(name) || text.containsKey(name)) {
        LOGGER.warn("Duplicate column '%s' in %s, keeping the first one", name, logName);
        continue;
      }
      String[] cells = new String[order.length];
      for (int i = 0; i < order.length; i++) {
        cells[i] = rows.get(order[i])[col];
      }
      double[] values = parseNumeric(cells);
      if (values != null) {
        numeric.put(name, values);
      } else {
        for (int i = 0; i < cells.length; i++) {
          cells[i] = StringUtils.trimToNull(cells[i]);
        }
        text.put(name, cells);
      }
    }

    TimeSeries series = new TimeSeries(times, numeric, text);
    renameLegacyCrackerColumns(series);
    LOGGER.info("Read %d samples and %d channels from %s", series.size(), series.getColumnNames().size(), logName);
    return series;
  }

  /**
   * Harmonizes the cracker valve columns of logs recorded before the feedback channels existed.  A legacy column is
   * only renamed when its canonical counterpart is absent; logs carrying both are left as they are.
   */
  public static void renameLegacyCrackerColumns(TimeSeries series) {
    for (String[] rename : LEGACY_CRACKER_RENAMES) {
      if (!series.hasColumn(rename[1]) && series.renameColumn(rename[0], rename[1])) {
        LOGGER.info("Renamed legacy column '%s' to '%s'", rename[0], rename[1]);
      }
    }
  }

  public static LocalDateTime parseTimeStamp(String cell) {
    if (StringUtils.isBlank(cell)) {
      return null;
    }
    String trimmed = cell.trim();
    for (DateTimeFormatter formatter : Arrays.asList(TIME_STAMP_FORMATTER, TIME_STAMP_FORMATTER_NO_FRACTION)) {
      try {
        return formatter.parseLocalDateTime(trimmed);
      } catch (IllegalArgumentException e) {
        LOGGER.trace("'%s' does not match %s", trimmed, formatter);
      }
    }
    return null;
  }

  /**
   * @return the parsed column, or null if any non-empty cell is neither a number nor a boolean.
   */
  static double[] parseNumeric(String[] cells) {
    double[] values = new double[cells.length];
    for (int i = 0; i < cells.length; i++) {
      String cell = StringUtils.trimToEmpty(cells[i]);
      if (cell.isEmpty()) {
        values[i] = Double.NaN;
      } else if ("TRUE".equalsIgnoreCase(cell)) {
        values[i] = 1.0;
      } else if ("FALSE".equalsIgnoreCase(cell)) {
        values[i] = 0.0;
      } else {
        try {
          values[i] = Double.parseDouble(cell);
        } catch (NumberFormatException e) {
          return null;
        }
      }
    }
    return values;
  }

  private static int indexOf(CSVRecord record, String name) {
    for (int i = 0; i < record.size(); i++) {
      if (name.equals(record.get(i).trim())) {
        return i;
      }
    }
    return -1;
  }

  private static Integer[] sortedOrder(List<LocalDateTime> timestamps, String logName) {
    Integer[] order = new Integer[timestamps.size()];
    boolean sorted = true;
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
      if (i > 0 && timestamps.get(i).isBefore(timestamps.get(i - 1))) {
        sorted = false;
      }
    }
    if (!sorted) {
      LOGGER.warn("Samples of %s are not in time order, sorting them", logName);
      // Arrays.sort on objects is stable, so samples sharing a time stamp keep their file order.
      Arrays.sort(order, Comparator.comparing(timestamps::get));
    }
    return order;
  }
}
