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

package com.twentyn.sputterlog.report;

import com.twentyn.sputterlog.event.Domain;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.timeseries.Channels;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one TSV row per event occurrence, for plotting a run on a time axis.  Events must be unfolded first (see
 * {@link com.twentyn.sputterlog.event.EventRefiner#unfoldEvents}) so that each carries a single domain.
 */
public class TimelineWriter implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  public enum TIMELINE_FIELD {
    NAME("name"),
    CATEGORY("category"),
    STEP_ID("step_id"),
    START("start"),
    END("end"),
    DURATION_S("duration_s"),
    MEAN_TEMPERATURE("mean_temperature"),
    MEAN_PRESSURE("mean_pressure"),
    ;

    private final String columnName;

    TIMELINE_FIELD(String columnName) {
      this.columnName = columnName;
    }

    public String getColumnName() {
      return columnName;
    }

    public static String[] header() {
      String[] header = new String[values().length];
      for (TIMELINE_FIELD f : values()) {
        header[f.ordinal()] = f.columnName;
      }
      return header;
    }
  }

  private static final DateTimeFormatter TIME_FORMATTER = ISODateTimeFormat.dateHourMinuteSecondMillis();

  private CSVPrinter printer;

  public void open(File f) throws IOException {
    open(new FileWriter(f));
  }

  public void open(Writer writer) throws IOException {
    printer = new CSVPrinter(writer, TSV_FORMAT.withHeader(TIMELINE_FIELD.header()));
  }

  public void append(LogEvent event) throws IOException {
    if (printer == null) {
      throw new IllegalStateException("Timeline writer has not been opened");
    }
    List<Domain> domains = event.getDomains();
    if (domains.size() != 1) {
      throw new IllegalArgumentException(String.format(
          "Event %s has %d domains, timelines take unfolded events", event.getName(), domains.size()));
    }
    Domain domain = domains.get(0);
    List<Object> vals = new ArrayList<>(TIMELINE_FIELD.values().length);
    vals.add(event.getName());
    vals.add(event.getCategory().getKey());
    vals.add(event.getStepId());
    vals.add(TIME_FORMATTER.print(domain.getStartTime()));
    vals.add(TIME_FORMATTER.print(domain.getEndTime()));
    vals.add(domain.getDurationMillis() / 1000.0);
    vals.add(formatMean(event.meanPerOccurrence(Channels.HEATER_TEMP_1)[0]));
    vals.add(formatMean(event.meanPerOccurrence(Channels.CAPMAN_PRESSURE)[0]));
    printer.printRecord(vals);
  }

  public void append(List<LogEvent> events) throws IOException {
    for (LogEvent event : events) {
      append(event);
    }
    printer.flush();
  }

  private static String formatMean(double mean) {
    return Double.isNaN(mean) ? "" : Double.toString(mean);
  }

  public void flush() throws IOException {
    printer.flush();
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }
}
