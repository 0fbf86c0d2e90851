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

import org.apache.commons.lang3.StringUtils;
import org.joda.time.Duration;
import org.joda.time.LocalDateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Human readable rendering of a report mapping: one {@code key: value} line per entry, nested sections indented by
 * two spaces.
 */
public class TextReport {
  private static final String INDENT = "  ";
  private static final DateTimeFormatter FULL_TIME_FORMATTER = DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter CLOCK_TIME_FORMATTER = DateTimeFormat.forPattern("HH:mm:ss");
  // Only the log bounds carry their date; every other time is on the day of the run.
  private static final Set<String> FULL_TIME_KEYS = new HashSet<>(Arrays.asList("log_start_time", "log_end_time"));

  private TextReport() {
  }

  public static String render(String logName, MainParameters mainParameters, List<StepParameters> stepParameters) {
    StringBuilder sb = new StringBuilder();
    sb.append("Sputter log: ").append(logName).append('\n');
    sb.append('\n').append("Main parameters").append('\n');
    render(sb, mainParameters.toReportMap(), 1);
    sb.append('\n').append("Process steps").append('\n');
    render(sb, StepParameters.toReportMap(stepParameters), 1);
    return sb.toString();
  }

  public static String render(Map<String, Object> map) {
    StringBuilder sb = new StringBuilder();
    render(sb, map, 0);
    return sb.toString();
  }

  @SuppressWarnings("unchecked")
  private static void render(StringBuilder sb, Map<String, Object> map, int depth) {
    String indent = StringUtils.repeat(INDENT, depth);
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Map) {
        sb.append(indent).append(entry.getKey()).append(':').append('\n');
        render(sb, (Map<String, Object>) value, depth + 1);
      } else {
        sb.append(indent).append(entry.getKey()).append(": ").append(formatValue(entry.getKey(), value)).append('\n');
      }
    }
  }

  static String formatValue(String key, Object value) {
    if (value instanceof Duration) {
      return formatDuration((Duration) value);
    }
    if (value instanceof LocalDateTime) {
      DateTimeFormatter formatter = FULL_TIME_KEYS.contains(key) ? FULL_TIME_FORMATTER : CLOCK_TIME_FORMATTER;
      return formatter.print((LocalDateTime) value);
    }
    return String.valueOf(value);
  }

  /** {@code HH:MM:SS}, hours not wrapping at a day; negative durations get a leading minus sign. */
  public static String formatDuration(Duration duration) {
    long seconds = duration.getStandardSeconds();
    String sign = seconds < 0 ? "-" : "";
    seconds = Math.abs(seconds);
    return String.format("%s%02d:%02d:%02d", sign, seconds / 3600, (seconds % 3600) / 60, seconds % 60);
  }
}
