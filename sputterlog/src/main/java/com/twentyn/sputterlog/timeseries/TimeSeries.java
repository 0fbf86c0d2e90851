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

import org.joda.time.DateTimeZone;
import org.joda.time.LocalDateTime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A column-oriented, timezone-naive time series.  Timestamps are stored as milliseconds of the wall clock reading
 * interpreted in UTC, so arithmetic on them never crosses a DST boundary.  A column is either numeric (booleans are
 * stored as 1/0, empty cells as NaN) or text.  Missing channels are simply absent.
 */
public class TimeSeries {
  private final long[] times;
  private final LinkedHashMap<String, double[]> numericColumns;
  private final LinkedHashMap<String, String[]> textColumns;

  public TimeSeries(long[] times, Map<String, double[]> numericColumns, Map<String, String[]> textColumns) {
    for (int i = 1; i < times.length; i++) {
      if (times[i] < times[i - 1]) {
        throw new IllegalArgumentException(String.format(
            "Timestamps must be non-decreasing, but sample %d precedes sample %d", i, i - 1));
      }
    }
    this.times = times;
    this.numericColumns = new LinkedHashMap<>();
    this.textColumns = new LinkedHashMap<>();
    for (Map.Entry<String, double[]> entry : numericColumns.entrySet()) {
      putNumeric(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String[]> entry : textColumns.entrySet()) {
      putText(entry.getKey(), entry.getValue());
    }
  }

  public static long toMillis(LocalDateTime time) {
    return time.toDateTime(DateTimeZone.UTC).getMillis();
  }

  public static LocalDateTime toLocalDateTime(long millis) {
    return new LocalDateTime(millis, DateTimeZone.UTC);
  }

  public int size() {
    return times.length;
  }

  public long getTime(int row) {
    return times[row];
  }

  public LocalDateTime getTimestamp(int row) {
    return toLocalDateTime(times[row]);
  }

  public long getStartTime() {
    return times[0];
  }

  public long getEndTime() {
    return times[times.length - 1];
  }

  public long[] getTimes() {
    return times;
  }

  /**
   * Mean interval between consecutive samples of the whole series, in milliseconds.
   */
  public double averageTimestep() {
    if (times.length < 2) {
      throw new IllegalStateException("At least two samples are needed to compute an average timestep");
    }
    return (double) (times[times.length - 1] - times[0]) / (times.length - 1);
  }

  public boolean hasColumn(String name) {
    return numericColumns.containsKey(name) || textColumns.containsKey(name);
  }

  public boolean hasNumeric(String name) {
    return numericColumns.containsKey(name);
  }

  public boolean hasText(String name) {
    return textColumns.containsKey(name);
  }

  /**
   * @return the column values, or null if the log does not contain this numeric channel.
   */
  public double[] getNumeric(String name) {
    return numericColumns.get(name);
  }

  public String[] getText(String name) {
    return textColumns.get(name);
  }

  /**
   * Renders a cell of either kind as a string; integral numbers lose their trailing ".0".  Returns null for absent
   * columns and empty cells.
   */
  public String getCellAsString(String name, int row) {
    if (textColumns.containsKey(name)) {
      return textColumns.get(name)[row];
    }
    double[] values = numericColumns.get(name);
    if (values == null || Double.isNaN(values[row])) {
      return null;
    }
    double v = values[row];
    if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) {
      return Long.toString((long) v);
    }
    return Double.toString(v);
  }

  /** All column names, numeric first, in the order they were added. */
  public List<String> getColumnNames() {
    List<String> names = new ArrayList<>(numericColumns.keySet());
    names.addAll(textColumns.keySet());
    return Collections.unmodifiableList(names);
  }

  public void putNumeric(String name, double[] values) {
    checkLength(name, values.length);
    textColumns.remove(name);
    numericColumns.put(name, values);
  }

  public void putText(String name, String[] values) {
    checkLength(name, values.length);
    numericColumns.remove(name);
    textColumns.put(name, values);
  }

  /**
   * Renames a column in place, keeping its position.  Returns false if the source column is absent.
   */
  public boolean renameColumn(String from, String to) {
    if (numericColumns.containsKey(from)) {
      LinkedHashMap<String, double[]> renamed = new LinkedHashMap<>();
      for (Map.Entry<String, double[]> entry : numericColumns.entrySet()) {
        renamed.put(entry.getKey().equals(from) ? to : entry.getKey(), entry.getValue());
      }
      numericColumns.clear();
      numericColumns.putAll(renamed);
      return true;
    }
    if (textColumns.containsKey(from)) {
      LinkedHashMap<String, String[]> renamed = new LinkedHashMap<>();
      for (Map.Entry<String, String[]> entry : textColumns.entrySet()) {
        renamed.put(entry.getKey().equals(from) ? to : entry.getKey(), entry.getValue());
      }
      textColumns.clear();
      textColumns.putAll(renamed);
      return true;
    }
    return false;
  }

  /** Deep enough copy that adding or renaming columns on the result leaves this series untouched. */
  public TimeSeries copy() {
    return new TimeSeries(Arrays.copyOf(times, times.length), numericColumns, textColumns);
  }

  private void checkLength(String name, int length) {
    if (length != times.length) {
      throw new IllegalArgumentException(String.format(
          "Column '%s' has %d values but the series has %d samples", name, length, times.length));
    }
  }
}
