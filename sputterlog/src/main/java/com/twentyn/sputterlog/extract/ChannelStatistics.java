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

package com.twentyn.sputterlog.extract;

import com.twentyn.sputterlog.condition.Condition;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Summary statistics of a channel over the samples selected by a condition.  NaN samples are skipped.  Every method
 * returns null when the channel is absent or no selected sample carries a value, so that callers can omit the field.
 */
public class ChannelStatistics {
  private ChannelStatistics() {
  }

  public static Double mean(TimeSeries series, String channel, Condition rows) {
    DescriptiveStatistics stats = statistics(series, channel, rows);
    return stats == null ? null : stats.getMean();
  }

  /**
   * Finite values of {@code channel} on the selected samples, or null when the channel is absent or none of the
   * selected samples carries a value.
   */
  private static DescriptiveStatistics statistics(TimeSeries series, String channel, Condition rows) {
    double[] values = series.getNumeric(channel);
    if (values == null) {
      return null;
    }
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (int i : rows.indices()) {
      if (!Double.isNaN(values[i])) {
        stats.addValue(values[i]);
      }
    }
    return stats.getN() == 0 ? null : stats;
  }

  /**
   * Mean of the samples above {@code threshold}, 0 if there are none.  Used for gas flows, where readings below the
   * noise level of the flow controller mean the gas was off.
   */
  public static Double meanAbove(TimeSeries series, String channel, Condition rows, double threshold) {
    double[] values = series.getNumeric(channel);
    if (values == null) {
      return null;
    }
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (int i : rows.indices()) {
      if (values[i] > threshold) {
        stats.addValue(values[i]);
      }
    }
    return stats.getN() == 0 ? 0.0 : stats.getMean();
  }

  public static Double min(TimeSeries series, String channel, Condition rows) {
    DescriptiveStatistics stats = statistics(series, channel, rows);
    return stats == null ? null : stats.getMin();
  }

  /** Smallest strictly positive value; gauges report 0 or less when they are off. */
  public static Double minPositive(TimeSeries series, String channel, Condition rows) {
    double[] values = series.getNumeric(channel);
    if (values == null) {
      return null;
    }
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (int i : rows.indices()) {
      if (values[i] > 0.0) {
        stats.addValue(values[i]);
      }
    }
    return stats.getN() == 0 ? null : stats.getMin();
  }

  public static Double max(TimeSeries series, String channel, Condition rows) {
    DescriptiveStatistics stats = statistics(series, channel, rows);
    return stats == null ? null : stats.getMax();
  }

  /** Population standard deviation. */
  public static Double std(TimeSeries series, String channel, Condition rows) {
    DescriptiveStatistics stats = statistics(series, channel, rows);
    return stats == null ? null : Math.sqrt(stats.getPopulationVariance());
  }

  public static Double first(TimeSeries series, String channel, Condition rows) {
    double[] values = series.getNumeric(channel);
    int row = rows.firstIndex();
    if (values == null || row < 0 || Double.isNaN(values[row])) {
      return null;
    }
    return values[row];
  }

  public static Double last(TimeSeries series, String channel, Condition rows) {
    double[] values = series.getNumeric(channel);
    int row = rows.lastIndex();
    if (values == null || row < 0 || Double.isNaN(values[row])) {
      return null;
    }
    return values[row];
  }

  /** Mean of the first {@code count} selected samples (at least one). */
  public static Double meanOfFirst(TimeSeries series, String channel, Condition rows, int count) {
    int[] indices = rows.indices();
    return meanOfRange(series.getNumeric(channel), indices, 0, Math.min(indices.length, Math.max(1, count)));
  }

  /** Mean of the last {@code count} selected samples (at least one). */
  public static Double meanOfLast(TimeSeries series, String channel, Condition rows, int count) {
    int[] indices = rows.indices();
    int n = Math.min(indices.length, Math.max(1, count));
    return meanOfRange(series.getNumeric(channel), indices, indices.length - n, indices.length);
  }

  private static Double meanOfRange(double[] values, int[] indices, int from, int to) {
    if (values == null) {
      return null;
    }
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (int k = from; k < to; k++) {
      double v = values[indices[k]];
      if (!Double.isNaN(v)) {
        stats.addValue(v);
      }
    }
    return stats.getN() == 0 ? null : stats.getMean();
  }

  /**
   * Share of the selected samples on which {@code condition} holds; 0 when nothing is selected.
   */
  public static double fraction(Condition condition, Condition rows) {
    int total = rows.count();
    return total == 0 ? 0.0 : (double) condition.and(rows).count() / total;
  }

  /** Whether {@code condition} holds on every selected sample, and at least one sample is selected. */
  public static boolean holdsThroughout(Condition condition, Condition rows) {
    int total = rows.count();
    return total > 0 && condition.and(rows).count() == total;
  }

  /** The value of a cell of either kind at the first selected sample, or null. */
  public static String firstText(TimeSeries series, String channel, Condition rows) {
    int row = rows.firstIndex();
    return row < 0 ? null : series.getCellAsString(channel, row);
  }
}
