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
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.report.CrackerParameters;
import com.twentyn.sputterlog.report.GasFlows;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.Gas;
import com.twentyn.sputterlog.timeseries.TimeSeries;

/**
 * Blocks of quantities reported identically for several process phases.
 */
class PhaseStatistics {
  private PhaseStatistics() {
  }

  static GasFlows gasFlows(ExtractionContext ctx, Condition rows) {
    TimeSeries series = ctx.getSeries();
    double threshold = ctx.getThresholds().getMfcFlowThreshold();
    return new GasFlows(
        ChannelStatistics.meanAbove(series, Gas.AR.flowChannel(), rows, threshold),
        ChannelStatistics.meanAbove(series, Gas.H2S.flowChannel(), rows, threshold),
        ChannelStatistics.meanAbove(series, Gas.PH3.flowChannel(), rows, threshold));
  }

  /**
   * The cracker counts as used when it was on and open on every sample of the phase; its settings are then averaged
   * over the phase.
   */
  static CrackerParameters cracker(ExtractionContext ctx, Condition rows) {
    TimeSeries series = ctx.getSeries();
    if (!series.hasNumeric(Channels.CRACKER_ZONE_1_TEMP)) {
      return CrackerParameters.disabled();
    }
    Condition crackerOn = ctx.getEvent(EventCategory.CRACKER_ON_OPEN).getCondition();
    if (!ChannelStatistics.holdsThroughout(crackerOn, rows)) {
      return CrackerParameters.disabled();
    }
    CrackerParameters cracker = new CrackerParameters(true);
    cracker.setZoneTemps(
        ChannelStatistics.mean(series, Channels.CRACKER_ZONE_1_TEMP, rows),
        ChannelStatistics.mean(series, Channels.CRACKER_ZONE_2_TEMP, rows),
        ChannelStatistics.mean(series, Channels.CRACKER_ZONE_3_TEMP, rows));
    cracker.setPulseWidth(ChannelStatistics.mean(series, Channels.CRACKER_PULSE_WIDTH, rows));
    cracker.setPulseFrequency(ChannelStatistics.mean(series, Channels.CRACKER_VALVE_SETPOINT, rows));
    return cracker;
  }

  /** Change rate of a channel between the first and last selected samples, per minute. */
  static Double slopePerMinute(TimeSeries series, String channel, Condition rows) {
    Double first = ChannelStatistics.first(series, channel, rows);
    Double last = ChannelStatistics.last(series, channel, rows);
    if (first == null || last == null) {
      return null;
    }
    long millis = series.getTime(rows.lastIndex()) - series.getTime(rows.firstIndex());
    if (millis <= 0) {
      return null;
    }
    return (last - first) / (millis / 60000.0);
  }

  static boolean flowing(Double flow, SegmentationThresholds thresholds) {
    return flow != null && flow > thresholds.getMfcFlowThreshold();
  }
}
