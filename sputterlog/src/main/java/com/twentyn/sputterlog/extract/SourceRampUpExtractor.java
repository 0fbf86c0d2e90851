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
import com.twentyn.sputterlog.condition.ConditionBuilder;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.report.SourceRampUpParameters;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.TimeSeries;

import java.util.LinkedHashMap;
import java.util.Map;

public class SourceRampUpExtractor {

  public Map<Integer, SourceRampUpParameters> extract(ExtractionContext ctx) {
    Map<Integer, SourceRampUpParameters> result = new LinkedHashMap<>();
    for (int source : ctx.getSources()) {
      LogEvent rampUp = ctx.getEvent(EventCategory.SOURCE_RAMP_UP, source);
      boolean enabled = ctx.getDepositionParameters().isSourceEnabled(source);
      SourceRampUpParameters params = new SourceRampUpParameters(source, enabled);
      if (enabled) {
        params.setNumEvents(ctx.getDetectedCount(rampUp));
        if (!rampUp.isEmpty()) {
          extractIgnition(ctx, source, rampUp, params);
          params.setRampRate(PhaseStatistics.slopePerMinute(ctx.getSeries(),
              Channels.source(source, Channels.OUTPUT_SETPOINT), rampUp.getRows()));
        }
      }
      result.put(source, params);
    }
    return result;
  }

  /**
   * The plasma ignites at the first sample with current or bias between the start of the last ramp and the start of
   * the deposition.
   */
  private void extractIgnition(ExtractionContext ctx, int source, LogEvent rampUp, SourceRampUpParameters params) {
    TimeSeries series = ctx.getSeries();
    ConditionBuilder conditions = ctx.conditions();
    long windowStart = rampUp.getDomains().get(rampUp.getNumEvents() - 1).getStart();
    long windowEnd = ctx.getDeposition().getStart();

    Condition window = conditions.after(windowStart - 1).and(conditions.before(windowEnd + 1));
    SegmentationThresholds thresholds = ctx.getThresholds();
    Condition lit = conditions.above(Channels.source(source, Channels.CURRENT), thresholds.getCurrentThreshold())
        .or(conditions.above(Channels.source(source, Channels.DC_BIAS), thresholds.getBiasThreshold()));
    int row = lit.and(window).firstIndex();
    if (row < 0) {
      params.setNoIgnition();
      return;
    }
    Condition ignition = singleRow(series.size(), row);
    params.setIgnition(series.getTimestamp(row),
        ChannelStatistics.first(series, Channels.source(source, Channels.OUTPUT_SETPOINT), ignition),
        ChannelStatistics.first(series, Channels.CAPMAN_PRESSURE, ignition));
  }

  private static Condition singleRow(int size, int row) {
    boolean[] mask = new boolean[size];
    mask[row] = true;
    return Condition.of(mask);
  }
}
