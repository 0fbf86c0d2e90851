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
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.report.DepositionParameters;
import com.twentyn.sputterlog.report.ReportMaps;
import com.twentyn.sputterlog.report.SubstrateRampDownParameters;
import com.twentyn.sputterlog.report.SubstrateRampUpParameters;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.joda.time.LocalDateTime;

/**
 * Heating before and cooling after a heated deposition.  Nothing is reported for room temperature depositions.
 */
public class SubstrateRampExtractor {

  /**
   * @return the heating ramp quantities, or null for a room temperature deposition or when no ramp was found
   */
  public SubstrateRampUpParameters extractRampUp(ExtractionContext ctx) {
    DepositionParameters deposition = ctx.getDepositionParameters();
    LogEvent rampUp = ctx.getEvent(EventCategory.SUBSTRATE_RAMP_UP);
    if (deposition.getTemperatureRegime() == TemperatureRegime.ROOM_TEMPERATURE || rampUp.isEmpty()) {
      return null;
    }
    TimeSeries series = ctx.getSeries();
    Condition rows = rampUp.getRows();

    SubstrateRampUpParameters params = new SubstrateRampUpParameters(ctx.getDetectedCount(rampUp));
    LocalDateTime end = series.getTimestamp(rows.lastIndex());
    params.setBounds(series.getTimestamp(rows.firstIndex()), end);
    params.setTempSlope(PhaseStatistics.slopePerMinute(series, Channels.HEATER_SETPOINT, rows));
    params.setTimePlateau(ReportMaps.between(end, deposition.getStartTime()));
    params.setAvgCapmanPressure(ChannelStatistics.mean(series, Channels.CAPMAN_PRESSURE, rows));
    params.setFlows(PhaseStatistics.gasFlows(ctx, rows));
    params.setCracker(PhaseStatistics.cracker(ctx, rows));
    return params;
  }

  /**
   * The ramp down starts with its high temperature phase, or with the first cooling sample if there is none, and
   * ends with the low temperature phase, or the high temperature phase if the log stops before.
   *
   * @return the cooling ramp quantities, or null for a room temperature deposition or when no ramp was found
   */
  public SubstrateRampDownParameters extractRampDown(ExtractionContext ctx) {
    DepositionParameters deposition = ctx.getDepositionParameters();
    LogEvent rampDown = ctx.getEvent(EventCategory.SUBSTRATE_RAMP_DOWN);
    if (deposition.getTemperatureRegime() == TemperatureRegime.ROOM_TEMPERATURE || rampDown.isEmpty()) {
      return null;
    }
    TimeSeries series = ctx.getSeries();
    LogEvent high = ctx.getEvent(EventCategory.SUBSTRATE_RAMP_DOWN_HIGH);
    LogEvent low = ctx.getEvent(EventCategory.SUBSTRATE_RAMP_DOWN_LOW);
    Condition coolingRows = rampDown.getRows();
    Condition highRows = high.getRows();
    Condition lowRows = low.getRows();

    SubstrateRampDownParameters params = new SubstrateRampDownParameters(
        ctx.getDetectedCount(rampDown), ctx.getDetectedCount(high), ctx.getDetectedCount(low));

    Double slope = PhaseStatistics.slopePerMinute(series, Channels.HEATER_SETPOINT, coolingRows);
    params.setTempSlope(slope == null ? null : -slope);

    int startRow = highRows.any() ? highRows.firstIndex() : coolingRows.firstIndex();
    int endRow;
    if (lowRows.any()) {
      endRow = lowRows.lastIndex();
    } else if (highRows.any()) {
      endRow = highRows.lastIndex();
    } else {
      endRow = coolingRows.lastIndex();
    }
    LocalDateTime start = series.getTimestamp(startRow);
    params.setBounds(start, series.getTimestamp(endRow));
    params.setTimePlateau(ReportMaps.between(deposition.getEndTime(), start));

    if (highRows.any()) {
      params.setFlows(PhaseStatistics.gasFlows(ctx, highRows));
      params.setCracker(PhaseStatistics.cracker(ctx, highRows));
      params.setAnionInputCutoff(ChannelStatistics.last(series, Channels.HEATER_SETPOINT, highRows),
          series.getTimestamp(highRows.lastIndex()));
    }
    return params;
  }
}
