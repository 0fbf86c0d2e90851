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
import com.twentyn.sputterlog.report.DepositionParameters;
import com.twentyn.sputterlog.report.GasFlows;
import com.twentyn.sputterlog.report.SourceDepositionParameters;
import com.twentyn.sputterlog.report.VoltageStatistics;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Derives the deposition quantities, including what every source did while the substrate shutter was open.
 */
public class DepositionExtractor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DepositionExtractor.class);

  public DepositionParameters extract(ExtractionContext ctx) {
    TimeSeries series = ctx.getSeries();
    SegmentationThresholds thresholds = ctx.getThresholds();
    LogEvent deposition = ctx.getDeposition();
    Condition rows = deposition.getRows();

    DepositionParameters params = new DepositionParameters(
        temperatureRegime(ctx, rows),
        ctx.getDetectedCount(deposition),
        series.getTimestamp(rows.firstIndex()),
        series.getTimestamp(rows.lastIndex()));

    Double temp1 = ChannelStatistics.mean(series, Channels.HEATER_TEMP_1, rows);
    Double temp2 = ChannelStatistics.mean(series, Channels.HEATER_TEMP_2, rows);
    Double trueTemp = temp1 != null && temp2 != null ? ProcessPhysics.trueTemperature(temp1, temp2, thresholds) : null;
    params.setAvgTemps(temp1, temp2, ChannelStatistics.mean(series, Channels.HEATER_SETPOINT, rows), trueTemp);

    Double pressure = ChannelStatistics.mean(series, Channels.CAPMAN_PRESSURE, rows);
    params.setAvgCapmanPressure(pressure);
    GasFlows flows = PhaseStatistics.gasFlows(ctx, rows);
    params.setFlows(flows);
    if (pressure != null) {
      params.setPartialPressures(ProcessPhysics.partialPressures(zeroIfAbsent(flows.getAr()),
          zeroIfAbsent(flows.getH2s()), zeroIfAbsent(flows.getPh3()), pressure, thresholds));
    }
    params.setPlatenPosition(ChannelStatistics.mean(series, Channels.PLATEN_POSITION, rows));
    params.setCracker(PhaseStatistics.cracker(ctx, rows));

    for (int source : ctx.getSources()) {
      params.addSource(sourceParameters(ctx, source, rows));
    }

    LogEvent sulfurRate = ctx.getEvent(EventCategory.SULFUR_DEPOSITION_RATE_MEASUREMENT);
    if (!sulfurRate.isEmpty()) {
      params.setSulfurDepositionRate(ChannelStatistics.mean(series, Channels.THICKNESS_RATE, sulfurRate.getRows()));
    }
    return params;
  }

  private static double zeroIfAbsent(Double flow) {
    return flow == null ? 0.0 : flow;
  }

  /**
   * Room temperature when the heater was never under control or its setpoint stayed below the threshold for the
   * whole deposition, heated when it stayed above, mixed otherwise.
   */
  static TemperatureRegime temperatureRegime(ExtractionContext ctx, Condition rows) {
    double threshold = ctx.getThresholds().getRtTempThreshold();
    double[] setpoint = ctx.getSeries().getNumeric(Channels.HEATER_SETPOINT);
    if (setpoint == null) {
      return ctx.isTemperatureControlObserved() ? TemperatureRegime.MIXED : TemperatureRegime.ROOM_TEMPERATURE;
    }
    boolean allBelow = true;
    boolean allAbove = true;
    for (int i : rows.indices()) {
      allBelow &= setpoint[i] < threshold;
      allAbove &= setpoint[i] > threshold;
    }
    if (!ctx.isTemperatureControlObserved() || allBelow) {
      return TemperatureRegime.ROOM_TEMPERATURE;
    }
    return allAbove ? TemperatureRegime.HEATED : TemperatureRegime.MIXED;
  }

  private SourceDepositionParameters sourceParameters(ExtractionContext ctx, int source, Condition rows) {
    TimeSeries series = ctx.getSeries();
    ConditionBuilder conditions = ctx.conditions();
    boolean enabled = conditions.nonZero(Channels.source(source, Channels.ENABLED)).and(rows).any();
    SourceDepositionParameters params = new SourceDepositionParameters(source, enabled);
    if (!enabled) {
      return params;
    }

    params.setAvgOutputPower(ChannelStatistics.mean(series, Channels.source(source, Channels.OUTPUT_SETPOINT), rows));
    PlasmaType type = classifyPlasma(ctx, source, rows);
    params.setPlasmaType(type);
    if (type == PlasmaType.PULSED_DC) {
      params.setPulseFrequency(ChannelStatistics.mean(series, Channels.source(source, Channels.PULSE_FREQUENCY), rows));
      params.setDeadTime(ChannelStatistics.mean(series, Channels.source(source, Channels.REVERSE_TIME), rows));
    }
    if (type != null) {
      String channel = Channels.source(source, type.isRf() ? Channels.DC_BIAS : Channels.VOLTAGE);
      params.setVoltage(voltageStatistics(series, channel, rows, ctx.getThresholds().getVoltageAveragingPercent()));
    }

    String materialText = ChannelStatistics.firstText(series,
        Channels.pcSource(source, Channels.PC_SOURCE_MATERIAL), rows);
    if (materialText != null) {
      Element element = Element.lookup(materialText);
      if (element == null) {
        LOGGER.warn("%s: material '%s' of source %d is not a known element, reporting it as is",
            ctx.getLogName(), materialText, source);
        params.setMaterial(materialText);
      } else {
        params.setMaterial(element.getSymbol());
      }
    }
    params.setTargetId(ChannelStatistics.firstText(series,
        Channels.pcSource(source, Channels.PC_SOURCE_LOADED_TARGET), rows));

    if (ctx.hasEvent(EventCategory.FILM_DEPOSITION_RATE_MEASUREMENT, source)) {
      LogEvent rate = ctx.getEvent(EventCategory.FILM_DEPOSITION_RATE_MEASUREMENT, source);
      if (!rate.isEmpty()) {
        params.setDepositionRate(ChannelStatistics.mean(series, Channels.THICKNESS_RATE, rate.getRows()),
            ChannelStatistics.firstText(series, Channels.THICKNESS_ACTIVE_MATERIAL, rate.getRows()));
      }
    }
    return params;
  }

  /**
   * DC when the discharge current is up on most of the deposition, RF when the self bias is, with forward minus
   * reflected power as a fallback for supplies that log neither.  Returns null when no indicator is conclusive.
   */
  static PlasmaType classifyPlasma(ExtractionContext ctx, int source, Condition rows) {
    SegmentationThresholds thresholds = ctx.getThresholds();
    ConditionBuilder conditions = ctx.conditions();
    double tolerance = thresholds.getPlasmaTypeTolerance();

    Condition current = conditions.above(Channels.source(source, Channels.CURRENT), thresholds.getCurrentThreshold());
    Condition bias = conditions.above(Channels.source(source, Channels.DC_BIAS), thresholds.getBiasThreshold());
    Condition power = conditions.differenceAbove(Channels.source(source, Channels.FWD_POWER),
        Channels.source(source, Channels.RFL_POWER), thresholds.getPowerFwdReflThreshold());

    boolean dc;
    if (ChannelStatistics.fraction(current, rows) >= tolerance) {
      dc = true;
    } else if (ChannelStatistics.fraction(bias, rows) >= tolerance) {
      dc = false;
    } else if (ChannelStatistics.fraction(power, rows) >= tolerance) {
      dc = !ctx.getSeries().hasNumeric(Channels.source(source, Channels.DC_BIAS));
    } else {
      return null;
    }
    if (!dc) {
      return PlasmaType.RF;
    }
    Condition pulsed = conditions.equalTo(Channels.source(source, Channels.PULSE_ENABLED), 1.0);
    return ChannelStatistics.fraction(pulsed, rows) >= tolerance ? PlasmaType.PULSED_DC : PlasmaType.DC;
  }

  /**
   * Start and end voltages average the first and last {@code averagingPercent} % of the samples, at least one each.
   */
  static VoltageStatistics voltageStatistics(TimeSeries series, String channel, Condition rows,
                                             double averagingPercent) {
    if (!series.hasNumeric(channel)) {
      return null;
    }
    int window = (int) (averagingPercent * 0.01 * rows.count());
    return new VoltageStatistics(
        ChannelStatistics.meanOfFirst(series, channel, rows, window),
        ChannelStatistics.meanOfLast(series, channel, rows, window),
        ChannelStatistics.mean(series, channel, rows),
        ChannelStatistics.min(series, channel, rows),
        ChannelStatistics.max(series, channel, rows),
        ChannelStatistics.std(series, channel, rows));
  }
}
