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

package com.twentyn.sputterlog.condition;

import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.Gas;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds the per-sample conditions that characterize each process phase.  Every builder evaluates to all-false when
 * one of the channels it needs is not in the log, so that a log format lacking an instrument simply yields empty
 * events.
 *
 * Builders that compare against the deposition take the deposition's selected samples as an argument; the caller is
 * responsible for finalizing the deposition first.
 */
public class ConditionBuilder {
  // Lowest heater setpoint that can belong to a ramp down; the heater reports 0 once it is switched off.
  private static final double MIN_RAMP_DOWN_SETPOINT = 1.0;

  private final TimeSeries series;
  private final SegmentationThresholds thresholds;

  public ConditionBuilder(TimeSeries series, SegmentationThresholds thresholds) {
    this.series = series;
    this.thresholds = thresholds;
  }

  public int size() {
    return series.size();
  }

  /* ----------------------------------------
   * Primitives
   * */

  public Condition none() {
    return Condition.allFalse(series.size());
  }

  /** {@code channel > threshold}; NaN samples are false. */
  public Condition above(String channel, double threshold) {
    double[] values = series.getNumeric(channel);
    boolean[] mask = new boolean[series.size()];
    if (values != null) {
      for (int i = 0; i < mask.length; i++) {
        mask[i] = values[i] > threshold;
      }
    }
    return Condition.wrap(mask);
  }

  /** {@code channel < threshold}; NaN samples are false. */
  public Condition below(String channel, double threshold) {
    double[] values = series.getNumeric(channel);
    boolean[] mask = new boolean[series.size()];
    if (values != null) {
      for (int i = 0; i < mask.length; i++) {
        mask[i] = values[i] < threshold;
      }
    }
    return Condition.wrap(mask);
  }

  public Condition equalTo(String channel, double value) {
    double[] values = series.getNumeric(channel);
    boolean[] mask = new boolean[series.size()];
    if (values != null) {
      for (int i = 0; i < mask.length; i++) {
        mask[i] = values[i] == value;
      }
    }
    return Condition.wrap(mask);
  }

  /** Flag channels are logged as 1/0; anything non-zero and not NaN counts as set. */
  public Condition nonZero(String channel) {
    double[] values = series.getNumeric(channel);
    boolean[] mask = new boolean[series.size()];
    if (values != null) {
      for (int i = 0; i < mask.length; i++) {
        mask[i] = !Double.isNaN(values[i]) && values[i] != 0.0;
      }
    }
    return Condition.wrap(mask);
  }

  /**
   * {@code channel[i] - channel[i - 1] > threshold}.  The first sample has no predecessor and is always false.
   */
  public Condition diffAbove(String channel, double threshold) {
    double[] values = series.getNumeric(channel);
    boolean[] mask = new boolean[series.size()];
    if (values != null) {
      for (int i = 1; i < mask.length; i++) {
        mask[i] = values[i] - values[i - 1] > threshold;
      }
    }
    return Condition.wrap(mask);
  }

  /** {@code channel[i] - channel[i - 1] < threshold}, false on the first sample. */
  public Condition diffBelow(String channel, double threshold) {
    double[] values = series.getNumeric(channel);
    boolean[] mask = new boolean[series.size()];
    if (values != null) {
      for (int i = 1; i < mask.length; i++) {
        mask[i] = values[i] - values[i - 1] < threshold;
      }
    }
    return Condition.wrap(mask);
  }

  /** {@code a - b > threshold} sample by sample. */
  public Condition differenceAbove(String a, String b, double threshold) {
    double[] x = series.getNumeric(a);
    double[] y = series.getNumeric(b);
    boolean[] mask = new boolean[series.size()];
    if (x != null && y != null) {
      for (int i = 0; i < mask.length; i++) {
        mask[i] = x[i] - y[i] > threshold;
      }
    }
    return Condition.wrap(mask);
  }

  public Condition textEquals(String channel, String value) {
    boolean[] mask = new boolean[series.size()];
    if (series.hasColumn(channel)) {
      for (int i = 0; i < mask.length; i++) {
        mask[i] = value.equals(series.getCellAsString(channel, i));
      }
    }
    return Condition.wrap(mask);
  }

  /** Empty cells differ from any value; an absent channel is all-false like any other condition. */
  public Condition textNotEquals(String channel, String value) {
    if (!series.hasColumn(channel)) {
      return none();
    }
    return textEquals(channel, value).not();
  }

  /** Samples strictly after {@code time}. */
  public Condition after(long time) {
    boolean[] mask = new boolean[series.size()];
    for (int i = 0; i < mask.length; i++) {
      mask[i] = series.getTime(i) > time;
    }
    return Condition.wrap(mask);
  }

  /** Samples strictly before {@code time}. */
  public Condition before(long time) {
    boolean[] mask = new boolean[series.size()];
    for (int i = 0; i < mask.length; i++) {
      mask[i] = series.getTime(i) < time;
    }
    return Condition.wrap(mask);
  }

  /**
   * Samples of {@code channel} within {@code withinRangePercent} of its mean over {@code reference}.  All-false when
   * the channel is absent or has no value on the reference samples.
   */
  public Condition withinRangeOf(String channel, Condition reference) {
    double[] values = series.getNumeric(channel);
    if (values == null) {
      return none();
    }
    return withinRange(values, meanOver(values, reference), thresholds.getWithinRangePercent(),
        thresholds.getMfcFlowThreshold());
  }

  /**
   * {@code (1 - p/100) * mean < x < (1 + p/100) * mean}.  A zero mean (an instrument that was off) matches samples
   * within {@code zeroTolerance} of zero instead of an empty open interval.  A NaN mean matches nothing.
   */
  public static Condition withinRange(double[] values, double mean, double percent, double zeroTolerance) {
    boolean[] mask = new boolean[values.length];
    if (Double.isNaN(mean)) {
      return Condition.wrap(mask);
    }
    double lower = (1.0 - 0.01 * percent) * mean;
    double upper = (1.0 + 0.01 * percent) * mean;
    if (lower > upper) {
      double tmp = lower;
      lower = upper;
      upper = tmp;
    }
    for (int i = 0; i < values.length; i++) {
      if (mean == 0.0) {
        mask[i] = Math.abs(values[i]) < zeroTolerance;
      } else {
        mask[i] = values[i] > lower && values[i] < upper;
      }
    }
    return Condition.wrap(mask);
  }

  private static double meanOver(double[] values, Condition rows) {
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (int i : rows.indices()) {
      if (!Double.isNaN(values[i])) {
        stats.addValue(values[i]);
      }
    }
    return stats.getMean();
  }

  /* ----------------------------------------
   * Sources
   * */

  public Condition plasmaOn(int source) {
    Condition enabled = nonZero(Channels.source(source, Channels.ENABLED));
    Condition current = above(Channels.source(source, Channels.CURRENT), thresholds.getCurrentThreshold());
    Condition bias = above(Channels.source(source, Channels.DC_BIAS), thresholds.getBiasThreshold());
    Condition power = differenceAbove(Channels.source(source, Channels.FWD_POWER),
        Channels.source(source, Channels.RFL_POWER), thresholds.getPowerFwdReflThreshold());
    return enabled.and(current.or(bias).or(power));
  }

  public Condition sourceShutterOpen(int source) {
    return equalTo(Channels.pcSource(source, Channels.PC_SOURCE_SHUTTER_OPEN), 1.0);
  }

  public Condition plasmaOnAndOpen(int source) {
    return plasmaOn(source).and(sourceShutterOpen(source));
  }

  /**
   * A rising output setpoint on an enabled source, including the sample the ramp starts from.
   */
  public Condition plasmaRamping(int source) {
    Condition enabled = nonZero(Channels.source(source, Channels.ENABLED));
    Condition rising = diffAbove(Channels.source(source, Channels.OUTPUT_SETPOINT),
        thresholds.getPowerSetpointDiffThreshold());
    return enabled.and(rising).orShiftedEarlier();
  }

  public Condition anyOf(Collection<Condition> conditions) {
    return Condition.anyOf(series.size(), conditions);
  }

  /* ----------------------------------------
   * Chamber state
   * */

  public Condition crackerOnOpen() {
    if (!series.hasNumeric(Channels.CRACKER_ZONE_1_TEMP)) {
      return none();
    }
    return above(Channels.CRACKER_ZONE_1_TEMP, thresholds.getCrackerZone1MinTemp())
        .and(above(Channels.CRACKER_ZONE_2_TEMP, thresholds.getCrackerZone2MinTemp()))
        .and(above(Channels.CRACKER_ZONE_3_TEMP, thresholds.getCrackerZone3MinTemp()))
        .and(equalTo(Channels.CRACKER_CONTROL_ENABLED, 1.0));
  }

  /**
   * Temperature control flag when logged, otherwise any disagreement between heater setpoint and reading.  Whether
   * the control was actually observed is decided on the extracted event, not here.
   */
  public Condition temperatureControlled() {
    if (series.hasNumeric(Channels.TEMPERATURE_CONTROL_ENABLED)) {
      return equalTo(Channels.TEMPERATURE_CONTROL_ENABLED, 1.0);
    }
    double[] setpoint = series.getNumeric(Channels.HEATER_SETPOINT);
    double[] temperature = series.getNumeric(Channels.HEATER_TEMP_1);
    boolean[] mask = new boolean[series.size()];
    if (setpoint != null && temperature != null) {
      for (int i = 0; i < mask.length; i++) {
        mask[i] = !Double.isNaN(setpoint[i]) && !Double.isNaN(temperature[i]) && setpoint[i] != temperature[i];
      }
    }
    return Condition.wrap(mask);
  }

  public Condition gasFlowing(Gas gas) {
    return above(gas.setpointChannel(), thresholds.getMfcFlowThreshold())
        .and(above(gas.flowChannel(), thresholds.getMfcFlowThreshold()));
  }

  public Condition substrateShutterOpen() {
    return equalTo(Channels.SUBSTRATE_SHUTTER_OPEN, 1.0);
  }

  public Condition deposition(Condition anySourceOnOpen) {
    return substrateShutterOpen().and(anySourceOnOpen);
  }

  /**
   * Plasma on before the deposition and after the last ramp up of the source, without ramping and without any
   * reactive species.
   *
   * @param lastRampUpEnd end of the source's last ramp-up domain, or null if it never ramped
   * @param reactive      PH3, H2S or the cracker running
   */
  public Condition presputtering(int source, long depositionStart, Long lastRampUpEnd, Condition reactive) {
    Condition cond = plasmaOn(source)
        .and(before(depositionStart))
        .and(plasmaRamping(source).not())
        .and(reactive.not());
    if (lastRampUpEnd != null) {
      cond = cond.and(after(lastRampUpEnd));
    }
    return cond;
  }

  /**
   * Cracker running at its deposition settings before the deposition, with no gas flowing, so that the pressure rise
   * is due to the cracker alone.
   */
  public Condition crackerBasePressure(Condition crackerOnOpen, Condition anyGas, long depositionStart,
                                       Condition depositionRows) {
    if (!series.hasNumeric(Channels.CRACKER_ZONE_1_TEMP) || crackerOnOpen.none()) {
      return none();
    }
    return crackerOnOpen
        .and(before(depositionStart))
        .and(anyGas.not())
        .and(crackerAtDepositionSettings(depositionRows))
        .and(equalTo(Channels.CRACKER_CONTROL_ENABLED, 1.0));
  }

  private Condition crackerAtDepositionSettings(Condition depositionRows) {
    return withinRangeOf(Channels.CRACKER_ZONE_1_TEMP, depositionRows)
        .and(withinRangeOf(Channels.CRACKER_ZONE_2_TEMP, depositionRows))
        .and(withinRangeOf(Channels.CRACKER_ZONE_3_TEMP, depositionRows))
        .and(withinRangeOf(Channels.CRACKER_PULSE_WIDTH, depositionRows))
        .and(withinRangeOf(Channels.CRACKER_VALVE_SETPOINT, depositionRows));
  }

  /* ----------------------------------------
   * Quartz crystal monitor
   * */

  public Condition xtal2ShutterOpen() {
    return equalTo(Channels.XTAL2_SHUTTER_OPEN, 1.0);
  }

  /**
   * Xtal 2 shutter open, minus the QCM settling window {@code (t_open, t_open + stabilizationTime]} after every
   * opening.
   */
  public Condition depositionRateMeasurement() {
    double[] shutter = series.getNumeric(Channels.XTAL2_SHUTTER_OPEN);
    if (shutter == null) {
      return none();
    }
    long window = Math.round(thresholds.getStabilizationTimeSeconds() * 1000.0);
    List<Long> openings = new ArrayList<>();
    for (int i = 1; i < shutter.length; i++) {
      if (shutter[i] - shutter[i - 1] == 1.0) {
        openings.add(series.getTime(i));
      }
    }
    boolean[] settled = new boolean[series.size()];
    for (int i = 0; i < settled.length; i++) {
      long t = series.getTime(i);
      settled[i] = true;
      for (long open : openings) {
        if (t > open && t <= open + window) {
          settled[i] = false;
          break;
        }
      }
    }
    return Condition.wrap(settled).and(xtal2ShutterOpen());
  }

  /**
   * Rate measurement of the full film before or after the deposition: a source on and open, the same reactive
   * species as during the deposition, the QCM not set to sulfur and the source power and chamber pressure within
   * range of their deposition values.
   */
  public Condition filmDepositionRateMeasurement(int source, Condition rateMeasurement, Condition anySourceOnOpen,
                                                 Condition crackerOnOpen, Condition ph3, Condition h2s,
                                                 Condition depositionRows) {
    String setpoint = Channels.source(source, Channels.OUTPUT_SETPOINT);
    if (!series.hasNumeric(setpoint)) {
      return none();
    }
    return rateMeasurement
        .and(anySourceOnOpen)
        .and(sameStateAsDeposition(ph3, ph3.and(depositionRows).any()))
        .and(sameStateAsDeposition(h2s, h2s.and(depositionRows).any()))
        .and(sameStateAsDeposition(crackerOnOpen,
            depositionRows.any() && crackerOnOpen.and(depositionRows).count() == depositionRows.count()))
        .and(textNotEquals(Channels.THICKNESS_ACTIVE_MATERIAL, Channels.SULFUR_MATERIAL))
        .and(depositionRows.not())
        .and(withinRangeOf(setpoint, depositionRows))
        .and(withinRangeOf(Channels.CAPMAN_PRESSURE, depositionRows));
  }

  private static Condition sameStateAsDeposition(Condition state, boolean usedDuringDeposition) {
    return usedDuringDeposition ? state : state.not();
  }

  /**
   * Rate measurement of the sulfur flux alone: cracker at its deposition settings, every source closed, no
   * reactive gas and the QCM set to sulfur.
   */
  public Condition sulfurDepositionRateMeasurement(Condition rateMeasurement, Condition anySourceOnOpen,
                                                   Condition crackerOnOpen, Condition ph3, Condition h2s,
                                                   Condition depositionRows) {
    if (!series.hasNumeric(Channels.CRACKER_ZONE_1_TEMP)) {
      return none();
    }
    return rateMeasurement
        .and(anySourceOnOpen.not())
        .and(crackerOnOpen)
        .and(ph3.or(h2s).not())
        .and(textEquals(Channels.THICKNESS_ACTIVE_MATERIAL, Channels.SULFUR_MATERIAL))
        .and(depositionRows.not())
        .and(crackerAtDepositionSettings(depositionRows))
        .and(withinRangeOf(Channels.CAPMAN_PRESSURE, depositionRows));
  }

  /* ----------------------------------------
   * Substrate temperature
   * */

  public Condition substrateRampUp(Condition temperatureControl, Condition depositionRows) {
    return temperatureControl
        .and(depositionRows.not())
        .and(diffAbove(Channels.HEATER_SETPOINT, thresholds.getTempSetpointDiffThreshold()));
  }

  public Condition substrateRampDown(Condition temperatureControl, Condition depositionRows) {
    return temperatureControl
        .and(depositionRows.not())
        .and(diffBelow(Channels.HEATER_SETPOINT, -thresholds.getTempSetpointDiffThreshold()))
        .and(above(Channels.HEATER_SETPOINT, MIN_RAMP_DOWN_SETPOINT));
  }

  /**
   * Part of the cool down after {@code rampDownStart} spent under a protective reactive atmosphere.  All-false when
   * there was no ramp down.
   */
  public Condition substrateRampDownHigh(Long rampDownStart, Condition reactive) {
    if (rampDownStart == null) {
      return none();
    }
    return after(rampDownStart).and(reactive);
  }

  public Condition substrateRampDownLow(Long rampDownStart, Condition reactive) {
    if (rampDownStart == null) {
      return none();
    }
    return after(rampDownStart).and(reactive.not());
  }
}
