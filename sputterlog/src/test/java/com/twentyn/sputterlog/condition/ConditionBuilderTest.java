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

import com.twentyn.sputterlog.SputterLogFixture;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.Gas;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

public class ConditionBuilderTest {
  private SegmentationThresholds thresholds;

  @Before
  public void setUp() throws Exception {
    thresholds = SegmentationThresholds.loadDefaults();
  }

  private ConditionBuilder builderFor(SputterLogFixture fixture) {
    return new ConditionBuilder(fixture.build(), thresholds);
  }

  @Test
  public void testMissingChannelsYieldAllFalse() throws Exception {
    // Only a pressure gauge: every phase condition must degrade to "never".
    ConditionBuilder b = builderFor(new SputterLogFixture(50).constant(Channels.CAPMAN_PRESSURE, 0.005));
    Condition all = Condition.allTrue(50);
    Condition never = Condition.allFalse(50);

    Assert.assertEquals("plasma on", never, b.plasmaOn(1));
    Assert.assertEquals("plasma on and open", never, b.plasmaOnAndOpen(1));
    Assert.assertEquals("plasma ramping", never, b.plasmaRamping(1));
    Assert.assertEquals("cracker on", never, b.crackerOnOpen());
    Assert.assertEquals("temperature control", never, b.temperatureControlled());
    Assert.assertEquals("gas flowing", never, b.gasFlowing(Gas.H2S));
    Assert.assertEquals("deposition", never, b.deposition(all));
    Assert.assertEquals("presputtering", never, b.presputtering(1, Long.MAX_VALUE, null, never));
    Assert.assertEquals("cracker base pressure", never,
        b.crackerBasePressure(all, never, Long.MAX_VALUE, all));
    Assert.assertEquals("xtal shutter", never, b.xtal2ShutterOpen());
    Assert.assertEquals("rate measurement", never, b.depositionRateMeasurement());
    Assert.assertEquals("film rate measurement", never,
        b.filmDepositionRateMeasurement(1, all, all, never, never, never, never));
    Assert.assertEquals("sulfur rate measurement", never,
        b.sulfurDepositionRateMeasurement(all, never, all, never, never, never));
    Assert.assertEquals("substrate ramp up", never, b.substrateRampUp(all, never));
    Assert.assertEquals("substrate ramp down", never, b.substrateRampDown(all, never));
    Assert.assertEquals("ramp down without a ramp down", never, b.substrateRampDownHigh(null, all));
    Assert.assertEquals("text comparisons", never, b.textNotEquals(Channels.THICKNESS_ACTIVE_MATERIAL, "Sulfur"));
    Assert.assertEquals("range of an absent channel", never, b.withinRangeOf(Channels.HEATER_TEMP_1, all));
  }

  @Test
  public void testWithinRange() throws Exception {
    double[] values = new double[] {8.5, 9.5, 10.0, 10.5, 11.5, 0.5};
    Assert.assertEquals("Open interval of 10 % around the mean",
        Condition.of(false, true, true, true, false, false),
        ConditionBuilder.withinRange(values, 10.0, 10.0, 1.0));
    Assert.assertEquals("A zero mean matches the values close to zero",
        Condition.of(false, false, false, false, false, true),
        ConditionBuilder.withinRange(values, 0.0, 10.0, 1.0));
    Assert.assertEquals("A NaN mean matches nothing", Condition.allFalse(values.length),
        ConditionBuilder.withinRange(values, Double.NaN, 10.0, 1.0));
    Assert.assertEquals("Negative means keep a proper interval",
        Condition.of(false, false, false, false, false, false),
        ConditionBuilder.withinRange(values, -10.0, 10.0, 1.0));
  }

  @Test
  public void testDifferencesAreFalseOnTheFirstSample() throws Exception {
    ConditionBuilder b = builderFor(new SputterLogFixture(4)
        .set(Channels.HEATER_SETPOINT, 0, 0, 100.0)
        .set(Channels.HEATER_SETPOINT, 2, 3, 50.0));
    Assert.assertEquals("Rising steps", Condition.of(false, false, true, false),
        b.diffAbove(Channels.HEATER_SETPOINT, 0.11));
    Assert.assertEquals("Falling steps", Condition.of(false, true, false, false),
        b.diffBelow(Channels.HEATER_SETPOINT, -0.11));
  }

  @Test
  public void testPlasmaRampingIncludesTheStartingSample() throws Exception {
    TimeSeries series = new SputterLogFixture(6)
        .set(Channels.source(1, Channels.ENABLED), 2, 5, 1.0)
        .set(Channels.source(1, Channels.OUTPUT_SETPOINT), 2, 2, 10.0)
        .set(Channels.source(1, Channels.OUTPUT_SETPOINT), 3, 5, 20.0)
        .build();
    Assert.assertEquals("Ramp from the sample before the first increase to the last increase",
        Condition.of(false, true, true, true, false, false),
        new ConditionBuilder(series, thresholds).plasmaRamping(1));
  }

  @Test
  public void testPlasmaOnFallsBackOnForwardMinusReflectedPower() throws Exception {
    ConditionBuilder b = builderFor(new SputterLogFixture(3)
        .constant(Channels.source(1, Channels.ENABLED), 1.0)
        .set(Channels.source(1, Channels.FWD_POWER), 1, 2, 60.0)
        .set(Channels.source(1, Channels.RFL_POWER), 2, 2, 55.0));
    Assert.assertEquals("Net power above 10 W only on the second sample", Condition.of(false, true, false),
        b.plasmaOn(1));
  }

  @Test
  public void testTemperatureControlFallbackIgnoresNaN() throws Exception {
    TimeSeries series = new SputterLogFixture(4)
        .constant(Channels.HEATER_SETPOINT, 200.0)
        .set(Channels.HEATER_TEMP_1, 0, 1, 200.0)
        .set(Channels.HEATER_TEMP_1, 2, 2, 150.0)
        .set(Channels.HEATER_TEMP_1, 3, 3, Double.NaN)
        .build();
    Assert.assertEquals("Setpoint and reading disagree only on the third sample",
        Condition.of(false, false, true, false), new ConditionBuilder(series, thresholds).temperatureControlled());
  }

  @Test
  public void testTemperatureControlFlagWinsOverTheFallback() throws Exception {
    ConditionBuilder b = builderFor(new SputterLogFixture(3)
        .set(Channels.TEMPERATURE_CONTROL_ENABLED, 0, 0, 1.0)
        .constant(Channels.HEATER_SETPOINT, 200.0)
        .constant(Channels.HEATER_TEMP_1, 100.0));
    Assert.assertEquals("Logged flag", Condition.of(true, false, false), b.temperatureControlled());
  }

  @Test
  public void testRateMeasurementSkipsTheSettlingWindow() throws Exception {
    ConditionBuilder b = builderFor(new SputterLogFixture(100)
        .set(Channels.XTAL2_SHUTTER_OPEN, 10, 79, 1.0));
    Condition measurement = b.depositionRateMeasurement();
    Assert.assertTrue("The opening sample itself is kept", measurement.get(10));
    for (int row = 11; row <= 40; row++) {
      Assert.assertFalse(String.format("Row %d is within 30 s of the opening", row), measurement.get(row));
    }
    Assert.assertTrue("Settled after 30 s", measurement.get(41));
    Assert.assertFalse("Closed shutter", measurement.get(80));
    Assert.assertEquals("Opening sample plus the settled samples", 1 + 39, measurement.count());
  }

  @Test
  public void testGasFlowingNeedsSetpointAndFlow() throws Exception {
    ConditionBuilder b = builderFor(new SputterLogFixture(3)
        .set(Gas.AR.setpointChannel(), 0, 1, 20.0)
        .set(Gas.AR.flowChannel(), 1, 2, 20.0));
    Assert.assertEquals("Both above the noise level", Condition.of(false, true, false), b.gasFlowing(Gas.AR));
  }

  @Test
  public void testRampDownSplitsOnReactiveAtmosphere() throws Exception {
    ConditionBuilder b = builderFor(new SputterLogFixture(5));
    Condition reactive = Condition.of(true, true, true, false, false);
    long rampDownStart = SputterLogFixture.timeOf(1);
    Assert.assertEquals("High temperature part keeps the reactive atmosphere",
        Condition.of(false, false, true, false, false), b.substrateRampDownHigh(rampDownStart, reactive));
    Assert.assertEquals("Low temperature part without it",
        Condition.of(false, false, false, true, true), b.substrateRampDownLow(rampDownStart, reactive));
  }

  @Test
  public void testAnyOfNoSourceIsNever() throws Exception {
    ConditionBuilder b = builderFor(new SputterLogFixture(3));
    Assert.assertEquals("No sources", Condition.allFalse(3), b.anyOf(Collections.<Condition>emptyList()));
  }
}
