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

package com.twentyn.sputterlog.config;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.timeseries.Gas;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public class SegmentationThresholdsTest {

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testPackagedDefaults() throws Exception {
    SegmentationThresholds t = SegmentationThresholds.loadDefaults();
    Assert.assertEquals("Continuity limit", 10.0, t.getDefaultContinuityLimit(), 0.0);
    Assert.assertEquals("Deposition continuity limit", 200.0, t.getContinuityLimit(EventCategory.DEPOSITION), 0.0);
    Assert.assertEquals("Other categories use the default limit", 10.0,
        t.getContinuityLimit(EventCategory.SOURCE_RAMP_UP), 0.0);
    Assert.assertEquals("QCM stabilization", 30.0, t.getStabilizationTimeSeconds(), 0.0);
    Assert.assertEquals("Temperature control minimal size", 10, t.getMinTempCtrlSize());
    Assert.assertEquals("PH3 dilution", 0.1, t.getGasDilutionFraction(Gas.PH3), 0.0);
  }

  @Test
  public void testPartialOverrideKeepsOtherDefaults() throws Exception {
    SegmentationThresholds t = SegmentationThresholds.fromStream(json(
        "{\"rt_temp_threshold\": 40.0, \"category_continuity_limits\": {\"deposition\": 300.0}}"));
    Assert.assertEquals("Overridden", 40.0, t.getRtTempThreshold(), 0.0);
    Assert.assertEquals("Overridden per category", 300.0, t.getContinuityLimit(EventCategory.DEPOSITION), 0.0);
    Assert.assertEquals("Untouched", 10.0, t.getWithinRangePercent(), 0.0);
  }

  @Test(expected = UnrecognizedPropertyException.class)
  public void testUnknownKeysAreRejected() throws Exception {
    SegmentationThresholds.fromStream(json("{\"rt_temperature\": 40.0}"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownCategoryIsRejected() throws Exception {
    SegmentationThresholds.fromStream(json("{\"category_continuity_limits\": {\"sputtering\": 300.0}}"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveValuesAreRejected() throws Exception {
    SegmentationThresholds.builder().minDomainSize(0.0).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPlasmaTypeToleranceIsAFraction() throws Exception {
    SegmentationThresholds.builder().plasmaTypeTolerance(1.5).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDilutionOnlyAppliesToReactiveGases() throws Exception {
    SegmentationThresholds.builder().gasDilutionFraction(Gas.AR, 0.5).build();
  }

  @Test
  public void testBuilderDoesNotAlterTheSource() throws Exception {
    SegmentationThresholds defaults = SegmentationThresholds.loadDefaults();
    SegmentationThresholds tuned = defaults.toBuilder().continuityLimit(EventCategory.DEPOSITION, 50.0).build();
    Assert.assertEquals("Tuned", 50.0, tuned.getContinuityLimit(EventCategory.DEPOSITION), 0.0);
    Assert.assertEquals("Untouched defaults", 200.0, defaults.getContinuityLimit(EventCategory.DEPOSITION), 0.0);
  }
}
