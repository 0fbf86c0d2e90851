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

import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.report.PartialPressures;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class ProcessPhysicsTest {
  private SegmentationThresholds thresholds;

  @Before
  public void setUp() throws Exception {
    thresholds = SegmentationThresholds.loadDefaults();
  }

  @Test
  public void testTrueTemperature() throws Exception {
    Assert.assertEquals("Calibrated surface temperature", 283.5,
        ProcessPhysics.trueTemperature(300.0, 300.0, thresholds), 1e-9);
    Assert.assertEquals("Averages both thermocouples", 2.0 * 150.0 + 1.0,
        ProcessPhysics.trueTemperature(100.0, 200.0, 2.0, 1.0), 1e-9);
  }

  @Test
  public void testPartialPressuresIncludeTheCarrierGas() throws Exception {
    PartialPressures pp = ProcessPhysics.partialPressures(20.0, 0.0, 5.0, 0.005, thresholds);
    Assert.assertEquals("PH3 is diluted to 10 %", 1.0e-4, pp.getPh3(), 1e-12);
    Assert.assertEquals("No H2S", 0.0, pp.getH2s(), 0.0);
    Assert.assertEquals("Ar plus the carrier part of the PH3 flow", 4.9e-3, pp.getAr(), 1e-12);
    Assert.assertEquals("Partial pressures add up to the total", 0.005,
        pp.getAr() + pp.getH2s() + pp.getPh3(), 1e-12);
  }

  @Test
  public void testPartialPressuresWithoutFlow() throws Exception {
    PartialPressures pp = ProcessPhysics.partialPressures(0.0, 0.0, 0.0, 0.005, thresholds);
    Assert.assertEquals("Ar", 0.0, pp.getAr(), 0.0);
    Assert.assertEquals("H2S", 0.0, pp.getH2s(), 0.0);
    Assert.assertEquals("PH3", 0.0, pp.getPh3(), 0.0);
  }

  @Test
  public void testMaterialSpace() throws Exception {
    Assert.assertEquals("Targets then reactive species", "Cu-Ag-Sn-P-S",
        ProcessPhysics.materialSpace(Arrays.asList("Cu", "Ag", "Sn"), true, true));
    Assert.assertEquals("Sulfur only", "Zn-S",
        ProcessPhysics.materialSpace(Collections.singletonList("Zn"), false, true));
    Assert.assertEquals("Nothing", "", ProcessPhysics.materialSpace(Collections.<String>emptyList(), false, false));
  }
}
