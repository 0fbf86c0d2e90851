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

import com.twentyn.sputterlog.SputterLogFixture;
import com.twentyn.sputterlog.condition.Condition;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class ChannelStatisticsTest {
  private static final String CHANNEL = "Wide Range Gauge";

  private TimeSeries series;
  private Condition rows;

  @Before
  public void setUp() throws Exception {
    series = new SputterLogFixture(6)
        .set(CHANNEL, 0, 0, 4.0)
        .set(CHANNEL, 1, 1, -1.0)
        .set(CHANNEL, 2, 2, Double.NaN)
        .set(CHANNEL, 3, 3, 2.0)
        .set(CHANNEL, 4, 4, 6.0)
        .build();
    rows = Condition.of(true, true, true, true, false, false);
  }

  @Test
  public void testStatisticsSkipNaN() throws Exception {
    Assert.assertEquals("Mean", 5.0 / 3.0, ChannelStatistics.mean(series, CHANNEL, rows), 1e-12);
    Assert.assertEquals("Min", -1.0, ChannelStatistics.min(series, CHANNEL, rows), 0.0);
    Assert.assertEquals("Min of positive values", 2.0, ChannelStatistics.minPositive(series, CHANNEL, rows), 0.0);
    Assert.assertEquals("Max ignores unselected rows", 4.0, ChannelStatistics.max(series, CHANNEL, rows), 0.0);
    Assert.assertEquals("Last", 2.0, ChannelStatistics.last(series, CHANNEL, rows), 0.0);
    Assert.assertEquals("Mean of the first two", 1.5, ChannelStatistics.meanOfFirst(series, CHANNEL, rows, 2), 0.0);
    Assert.assertEquals("Mean of the last two", 2.0, ChannelStatistics.meanOfLast(series, CHANNEL, rows, 2), 0.0);
  }

  @Test
  public void testAbsentChannelOrNoSampleIsNull() throws Exception {
    Assert.assertNull("Absent channel", ChannelStatistics.mean(series, "Nothing", rows));
    Assert.assertNull("No selected sample", ChannelStatistics.mean(series, CHANNEL, Condition.allFalse(6)));
    Assert.assertNull("No first sample", ChannelStatistics.first(series, CHANNEL, Condition.allFalse(6)));
    Assert.assertEquals("Flows below the noise level count as zero", 0.0,
        ChannelStatistics.meanAbove(series, CHANNEL, rows, 10.0), 0.0);
  }

  @Test
  public void testMeansOfLongConstantRunsAreExact() throws Exception {
    TimeSeries constant = new SputterLogFixture(300).constant(CHANNEL, 0.005).build();
    Condition all = Condition.allTrue(300);
    Assert.assertEquals("Mean", 0.005, ChannelStatistics.mean(constant, CHANNEL, all), 0.0);
    Assert.assertEquals("Mean above a threshold", 0.005, ChannelStatistics.meanAbove(constant, CHANNEL, all, 0.001),
        0.0);
    Assert.assertEquals("Mean of the last samples", 0.005, ChannelStatistics.meanOfLast(constant, CHANNEL, all, 200),
        0.0);
  }

  @Test
  public void testFractions() throws Exception {
    Condition half = Condition.of(true, false, true, false, true, true);
    Assert.assertEquals("Two of four selected samples", 0.5, ChannelStatistics.fraction(half, rows), 0.0);
    Assert.assertFalse("Not throughout", ChannelStatistics.holdsThroughout(half, rows));
    Assert.assertTrue("Throughout", ChannelStatistics.holdsThroughout(Condition.allTrue(6), rows));
    Assert.assertFalse("Nothing selected", ChannelStatistics.holdsThroughout(Condition.allTrue(6),
        Condition.allFalse(6)));
  }
}
