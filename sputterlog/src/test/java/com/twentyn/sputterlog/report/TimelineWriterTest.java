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

package com.twentyn.sputterlog.report;

import com.twentyn.sputterlog.SputterLogFixture;
import com.twentyn.sputterlog.SputterLogReader;
import com.twentyn.sputterlog.SputterLogResult;
import com.twentyn.sputterlog.condition.Condition;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.junit.Assert;
import org.junit.Test;

import java.io.StringWriter;

public class TimelineWriterTest {

  @Test
  public void testOneRowPerOccurrence() throws Exception {
    SputterLogResult result = new SputterLogReader(SegmentationThresholds.loadDefaults())
        .readEvents(SputterLogFixture.standardRun().build(), "XY_0001.CSV");
    StringWriter out = new StringWriter();
    try (TimelineWriter writer = new TimelineWriter()) {
      writer.open(out);
      writer.append(result.getTimeline());
    }

    String[] lines = out.toString().split("\n");
    Assert.assertEquals("Header", String.join("\t", TimelineWriter.TIMELINE_FIELD.header()), lines[0]);
    Assert.assertEquals("One row per event", result.getTimeline().size() + 1, lines.length);

    String depositionRow = null;
    for (String line : lines) {
      if (line.startsWith("Deposition\t")) {
        depositionRow = line;
      }
    }
    Assert.assertEquals("Deposition row",
        "Deposition\tdeposition\tdeposition\t2024-08-02T10:01:40.000\t2024-08-02T10:06:39.000\t299.0\t25.0\t0.005",
        depositionRow);
  }

  @Test(expected = IllegalStateException.class)
  public void testAppendBeforeOpen() throws Exception {
    TimeSeries series = new SputterLogFixture(10).build();
    LogEvent event = new LogEvent(EventCategory.DEPOSITION, null, series);
    event.setCondition(Condition.allTrue(10));
    event.extractDomains(1000.0, 10.0, 3.0);
    new TimelineWriter().append(event);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFoldedEventsAreRejected() throws Exception {
    TimeSeries series = new SputterLogFixture(60).build();
    LogEvent event = new LogEvent(EventCategory.DEPOSITION, null, series);
    event.setCondition(Condition.of(mask(60, 0, 9, 40, 49)));
    event.extractDomains(1000.0, 10.0, 3.0);
    try (TimelineWriter writer = new TimelineWriter()) {
      writer.open(new StringWriter());
      writer.append(event);
    }
  }

  private static boolean[] mask(int size, int... bounds) {
    boolean[] mask = new boolean[size];
    for (int r = 0; r < bounds.length; r += 2) {
      for (int i = bounds[r]; i <= bounds[r + 1]; i++) {
        mask[i] = true;
      }
    }
    return mask;
  }
}
