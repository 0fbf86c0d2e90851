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
import com.twentyn.sputterlog.config.SegmentationThresholds;
import org.joda.time.Duration;
import org.joda.time.LocalDateTime;
import org.junit.Assert;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

public class TextReportTest {

  @Test
  public void testFormatDuration() throws Exception {
    Assert.assertEquals("Hours, minutes and seconds", "01:02:05",
        TextReport.formatDuration(Duration.standardSeconds(3725)));
    Assert.assertEquals("Hours do not wrap at a day", "25:00:00",
        TextReport.formatDuration(Duration.standardHours(25)));
    Assert.assertEquals("Negative durations", "-00:00:05", TextReport.formatDuration(Duration.standardSeconds(-5)));
    Assert.assertEquals("Sub-second parts are dropped", "00:00:01", TextReport.formatDuration(new Duration(1999L)));
  }

  @Test
  public void testTimesCarryTheirDateOnlyForTheLogBounds() throws Exception {
    LocalDateTime time = new LocalDateTime(2024, 8, 2, 10, 1, 40, 500);
    Assert.assertEquals("Log bounds", "2024-08-02 10:01:40", TextReport.formatValue("log_start_time", time));
    Assert.assertEquals("Other times", "10:01:40", TextReport.formatValue("start_time", time));
    Assert.assertEquals("Plain values", "true", TextReport.formatValue("rt", Boolean.TRUE));
  }

  @Test
  public void testNestedSectionsAreIndented() throws Exception {
    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("avg_output_power", 100.0);
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("num_events", 1);
    map.put("s1", inner);
    Assert.assertEquals("Rendering", "num_events: 1\ns1:\n  avg_output_power: 100.0\n", TextReport.render(map));
  }

  @Test
  public void testRenderRun() throws Exception {
    SputterLogResult result = new SputterLogReader(SegmentationThresholds.loadDefaults())
        .readEvents(SputterLogFixture.standardRun().build(), "XY_0001.CSV");
    String text = TextReport.render(result.getLogName(), result.getMainParameters(), result.getStepParameters());

    Assert.assertTrue("Title", text.startsWith("Sputter log: XY_0001.CSV\n"));
    Assert.assertTrue("Log start with its date", text.contains("\n  log_start_time: 2024-08-02 10:00:00\n"));
    Assert.assertTrue("Deposition section", text.contains("\n  deposition:\n"));
    Assert.assertTrue("Deposition duration", text.contains("\n    duration: 00:04:59\n"));
    Assert.assertTrue("Deposition start", text.contains("\n    start_time: 10:01:40\n"));
  }
}
