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

package com.twentyn.sputterlog.util.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.sputterlog.SputterLogFixture;
import com.twentyn.sputterlog.SputterLogReader;
import com.twentyn.sputterlog.SputterLogResult;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.report.JsonReportSink;
import org.joda.time.Duration;
import org.joda.time.LocalDateTime;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class ReportObjectMapperTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testRoundTripOfJodaValues() throws Exception {
    ObjectMapper om = ReportObjectMapper.create();

    LocalDateTime time = new LocalDateTime(2024, 8, 2, 10, 52, 28, 123);
    Duration duration = new Duration(299123L);
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("time", time);
    values.put("duration", duration);
    JsonNode node = om.readTree(om.writeValueAsString(values));

    assertEquals("Time written without a zone", "2024-08-02T10:52:28.123", node.get("time").asText());
    assertEquals("Time read back", time, om.treeToValue(node.get("time"), LocalDateTime.class));
    assertEquals("Duration read back to the millisecond", duration,
        om.treeToValue(node.get("duration"), Duration.class));
  }

  @Test
  public void testRoundTripOfAWrittenReport() throws Exception {
    SputterLogResult result = new SputterLogReader(SegmentationThresholds.loadDefaults())
        .readEvents(SputterLogFixture.standardRun().build(), "XY_0001.CSV");
    JsonReportSink sink = new JsonReportSink(folder.getRoot());
    sink.write(result.getLogName(), result.getMainParameters(), result.getStepParameters());

    ObjectMapper om = ReportObjectMapper.create();
    JsonNode deposition = om.readTree(sink.outputFileFor(result.getLogName())).get("main_params").get("deposition");
    assertEquals("Deposition start",
        SputterLogFixture.LOG_START.plusSeconds(SputterLogFixture.DEPOSITION_START),
        om.treeToValue(deposition.get("start_time"), LocalDateTime.class));
    assertEquals("Deposition end",
        SputterLogFixture.LOG_START.plusSeconds(SputterLogFixture.DEPOSITION_END),
        om.treeToValue(deposition.get("end_time"), LocalDateTime.class));
    assertEquals("Deposition duration", Duration.standardSeconds(299),
        om.treeToValue(deposition.get("duration"), Duration.class));
  }
}
