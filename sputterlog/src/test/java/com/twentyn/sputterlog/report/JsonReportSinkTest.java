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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.sputterlog.SputterLogFixture;
import com.twentyn.sputterlog.SputterLogReader;
import com.twentyn.sputterlog.SputterLogResult;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

public class JsonReportSinkTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private SputterLogResult result;

  @Before
  public void setUp() throws Exception {
    result = new SputterLogReader(SegmentationThresholds.loadDefaults())
        .readEvents(SputterLogFixture.standardRun().build(), "XY_0001.CSV");
  }

  private static List<String> fieldNames(JsonNode node) {
    List<String> names = new ArrayList<>();
    Iterator<String> it = node.fieldNames();
    while (it.hasNext()) {
      names.add(it.next());
    }
    return names;
  }

  @Test
  public void testOutputFileIsNamedAfterTheLog() throws Exception {
    JsonReportSink sink = new JsonReportSink(folder.getRoot());
    Assert.assertEquals("Extension replaced", new File(folder.getRoot(), "XY_0001_derived_quantities.json"),
        sink.outputFileFor("XY_0001.CSV"));
  }

  @Test
  public void testWrittenDocument() throws Exception {
    JsonReportSink sink = new JsonReportSink(folder.getRoot());
    sink.write(result.getLogName(), result.getMainParameters(), result.getStepParameters());

    File out = sink.outputFileFor(result.getLogName());
    Assert.assertTrue("Report written", out.exists());
    JsonNode root = new ObjectMapper().readTree(out);
    Assert.assertEquals("Top level sections", Arrays.asList("main_params", "step_params"), fieldNames(root));

    JsonNode main = root.get("main_params");
    Assert.assertEquals("Log start", "2024-08-02T10:00:00.000", main.get("log_start_time").asText());
    JsonNode deposition = main.get("deposition");
    Assert.assertEquals("Deposition start", "2024-08-02T10:01:40.000", deposition.get("start_time").asText());
    Assert.assertEquals("Durations are written in seconds", 299.0, deposition.get("duration").asDouble(), 0.0);
    Assert.assertTrue("Room temperature run", deposition.get("rt").asBoolean());
    Assert.assertEquals("Ramp ups per source", Arrays.asList("s1", "s2", "s3"),
        fieldNames(main.get("source_ramp_up")));
    Assert.assertFalse("No substrate ramp at room temperature", main.has("sub_ramp_up"));

    JsonNode steps = root.get("step_params");
    List<String> stepIds = fieldNames(steps);
    Assert.assertEquals("Deposition is the last step", "deposition", stepIds.get(stepIds.size() - 1));
    Assert.assertTrue("The deposition creates a film",
        steps.get("deposition").get("creates_new_thin_film").asBoolean());
    Assert.assertEquals("All three sources deposit", Arrays.asList("s1", "s2", "s3"),
        fieldNames(steps.get("deposition").get("sources")));
  }
}
