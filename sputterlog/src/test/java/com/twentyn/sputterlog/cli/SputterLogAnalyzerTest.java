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

package com.twentyn.sputterlog.cli;

import com.twentyn.sputterlog.DepositionUnicityException;
import com.twentyn.sputterlog.SputterLogReader;
import com.twentyn.sputterlog.SputterLogResult;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.report.MainParameters;
import com.twentyn.sputterlog.report.ReportSink;
import com.twentyn.sputterlog.report.StepParameters;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.MissingOptionException;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class SputterLogAnalyzerTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private SputterLogReader mockReader;
  private ReportSink mockSink;
  private SputterLogResult mockResult;
  private MainParameters mockMainParameters;
  private List<StepParameters> steps;

  @Before
  public void setUp() throws Exception {
    mockReader = Mockito.mock(SputterLogReader.class);
    mockSink = Mockito.mock(ReportSink.class);
    mockResult = Mockito.mock(SputterLogResult.class);
    mockMainParameters = Mockito.mock(MainParameters.class);
    steps = Collections.emptyList();

    Mockito.doReturn("good.CSV").when(mockResult).getLogName();
    Mockito.doReturn(mockMainParameters).when(mockResult).getMainParameters();
    Mockito.doReturn(steps).when(mockResult).getStepParameters();
    Mockito.doReturn(Collections.<LogEvent>emptyList()).when(mockResult).getTimeline();
  }

  @Test
  public void testFailingLogsDoNotStopTheBatch() throws Exception {
    File bad = new File("bad.CSV");
    File unreadable = new File("unreadable.CSV");
    File good = new File("good.CSV");
    Mockito.doThrow(new DepositionUnicityException("bad.CSV", 2)).when(mockReader).read(bad);
    Mockito.doThrow(new IOException("truncated file")).when(mockReader).read(unreadable);
    Mockito.doReturn(mockResult).when(mockReader).read(good);

    SputterLogAnalyzer analyzer =
        new SputterLogAnalyzer(mockReader, Collections.singletonList(mockSink), null);
    int failures = analyzer.processAll(Arrays.asList(bad, unreadable, good));

    Assert.assertEquals("Two logs failed", 2, failures);
    Mockito.verify(mockReader).read(good);
    Mockito.verify(mockSink, Mockito.times(1)).write("good.CSV", mockMainParameters, steps);
  }

  @Test
  public void testTimelineIsWrittenNextToTheReports() throws Exception {
    File good = new File("good.CSV");
    Mockito.doReturn(mockResult).when(mockReader).read(good);

    SputterLogAnalyzer analyzer =
        new SputterLogAnalyzer(mockReader, Collections.<ReportSink>emptyList(), folder.getRoot());
    Assert.assertSame("Result is handed back", mockResult, analyzer.process(good));
    Assert.assertTrue("Timeline written", new File(folder.getRoot(), "good" + SputterLogAnalyzer.TIMELINE_SUFFIX)
        .exists());
  }

  @Test
  public void testFindLogs() throws Exception {
    File a = folder.newFile("a.CSV");
    File b = folder.newFile("b.csv");
    folder.newFile("notes.txt");
    folder.newFolder("archive");

    Assert.assertEquals("Logs of a directory, sorted", Arrays.asList(a, b),
        SputterLogAnalyzer.findLogs(folder.getRoot()));
    Assert.assertEquals("A single log", Collections.singletonList(a), SputterLogAnalyzer.findLogs(a));
  }

  @Test
  public void testCommandLine() throws Exception {
    CLIUtil cliUtil = new CLIUtil(SputterLogAnalyzer.class, SputterLogAnalyzer.HELP_MESSAGE,
        SputterLogAnalyzer.OPTION_BUILDERS);
    CommandLine cl = cliUtil.parse(new String[] {"--input", "logs", "-t", "-o", "out"});
    Assert.assertEquals("Input", "logs", cl.getOptionValue(SputterLogAnalyzer.OPTION_INPUT));
    Assert.assertEquals("Output directory", "out", cl.getOptionValue(SputterLogAnalyzer.OPTION_OUTPUT_DIR));
    Assert.assertTrue("Text report", cl.hasOption(SputterLogAnalyzer.OPTION_TEXT_REPORT));
    Assert.assertFalse("No timeline", cl.hasOption(SputterLogAnalyzer.OPTION_TIMELINE));
    Assert.assertTrue("Help is always available",
        cliUtil.parse(new String[] {"-i", "logs", "--help"}).hasOption(CLIUtil.OPTION_HELP));
    Assert.assertTrue("Help needs no other option", cliUtil.requestsHelp(new String[] {"-h"}));
    Assert.assertFalse("No help by default", cliUtil.requestsHelp(new String[] {"-i", "logs"}));
  }

  @Test(expected = MissingOptionException.class)
  public void testInputIsRequired() throws Exception {
    new CLIUtil(SputterLogAnalyzer.class, SputterLogAnalyzer.HELP_MESSAGE, SputterLogAnalyzer.OPTION_BUILDERS)
        .parse(new String[] {"-t"});
  }
}
