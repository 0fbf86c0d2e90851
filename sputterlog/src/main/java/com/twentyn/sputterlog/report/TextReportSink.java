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

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class TextReportSink implements ReportSink {
  private static final Logger LOGGER = LogManager.getFormatterLogger(TextReportSink.class);

  public static final String FILE_SUFFIX = "_derived_quantities.txt";

  private final File outputDir;

  public TextReportSink(File outputDir) {
    this.outputDir = outputDir;
  }

  public File outputFileFor(String logName) {
    return new File(outputDir, FilenameUtils.getBaseName(logName) + FILE_SUFFIX);
  }

  @Override
  public void write(String logName, MainParameters mainParameters, List<StepParameters> stepParameters)
      throws IOException {
    File out = outputFileFor(logName);
    FileUtils.writeStringToFile(out, TextReport.render(logName, mainParameters, stepParameters),
        StandardCharsets.UTF_8);
    LOGGER.info("Wrote text report of %s to %s", logName, out.getAbsolutePath());
  }
}
