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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.sputterlog.util.json.ReportObjectMapper;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes {@code <log name>_derived_quantities.json} holding the main and the step parameters.
 */
public class JsonReportSink implements ReportSink {
  private static final Logger LOGGER = LogManager.getFormatterLogger(JsonReportSink.class);
  private static final ObjectMapper OBJECT_MAPPER = ReportObjectMapper.create();

  public static final String FILE_SUFFIX = "_derived_quantities.json";

  private final File outputDir;

  public JsonReportSink(File outputDir) {
    this.outputDir = outputDir;
  }

  public File outputFileFor(String logName) {
    return new File(outputDir, FilenameUtils.getBaseName(logName) + FILE_SUFFIX);
  }

  /** The document written for a log, exposed for callers that serialize elsewhere. */
  public static Map<String, Object> toDocument(MainParameters mainParameters, List<StepParameters> stepParameters) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("main_params", mainParameters.toReportMap());
    document.put("step_params", StepParameters.toReportMap(stepParameters));
    return document;
  }

  @Override
  public void write(String logName, MainParameters mainParameters, List<StepParameters> stepParameters)
      throws IOException {
    File out = outputFileFor(logName);
    OBJECT_MAPPER.writeValue(out, toDocument(mainParameters, stepParameters));
    LOGGER.info("Wrote derived quantities of %s to %s", logName, out.getAbsolutePath());
  }
}
