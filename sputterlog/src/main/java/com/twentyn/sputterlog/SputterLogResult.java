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

package com.twentyn.sputterlog;

import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.report.MainParameters;
import com.twentyn.sputterlog.report.StepParameters;
import com.twentyn.sputterlog.source.SourceBinding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything read from one log: the finalized events, their occurrences in time order and the derived quantities.
 */
public class SputterLogResult {
  private final String logName;
  private final Map<String, LogEvent> events;
  private final List<LogEvent> timeline;
  private final Map<Integer, SourceBinding> bindings;
  private final MainParameters mainParameters;
  private final List<StepParameters> stepParameters;

  public SputterLogResult(String logName, Map<String, LogEvent> events, List<LogEvent> timeline,
                          Map<Integer, SourceBinding> bindings, MainParameters mainParameters,
                          List<StepParameters> stepParameters) {
    this.logName = logName;
    this.events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
    this.timeline = Collections.unmodifiableList(timeline);
    this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    this.mainParameters = mainParameters;
    this.stepParameters = Collections.unmodifiableList(stepParameters);
  }

  public String getLogName() {
    return logName;
  }

  /** Events keyed by step id, in the order they were built. */
  public Map<String, LogEvent> getEvents() {
    return events;
  }

  public LogEvent getEvent(String stepId) {
    return events.get(stepId);
  }

  /** One single-domain event per occurrence of every non-empty event, ordered by start time then step id. */
  public List<LogEvent> getTimeline() {
    return timeline;
  }

  public Map<Integer, SourceBinding> getBindings() {
    return bindings;
  }

  public MainParameters getMainParameters() {
    return mainParameters;
  }

  public List<StepParameters> getStepParameters() {
    return stepParameters;
  }

  public Map<String, Object> getMainParametersMap() {
    return mainParameters.toReportMap();
  }

  public Map<String, Object> getStepParametersMap() {
    return StepParameters.toReportMap(stepParameters);
  }
}
