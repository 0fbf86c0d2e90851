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

import com.twentyn.sputterlog.condition.Condition;
import com.twentyn.sputterlog.event.Domain;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.event.EventRefiner;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.report.StepParameters;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.TimeSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the process-step events into a time-ordered list of steps, one per occurrence.
 */
public class StepParametersExtractor {
  public static final Comparator<LogEvent> BY_START_THEN_STEP_ID = new Comparator<LogEvent>() {
    @Override
    public int compare(LogEvent a, LogEvent b) {
      int byStart = Long.compare(a.getStart(), b.getStart());
      return byStart != 0 ? byStart : a.getStepId().compareTo(b.getStepId());
    }
  };

  /** Occurrences of every process-step event, ordered by start time, ties broken by step id. */
  public static List<LogEvent> processSteps(ExtractionContext ctx) {
    List<LogEvent> steps = new ArrayList<>();
    for (LogEvent event : ctx.getEvents()) {
      if (event.getCategory().isProcessStep()) {
        steps.add(event);
      }
    }
    List<LogEvent> unfolded = EventRefiner.unfoldEvents(steps);
    Collections.sort(unfolded, BY_START_THEN_STEP_ID);
    return unfolded;
  }

  public List<StepParameters> extract(ExtractionContext ctx) {
    TimeSeries series = ctx.getSeries();
    List<StepParameters> result = new ArrayList<>();
    for (LogEvent step : processSteps(ctx)) {
      Domain domain = step.getDomains().get(0);
      StepParameters params = new StepParameters(step.getStepId(), step.getName(), step.getCategory(),
          domain.getStartTime(), domain.getEndTime());

      Condition span = spanOf(series, domain);
      for (int source : ctx.getSources()) {
        Condition plasma = ctx.getEvent(EventCategory.SOURCE_ON, source).getCondition().and(span);
        if (plasma.any()) {
          params.addSource(source,
              ChannelStatistics.mean(series, Channels.source(source, Channels.OUTPUT_SETPOINT), plasma));
        }
      }

      Condition rows = step.getRows();
      params.setEnvironment(
          ChannelStatistics.mean(series, Channels.CAPMAN_PRESSURE, rows),
          PhaseStatistics.gasFlows(ctx, rows),
          ChannelStatistics.mean(series, Channels.HEATER_SETPOINT, rows));
      result.add(params);
    }
    return result;
  }

  // Every sample within the domain bounds, whether or not the step's condition holds there.
  private static Condition spanOf(TimeSeries series, Domain domain) {
    boolean[] mask = new boolean[series.size()];
    for (int i = 0; i < mask.length; i++) {
      mask[i] = domain.contains(series.getTime(i));
    }
    return Condition.of(mask);
  }
}
