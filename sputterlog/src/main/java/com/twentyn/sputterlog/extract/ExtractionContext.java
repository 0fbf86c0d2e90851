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

import com.twentyn.sputterlog.condition.ConditionBuilder;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.report.DepositionParameters;
import com.twentyn.sputterlog.source.SourceBinding;
import com.twentyn.sputterlog.timeseries.TimeSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a processed log handed to the parameter extractors: the finalized events, the sources and the
 * deposition parameters once they exist.  Adding the deposition parameters yields a new context.
 */
public class ExtractionContext {
  private final String logName;
  private final TimeSeries series;
  private final SegmentationThresholds thresholds;
  private final List<Integer> sources;
  private final Map<Integer, SourceBinding> bindings;
  private final Map<String, LogEvent> events;
  private final Map<String, Integer> detectedCounts;
  private final boolean temperatureControlObserved;
  private final DepositionParameters depositionParameters;

  /**
   * @param events         finalized events keyed by step id
   * @param detectedCounts number of occurrences found for an event before only the last one was kept, by step id
   */
  public ExtractionContext(String logName, TimeSeries series, SegmentationThresholds thresholds,
                           List<Integer> sources, Map<Integer, SourceBinding> bindings, Map<String, LogEvent> events,
                           Map<String, Integer> detectedCounts, boolean temperatureControlObserved) {
    this(logName, series, thresholds, Collections.unmodifiableList(new ArrayList<>(sources)),
        Collections.unmodifiableMap(new LinkedHashMap<>(bindings)),
        Collections.unmodifiableMap(new LinkedHashMap<>(events)),
        Collections.unmodifiableMap(new LinkedHashMap<>(detectedCounts)), temperatureControlObserved, null);
  }

  private ExtractionContext(String logName, TimeSeries series, SegmentationThresholds thresholds,
                            List<Integer> sources, Map<Integer, SourceBinding> bindings,
                            Map<String, LogEvent> events, Map<String, Integer> detectedCounts,
                            boolean temperatureControlObserved, DepositionParameters depositionParameters) {
    this.logName = logName;
    this.series = series;
    this.thresholds = thresholds;
    this.sources = sources;
    this.bindings = bindings;
    this.events = events;
    this.detectedCounts = detectedCounts;
    this.temperatureControlObserved = temperatureControlObserved;
    this.depositionParameters = depositionParameters;
  }

  public ExtractionContext withDepositionParameters(DepositionParameters parameters) {
    return new ExtractionContext(logName, series, thresholds, sources, bindings, events, detectedCounts,
        temperatureControlObserved, parameters);
  }

  public String getLogName() {
    return logName;
  }

  public TimeSeries getSeries() {
    return series;
  }

  public SegmentationThresholds getThresholds() {
    return thresholds;
  }

  public ConditionBuilder conditions() {
    return new ConditionBuilder(series, thresholds);
  }

  public List<Integer> getSources() {
    return sources;
  }

  public Map<Integer, SourceBinding> getBindings() {
    return bindings;
  }

  public boolean isTemperatureControlObserved() {
    return temperatureControlObserved;
  }

  public LogEvent getEvent(EventCategory category) {
    return requireEvent(category.getKey(), category);
  }

  public LogEvent getEvent(EventCategory category, int source) {
    return requireEvent(String.format("%s_s%d", category.getKey(), source), category);
  }

  public boolean hasEvent(EventCategory category, int source) {
    return events.containsKey(String.format("%s_s%d", category.getKey(), source));
  }

  private LogEvent requireEvent(String stepId, EventCategory category) {
    LogEvent event = events.get(stepId);
    if (event == null) {
      throw new IllegalStateException(String.format(
          "No %s event (%s) in the context of %s", category, stepId, logName));
    }
    return event;
  }

  public LogEvent getDeposition() {
    return getEvent(EventCategory.DEPOSITION);
  }

  /** Occurrences found before the last-before-deposition selection, or the current count if none was applied. */
  public int getDetectedCount(LogEvent event) {
    Integer count = detectedCounts.get(event.getStepId());
    return count != null ? count : event.getNumEvents();
  }

  public DepositionParameters getDepositionParameters() {
    if (depositionParameters == null) {
      throw new IllegalStateException(String.format(
          "Deposition parameters of %s are needed but have not been extracted yet", logName));
    }
    return depositionParameters;
  }

  public List<LogEvent> getEvents() {
    return new ArrayList<>(events.values());
  }
}
