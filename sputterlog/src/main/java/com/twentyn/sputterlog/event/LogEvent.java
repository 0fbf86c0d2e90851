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

package com.twentyn.sputterlog.event;

import com.twentyn.sputterlog.condition.Condition;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A process phase detected in a sputter log: a condition over the series, the domains over which it holds and the
 * samples it selects.
 *
 * The rows of an event are the samples that satisfy its condition and fall within one of its domains.  Whenever the
 * domain list changes, the rows and the per-domain views are recomputed before anything can read them.  Once its
 * parameters have been extracted, an event is frozen.
 */
public class LogEvent {
  private final String name;
  private final EventCategory category;
  private final Integer source;
  private final Integer stepIndex;
  private final TimeSeries series;

  private EventState state = EventState.UNBOUND;
  private Condition condition;
  private List<Domain> domains = Collections.emptyList();
  private Condition rows;
  private List<Condition> occurrenceRows = Collections.emptyList();

  public LogEvent(EventCategory category, Integer source, TimeSeries series) {
    this(category.displayName(source), category, source, null, series);
  }

  private LogEvent(String name, EventCategory category, Integer source, Integer stepIndex, TimeSeries series) {
    if (category.isPerSource() != (source != null)) {
      throw new IllegalArgumentException(String.format(
          "Category %s %s a source", category, category.isPerSource() ? "requires" : "does not take"));
    }
    this.name = name;
    this.category = category;
    this.source = source;
    this.stepIndex = stepIndex;
    this.series = series;
  }

  public void setCondition(Condition condition) {
    requireState("set a condition", EventState.UNBOUND, EventState.CONDITIONED);
    if (condition.size() != series.size()) {
      throw new IllegalArgumentException(String.format(
          "Condition of %s covers %d samples, series has %d", name, condition.size(), series.size()));
    }
    this.condition = condition;
    this.state = EventState.CONDITIONED;
  }

  /**
   * Extracts domains from every sample satisfying the condition.  Running it again on an event that already has
   * domains is a refinement (e.g. re-extraction with a larger continuity limit).
   */
  public void extractDomains(double avgTimestep, double continuityLimit, double minDomainSize) {
    requireState("extract domains", EventState.CONDITIONED, EventState.DOMAIN_EXTRACTED, EventState.REFINED);
    EventState next = state == EventState.CONDITIONED ? EventState.DOMAIN_EXTRACTED : EventState.REFINED;
    applyDomains(DomainExtractor.extract(series.getTimes(), condition, avgTimestep, continuityLimit, minDomainSize));
    state = next;
  }

  public void replaceDomains(List<Domain> newDomains) {
    requireState("refine domains", EventState.DOMAIN_EXTRACTED, EventState.REFINED);
    applyDomains(newDomains);
    state = EventState.REFINED;
  }

  /** Freezes the event.  Calling it again is harmless. */
  public void markParametersExtracted() {
    if (state == EventState.PARAMETERS_EXTRACTED) {
      return;
    }
    requireState("finalize", EventState.DOMAIN_EXTRACTED, EventState.REFINED);
    state = EventState.PARAMETERS_EXTRACTED;
  }

  private void applyDomains(List<Domain> newDomains) {
    List<Domain> sorted = new ArrayList<>(newDomains);
    Collections.sort(sorted);
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i - 1).overlaps(sorted.get(i))) {
        throw new IllegalArgumentException(String.format(
            "Domains %s and %s of %s overlap", sorted.get(i - 1), sorted.get(i), name));
      }
    }
    this.domains = Collections.unmodifiableList(sorted);

    long[] times = series.getTimes();
    List<boolean[]> perDomain = new ArrayList<>(sorted.size());
    for (int d = 0; d < sorted.size(); d++) {
      perDomain.add(new boolean[times.length]);
    }
    boolean[] all = new boolean[times.length];
    int d = 0;
    for (int i = 0; i < times.length && d < sorted.size(); i++) {
      while (d < sorted.size() && times[i] > sorted.get(d).getEnd()) {
        d++;
      }
      if (d < sorted.size() && condition.get(i) && sorted.get(d).contains(times[i])) {
        all[i] = true;
        perDomain.get(d)[i] = true;
      }
    }
    this.rows = Condition.of(all);
    List<Condition> views = new ArrayList<>(perDomain.size());
    for (boolean[] mask : perDomain) {
      views.add(Condition.of(mask));
    }
    this.occurrenceRows = Collections.unmodifiableList(views);
  }

  /**
   * A single-domain event standing for occurrence {@code index} of this one, named "name(index)".
   */
  public LogEvent occurrence(int index) {
    requireDomains();
    LogEvent sub = new LogEvent(String.format("%s(%d)", name, index), category, source, index, series);
    sub.condition = condition;
    sub.applyDomains(Collections.singletonList(domains.get(index)));
    sub.state = state;
    return sub;
  }

  public String getName() {
    return name;
  }

  public EventCategory getCategory() {
    return category;
  }

  public Integer getSource() {
    return source;
  }

  public Integer getStepIndex() {
    return stepIndex;
  }

  public EventState getState() {
    return state;
  }

  public TimeSeries getSeries() {
    return series;
  }

  /** Unique key of this event in the step report: {@code <category>[_s<source>][_n<index>]}. */
  public String getStepId() {
    StringBuilder sb = new StringBuilder(category.getKey());
    if (source != null) {
      sb.append("_s").append(source);
    }
    if (stepIndex != null) {
      sb.append("_n").append(stepIndex);
    }
    return sb.toString();
  }

  public Condition getCondition() {
    if (condition == null) {
      throw new IllegalStateException(String.format("Event %s has no condition yet", name));
    }
    return condition;
  }

  public List<Domain> getDomains() {
    requireDomains();
    return domains;
  }

  public int getNumEvents() {
    return getDomains().size();
  }

  public boolean isEmpty() {
    return getDomains().isEmpty();
  }

  /** Samples satisfying the condition within any domain. */
  public Condition getRows() {
    requireDomains();
    return rows;
  }

  /** Samples satisfying the condition within domain {@code index}. */
  public Condition getOccurrenceRows(int index) {
    requireDomains();
    return occurrenceRows.get(index);
  }

  public List<String> getOccurrenceNames() {
    requireDomains();
    List<String> names = new ArrayList<>(domains.size());
    for (int i = 0; i < domains.size(); i++) {
      names.add(String.format("%s(%d)", name, i));
    }
    return names;
  }

  /** Start of the first domain; the event must not be empty. */
  public long getStart() {
    return firstDomain().getStart();
  }

  /** End of the last domain; the event must not be empty. */
  public long getEnd() {
    List<Domain> ds = getDomains();
    if (ds.isEmpty()) {
      throw new IllegalStateException(String.format("Event %s has no domain", name));
    }
    return ds.get(ds.size() - 1).getEnd();
  }

  /**
   * Mean of a channel over each occurrence, NaN where the channel is absent or has no finite value.
   */
  public double[] meanPerOccurrence(String channel) {
    requireDomains();
    double[] means = new double[domains.size()];
    double[] values = series.getNumeric(channel);
    for (int d = 0; d < domains.size(); d++) {
      means[d] = Double.NaN;
      if (values == null) {
        continue;
      }
      DescriptiveStatistics stats = new DescriptiveStatistics();
      for (int i : occurrenceRows.get(d).indices()) {
        if (!Double.isNaN(values[i])) {
          stats.addValue(values[i]);
        }
      }
      if (stats.getN() > 0) {
        means[d] = stats.getMean();
      }
    }
    return means;
  }

  private Domain firstDomain() {
    List<Domain> ds = getDomains();
    if (ds.isEmpty()) {
      throw new IllegalStateException(String.format("Event %s has no domain", name));
    }
    return ds.get(0);
  }

  private void requireDomains() {
    if (!state.hasDomains()) {
      throw new IllegalStateException(String.format(
          "Event %s is %s, its domains have not been extracted", name, state));
    }
  }

  private void requireState(String action, EventState... allowed) {
    for (EventState s : allowed) {
      if (state == s) {
        return;
      }
    }
    throw new IllegalStateException(String.format("Cannot %s for event %s in state %s", action, name, state));
  }

  @Override
  public String toString() {
    return String.format("LogEvent{%s, %s, %s}", getStepId(), state, domains);
  }
}
