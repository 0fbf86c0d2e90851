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

import com.twentyn.sputterlog.DepositionUnicityException;
import com.twentyn.sputterlog.condition.Condition;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Post-processing applied to events after their first domain extraction.
 */
public class EventRefiner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(EventRefiner.class);

  private final SegmentationThresholds thresholds;
  private final double avgTimestep;
  private final String logName;

  public EventRefiner(SegmentationThresholds thresholds, double avgTimestep, String logName) {
    this.thresholds = thresholds;
    this.avgTimestep = avgTimestep;
    this.logName = logName;
  }

  /**
   * Runs the initial domain extraction of an event with the continuity limit of its category.  The deposition limit
   * is reserved for {@link #disambiguateDeposition(LogEvent)}, so the first deposition pass uses the default one.
   */
  public void extract(LogEvent event) {
    event.extractDomains(avgTimestep, initialContinuityLimit(event.getCategory()), thresholds.getMinDomainSize());
    LOGGER.debug("%s: %d domain(s)", event.getName(), event.getDomains().size());
  }

  double initialContinuityLimit(EventCategory category) {
    return category == EventCategory.DEPOSITION ? thresholds.getDefaultContinuityLimit()
        : thresholds.getContinuityLimit(category);
  }

  /**
   * Merges consecutive ramp domains of a source whose output setpoint did not change across the gap, i.e. a ramp that
   * paused and then resumed.
   */
  public void stitch(LogEvent event, String setpointChannel) {
    List<Domain> stitched = stitch(event.getDomains(), event.getSeries(), event.getRows(), setpointChannel);
    if (stitched.size() != event.getDomains().size()) {
      LOGGER.debug("%s: stitched %d domains into %d", event.getName(), event.getDomains().size(), stitched.size());
      event.replaceDomains(stitched);
    }
  }

  /**
   * Pure form of {@link #stitch(LogEvent, String)}.  The setpoint at the end of a domain and at the start of the next
   * are read from the first selected sample at each of those times.  Missing or NaN setpoints never merge.  Applying
   * it to its own output returns an equal list.
   */
  public static List<Domain> stitch(List<Domain> domains, TimeSeries series, Condition rows, String setpointChannel) {
    List<Domain> result = new ArrayList<>(domains);
    double[] setpoint = series.getNumeric(setpointChannel);
    if (setpoint == null) {
      return result;
    }
    int i = 0;
    while (i < result.size() - 1) {
      int endRow = firstRowAt(series, rows, result.get(i).getEnd());
      int nextStartRow = firstRowAt(series, rows, result.get(i + 1).getStart());
      if (endRow >= 0 && nextStartRow >= 0 && !Double.isNaN(setpoint[endRow])
          && setpoint[endRow] == setpoint[nextStartRow]) {
        result.set(i, result.get(i).span(result.get(i + 1)));
        result.remove(i + 1);
      } else {
        i++;
      }
    }
    return result;
  }

  private static int firstRowAt(TimeSeries series, Condition rows, long time) {
    for (int row = 0; row < series.size(); row++) {
      if (rows.get(row) && series.getTime(row) == time) {
        return row;
      }
    }
    return -1;
  }

  /**
   * Reduces the deposition event to exactly one domain.  Short domains are dropped first; if several remain, the
   * domains are re-extracted with the deposition continuity limit so that an interrupted deposition merges back.
   *
   * @throws DepositionUnicityException if no single deposition domain can be identified
   */
  public void disambiguateDeposition(LogEvent deposition) throws DepositionUnicityException {
    List<Domain> domains = deposition.getDomains();
    if (domains.size() == 1) {
      return;
    }
    if (domains.isEmpty()) {
      throw new DepositionUnicityException(logName, 0);
    }

    double minDuration = thresholds.getDepositionMinDomainSize() * avgTimestep;
    List<Domain> large = new ArrayList<>();
    for (Domain d : domains) {
      if (d.getDurationMillis() >= minDuration) {
        large.add(d);
      }
    }
    if (large.size() == 1) {
      LOGGER.warn("%s: kept the only deposition domain longer than %.0f ms out of %d", logName, minDuration,
          domains.size());
      deposition.replaceDomains(large);
      return;
    }

    double limit = thresholds.getContinuityLimit(EventCategory.DEPOSITION);
    LOGGER.warn("%s: found %d deposition domains, re-extracting with a continuity limit of %.0f timesteps",
        logName, domains.size(), limit);
    deposition.extractDomains(avgTimestep, limit, thresholds.getMinDomainSize());
    int found = deposition.getDomains().size();
    if (found != 1) {
      throw new DepositionUnicityException(logName, found);
    }
  }

  /**
   * Keeps only the occurrence of {@code event} that starts last before {@code reference} starts.  The event is
   * emptied when no occurrence starts before it.
   */
  public void selectLastBefore(LogEvent event, LogEvent reference) {
    long limit = reference.getStart();
    Domain last = null;
    for (Domain d : event.getDomains()) {
      if (d.getStart() < limit) {
        last = d;
      }
    }
    if (last == null) {
      if (!event.isEmpty()) {
        LOGGER.debug("%s: no occurrence before %s", event.getName(), reference.getName());
      }
      event.replaceDomains(Collections.<Domain>emptyList());
    } else {
      event.replaceDomains(Collections.singletonList(last));
    }
  }

  /**
   * Flattens events into one event per occurrence.  Events with several domains are split into "name(i)" events
   * carrying the step index i, single-domain events are kept as they are and empty events are dropped.
   */
  public static List<LogEvent> unfoldEvents(Collection<LogEvent> events) {
    List<LogEvent> unfolded = new ArrayList<>();
    for (LogEvent event : events) {
      int n = event.getNumEvents();
      if (n == 1) {
        unfolded.add(event);
      } else {
        for (int i = 0; i < n; i++) {
          unfolded.add(event.occurrence(i));
        }
      }
    }
    return unfolded;
  }
}
