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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partitions the samples selected by a condition into domains.  A gap between consecutive selected samples wider
 * than {@code continuityLimit} average timesteps starts a new domain; domains lasting less than
 * {@code minDomainSize} average timesteps are noise and are dropped.
 */
public class DomainExtractor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DomainExtractor.class);

  private DomainExtractor() {
  }

  /**
   * @param times           timestamps of the whole series
   * @param rows            samples that satisfy the condition
   * @param avgTimestep     average sampling interval of the whole series, in ms
   * @param continuityLimit tolerated gap, in average timesteps
   * @param minDomainSize   minimal domain duration, in average timesteps
   * @return disjoint domains ordered by start time
   */
  public static List<Domain> extract(long[] times, Condition rows, double avgTimestep, double continuityLimit,
                                     double minDomainSize) {
    if (rows.size() != times.length) {
      throw new IllegalArgumentException(String.format(
          "Condition covers %d samples but the series has %d", rows.size(), times.length));
    }
    if (rows.none()) {
      return Collections.emptyList();
    }

    double maxGap = continuityLimit * avgTimestep;
    double minDuration = minDomainSize * avgTimestep;

    List<Domain> bounds = new ArrayList<>();
    int previous = -1;
    long start = 0L;
    for (int i = 0; i < times.length; i++) {
      if (!rows.get(i)) {
        continue;
      }
      if (previous < 0) {
        start = times[i];
      } else if (times[i] - times[previous] > maxGap) {
        bounds.add(new Domain(start, times[previous]));
        start = times[i];
      }
      previous = i;
    }
    bounds.add(new Domain(start, times[previous]));

    List<Domain> domains = new ArrayList<>(bounds.size());
    for (Domain d : bounds) {
      if (d.getDurationMillis() >= minDuration) {
        domains.add(d);
      }
    }
    if (domains.size() < bounds.size()) {
      LOGGER.debug("Dropped %d of %d domains shorter than %.0f ms", bounds.size() - domains.size(), bounds.size(),
          minDuration);
    }
    return domains;
  }
}
