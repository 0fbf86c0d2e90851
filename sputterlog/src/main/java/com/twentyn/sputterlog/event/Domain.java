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

import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.joda.time.Duration;
import org.joda.time.LocalDateTime;

/**
 * A closed time interval [start, end] over which a condition holds with acceptable continuity.  Bounds are the
 * series' naive millisecond timestamps.
 */
public final class Domain implements Comparable<Domain> {
  private final long start;
  private final long end;

  public Domain(long start, long end) {
    if (end < start) {
      throw new IllegalArgumentException(String.format("Domain end %d precedes its start %d", end, start));
    }
    this.start = start;
    this.end = end;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public LocalDateTime getStartTime() {
    return TimeSeries.toLocalDateTime(start);
  }

  public LocalDateTime getEndTime() {
    return TimeSeries.toLocalDateTime(end);
  }

  public long getDurationMillis() {
    return end - start;
  }

  public Duration getDuration() {
    return new Duration(end - start);
  }

  public boolean contains(long time) {
    return time >= start && time <= end;
  }

  public boolean overlaps(Domain other) {
    return start <= other.end && other.start <= end;
  }

  /** The smallest domain covering both this one and the other. */
  public Domain span(Domain other) {
    return new Domain(Math.min(start, other.start), Math.max(end, other.end));
  }

  @Override
  public int compareTo(Domain o) {
    int c = Long.compare(start, o.start);
    return c != 0 ? c : Long.compare(end, o.end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Domain domain = (Domain) o;
    return start == domain.start && end == domain.end;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(start) + Long.hashCode(end);
  }

  @Override
  public String toString() {
    return String.format("[%s, %s]", getStartTime(), getEndTime());
  }
}
