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

import java.util.Map;

/**
 * Target voltage over the deposition: the discharge voltage for DC supplies, the self bias for RF.
 */
public class VoltageStatistics {
  private final Double start;
  private final Double end;
  private final Double mean;
  private final Double min;
  private final Double max;
  private final Double std;

  public VoltageStatistics(Double start, Double end, Double mean, Double min, Double max, Double std) {
    this.start = start;
    this.end = end;
    this.mean = mean;
    this.min = min;
    this.max = max;
    this.std = std;
  }

  public Double getStart() {
    return start;
  }

  public Double getEnd() {
    return end;
  }

  public Double getMean() {
    return mean;
  }

  public Double getMin() {
    return min;
  }

  public Double getMax() {
    return max;
  }

  public Double getStd() {
    return std;
  }

  public void putInto(Map<String, Object> map) {
    ReportMaps.putIfPresent(map, "start_voltage", start);
    ReportMaps.putIfPresent(map, "end_voltage", end);
    ReportMaps.putIfPresent(map, "avg_voltage", mean);
    ReportMaps.putIfPresent(map, "min_voltage", min);
    ReportMaps.putIfPresent(map, "max_voltage", max);
    ReportMaps.putIfPresent(map, "std_voltage", std);
  }
}
