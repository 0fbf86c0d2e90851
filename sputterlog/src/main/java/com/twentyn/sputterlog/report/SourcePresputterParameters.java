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

import org.joda.time.Duration;

import java.util.LinkedHashMap;
import java.util.Map;

public class SourcePresputterParameters implements ReportSection {
  private final int source;
  private final boolean enabled;
  private Duration duration;
  private Double avgOutputPower;
  private Double avgCapmanPressure;
  private Double avgArFlow;

  public SourcePresputterParameters(int source, boolean enabled) {
    this.source = source;
    this.enabled = enabled;
  }

  public int getSource() {
    return source;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** Total time spent presputtering, summed over all occurrences. */
  public Duration getDuration() {
    return duration;
  }

  public void setDuration(Duration duration) {
    this.duration = duration;
  }

  public Double getAvgOutputPower() {
    return avgOutputPower;
  }

  public void setAvgOutputPower(Double avgOutputPower) {
    this.avgOutputPower = avgOutputPower;
  }

  public Double getAvgCapmanPressure() {
    return avgCapmanPressure;
  }

  public void setAvgCapmanPressure(Double avgCapmanPressure) {
    this.avgCapmanPressure = avgCapmanPressure;
  }

  public Double getAvgArFlow() {
    return avgArFlow;
  }

  public void setAvgArFlow(Double avgArFlow) {
    this.avgArFlow = avgArFlow;
  }

  @Override
  public Map<String, Object> toReportMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("enabled", enabled);
    ReportMaps.putIfPresent(map, "duration", duration);
    ReportMaps.putIfPresent(map, "avg_output_power", avgOutputPower);
    ReportMaps.putIfPresent(map, "avg_capman_pressure", avgCapmanPressure);
    ReportMaps.putIfPresent(map, "avg_ar_flow", avgArFlow);
    return map;
  }
}
