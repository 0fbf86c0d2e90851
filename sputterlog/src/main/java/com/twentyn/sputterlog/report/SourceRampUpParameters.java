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

import org.joda.time.LocalDateTime;

import java.util.LinkedHashMap;
import java.util.Map;

public class SourceRampUpParameters implements ReportSection {
  private final int source;
  private final boolean enabled;
  private Integer numEvents;
  private Boolean ignition;
  private LocalDateTime ignitionTime;
  private Double ignitionPower;
  private Double ignitionPressure;
  private Double rampRate;

  public SourceRampUpParameters(int source, boolean enabled) {
    this.source = source;
    this.enabled = enabled;
  }

  public int getSource() {
    return source;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Integer getNumEvents() {
    return numEvents;
  }

  public void setNumEvents(Integer numEvents) {
    this.numEvents = numEvents;
  }

  public Boolean getIgnition() {
    return ignition;
  }

  public LocalDateTime getIgnitionTime() {
    return ignitionTime;
  }

  public Double getIgnitionPower() {
    return ignitionPower;
  }

  public Double getIgnitionPressure() {
    return ignitionPressure;
  }

  public void setNoIgnition() {
    this.ignition = false;
  }

  public void setIgnition(LocalDateTime time, Double power, Double pressure) {
    this.ignition = true;
    this.ignitionTime = time;
    this.ignitionPower = power;
    this.ignitionPressure = pressure;
  }

  /** Output setpoint increase over the last ramp, in W/min. */
  public Double getRampRate() {
    return rampRate;
  }

  public void setRampRate(Double rampRate) {
    this.rampRate = rampRate;
  }

  @Override
  public Map<String, Object> toReportMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("enabled", enabled);
    ReportMaps.putIfPresent(map, "num_events", numEvents);
    ReportMaps.putIfPresent(map, "source_ignition", ignition);
    ReportMaps.putIfPresent(map, "source_ignition_time", ignitionTime);
    ReportMaps.putIfPresent(map, "source_ignition_power", ignitionPower);
    ReportMaps.putIfPresent(map, "source_ignition_pressure", ignitionPressure);
    ReportMaps.putIfPresent(map, "ramp_rate", rampRate);
    return map;
  }
}
