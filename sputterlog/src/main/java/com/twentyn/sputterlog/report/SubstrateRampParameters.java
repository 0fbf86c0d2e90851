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
import org.joda.time.LocalDateTime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quantities shared by the heating and cooling ramps of the substrate.
 */
public abstract class SubstrateRampParameters implements ReportSection {
  private final int numEvents;
  private LocalDateTime startTime;
  private LocalDateTime endTime;
  private Double tempSlope;
  private Duration timePlateau;
  private GasFlows flows;
  private CrackerParameters cracker = CrackerParameters.disabled();

  protected SubstrateRampParameters(int numEvents) {
    this.numEvents = numEvents;
  }

  public int getNumEvents() {
    return numEvents;
  }

  public LocalDateTime getStartTime() {
    return startTime;
  }

  public LocalDateTime getEndTime() {
    return endTime;
  }

  public void setBounds(LocalDateTime startTime, LocalDateTime endTime) {
    this.startTime = startTime;
    this.endTime = endTime;
  }

  public Duration getDuration() {
    return startTime == null || endTime == null ? null : ReportMaps.between(startTime, endTime);
  }

  /** Setpoint change rate in degrees C per minute, positive for both directions. */
  public Double getTempSlope() {
    return tempSlope;
  }

  public void setTempSlope(Double tempSlope) {
    this.tempSlope = tempSlope;
  }

  /** Time spent at constant temperature between the ramp and the deposition. */
  public Duration getTimePlateau() {
    return timePlateau;
  }

  public void setTimePlateau(Duration timePlateau) {
    this.timePlateau = timePlateau;
  }

  public GasFlows getFlows() {
    return flows;
  }

  public void setFlows(GasFlows flows) {
    this.flows = flows;
  }

  public CrackerParameters getCracker() {
    return cracker;
  }

  public void setCracker(CrackerParameters cracker) {
    this.cracker = cracker;
  }

  protected abstract void putCounts(Map<String, Object> map);

  protected abstract void putExtra(Map<String, Object> map);

  @Override
  public Map<String, Object> toReportMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    putCounts(map);
    ReportMaps.putIfPresent(map, "start_time", startTime);
    ReportMaps.putIfPresent(map, "end_time", endTime);
    ReportMaps.putIfPresent(map, "duration", getDuration());
    ReportMaps.putIfPresent(map, "temp_slope", tempSlope);
    ReportMaps.putIfPresent(map, "time_plateau", timePlateau);
    putExtra(map);
    if (flows != null) {
      flows.putInto(map);
    }
    ReportMaps.putSection(map, "cracker", cracker);
    return map;
  }
}
