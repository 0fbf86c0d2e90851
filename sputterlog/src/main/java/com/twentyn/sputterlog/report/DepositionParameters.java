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

import com.twentyn.sputterlog.extract.TemperatureRegime;
import org.joda.time.Duration;
import org.joda.time.LocalDateTime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived quantities of the deposition.  Every later extractor reads the deposition through this object, so it is
 * built first and never modified afterwards.
 */
public class DepositionParameters implements ReportSection {
  private final TemperatureRegime temperatureRegime;
  private final int numEvents;
  private final LocalDateTime startTime;
  private final LocalDateTime endTime;
  private Double avgTemp1;
  private Double avgTemp2;
  private Double avgTempSetpoint;
  private Double avgTrueTemp;
  private Double avgCapmanPressure;
  private GasFlows flows;
  private PartialPressures partialPressures;
  private Double platenPosition;
  private CrackerParameters cracker = CrackerParameters.disabled();
  private Map<Integer, SourceDepositionParameters> sources = new LinkedHashMap<>();
  private Double sulfurDepositionRate;

  public DepositionParameters(TemperatureRegime temperatureRegime, int numEvents, LocalDateTime startTime,
                              LocalDateTime endTime) {
    this.temperatureRegime = temperatureRegime;
    this.numEvents = numEvents;
    this.startTime = startTime;
    this.endTime = endTime;
  }

  public TemperatureRegime getTemperatureRegime() {
    return temperatureRegime;
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

  public Duration getDuration() {
    return ReportMaps.between(startTime, endTime);
  }

  public Double getAvgTemp1() {
    return avgTemp1;
  }

  public Double getAvgTemp2() {
    return avgTemp2;
  }

  public void setAvgTemps(Double avgTemp1, Double avgTemp2, Double avgTempSetpoint, Double avgTrueTemp) {
    this.avgTemp1 = avgTemp1;
    this.avgTemp2 = avgTemp2;
    this.avgTempSetpoint = avgTempSetpoint;
    this.avgTrueTemp = avgTrueTemp;
  }

  public Double getAvgTempSetpoint() {
    return avgTempSetpoint;
  }

  public Double getAvgTrueTemp() {
    return avgTrueTemp;
  }

  public Double getAvgCapmanPressure() {
    return avgCapmanPressure;
  }

  public void setAvgCapmanPressure(Double avgCapmanPressure) {
    this.avgCapmanPressure = avgCapmanPressure;
  }

  public GasFlows getFlows() {
    return flows;
  }

  public void setFlows(GasFlows flows) {
    this.flows = flows;
  }

  public PartialPressures getPartialPressures() {
    return partialPressures;
  }

  public void setPartialPressures(PartialPressures partialPressures) {
    this.partialPressures = partialPressures;
  }

  public Double getPlatenPosition() {
    return platenPosition;
  }

  public void setPlatenPosition(Double platenPosition) {
    this.platenPosition = platenPosition;
  }

  public CrackerParameters getCracker() {
    return cracker;
  }

  public void setCracker(CrackerParameters cracker) {
    this.cracker = cracker;
  }

  public Map<Integer, SourceDepositionParameters> getSources() {
    return Collections.unmodifiableMap(sources);
  }

  public void addSource(SourceDepositionParameters source) {
    sources.put(source.getSource(), source);
  }

  public SourceDepositionParameters getSource(int source) {
    return sources.get(source);
  }

  /** Sources enabled during the deposition, ascending. */
  public List<Integer> getEnabledSources() {
    List<Integer> enabled = new ArrayList<>();
    for (SourceDepositionParameters p : sources.values()) {
      if (p.isEnabled()) {
        enabled.add(p.getSource());
      }
    }
    return enabled;
  }

  public boolean isSourceEnabled(int source) {
    SourceDepositionParameters p = sources.get(source);
    return p != null && p.isEnabled();
  }

  public Double getSulfurDepositionRate() {
    return sulfurDepositionRate;
  }

  public void setSulfurDepositionRate(Double sulfurDepositionRate) {
    this.sulfurDepositionRate = sulfurDepositionRate;
  }

  @Override
  public Map<String, Object> toReportMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    ReportMaps.putIfPresent(map, "rt", temperatureRegime.isRoomTemperature());
    map.put("temperature_regime", temperatureRegime.name());
    map.put("num_events", numEvents);
    map.put("start_time", startTime);
    map.put("end_time", endTime);
    map.put("duration", getDuration());
    ReportMaps.putIfPresent(map, "avg_temp_1", avgTemp1);
    ReportMaps.putIfPresent(map, "avg_temp_2", avgTemp2);
    ReportMaps.putIfPresent(map, "avg_temp_setpoint", avgTempSetpoint);
    ReportMaps.putIfPresent(map, "avg_true_temp", avgTrueTemp);
    ReportMaps.putIfPresent(map, "avg_capman_pressure", avgCapmanPressure);
    if (flows != null) {
      flows.putInto(map);
    }
    if (partialPressures != null) {
      partialPressures.putInto(map);
    }
    ReportMaps.putIfPresent(map, "platin_position", platenPosition);
    ReportMaps.putSection(map, "cracker", cracker);
    for (SourceDepositionParameters source : sources.values()) {
      map.put(ReportMaps.sourceKey(source.getSource()), source.toReportMap());
    }
    ReportMaps.putIfPresent(map, "sulfur_deposition_rate", sulfurDepositionRate);
    return map;
  }
}
