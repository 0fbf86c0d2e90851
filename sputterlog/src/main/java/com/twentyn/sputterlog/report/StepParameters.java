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

import com.twentyn.sputterlog.event.EventCategory;
import org.joda.time.Duration;
import org.joda.time.LocalDateTime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of the deposition process as reported to the sample database: its bounds, the sources running during it
 * and the chamber environment.
 */
public class StepParameters implements ReportSection {
  private final String stepId;
  private final String name;
  private final EventCategory category;
  private final LocalDateTime startTime;
  private final LocalDateTime endTime;
  private final Map<Integer, Double> sourcePowers = new LinkedHashMap<>();
  private GasFlows flows;
  private Double avgCapmanPressure;
  private Double avgTempSetpoint;

  public StepParameters(String stepId, String name, EventCategory category, LocalDateTime startTime,
                        LocalDateTime endTime) {
    this.stepId = stepId;
    this.name = name;
    this.category = category;
    this.startTime = startTime;
    this.endTime = endTime;
  }

  public String getStepId() {
    return stepId;
  }

  public String getName() {
    return name;
  }

  public EventCategory getCategory() {
    return category;
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

  public boolean createsNewThinFilm() {
    return category.createsThinFilm();
  }

  /** Sources with plasma during the step, with their mean output power (null when the power is not logged). */
  public Map<Integer, Double> getSourcePowers() {
    return Collections.unmodifiableMap(sourcePowers);
  }

  public void addSource(int source, Double avgOutputPower) {
    sourcePowers.put(source, avgOutputPower);
  }

  public GasFlows getFlows() {
    return flows;
  }

  public Double getAvgCapmanPressure() {
    return avgCapmanPressure;
  }

  public Double getAvgTempSetpoint() {
    return avgTempSetpoint;
  }

  public void setEnvironment(Double avgCapmanPressure, GasFlows flows, Double avgTempSetpoint) {
    this.avgCapmanPressure = avgCapmanPressure;
    this.flows = flows;
    this.avgTempSetpoint = avgTempSetpoint;
  }

  @Override
  public Map<String, Object> toReportMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", name);
    map.put("category", category.getKey());
    map.put("start_time", startTime);
    map.put("end_time", endTime);
    map.put("duration", getDuration());
    map.put("creates_new_thin_film", createsNewThinFilm());

    Map<String, Object> sources = new LinkedHashMap<>();
    for (Map.Entry<Integer, Double> entry : sourcePowers.entrySet()) {
      Map<String, Object> source = new LinkedHashMap<>();
      ReportMaps.putIfPresent(source, "avg_output_power", entry.getValue());
      source.put("plasma_on", true);
      sources.put(ReportMaps.sourceKey(entry.getKey()), source);
    }
    map.put("sources", sources);

    Map<String, Object> environment = new LinkedHashMap<>();
    ReportMaps.putIfPresent(environment, "avg_capman_pressure", avgCapmanPressure);
    if (flows != null) {
      flows.putInto(environment);
    }
    ReportMaps.putIfPresent(environment, "avg_temp_setpoint", avgTempSetpoint);
    map.put("environment", environment);
    return map;
  }

  /** Step reports keyed by step id, in the order given. */
  public static Map<String, Object> toReportMap(List<StepParameters> steps) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (StepParameters step : steps) {
      map.put(step.getStepId(), step.toReportMap());
    }
    return map;
  }
}
