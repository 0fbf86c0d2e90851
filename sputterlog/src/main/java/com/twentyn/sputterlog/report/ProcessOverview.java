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

import java.util.Map;

/**
 * Top level quantities of a run, reported next to the per-phase sections.
 */
public class ProcessOverview {
  private final String sampleName;
  private final LocalDateTime logStartTime;
  private final LocalDateTime logEndTime;
  private String materialSpace;
  private Double lowerPressureBeforeDeposition;
  private boolean trueBasePressureMeasured;
  private Boolean crackerPressureMeasured;
  private Double crackerPressure;
  private Double endOfProcessTemp;
  private Duration timeInChamberAfterDeposition;

  public ProcessOverview(String sampleName, LocalDateTime logStartTime, LocalDateTime logEndTime) {
    this.sampleName = sampleName;
    this.logStartTime = logStartTime;
    this.logEndTime = logEndTime;
  }

  public String getSampleName() {
    return sampleName;
  }

  public LocalDateTime getLogStartTime() {
    return logStartTime;
  }

  public LocalDateTime getLogEndTime() {
    return logEndTime;
  }

  public String getMaterialSpace() {
    return materialSpace;
  }

  public void setMaterialSpace(String materialSpace) {
    this.materialSpace = materialSpace;
  }

  public Double getLowerPressureBeforeDeposition() {
    return lowerPressureBeforeDeposition;
  }

  public boolean isTrueBasePressureMeasured() {
    return trueBasePressureMeasured;
  }

  public void setBasePressure(Double lowerPressureBeforeDeposition, boolean trueBasePressureMeasured) {
    this.lowerPressureBeforeDeposition = lowerPressureBeforeDeposition;
    this.trueBasePressureMeasured = trueBasePressureMeasured;
  }

  public Boolean getCrackerPressureMeasured() {
    return crackerPressureMeasured;
  }

  public Double getCrackerPressure() {
    return crackerPressure;
  }

  public void setCrackerPressure(boolean measured, Double crackerPressure) {
    this.crackerPressureMeasured = measured;
    this.crackerPressure = crackerPressure;
  }

  public Double getEndOfProcessTemp() {
    return endOfProcessTemp;
  }

  public void setEndOfProcessTemp(Double endOfProcessTemp) {
    this.endOfProcessTemp = endOfProcessTemp;
  }

  public Duration getTimeInChamberAfterDeposition() {
    return timeInChamberAfterDeposition;
  }

  public void setTimeInChamberAfterDeposition(Duration timeInChamberAfterDeposition) {
    this.timeInChamberAfterDeposition = timeInChamberAfterDeposition;
  }

  /** The overview keys live at the top level of the report, next to the phase sections. */
  public void putInto(Map<String, Object> map) {
    map.put("sample_name", sampleName);
    map.put("log_start_time", logStartTime);
    map.put("log_end_time", logEndTime);
    ReportMaps.putIfPresent(map, "material_space", materialSpace);
    ReportMaps.putIfPresent(map, "lower_pressure_before_deposition", lowerPressureBeforeDeposition);
    map.put("true_base_pressure_meas", trueBasePressureMeasured);
    ReportMaps.putIfPresent(map, "cracker_pressure_meas", crackerPressureMeasured);
    ReportMaps.putIfPresent(map, "cracker_pressure", crackerPressure);
    ReportMaps.putIfPresent(map, "end_of_process_temp", endOfProcessTemp);
    ReportMaps.putIfPresent(map, "time_in_chamber_after_deposition", timeInChamberAfterDeposition);
  }
}
