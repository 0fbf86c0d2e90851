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

import com.twentyn.sputterlog.extract.PlasmaType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a single source did during the deposition.
 */
public class SourceDepositionParameters implements ReportSection {
  private final int source;
  private final boolean enabled;
  private Double avgOutputPower;
  private PlasmaType plasmaType;
  private Double pulseFrequency;
  private Double deadTime;
  private VoltageStatistics voltage;
  private String material;
  private String targetId;
  private Double depositionRate;
  private String depositionRateMaterial;

  public SourceDepositionParameters(int source, boolean enabled) {
    this.source = source;
    this.enabled = enabled;
  }

  public int getSource() {
    return source;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Double getAvgOutputPower() {
    return avgOutputPower;
  }

  public void setAvgOutputPower(Double avgOutputPower) {
    this.avgOutputPower = avgOutputPower;
  }

  /** Null when the supply signals did not allow a classification. */
  public PlasmaType getPlasmaType() {
    return plasmaType;
  }

  public void setPlasmaType(PlasmaType plasmaType) {
    this.plasmaType = plasmaType;
  }

  public Double getPulseFrequency() {
    return pulseFrequency;
  }

  public void setPulseFrequency(Double pulseFrequency) {
    this.pulseFrequency = pulseFrequency;
  }

  public Double getDeadTime() {
    return deadTime;
  }

  public void setDeadTime(Double deadTime) {
    this.deadTime = deadTime;
  }

  public VoltageStatistics getVoltage() {
    return voltage;
  }

  public void setVoltage(VoltageStatistics voltage) {
    this.voltage = voltage;
  }

  /** Element symbol of the target, or the raw material text when it names no known element. */
  public String getMaterial() {
    return material;
  }

  public void setMaterial(String material) {
    this.material = material;
  }

  public String getTargetId() {
    return targetId;
  }

  public void setTargetId(String targetId) {
    this.targetId = targetId;
  }

  public Double getDepositionRate() {
    return depositionRate;
  }

  public String getDepositionRateMaterial() {
    return depositionRateMaterial;
  }

  public void setDepositionRate(Double depositionRate, String depositionRateMaterial) {
    this.depositionRate = depositionRate;
    this.depositionRateMaterial = depositionRateMaterial;
  }

  @Override
  public Map<String, Object> toReportMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("enabled", enabled);
    ReportMaps.putIfPresent(map, "avg_output_power", avgOutputPower);
    if (plasmaType != null) {
      map.put("plasma_type", plasmaType.name());
      map.put("dc", plasmaType.isDc());
      map.put("rf", plasmaType.isRf());
      if (plasmaType.isDc()) {
        map.put("pulsed", plasmaType.isPulsed());
      }
    }
    ReportMaps.putIfPresent(map, "pulse_frequency", pulseFrequency);
    ReportMaps.putIfPresent(map, "dead_time", deadTime);
    if (voltage != null) {
      voltage.putInto(map);
    }
    ReportMaps.putIfPresent(map, "material", material);
    ReportMaps.putIfPresent(map, "target_id", targetId);
    ReportMaps.putIfPresent(map, "deposition_rate", depositionRate);
    ReportMaps.putIfPresent(map, "deposition_rate_mat", depositionRateMaterial);
    return map;
  }
}
