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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of the sulfur cracker over a process phase.  Settings are only reported when the cracker ran throughout the
 * phase.
 */
public class CrackerParameters implements ReportSection {
  private final boolean enabled;
  private Double zone1Temp;
  private Double zone2Temp;
  private Double zone3Temp;
  private Double pulseWidth;
  private Double pulseFrequency;

  public CrackerParameters(boolean enabled) {
    this.enabled = enabled;
  }

  public static CrackerParameters disabled() {
    return new CrackerParameters(false);
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Double getZone1Temp() {
    return zone1Temp;
  }

  public void setZoneTemps(Double zone1Temp, Double zone2Temp, Double zone3Temp) {
    this.zone1Temp = zone1Temp;
    this.zone2Temp = zone2Temp;
    this.zone3Temp = zone3Temp;
  }

  public Double getZone2Temp() {
    return zone2Temp;
  }

  public Double getZone3Temp() {
    return zone3Temp;
  }

  public Double getPulseWidth() {
    return pulseWidth;
  }

  public void setPulseWidth(Double pulseWidth) {
    this.pulseWidth = pulseWidth;
  }

  public Double getPulseFrequency() {
    return pulseFrequency;
  }

  public void setPulseFrequency(Double pulseFrequency) {
    this.pulseFrequency = pulseFrequency;
  }

  @Override
  public Map<String, Object> toReportMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("enabled", enabled);
    ReportMaps.putIfPresent(map, "zone1_temp", zone1Temp);
    ReportMaps.putIfPresent(map, "zone2_temp", zone2Temp);
    ReportMaps.putIfPresent(map, "zone3_temp", zone3Temp);
    ReportMaps.putIfPresent(map, "pulse_width", pulseWidth);
    ReportMaps.putIfPresent(map, "pulse_freq", pulseFrequency);
    return map;
  }
}
