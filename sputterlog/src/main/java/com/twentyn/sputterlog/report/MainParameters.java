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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything derived for one log, rooted at the process overview.  Phase sections that do not apply to the run
 * (no substrate heating, for instance) are null and left out of the report.
 */
public class MainParameters implements ReportSection {
  private final ProcessOverview overview;
  private final DepositionParameters deposition;
  private final Map<Integer, SourceRampUpParameters> sourceRampUps;
  private final Map<Integer, SourcePresputterParameters> sourcePresputters;
  private final SubstrateRampUpParameters substrateRampUp;
  private final SubstrateRampDownParameters substrateRampDown;

  public MainParameters(ProcessOverview overview, DepositionParameters deposition,
                        Map<Integer, SourceRampUpParameters> sourceRampUps,
                        Map<Integer, SourcePresputterParameters> sourcePresputters,
                        SubstrateRampUpParameters substrateRampUp,
                        SubstrateRampDownParameters substrateRampDown) {
    this.overview = overview;
    this.deposition = deposition;
    this.sourceRampUps = Collections.unmodifiableMap(new LinkedHashMap<>(sourceRampUps));
    this.sourcePresputters = Collections.unmodifiableMap(new LinkedHashMap<>(sourcePresputters));
    this.substrateRampUp = substrateRampUp;
    this.substrateRampDown = substrateRampDown;
  }

  public ProcessOverview getOverview() {
    return overview;
  }

  public DepositionParameters getDeposition() {
    return deposition;
  }

  public Map<Integer, SourceRampUpParameters> getSourceRampUps() {
    return sourceRampUps;
  }

  public Map<Integer, SourcePresputterParameters> getSourcePresputters() {
    return sourcePresputters;
  }

  public SubstrateRampUpParameters getSubstrateRampUp() {
    return substrateRampUp;
  }

  public SubstrateRampDownParameters getSubstrateRampDown() {
    return substrateRampDown;
  }

  @Override
  public Map<String, Object> toReportMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    overview.putInto(map);
    map.put("deposition", deposition.toReportMap());
    map.put("source_ramp_up", perSource(sourceRampUps));
    map.put("source_presput", perSource(sourcePresputters));
    ReportMaps.putSection(map, "sub_ramp_up", substrateRampUp);
    ReportMaps.putSection(map, "sub_ramp_down", substrateRampDown);
    return map;
  }

  private static Map<String, Object> perSource(Map<Integer, ? extends ReportSection> sections) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<Integer, ? extends ReportSection> entry : sections.entrySet()) {
      map.put(ReportMaps.sourceKey(entry.getKey()), entry.getValue().toReportMap());
    }
    return map;
  }
}
