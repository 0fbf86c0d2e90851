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

public class SubstrateRampUpParameters extends SubstrateRampParameters {
  private Double avgCapmanPressure;

  public SubstrateRampUpParameters(int numEvents) {
    super(numEvents);
  }

  public Double getAvgCapmanPressure() {
    return avgCapmanPressure;
  }

  public void setAvgCapmanPressure(Double avgCapmanPressure) {
    this.avgCapmanPressure = avgCapmanPressure;
  }

  @Override
  protected void putCounts(Map<String, Object> map) {
    map.put("num_events", getNumEvents());
  }

  @Override
  protected void putExtra(Map<String, Object> map) {
    ReportMaps.putIfPresent(map, "avg_capman_pressure", avgCapmanPressure);
  }
}
