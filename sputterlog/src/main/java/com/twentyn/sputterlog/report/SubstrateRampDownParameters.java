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

import java.util.Map;

/**
 * The cool down after the deposition.  Its high temperature phase runs under PH3, H2S or the cracker to keep the
 * film from losing anions; the low temperature phase runs without them.
 */
public class SubstrateRampDownParameters extends SubstrateRampParameters {
  private final int numEventsHighTemp;
  private final int numEventsLowTemp;
  private Double anionInputCutoffTemp;
  private LocalDateTime anionInputCutoffTime;

  public SubstrateRampDownParameters(int numEvents, int numEventsHighTemp, int numEventsLowTemp) {
    super(numEvents);
    this.numEventsHighTemp = numEventsHighTemp;
    this.numEventsLowTemp = numEventsLowTemp;
  }

  public int getNumEventsHighTemp() {
    return numEventsHighTemp;
  }

  public int getNumEventsLowTemp() {
    return numEventsLowTemp;
  }

  public Double getAnionInputCutoffTemp() {
    return anionInputCutoffTemp;
  }

  public LocalDateTime getAnionInputCutoffTime() {
    return anionInputCutoffTime;
  }

  public void setAnionInputCutoff(Double temp, LocalDateTime time) {
    this.anionInputCutoffTemp = temp;
    this.anionInputCutoffTime = time;
  }

  @Override
  protected void putCounts(Map<String, Object> map) {
    map.put("num_events", getNumEvents());
    map.put("num_events_high_temp", numEventsHighTemp);
    map.put("num_events_low_temp", numEventsLowTemp);
  }

  @Override
  protected void putExtra(Map<String, Object> map) {
    ReportMaps.putIfPresent(map, "anion_input_cutoff_temp", anionInputCutoffTemp);
    ReportMaps.putIfPresent(map, "anion_input_cutoff_time", anionInputCutoffTime);
  }
}
