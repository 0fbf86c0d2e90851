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

/**
 * Average flows of the process gases, in sccm.  A gas whose controller stayed below its noise level averages 0.
 */
public class GasFlows {
  private final Double ar;
  private final Double h2s;
  private final Double ph3;

  public GasFlows(Double ar, Double h2s, Double ph3) {
    this.ar = ar;
    this.h2s = h2s;
    this.ph3 = ph3;
  }

  public Double getAr() {
    return ar;
  }

  public Double getH2s() {
    return h2s;
  }

  public Double getPh3() {
    return ph3;
  }

  public void putInto(Map<String, Object> map) {
    ReportMaps.putIfPresent(map, "avg_ar_flow", ar);
    ReportMaps.putIfPresent(map, "avg_h2s_flow", h2s);
    ReportMaps.putIfPresent(map, "avg_ph3_flow", ph3);
  }
}
