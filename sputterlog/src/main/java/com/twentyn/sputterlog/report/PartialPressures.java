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

/** Partial pressures of the process gases, in the unit of the total pressure they were split from. */
public class PartialPressures {
  private final double ar;
  private final double h2s;
  private final double ph3;

  public PartialPressures(double ar, double h2s, double ph3) {
    this.ar = ar;
    this.h2s = h2s;
    this.ph3 = ph3;
  }

  public double getAr() {
    return ar;
  }

  public double getH2s() {
    return h2s;
  }

  public double getPh3() {
    return ph3;
  }

  public void putInto(Map<String, Object> map) {
    map.put("ar_partial_pressure", ar);
    map.put("h2s_partial_pressure", h2s);
    map.put("ph3_partial_pressure", ph3);
  }

  @Override
  public String toString() {
    return String.format("PartialPressures{Ar=%g, H2S=%g, PH3=%g}", ar, h2s, ph3);
  }
}
