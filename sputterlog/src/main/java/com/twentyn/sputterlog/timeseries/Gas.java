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

package com.twentyn.sputterlog.timeseries;

/**
 * Process gases dosed through the chamber's mass flow controllers.  H2S and PH3 come from bottles diluted in Ar.
 */
public enum Gas {
  AR("Ar", 1),
  PH3("PH3", 4),
  H2S("H2S", 6),
  ;

  private final String formula;
  private final int mfcNumber;

  Gas(String formula, int mfcNumber) {
    this.formula = formula;
    this.mfcNumber = mfcNumber;
  }

  public String getFormula() {
    return formula;
  }

  public int getMfcNumber() {
    return mfcNumber;
  }

  public String setpointChannel() {
    return String.format("PC MFC %d Setpoint", mfcNumber);
  }

  public String flowChannel() {
    return String.format("PC MFC %d Flow", mfcNumber);
  }

  public boolean isReactive() {
    return this != AR;
  }
}
