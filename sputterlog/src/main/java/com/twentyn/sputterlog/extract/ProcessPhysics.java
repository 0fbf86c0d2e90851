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

package com.twentyn.sputterlog.extract;

import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.report.PartialPressures;
import com.twentyn.sputterlog.timeseries.Gas;

import java.util.List;

/**
 * Chamber-specific corrections and derived physical quantities.
 */
public class ProcessPhysics {
  private ProcessPhysics() {
  }

  /**
   * Substrate temperature from the two heater thermocouples, corrected for the offset between heater and sample
   * surface measured at calibration.
   */
  public static double trueTemperature(double temp1, double temp2, double slope, double offset) {
    return slope * (0.5 * (temp1 + temp2)) + offset;
  }

  public static double trueTemperature(double temp1, double temp2, SegmentationThresholds thresholds) {
    return trueTemperature(temp1, temp2, thresholds.getTrueTempSlope(), thresholds.getTrueTempOffset());
  }

  /**
   * Splits the total pressure between the gases in proportion to their flows.  H2S and PH3 come diluted in Ar, so
   * the Ar share includes the carrier part of their flows.
   */
  public static PartialPressures partialPressures(double arFlow, double h2sFlow, double ph3Flow, double pressure,
                                                  SegmentationThresholds thresholds) {
    double flow = arFlow + h2sFlow + ph3Flow;
    if (flow <= 0.0) {
      return new PartialPressures(0.0, 0.0, 0.0);
    }
    double fH2s = thresholds.getGasDilutionFraction(Gas.H2S);
    double fPh3 = thresholds.getGasDilutionFraction(Gas.PH3);
    double h2s = fH2s * h2sFlow / flow * pressure;
    double ph3 = fPh3 * ph3Flow / flow * pressure;
    double ar = (arFlow + (1.0 - fH2s) * h2sFlow + (1.0 - fPh3) * ph3Flow) / flow * pressure;
    return new PartialPressures(ar, h2s, ph3);
  }

  /**
   * "Cu-Ag-Sn-P" style label: the target elements in source order, then P and S for the reactive species.
   */
  public static String materialSpace(List<String> targetSymbols, boolean phosphorus, boolean sulfur) {
    StringBuilder sb = new StringBuilder();
    for (String symbol : targetSymbols) {
      append(sb, symbol);
    }
    if (phosphorus) {
      append(sb, Element.PHOSPHORUS.getSymbol());
    }
    if (sulfur) {
      append(sb, Element.SULFUR.getSymbol());
    }
    return sb.toString();
  }

  private static void append(StringBuilder sb, String symbol) {
    if (sb.length() > 0) {
      sb.append('-');
    }
    sb.append(symbol);
  }
}
