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
 * Column names of the deposition chamber log.  Per-source names are only valid once the power supply channels have
 * been copied into the source namespace, see {@link com.twentyn.sputterlog.source.SourceRegistry}.
 */
public final class Channels {
  public static final String TIME_STAMP = "Time Stamp";

  // Source status, as logged by the process computer.
  public static final String PC_SOURCE_LOADED_TARGET = "Loaded Target";
  public static final String PC_SOURCE_SHUTTER_OPEN = "Shutter Open";
  public static final String PC_SOURCE_MATERIAL = "Material";

  // Source channels after binding to a power supply.
  public static final String ENABLED = "Enabled";
  public static final String CURRENT = "Current";
  public static final String DC_BIAS = "DC Bias";
  public static final String OUTPUT_SETPOINT = "Output Setpoint";
  public static final String VOLTAGE = "Voltage";
  public static final String FWD_POWER = "Fwd Power";
  public static final String RFL_POWER = "Rfl Power";
  public static final String PULSE_ENABLED = "Pulse Enabled";
  public static final String PULSE_FREQUENCY = "Pulse Frequency";
  public static final String REVERSE_TIME = "Reverse Time";

  public static final String CRACKER_ZONE_1_TEMP = "Sulfur Cracker Zone 1 Current Temperature";
  public static final String CRACKER_ZONE_2_TEMP = "Sulfur Cracker Zone 2 Current Temperature";
  public static final String CRACKER_ZONE_3_TEMP = "Sulfur Cracker Zone 3 Current Temperature";
  public static final String CRACKER_CONTROL_ENABLED = "Sulfur Cracker Control Enabled";
  public static final String CRACKER_PULSE_WIDTH = "Sulfur Cracker Control Valve PulseWidth Setpoint Feedback";
  public static final String CRACKER_VALVE_SETPOINT = "Sulfur Cracker Control Valve Setpoint Feedback";
  // Names used before the feedback channels were logged correctly (summer 2024).
  public static final String LEGACY_CRACKER_PULSE_WIDTH = "Sulfur Cracker Control Valve PulseWidth Setpoint";
  public static final String LEGACY_CRACKER_VALVE_SETPOINT = "Sulfur Cracker Control Valve Setpoint";

  public static final String TEMPERATURE_CONTROL_ENABLED = "Temperature Control Enabled";
  public static final String HEATER_SETPOINT = "Substrate Heater Temperature Setpoint";
  public static final String HEATER_TEMP_1 = "Substrate Heater Temperature";
  public static final String HEATER_TEMP_2 = "Substrate Heater Temperature 2";
  public static final String PLATEN_POSITION = "Substrate Rotation_Position";

  public static final String CAPMAN_PRESSURE = "PC Capman Pressure";
  public static final String WIDE_RANGE_GAUGE = "PC Wide Range Gauge";

  public static final String SUBSTRATE_SHUTTER_OPEN = "PC Substrate Shutter Open";
  public static final String XTAL2_SHUTTER_OPEN = "Xtal 2 Shutter Open";
  public static final String THICKNESS_RATE = "Thickness Rate";
  public static final String THICKNESS_ACTIVE_MATERIAL = "Thickness Active Material";
  public static final String SULFUR_MATERIAL = "Sulfur";

  private Channels() {
  }

  /** "PC Source 4 Shutter Open" style names, logged per gun by the process computer. */
  public static String pcSource(int source, String suffix) {
    return String.format("PC Source %d %s", source, suffix);
  }

  /** "Source 4 Current" style names, created by source binding. */
  public static String source(int source, String suffix) {
    return String.format("Source %d %s", source, suffix);
  }

  public static String powerSupplyPrefix(int supply) {
    return String.format("Power Supply %d", supply);
  }
}
