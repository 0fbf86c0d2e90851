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

package com.twentyn.sputterlog;

import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.Gas;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.joda.time.LocalDateTime;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds synthetic chamber logs sampled once per second.
 *
 * {@link #standardRun()} is a room temperature, three gun co-sputtering run:
 * <ul>
 *   <li>guns 1, 2 and 3 loaded with Cu, Ag and Sn, driven by power supplies 1 (DC), 2 (RF) and 3 (DC);</li>
 *   <li>plasma ignites at row 10 and the output setpoint ramps from 0 W (row 9) to 100 W (row 19);</li>
 *   <li>presputtering on rows 20 to 99 with the gun shutters closed;</li>
 *   <li>deposition on rows 100 to 399 with every shutter open and PH3 flowing;</li>
 *   <li>Ar flowing from row 5 to row 420, the log ending at row 459.</li>
 * </ul>
 */
public class SputterLogFixture {
  public static final LocalDateTime LOG_START = new LocalDateTime(2024, 8, 2, 10, 0, 0);
  public static final int STANDARD_RUN_SIZE = 460;
  public static final int RAMP_START = 9;
  public static final int IGNITION = 10;
  public static final int RAMP_END = 19;
  public static final int DEPOSITION_START = 100;
  public static final int DEPOSITION_END = 399;
  public static final double OUTPUT_POWER = 100.0;

  public static final int HEATING_START = 30;
  public static final int HEATING_END = 70;
  public static final int COOLING_START = 410;
  public static final int H2S_COOLING_END = 430;
  public static final double HEATED_SETPOINT = 425.0;

  public static final int CRACKER_START = 30;
  public static final int CRACKER_BASE_PRESSURE_END = 44;
  public static final int QCM_OPEN = 50;
  public static final int FILM_RATE_START = 90;

  private final int size;
  private final long[] times;
  private final Map<String, double[]> numeric = new LinkedHashMap<>();
  private final Map<String, String[]> text = new LinkedHashMap<>();

  public SputterLogFixture(int size) {
    this.size = size;
    this.times = new long[size];
    long start = TimeSeries.toMillis(LOG_START);
    for (int i = 0; i < size; i++) {
      times[i] = start + i * 1000L;
    }
  }

  public static long timeOf(int row) {
    return TimeSeries.toMillis(LOG_START) + row * 1000L;
  }

  /** Sets {@code channel} to {@code value} on rows {@code from} to {@code to}, inclusive; other rows default to 0. */
  public SputterLogFixture set(String channel, int from, int to, double value) {
    double[] values = numeric.get(channel);
    if (values == null) {
      values = new double[size];
      numeric.put(channel, values);
    }
    for (int i = from; i <= to; i++) {
      values[i] = value;
    }
    return this;
  }

  public SputterLogFixture constant(String channel, double value) {
    return set(channel, 0, size - 1, value);
  }

  public SputterLogFixture text(String channel, String value) {
    return text(channel, 0, size - 1, value);
  }

  /** Sets a text channel on rows {@code from} to {@code to}, inclusive; other rows are empty cells. */
  public SputterLogFixture text(String channel, int from, int to, String value) {
    String[] values = text.get(channel);
    if (values == null) {
      values = new String[size];
      text.put(channel, values);
    }
    Arrays.fill(values, from, to + 1, value);
    return this;
  }

  public SputterLogFixture remove(String channel) {
    numeric.remove(channel);
    text.remove(channel);
    return this;
  }

  public TimeSeries build() {
    Map<String, double[]> numericCopy = new LinkedHashMap<>();
    for (Map.Entry<String, double[]> entry : numeric.entrySet()) {
      numericCopy.put(entry.getKey(), Arrays.copyOf(entry.getValue(), size));
    }
    Map<String, String[]> textCopy = new LinkedHashMap<>();
    for (Map.Entry<String, String[]> entry : text.entrySet()) {
      textCopy.put(entry.getKey(), Arrays.copyOf(entry.getValue(), size));
    }
    return new TimeSeries(Arrays.copyOf(times, size), numericCopy, textCopy);
  }

  public static SputterLogFixture standardRun() {
    SputterLogFixture f = new SputterLogFixture(STANDARD_RUN_SIZE);
    String[] materials = new String[] {"Copper", "Ag", "Tin"};
    String[] switches = new String[] {"Switch-PDC-PWS1", "Switch-RF1-PWS2", "Switch-RF2-PWS3"};
    for (int source = 1; source <= 3; source++) {
      f.constant(Channels.pcSource(source, Channels.PC_SOURCE_LOADED_TARGET), 100 + source);
      f.text(Channels.pcSource(source, Channels.PC_SOURCE_MATERIAL), materials[source - 1]);
      f.set(Channels.pcSource(source, Channels.PC_SOURCE_SHUTTER_OPEN), DEPOSITION_START, DEPOSITION_END, 1.0);
      for (int s = 1; s <= 3; s++) {
        f.constant(Channels.pcSource(source, switches[s - 1]), s == source ? 1.0 : 0.0);
      }

      String supply = Channels.powerSupplyPrefix(source) + " ";
      f.set(supply + Channels.ENABLED, IGNITION, DEPOSITION_END, 1.0);
      for (int row = IGNITION; row <= RAMP_END; row++) {
        f.set(supply + Channels.OUTPUT_SETPOINT, row, row, OUTPUT_POWER * (row - RAMP_START) / (RAMP_END - RAMP_START));
      }
      f.set(supply + Channels.OUTPUT_SETPOINT, RAMP_END, DEPOSITION_END, OUTPUT_POWER);
      if (source == 2) {
        f.constant(supply + Channels.CURRENT, 0.0);
        f.set(supply + Channels.DC_BIAS, IGNITION, DEPOSITION_END, 80.0);
      } else {
        f.set(supply + Channels.CURRENT, IGNITION, DEPOSITION_END, 0.3);
        f.set(supply + Channels.VOLTAGE, IGNITION, DEPOSITION_END, 320.0);
      }
    }

    f.set(Channels.SUBSTRATE_SHUTTER_OPEN, DEPOSITION_START, DEPOSITION_END, 1.0);
    f.set(Gas.AR.setpointChannel(), 5, 420, 20.0);
    f.set(Gas.AR.flowChannel(), 5, 420, 20.0);
    f.set(Gas.PH3.setpointChannel(), DEPOSITION_START, DEPOSITION_END, 5.0);
    f.set(Gas.PH3.flowChannel(), DEPOSITION_START, DEPOSITION_END, 5.0);
    f.constant(Gas.H2S.setpointChannel(), 0.0);
    f.constant(Gas.H2S.flowChannel(), 0.0);

    f.constant(Channels.CAPMAN_PRESSURE, 1.0e-7);
    f.set(Channels.CAPMAN_PRESSURE, 5, 420, 0.005);
    f.constant(Channels.WIDE_RANGE_GAUGE, 0.005);
    f.set(Channels.WIDE_RANGE_GAUGE, 0, 4, 1.0e-8);

    f.constant(Channels.HEATER_SETPOINT, 25.0);
    f.constant(Channels.HEATER_TEMP_1, 25.0);
    f.constant(Channels.HEATER_TEMP_2, 25.0);
    f.constant(Channels.PLATEN_POSITION, 45.0);
    return f;
  }

  /**
   * The standard run on a heated substrate:
   * <ul>
   *   <li>temperature control on from row 20 to row 455;</li>
   *   <li>heater setpoint rising by 10 C per sample from 25 C (row 30) to 425 C (row 70), held through the
   *   deposition, then falling by 10 C per sample from row 410 back to 25 C (row 449);</li>
   *   <li>both heater readings at 400 C during the deposition;</li>
   *   <li>H2S flowing from row 400 to row 430, protecting the film during the first part of the cool down.</li>
   * </ul>
   */
  public static SputterLogFixture heatedRun() {
    SputterLogFixture f = standardRun();
    f.set(Channels.TEMPERATURE_CONTROL_ENABLED, HEATING_START - 10, 455, 1.0);
    for (int row = HEATING_START; row < STANDARD_RUN_SIZE; row++) {
      double setpoint;
      if (row <= HEATING_END) {
        setpoint = 25.0 + 10.0 * (row - HEATING_START);
      } else if (row <= COOLING_START - 1) {
        setpoint = HEATED_SETPOINT;
      } else {
        setpoint = Math.max(25.0, HEATED_SETPOINT - 10.0 * (row - COOLING_START + 1));
      }
      f.set(Channels.HEATER_SETPOINT, row, row, setpoint);
    }
    f.set(Channels.HEATER_TEMP_1, DEPOSITION_START, DEPOSITION_END, 400.0);
    f.set(Channels.HEATER_TEMP_2, DEPOSITION_START, DEPOSITION_END, 400.0);
    f.set(Gas.H2S.setpointChannel(), DEPOSITION_END + 1, H2S_COOLING_END, 5.0);
    f.set(Gas.H2S.flowChannel(), DEPOSITION_END + 1, H2S_COOLING_END, 5.0);
    return f;
  }

  /**
   * The standard run without PH3, sulfurized by the cracker instead:
   * <ul>
   *   <li>cracker running from row 30 to the end of the log;</li>
   *   <li>Ar off on rows 30 to 44, the cracker alone raising the pressure to 0.002;</li>
   *   <li>QCM shutter opening at row 50 and closing at row 100, measuring sulfur until row 89 (0.8 A/s) and the
   *   film with gun 1 open from row 90 (1.5 A/s).</li>
   * </ul>
   */
  public static SputterLogFixture crackerRun() {
    SputterLogFixture f = standardRun();
    f.constant(Gas.PH3.setpointChannel(), 0.0);
    f.constant(Gas.PH3.flowChannel(), 0.0);

    f.set(Channels.CRACKER_ZONE_1_TEMP, CRACKER_START, STANDARD_RUN_SIZE - 1, 100.0);
    f.set(Channels.CRACKER_ZONE_2_TEMP, CRACKER_START, STANDARD_RUN_SIZE - 1, 200.0);
    f.set(Channels.CRACKER_ZONE_3_TEMP, CRACKER_START, STANDARD_RUN_SIZE - 1, 250.0);
    f.set(Channels.CRACKER_CONTROL_ENABLED, CRACKER_START, STANDARD_RUN_SIZE - 1, 1.0);
    f.set(Channels.CRACKER_PULSE_WIDTH, CRACKER_START, STANDARD_RUN_SIZE - 1, 3.0);
    f.set(Channels.CRACKER_VALVE_SETPOINT, CRACKER_START, STANDARD_RUN_SIZE - 1, 50.0);

    f.set(Gas.AR.setpointChannel(), CRACKER_START, CRACKER_BASE_PRESSURE_END, 0.0);
    f.set(Gas.AR.flowChannel(), CRACKER_START, CRACKER_BASE_PRESSURE_END, 0.0);
    f.set(Channels.WIDE_RANGE_GAUGE, CRACKER_START, CRACKER_BASE_PRESSURE_END, 0.002);

    f.set(Channels.XTAL2_SHUTTER_OPEN, QCM_OPEN, DEPOSITION_START - 1, 1.0);
    f.text(Channels.THICKNESS_ACTIVE_MATERIAL, QCM_OPEN - 5, FILM_RATE_START - 1, Channels.SULFUR_MATERIAL);
    f.text(Channels.THICKNESS_ACTIVE_MATERIAL, FILM_RATE_START, DEPOSITION_END, "CuAgSnS");
    f.set(Channels.THICKNESS_RATE, QCM_OPEN, FILM_RATE_START - 1, 0.8);
    f.set(Channels.THICKNESS_RATE, FILM_RATE_START, DEPOSITION_START - 1, 1.5);
    f.set(Channels.pcSource(1, Channels.PC_SOURCE_SHUTTER_OPEN), FILM_RATE_START, DEPOSITION_START - 1, 1.0);
    return f;
  }
}
