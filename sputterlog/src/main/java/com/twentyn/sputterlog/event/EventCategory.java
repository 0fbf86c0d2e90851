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

package com.twentyn.sputterlog.event;

/**
 * Kinds of process phase the segmentation engine knows how to detect.  The key is the stable prefix of every step id
 * built for an event of this category.
 */
public enum EventCategory {
  SOURCE_ON("source_on", "Source %d On", true, false, false),
  SOURCE_RAMP_UP("source_ramp_up", "Source %d Ramp Up", true, true, false),
  SOURCE_PRESPUTTER("source_presput", "Source %d Presput", true, true, false),
  CRACKER_ON_OPEN("cracker_on_open", "Cracker On Open", false, false, false),
  TEMPERATURE_CONTROL("temp_ctrl", "Temperature Ctrl.", false, false, false),
  AR_ON("ar_on", "Ar On", false, false, false),
  H2S_ON("h2s_on", "H2S On", false, false, false),
  PH3_ON("ph3_on", "PH3 On", false, false, false),
  ANY_SOURCE_ON("any_source_on", "Any Source On", false, false, false),
  ANY_SOURCE_ON_OPEN("any_source_on_open", "Any Source On and Open", false, false, false),
  DEPOSITION("deposition", "Deposition", false, true, true),
  CRACKER_BASE_PRESSURE("cracker_pressure_meas", "Cracker Pressure Meas", false, true, false),
  XTAL2_SHUTTER_OPEN("xtal2_shutter_open", "Xtal 2 Shutter Open", false, false, false),
  DEPOSITION_RATE_MEASUREMENT("deprate2_meas", "Deposition Rate Measurement", false, false, false),
  FILM_DEPOSITION_RATE_MEASUREMENT("deprate2_film_meas", "Source %d MePS Dep Rate Meas", true, true, false),
  SULFUR_DEPOSITION_RATE_MEASUREMENT("deprate2_sulfur_meas", "S Dep Rate Meas", false, true, false),
  SUBSTRATE_RAMP_UP("sub_ramp_up", "Sub Temp Ramp Up", false, true, false),
  SUBSTRATE_RAMP_DOWN("sub_ramp_down", "Sub Temp Ramp Down", false, false, false),
  SUBSTRATE_RAMP_DOWN_HIGH("sub_ramp_down_high_temp", "Sub High Temp Ramp Down", false, true, false),
  SUBSTRATE_RAMP_DOWN_LOW("sub_ramp_down_low_temp", "Sub Low Temp Ramp Down", false, true, false),
  ;

  private final String key;
  private final String nameTemplate;
  private final boolean perSource;
  private final boolean processStep;
  private final boolean createsThinFilm;

  EventCategory(String key, String nameTemplate, boolean perSource, boolean processStep, boolean createsThinFilm) {
    this.key = key;
    this.nameTemplate = nameTemplate;
    this.perSource = perSource;
    this.processStep = processStep;
    this.createsThinFilm = createsThinFilm;
  }

  public String getKey() {
    return key;
  }

  public boolean isPerSource() {
    return perSource;
  }

  /** Whether events of this category are reported as steps of the deposition process. */
  public boolean isProcessStep() {
    return processStep;
  }

  public boolean createsThinFilm() {
    return createsThinFilm;
  }

  public String displayName(Integer source) {
    if (perSource) {
      if (source == null) {
        throw new IllegalArgumentException(String.format("Category %s needs a source", this));
      }
      return String.format(nameTemplate, source);
    }
    return nameTemplate;
  }

  public static EventCategory fromKey(String key) {
    for (EventCategory category : values()) {
      if (category.key.equals(key)) {
        return category;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown event category key '%s'", key));
  }
}
