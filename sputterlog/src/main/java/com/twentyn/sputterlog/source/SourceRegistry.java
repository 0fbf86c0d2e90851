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

package com.twentyn.sputterlog.source;

import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the sputter sources of a log and maps the power supply channels onto them.  The chamber has three supplies
 * that can be switched between guns; the log records supply channels ("Power Supply 2 DC Bias") and switch states,
 * but every event is defined per gun ("Source 4 DC Bias").
 */
public class SourceRegistry {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SourceRegistry.class);

  private static final Pattern LOADED_TARGET_PATTERN =
      Pattern.compile("^PC Source (\\d+) " + Channels.PC_SOURCE_LOADED_TARGET + "$");

  // Switch column suffix of each power supply, in supply order.
  private static final String[] SWITCH_SUFFIXES = new String[] {
      "Switch-PDC-PWS1", "Switch-RF1-PWS2", "Switch-RF2-PWS3"
  };
  public static final int NUM_POWER_SUPPLIES = SWITCH_SUFFIXES.length;

  private SourceRegistry() {
  }

  public static SortedSet<Integer> discoverSources(TimeSeries series) {
    SortedSet<Integer> sources = new TreeSet<>();
    for (String column : series.getColumnNames()) {
      Matcher matcher = LOADED_TARGET_PATTERN.matcher(column);
      if (matcher.matches()) {
        sources.add(Integer.parseInt(matcher.group(1)));
      }
    }
    return sources;
  }

  /**
   * Copies every "Power Supply K ..." channel to "Source N ..." for each supply K that was switched to source N while
   * the source shutter was open.  Falls back on "Power Supply K Enabled" when the log has no switch columns.
   *
   * @return the bindings found, keyed by source in ascending order
   */
  public static Map<Integer, SourceBinding> bindSourcesToSupplies(TimeSeries series, SortedSet<Integer> sources) {
    Map<Integer, SourceBinding> bindings = new LinkedHashMap<>();
    for (int source : sources) {
      SourceBinding binding = new SourceBinding(source);
      bindings.put(source, binding);

      double[] shutter = series.getNumeric(Channels.pcSource(source, Channels.PC_SOURCE_SHUTTER_OPEN));
      if (shutter == null) {
        LOGGER.debug("Source %d has no shutter channel, it cannot be bound", source);
        continue;
      }
      boolean hasSwitches = series.hasNumeric(Channels.pcSource(source, SWITCH_SUFFIXES[0]));

      for (int supply = 1; supply <= NUM_POWER_SUPPLIES; supply++) {
        String indicatorName = hasSwitches
            ? Channels.pcSource(source, SWITCH_SUFFIXES[supply - 1])
            : Channels.powerSupplyPrefix(supply) + " " + Channels.ENABLED;
        int firstRow = firstGatedRow(series.getNumeric(indicatorName), shutter);
        if (firstRow < 0) {
          continue;
        }
        if (binding.isBound()) {
          LOGGER.warn("Source %d is driven by power supply %d and then by power supply %d from sample %d on; " +
              "keeping power supply %d", source, binding.getEffectiveSupply(), supply, firstRow, supply);
        }
        copySupplyChannels(series, supply, source);
        binding.addSupply(supply);
      }
    }
    return bindings;
  }

  private static int firstGatedRow(double[] indicator, double[] shutter) {
    if (indicator == null) {
      return -1;
    }
    for (int i = 0; i < indicator.length; i++) {
      if (indicator[i] == 1.0 && shutter[i] == 1.0) {
        return i;
      }
    }
    return -1;
  }

  private static void copySupplyChannels(TimeSeries series, int supply, int source) {
    String prefix = Channels.powerSupplyPrefix(supply) + " ";
    List<String> copied = new ArrayList<>();
    for (String column : series.getColumnNames()) {
      if (!column.startsWith(prefix)) {
        continue;
      }
      String target = Channels.source(source, column.substring(prefix.length()));
      if (series.hasNumeric(column)) {
        series.putNumeric(target, series.getNumeric(column));
      } else {
        series.putText(target, series.getText(column));
      }
      copied.add(target);
    }
    LOGGER.debug("Bound power supply %d to source %d: %s", supply, source, copied);
  }
}
