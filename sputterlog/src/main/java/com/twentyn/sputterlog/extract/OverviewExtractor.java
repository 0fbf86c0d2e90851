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

import com.twentyn.sputterlog.condition.Condition;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.report.DepositionParameters;
import com.twentyn.sputterlog.report.ProcessOverview;
import com.twentyn.sputterlog.report.ReportMaps;
import com.twentyn.sputterlog.report.SourceDepositionParameters;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class OverviewExtractor {
  private static final String SAMPLE_NAME_SEPARATOR = "_";
  // Log files are named "<user>_<number>_<material>_<date>..."; the first three tokens identify the sample.
  private static final int SAMPLE_NAME_TOKENS = 3;

  public ProcessOverview extract(ExtractionContext ctx) {
    TimeSeries series = ctx.getSeries();
    DepositionParameters deposition = ctx.getDepositionParameters();
    LogEvent depositionEvent = ctx.getDeposition();

    ProcessOverview overview = new ProcessOverview(sampleName(ctx.getLogName()),
        series.getTimestamp(0), series.getTimestamp(series.size() - 1));
    overview.setMaterialSpace(materialSpace(ctx, deposition));

    Condition untilDeposition = ctx.conditions().before(depositionEvent.getStart() + 1);
    Double lowest = ChannelStatistics.minPositive(series, Channels.WIDE_RANGE_GAUGE, untilDeposition);
    boolean crackerEnabled = deposition.getCracker().isEnabled();
    overview.setBasePressure(lowest,
        lowest != null && lowest < ctx.getThresholds().getMaxBasePressure() && !crackerEnabled);

    if (crackerEnabled) {
      LogEvent basePressure = ctx.getEvent(EventCategory.CRACKER_BASE_PRESSURE);
      if (basePressure.isEmpty()) {
        overview.setCrackerPressure(false, null);
      } else {
        overview.setCrackerPressure(true,
            ChannelStatistics.mean(series, Channels.WIDE_RANGE_GAUGE, basePressure.getRows()));
      }
    }

    overview.setEndOfProcessTemp(
        ChannelStatistics.last(series, Channels.HEATER_TEMP_1, Condition.allTrue(series.size())));
    overview.setTimeInChamberAfterDeposition(
        ReportMaps.between(deposition.getEndTime(), overview.getLogEndTime()));
    return overview;
  }

  /** First three "_" separated tokens of the log file name, without its extension. */
  public static String sampleName(String logName) {
    String base = FilenameUtils.getBaseName(logName);
    String[] tokens = StringUtils.splitByWholeSeparatorPreserveAllTokens(base, SAMPLE_NAME_SEPARATOR);
    return StringUtils.join(Arrays.asList(tokens).subList(0, Math.min(tokens.length, SAMPLE_NAME_TOKENS)),
        SAMPLE_NAME_SEPARATOR);
  }

  static String materialSpace(ExtractionContext ctx, DepositionParameters deposition) {
    List<String> symbols = new ArrayList<>();
    for (SourceDepositionParameters source : deposition.getSources().values()) {
      if (source.isEnabled() && source.getMaterial() != null) {
        symbols.add(source.getMaterial());
      }
    }
    boolean phosphorus = deposition.getFlows() != null
        && PhaseStatistics.flowing(deposition.getFlows().getPh3(), ctx.getThresholds());
    boolean sulfur = (deposition.getFlows() != null
        && PhaseStatistics.flowing(deposition.getFlows().getH2s(), ctx.getThresholds()))
        || deposition.getCracker().isEnabled();
    return ProcessPhysics.materialSpace(symbols, phosphorus, sulfur);
  }
}
