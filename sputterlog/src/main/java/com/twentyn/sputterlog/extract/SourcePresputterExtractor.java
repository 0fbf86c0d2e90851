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

import com.twentyn.sputterlog.event.Domain;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.report.SourcePresputterParameters;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.Gas;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.joda.time.Duration;

import java.util.LinkedHashMap;
import java.util.Map;

public class SourcePresputterExtractor {

  public Map<Integer, SourcePresputterParameters> extract(ExtractionContext ctx) {
    TimeSeries series = ctx.getSeries();
    Map<Integer, SourcePresputterParameters> result = new LinkedHashMap<>();
    for (int source : ctx.getSources()) {
      LogEvent presputter = ctx.getEvent(EventCategory.SOURCE_PRESPUTTER, source);
      boolean enabled = ctx.getDepositionParameters().isSourceEnabled(source) && !presputter.isEmpty();
      SourcePresputterParameters params = new SourcePresputterParameters(source, enabled);
      if (enabled) {
        long total = 0L;
        for (Domain d : presputter.getDomains()) {
          total += d.getDurationMillis();
        }
        params.setDuration(new Duration(total));
        params.setAvgOutputPower(ChannelStatistics.mean(series, Channels.source(source, Channels.OUTPUT_SETPOINT),
            presputter.getRows()));
        params.setAvgCapmanPressure(ChannelStatistics.mean(series, Channels.CAPMAN_PRESSURE, presputter.getRows()));
        params.setAvgArFlow(ChannelStatistics.mean(series, Gas.AR.flowChannel(), presputter.getRows()));
      }
      result.put(source, params);
    }
    return result;
  }
}
