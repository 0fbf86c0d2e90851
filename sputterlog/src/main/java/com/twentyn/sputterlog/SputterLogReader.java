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

import com.twentyn.sputterlog.condition.Condition;
import com.twentyn.sputterlog.condition.ConditionBuilder;
import com.twentyn.sputterlog.config.SegmentationThresholds;
import com.twentyn.sputterlog.event.Domain;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.event.EventRefiner;
import com.twentyn.sputterlog.event.LogEvent;
import com.twentyn.sputterlog.extract.DepositionExtractor;
import com.twentyn.sputterlog.extract.ExtractionContext;
import com.twentyn.sputterlog.extract.OverviewExtractor;
import com.twentyn.sputterlog.extract.SourcePresputterExtractor;
import com.twentyn.sputterlog.extract.SourceRampUpExtractor;
import com.twentyn.sputterlog.extract.StepParametersExtractor;
import com.twentyn.sputterlog.extract.SubstrateRampExtractor;
import com.twentyn.sputterlog.report.DepositionParameters;
import com.twentyn.sputterlog.report.MainParameters;
import com.twentyn.sputterlog.report.ProcessOverview;
import com.twentyn.sputterlog.report.SourcePresputterParameters;
import com.twentyn.sputterlog.report.SourceRampUpParameters;
import com.twentyn.sputterlog.report.StepParameters;
import com.twentyn.sputterlog.report.SubstrateRampDownParameters;
import com.twentyn.sputterlog.report.SubstrateRampUpParameters;
import com.twentyn.sputterlog.source.SourceBinding;
import com.twentyn.sputterlog.source.SourceRegistry;
import com.twentyn.sputterlog.timeseries.Channels;
import com.twentyn.sputterlog.timeseries.Gas;
import com.twentyn.sputterlog.timeseries.LogfileParser;
import com.twentyn.sputterlog.timeseries.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Segments a sputter deposition log into process events and derives the quantities describing the run.
 *
 * Events are built in dependency order: the plasma, cracker, temperature and gas events first, then the deposition,
 * which anchors everything after it (presputtering, cracker base pressure, rate measurements, substrate ramps).
 * Every log is processed independently; the reader keeps no state between calls.
 */
public class SputterLogReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SputterLogReader.class);

  public static final String STAGE_SOURCES = "sources";
  public static final String STAGE_PLASMA = "plasma";
  public static final String STAGE_CRACKER = "cracker";
  public static final String STAGE_TEMPERATURE = "temperature";
  public static final String STAGE_GASES = "gases";
  public static final String STAGE_DEPOSITION = DepositionUnicityException.STAGE;
  public static final String STAGE_PRESPUTTER = "presputter";
  public static final String STAGE_CRACKER_BASE_PRESSURE = "cracker_base_pressure";
  public static final String STAGE_RATE_MEASUREMENT = "rate_measurement";
  public static final String STAGE_SUBSTRATE_RAMPS = "substrate_ramps";
  public static final String STAGE_PARAMETERS = "parameters";
  public static final String STAGE_REPORT = "report";

  private final SegmentationThresholds thresholds;

  public SputterLogReader(SegmentationThresholds thresholds) {
    this.thresholds = thresholds;
  }

  public SegmentationThresholds getThresholds() {
    return thresholds;
  }

  public SputterLogResult read(File logFile) throws IOException, LogProcessingException {
    TimeSeries series = new LogfileParser().parse(logFile);
    return readEvents(series, logFile.getName());
  }

  /**
   * Runs the whole pipeline over a loaded log.  The series passed in is left untouched.
   *
   * @throws DepositionUnicityException if no single deposition window can be identified
   * @throws LogProcessingException     if any stage fails, naming the stage and the log
   */
  public SputterLogResult readEvents(TimeSeries series, String logName) throws LogProcessingException {
    if (series.size() < 2) {
      throw new LogProcessingException(LogfileParser.STAGE, logName,
          String.format("a log needs at least two samples, found %d", series.size()));
    }
    return new Pipeline(series.copy(), logName).run();
  }

  /**
   * State of a single {@link #readEvents} call.
   */
  private class Pipeline {
    private final TimeSeries series;
    private final String logName;
    private final ConditionBuilder conditions;
    private final EventRefiner refiner;
    private final Map<String, LogEvent> events = new LinkedHashMap<>();
    private final Map<String, Integer> detectedCounts = new HashMap<>();

    private String stage;
    private SortedSet<Integer> sources;
    private Map<Integer, SourceBinding> bindings;
    private boolean temperatureControlObserved;

    Pipeline(TimeSeries series, String logName) {
      this.series = series;
      this.logName = logName;
      this.conditions = new ConditionBuilder(series, thresholds);
      this.refiner = new EventRefiner(thresholds, series.averageTimestep(), logName);
    }

    SputterLogResult run() throws LogProcessingException {
      try {
        enter(STAGE_SOURCES);
        bindSources();
        enter(STAGE_PLASMA);
        buildPlasmaEvents();
        enter(STAGE_CRACKER);
        addEvent(EventCategory.CRACKER_ON_OPEN, null, conditions.crackerOnOpen());
        enter(STAGE_TEMPERATURE);
        buildTemperatureControl();
        enter(STAGE_GASES);
        addEvent(EventCategory.AR_ON, null, conditions.gasFlowing(Gas.AR));
        addEvent(EventCategory.H2S_ON, null, conditions.gasFlowing(Gas.H2S));
        addEvent(EventCategory.PH3_ON, null, conditions.gasFlowing(Gas.PH3));
        enter(STAGE_DEPOSITION);
        buildDeposition();
        enter(STAGE_PRESPUTTER);
        buildPresputtering();
        enter(STAGE_CRACKER_BASE_PRESSURE);
        buildCrackerBasePressure();
        enter(STAGE_RATE_MEASUREMENT);
        buildRateMeasurements();
        enter(STAGE_SUBSTRATE_RAMPS);
        buildSubstrateRamps();
        enter(STAGE_PARAMETERS);
        return extractParameters();
      } catch (RuntimeException e) {
        throw new LogProcessingException(stage, logName, String.valueOf(e.getMessage()), e);
      }
    }

    private void enter(String nextStage) {
      stage = nextStage;
      LOGGER.info("%s: %s", logName, nextStage);
    }

    private LogEvent addEvent(EventCategory category, Integer source, Condition condition) {
      LogEvent event = new LogEvent(category, source, series);
      event.setCondition(condition);
      refiner.extract(event);
      events.put(event.getStepId(), event);
      return event;
    }

    private LogEvent event(EventCategory category) {
      return events.get(category.getKey());
    }

    private LogEvent event(EventCategory category, int source) {
      return events.get(String.format("%s_s%d", category.getKey(), source));
    }

    private void selectLastBeforeDeposition(LogEvent event) {
      detectedCounts.put(event.getStepId(), event.getNumEvents());
      refiner.selectLastBefore(event, event(EventCategory.DEPOSITION));
    }

    private Condition reactive() {
      return event(EventCategory.PH3_ON).getCondition()
          .or(event(EventCategory.H2S_ON).getCondition())
          .or(event(EventCategory.CRACKER_ON_OPEN).getCondition());
    }

    /* ----------------------------------------
     * Event building, in dependency order
     * */

    private void bindSources() {
      sources = SourceRegistry.discoverSources(series);
      bindings = SourceRegistry.bindSourcesToSupplies(series, sources);
      LOGGER.info("%s: found sources %s", logName, sources);
    }

    private void buildPlasmaEvents() {
      for (int source : sources) {
        addEvent(EventCategory.SOURCE_ON, source, conditions.plasmaOn(source));
        LogEvent rampUp = addEvent(EventCategory.SOURCE_RAMP_UP, source, conditions.plasmaRamping(source));
        refiner.stitch(rampUp, Channels.source(source, Channels.OUTPUT_SETPOINT));
      }
    }

    private void buildTemperatureControl() {
      Condition controlled = conditions.temperatureControlled();
      LogEvent temperatureControl = addEvent(EventCategory.TEMPERATURE_CONTROL, null, controlled);
      if (controlled.count() < thresholds.getMinTempCtrlSize() && !temperatureControl.isEmpty()) {
        LOGGER.debug("%s: temperature control held on %d samples only, ignored", logName, controlled.count());
        temperatureControl.replaceDomains(Collections.<Domain>emptyList());
      }
      temperatureControlObserved = !temperatureControl.isEmpty();
    }

    private void buildDeposition() throws DepositionUnicityException {
      List<Condition> on = new ArrayList<>();
      List<Condition> onAndOpen = new ArrayList<>();
      for (int source : sources) {
        on.add(event(EventCategory.SOURCE_ON, source).getCondition());
        onAndOpen.add(conditions.plasmaOnAndOpen(source));
      }
      addEvent(EventCategory.ANY_SOURCE_ON, null, conditions.anyOf(on));
      Condition anySourceOnOpen = conditions.anyOf(onAndOpen);
      addEvent(EventCategory.ANY_SOURCE_ON_OPEN, null, anySourceOnOpen);

      LogEvent deposition = addEvent(EventCategory.DEPOSITION, null, conditions.deposition(anySourceOnOpen));
      refiner.disambiguateDeposition(deposition);
      LOGGER.info("%s: deposition from %s to %s", logName, deposition.getDomains().get(0).getStartTime(),
          deposition.getDomains().get(0).getEndTime());

      for (int source : sources) {
        selectLastBeforeDeposition(event(EventCategory.SOURCE_RAMP_UP, source));
      }
    }

    private void buildPresputtering() {
      long depositionStart = event(EventCategory.DEPOSITION).getStart();
      Condition reactive = reactive();
      for (int source : sources) {
        Condition presputtering;
        if (event(EventCategory.SOURCE_ON, source).isEmpty()) {
          presputtering = conditions.none();
        } else {
          LogEvent rampUp = event(EventCategory.SOURCE_RAMP_UP, source);
          Long lastRampUpEnd = rampUp.isEmpty() ? null : rampUp.getEnd();
          presputtering = conditions.presputtering(source, depositionStart, lastRampUpEnd, reactive);
        }
        addEvent(EventCategory.SOURCE_PRESPUTTER, source, presputtering);
      }
    }

    private void buildCrackerBasePressure() {
      LogEvent deposition = event(EventCategory.DEPOSITION);
      Condition anyGas = event(EventCategory.AR_ON).getCondition()
          .or(event(EventCategory.H2S_ON).getCondition())
          .or(event(EventCategory.PH3_ON).getCondition());
      addEvent(EventCategory.CRACKER_BASE_PRESSURE, null, conditions.crackerBasePressure(
          event(EventCategory.CRACKER_ON_OPEN).getCondition(), anyGas, deposition.getStart(), deposition.getRows()));
    }

    private void buildRateMeasurements() {
      Condition depositionRows = event(EventCategory.DEPOSITION).getRows();
      Condition anySourceOnOpen = event(EventCategory.ANY_SOURCE_ON_OPEN).getCondition();
      Condition crackerOnOpen = event(EventCategory.CRACKER_ON_OPEN).getCondition();
      Condition ph3 = event(EventCategory.PH3_ON).getCondition();
      Condition h2s = event(EventCategory.H2S_ON).getCondition();

      addEvent(EventCategory.XTAL2_SHUTTER_OPEN, null, conditions.xtal2ShutterOpen());
      Condition rateMeasurement = conditions.depositionRateMeasurement();
      addEvent(EventCategory.DEPOSITION_RATE_MEASUREMENT, null, rateMeasurement);

      for (int source : sources) {
        if (!series.hasNumeric(Channels.source(source, Channels.OUTPUT_SETPOINT))) {
          continue;
        }
        LogEvent film = addEvent(EventCategory.FILM_DEPOSITION_RATE_MEASUREMENT, source,
            conditions.filmDepositionRateMeasurement(source, rateMeasurement, anySourceOnOpen, crackerOnOpen, ph3,
                h2s, depositionRows));
        selectLastBeforeDeposition(film);
      }
      LogEvent sulfur = addEvent(EventCategory.SULFUR_DEPOSITION_RATE_MEASUREMENT, null,
          conditions.sulfurDepositionRateMeasurement(rateMeasurement, anySourceOnOpen, crackerOnOpen, ph3, h2s,
              depositionRows));
      selectLastBeforeDeposition(sulfur);
    }

    private void buildSubstrateRamps() {
      Condition depositionRows = event(EventCategory.DEPOSITION).getRows();
      Condition heatedDeposition = conditions.above(Channels.HEATER_SETPOINT, thresholds.getRtTempThreshold())
          .and(depositionRows);
      boolean heated = depositionRows.any() && heatedDeposition.count() == depositionRows.count();

      if (!temperatureControlObserved && !heated) {
        LOGGER.debug("%s: no substrate heating, substrate ramps left empty", logName);
        addEvent(EventCategory.SUBSTRATE_RAMP_UP, null, conditions.none());
        addEvent(EventCategory.SUBSTRATE_RAMP_DOWN, null, conditions.none());
        addEvent(EventCategory.SUBSTRATE_RAMP_DOWN_HIGH, null, conditions.none());
        addEvent(EventCategory.SUBSTRATE_RAMP_DOWN_LOW, null, conditions.none());
        return;
      }

      Condition temperatureControl = event(EventCategory.TEMPERATURE_CONTROL).getCondition();
      LogEvent rampUp = addEvent(EventCategory.SUBSTRATE_RAMP_UP, null,
          conditions.substrateRampUp(temperatureControl, depositionRows));
      selectLastBeforeDeposition(rampUp);

      LogEvent rampDown = addEvent(EventCategory.SUBSTRATE_RAMP_DOWN, null,
          conditions.substrateRampDown(temperatureControl, depositionRows));
      Long rampDownStart = rampDown.isEmpty() ? null : rampDown.getStart();
      Condition reactive = reactive();
      addEvent(EventCategory.SUBSTRATE_RAMP_DOWN_HIGH, null,
          conditions.substrateRampDownHigh(rampDownStart, reactive));
      addEvent(EventCategory.SUBSTRATE_RAMP_DOWN_LOW, null,
          conditions.substrateRampDownLow(rampDownStart, reactive));
    }

    /* ----------------------------------------
     * Parameters and report
     * */

    private SputterLogResult extractParameters() {
      ExtractionContext ctx = new ExtractionContext(logName, series, thresholds, new ArrayList<>(sources), bindings,
          events, detectedCounts, temperatureControlObserved);
      DepositionParameters deposition = new DepositionExtractor().extract(ctx);
      ctx = ctx.withDepositionParameters(deposition);

      ProcessOverview overview = new OverviewExtractor().extract(ctx);
      Map<Integer, SourceRampUpParameters> rampUps = new SourceRampUpExtractor().extract(ctx);
      Map<Integer, SourcePresputterParameters> presputters = new SourcePresputterExtractor().extract(ctx);
      SubstrateRampExtractor substrateRamps = new SubstrateRampExtractor();
      SubstrateRampUpParameters substrateRampUp = substrateRamps.extractRampUp(ctx);
      SubstrateRampDownParameters substrateRampDown = substrateRamps.extractRampDown(ctx);

      for (LogEvent event : events.values()) {
        event.markParametersExtracted();
      }

      enter(STAGE_REPORT);
      MainParameters mainParameters = new MainParameters(overview, deposition, rampUps, presputters,
          substrateRampUp, substrateRampDown);
      List<StepParameters> steps = new StepParametersExtractor().extract(ctx);

      List<LogEvent> timeline = EventRefiner.unfoldEvents(events.values());
      Collections.sort(timeline, StepParametersExtractor.BY_START_THEN_STEP_ID);
      LOGGER.info("%s: %d events, %d process steps", logName, events.size(), steps.size());
      return new SputterLogResult(logName, events, timeline, bindings, mainParameters, steps);
    }
  }
}
