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

package com.twentyn.sputterlog.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.sputterlog.event.EventCategory;
import com.twentyn.sputterlog.timeseries.Gas;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Every tunable number the segmentation heuristics use.  The packaged defaults live in
 * {@value #DEFAULTS_RESOURCE}; a user file may override any subset of them.  Instances are immutable once loaded;
 * use {@link #toBuilder()} to derive a perturbed copy.
 */
public class SegmentationThresholds {
  public static final String DEFAULTS_RESOURCE = "segmentation-thresholds.json";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  // Electrical current above which a DC plasma is considered on (mA).
  @JsonProperty("current_threshold")
  private double currentThreshold = 0.01;

  // DC bias above which an RF plasma is considered on (V).
  @JsonProperty("bias_threshold")
  private double biasThreshold = 0.01;

  // Forward minus reflected power above which a plasma is considered on (W).
  @JsonProperty("power_fwd_refl_threshold")
  private double powerFwdReflThreshold = 10.0;

  // Sample-to-sample increase of the power setpoint that marks a plasma ramp (W).
  @JsonProperty("power_setpoint_diff_threshold")
  private double powerSetpointDiffThreshold = 0.01;

  // Sample-to-sample change of the heater setpoint that marks a substrate ramp (degrees C).
  @JsonProperty("temp_setpoint_diff_threshold")
  private double tempSetpointDiffThreshold = 0.11;

  @JsonProperty("cracker_zone1_min_temp")
  private double crackerZone1MinTemp = 70.0;

  @JsonProperty("cracker_zone2_min_temp")
  private double crackerZone2MinTemp = 150.0;

  @JsonProperty("cracker_zone3_min_temp")
  private double crackerZone3MinTemp = 200.0;

  // Heater setpoint below which a deposition counts as room temperature (degrees C).
  @JsonProperty("rt_temp_threshold")
  private double rtTempThreshold = 30.0;

  // Settling time of the QCM after the Xtal 2 shutter opens (s).
  @JsonProperty("stabilization_time_seconds")
  private double stabilizationTimeSeconds = 30.0;

  // Flow above which a mass flow controller is considered on (sccm).
  @JsonProperty("mfc_flow_threshold")
  private double mfcFlowThreshold = 1.0;

  // Share of the deposition samples averaged for the start and end voltage (%).
  @JsonProperty("voltage_averaging_percent")
  private double voltageAveragingPercent = 5.0;

  // Gaps, in average timesteps, tolerated inside a domain.
  @JsonProperty("default_continuity_limit")
  private double defaultContinuityLimit = 10.0;

  @JsonProperty("category_continuity_limits")
  private Map<String, Double> categoryContinuityLimits = defaultCategoryContinuityLimits();

  // Domains shorter than this many average timesteps are noise.
  @JsonProperty("min_domain_size")
  private double minDomainSize = 3.0;

  @JsonProperty("deposition_min_domain_size")
  private double depositionMinDomainSize = 60.0;

  // Temperature control holding on fewer samples than this is a logging glitch.
  @JsonProperty("min_temp_ctrl_size")
  private int minTempCtrlSize = 10;

  // Upper bound of a pressure that still counts as a true base pressure (Torr).
  @JsonProperty("max_base_pressure")
  private double maxBasePressure = 1e-6;

  // Tolerance band around deposition values for "same conditions as the deposition" (%).
  @JsonProperty("within_range_percent")
  private double withinRangePercent = 10.0;

  // Share of deposition samples an indicator must hold on to classify the plasma type.
  @JsonProperty("plasma_type_tolerance")
  private double plasmaTypeTolerance = 0.85;

  // Fraction of reactive gas in its Ar-diluted bottle.
  @JsonProperty("gas_dilution_fractions")
  private Map<String, Double> gasDilutionFractions = defaultGasDilutionFractions();

  @JsonProperty("true_temp_slope")
  private double trueTempSlope = 0.905;

  @JsonProperty("true_temp_offset")
  private double trueTempOffset = 12.0;

  private SegmentationThresholds() {
  }

  public static SegmentationThresholds loadDefaults() {
    try (InputStream is = SegmentationThresholds.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (is == null) {
        throw new RuntimeException(String.format("Unable to find resource %s on the classpath", DEFAULTS_RESOURCE));
      }
      return fromStream(is);
    } catch (IOException e) {
      throw new RuntimeException(String.format("Unable to read packaged thresholds %s", DEFAULTS_RESOURCE), e);
    }
  }

  public static SegmentationThresholds fromFile(File file) throws IOException {
    SegmentationThresholds thresholds = OBJECT_MAPPER.readValue(file, SegmentationThresholds.class);
    thresholds.validate();
    return thresholds;
  }

  public static SegmentationThresholds fromStream(InputStream is) throws IOException {
    SegmentationThresholds thresholds = OBJECT_MAPPER.readValue(is, SegmentationThresholds.class);
    thresholds.validate();
    return thresholds;
  }

  public static Builder builder() {
    return loadDefaults().toBuilder();
  }

  public Builder toBuilder() {
    return new Builder(copy());
  }

  void validate() {
    double[] finitePositive = new double[] {
        mfcFlowThreshold, stabilizationTimeSeconds, voltageAveragingPercent, defaultContinuityLimit,
        minDomainSize, depositionMinDomainSize, maxBasePressure, withinRangePercent, trueTempSlope,
    };
    for (double v : finitePositive) {
      if (!(v > 0.0) || Double.isInfinite(v)) {
        throw new IllegalArgumentException(String.format("Threshold value %f must be finite and positive", v));
      }
    }
    double[] finite = new double[] {
        currentThreshold, biasThreshold, powerFwdReflThreshold, powerSetpointDiffThreshold,
        tempSetpointDiffThreshold, crackerZone1MinTemp, crackerZone2MinTemp, crackerZone3MinTemp, rtTempThreshold,
        trueTempOffset,
    };
    for (double v : finite) {
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        throw new IllegalArgumentException(String.format("Threshold value %f must be finite", v));
      }
    }
    if (!(plasmaTypeTolerance > 0.0 && plasmaTypeTolerance <= 1.0)) {
      throw new IllegalArgumentException(String.format(
          "plasma_type_tolerance must be in (0, 1], got %f", plasmaTypeTolerance));
    }
    if (voltageAveragingPercent > 100.0) {
      throw new IllegalArgumentException(String.format(
          "voltage_averaging_percent must be at most 100, got %f", voltageAveragingPercent));
    }
    if (minTempCtrlSize < 1) {
      throw new IllegalArgumentException(String.format("min_temp_ctrl_size must be positive, got %d", minTempCtrlSize));
    }
    for (Map.Entry<String, Double> entry : categoryContinuityLimits.entrySet()) {
      EventCategory.fromKey(entry.getKey());
      if (entry.getValue() == null || !(entry.getValue() > 0.0)) {
        throw new IllegalArgumentException(String.format(
            "Continuity limit for '%s' must be positive, got %s", entry.getKey(), entry.getValue()));
      }
    }
    for (Map.Entry<String, Double> entry : gasDilutionFractions.entrySet()) {
      Gas gas = Gas.valueOf(entry.getKey());
      if (!gas.isReactive() || entry.getValue() == null || !(entry.getValue() > 0.0 && entry.getValue() <= 1.0)) {
        throw new IllegalArgumentException(String.format(
            "Dilution fraction for '%s' must be in (0, 1] and apply to a reactive gas", entry.getKey()));
      }
    }
  }

  private SegmentationThresholds copy() {
    SegmentationThresholds copy = new SegmentationThresholds();
    copy.currentThreshold = currentThreshold;
    copy.biasThreshold = biasThreshold;
    copy.powerFwdReflThreshold = powerFwdReflThreshold;
    copy.powerSetpointDiffThreshold = powerSetpointDiffThreshold;
    copy.tempSetpointDiffThreshold = tempSetpointDiffThreshold;
    copy.crackerZone1MinTemp = crackerZone1MinTemp;
    copy.crackerZone2MinTemp = crackerZone2MinTemp;
    copy.crackerZone3MinTemp = crackerZone3MinTemp;
    copy.rtTempThreshold = rtTempThreshold;
    copy.stabilizationTimeSeconds = stabilizationTimeSeconds;
    copy.mfcFlowThreshold = mfcFlowThreshold;
    copy.voltageAveragingPercent = voltageAveragingPercent;
    copy.defaultContinuityLimit = defaultContinuityLimit;
    copy.categoryContinuityLimits = new TreeMap<>(categoryContinuityLimits);
    copy.minDomainSize = minDomainSize;
    copy.depositionMinDomainSize = depositionMinDomainSize;
    copy.minTempCtrlSize = minTempCtrlSize;
    copy.maxBasePressure = maxBasePressure;
    copy.withinRangePercent = withinRangePercent;
    copy.plasmaTypeTolerance = plasmaTypeTolerance;
    copy.gasDilutionFractions = new TreeMap<>(gasDilutionFractions);
    copy.trueTempSlope = trueTempSlope;
    copy.trueTempOffset = trueTempOffset;
    return copy;
  }

  private static Map<String, Double> defaultCategoryContinuityLimits() {
    Map<String, Double> limits = new TreeMap<>();
    limits.put(EventCategory.DEPOSITION.getKey(), 200.0);
    return limits;
  }

  private static Map<String, Double> defaultGasDilutionFractions() {
    Map<String, Double> fractions = new TreeMap<>();
    fractions.put(Gas.H2S.name(), 0.1);
    fractions.put(Gas.PH3.name(), 0.1);
    return fractions;
  }

  public double getCurrentThreshold() {
    return currentThreshold;
  }

  public double getBiasThreshold() {
    return biasThreshold;
  }

  public double getPowerFwdReflThreshold() {
    return powerFwdReflThreshold;
  }

  public double getPowerSetpointDiffThreshold() {
    return powerSetpointDiffThreshold;
  }

  public double getTempSetpointDiffThreshold() {
    return tempSetpointDiffThreshold;
  }

  public double getCrackerZone1MinTemp() {
    return crackerZone1MinTemp;
  }

  public double getCrackerZone2MinTemp() {
    return crackerZone2MinTemp;
  }

  public double getCrackerZone3MinTemp() {
    return crackerZone3MinTemp;
  }

  public double getRtTempThreshold() {
    return rtTempThreshold;
  }

  public double getStabilizationTimeSeconds() {
    return stabilizationTimeSeconds;
  }

  public double getMfcFlowThreshold() {
    return mfcFlowThreshold;
  }

  public double getVoltageAveragingPercent() {
    return voltageAveragingPercent;
  }

  public double getDefaultContinuityLimit() {
    return defaultContinuityLimit;
  }

  /**
   * Continuity limit for events of this category: the per-category override if one is configured, otherwise the
   * default limit.
   */
  public double getContinuityLimit(EventCategory category) {
    Double limit = categoryContinuityLimits.get(category.getKey());
    return limit != null ? limit : defaultContinuityLimit;
  }

  public Map<String, Double> getCategoryContinuityLimits() {
    return Collections.unmodifiableMap(categoryContinuityLimits);
  }

  public double getMinDomainSize() {
    return minDomainSize;
  }

  public double getDepositionMinDomainSize() {
    return depositionMinDomainSize;
  }

  public int getMinTempCtrlSize() {
    return minTempCtrlSize;
  }

  public double getMaxBasePressure() {
    return maxBasePressure;
  }

  public double getWithinRangePercent() {
    return withinRangePercent;
  }

  public double getPlasmaTypeTolerance() {
    return plasmaTypeTolerance;
  }

  /** Fraction of the reactive gas in its bottle; Ar is never diluted. */
  public double getGasDilutionFraction(Gas gas) {
    if (!gas.isReactive()) {
      return 1.0;
    }
    Double fraction = gasDilutionFractions.get(gas.name());
    if (fraction == null) {
      throw new IllegalStateException(String.format("No dilution fraction configured for %s", gas.getFormula()));
    }
    return fraction;
  }

  public double getTrueTempSlope() {
    return trueTempSlope;
  }

  public double getTrueTempOffset() {
    return trueTempOffset;
  }

  public static class Builder {
    private final SegmentationThresholds thresholds;

    private Builder(SegmentationThresholds thresholds) {
      this.thresholds = thresholds;
    }

    public Builder currentThreshold(double v) {
      thresholds.currentThreshold = v;
      return this;
    }

    public Builder biasThreshold(double v) {
      thresholds.biasThreshold = v;
      return this;
    }

    public Builder powerFwdReflThreshold(double v) {
      thresholds.powerFwdReflThreshold = v;
      return this;
    }

    public Builder rtTempThreshold(double v) {
      thresholds.rtTempThreshold = v;
      return this;
    }

    public Builder mfcFlowThreshold(double v) {
      thresholds.mfcFlowThreshold = v;
      return this;
    }

    public Builder defaultContinuityLimit(double v) {
      thresholds.defaultContinuityLimit = v;
      return this;
    }

    public Builder continuityLimit(EventCategory category, double v) {
      thresholds.categoryContinuityLimits.put(category.getKey(), v);
      return this;
    }

    public Builder minDomainSize(double v) {
      thresholds.minDomainSize = v;
      return this;
    }

    public Builder depositionMinDomainSize(double v) {
      thresholds.depositionMinDomainSize = v;
      return this;
    }

    public Builder minTempCtrlSize(int v) {
      thresholds.minTempCtrlSize = v;
      return this;
    }

    public Builder stabilizationTimeSeconds(double v) {
      thresholds.stabilizationTimeSeconds = v;
      return this;
    }

    public Builder withinRangePercent(double v) {
      thresholds.withinRangePercent = v;
      return this;
    }

    public Builder plasmaTypeTolerance(double v) {
      thresholds.plasmaTypeTolerance = v;
      return this;
    }

    public Builder gasDilutionFraction(Gas gas, double v) {
      thresholds.gasDilutionFractions.put(gas.name(), v);
      return this;
    }

    public SegmentationThresholds build() {
      SegmentationThresholds built = thresholds.copy();
      built.validate();
      return built;
    }
  }
}
