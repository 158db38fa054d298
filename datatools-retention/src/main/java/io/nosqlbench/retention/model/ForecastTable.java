package io.nosqlbench.retention.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;
import java.util.Objects;

/// Model-implied survivor counts for periods `1..H`.
///
/// Produced by `Projector`; the counts are expected values and are generally
/// fractional. The remaining series is non-increasing and bounded by the
/// initial population.
public final class ForecastTable implements RetentionCurve {

    @SerializedName("initial_population")
    private final double initialPopulation;

    @SerializedName("parameters")
    private final ModelParameters parameters;

    @SerializedName("remaining")
    private final double[] remaining;

    /// Creates a forecast table.
    /// @param initialPopulation the period-0 cohort size the forecast was seeded from
    /// @param parameters the parameters the forecast was computed with
    /// @param remaining expected remaining customers for periods `1..H`
    public ForecastTable(double initialPopulation, ModelParameters parameters, double[] remaining) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Objects.requireNonNull(remaining, "remaining cannot be null");
        if (remaining.length == 0) {
            throw new IllegalArgumentException("a forecast needs at least one period");
        }
        double previous = initialPopulation;
        for (int i = 0; i < remaining.length; i++) {
            if (!(remaining[i] >= 0 && remaining[i] <= previous)) {
                throw new IllegalArgumentException(
                    "forecast remaining must be non-increasing within [0, " + initialPopulation
                        + "], period " + (i + 1) + " has " + remaining[i]);
            }
            previous = remaining[i];
        }
        this.initialPopulation = initialPopulation;
        this.parameters = parameters;
        this.remaining = remaining.clone();
    }

    @Override
    public double initialPopulation() {
        return initialPopulation;
    }

    /// @return the parameters this forecast was computed from
    public ModelParameters parameters() {
        return parameters;
    }

    /// @return the forecast horizon H
    public int horizon() {
        return remaining.length;
    }

    @Override
    public int periodCount() {
        return remaining.length;
    }

    @Override
    public double remaining(int period) {
        if (period < 1 || period > remaining.length) {
            throw new IndexOutOfBoundsException(
                "period " + period + " is outside 1.." + remaining.length);
        }
        return remaining[period - 1];
    }

    @Override
    public double[] remainingSeries() {
        return remaining.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForecastTable)) return false;
        ForecastTable that = (ForecastTable) o;
        return Double.compare(initialPopulation, that.initialPopulation) == 0
            && parameters.equals(that.parameters)
            && Arrays.equals(remaining, that.remaining);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(initialPopulation, parameters) + Arrays.hashCode(remaining);
    }

    @Override
    public String toString() {
        return "ForecastTable{initialPopulation=" + initialPopulation
            + ", parameters=" + parameters
            + ", remaining=" + Arrays.toString(remaining) + "}";
    }
}
