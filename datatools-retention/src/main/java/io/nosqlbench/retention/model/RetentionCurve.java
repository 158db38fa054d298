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

/// Per-period survivor counts of a single cohort, observed or model-implied.
///
/// ## Period indexing
///
/// ```
/// period:      0        1        2    ...    N
/// remaining:   N0       r1       r2   ...    rN
/// lost:        -      N0-r1    r1-r2  ...  r(N-1)-rN
/// ```
///
/// Period 0 is the initial cohort and is exposed only through
/// [#initialPopulation()]. All per-period accessors take periods `1..N`.
///
/// ## Invariants
///
/// - `0 <= remaining(t) <= initialPopulation()`
/// - `remaining(t) <= remaining(t - 1)`, so `lost(t) >= 0`
///
/// @see SurvivalTable
/// @see ForecastTable
public interface RetentionCurve {

    /// @return the size of the cohort at period 0
    double initialPopulation();

    /// @return the number of periods after period 0
    int periodCount();

    /// @param period a period in `1..periodCount()`
    /// @return customers still active at the start of the period
    double remaining(int period);

    /// @param period a period in `1..periodCount()`
    /// @return customers who churned between the previous period and this one
    default double lost(int period) {
        return remainingAt(period - 1) - remaining(period);
    }

    /// Fraction of the previous period's customers still active in this period.
    ///
    /// Returns `0` when the previous period had no customers left.
    /// @param period a period in `1..periodCount()`
    /// @return `remaining(t) / remaining(t - 1)`
    default double retentionRate(int period) {
        double previous = remainingAt(period - 1);
        return previous > 0 ? remaining(period) / previous : 0.0;
    }

    /// @param period a period in `1..periodCount()`
    /// @return `remaining(t) / initialPopulation()`, or `0` for an empty cohort
    default double survivalFraction(int period) {
        double initial = initialPopulation();
        return initial > 0 ? remaining(period) / initial : 0.0;
    }

    /// @return the remaining counts for periods `1..periodCount()`
    default double[] remainingSeries() {
        double[] series = new double[periodCount()];
        for (int t = 1; t <= periodCount(); t++) {
            series[t - 1] = remaining(t);
        }
        return series;
    }

    /// @return the lost counts for periods `1..periodCount()`
    default double[] lostSeries() {
        double[] series = new double[periodCount()];
        for (int t = 1; t <= periodCount(); t++) {
            series[t - 1] = lost(t);
        }
        return series;
    }

    private double remainingAt(int period) {
        return period == 0 ? initialPopulation() : remaining(period);
    }
}
