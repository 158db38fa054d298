package io.nosqlbench.retention.project;

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

import io.nosqlbench.retention.likelihood.BetaGeometricSurvival;
import io.nosqlbench.retention.likelihood.CumulativeExponents;
import io.nosqlbench.retention.model.ForecastTable;
import io.nosqlbench.retention.model.ModelParameters;
import io.nosqlbench.retention.model.SurvivalTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Forward projection of expected survivors under given model parameters.
///
/// ```
/// remaining[t] = N0 * B(gamma, delta + cum(t)) / B(gamma, delta)
/// ```
///
/// with `cum(t) = t` in the base model and the clipped cumulative exponent of
/// [CumulativeExponents] in the extended model. Because clipped exponents are
/// never negative, `cum(t)` never decreases and neither does the forecast
/// survival fraction; the fraction is additionally clamped to `[0, 1]` and to
/// the previous period's value so rounding can never break monotonicity.
public final class Projector {

    private static final Logger logger = LogManager.getLogger(Projector.class);

    /// Creates a projector.
    public Projector() {
    }

    /// Projects from the initial population of an observed table.
    ///
    /// @param table supplies the period-0 cohort size
    /// @param parameters fitted or counterfactual parameters
    /// @param horizon number of periods to project, at least 1
    /// @return the forecast for periods `1..horizon`
    public ForecastTable project(SurvivalTable table, ModelParameters parameters, int horizon) {
        Objects.requireNonNull(table, "table cannot be null");
        return project(table.initialPopulation(), parameters, horizon);
    }

    /// Projects expected survivors of a cohort.
    ///
    /// @param initialPopulation the period-0 cohort size, finite and non-negative
    /// @param parameters fitted or counterfactual parameters, must be feasible
    /// @param horizon number of periods to project, at least 1
    /// @return the forecast for periods `1..horizon`
    /// @throws IllegalArgumentException for a negative population, infeasible parameters or a horizon below 1
    public ForecastTable project(double initialPopulation, ModelParameters parameters, int horizon) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        if (!Double.isFinite(initialPopulation) || initialPopulation < 0) {
            throw new IllegalArgumentException("initial population must be finite and non-negative, got: " + initialPopulation);
        }

        double[] fractions = survivalFractions(parameters, horizon);
        double[] remaining = new double[horizon];
        for (int t = 0; t < horizon; t++) {
            remaining[t] = initialPopulation * fractions[t];
        }
        logger.debug("Projected {} periods from {} with {}", horizon, initialPopulation, parameters);
        return new ForecastTable(initialPopulation, parameters, remaining);
    }

    /// Survival fractions `P(alive after t)` for periods `1..horizon`.
    ///
    /// @param parameters feasible model parameters
    /// @param horizon number of periods, at least 1
    /// @return non-increasing fractions in `[0, 1]`
    /// @throws IllegalArgumentException for infeasible parameters or a horizon below 1
    public double[] survivalFractions(ModelParameters parameters, int horizon) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be at least 1, got: " + horizon);
        }
        if (!parameters.isFeasible()) {
            throw new IllegalArgumentException("cannot project with infeasible parameters: " + parameters);
        }
        CumulativeExponents exponents = CumulativeExponents.compute(parameters.alpha(), horizon);
        double[] fractions = new double[horizon];
        double previous = 1.0;
        for (int t = 1; t <= horizon; t++) {
            double logSurvival = BetaGeometricSurvival.logSurvival(
                parameters.gamma(), parameters.delta(), exponents.through(t));
            double fraction = Double.isNaN(logSurvival) ? 0.0 : Math.exp(logSurvival);
            fraction = Math.min(previous, Math.max(0.0, fraction));
            fractions[t - 1] = fraction;
            previous = fraction;
        }
        return fractions;
    }
}
