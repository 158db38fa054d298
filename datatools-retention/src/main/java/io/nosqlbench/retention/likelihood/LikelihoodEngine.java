package io.nosqlbench.retention.likelihood;

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

import io.nosqlbench.retention.model.ChurnModel;
import io.nosqlbench.retention.model.ModelParameters;
import io.nosqlbench.retention.model.SurvivalTable;

import java.util.Objects;

/// Negative log-likelihood of an observed [SurvivalTable] under the
/// Beta-Geometric model.
///
/// ## Objective
///
/// ```
/// NLL = -[ Σ_{t=1..T} lost[t] * log P(churn in t)  +  remaining[T] * log P(alive after T) ]
/// ```
///
/// The final period `T` is right-censored: its survivors contribute the
/// survival term instead of a churn term. See [BetaGeometricSurvival] for the
/// probabilities of each variant.
///
/// ## Infeasible parameters
///
/// The optimizer proposes points anywhere in parameter space. Instead of
/// throwing, an evaluation returns [#INFEASIBLE_PENALTY] when
///
/// - `gamma <= 0` or `delta <= 0`, or any parameter is not finite
/// - a Beta argument becomes non-positive
/// - the observed data has zero probability under the parameters, for example
///   churn observed in a period whose exponent is clipped to zero
///
/// Terms with a zero count contribute nothing, so an impossible event that
/// was never observed does not poison the total.
public final class LikelihoodEngine {

    /// Finite stand-in for `+infinity` returned for infeasible parameters.
    public static final double INFEASIBLE_PENALTY = 1.0e100;

    /// Creates a likelihood engine.
    public LikelihoodEngine() {
    }

    /// Evaluates the model variant implied by the parameters.
    ///
    /// Parameters with `alpha == 0` are evaluated with the base formulas.
    /// @param parameters the parameters to evaluate
    /// @param table the observed data
    /// @return the negative log-likelihood, or [#INFEASIBLE_PENALTY]
    public double negativeLogLikelihood(ModelParameters parameters, SurvivalTable table) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        return parameters.model() == ChurnModel.BASE
            ? base(parameters.gamma(), parameters.delta(), table)
            : extended(parameters.gamma(), parameters.delta(), parameters.alpha(), table);
    }

    /// Evaluates the parameters under an explicit model variant.
    /// @param model the variant to evaluate, [ChurnModel#EXTENDED] honors alpha
    /// @param parameters the parameters to evaluate
    /// @param table the observed data
    /// @return the negative log-likelihood, or [#INFEASIBLE_PENALTY]
    public double negativeLogLikelihood(ChurnModel model, ModelParameters parameters, SurvivalTable table) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        return model == ChurnModel.EXTENDED
            ? extended(parameters.gamma(), parameters.delta(), parameters.alpha(), table)
            : base(parameters.gamma(), parameters.delta(), table);
    }

    /// Base-model negative log-likelihood.
    /// @param gamma first shape parameter
    /// @param delta second shape parameter
    /// @param table the observed data
    /// @return the negative log-likelihood, or [#INFEASIBLE_PENALTY]
    public double base(double gamma, double delta, SurvivalTable table) {
        Objects.requireNonNull(table, "table cannot be null");
        if (!feasible(gamma, delta, 0.0)) {
            return INFEASIBLE_PENALTY;
        }
        int finalPeriod = table.finalPeriod();
        double logLikelihood = 0.0;
        for (int t = 1; t <= finalPeriod; t++) {
            logLikelihood += weighted(table.lost(t), BetaGeometricSurvival.logChurnBase(gamma, delta, t));
        }
        logLikelihood += weighted(table.remaining(finalPeriod),
            BetaGeometricSurvival.logSurvival(gamma, delta, finalPeriod));
        return finish(logLikelihood);
    }

    /// Extended-model negative log-likelihood.
    ///
    /// Equal to [#base(double, double, SurvivalTable)] when `alpha == 0`.
    /// @param gamma first shape parameter
    /// @param delta second shape parameter
    /// @param alpha churn-exponent drift
    /// @param table the observed data
    /// @return the negative log-likelihood, or [#INFEASIBLE_PENALTY]
    public double extended(double gamma, double delta, double alpha, SurvivalTable table) {
        Objects.requireNonNull(table, "table cannot be null");
        if (!feasible(gamma, delta, alpha)) {
            return INFEASIBLE_PENALTY;
        }
        int finalPeriod = table.finalPeriod();
        CumulativeExponents exponents = CumulativeExponents.compute(alpha, finalPeriod);
        double logLikelihood = 0.0;
        for (int t = 1; t <= finalPeriod; t++) {
            logLikelihood += weighted(table.lost(t),
                BetaGeometricSurvival.logChurnExtended(gamma, delta, exponents.before(t), exponents.through(t)));
        }
        logLikelihood += weighted(table.remaining(finalPeriod),
            BetaGeometricSurvival.logSurvival(gamma, delta, exponents.through(finalPeriod)));
        return finish(logLikelihood);
    }

    private static boolean feasible(double gamma, double delta, double alpha) {
        return Double.isFinite(gamma) && gamma > 0
            && Double.isFinite(delta) && delta > 0
            && Double.isFinite(alpha);
    }

    // zero counts contribute nothing, even against a zero-probability event
    private static double weighted(double count, double logProbability) {
        return count == 0.0 ? 0.0 : count * logProbability;
    }

    private static double finish(double logLikelihood) {
        double nll = -logLikelihood;
        if (Double.isNaN(nll) || nll >= INFEASIBLE_PENALTY) {
            return INFEASIBLE_PENALTY;
        }
        return nll;
    }
}
