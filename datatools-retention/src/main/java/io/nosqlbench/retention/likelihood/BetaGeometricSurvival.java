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

/// Closed-form survival and churn probabilities of the Beta-Geometric model.
///
/// Integrating the per-customer churn probability θ ~ Beta(gamma, delta) out of
/// the geometric survival law gives
///
/// ```
/// P(alive after t)        = B(gamma, delta + cum(t)) / B(gamma, delta)
/// P(churn in period t)    = (B(gamma, delta + cum(t-1)) - B(gamma, delta + cum(t))) / B(gamma, delta)
/// ```
///
/// where `cum(t)` is the cumulative survival exponent of [CumulativeExponents].
/// In the base model `cum(t) = t` and the churn probability simplifies through
/// `B(a, b) - B(a, b + 1) = B(a + 1, b)` to `B(gamma + 1, delta + t - 1) / B(gamma, delta)`.
///
/// Every method returns a natural log and yields `NaN` for infeasible arguments.
public final class BetaGeometricSurvival {

    private BetaGeometricSurvival() {
    }

    /// @param gamma first shape parameter
    /// @param delta second shape parameter
    /// @param cumulativeExponent `cum(t)`, `t` in the base model
    /// @return `log P(alive after t)`
    public static double logSurvival(double gamma, double delta, double cumulativeExponent) {
        return LogBeta.logRatio(gamma, delta + cumulativeExponent, delta);
    }

    /// Base-model churn probability for period `t`.
    /// @param gamma first shape parameter
    /// @param delta second shape parameter
    /// @param period the period `t >= 1`
    /// @return `log(B(gamma + 1, delta + t - 1) / B(gamma, delta))`
    public static double logChurnBase(double gamma, double delta, int period) {
        return LogBeta.logBeta(gamma + 1.0, delta + (period - 1)) - LogBeta.logBeta(gamma, delta);
    }

    /// Extended-model churn probability for a period.
    ///
    /// A period whose exponent is exactly 1 uses the closed form
    /// `B(gamma + 1, delta + cumA)` instead of the difference of two Beta values,
    /// which loses precision when `gamma` is small relative to `delta`.
    /// @param gamma first shape parameter
    /// @param delta second shape parameter
    /// @param cumulativeBefore `cumA[t]`
    /// @param cumulativeThrough `cumB[t]`
    /// @return the log churn probability; negative infinity when the period's exponent is clipped to zero
    public static double logChurnExtended(double gamma, double delta,
                                          double cumulativeBefore, double cumulativeThrough) {
        if (cumulativeThrough - cumulativeBefore == 1.0) {
            return LogBeta.logBeta(gamma + 1.0, delta + cumulativeBefore) - LogBeta.logBeta(gamma, delta);
        }
        return LogBeta.logDifference(gamma, delta + cumulativeBefore, delta + cumulativeThrough)
            - LogBeta.logBeta(gamma, delta);
    }
}
