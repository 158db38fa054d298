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

/// Prefix sums of the clipped per-period survival exponent.
///
/// In the extended model a customer with churn probability θ survives period
/// `i` with probability `(1-θ)^e(i)` where
///
/// ```
/// e(i) = max(0, 1 + alpha * i)
/// ```
///
/// The clip keeps a strong loyalty effect (`alpha < 0`) from turning into a
/// negative exponent, which would let the surviving fraction grow. Survival
/// through period `t` is then `(1-θ)^cum(t)` with `cum(t) = e(1) + ... + e(t)`.
///
/// The series is computed once per evaluation:
///
/// | Accessor | Meaning |
/// |----------|---------|
/// | `before(t)` | `cumA[t]`, sum over `1..t-1` |
/// | `through(t)` | `cumB[t]`, sum over `1..t` |
///
/// With `alpha == 0` every exponent is exactly `1.0`, so `through(t) == t`
/// with no rounding.
public final class CumulativeExponents {

    private final double alpha;
    private final double[] cumulative;

    private CumulativeExponents(double alpha, double[] cumulative) {
        this.alpha = alpha;
        this.cumulative = cumulative;
    }

    /// Computes the prefix sums for periods `1..horizon`.
    /// @param alpha the churn-exponent drift
    /// @param horizon the last period needed, at least 1
    /// @return the cumulative series
    public static CumulativeExponents compute(double alpha, int horizon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be at least 1, got: " + horizon);
        }
        double[] cumulative = new double[horizon + 1];
        for (int i = 1; i <= horizon; i++) {
            cumulative[i] = cumulative[i - 1] + exponent(alpha, i);
        }
        return new CumulativeExponents(alpha, cumulative);
    }

    /// @param alpha the churn-exponent drift
    /// @param period the period
    /// @return `max(0, 1 + alpha * period)`
    public static double exponent(double alpha, int period) {
        return Math.max(0.0, 1.0 + alpha * period);
    }

    /// @return the drift this series was computed for
    public double alpha() {
        return alpha;
    }

    /// @return the last period covered
    public int horizon() {
        return cumulative.length - 1;
    }

    /// @param period a period in `1..horizon()`
    /// @return the exponent applied in that period
    public double exponent(int period) {
        return cumulative[period] - cumulative[period - 1];
    }

    /// @param period a period in `1..horizon()`
    /// @return `cumA[period]`, the exponent sum over periods before this one
    public double before(int period) {
        return cumulative[period - 1];
    }

    /// @param period a period in `0..horizon()`
    /// @return `cumB[period]`, the exponent sum through this period
    public double through(int period) {
        return cumulative[period];
    }
}
