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

import org.apache.commons.math3.special.Beta;

/// Log-space Beta function helpers.
///
/// Ratios of Beta functions are the building blocks of the Beta-Geometric
/// likelihood. Evaluated directly they overflow or underflow as soon as the
/// shape parameters or the horizon grow, so every ratio here is a difference
/// of logs and every difference of Beta values is taken relative to the larger one:
///
/// ```
/// log(B(a,b1) - B(a,b2)) = log B(a,b1) + log1p(-exp(log B(a,b2) - log B(a,b1)))   for b2 >= b1
/// ```
///
/// All methods return `NaN` rather than throwing when an argument is outside
/// the domain `a > 0, b > 0`.
public final class LogBeta {

    private LogBeta() {
    }

    /// @param a first argument, must be positive
    /// @param b second argument, must be positive
    /// @return `log B(a, b)`, or `NaN` outside the domain
    public static double logBeta(double a, double b) {
        if (!(a > 0) || !(b > 0) || Double.isInfinite(a) || Double.isInfinite(b)) {
            return Double.NaN;
        }
        return Beta.logBeta(a, b);
    }

    /// @return `log(B(a, b2) / B(a, b1))`, or `NaN` outside the domain
    public static double logRatio(double a, double b2, double b1) {
        return logBeta(a, b2) - logBeta(a, b1);
    }

    /// Computes `log(B(a, b1) - B(a, b2))` for `b2 >= b1`.
    ///
    /// Returns negative infinity when `b2 == b1`, since the difference is zero.
    /// @return the log of the difference, or `NaN` outside the domain or when `b2 < b1`
    public static double logDifference(double a, double b1, double b2) {
        if (b2 < b1) {
            return Double.NaN;
        }
        double logB1 = logBeta(a, b1);
        double logB2 = logBeta(a, b2);
        if (Double.isNaN(logB1) || Double.isNaN(logB2)) {
            return Double.NaN;
        }
        return logB1 + log1mExp(logB2 - logB1);
    }

    /// Computes `log(1 - exp(x))` for `x <= 0`.
    ///
    /// Switches between `log(-expm1(x))` and `log1p(-exp(x))` at `-ln 2`
    /// (Mächler, "Accurately Computing log(1 - exp(-|a|))").
    static double log1mExp(double x) {
        if (x > 0) {
            return Double.NaN;
        }
        if (x > -Math.log(2.0)) {
            return Math.log(-Math.expm1(x));
        }
        return Math.log1p(-Math.exp(x));
    }
}
