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

/// Parameters of the (possibly extended) Beta-Geometric model.
///
/// `gamma` and `delta` are the shape parameters of the Beta distribution over
/// each customer's latent per-period churn probability θ. `alpha` controls a
/// population-wide drift of the per-period survival exponent, `max(0, 1 + alpha * t)`;
/// with `alpha == 0` the extended model is exactly the base model.
///
/// Instances are plain values. Feasibility is not enforced here because the
/// optimizer must be able to represent infeasible proposals; see [#isFeasible()].
///
/// @param gamma first Beta shape parameter, must be positive to be feasible
/// @param delta second Beta shape parameter, must be positive to be feasible
/// @param alpha churn-exponent drift, unconstrained
public record ModelParameters(
    @SerializedName("gamma") double gamma,
    @SerializedName("delta") double delta,
    @SerializedName("alpha") double alpha
) {

    /// Creates base-model parameters.
    /// @param gamma first Beta shape parameter
    /// @param delta second Beta shape parameter
    /// @return parameters with `alpha == 0`
    public static ModelParameters base(double gamma, double delta) {
        return new ModelParameters(gamma, delta, 0.0);
    }

    /// Creates extended-model parameters.
    /// @param gamma first Beta shape parameter
    /// @param delta second Beta shape parameter
    /// @param alpha churn-exponent drift
    /// @return the parameters
    public static ModelParameters extended(double gamma, double delta, double alpha) {
        return new ModelParameters(gamma, delta, alpha);
    }

    /// Builds parameters from an optimizer point.
    /// @param point `[gamma, delta]` or `[gamma, delta, alpha]`
    /// @return the parameters
    public static ModelParameters fromPoint(double[] point) {
        if (point.length == 2) {
            return base(point[0], point[1]);
        }
        if (point.length == 3) {
            return extended(point[0], point[1], point[2]);
        }
        throw new IllegalArgumentException("Expected 2 or 3 parameters, got: " + point.length);
    }

    /// @param model the variant whose free parameters are wanted
    /// @return this point in optimizer coordinates for the given variant
    public double[] toPoint(ChurnModel model) {
        return model == ChurnModel.EXTENDED
            ? new double[]{gamma, delta, alpha}
            : new double[]{gamma, delta};
    }

    /// @return true when both shape parameters are finite and positive and alpha is finite
    public boolean isFeasible() {
        return Double.isFinite(gamma) && gamma > 0
            && Double.isFinite(delta) && delta > 0
            && Double.isFinite(alpha);
    }

    /// @return [ChurnModel#BASE] when alpha is zero, otherwise [ChurnModel#EXTENDED]
    public ChurnModel model() {
        return alpha == 0.0 ? ChurnModel.BASE : ChurnModel.EXTENDED;
    }

    /// Mean of the latent churn-probability distribution, `gamma / (gamma + delta)`.
    ///
    /// This is the expected churn probability of a freshly acquired customer
    /// in the first period.
    /// @return the mean churn probability
    public double meanChurnProbability() {
        return gamma / (gamma + delta);
    }

    @Override
    public String toString() {
        return model() == ChurnModel.BASE
            ? String.format("ModelParameters{gamma=%.6g, delta=%.6g}", gamma, delta)
            : String.format("ModelParameters{gamma=%.6g, delta=%.6g, alpha=%.6g}", gamma, delta, alpha);
    }
}
