package io.nosqlbench.retention.fit;

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
import io.nosqlbench.retention.model.ChurnModel;
import io.nosqlbench.retention.model.ModelParameters;

import java.util.List;

/// Outcome of a maximum-likelihood fit.
///
/// A fit that ran out of its evaluation or iteration budget still carries the
/// best parameters seen, with `converged == false`. Callers must check the
/// flag before trusting the estimate.
///
/// @param parameters the best parameters found
/// @param model the model variant that was fitted
/// @param converged whether the winning simplex run met its convergence criterion
/// @param objective the negative log-likelihood at [#parameters()]
/// @param evaluations objective evaluations across all starts
/// @param observations the cohort size the likelihood was computed over
/// @param starts one entry per simplex run, the fixed start first
public record FitResult(
    @SerializedName("parameters") ModelParameters parameters,
    @SerializedName("model") ChurnModel model,
    @SerializedName("converged") boolean converged,
    @SerializedName("objective") double objective,
    @SerializedName("evaluations") int evaluations,
    @SerializedName("observations") double observations,
    @SerializedName("starts") List<StartOutcome> starts
) {

    /// Creates a fit result.
    public FitResult {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (Double.isNaN(objective)) {
            throw new IllegalArgumentException("objective cannot be NaN");
        }
        starts = starts == null ? List.of() : List.copyOf(starts);
    }

    /// @return the maximized log-likelihood, `-objective`
    public double logLikelihood() {
        return -objective;
    }

    /// Akaike information criterion, `2k + 2 * NLL`. Lower is better.
    /// @return the AIC
    public double aic() {
        return 2.0 * model.getParameterCount() + 2.0 * objective;
    }

    /// Bayesian information criterion, `k * ln(n) + 2 * NLL` with `n` the cohort size. Lower is better.
    /// @return the BIC
    public double bic() {
        return model.getParameterCount() * Math.log(observations) + 2.0 * objective;
    }

    /// @return how many of the simplex runs converged
    public long convergedStarts() {
        return starts.stream().filter(StartOutcome::converged).count();
    }

    /// Result of a single simplex run.
    ///
    /// @param start the starting point
    /// @param parameters the best point the run reached
    /// @param objective the negative log-likelihood at that point
    /// @param converged whether the run met its convergence criterion
    /// @param evaluations objective evaluations used by the run
    /// @param iterations simplex iterations used by the run
    public record StartOutcome(
        @SerializedName("start") ModelParameters start,
        @SerializedName("parameters") ModelParameters parameters,
        @SerializedName("objective") double objective,
        @SerializedName("converged") boolean converged,
        @SerializedName("evaluations") int evaluations,
        @SerializedName("iterations") int iterations
    ) {
    }
}
