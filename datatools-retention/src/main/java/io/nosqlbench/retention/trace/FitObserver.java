package io.nosqlbench.retention.trace;

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

import io.nosqlbench.retention.config.RetentionGsonConfig;
import io.nosqlbench.retention.fit.FitResult;
import io.nosqlbench.retention.model.ChurnModel;
import io.nosqlbench.retention.model.ModelParameters;

/// Observer interface for monitoring the progress of a maximum-likelihood fit.
///
/// ## Purpose
///
/// Simplex searches can wander or stall; these callbacks make the search path
/// inspectable without changing the fitter:
///
/// ```text
///   onFitStart
///      │
///      ├── for each start 0..S-1:
///      │      onEvaluation (many times)
///      │      onStartComplete
///      │
///   onFitComplete
/// ```
///
/// ## Usage
///
/// ```java
/// try (NdjsonFitTraceObserver observer = new NdjsonFitTraceObserver(Path.of("fit.ndjson"))) {
///     FitResult result = new ModelFitter(config, observer).fit(table, true);
/// }
/// ```
///
/// @see io.nosqlbench.retention.fit.ModelFitter
public interface FitObserver {

    /// No-op observer that does nothing.
    FitObserver NOOP = new FitObserver() {
        @Override
        public void onFitStart(ChurnModel model, int periods, int starts) {
            // No-op
        }

        @Override
        public void onEvaluation(int start, ModelParameters parameters, double objective) {
            // No-op
        }

        @Override
        public void onStartComplete(int start, FitResult.StartOutcome outcome) {
            // No-op
        }

        @Override
        public void onFitComplete(FitResult result) {
            // No-op
        }
    };

    /// Called once before the first simplex run.
    ///
    /// @param model the model variant being fitted
    /// @param periods the number of observed periods
    /// @param starts the number of simplex runs that will be made
    void onFitStart(ChurnModel model, int periods, int starts);

    /// Called for every objective evaluation.
    ///
    /// @param start the zero-based index of the simplex run
    /// @param parameters the evaluated point, possibly infeasible
    /// @param objective the negative log-likelihood or the infeasibility penalty
    void onEvaluation(int start, ModelParameters parameters, double objective);

    /// Called when a simplex run ends, converged or not.
    ///
    /// @param start the zero-based index of the simplex run
    /// @param outcome the result of that run
    void onStartComplete(int start, FitResult.StartOutcome outcome);

    /// Called once with the selected result.
    ///
    /// @param result the final fit result
    void onFitComplete(FitResult result);

    /// Formats an object as a compact JSON string, one line per record.
    ///
    /// @param state the object to format
    /// @return compact JSON
    static String toCompactJson(Object state) {
        return RetentionGsonConfig.compactGson().toJson(state);
    }
}
