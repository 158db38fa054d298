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

/// Variant of the Beta-Geometric churn model.
///
/// | Variant | Free parameters | Per-period survival exponent |
/// |---------|-----------------|------------------------------|
/// | BASE | gamma, delta | 1 |
/// | EXTENDED | gamma, delta, alpha | max(0, 1 + alpha * t) |
public enum ChurnModel {

    /// Static churn probability per customer.
    BASE("bg", 2),

    /// Churn propensity drifting over time (loyalty when alpha < 0, novelty when alpha > 0).
    EXTENDED("bg-alpha", 3);

    private final String modelType;
    private final int parameterCount;

    ChurnModel(String modelType, int parameterCount) {
        this.modelType = modelType;
        this.parameterCount = parameterCount;
    }

    /// @return short identifier used in JSON output and trace files
    public String getModelType() {
        return modelType;
    }

    /// @return number of parameters estimated by the fitter for this variant
    public int getParameterCount() {
        return parameterCount;
    }

    /// Selects the variant from the boolean form used by the fit entry point.
    /// @param extended
    ///     whether the alpha term is estimated
    /// @return the matching variant
    public static ChurnModel of(boolean extended) {
        return extended ? EXTENDED : BASE;
    }
}
