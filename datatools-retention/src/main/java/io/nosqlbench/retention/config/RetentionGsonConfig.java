package io.nosqlbench.retention.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for retention model output.
///
/// ## Purpose
///
/// Provides configured [Gson] instances for serializing fit results,
/// forecasts, fitter configuration and trace events:
///
/// - [io.nosqlbench.retention.model.ModelParameters]
/// - [io.nosqlbench.retention.model.ForecastTable]
/// - [io.nosqlbench.retention.fit.FitResult]
/// - [io.nosqlbench.retention.fit.FitterConfig]
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled (except compact) | Human-readable reports |
/// | HTML escaping | Disabled | Cleaner output |
/// | Special floats | Serialized | Penalty and non-finite objectives survive output |
///
/// ## Thread Safety
///
/// [Gson] instances are thread-safe and shared.
public final class RetentionGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private static final Gson COMPACT = new GsonBuilder()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    private RetentionGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with retention defaults, for callers that
    /// need further customization.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }

    /// Returns a compact (single-line) Gson instance for NDJSON output.
    ///
    /// @return the shared compact Gson instance
    public static Gson compactGson() {
        return COMPACT;
    }
}
