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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.retention.config.RetentionGsonConfig;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/// JSON-serializable settings for [ModelFitter].
///
/// ## JSON Schema
///
/// Every field is optional; missing fields keep their defaults.
///
/// ```json
/// {
///   "max_evaluations": 20000,
///   "max_iterations": 10000,
///   "relative_tolerance": 1e-10,
///   "absolute_tolerance": 1e-10,
///   "initial_gamma": 1.0,
///   "initial_delta": 1.0,
///   "initial_alpha": 0.0,
///   "shape_step": 0.25,
///   "alpha_step": 0.05,
///   "restarts": 0,
///   "restart_spread": 2.0,
///   "seed": 42
/// }
/// ```
///
/// The evaluation and iteration budgets bound the run time of a simplex search,
/// which has no intrinsic upper bound on pathological inputs. Exhausting either
/// budget yields a non-converged result, not an exception.
///
/// `restarts` adds that many extra simplex runs from starting points spread
/// log-uniformly by a factor of up to `restart_spread` around the initial point.
/// The default of zero is a single run from `gamma = 1, delta = 1, alpha = 0`.
public class FitterConfig {

    @SerializedName("max_evaluations")
    private int maxEvaluations = 20_000;

    @SerializedName("max_iterations")
    private int maxIterations = 10_000;

    @SerializedName("relative_tolerance")
    private double relativeTolerance = 1e-10;

    @SerializedName("absolute_tolerance")
    private double absoluteTolerance = 1e-10;

    @SerializedName("initial_gamma")
    private double initialGamma = 1.0;

    @SerializedName("initial_delta")
    private double initialDelta = 1.0;

    @SerializedName("initial_alpha")
    private double initialAlpha = 0.0;

    @SerializedName("shape_step")
    private double shapeStep = 0.25;

    @SerializedName("alpha_step")
    private double alphaStep = 0.05;

    @SerializedName("restarts")
    private int restarts = 0;

    @SerializedName("restart_spread")
    private double restartSpread = 2.0;

    @SerializedName("seed")
    private long seed = 42L;

    /// Creates a configuration with default settings.
    public FitterConfig() {
    }

    /// @return a configuration with default settings
    public static FitterConfig defaults() {
        return new FitterConfig();
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    public FitterConfig withMaxEvaluations(int maxEvaluations) {
        this.maxEvaluations = maxEvaluations;
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public FitterConfig withMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
        return this;
    }

    public double getRelativeTolerance() {
        return relativeTolerance;
    }

    public FitterConfig withRelativeTolerance(double relativeTolerance) {
        this.relativeTolerance = relativeTolerance;
        return this;
    }

    public double getAbsoluteTolerance() {
        return absoluteTolerance;
    }

    public FitterConfig withAbsoluteTolerance(double absoluteTolerance) {
        this.absoluteTolerance = absoluteTolerance;
        return this;
    }

    public double getInitialGamma() {
        return initialGamma;
    }

    public double getInitialDelta() {
        return initialDelta;
    }

    public double getInitialAlpha() {
        return initialAlpha;
    }

    /// Sets the point the first simplex run starts from.
    /// @param gamma initial gamma, positive
    /// @param delta initial delta, positive
    /// @param alpha initial alpha, ignored by base-model fits
    /// @return this config
    public FitterConfig withInitialPoint(double gamma, double delta, double alpha) {
        this.initialGamma = gamma;
        this.initialDelta = delta;
        this.initialAlpha = alpha;
        return this;
    }

    public double getShapeStep() {
        return shapeStep;
    }

    public FitterConfig withShapeStep(double shapeStep) {
        this.shapeStep = shapeStep;
        return this;
    }

    public double getAlphaStep() {
        return alphaStep;
    }

    public FitterConfig withAlphaStep(double alphaStep) {
        this.alphaStep = alphaStep;
        return this;
    }

    public int getRestarts() {
        return restarts;
    }

    public FitterConfig withRestarts(int restarts) {
        this.restarts = restarts;
        return this;
    }

    public double getRestartSpread() {
        return restartSpread;
    }

    public FitterConfig withRestartSpread(double restartSpread) {
        this.restartSpread = restartSpread;
        return this;
    }

    public long getSeed() {
        return seed;
    }

    public FitterConfig withSeed(long seed) {
        this.seed = seed;
        return this;
    }

    /// Checks that all settings are usable.
    /// @return this config
    /// @throws IllegalArgumentException naming the first invalid setting
    public FitterConfig validate() {
        if (maxEvaluations < 1) {
            throw new IllegalArgumentException("max_evaluations must be positive, got: " + maxEvaluations);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("max_iterations must be positive, got: " + maxIterations);
        }
        if (!(relativeTolerance > 0) && !(absoluteTolerance > 0)) {
            throw new IllegalArgumentException("at least one of relative_tolerance and absolute_tolerance must be positive");
        }
        if (!(initialGamma > 0) || !(initialDelta > 0) || !Double.isFinite(initialAlpha)) {
            throw new IllegalArgumentException("initial point must have positive gamma and delta and finite alpha, got: "
                + initialGamma + ", " + initialDelta + ", " + initialAlpha);
        }
        if (!(shapeStep > 0) || !(alphaStep > 0)) {
            throw new IllegalArgumentException("simplex steps must be positive, got: " + shapeStep + ", " + alphaStep);
        }
        if (restarts < 0) {
            throw new IllegalArgumentException("restarts cannot be negative, got: " + restarts);
        }
        if (!(restartSpread >= 1.0)) {
            throw new IllegalArgumentException("restart_spread must be at least 1, got: " + restartSpread);
        }
        return this;
    }

    /// Loads a config from JSON.
    public static FitterConfig fromJson(String json) {
        return parsed(RetentionGsonConfig.gson().fromJson(json, FitterConfig.class));
    }

    /// Loads a config from a Reader providing JSON.
    public static FitterConfig fromJson(Reader reader) {
        return parsed(RetentionGsonConfig.gson().fromJson(reader, FitterConfig.class));
    }

    /// Loads a config from a JSON file.
    public static FitterConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    private static FitterConfig parsed(FitterConfig config) {
        if (config == null) {
            throw new JsonParseException("fitter config is empty");
        }
        return config.validate();
    }

    /// @return an independent copy of this configuration
    public FitterConfig copy() {
        return RetentionGsonConfig.gson().fromJson(toJson(), FitterConfig.class);
    }

    /// Serializes this configuration to JSON.
    public String toJson() {
        return RetentionGsonConfig.gson().toJson(this);
    }

    /// Writes this configuration as JSON to a Writer.
    public void toJson(Writer writer) {
        RetentionGsonConfig.gson().toJson(this, writer);
    }

    /// Saves this configuration to a JSON file.
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return toJson();
    }
}
