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

import io.nosqlbench.retention.likelihood.LikelihoodEngine;
import io.nosqlbench.retention.model.ChurnModel;
import io.nosqlbench.retention.model.ModelParameters;
import io.nosqlbench.retention.model.SurvivalTable;
import io.nosqlbench.retention.trace.FitObserver;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Maximum-likelihood estimation of Beta-Geometric parameters.
///
/// ## Algorithm
///
/// <ol>
///   <li>Start a Nelder-Mead simplex at `gamma = 1, delta = 1` (plus `alpha = 0`
///       for the extended model), or at the configured initial point</li>
///   <li>Minimize the [LikelihoodEngine] negative log-likelihood until the
///       simplex values stop changing or the evaluation / iteration budget runs out</li>
///   <li>Repeat from each extra starting point when restarts are configured</li>
///   <li>Keep the run with the lowest objective</li>
/// </ol>
///
/// Infeasible proposals (`gamma <= 0`, `delta <= 0`) score the likelihood
/// penalty, which pushes the simplex back into the feasible region.
///
/// ## Caveats
///
/// The objective is not convex in `(gamma, delta, alpha)` and a simplex can
/// report convergence on a plateau. Inspect [FitResult#converged()] and, for
/// extended fits, prefer several restarts. A run that exhausts its budget is
/// reported with `converged == false` and the best point it evaluated.
///
/// ```java
/// FitResult result = new ModelFitter().fit(SurvivalTable.of(1000, 800, 275, 250, 220), false);
/// if (result.converged()) {
///     ForecastTable forecast = new Projector().project(1000, result.parameters(), 12);
/// }
/// ```
public final class ModelFitter {

    private static final Logger logger = LogManager.getLogger(ModelFitter.class);

    private final FitterConfig config;
    private final LikelihoodEngine engine;
    private final FitObserver observer;

    /// Creates a fitter with default settings.
    public ModelFitter() {
        this(FitterConfig.defaults());
    }

    /// Creates a fitter with the given settings.
    ///
    /// The settings are copied; later changes to `config` do not affect this fitter.
    ///
    /// @param config fitter settings
    public ModelFitter(FitterConfig config) {
        this(config, FitObserver.NOOP);
    }

    /// Creates a fitter that reports progress to an observer.
    ///
    /// @param config fitter settings
    /// @param observer receives fit progress callbacks
    public ModelFitter(FitterConfig config, FitObserver observer) {
        this(config, new LikelihoodEngine(), observer);
    }

    /// Creates a fitter with an explicit likelihood engine.
    ///
    /// @param config fitter settings
    /// @param engine the objective to minimize
    /// @param observer receives fit progress callbacks
    public ModelFitter(FitterConfig config, LikelihoodEngine engine, FitObserver observer) {
        this.config = Objects.requireNonNull(config, "config cannot be null").copy().validate();
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
    }

    /// @return a copy of the settings of this fitter
    public FitterConfig getConfig() {
        return config.copy();
    }

    /// Fits the base or extended model.
    ///
    /// @param table the observed data
    /// @param extended whether to estimate the alpha term
    /// @return the best fit found
    public FitResult fit(SurvivalTable table, boolean extended) {
        return fit(table, ChurnModel.of(extended));
    }

    /// Fits the given model variant.
    ///
    /// @param table the observed data
    /// @param model the variant to fit
    /// @return the best fit found
    public FitResult fit(SurvivalTable table, ChurnModel model) {
        Objects.requireNonNull(table, "table cannot be null");
        Objects.requireNonNull(model, "model cannot be null");

        List<ModelParameters> startingPoints = StartingPoints.generate(config, model);
        observer.onFitStart(model, table.periodCount(), startingPoints.size());
        logger.debug("Fitting {} model to {} periods from {} starting point(s)",
            model, table.periodCount(), startingPoints.size());

        List<FitResult.StartOutcome> outcomes = new ArrayList<>(startingPoints.size());
        FitResult.StartOutcome best = null;
        int evaluations = 0;
        for (int i = 0; i < startingPoints.size(); i++) {
            FitResult.StartOutcome outcome = runSimplex(table, model, startingPoints.get(i), i);
            observer.onStartComplete(i, outcome);
            outcomes.add(outcome);
            evaluations += outcome.evaluations();
            if (best == null || isBetter(outcome, best)) {
                best = outcome;
            }
        }

        FitResult result = new FitResult(best.parameters(), model, best.converged(), best.objective(),
            evaluations, table.initialPopulation(), outcomes);
        if (result.converged()) {
            logger.info("Fitted {} model: {} (NLL={}, {} evaluations, {}/{} starts converged)",
                model, result.parameters(), result.objective(), evaluations,
                result.convergedStarts(), outcomes.size());
        } else {
            logger.warn("{} model fit did not converge; best estimate {} (NLL={}, {} evaluations)",
                model, result.parameters(), result.objective(), evaluations);
        }
        observer.onFitComplete(result);
        return result;
    }

    // converged runs beat non-converged ones at equal objective
    private static boolean isBetter(FitResult.StartOutcome candidate, FitResult.StartOutcome incumbent) {
        if (candidate.objective() < incumbent.objective()) {
            return true;
        }
        return candidate.objective() == incumbent.objective() && candidate.converged() && !incumbent.converged();
    }

    private FitResult.StartOutcome runSimplex(SurvivalTable table, ChurnModel model, ModelParameters start, int index) {
        TrackingObjective objective = new TrackingObjective(table, model, index);
        SimplexOptimizer optimizer = new SimplexOptimizer(
            new SimpleValueChecker(config.getRelativeTolerance(), config.getAbsoluteTolerance()));

        boolean converged;
        try {
            optimizer.optimize(
                new MaxEval(config.getMaxEvaluations()),
                new MaxIter(config.getMaxIterations()),
                new ObjectiveFunction(objective),
                GoalType.MINIMIZE,
                new InitialGuess(start.toPoint(model)),
                new NelderMeadSimplex(steps(model)));
            converged = true;
        } catch (MaxCountExceededException e) {
            logger.debug("Simplex run {} stopped at its budget: {}", index, e.getMessage());
            converged = false;
        }

        ModelParameters reached = objective.bestParameters();
        double value = objective.bestValue();
        if (reached == null || !reached.isFeasible() || value >= LikelihoodEngine.INFEASIBLE_PENALTY) {
            converged = false;
            if (reached == null) {
                reached = start;
                value = LikelihoodEngine.INFEASIBLE_PENALTY;
            }
        }
        return new FitResult.StartOutcome(start, reached, value, converged,
            objective.evaluations(), optimizer.getIterations());
    }

    private double[] steps(ChurnModel model) {
        return model == ChurnModel.EXTENDED
            ? new double[]{config.getShapeStep(), config.getShapeStep(), config.getAlphaStep()}
            : new double[]{config.getShapeStep(), config.getShapeStep()};
    }

    /// Objective wrapper that remembers the best point evaluated, so a run cut
    /// short by its budget still yields an estimate.
    private final class TrackingObjective implements MultivariateFunction {
        private final SurvivalTable table;
        private final ChurnModel model;
        private final int start;
        private ModelParameters bestParameters;
        private double bestValue = Double.POSITIVE_INFINITY;
        private int evaluations;

        private TrackingObjective(SurvivalTable table, ChurnModel model, int start) {
            this.table = table;
            this.model = model;
            this.start = start;
        }

        @Override
        public double value(double[] point) {
            ModelParameters parameters = ModelParameters.fromPoint(point);
            double value = engine.negativeLogLikelihood(model, parameters, table);
            evaluations++;
            if (value < bestValue) {
                bestValue = value;
                bestParameters = parameters;
            }
            observer.onEvaluation(start, parameters, value);
            return value;
        }

        ModelParameters bestParameters() {
            return bestParameters;
        }

        double bestValue() {
            return bestValue;
        }

        int evaluations() {
            return evaluations;
        }
    }
}
