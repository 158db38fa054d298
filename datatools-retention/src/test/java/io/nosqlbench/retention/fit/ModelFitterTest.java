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
import io.nosqlbench.retention.model.ForecastTable;
import io.nosqlbench.retention.model.ModelParameters;
import io.nosqlbench.retention.model.SurvivalTable;
import io.nosqlbench.retention.project.Projector;
import io.nosqlbench.retention.trace.FitObserver;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ModelFitterTest {

    private static final SurvivalTable REFERENCE = SurvivalTable.of(1000, 800, 275, 250, 220);

    @Test
    void testReferenceCohortBaseFit() {
        FitResult result = new ModelFitter().fit(REFERENCE, false);

        assertTrue(result.converged(), "base fit should converge: " + result);
        assertEquals(ChurnModel.BASE, result.model());
        ModelParameters parameters = result.parameters();
        assertTrue(parameters.gamma() > 0);
        assertTrue(parameters.delta() > 0);
        assertEquals(0.0, parameters.alpha());

        // maximum near gamma = 11.24, delta = 21.39, NLL = 1482.4655
        assertThat(parameters.gamma()).isCloseTo(11.24, within(1.0));
        assertThat(parameters.delta()).isCloseTo(21.39, within(2.0));
        assertThat(result.objective()).isCloseTo(1482.4655, within(5e-3));

        ForecastTable forecast = new Projector().project(1000, parameters, 1);
        assertThat(forecast.remaining(1)).isLessThanOrEqualTo(1000.0);
    }

    @Test
    void testObjectiveMatchesLikelihoodEngine() {
        FitResult result = new ModelFitter().fit(REFERENCE, ChurnModel.BASE);
        double recomputed = new LikelihoodEngine().negativeLogLikelihood(result.parameters(), REFERENCE);
        assertEquals(recomputed, result.objective(), 1e-12);
        assertEquals(-result.objective(), result.logLikelihood());
        assertEquals(4 + 2 * result.objective(), result.aic(), 1e-9);
        assertEquals(2 * Math.log(1000) + 2 * result.objective(), result.bic(), 1e-9);
    }

    @Test
    void testBaseRoundTrip() {
        ModelParameters truth = ModelParameters.base(0.7, 2.5);
        ForecastTable generated = new Projector().project(10_000, truth, 12);
        SurvivalTable table = SurvivalTable.of(10_000, generated.remainingSeries());

        FitResult result = new ModelFitter().fit(table, false);

        assertTrue(result.converged());
        assertThat(result.parameters().gamma()).isCloseTo(0.7, within(0.05));
        assertThat(result.parameters().delta()).isCloseTo(2.5, within(0.15));
    }

    @Test
    void testExtendedRoundTrip() {
        ModelParameters truth = ModelParameters.extended(0.7, 2.5, -0.05);
        ForecastTable generated = new Projector().project(10_000, truth, 12);
        SurvivalTable table = SurvivalTable.of(10_000, generated.remainingSeries());

        FitterConfig config = FitterConfig.defaults().withRestarts(3);
        FitResult result = new ModelFitter(config).fit(table, true);

        assertTrue(result.converged());
        assertEquals(ChurnModel.EXTENDED, result.model());
        assertThat(result.parameters().gamma()).isCloseTo(0.7, within(0.1));
        assertThat(result.parameters().delta()).isCloseTo(2.5, within(0.4));
        assertThat(result.parameters().alpha()).isCloseTo(-0.05, within(0.01));
    }

    @Test
    void testExtendedFitIsNoWorseThanBase() {
        ModelParameters truth = ModelParameters.extended(1.2, 4.0, 0.04);
        ForecastTable generated = new Projector().project(5_000, truth, 10);
        SurvivalTable table = SurvivalTable.of(5_000, generated.remainingSeries());

        FitResult base = new ModelFitter().fit(table, false);
        FitResult extended = new ModelFitter(FitterConfig.defaults().withRestarts(2)).fit(table, true);

        assertThat(extended.objective()).isLessThanOrEqualTo(base.objective() + 1e-6);
    }

    @Test
    void testExhaustedBudgetIsReportedNotThrown() {
        FitterConfig config = FitterConfig.defaults().withMaxEvaluations(5);
        FitResult result = assertDoesNotThrow(() -> new ModelFitter(config).fit(REFERENCE, false));

        assertFalse(result.converged());
        assertTrue(result.parameters().isFeasible());
        assertTrue(Double.isFinite(result.objective()));
        assertTrue(result.objective() < LikelihoodEngine.INFEASIBLE_PENALTY);
        assertThat(result.evaluations()).isLessThanOrEqualTo(6);
    }

    @Test
    void testIterationBudget() {
        FitterConfig config = FitterConfig.defaults().withMaxIterations(3);
        FitResult result = new ModelFitter(config).fit(REFERENCE, true);
        assertFalse(result.converged());
        assertEquals(1, result.starts().size());
        assertTrue(result.parameters().isFeasible());
    }

    @Test
    void testRestartsAreRecordedAndReproducible() {
        FitterConfig config = FitterConfig.defaults().withRestarts(4).withSeed(7L);
        FitResult first = new ModelFitter(config).fit(REFERENCE, false);
        FitResult second = new ModelFitter(config).fit(REFERENCE, false);

        assertEquals(5, first.starts().size());
        assertEquals(ModelParameters.base(1.0, 1.0), first.starts().get(0).start());
        assertEquals(first.parameters(), second.parameters());
        assertEquals(first.objective(), second.objective());

        double bestOfStarts = first.starts().stream()
            .mapToDouble(FitResult.StartOutcome::objective).min().orElseThrow();
        assertEquals(bestOfStarts, first.objective());
        int totalEvaluations = first.starts().stream().mapToInt(FitResult.StartOutcome::evaluations).sum();
        assertEquals(totalEvaluations, first.evaluations());
    }

    @Test
    void testCustomInitialPoint() {
        FitterConfig config = FitterConfig.defaults().withInitialPoint(5.0, 10.0, 0.0);
        FitResult result = new ModelFitter(config).fit(REFERENCE, false);
        assertEquals(ModelParameters.base(5.0, 10.0), result.starts().get(0).start());
        assertTrue(result.converged());
        assertThat(result.parameters().gamma()).isCloseTo(11.24, within(1.0));
    }

    @Test
    void testObserverCallbacks() {
        List<String> events = new ArrayList<>();
        int[] evaluations = {0};
        FitObserver observer = new FitObserver() {
            @Override
            public void onFitStart(ChurnModel model, int periods, int starts) {
                events.add("start:" + model + ":" + periods + ":" + starts);
            }

            @Override
            public void onEvaluation(int start, ModelParameters parameters, double objective) {
                evaluations[0]++;
            }

            @Override
            public void onStartComplete(int start, FitResult.StartOutcome outcome) {
                events.add("run:" + start);
            }

            @Override
            public void onFitComplete(FitResult result) {
                events.add("complete:" + result.converged());
            }
        };

        FitResult result = new ModelFitter(FitterConfig.defaults().withRestarts(1), observer)
            .fit(REFERENCE, ChurnModel.BASE);

        assertEquals(List.of("start:BASE:4:2", "run:0", "run:1", "complete:" + result.converged()), events);
        assertEquals(result.evaluations(), evaluations[0]);
    }

    @Test
    void testConfigChangesAfterConstructionAreIgnored() {
        FitterConfig config = FitterConfig.defaults();
        ModelFitter fitter = new ModelFitter(config);
        config.withMaxEvaluations(0).withRestarts(-3);

        FitResult result = assertDoesNotThrow(() -> fitter.fit(REFERENCE, false));
        assertTrue(result.converged());
        assertEquals(1, result.starts().size());
        assertEquals(20_000, fitter.getConfig().getMaxEvaluations());

        fitter.getConfig().withMaxIterations(0);
        assertEquals(10_000, fitter.getConfig().getMaxIterations());
    }

    @Test
    void testInvalidConfigIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new ModelFitter(FitterConfig.defaults().withInitialPoint(0.0, 1.0, 0.0)));
        assertThrows(IllegalArgumentException.class,
            () -> new ModelFitter(FitterConfig.defaults().withRestarts(-1)));
        assertThrows(NullPointerException.class, () -> new ModelFitter().fit(null, false));
    }
}
