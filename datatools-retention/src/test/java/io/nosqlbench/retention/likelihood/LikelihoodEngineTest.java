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

import io.nosqlbench.retention.model.ChurnModel;
import io.nosqlbench.retention.model.ModelParameters;
import io.nosqlbench.retention.model.SurvivalTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class LikelihoodEngineTest {

    private static final SurvivalTable REFERENCE = SurvivalTable.of(1000, 800, 275, 250, 220);

    private final LikelihoodEngine engine = new LikelihoodEngine();

    @Test
    void testUniformPriorClosedForm() {
        // gamma = delta = 1: P(churn in t) = 1 / (t (t + 1)), P(alive after T) = 1 / (T + 1)
        double expected = 200 * Math.log(2) + 525 * Math.log(6) + 25 * Math.log(12)
            + 30 * Math.log(20) + 220 * Math.log(5);
        assertEquals(expected, engine.base(1.0, 1.0, REFERENCE), 1e-9);
        assertEquals(expected, engine.extended(1.0, 1.0, 0.0, REFERENCE), 1e-9);
    }

    @Test
    void testExtendedReducesToBaseAtZeroAlpha() {
        double[] gammas = {0.05, 0.1, 0.5, 1.0, 3.7, 25.0, 140.0};
        double[] deltas = {0.2, 1.0, 4.2, 60.0, 900.0};
        for (double gamma : gammas) {
            for (double delta : deltas) {
                double base = engine.base(gamma, delta, REFERENCE);
                double extended = engine.extended(gamma, delta, 0.0, REFERENCE);
                assertEquals(base, extended, 1e-9 * Math.max(1.0, Math.abs(base)),
                    "gamma=" + gamma + ", delta=" + delta);
            }
        }
    }

    @Test
    void testReductionOnRandomTables() {
        Random random = new Random(12345);
        for (int trial = 0; trial < 25; trial++) {
            int periods = 2 + random.nextInt(20);
            double[] counts = new double[periods + 1];
            counts[0] = 100 + random.nextInt(100_000);
            for (int t = 1; t <= periods; t++) {
                counts[t] = Math.floor(counts[t - 1] * (0.5 + 0.5 * random.nextDouble()));
            }
            SurvivalTable table = SurvivalTable.of(counts);
            double gamma = Math.exp(4 * random.nextDouble() - 2);
            double delta = Math.exp(4 * random.nextDouble() - 2);

            double base = engine.base(gamma, delta, table);
            double extended = engine.extended(gamma, delta, 0.0, table);
            assertTrue(Double.isFinite(base));
            assertEquals(base, extended, 1e-9 * Math.max(1.0, Math.abs(base)),
                "trial " + trial + " gamma=" + gamma + ", delta=" + delta);
        }
    }

    @Test
    void testContinuousAroundZeroAlpha() {
        // tiny alpha takes the Beta-difference path for every period
        double[][] cases = {{0.5, 4.2}, {1.0, 1.0}, {3.7, 60.0}, {11.0, 21.0}};
        for (double[] c : cases) {
            double base = engine.base(c[0], c[1], REFERENCE);
            assertEquals(base, engine.extended(c[0], c[1], 1e-9, REFERENCE), 1e-6 * base);
            assertEquals(base, engine.extended(c[0], c[1], -1e-9, REFERENCE), 1e-6 * base);
        }
    }

    @Test
    void testDispatchByParameters() {
        ModelParameters base = ModelParameters.base(0.8, 3.0);
        ModelParameters extended = ModelParameters.extended(0.8, 3.0, -0.05);

        assertEquals(engine.base(0.8, 3.0, REFERENCE), engine.negativeLogLikelihood(base, REFERENCE));
        assertEquals(engine.extended(0.8, 3.0, -0.05, REFERENCE), engine.negativeLogLikelihood(extended, REFERENCE));
        // an explicit BASE variant ignores alpha
        assertEquals(engine.base(0.8, 3.0, REFERENCE),
            engine.negativeLogLikelihood(ChurnModel.BASE, extended, REFERENCE));
    }

    @Test
    void testAlphaChangesTheObjective() {
        double base = engine.base(0.8, 3.0, REFERENCE);
        assertNotEquals(base, engine.extended(0.8, 3.0, 0.1, REFERENCE));
        assertNotEquals(base, engine.extended(0.8, 3.0, -0.1, REFERENCE));
    }

    @Test
    void testNegativeGammaReturnsPenalty() {
        double value = assertDoesNotThrow(() -> engine.base(-1.0, 1.0, REFERENCE));
        assertEquals(LikelihoodEngine.INFEASIBLE_PENALTY, value);
        assertTrue(Double.isFinite(value));
        assertEquals(LikelihoodEngine.INFEASIBLE_PENALTY, engine.extended(-1.0, 1.0, 0.2, REFERENCE));
    }

    @Test
    void testOtherInfeasibleProposalsReturnPenalty() {
        assertEquals(LikelihoodEngine.INFEASIBLE_PENALTY, engine.base(1.0, 0.0, REFERENCE));
        assertEquals(LikelihoodEngine.INFEASIBLE_PENALTY, engine.base(0.0, 1.0, REFERENCE));
        assertEquals(LikelihoodEngine.INFEASIBLE_PENALTY, engine.base(Double.NaN, 1.0, REFERENCE));
        assertEquals(LikelihoodEngine.INFEASIBLE_PENALTY, engine.extended(1.0, 1.0, Double.NaN, REFERENCE));
        assertEquals(LikelihoodEngine.INFEASIBLE_PENALTY,
            engine.extended(1.0, Double.POSITIVE_INFINITY, 0.0, REFERENCE));
    }

    @Test
    void testObservedChurnInClampedPeriodIsImpossible() {
        // with alpha = -10 nobody can churn, yet the table shows churn
        assertEquals(LikelihoodEngine.INFEASIBLE_PENALTY, engine.extended(1.0, 1.0, -10.0, REFERENCE));
    }

    @Test
    void testClampedPeriodsWithoutChurnAreFinite() {
        // 1 - 0.5 t clamps from period 2; churn only happens in period 1
        SurvivalTable table = SurvivalTable.of(1000, 700, 700, 700);
        double value = engine.extended(1.0, 2.0, -0.5, table);
        assertTrue(Double.isFinite(value));
        assertTrue(value < LikelihoodEngine.INFEASIBLE_PENALTY);
    }

    @Test
    void testLargeParametersAndLongHorizonStayFinite() {
        double[] counts = new double[241];
        counts[0] = 1_000_000;
        for (int t = 1; t < counts.length; t++) {
            counts[t] = Math.floor(counts[t - 1] * 0.99);
        }
        SurvivalTable table = SurvivalTable.of(counts);
        double base = engine.base(5_000, 400_000, table);
        double extended = engine.extended(5_000, 400_000, 0.01, table);
        assertTrue(Double.isFinite(base));
        assertTrue(base < LikelihoodEngine.INFEASIBLE_PENALTY);
        assertTrue(Double.isFinite(extended));
        assertTrue(extended < LikelihoodEngine.INFEASIBLE_PENALTY);
    }

    @Test
    void testBetterParametersScoreLower() {
        // the base-model optimum for the reference cohort is near (11.2, 21.4)
        double nearOptimum = engine.base(11.24, 21.39, REFERENCE);
        assertTrue(nearOptimum < engine.base(1.0, 1.0, REFERENCE));
        assertTrue(nearOptimum < engine.base(50.0, 10.0, REFERENCE));
        assertEquals(1482.4655, nearOptimum, 1e-3);
    }
}
