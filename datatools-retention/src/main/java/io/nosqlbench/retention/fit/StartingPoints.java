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

import io.nosqlbench.retention.model.ChurnModel;
import io.nosqlbench.retention.model.ModelParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/// Starting points for the simplex runs of a fit.
///
/// The first point is always the configured initial point. Each restart draws
/// `gamma` and `delta` log-uniformly within a factor of `restart_spread` of the
/// initial values, and `alpha` uniformly within `± alpha_step * restart_spread`.
/// Draws come from a [Random] seeded from the config, so a fit is reproducible.
final class StartingPoints {

    private StartingPoints() {
    }

    static List<ModelParameters> generate(FitterConfig config, ChurnModel model) {
        List<ModelParameters> points = new ArrayList<>(config.getRestarts() + 1);
        double alpha0 = model == ChurnModel.EXTENDED ? config.getInitialAlpha() : 0.0;
        points.add(new ModelParameters(config.getInitialGamma(), config.getInitialDelta(), alpha0));

        Random random = new Random(config.getSeed());
        double logSpread = Math.log(config.getRestartSpread());
        double alphaRange = config.getAlphaStep() * config.getRestartSpread();
        for (int i = 0; i < config.getRestarts(); i++) {
            double gamma = config.getInitialGamma() * Math.exp(logSpread * (2.0 * random.nextDouble() - 1.0));
            double delta = config.getInitialDelta() * Math.exp(logSpread * (2.0 * random.nextDouble() - 1.0));
            double alpha = model == ChurnModel.EXTENDED
                ? alpha0 + alphaRange * (2.0 * random.nextDouble() - 1.0)
                : 0.0;
            points.add(new ModelParameters(gamma, delta, alpha));
        }
        return points;
    }
}
