package io.nosqlbench.command.retention.subcommands;

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
import io.nosqlbench.command.retention.RetentionCliSupport;
import io.nosqlbench.command.retention.RetentionCliSupport.OutputFormat;
import io.nosqlbench.command.retention.RetentionTableFormatter;
import io.nosqlbench.retention.fit.FitResult;
import io.nosqlbench.retention.fit.FitterConfig;
import io.nosqlbench.retention.fit.ModelFitter;
import io.nosqlbench.retention.model.ForecastTable;
import io.nosqlbench.retention.model.InvalidSurvivalDataException;
import io.nosqlbench.retention.model.SurvivalTable;
import io.nosqlbench.retention.project.Projector;
import io.nosqlbench.retention.trace.NdjsonFitTraceObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Fit a Beta-Geometric churn model to a cohort's survival counts.
///
/// The counts are given inline, period 0 first:
///
/// ```
/// retention fit 1000 800 275 250 220 --horizon 12
/// ```
///
/// The last observed period is treated as censored: customers still present
/// there contribute only their probability of having survived so far.
@CommandLine.Command(name = "fit",
    header = "Fit a churn model to cohort survival counts",
    description = "Estimates gamma and delta (and alpha with --extended) by maximum likelihood, "
        + "optionally projecting survivors over a horizon with the fitted parameters.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: fit converged",
        "1: fit did not converge within its budget",
        "2: invalid input or error"
    })
public class CMD_retention_fit implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_retention_fit.class);

    @CommandLine.Parameters(arity = "2..*", paramLabel = "COUNT",
        description = "Survivors at period 0, 1, 2, ... (non-increasing, period 0 positive)")
    private List<Double> counts;

    @CommandLine.Option(names = {"--extended", "-x"},
        description = "Fit the extended model with the alpha drift parameter")
    private boolean extended = false;

    @CommandLine.Option(names = {"--horizon", "-H"},
        description = "Project survivors this many periods past period 0 with the fitted parameters")
    private Integer horizon;

    @CommandLine.Option(names = {"--restarts", "-r"},
        description = "Additional simplex runs from spread starting points (overrides the config file)")
    private Integer restarts;

    @CommandLine.Option(names = {"--config", "-c"},
        description = "JSON fitter config file")
    private Path configPath;

    @CommandLine.Option(names = {"--trace"},
        description = "Write an NDJSON trace of the fit to this file")
    private Path tracePath;

    @CommandLine.Option(names = {"--format", "-f"}, defaultValue = "text",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format = OutputFormat.text;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        RetentionCliSupport.logInvocation(spec, logger);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            SurvivalTable table = SurvivalTable.of(counts);
            if (horizon != null && horizon < 1) {
                throw new IllegalArgumentException("horizon must be at least 1, got: " + horizon);
            }
            FitterConfig config = loadConfig();
            FitResult result = fit(table, config);
            ForecastTable forecast = horizon == null
                ? null
                : new Projector().project(table, result.parameters(), horizon);

            if (format == OutputFormat.json) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("observed", table.toCounts());
                payload.put("fit", result);
                if (forecast != null) {
                    payload.put("forecast", forecast);
                }
                RetentionCliSupport.writeJson(out, payload);
            } else {
                printText(out, table, result, forecast);
            }

            if (!result.converged()) {
                err.println("Warning: fit did not converge within " + config.getMaxEvaluations()
                    + " evaluations / " + config.getMaxIterations() + " iterations; reporting the best point found");
                return RetentionCliSupport.EXIT_NOT_CONVERGED;
            }
            return RetentionCliSupport.EXIT_SUCCESS;
        } catch (InvalidSurvivalDataException e) {
            err.println("Invalid survival counts: " + e.getMessage());
            return RetentionCliSupport.EXIT_ERROR;
        } catch (IOException | UncheckedIOException | JsonParseException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            logger.debug("fit failed", e);
            return RetentionCliSupport.EXIT_ERROR;
        }
    }

    private FitterConfig loadConfig() throws IOException {
        FitterConfig config = configPath != null ? FitterConfig.load(configPath) : FitterConfig.defaults();
        if (restarts != null) {
            config.withRestarts(restarts);
        }
        return config;
    }

    private FitResult fit(SurvivalTable table, FitterConfig config) throws IOException {
        if (tracePath == null) {
            return new ModelFitter(config).fit(table, extended);
        }
        try (NdjsonFitTraceObserver observer = new NdjsonFitTraceObserver(tracePath)) {
            FitResult result = new ModelFitter(config, observer).fit(table, extended);
            logger.info("Wrote fit trace to {}", tracePath);
            return result;
        }
    }

    private static void printText(PrintWriter out, SurvivalTable table, FitResult result, ForecastTable forecast) {
        out.println("Observed:");
        out.print(RetentionTableFormatter.forCurve(table).format());
        out.println();

        out.printf("Model: %s (%s)%n", result.model(), result.model().getModelType());
        out.printf("Converged: %s%n", result.converged());
        RetentionCliSupport.printParameters(out, result.parameters());
        out.printf("  negative log-likelihood: %.6f%n", result.objective());
        out.printf("  AIC: %.4f  BIC: %.4f%n", result.aic(), result.bic());
        out.printf("  evaluations: %d%n", result.evaluations());

        if (result.starts().size() > 1) {
            out.println();
            out.printf("Starts (%d converged of %d, * = selected, ! = not converged):%n",
                result.convergedStarts(), result.starts().size());
            out.print(RetentionTableFormatter.forStarts(result).format());
        }

        if (forecast != null) {
            out.println();
            out.printf("Forecast (%d periods):%n", forecast.horizon());
            out.print(RetentionTableFormatter.forCurve(forecast).format());
        }
        out.flush();
    }
}
