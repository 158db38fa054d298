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

import io.nosqlbench.command.retention.RetentionCliSupport;
import io.nosqlbench.command.retention.RetentionCliSupport.OutputFormat;
import io.nosqlbench.command.retention.RetentionTableFormatter;
import io.nosqlbench.retention.model.ForecastTable;
import io.nosqlbench.retention.model.ModelParameters;
import io.nosqlbench.retention.project.Projector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// Project expected survivors of a cohort from known model parameters.
@CommandLine.Command(name = "project",
    header = "Forecast survivors from model parameters",
    description = "Computes expected survivors for periods 1..horizon of a cohort of the given initial size.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: success",
        "2: invalid input or error"
    })
public class CMD_retention_project implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_retention_project.class);

    @CommandLine.Option(names = {"--initial", "-n"}, required = true,
        description = "Cohort size at period 0")
    private double initialPopulation;

    @CommandLine.Option(names = {"--gamma", "-g"}, required = true,
        description = "First Beta shape parameter (positive)")
    private double gamma;

    @CommandLine.Option(names = {"--delta", "-d"}, required = true,
        description = "Second Beta shape parameter (positive)")
    private double delta;

    @CommandLine.Option(names = {"--alpha", "-a"}, defaultValue = "0",
        description = "Churn exponent drift; 0 selects the base model (default: ${DEFAULT-VALUE})")
    private double alpha;

    @CommandLine.Option(names = {"--horizon", "-H"}, required = true,
        description = "Number of periods to project")
    private int horizon;

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

        ModelParameters parameters = ModelParameters.extended(gamma, delta, alpha);
        try {
            ForecastTable forecast = new Projector().project(initialPopulation, parameters, horizon);
            if (format == OutputFormat.json) {
                RetentionCliSupport.writeJson(out, forecast);
            } else {
                out.printf("Model: %s (%s)%n", parameters.model(), parameters.model().getModelType());
                RetentionCliSupport.printParameters(out, parameters);
                out.println();
                out.print(RetentionTableFormatter.forCurve(forecast).format());
                out.flush();
            }
            return RetentionCliSupport.EXIT_SUCCESS;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            logger.debug("projection failed", e);
            return RetentionCliSupport.EXIT_ERROR;
        }
    }
}
