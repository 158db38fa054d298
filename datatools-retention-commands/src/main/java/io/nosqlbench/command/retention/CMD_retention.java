package io.nosqlbench.command.retention;

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

import io.nosqlbench.command.retention.subcommands.CMD_retention_fit;
import io.nosqlbench.command.retention.subcommands.CMD_retention_project;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The retention command fits Beta-Geometric churn models to cohort survival
/// counts and projects survivors forward.
///
/// This is an umbrella command for the `fit` and `project` subcommands.
@CommandLine.Command(name = "retention",
    header = "Fit and project cohort retention with the Beta-Geometric model",
    description = "Contains subcommands to fit churn models to survival counts and to forecast survivors",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: success",
        "1: fit did not converge within its budget",
        "2: invalid input or error"
    },
    subcommands = {
        CMD_retention_fit.class,
        CMD_retention_project.class,
        CommandLine.HelpCommand.class
    })
public class CMD_retention implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_retention.class);

    /// Run CMD_retention
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return a command line for this command, configured as `main` runs it
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_retention())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        logger.debug("no subcommand given, printing usage");
        CommandLine.usage(this, System.out);
        return RetentionCliSupport.EXIT_SUCCESS;
    }
}
