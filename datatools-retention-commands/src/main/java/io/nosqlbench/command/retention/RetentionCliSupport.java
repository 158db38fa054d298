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

import io.nosqlbench.retention.config.RetentionGsonConfig;
import io.nosqlbench.retention.model.ModelParameters;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;

/// Utilities shared across the retention subcommands.
public final class RetentionCliSupport {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_NOT_CONVERGED = 1;
    public static final int EXIT_ERROR = 2;

    /// Output formats accepted by `--format`.
    public enum OutputFormat {
        text,
        json
    }

    private RetentionCliSupport() {
    }

    /// Log the invocation at debug level without polluting stdout.
    public static void logInvocation(CommandLine.Model.CommandSpec spec, Logger logger) {
        CommandLine.ParseResult parseResult = spec.commandLine().getParseResult();
        if (parseResult != null) {
            logger.debug("retention invocation: {}", parseResult.originalArgs());
        }
    }

    /// Writes a value as pretty-printed JSON followed by a newline.
    public static void writeJson(PrintWriter out, Object value) {
        out.println(RetentionGsonConfig.gson().toJson(value));
        out.flush();
    }

    /// Prints the fitted or supplied parameters one per line.
    public static void printParameters(PrintWriter out, ModelParameters parameters) {
        out.printf("  gamma: %.6f%n", parameters.gamma());
        out.printf("  delta: %.6f%n", parameters.delta());
        if (parameters.alpha() != 0.0) {
            out.printf("  alpha: %.6f%n", parameters.alpha());
        }
        out.printf("  mean churn probability: %.6f%n", parameters.meanChurnProbability());
    }
}
