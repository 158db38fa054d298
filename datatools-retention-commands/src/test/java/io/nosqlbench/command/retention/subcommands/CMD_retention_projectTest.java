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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.command.retention.CMD_retention;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CMD_retention_project}.
 */
@Tag("unit")
class CMD_retention_projectTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = CMD_retention.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void testTextOutput() {
        int exitCode = run("project", "--initial", "1000", "--gamma", "1", "--delta", "1", "--horizon", "3");

        assertEquals(0, exitCode, err.toString());
        String text = out.toString();
        assertThat(text).contains("Model: BASE (bg)");
        assertThat(text).contains("Period");
        assertThat(text).contains("Remaining");
        // gamma = delta = 1 leaves 1000 / (t + 1) after period t
        assertThat(text).contains("500");
        assertThat(text).contains("250");
    }

    @Test
    void testJsonOutput() {
        int exitCode = run("project", "--initial", "600", "--gamma", "1", "--delta", "1",
            "--horizon", "5", "--format", "json");

        assertEquals(0, exitCode, err.toString());
        JsonObject forecast = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertEquals(600.0, forecast.get("initial_population").getAsDouble());
        JsonArray remaining = forecast.getAsJsonArray("remaining");
        assertEquals(5, remaining.size());
        for (int t = 1; t <= 5; t++) {
            assertEquals(600.0 / (t + 1), remaining.get(t - 1).getAsDouble(), 1e-9);
        }
        assertEquals(0.0, forecast.getAsJsonObject("parameters").get("alpha").getAsDouble());
    }

    @Test
    void testExtendedModel() {
        int exitCode = run("project", "--initial", "1000", "--gamma", "0.7", "--delta", "2.5",
            "--alpha=-10", "--horizon", "4", "--format", "json");

        assertEquals(0, exitCode, err.toString());
        JsonArray remaining = JsonParser.parseString(out.toString()).getAsJsonObject().getAsJsonArray("remaining");
        for (int i = 0; i < remaining.size(); i++) {
            assertEquals(1000.0, remaining.get(i).getAsDouble());
        }
    }

    @Test
    void testInfeasibleParametersAreRejected() {
        int exitCode = run("project", "--initial", "1000", "--gamma=-1", "--delta", "1", "--horizon", "3");

        assertEquals(2, exitCode);
        assertThat(err.toString()).contains("Error:");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testInvalidHorizonIsRejected() {
        assertEquals(2, run("project", "--initial", "1000", "--gamma", "1", "--delta", "1", "--horizon", "0"));
    }

    @Test
    void testMissingRequiredOptionIsAUsageError() {
        assertEquals(2, run("project", "--initial", "1000", "--gamma", "1", "--delta", "1"));
        assertThat(err.toString()).contains("--horizon");
    }
}
