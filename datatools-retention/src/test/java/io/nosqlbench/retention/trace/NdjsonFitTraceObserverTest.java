package io.nosqlbench.retention.trace;

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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.retention.fit.FitResult;
import io.nosqlbench.retention.fit.FitterConfig;
import io.nosqlbench.retention.fit.ModelFitter;
import io.nosqlbench.retention.model.ChurnModel;
import io.nosqlbench.retention.model.SurvivalTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class NdjsonFitTraceObserverTest {

    private static final SurvivalTable TABLE = SurvivalTable.of(1000, 800, 275, 250, 220);

    @TempDir
    Path tempDir;

    @Test
    void testRunBoundariesOnly() {
        StringWriter out = new StringWriter();
        NdjsonFitTraceObserver observer = new NdjsonFitTraceObserver(out, false);

        new ModelFitter(FitterConfig.defaults().withRestarts(1), observer).fit(TABLE, false);

        List<String> lines = out.toString().lines().toList();
        assertEquals(4, lines.size(), out.toString());
        assertEquals("fit_start", event(lines.get(0)));
        assertEquals("start_complete", event(lines.get(1)));
        assertEquals("start_complete", event(lines.get(2)));
        assertEquals("fit_complete", event(lines.get(3)));

        JsonObject start = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertEquals("BASE", start.get("model").getAsString());
        assertEquals(4, start.get("periods").getAsInt());
        assertEquals(2, start.get("starts").getAsInt());

        JsonObject complete = JsonParser.parseString(lines.get(3)).getAsJsonObject();
        JsonObject parameters = complete.getAsJsonObject("result").getAsJsonObject("parameters");
        assertTrue(parameters.get("gamma").getAsDouble() > 0);
        assertTrue(parameters.get("delta").getAsDouble() > 0);
    }

    @Test
    void testEvaluationsToFile() throws IOException {
        Path trace = tempDir.resolve("fit.ndjson");
        FitResult result;
        try (NdjsonFitTraceObserver observer = new NdjsonFitTraceObserver(trace)) {
            result = new ModelFitter(FitterConfig.defaults(), observer).fit(TABLE, true);
        }

        List<String> lines = Files.readAllLines(trace);
        long evaluations = lines.stream().filter(line -> event(line).equals("evaluation")).count();
        assertEquals(result.evaluations(), evaluations);
        assertThat(lines.get(lines.size() - 1)).contains("\"fit_complete\"");
    }

    @Test
    void testSuppliedWriterStaysOpen() throws IOException {
        boolean[] closed = {false};
        StringWriter out = new StringWriter() {
            @Override
            public void close() throws IOException {
                closed[0] = true;
                super.close();
            }
        };

        NdjsonFitTraceObserver observer = new NdjsonFitTraceObserver(out, false);
        observer.onFitStart(ChurnModel.BASE, 4, 1);
        observer.close();

        assertFalse(closed[0]);
        assertThat(out.toString()).contains("\"fit_start\"");
    }

    private static String event(String line) {
        return JsonParser.parseString(line).getAsJsonObject().get("event").getAsString();
    }
}
