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

import io.nosqlbench.retention.fit.FitResult;
import io.nosqlbench.retention.model.ChurnModel;
import io.nosqlbench.retention.model.ModelParameters;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/// FitObserver that writes NDJSON (newline-delimited JSON) trace files.
///
/// ## Output Format
///
/// ```json
/// {"event":"fit_start","model":"EXTENDED","periods":12,"starts":4}
/// {"event":"evaluation","start":0,"parameters":{"gamma":1.0,"delta":1.0,"alpha":0.0},"objective":5512.3}
/// {"event":"start_complete","start":0,"outcome":{...}}
/// {"event":"fit_complete","result":{...}}
/// ```
///
/// Evaluation events can be numerous; set `includeEvaluations` to false to
/// record only run boundaries.
public final class NdjsonFitTraceObserver implements FitObserver, Closeable {

    private final BufferedWriter writer;
    private final boolean includeEvaluations;
    private final boolean ownsWriter;
    private final Object writeLock = new Object();

    /// Creates an NDJSON trace observer that writes every event to a file.
    ///
    /// @param outputPath path to write trace output
    /// @throws IOException if the file cannot be opened for writing
    public NdjsonFitTraceObserver(Path outputPath) throws IOException {
        this(outputPath, true);
    }

    /// Creates an NDJSON trace observer that writes to a file.
    ///
    /// @param outputPath path to write trace output
    /// @param includeEvaluations whether to write one line per objective evaluation
    /// @throws IOException if the file cannot be opened for writing
    public NdjsonFitTraceObserver(Path outputPath, boolean includeEvaluations) throws IOException {
        this.writer = Files.newBufferedWriter(outputPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
        this.includeEvaluations = includeEvaluations;
        this.ownsWriter = true;
    }

    /// Creates an NDJSON trace observer that writes to a Writer.
    ///
    /// The caller retains ownership of `writer`: [#close()] flushes it but
    /// leaves it open.
    ///
    /// @param writer the writer to use
    /// @param includeEvaluations whether to write one line per objective evaluation
    public NdjsonFitTraceObserver(Writer writer, boolean includeEvaluations) {
        this.writer = (writer instanceof BufferedWriter)
            ? (BufferedWriter) writer
            : new BufferedWriter(writer);
        this.includeEvaluations = includeEvaluations;
        this.ownsWriter = false;
    }

    @Override
    public void onFitStart(ChurnModel model, int periods, int starts) {
        Map<String, Object> event = event("fit_start");
        event.put("model", model);
        event.put("periods", periods);
        event.put("starts", starts);
        writeEvent(event);
    }

    @Override
    public void onEvaluation(int start, ModelParameters parameters, double objective) {
        if (!includeEvaluations) {
            return;
        }
        Map<String, Object> event = event("evaluation");
        event.put("start", start);
        event.put("parameters", parameters);
        event.put("objective", objective);
        writeEvent(event);
    }

    @Override
    public void onStartComplete(int start, FitResult.StartOutcome outcome) {
        Map<String, Object> event = event("start_complete");
        event.put("start", start);
        event.put("outcome", outcome);
        writeEvent(event);
    }

    @Override
    public void onFitComplete(FitResult result) {
        Map<String, Object> event = event("fit_complete");
        event.put("result", result);
        writeEvent(event);
    }

    private static Map<String, Object> event(String name) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", name);
        return event;
    }

    private void writeEvent(Map<String, Object> event) {
        synchronized (writeLock) {
            try {
                writer.write(FitObserver.toCompactJson(event));
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write fit trace event", e);
            }
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (writeLock) {
            if (ownsWriter) {
                writer.close();
            } else {
                writer.flush();
            }
        }
    }
}
