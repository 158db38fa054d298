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

import io.nosqlbench.retention.fit.FitResult;
import io.nosqlbench.retention.model.RetentionCurve;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats retention curves and fit runs as aligned ASCII tables.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * RetentionTableFormatter formatter = new RetentionTableFormatter("Period", List.of("Remaining", "Lost"));
 * formatter.addRow("1", new double[]{800, 200}, false);
 * String table = formatter.format();
 * }</pre>
 *
 * <p>A row may be marked, which appends an asterisk to each of its values.
 */
public final class RetentionTableFormatter {

    private static final String NA = "N/A";
    private static final int MIN_VALUE_WIDTH = 9;

    private final String labelHeader;
    private final List<String> columnHeaders;
    private final List<RowData> rows;

    /**
     * Creates a formatter with a label column and the given value columns.
     *
     * @param labelHeader header of the leftmost column
     * @param columnHeaders headers of the value columns
     */
    public RetentionTableFormatter(String labelHeader, List<String> columnHeaders) {
        this.labelHeader = labelHeader;
        this.columnHeaders = new ArrayList<>(columnHeaders);
        this.rows = new ArrayList<>();
    }

    /**
     * Builds a per-period table of a retention curve: remaining, lost and
     * period-over-period retention rate, starting with the period 0 row.
     *
     * @param curve observed or projected curve
     * @return a populated formatter
     */
    public static RetentionTableFormatter forCurve(RetentionCurve curve) {
        RetentionTableFormatter formatter =
            new RetentionTableFormatter("Period", List.of("Remaining", "Lost", "Retention"));
        formatter.addRow("0", new double[]{curve.initialPopulation(), Double.NaN, Double.NaN}, false);
        for (int t = 1; t <= curve.periodCount(); t++) {
            formatter.addRow(String.valueOf(t),
                new double[]{curve.remaining(t), curve.lost(t), curve.retentionRate(t)}, false);
        }
        return formatter;
    }

    /**
     * Builds a table with one row per simplex run, marking the runs whose
     * objective equals the selected fit.
     *
     * @param result a completed fit
     * @return a populated formatter
     */
    public static RetentionTableFormatter forStarts(FitResult result) {
        RetentionTableFormatter formatter =
            new RetentionTableFormatter("Start", List.of("Gamma", "Delta", "Alpha", "NLL", "Evals"));
        List<FitResult.StartOutcome> starts = result.starts();
        for (int i = 0; i < starts.size(); i++) {
            FitResult.StartOutcome outcome = starts.get(i);
            formatter.addRow(i + (outcome.converged() ? "" : "!"),
                new double[]{
                    outcome.parameters().gamma(),
                    outcome.parameters().delta(),
                    outcome.parameters().alpha(),
                    outcome.objective(),
                    outcome.evaluations()
                },
                outcome.objective() == result.objective());
        }
        return formatter;
    }

    /**
     * Adds a row of values.
     *
     * @param label text for the label column
     * @param values one value per column
     * @param marked whether to mark this row
     */
    public void addRow(String label, double[] values, boolean marked) {
        if (values.length != columnHeaders.size()) {
            throw new IllegalArgumentException(
                "Value count (" + values.length + ") must match column count (" + columnHeaders.size() + ")");
        }
        rows.add(new RowData(label, values.clone(), marked));
    }

    /**
     * Formats the table as an aligned string.
     *
     * @return formatted table string
     */
    public String format() {
        if (rows.isEmpty()) {
            return "No data\n";
        }

        int[] colWidths = computeColumnWidths();
        int labelWidth = computeLabelWidth();

        StringBuilder sb = new StringBuilder();
        appendHeader(sb, labelWidth, colWidths);
        appendSeparator(sb, labelWidth, colWidths);
        appendDataRows(sb, labelWidth, colWidths);

        return sb.toString();
    }

    /**
     * Formats a value to an exact width, reserving the last character for the
     * row marker.
     *
     * @param value the value
     * @param width the target width
     * @param marked true to append the marker
     * @return formatted value of exact width
     */
    static String formatValue(double value, int width, boolean marked) {
        String marker = marked ? "*" : " ";
        int valueWidth = width - 1;

        String valueStr;
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            valueStr = NA;
        } else if (value == Math.rint(value) && Math.abs(value) < 1e9) {
            valueStr = String.format("%.0f", value);
        } else if (Math.abs(value) >= 1e6 || Math.abs(value) < 1e-3) {
            valueStr = String.format("%.2e", value);
        } else if (Math.abs(value) >= 100) {
            valueStr = String.format("%.2f", value);
        } else {
            valueStr = String.format("%.4f", value);
        }

        if (valueStr.length() > valueWidth) {
            valueStr = valueStr.substring(0, valueWidth);
        } else if (valueStr.length() < valueWidth) {
            valueStr = pad(valueStr, valueWidth, true);
        }

        return valueStr + marker;
    }

    static String pad(String s, int width, boolean rightAlign) {
        if (s.length() >= width) {
            return s;
        }
        int padding = width - s.length();
        if (rightAlign) {
            return " ".repeat(padding) + s;
        } else {
            return s + " ".repeat(padding);
        }
    }

    static String centerPad(String s, int width) {
        if (s.length() >= width) {
            return s;
        }
        int padding = width - s.length();
        int left = padding / 2;
        int right = padding - left;
        return " ".repeat(left) + s + " ".repeat(right);
    }

    private int[] computeColumnWidths() {
        int[] widths = new int[columnHeaders.size()];
        for (int i = 0; i < columnHeaders.size(); i++) {
            widths[i] = Math.max(columnHeaders.get(i).length() + 1, MIN_VALUE_WIDTH);
        }
        return widths;
    }

    private int computeLabelWidth() {
        int width = labelHeader.length();
        for (RowData row : rows) {
            width = Math.max(width, row.label.length());
        }
        return width;
    }

    private void appendHeader(StringBuilder sb, int labelWidth, int[] colWidths) {
        sb.append(pad(labelHeader, labelWidth, true));
        for (int i = 0; i < columnHeaders.size(); i++) {
            sb.append(" | ").append(centerPad(columnHeaders.get(i), colWidths[i]));
        }
        sb.append("\n");
    }

    private void appendSeparator(StringBuilder sb, int labelWidth, int[] colWidths) {
        sb.append("-".repeat(labelWidth));
        for (int colWidth : colWidths) {
            sb.append("-+-").append("-".repeat(colWidth));
        }
        sb.append("\n");
    }

    private void appendDataRows(StringBuilder sb, int labelWidth, int[] colWidths) {
        for (RowData row : rows) {
            sb.append(pad(row.label, labelWidth, true));
            for (int i = 0; i < row.values.length; i++) {
                sb.append(" | ").append(formatValue(row.values[i], colWidths[i], row.marked));
            }
            sb.append("\n");
        }
    }

    private record RowData(String label, double[] values, boolean marked) {}
}
