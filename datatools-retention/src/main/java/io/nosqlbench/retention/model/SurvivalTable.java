package io.nosqlbench.retention.model;

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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Observed attrition history of a single cohort.
///
/// Built once from an ordered sequence of per-period survivor counts whose
/// first element is the initial cohort size:
///
/// ```java
/// SurvivalTable table = SurvivalTable.of(1000, 800, 275, 250, 220);
/// table.periodCount();      // 4
/// table.lost(2);            // 525
/// table.isFinalPeriod(4);   // true
/// ```
///
/// The last period is the right-censoring boundary: customers remaining there
/// are known only to have survived at least that long.
///
/// ## Validation
///
/// Construction fails with [InvalidSurvivalDataException] when
///
/// - the sequence has fewer than two elements,
/// - any value is negative, NaN or infinite,
/// - a count increases from one period to the next (churn is irreversible in
///   this model, so an increase can only be a data error), or
/// - the initial population is zero, since an empty cohort carries no
///   information for a fit.
public final class SurvivalTable implements RetentionCurve {

    private final double[] counts;

    private SurvivalTable(double[] counts) {
        this.counts = counts;
    }

    /// Creates a table from raw per-period counts.
    /// @param counts
    ///     remaining customers for periods `0..N`, `N >= 1`
    /// @return the validated table
    /// @throws InvalidSurvivalDataException if the counts are not a valid survival sequence
    public static SurvivalTable of(double... counts) {
        Objects.requireNonNull(counts, "counts cannot be null");
        double[] copy = counts.clone();
        validate(copy);
        return new SurvivalTable(copy);
    }

    /// Creates a table from raw per-period counts.
    /// @param counts
    ///     remaining customers for periods `0..N`, `N >= 1`
    /// @return the validated table
    /// @throws InvalidSurvivalDataException if the counts are not a valid survival sequence
    public static SurvivalTable of(List<? extends Number> counts) {
        Objects.requireNonNull(counts, "counts cannot be null");
        double[] values = new double[counts.size()];
        for (int i = 0; i < values.length; i++) {
            Number n = counts.get(i);
            if (n == null) {
                throw new InvalidSurvivalDataException("count at period " + i + " is null");
            }
            values[i] = n.doubleValue();
        }
        validate(values);
        return new SurvivalTable(values);
    }

    /// Creates a table from an initial population and a following series,
    /// such as the remaining series of a [ForecastTable].
    /// @param initialPopulation the period-0 count
    /// @param remaining counts for periods `1..N`
    /// @return the validated table
    public static SurvivalTable of(double initialPopulation, double[] remaining) {
        Objects.requireNonNull(remaining, "remaining cannot be null");
        double[] values = new double[remaining.length + 1];
        values[0] = initialPopulation;
        System.arraycopy(remaining, 0, values, 1, remaining.length);
        validate(values);
        return new SurvivalTable(values);
    }

    private static void validate(double[] counts) {
        if (counts.length < 2) {
            throw new InvalidSurvivalDataException(
                "a survival sequence needs the initial population and at least one period, got "
                    + counts.length + " value(s)");
        }
        for (int i = 0; i < counts.length; i++) {
            if (!Double.isFinite(counts[i])) {
                throw new InvalidSurvivalDataException("count at period " + i + " is not finite: " + counts[i]);
            }
            if (counts[i] < 0) {
                throw new InvalidSurvivalDataException("count at period " + i + " is negative: " + counts[i]);
            }
            if (i > 0 && counts[i] > counts[i - 1]) {
                throw new InvalidSurvivalDataException(
                    "counts must be non-increasing, but period " + i + " has " + counts[i]
                        + " after " + counts[i - 1]);
            }
        }
        if (counts[0] == 0) {
            throw new InvalidSurvivalDataException("initial population must be positive");
        }
    }

    @Override
    public double initialPopulation() {
        return counts[0];
    }

    @Override
    public int periodCount() {
        return counts.length - 1;
    }

    @Override
    public double remaining(int period) {
        checkPeriod(period);
        return counts[period];
    }

    @Override
    public double lost(int period) {
        checkPeriod(period);
        return counts[period - 1] - counts[period];
    }

    /// @param period a period in `1..periodCount()`
    /// @return true only for the last observed period
    public boolean isFinalPeriod(int period) {
        checkPeriod(period);
        return period == periodCount();
    }

    /// @return the final observed period, which is also the period count
    public int finalPeriod() {
        return periodCount();
    }

    /// @return the flags of [#isFinalPeriod(int)] for periods `1..N`
    public boolean[] finalPeriodFlags() {
        boolean[] flags = new boolean[periodCount()];
        flags[flags.length - 1] = true;
        return flags;
    }

    /// @return the raw counts for periods `0..N`, as accepted by [#of(double...)]
    public double[] toCounts() {
        return counts.clone();
    }

    private void checkPeriod(int period) {
        if (period < 1 || period > periodCount()) {
            throw new IndexOutOfBoundsException(
                "period " + period + " is outside 1.." + periodCount());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SurvivalTable)) return false;
        return Arrays.equals(counts, ((SurvivalTable) o).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return "SurvivalTable{counts=" + Arrays.toString(counts) + "}";
    }
}
