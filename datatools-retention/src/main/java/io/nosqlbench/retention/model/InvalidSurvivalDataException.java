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

/// Thrown when a raw sequence of per-period survivor counts cannot be shaped
/// into a [SurvivalTable].
///
/// Raised eagerly at construction time, so a table that exists is always valid.
public class InvalidSurvivalDataException extends IllegalArgumentException {

    /// Creates an exception with the given message
    /// @param message
    ///     a description of what was wrong with the counts
    public InvalidSurvivalDataException(String message) {
        super(message);
    }
}
