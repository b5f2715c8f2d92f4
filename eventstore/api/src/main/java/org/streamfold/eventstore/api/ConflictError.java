/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.streamfold.eventstore.api;

import org.jspecify.annotations.NullMarked;

import static java.util.Objects.requireNonNull;

/**
 * Describes why an {@link ExpectedStreamVersion#exactly(Version) exact version} condition was not fulfilled.
 *
 * @param expected The version the caller expected the stream to have
 * @param actual   The version the stream actually had when the append was attempted
 */
@NullMarked
public record ConflictError(Version expected, Version actual) {

    public ConflictError {
        requireNonNull(expected, "Expected version cannot be null");
        requireNonNull(actual, "Actual version cannot be null");
    }

    public static ConflictError of(long expected, long actual) {
        return new ConflictError(Version.of(expected), Version.of(actual));
    }
}
