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

/**
 * The position of an event in its event stream. Versions are assigned by the event store when events are appended,
 * the first event in a stream gets version {@code 1}. A stream that doesn't exist (or is empty) has version {@link #ZERO}.
 *
 * @param value The version number, never negative.
 */
@NullMarked
public record Version(long value) implements Comparable<Version> {

    /**
     * The version of a stream that has no events.
     */
    public static final Version ZERO = new Version(0);

    public Version {
        if (value < 0) {
            throw new IllegalArgumentException("Version cannot be negative, was " + value);
        }
    }

    public static Version of(long value) {
        return value == 0 ? ZERO : new Version(value);
    }

    /**
     * @return The version that directly follows this version
     */
    public Version next() {
        return new Version(Math.addExact(value, 1));
    }

    /**
     * @return {@code true} if this is {@link #ZERO}, i.e. the stream has no events.
     */
    public boolean isZero() {
        return value == 0;
    }

    public boolean isGreaterThan(Version other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Version other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
