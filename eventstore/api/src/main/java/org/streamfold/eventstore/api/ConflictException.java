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

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The {@link ExpectedStreamVersion} was not fulfilled so events have not been written to the event store.
 * In a typical scenario, if an application reads and writes stream A from two different places at the same time,
 * this is effectively the same as an optimistic locking exception and a retry (read the stream again, recompute the
 * events and append them with the new version) is appropriate.
 * <p>
 * The event store never retries on its own, retrying is up to the caller.
 * </p>
 */
public class ConflictException extends AppendException {
    private final ConflictError conflict;

    public ConflictException(String eventStreamId, ConflictError conflict) {
        super(eventStreamId, String.format("%s was not fulfilled for event stream %s. Expected version %s but was %s.",
                ExpectedStreamVersion.class.getSimpleName(), eventStreamId, requireNonNull(conflict, ConflictError.class.getSimpleName() + " cannot be null").expected(), conflict.actual()));
        this.conflict = conflict;
    }

    public ConflictError conflict() {
        return conflict;
    }

    public Version expected() {
        return conflict.expected();
    }

    public Version actual() {
        return conflict.actual();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConflictException that)) return false;
        return Objects.equals(eventStreamId, that.eventStreamId) && Objects.equals(conflict, that.conflict);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventStreamId, conflict);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ConflictException.class.getSimpleName() + "[", "]")
                .add("eventStreamId='" + eventStreamId + "'")
                .add("expected=" + conflict.expected())
                .add("actual=" + conflict.actual())
                .toString();
    }
}
