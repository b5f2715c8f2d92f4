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

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * An event that has been written to an event stream. Instances are created by the event store when events are appended
 * and are never changed afterwards.
 *
 * @param streamId The id of the stream that the event belongs to
 * @param version  The version assigned to the event by the event store
 * @param event    The event as it was appended
 * @param <ID>     The type of the stream id
 * @param <E>      The type of the event
 */
@NullMarked
public record Persisted<ID, E>(ID streamId, Version version, E event) {

    public Persisted {
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(version, Version.class.getSimpleName() + " cannot be null");
        requireNonNull(event, "Event cannot be null");
        if (version.isZero()) {
            throw new IllegalArgumentException("A persisted event cannot have version " + Version.ZERO);
        }
    }

    /**
     * @return A new {@code Persisted} with the same stream id and version but with the event converted by {@code fn}.
     */
    public <E2> Persisted<ID, E2> map(Function<? super E, ? extends E2> fn) {
        requireNonNull(fn, "Mapping function cannot be null");
        return new Persisted<>(streamId, version, fn.apply(event));
    }
}
