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

import java.util.List;

import static org.streamfold.eventstore.api.ExpectedStreamVersion.exactly;

/**
 * An interface that should be implemented by event stores that supports appending events to an event stream.
 * <p>
 * The event store is the only party that assigns versions. The events are given the versions
 * {@code current + 1, current + 2, ...} in the order they are supplied, and the check of the {@link ExpectedStreamVersion}
 * together with the append is atomic with respect to other appends to the same stream. Two concurrent appends that expect
 * the same version can thus never both succeed.
 * </p>
 * <p>
 * Note that the event store never retries a failed append. Re-reading the stream, recomputing the events and appending again
 * when a {@link ConflictException} is thrown is up to the caller, for example an application service.
 * </p>
 *
 * @param <ID> The type of the stream id
 * @param <E>  The type of the events
 */
public interface AppendToEventStream<ID, E> {

    /**
     * Conditionally append events to an event stream. The stream is created if it doesn't exist.
     * Appending an empty list of events writes nothing, but the condition is still evaluated.
     *
     * @param streamId        The id of the stream
     * @param expectedVersion The condition that must be fulfilled for the events to be written
     * @param events          The events to be appended to the stream
     * @return The version of the stream after the append, i.e. the version of the last appended event.
     * @throws ConflictException When the {@code expectedVersion} was not fulfilled, in which case nothing is written
     * @throws AppendException   When the events couldn't be written for other reasons
     */
    Version append(ID streamId, ExpectedStreamVersion expectedVersion, List<? extends E> events);

    /**
     * A convenience function that appends events to a stream if the stream version is equal to {@code expectedVersion}.
     *
     * @see #append(Object, ExpectedStreamVersion, List)
     */
    default Version append(ID streamId, long expectedVersion, List<? extends E> events) {
        return append(streamId, exactly(expectedVersion), events);
    }

    /**
     * Unconditionally append events to a stream.
     *
     * @see #append(Object, ExpectedStreamVersion, List)
     */
    default Version append(ID streamId, List<? extends E> events) {
        return append(streamId, ExpectedStreamVersion.any(), events);
    }
}
