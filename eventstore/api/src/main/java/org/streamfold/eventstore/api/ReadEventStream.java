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

/**
 * An interface that should be implemented by event stores that supports reading an {@link EventStream}.
 *
 * @param <ID> The type of the stream id
 * @param <E>  The type of the events
 */
public interface ReadEventStream<ID, E> {

    /**
     * Read all events from a particular event stream
     *
     * @param streamId The id of the stream to read.
     * @return An {@link EventStream} containing the events of the stream. Will return an {@link EventStream} with version {@code 0} if event stream doesn't exists.
     * @throws StreamReadException If the stream could not be read
     */
    default EventStream<ID, E> read(ID streamId) {
        return read(streamId, VersionSelect.all());
    }

    /**
     * Read the events selected by {@code select} from a particular event stream, in ascending version order.
     * The returned {@link EventStream} is a snapshot: events appended after this method returns are not part of it.
     * A stream that doesn't exist is not an error, it's read as an empty {@link EventStream} with version {@code 0}.
     *
     * @param streamId The id of the stream to read.
     * @param select   Which events to read
     * @return An {@link EventStream} containing the selected events of the stream.
     * @throws StreamReadException If the stream could not be read
     */
    EventStream<ID, E> read(ID streamId, VersionSelect select);
}
