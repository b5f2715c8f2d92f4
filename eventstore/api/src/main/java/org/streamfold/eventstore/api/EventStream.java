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

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Represents the events of an event stream as they were when the stream was read.
 *
 * @param <ID> The type of the stream id
 * @param <E>  The type of the events
 */
@SuppressWarnings("NullableProblems")
public interface EventStream<ID, E> extends Iterable<Persisted<ID, E>> {

    /**
     * @return The id of the event stream
     */
    ID id();

    /**
     * The version of the event stream when it was read. It is equal to {@link Version#ZERO} if event stream is empty.
     * Note that the version is the version of the whole stream, regardless of which events that were selected by the read.
     * Use it as the expected version when appending events that were computed from this stream.
     *
     * @return The version of the event stream at the time of the read
     * @see #isEmpty()
     */
    Version version();

    /**
     * The selected events in ascending version order. Every invocation returns a new {@link Stream} over the same events.
     *
     * @return The events as a {@link Stream}.
     */
    Stream<Persisted<ID, E>> events();

    @Override
    default Iterator<Persisted<ID, E>> iterator() {
        return events().iterator();
    }

    /**
     * @return {@code true} if event stream is empty, {@code false} otherwise.
     */
    default boolean isEmpty() {
        return version().isZero();
    }

    /**
     * @return The selected events in this stream as a list
     */
    default List<Persisted<ID, E>> eventList() {
        return events().collect(Collectors.toList());
    }

    /**
     * @return The selected events, without stream id and version, as a {@link Stream}.
     */
    default Stream<E> rawEvents() {
        return events().map(Persisted::event);
    }

    /**
     * Apply a mapping function to the events of the {@link EventStream}
     *
     * @param fn   The function to apply for each event.
     * @param <E2> The return type
     * @return A new {@link EventStream} where events are converted to {@code E2}.
     */
    default <E2> EventStream<ID, E2> map(Function<? super E, ? extends E2> fn) {
        return new EventStream<>() {

            @Override
            public ID id() {
                return EventStream.this.id();
            }

            @Override
            public Version version() {
                return EventStream.this.version();
            }

            @Override
            public Stream<Persisted<ID, E2>> events() {
                return EventStream.this.events().map(persisted -> persisted.<E2>map(fn));
            }

            @Override
            public String toString() {
                return "EventStream{" +
                        "id='" + id() + '\'' +
                        ", version=" + version() +
                        '}';
            }
        };
    }
}
