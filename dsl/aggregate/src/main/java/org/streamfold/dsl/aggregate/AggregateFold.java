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

package org.streamfold.dsl.aggregate;

import org.streamfold.eventstore.api.EventStream;
import org.streamfold.eventstore.api.Persisted;
import org.streamfold.eventstore.api.ReadEventStream;
import org.streamfold.eventstore.api.Version;

import java.util.Iterator;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.streamfold.eventstore.api.VersionSelect.from;

/**
 * Derives the state of an {@link Aggregate} from events, without the aggregate having to know about the event store.
 * <p>
 * Events are applied in the order they are given. The first exception thrown by {@link Aggregate#apply(Object, Object)}
 * stops the fold and is rethrown unchanged, events after the failing one are never consumed.
 * </p>
 */
public final class AggregateFold {

    private AggregateFold() {
    }

    public static <S, E> S fold(Aggregate<S, ? super E> aggregate, S initialState, Stream<? extends E> events) {
        requireNonNull(events, "Events cannot be null");
        return fold(aggregate, initialState, events.iterator());
    }

    public static <S, E> S fold(Aggregate<S, ? super E> aggregate, S initialState, Iterable<? extends E> events) {
        requireNonNull(events, "Events cannot be null");
        return fold(aggregate, initialState, events.iterator());
    }

    /**
     * Fold persisted events onto {@code versionedState}, keeping track of the version of the last applied event.
     *
     * @return The new state together with the version of the last applied event, or {@code versionedState} if there were no events.
     */
    public static <S, E> VersionedState<S> foldPersisted(Aggregate<S, ? super E> aggregate, VersionedState<S> versionedState, Stream<? extends Persisted<?, ? extends E>> events) {
        requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
        requireNonNull(versionedState, VersionedState.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        S state = versionedState.state();
        Version version = versionedState.version();
        Iterator<? extends Persisted<?, ? extends E>> iterator = events.iterator();
        while (iterator.hasNext()) {
            Persisted<?, ? extends E> persisted = iterator.next();
            state = aggregate.apply(state, persisted.event());
            version = persisted.version();
        }
        return new VersionedState<>(state, version);
    }

    /**
     * Read the whole event stream of {@code streamId} and fold it from the {@link Aggregate#initialState() initial state}.
     *
     * @return The current state of the aggregate together with the version of the stream that was read. Use the version
     * as expected version when appending the events of the next decision.
     */
    public static <ID, S, E> VersionedState<S> load(ReadEventStream<ID, E> eventStore, Aggregate<S, ? super E> aggregate, ID streamId) {
        requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
        return loadFrom(eventStore, aggregate, streamId, VersionedState.initial(aggregate));
    }

    /**
     * Bring a snapshot up to date by reading only the events that were appended after the snapshot was taken.
     * The result is the same as if the whole stream was folded with {@link #load(ReadEventStream, Aggregate, Object)}.
     *
     * @param snapshot A state previously derived from the same stream, for example by {@link #load(ReadEventStream, Aggregate, Object)}.
     * @return The current state of the aggregate together with the version of the stream that was read.
     * @throws IllegalStateException If the snapshot is of a later version than the event stream.
     */
    public static <ID, S, E> VersionedState<S> loadFrom(ReadEventStream<ID, E> eventStore, Aggregate<S, ? super E> aggregate, ID streamId, VersionedState<S> snapshot) {
        requireNonNull(eventStore, "Event store cannot be null");
        requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(snapshot, "Snapshot cannot be null");

        EventStream<ID, E> eventStream = eventStore.read(streamId, from(snapshot.version().next()));
        if (snapshot.version().isGreaterThan(eventStream.version())) {
            throw new IllegalStateException(String.format("Snapshot of event stream %s is at version %s but the event stream is at version %s", streamId, snapshot.version(), eventStream.version()));
        }
        S state = fold(aggregate, snapshot.state(), eventStream.rawEvents());
        return new VersionedState<>(state, eventStream.version());
    }

    private static <S, E> S fold(Aggregate<S, ? super E> aggregate, S initialState, Iterator<? extends E> events) {
        requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
        S state = initialState;
        while (events.hasNext()) {
            state = aggregate.apply(state, events.next());
        }
        return state;
    }
}
