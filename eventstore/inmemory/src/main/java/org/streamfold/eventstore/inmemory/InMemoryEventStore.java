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

package org.streamfold.eventstore.inmemory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamfold.eventstore.api.ConflictException;
import org.streamfold.eventstore.api.EventStore;
import org.streamfold.eventstore.api.EventStream;
import org.streamfold.eventstore.api.ExpectedStreamVersion;
import org.streamfold.eventstore.api.Persisted;
import org.streamfold.eventstore.api.Version;
import org.streamfold.eventstore.api.VersionSelect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventStore} that keeps all event streams in memory. Useful for tests and for applications that don't need
 * durability.
 * <p>
 * Appends to the same stream are serialized, appends to different streams are not. A read never blocks and returns the
 * events that were appended when the read took place.
 * </p>
 *
 * @param <ID> The type of the stream id
 * @param <E>  The type of the events
 */
public class InMemoryEventStore<ID, E> implements EventStore<ID, E> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, List<Persisted<ID, E>>> state = new ConcurrentHashMap<>();
    private final InMemoryEventStoreConfig<ID> config;

    public InMemoryEventStore() {
        this(InMemoryEventStoreConfig.defaults());
    }

    public InMemoryEventStore(InMemoryEventStoreConfig<ID> config) {
        this.config = requireNonNull(config, InMemoryEventStoreConfig.class.getSimpleName() + " cannot be null");
    }

    @Override
    public EventStream<ID, E> read(ID streamId, VersionSelect select) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(select, VersionSelect.class.getSimpleName() + " cannot be null");
        List<Persisted<ID, E>> events = state.getOrDefault(streamKey(streamId), Collections.emptyList());
        return new EventStreamImpl<>(streamId, events, select);
    }

    @Override
    public Version append(ID streamId, ExpectedStreamVersion expectedVersion, List<? extends E> events) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(expectedVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        requireTrue(events.stream().allMatch(Objects::nonNull), "Events cannot contain null");

        String streamKey = streamKey(streamId);
        AtomicReference<Version> newVersion = new AtomicReference<>();
        state.compute(streamKey, (__, currentEvents) -> {
            Version currentVersion = currentEvents == null ? Version.ZERO : Version.of(currentEvents.size());
            expectedVersion.check(currentVersion).ifPresent(conflict -> {
                log.debug("Rejecting append of {} event(s) to event stream {}: expected version {} but was {}", events.size(), streamKey, conflict.expected(), conflict.actual());
                throw new ConflictException(streamKey, conflict);
            });

            if (events.isEmpty()) {
                newVersion.set(currentVersion);
                return currentEvents;
            }

            List<Persisted<ID, E>> newEvents = new ArrayList<>(currentEvents == null ? events.size() : currentEvents.size() + events.size());
            if (currentEvents != null) {
                newEvents.addAll(currentEvents);
            }
            Version version = currentVersion;
            for (E event : events) {
                version = version.next();
                newEvents.add(new Persisted<>(streamId, version, event));
            }
            newVersion.set(version);
            return Collections.unmodifiableList(newEvents);
        });

        Version version = newVersion.get();
        log.debug("Appended {} event(s) to event stream {}, version is now {}", events.size(), streamKey, version);
        return version;
    }

    @Override
    public boolean exists(ID streamId) {
        requireNonNull(streamId, "Stream id cannot be null");
        return state.containsKey(streamKey(streamId));
    }

    private String streamKey(ID streamId) {
        String streamKey = config.streamKey.apply(streamId);
        if (streamKey == null) {
            throw new IllegalArgumentException("Stream key function returned null for stream id " + streamId);
        }
        return streamKey;
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }

    private static class EventStreamImpl<ID, E> implements EventStream<ID, E> {
        private final ID streamId;
        private final List<Persisted<ID, E>> events;
        private final VersionSelect select;

        EventStreamImpl(ID streamId, List<Persisted<ID, E>> events, VersionSelect select) {
            this.streamId = streamId;
            this.events = events;
            this.select = select;
        }

        @Override
        public ID id() {
            return streamId;
        }

        @Override
        public Version version() {
            return Version.of(events.size());
        }

        @Override
        public Stream<Persisted<ID, E>> events() {
            return events.stream().filter(persisted -> select.includes(persisted.version()));
        }

        @Override
        public String toString() {
            return "EventStreamImpl{" +
                    "streamId='" + streamId + '\'' +
                    ", version=" + version() +
                    ", select=" + select +
                    '}';
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof EventStreamImpl)) return false;
            EventStreamImpl<?, ?> that = (EventStreamImpl<?, ?>) o;
            return Objects.equals(streamId, that.streamId) &&
                    Objects.equals(events, that.events) &&
                    Objects.equals(select, that.select);
        }

        @Override
        public int hashCode() {
            return Objects.hash(streamId, events, select);
        }
    }
}
