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

package org.streamfold.application.service.generic;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamfold.application.service.ApplicationService;
import org.streamfold.dsl.aggregate.Aggregate;
import org.streamfold.dsl.aggregate.AggregateException;
import org.streamfold.dsl.aggregate.AggregateFold;
import org.streamfold.dsl.aggregate.VersionedState;
import org.streamfold.eventstore.api.ConflictException;
import org.streamfold.eventstore.api.EventStore;
import org.streamfold.eventstore.api.Version;
import org.streamfold.retry.RetryStrategy;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.streamfold.eventstore.api.ExpectedStreamVersion.exactly;

/**
 * A generic application service that works in many scenarios. It reads the whole event stream, folds it with the
 * {@link Aggregate}, calls the domain model with the current state and appends the resulting events, expecting the
 * event stream to still be at the version that was read. If another writer got there first, the whole cycle is
 * retried according to the {@link RetryStrategy}.
 *
 * @param <ID> The type of the stream id
 * @param <S>  The type of the aggregate state
 * @param <E>  The type of the events
 */
public class GenericApplicationService<ID, S, E> implements ApplicationService<ID, S, E> {
    private static final Logger log = LoggerFactory.getLogger(GenericApplicationService.class);

    private final EventStore<ID, E> eventStore;
    private final Aggregate<S, ? super E> aggregate;
    private final RetryStrategy retryStrategy;

    /**
     * Create a GenericApplicationService with the supplied {@link EventStore} and {@link Aggregate}.
     * It will use a {@link RetryStrategy} for retries, with exponential backoff starting with 100 ms and progressively go up to max 2 seconds wait time between
     * each retry, if {@link ConflictException} is caught. It will, by default, only retry 5 times before giving up, rethrowing the original exception.
     *
     * @param eventStore The event store to use
     * @param aggregate  The aggregate that derives the state that is passed to the domain model
     * @see #GenericApplicationService(EventStore, Aggregate, RetryStrategy)
     */
    public GenericApplicationService(EventStore<ID, E> eventStore, Aggregate<S, ? super E> aggregate) {
        this(eventStore, aggregate, defaultRetryStrategy());
    }

    /**
     * Create a GenericApplicationService with the supplied {@link EventStore}, {@link Aggregate} and {@link RetryStrategy}.
     *
     * @param eventStore    The event store to use
     * @param aggregate     The aggregate that derives the state that is passed to the domain model
     * @param retryStrategy The retry strategy to use when the events could not be appended
     */
    public GenericApplicationService(EventStore<ID, E> eventStore, Aggregate<S, ? super E> aggregate, RetryStrategy retryStrategy) {
        if (eventStore == null) throw new IllegalArgumentException(EventStore.class.getSimpleName() + " cannot be null");
        if (aggregate == null) throw new IllegalArgumentException(Aggregate.class.getSimpleName() + " cannot be null");
        if (retryStrategy == null) throw new IllegalArgumentException(RetryStrategy.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.aggregate = aggregate;
        this.retryStrategy = retryStrategy;
    }

    @Override
    public Version execute(ID streamId, Function<S, List<E>> functionThatCallsDomainModel, @Nullable Consumer<List<E>> sideEffect) {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        Objects.requireNonNull(functionThatCallsDomainModel, "Function that calls domain model cannot be null");

        Result<E> result = retryStrategy.execute(() -> {
            // Derive the current state from all events in the stream
            VersionedState<S> current = AggregateFold.load(eventStore, aggregate, streamId);

            // Call a pure function from the domain model which returns the new events
            List<E> newEvents = emptyListIfNull(functionThatCallsDomainModel.apply(current.state()));
            if (newEvents.isEmpty()) {
                return new Result<>(current.version(), newEvents);
            }

            // Only succeeds if nobody else has appended to the stream since it was read
            Version version = eventStore.append(streamId, exactly(current.version()), newEvents);
            return new Result<>(version, newEvents);
        });

        if (sideEffect != null) {
            sideEffect.accept(result.events);
        }
        return result.version;
    }

    private static <E> List<E> emptyListIfNull(@Nullable List<E> list) {
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * @return The default {@link RetryStrategy} using exponential backoff starting with 100 ms and progressively go up to max 2 seconds wait time if {@link ConflictException} is caught.
     * It will only retry 5 times before giving up, rethrowing the original exception. {@link AggregateException}s, and all other exceptions, are never retried.
     */
    public static RetryStrategy defaultRetryStrategy() {
        return RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0)
                .maxAttempts(5)
                .retryIf(ConflictException.class::isInstance)
                .onError((info, throwable) -> {
                    if (info.isRetryable()) {
                        log.warn("Attempt {} of {} failed, retrying in {}: {}", info.attemptNumber(), info.maxAttempts(),
                                info.backoffBeforeNextAttempt().orElse(Duration.ZERO), throwable.getMessage());
                    }
                });
    }

    private static class Result<E> {
        private final Version version;
        private final List<E> events;

        Result(Version version, List<E> events) {
            this.version = version;
            this.events = events;
        }
    }
}
