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

/**
 * An aggregate is a business entity whose state is derived entirely from the events in its event stream.
 * Applying the same events, in the same order, to the same initial state must always yield the same state.
 * <p>
 * An {@code Aggregate} knows nothing about event stores, use {@link AggregateFold} to derive the state of an aggregate
 * from an event stream.
 * </p>
 *
 * @param <S> The state of the aggregate. It may be {@code null}, for example to represent an aggregate that is not yet created.
 * @param <E> The type of events that changes the state of the aggregate
 */
public interface Aggregate<S, E> {

    /**
     * @return The state of an aggregate whose event stream is empty
     */
    S initialState();

    /**
     * Applies the change described by {@code event} to {@code state}. This must be a pure function: it may not have
     * side effects and may not perform I/O.
     *
     * @param state The current state
     * @param event The event to apply
     * @return The new state
     * @throws AggregateException If the event cannot be applied to the current state
     */
    S apply(S state, E event);
}
