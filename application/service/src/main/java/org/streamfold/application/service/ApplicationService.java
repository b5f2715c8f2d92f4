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

package org.streamfold.application.service;

import org.jspecify.annotations.Nullable;
import org.streamfold.eventstore.api.Version;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * An application service loads the current state of an aggregate, lets a <i>pure</i> function from the domain model
 * decide which events to produce, and appends the events to the event stream of the aggregate.
 *
 * @param <ID> The type of the stream id
 * @param <S>  The type of the aggregate state
 * @param <E>  The type of the events
 */
public interface ApplicationService<ID, S, E> {

    /**
     * Execute a function that is given the current state of the aggregate stored in the event stream {@code streamId},
     * and append the events it returns to the same event stream. Also execute side-effects that are executed
     * synchronously <i>after</i> the events have been appended.
     *
     * @param streamId                     The id of the stream to load the state from and also append the events returned from {@code functionThatCallsDomainModel} to.
     * @param functionThatCallsDomainModel A <i>pure</i> function that calls the domain model. It may be invoked more than once,
     *                                     for example if another writer appended events to the stream at the same time.
     * @param sideEffect                   Side-effects that are executed <i>after</i> the events have been appended, may be {@code null}.
     * @return The version of the event stream after the events were appended.
     */
    Version execute(ID streamId, Function<S, List<E>> functionThatCallsDomainModel, @Nullable Consumer<List<E>> sideEffect);

    /**
     * Execute a function that is given the current state of the aggregate stored in the event stream {@code streamId},
     * and append the events it returns to the same event stream.
     *
     * @see #execute(Object, Function, Consumer)
     */
    default Version execute(ID streamId, Function<S, List<E>> functionThatCallsDomainModel) {
        return execute(streamId, functionThatCallsDomainModel, null);
    }
}
