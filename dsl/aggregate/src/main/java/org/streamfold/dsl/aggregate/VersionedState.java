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

import org.jspecify.annotations.Nullable;
import org.streamfold.eventstore.api.Version;

import static java.util.Objects.requireNonNull;

/**
 * The state of an aggregate together with the version of the event stream that the state was derived from.
 * Can be stored as a snapshot and later be brought up to date with {@link AggregateFold#loadFrom}.
 *
 * @param state   The state of the aggregate
 * @param version The version of the last event that is included in {@code state}
 * @param <S>     The type of the state
 */
public record VersionedState<S>(@Nullable S state, Version version) {

    public VersionedState {
        requireNonNull(version, Version.class.getSimpleName() + " cannot be null");
    }

    /**
     * @return The initial state of the {@code aggregate} at version {@link Version#ZERO}.
     */
    public static <S> VersionedState<S> initial(Aggregate<S, ?> aggregate) {
        requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
        return new VersionedState<>(aggregate.initialState(), Version.ZERO);
    }
}
