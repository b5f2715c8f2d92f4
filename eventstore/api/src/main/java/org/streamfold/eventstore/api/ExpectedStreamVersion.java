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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The condition that must be fulfilled for events to be appended to a stream. This is what makes optimistic concurrency
 * control possible: the caller states which version of the stream it based its decision on, and the event store refuses
 * to append if the stream has changed since.
 */
@NullMarked
public sealed interface ExpectedStreamVersion {

    /**
     * Stream version doesn't matter, the events are always appended.
     *
     * @return An {@link ExpectedStreamVersion} with the behavior specified above.
     */
    static ExpectedStreamVersion any() {
        return Any.INSTANCE;
    }

    /**
     * The current version of the stream must be equal to {@code version} in order for the events to be appended.
     * Use {@link Version#ZERO} to require that the stream doesn't exist.
     *
     * @return An {@link ExpectedStreamVersion} with the behavior specified above.
     */
    static ExpectedStreamVersion exactly(Version version) {
        requireNonNull(version, Version.class.getSimpleName() + " cannot be null");
        return new Exactly(version);
    }

    static ExpectedStreamVersion exactly(long version) {
        return exactly(Version.of(version));
    }

    /**
     * Evaluate this condition against the current version of a stream.
     *
     * @param currentVersion The current version of the stream ({@link Version#ZERO} if it doesn't exist)
     * @return An empty {@code Optional} if the condition is fulfilled, otherwise the {@link ConflictError} describing why not.
     */
    Optional<ConflictError> check(Version currentVersion);

    final class Any implements ExpectedStreamVersion {
        private static final Any INSTANCE = new Any();

        private Any() {
        }

        @Override
        public Optional<ConflictError> check(Version currentVersion) {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    record Exactly(Version version) implements ExpectedStreamVersion {

        public Exactly {
            requireNonNull(version, Version.class.getSimpleName() + " cannot be null");
        }

        @Override
        public Optional<ConflictError> check(Version currentVersion) {
            requireNonNull(currentVersion, "Current version cannot be null");
            return version.equals(currentVersion) ? Optional.empty() : Optional.of(new ConflictError(version, currentVersion));
        }

        @Override
        public String toString() {
            return "exactly " + version;
        }
    }
}
