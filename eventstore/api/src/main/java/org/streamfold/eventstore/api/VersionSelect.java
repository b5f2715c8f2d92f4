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

import static java.util.Objects.requireNonNull;

/**
 * Specifies which events of a stream to read.
 */
@NullMarked
public sealed interface VersionSelect {

    /**
     * Read all events of the stream.
     *
     * @return A {@link VersionSelect} with the behavior specified above.
     */
    static VersionSelect all() {
        return All.INSTANCE;
    }

    /**
     * Read the events whose version is greater than or equal to {@code version}. This is typically used to read the events
     * that were written after a snapshot was taken.
     *
     * @return A {@link VersionSelect} with the behavior specified above.
     */
    static VersionSelect from(Version version) {
        requireNonNull(version, Version.class.getSimpleName() + " cannot be null");
        return new From(version);
    }

    static VersionSelect from(long version) {
        return from(Version.of(version));
    }

    /**
     * @return {@code true} if the event with the supplied {@code version} is selected, {@code false} otherwise.
     */
    boolean includes(Version version);

    final class All implements VersionSelect {
        private static final All INSTANCE = new All();

        private All() {
        }

        @Override
        public boolean includes(Version version) {
            return true;
        }

        @Override
        public String toString() {
            return "all";
        }
    }

    record From(Version version) implements VersionSelect {

        public From {
            requireNonNull(version, Version.class.getSimpleName() + " cannot be null");
        }

        @Override
        public boolean includes(Version version) {
            return version.compareTo(this.version) >= 0;
        }

        @Override
        public String toString() {
            return "from " + version;
        }
    }
}
