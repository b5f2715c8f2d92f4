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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Configuration for the {@link InMemoryEventStore}
 *
 * @param <ID> The type of the stream id
 */
@NullMarked
public class InMemoryEventStoreConfig<ID> {

    public final Function<? super ID, String> streamKey;

    private InMemoryEventStoreConfig(Function<? super ID, String> streamKey) {
        this.streamKey = Objects.requireNonNull(streamKey, "Stream key function cannot be null");
    }

    /**
     * @return A configuration that uses {@link String#valueOf(Object)} of the stream id as key.
     */
    public static <ID> InMemoryEventStoreConfig<ID> defaults() {
        return new Builder<ID>().build();
    }

    public static <ID> Builder<ID> builder() {
        return new Builder<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InMemoryEventStoreConfig)) return false;
        InMemoryEventStoreConfig<?> that = (InMemoryEventStoreConfig<?>) o;
        return Objects.equals(streamKey, that.streamKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamKey);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", InMemoryEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("streamKey=" + streamKey)
                .toString();
    }

    @NullUnmarked
    public static final class Builder<ID> {
        private Function<? super ID, String> streamKey = String::valueOf;

        /**
         * Specify how a stream id is converted into the key that the stream is stored under. Two stream ids
         * that are converted to the same key refer to the same event stream. By default {@link String#valueOf(Object)} is used.
         *
         * @param streamKey The function to use, it cannot return null.
         * @return The builder instance
         */
        @NullMarked
        public Builder<ID> streamKey(Function<? super ID, String> streamKey) {
            this.streamKey = streamKey;
            return this;
        }

        @NullMarked
        public InMemoryEventStoreConfig<ID> build() {
            return new InMemoryEventStoreConfig<>(streamKey);
        }
    }
}
