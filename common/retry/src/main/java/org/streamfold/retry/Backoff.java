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
package org.streamfold.retry;

import org.jspecify.annotations.NullMarked;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * How long a {@link RetryStrategy} waits after a failed attempt before it tries again.
 */
@NullMarked
public sealed interface Backoff {

    /**
     * @param failedAttempts The number of attempts that have failed so far, {@code 1} after the first failure.
     * @return The time to wait before the next attempt
     */
    Duration delayAfter(int failedAttempts);

    static Backoff none() {
        return new Fixed(Duration.ZERO);
    }

    static Backoff fixed(Duration delay) {
        return new Fixed(delay);
    }

    /**
     * Wait {@code initial} after the first failure, then multiply the wait time with {@code multiplier} for every
     * failure after that, but never wait longer than {@code max}.
     */
    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    record Fixed(Duration delay) implements Backoff {

        public Fixed {
            requireNonNull(delay, "Delay cannot be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Delay cannot be negative");
            }
        }

        @Override
        public Duration delayAfter(int failedAttempts) {
            return delay;
        }
    }

    record Exponential(Duration initial, Duration max, double multiplier) implements Backoff {

        public Exponential {
            requireNonNull(initial, "Initial delay cannot be null");
            requireNonNull(max, "Max delay cannot be null");
            if (initial.isNegative()) {
                throw new IllegalArgumentException("Initial delay cannot be negative");
            }
            if (max.compareTo(initial) < 0) {
                throw new IllegalArgumentException("Max delay cannot be less than initial delay");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than or equal to 1");
            }
        }

        @Override
        public Duration delayAfter(int failedAttempts) {
            double millis = initial.toMillis() * Math.pow(multiplier, failedAttempts - 1);
            return millis >= max.toMillis() ? max : Duration.ofMillis(Math.round(millis));
        }
    }
}
