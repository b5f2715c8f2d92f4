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
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;

/**
 * Describes a failed attempt, passed to the listener registered with {@link RetryStrategy#onError}.
 *
 * @param attemptNumber The attempt that failed, {@code 1} for the first attempt
 * @param maxAttempts   The configured max number of attempts, {@link Integer#MAX_VALUE} if unlimited
 * @param backoff       The time until the next attempt, or {@code null} if the failure is rethrown
 */
@NullMarked
public record ErrorInfo(int attemptNumber, int maxAttempts, @Nullable Duration backoff) {

    /**
     * @return {@code true} if another attempt will be made, {@code false} if the failure is rethrown to the caller.
     */
    public boolean isRetryable() {
        return backoff != null;
    }

    public Optional<Duration> backoffBeforeNextAttempt() {
        return Optional.ofNullable(backoff);
    }
}
