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
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Re-runs an operation that failed with an exception that is worth retrying, typically because an optimistic
 * append lost the race against another writer. Every attempt runs the whole operation again, so the operation
 * should re-read whatever it depends on.
 * <p>
 * Instances are immutable, every configuration method returns a new instance:
 * </p>
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.fixed(Duration.ofMillis(200)).maxAttempts(5).retryIf(ConflictException.class::isInstance);
 * Version version = retryStrategy.execute(() -> readDecideAndAppend());
 * </pre>
 * By default every {@link RuntimeException} is retried, without limit. {@link Error}s are never retried.
 */
@NullMarked
public final class RetryStrategy {
    private static final int UNLIMITED = Integer.MAX_VALUE;
    private static final BiConsumer<ErrorInfo, Throwable> NO_LISTENER = (__, ___) -> {
    };

    private final Backoff backoff;
    private final int maxAttempts;
    private final Predicate<? super RuntimeException> retryPredicate;
    private final BiConsumer<ErrorInfo, Throwable> errorListener;

    private RetryStrategy(Backoff backoff, int maxAttempts, Predicate<? super RuntimeException> retryPredicate, BiConsumer<ErrorInfo, Throwable> errorListener) {
        this.backoff = requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        this.maxAttempts = maxAttempts;
        this.retryPredicate = requireNonNull(retryPredicate, "Retry predicate cannot be null");
        this.errorListener = requireNonNull(errorListener, "Error listener cannot be null");
    }

    /**
     * @return A strategy that runs the operation once and rethrows its failure.
     */
    public static RetryStrategy none() {
        return new RetryStrategy(Backoff.none(), 1, __ -> false, NO_LISTENER);
    }

    public static RetryStrategy backoff(Backoff backoff) {
        return new RetryStrategy(backoff, UNLIMITED, __ -> true, NO_LISTENER);
    }

    public static RetryStrategy fixed(Duration delay) {
        return backoff(Backoff.fixed(delay));
    }

    public static RetryStrategy fixed(long millis) {
        return fixed(Duration.ofMillis(millis));
    }

    public static RetryStrategy exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return backoff(Backoff.exponential(initial, max, multiplier));
    }

    /**
     * @param maxAttempts The max number of times the operation is run, including the first one.
     */
    public RetryStrategy maxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be greater than or equal to 1, was " + maxAttempts);
        }
        return new RetryStrategy(backoff, maxAttempts, retryPredicate, errorListener);
    }

    /**
     * Only retry failures that match {@code retryPredicate}, all other failures are rethrown at once.
     */
    public RetryStrategy retryIf(Predicate<? super RuntimeException> retryPredicate) {
        return new RetryStrategy(backoff, maxAttempts, retryPredicate, errorListener);
    }

    /**
     * Register a listener that is invoked for every failed attempt, including the last one that is rethrown.
     * Replaces any previously registered listener.
     */
    public RetryStrategy onError(BiConsumer<ErrorInfo, Throwable> errorListener) {
        return new RetryStrategy(backoff, maxAttempts, retryPredicate, errorListener);
    }

    /**
     * Run {@code operation} until it succeeds, the failure is not retryable or max attempts are reached.
     *
     * @return The result of the first successful attempt
     * @throws RuntimeException The failure of the last attempt, unchanged
     */
    public <T> T execute(Supplier<T> operation) {
        requireNonNull(operation, "Operation cannot be null");
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                boolean retry = attempt < maxAttempts && retryPredicate.test(e);
                Duration delay = retry ? backoff.delayAfter(attempt) : null;
                errorListener.accept(new ErrorInfo(attempt, maxAttempts, delay), e);
                if (delay == null) {
                    throw e;
                }
                sleep(delay, e);
                attempt++;
            }
        }
    }

    private static void sleep(Duration delay, RuntimeException failure) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure.addSuppressed(e);
            throw failure;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryStrategy)) return false;
        RetryStrategy that = (RetryStrategy) o;
        return maxAttempts == that.maxAttempts && backoff.equals(that.backoff) && retryPredicate.equals(that.retryPredicate) && errorListener.equals(that.errorListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryStrategy.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + (maxAttempts == UNLIMITED ? "unlimited" : maxAttempts))
                .toString();
    }
}
