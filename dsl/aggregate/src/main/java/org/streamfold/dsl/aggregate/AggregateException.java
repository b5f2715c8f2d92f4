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
 * Thrown by {@link Aggregate#apply(Object, Object)} when an event cannot be applied to the current state, for example
 * because it violates an invariant of the aggregate or because the history is out of order.
 * <p>
 * Unlike a {@link org.streamfold.eventstore.api.ConflictException} this is not a concurrency problem, so retrying
 * will not help.
 * </p>
 */
public class AggregateException extends RuntimeException {

    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
