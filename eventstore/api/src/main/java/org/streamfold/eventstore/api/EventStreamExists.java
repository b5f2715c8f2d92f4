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

/**
 * An interface that should be implemented by event stores that can tell if an event stream exists.
 *
 * @param <ID> The type of the stream id
 */
public interface EventStreamExists<ID> {

    /**
     * @param streamId The id of the event stream
     * @return {@code true} if at least one event has been appended to the stream, {@code false} otherwise.
     */
    boolean exists(ID streamId);
}
