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
 * An event store that stores append-only event streams. Each stream is identified by a stream id and the events in it
 * have contiguous versions starting at {@code 1}. Implementations must be safe to use from multiple threads.
 *
 * @param <ID> The type of the stream id. The event store uses a stable textual form of the id as key.
 * @param <E>  The type of the events, opaque to the event store
 */
public interface EventStore<ID, E> extends ReadEventStream<ID, E>, AppendToEventStream<ID, E>, EventStreamExists<ID> {
}
