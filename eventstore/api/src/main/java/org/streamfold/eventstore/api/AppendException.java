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
 * Events could not be appended to an event stream. When this exception is thrown no events have been written.
 *
 * @see ConflictException
 */
public class AppendException extends EventStoreException {
    public final String eventStreamId;

    public AppendException(String eventStreamId, String message) {
        super(message);
        this.eventStreamId = eventStreamId;
    }

    public AppendException(String eventStreamId, String message, Throwable cause) {
        super(message, cause);
        this.eventStreamId = eventStreamId;
    }
}
