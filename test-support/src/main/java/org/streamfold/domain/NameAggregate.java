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

package org.streamfold.domain;

import org.jspecify.annotations.Nullable;
import org.streamfold.dsl.aggregate.Aggregate;
import org.streamfold.dsl.aggregate.AggregateException;

/**
 * The current name, or {@code null} if no name has been defined.
 */
public class NameAggregate implements Aggregate<@Nullable String, DomainEvent> {

    @Override
    public @Nullable String initialState() {
        return null;
    }

    @Override
    public @Nullable String apply(@Nullable String currentName, DomainEvent event) {
        if (event instanceof NameDefined) {
            if (currentName != null) {
                throw new AggregateException("Name is already defined as " + currentName + ", cannot apply " + event);
            }
            return event.getName();
        } else if (event instanceof NameWasChanged) {
            if (currentName == null) {
                throw new AggregateException("Name is not defined, cannot apply " + event);
            }
            return event.getName();
        }
        throw new AggregateException("Unsupported event " + event);
    }
}
