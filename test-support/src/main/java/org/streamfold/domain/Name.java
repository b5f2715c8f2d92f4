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

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Decisions for the name domain. Each decision takes the current name, as derived by {@link NameAggregate}, and returns
 * the events to append.
 */
public class Name {

    public static List<DomainEvent> defineName(@Nullable String currentName, LocalDateTime time, String name) {
        return defineName(currentName, UUID.randomUUID().toString(), time, name);
    }

    public static List<DomainEvent> defineName(@Nullable String currentName, String eventId, LocalDateTime time, String name) {
        if (currentName != null) {
            throw new IllegalStateException("Name is already defined as " + currentName);
        }
        return Collections.singletonList(new NameDefined(eventId, time, name));
    }

    public static List<DomainEvent> changeName(@Nullable String currentName, LocalDateTime time, String newName) {
        return changeName(currentName, UUID.randomUUID().toString(), time, newName);
    }

    public static List<DomainEvent> changeName(@Nullable String currentName, String eventId, LocalDateTime time, String newName) {
        if (currentName == null) {
            throw new IllegalArgumentException("Cannot change name since it is currently undefined");
        } else if (Objects.equals(currentName, "John Doe")) {
            throw new IllegalArgumentException("Cannot change name from John Doe since this is the ultimate name");
        } else if (Objects.equals(currentName, newName)) {
            return Collections.emptyList();
        }
        return Collections.singletonList(new NameWasChanged(eventId, time, newName));
    }
}
