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

package org.streamfold.eventstore.test;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.streamfold.domain.DomainEvent;
import org.streamfold.domain.NameAggregate;
import org.streamfold.domain.NameDefined;
import org.streamfold.domain.NameWasChanged;
import org.streamfold.dsl.aggregate.AggregateFold;
import org.streamfold.dsl.aggregate.VersionedState;
import org.streamfold.eventstore.api.ConflictError;
import org.streamfold.eventstore.api.ConflictException;
import org.streamfold.eventstore.api.EventStore;
import org.streamfold.eventstore.api.EventStream;
import org.streamfold.eventstore.api.Persisted;
import org.streamfold.eventstore.api.Version;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.streamfold.eventstore.api.ExpectedStreamVersion.any;
import static org.streamfold.eventstore.api.ExpectedStreamVersion.exactly;
import static org.streamfold.eventstore.api.VersionSelect.all;
import static org.streamfold.eventstore.api.VersionSelect.from;

/**
 * Tests that every {@link EventStore} implementation must pass. Extend this class and implement {@link #newEventStore()}.
 */
@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class EventStoreContract {

    protected static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);

    protected EventStore<String, DomainEvent> eventStore;

    /**
     * @return A new and empty event store. Invoked before each test.
     */
    protected abstract EventStore<String, DomainEvent> newEventStore();

    @BeforeEach
    protected void create_event_store() {
        eventStore = newEventStore();
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        void reading_a_stream_that_does_not_exist_returns_an_empty_stream_at_version_zero() {
            // When
            EventStream<String, DomainEvent> eventStream = eventStore.read("unknown");

            // Then
            assertThat(eventStream.id()).isEqualTo("unknown");
            assertThat(eventStream.version()).isEqualTo(Version.ZERO);
            assertThat(eventStream.isEmpty()).isTrue();
            assertThat(eventStream.eventList()).isEmpty();
        }

        @Test
        void events_are_returned_in_the_order_they_were_appended_with_stream_id_and_version() {
            // Given
            NameDefined nameDefined = nameDefined("John");
            NameWasChanged nameWasChanged1 = nameWasChanged("Jane");
            NameWasChanged nameWasChanged2 = nameWasChanged("Jack");
            eventStore.append("name", any(), List.of(nameDefined));
            eventStore.append("name", any(), List.of(nameWasChanged1, nameWasChanged2));

            // When
            EventStream<String, DomainEvent> eventStream = eventStore.read("name", all());

            // Then
            assertThat(eventStream.eventList()).containsExactly(
                    new Persisted<>("name", Version.of(1), nameDefined),
                    new Persisted<>("name", Version.of(2), nameWasChanged1),
                    new Persisted<>("name", Version.of(3), nameWasChanged2));
        }

        @Test
        void reading_from_a_version_returns_the_events_with_a_version_greater_than_or_equal_to_the_version() {
            // Given
            eventStore.append("name", any(), List.of(nameDefined("John"), nameWasChanged("Jane"), nameWasChanged("Jack")));

            // When
            EventStream<String, DomainEvent> eventStream = eventStore.read("name", from(2));

            // Then
            assertThat(versionsOf(eventStream)).containsExactly(2L, 3L);
            assertThat(eventStream.rawEvents().map(DomainEvent::getName)).containsExactly("Jane", "Jack");
        }

        @Test
        void reading_from_the_version_after_the_last_event_returns_no_events_but_the_version_of_the_stream() {
            // Given
            eventStore.append("name", any(), List.of(nameDefined("John"), nameWasChanged("Jane")));

            // When
            EventStream<String, DomainEvent> eventStream = eventStore.read("name", from(3));

            // Then
            assertThat(eventStream.eventList()).isEmpty();
            assertThat(eventStream.version()).isEqualTo(Version.of(2));
            assertThat(eventStream.isEmpty()).isFalse();
        }

        @Test
        void read_is_a_snapshot_that_is_not_affected_by_later_appends() {
            // Given
            eventStore.append("name", any(), List.of(nameDefined("John")));
            EventStream<String, DomainEvent> eventStream = eventStore.read("name");

            // When
            eventStore.append("name", any(), List.of(nameWasChanged("Jane")));

            // Then
            assertThat(eventStream.version()).isEqualTo(Version.of(1));
            assertThat(versionsOf(eventStream)).containsExactly(1L);
        }

        @Test
        void events_of_a_stream_can_be_consumed_more_than_once() {
            // Given
            eventStore.append("name", any(), List.of(nameDefined("John"), nameWasChanged("Jane")));
            EventStream<String, DomainEvent> eventStream = eventStore.read("name");

            // Then
            assertThat(eventStream.events().count()).isEqualTo(2);
            assertThat(eventStream).hasSize(2);
        }

        @Test
        void reading_with_null_stream_id_throws_npe() {
            assertThatThrownBy(() -> eventStore.read(null, all())).isInstanceOf(NullPointerException.class);
        }

        @Test
        void reading_with_null_version_select_throws_npe() {
            assertThatThrownBy(() -> eventStore.read("name", null)).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        void appending_three_events_to_a_new_stream_with_expected_version_zero_assigns_versions_one_to_three() {
            // Given
            List<DomainEvent> events = List.of(nameDefined("John"), nameWasChanged("Jane"), nameWasChanged("Jack"));

            // When
            Version version = eventStore.append("stream:test", exactly(0), events);

            // Then
            assertThat(version).isEqualTo(Version.of(3));
            EventStream<String, DomainEvent> eventStream = eventStore.read("stream:test", all());
            assertThat(versionsOf(eventStream)).containsExactly(1L, 2L, 3L);
            assertThat(eventStream.rawEvents()).containsExactlyElementsOf(events);
            assertThat(eventStream.events().map(Persisted::streamId)).containsOnly("stream:test");
        }

        @Test
        void appending_three_events_to_an_empty_stream_with_expected_version_three_fails_with_conflict_and_writes_nothing() {
            // Given
            List<DomainEvent> events = List.of(nameDefined("John"), nameWasChanged("Jane"), nameWasChanged("Jack"));

            // When
            ConflictException exception = catchThrowableOfType(() -> eventStore.append("stream:test", exactly(3), events), ConflictException.class);

            // Then
            assertThat(exception).isNotNull();
            assertThat(exception.conflict()).isEqualTo(ConflictError.of(3, 0));
            assertThat(exception.eventStreamId).isEqualTo("stream:test");
            assertThat(eventStore.read("stream:test").eventList()).isEmpty();
            assertThat(eventStore.exists("stream:test")).isFalse();
        }

        @Test
        void appending_with_any_continues_from_the_current_version() {
            // Given
            eventStore.append("name", any(), List.of(nameDefined("John"), nameWasChanged("Jane")));

            // When
            Version version = eventStore.append("name", List.of(nameWasChanged("Jack")));

            // Then
            assertThat(version).isEqualTo(Version.of(3));
            assertThat(versionsOf(eventStore.read("name"))).containsExactly(1L, 2L, 3L);
        }

        @Test
        void appending_with_the_current_version_as_expected_version_succeeds() {
            // Given
            Version current = eventStore.append("name", exactly(0), List.of(nameDefined("John")));

            // When
            Version version = eventStore.append("name", current.value(), List.of(nameWasChanged("Jane")));

            // Then
            assertThat(version).isEqualTo(Version.of(2));
        }

        @Test
        void conflicting_append_leaves_the_stream_unchanged() {
            // Given
            eventStore.append("name", any(), List.of(nameDefined("John"), nameWasChanged("Jane")));

            // When
            Throwable throwable = catchThrowableOfType(() -> eventStore.append("name", exactly(1), List.of(nameWasChanged("Jack"))), ConflictException.class);

            // Then
            assertThat(throwable).isEqualTo(new ConflictException("name", ConflictError.of(1, 2)));
            EventStream<String, DomainEvent> eventStream = eventStore.read("name");
            assertThat(eventStream.version()).isEqualTo(Version.of(2));
            assertThat(eventStream.rawEvents().map(DomainEvent::getName)).containsExactly("John", "Jane");
        }

        @Test
        void conflicting_append_of_several_events_writes_none_of_them() {
            // Given
            eventStore.append("name", exactly(0), List.of(nameDefined("John"), nameWasChanged("Jane")));

            // When
            ConflictException exception = catchThrowableOfType(() -> eventStore.append("name", exactly(1),
                    List.of(nameWasChanged("Jack"), nameWasChanged("Jill"), nameWasChanged("Joe"))), ConflictException.class);

            // Then
            assertThat(exception).isNotNull();
            assertThat(exception.conflict()).isEqualTo(ConflictError.of(1, 2));
            EventStream<String, DomainEvent> eventStream = eventStore.read("name");
            assertThat(eventStream.version()).isEqualTo(Version.of(2));
            assertThat(versionsOf(eventStream)).containsExactly(1L, 2L);
            assertThat(eventStream.rawEvents().map(DomainEvent::getName)).containsExactly("John", "Jane");
        }

        @Test
        void expected_version_zero_fails_when_stream_exists() {
            // Given
            eventStore.append("name", any(), List.of(nameDefined("John")));

            // Then
            assertThatThrownBy(() -> eventStore.append("name", exactly(0), List.of(nameDefined("Jane"))))
                    .isEqualTo(new ConflictException("name", ConflictError.of(0, 1)));
        }

        @Test
        void appending_no_events_writes_nothing_and_returns_the_current_version() {
            // Given
            eventStore.append("name", any(), List.of(nameDefined("John")));

            // When
            Version version = eventStore.append("name", exactly(1), Collections.emptyList());

            // Then
            assertThat(version).isEqualTo(Version.of(1));
            assertThat(eventStore.read("name").version()).isEqualTo(Version.of(1));
            assertThat(eventStore.append("new", any(), Collections.emptyList())).isEqualTo(Version.ZERO);
            assertThat(eventStore.exists("new")).isFalse();
        }

        @Test
        void appending_no_events_still_evaluates_the_expected_version() {
            assertThatThrownBy(() -> eventStore.append("name", exactly(2), Collections.emptyList()))
                    .isEqualTo(new ConflictException("name", ConflictError.of(2, 0)));
        }

        @Test
        void streams_are_versioned_independently_of_each_other() {
            // When
            eventStore.append("name1", any(), List.of(nameDefined("John"), nameWasChanged("Jane")));
            Version version = eventStore.append("name2", exactly(0), List.of(nameDefined("Jack")));

            // Then
            assertThat(version).isEqualTo(Version.of(1));
            assertThat(eventStore.read("name1").version()).isEqualTo(Version.of(2));
        }

        @Test
        void appending_a_null_event_throws_iae_and_writes_nothing() {
            // Given
            List<DomainEvent> events = Arrays.asList(nameDefined("John"), null);

            // Then
            assertThatThrownBy(() -> eventStore.append("name", any(), events)).isExactlyInstanceOf(IllegalArgumentException.class);
            assertThat(eventStore.exists("name")).isFalse();
        }

        @Test
        void appending_with_null_arguments_throws_npe() {
            assertThatThrownBy(() -> eventStore.append(null, any(), List.of(nameDefined("John")))).isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> eventStore.append("name", null, List.of(nameDefined("John")))).isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> eventStore.append("name", any(), null)).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("exists")
    class Exists {

        @Test
        void returns_false_when_no_events_have_been_appended_to_the_stream() {
            assertThat(eventStore.exists("name")).isFalse();
        }

        @Test
        void returns_true_when_events_have_been_appended_to_the_stream() {
            // When
            eventStore.append("name", any(), List.of(nameDefined("John")));

            // Then
            assertThat(eventStore.exists("name")).isTrue();
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        void only_one_of_several_concurrent_appends_expecting_the_same_version_succeeds() throws Exception {
            // Given
            eventStore.append("name", exactly(0), List.of(nameDefined("John")));
            int numberOfWriters = 20;

            // When
            List<Object> results = runConcurrently(numberOfWriters, writer -> () -> eventStore.append("name", exactly(1), List.of(nameWasChanged("Name " + writer))));

            // Then
            assertThat(results).filteredOn(Version.class::isInstance).containsExactly(Version.of(2));
            assertThat(results).filteredOn(ConflictException.class::isInstance).hasSize(numberOfWriters - 1)
                    .allSatisfy(e -> assertThat(((ConflictException) e).conflict()).isEqualTo(ConflictError.of(1, 2)));
            assertThat(eventStore.read("name").version()).isEqualTo(Version.of(2));
        }

        @Test
        void concurrent_unconditional_appends_are_assigned_contiguous_versions() throws Exception {
            // Given
            int numberOfWriters = 10;
            int eventsPerWriter = 50;

            // When
            runConcurrently(numberOfWriters, writer -> () -> {
                for (int i = 0; i < eventsPerWriter; i++) {
                    eventStore.append("name", any(), List.of(nameWasChanged(writer + ":" + i)));
                }
                return null;
            });

            // Then
            EventStream<String, DomainEvent> eventStream = eventStore.read("name");
            long expectedNumberOfEvents = (long) numberOfWriters * eventsPerWriter;
            assertThat(eventStream.version()).isEqualTo(Version.of(expectedNumberOfEvents));
            assertThat(versionsOf(eventStream)).containsExactlyElementsOf(LongStream.rangeClosed(1, expectedNumberOfEvents).boxed().collect(Collectors.toList()));
            for (int writer = 0; writer < numberOfWriters; writer++) {
                String prefix = writer + ":";
                assertThat(eventStream.rawEvents().map(DomainEvent::getName).filter(name -> name.startsWith(prefix)))
                        .containsExactlyElementsOf(LongStream.range(0, eventsPerWriter).mapToObj(i -> prefix + i).collect(Collectors.toList()));
            }
        }

        @Test
        void appends_to_different_streams_do_not_conflict() throws Exception {
            // When
            List<Object> results = runConcurrently(10, writer -> () -> eventStore.append("name" + writer, exactly(0), List.of(nameDefined("Name " + writer))));

            // Then
            assertThat(results).containsOnly(Version.of(1));
        }
    }

    @Test
    void state_of_an_aggregate_can_be_loaded_from_the_event_store() {
        // Given
        NameAggregate aggregate = new NameAggregate();
        eventStore.append("name", exactly(0), List.of(nameDefined("John"), nameWasChanged("Jane")));

        // When
        VersionedState<String> state = AggregateFold.load(eventStore, aggregate, "name");

        // Then
        assertThat(state).isEqualTo(new VersionedState<>("Jane", Version.of(2)));
    }

    protected static NameDefined nameDefined(String name) {
        return new NameDefined(UUID.randomUUID().toString(), NOW, name);
    }

    protected static NameWasChanged nameWasChanged(String name) {
        return new NameWasChanged(UUID.randomUUID().toString(), NOW, name);
    }

    protected static List<Long> versionsOf(EventStream<?, ?> eventStream) {
        return eventStream.events().map(persisted -> persisted.version().value()).collect(Collectors.toList());
    }

    /**
     * Start {@code numberOfTasks} tasks at the same time and wait for all of them to complete.
     *
     * @return The result of each task, or the exception thrown by the task, in the order the tasks were created.
     */
    protected static List<Object> runConcurrently(int numberOfTasks, TaskFactory taskFactory) throws InterruptedException {
        ExecutorService executorService = Executors.newFixedThreadPool(numberOfTasks);
        try {
            CountDownLatch startSignal = new CountDownLatch(1);
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < numberOfTasks; i++) {
                Callable<?> task = taskFactory.create(i);
                futures.add(executorService.submit(() -> {
                    startSignal.await();
                    return task.call();
                }));
            }
            startSignal.countDown();
            List<Object> results = new ArrayList<>();
            for (Future<Object> future : futures) {
                try {
                    results.add(future.get(10, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    results.add(e.getCause());
                } catch (TimeoutException e) {
                    throw new AssertionError("Task didn't complete in time", e);
                }
            }
            return results;
        } finally {
            executorService.shutdownNow();
        }
    }

    @FunctionalInterface
    protected interface TaskFactory {
        Callable<?> create(int taskNumber);
    }
}
