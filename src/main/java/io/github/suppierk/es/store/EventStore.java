/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.es.store;

import io.github.suppierk.es.cqrs.AggregateType;
import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.cqrs.EventPayload;
import java.util.List;
import java.util.UUID;

/**
 * Durable, append-only storage of {@link DomainEvent}s, grouped into streams.
 *
 * <p>A stream is identified by the pair of {@link AggregateType} and aggregate ID and holds events
 * ordered by their {@link DomainEvent#version()}, starting from {@code 1} without gaps.
 *
 * <p>Optimistic concurrency is the only mutual exclusion mechanism: writers state which version
 * they expect the stream to be at, and exactly one of the racing writers wins.
 */
public interface EventStore {
  /**
   * Creates the underlying storage structure if it is absent. Invoking this method again is a
   * no-op.
   *
   * @throws EventStoreException if the structure cannot be created
   */
  void createSchema();

  /**
   * Atomically appends events to the end of the stream.
   *
   * <p>Events must belong to the stream and carry versions {@code expectedVersion + 1} up to {@code
   * expectedVersion + events.size()}. Either all events are persisted or none. Appending an empty
   * list does nothing.
   *
   * @param streamId identity of the aggregate
   * @param aggregateType of the aggregate
   * @param expectedVersion the version the stream must be at before this append, {@code 0} for a
   *     new stream
   * @param events to append, oldest first
   * @param <E> the payload family of the aggregate
   * @throws IllegalArgumentException if arguments are {@code null} or events do not follow the
   *     expected version
   * @throws ConcurrencyConflictException if the stream is not at the expected version
   * @throws EventStoreException if the underlying storage failed
   */
  <E extends EventPayload> void append(
      final UUID streamId,
      final AggregateType<?, E> aggregateType,
      final long expectedVersion,
      final List<? extends DomainEvent<? extends E>> events);

  /**
   * @param streamId identity of the aggregate
   * @param aggregateType of the aggregate
   * @param <E> the payload family of the aggregate
   * @return all events of the stream, oldest first, or an empty list if the stream has no history
   * @throws IllegalArgumentException if arguments are {@code null}
   * @throws EventStoreException if the underlying storage failed
   */
  <E extends EventPayload> List<DomainEvent<? extends E>> load(
      final UUID streamId, final AggregateType<?, E> aggregateType);

  /**
   * @param streamId identity of the aggregate
   * @param aggregateType of the aggregate
   * @return the version of the last persisted event, {@code 0} if the stream has no history
   * @throws IllegalArgumentException if arguments are {@code null}
   * @throws EventStoreException if the underlying storage failed
   */
  long currentVersion(final UUID streamId, final AggregateType<?, ?> aggregateType);
}
