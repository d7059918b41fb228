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

package io.github.suppierk.es.cqrs;

import io.github.suppierk.es.store.ConcurrencyConflictException;
import io.github.suppierk.es.store.EventStore;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads aggregates of a single {@link AggregateType} by replaying their streams and saves them by
 * appending their pending events.
 *
 * <p>The repository never retries: a {@link ConcurrencyConflictException} on save reaches the
 * caller untouched, and it is up to the caller to reload the aggregate and try again.
 *
 * @param <A> the aggregate class
 * @param <E> the sealed family of payloads the aggregate produces
 */
public final class AggregateRepository<A extends AggregateRoot<E>, E extends EventPayload>
    extends Suspicious {
  private static final Logger logger = LoggerFactory.getLogger(AggregateRepository.class);

  private final AggregateType<A, E> aggregateType;
  private final EventStore eventStore;
  private final EventPublisher eventPublisher;

  /**
   * @param aggregateType this repository works with
   * @param eventStore to load and append events
   * @param eventPublisher to hand persisted events to
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public AggregateRepository(
      final AggregateType<A, E> aggregateType,
      final EventStore eventStore,
      final EventPublisher eventPublisher) {
    this.aggregateType = throwIllegalArgumentIfNull(aggregateType, "Aggregate type");
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.eventPublisher = throwIllegalArgumentIfNull(eventPublisher, "Event publisher");
  }

  public AggregateType<A, E> getAggregateType() {
    return aggregateType;
  }

  /**
   * @param aggregateId to load
   * @return a fresh instance in its current state, exclusively owned by the caller
   * @throws IllegalArgumentException if the ID is {@code null}
   * @throws AggregateNotFoundException if the aggregate has no history
   */
  public A load(final UUID aggregateId) {
    final UUID nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate ID");

    final List<DomainEvent<? extends E>> history =
        throwIllegalStateIfNull(
            eventStore.load(nonNullAggregateId, aggregateType), "Loaded event stream");

    if (history.isEmpty()) {
      throw new AggregateNotFoundException(nonNullAggregateId, aggregateType.name());
    }

    return aggregateType.reconstitute(history);
  }

  /**
   * @param aggregateId to check
   * @return {@code true} if the aggregate has at least one persisted event
   * @throws IllegalArgumentException if the ID is {@code null}
   */
  public boolean exists(final UUID aggregateId) {
    return eventStore.currentVersion(
            throwIllegalArgumentIfNull(aggregateId, "Aggregate ID"), aggregateType)
        > 0L;
  }

  /**
   * Appends pending events of the aggregate, clears them and publishes them.
   *
   * @param aggregate to save
   * @return persisted events, oldest first, or an empty list if there was nothing to save
   * @throws IllegalArgumentException if the aggregate is {@code null}
   * @throws IllegalStateException if the aggregate has pending events, but no identity
   * @throws ConcurrencyConflictException if the stream was modified since the aggregate was loaded
   */
  public List<DomainEvent<? extends E>> save(final A aggregate) {
    final A nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
    final List<DomainEvent<? extends E>> pendingEvents = nonNullAggregate.pendingEvents();

    if (pendingEvents.isEmpty()) {
      return List.of();
    }

    final UUID aggregateId = throwIllegalStateIfNull(nonNullAggregate.aggregateId(), "Aggregate ID");
    final long expectedVersion = nonNullAggregate.version() - pendingEvents.size();

    eventStore.append(aggregateId, aggregateType, expectedVersion, pendingEvents);
    nonNullAggregate.clearPendingEvents();

    logger.debug(
        "Saved {} events of '{}' aggregate {} at version {}",
        pendingEvents.size(),
        aggregateType,
        aggregateId,
        nonNullAggregate.version());

    eventPublisher.publish(pendingEvents);
    return pendingEvents;
  }
}
