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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Base class for entities whose state is derived entirely from their own event history.
 *
 * <p>State may only change through {@link #recordThat(EventType, EventPayload)}: the payload is
 * folded into the state via {@link #apply(EventPayload)} and the resulting {@link DomainEvent} is
 * queued as pending until {@link AggregateRepository#save(AggregateRoot)} persists it.
 *
 * <p>When the aggregate is loaded, the same {@link #apply(EventPayload)} is used to replay history,
 * which means it must be deterministic and must not have any side effects.
 *
 * <p>Instances are not thread-safe and must never be shared: every load produces a fresh instance
 * owned by a single command.
 *
 * @param <E> the sealed family of payloads this aggregate produces
 */
public abstract class AggregateRoot<E extends EventPayload> {
  private final List<DomainEvent<? extends E>> pendingEvents;

  private UUID aggregateId;
  private long version;

  protected AggregateRoot() {
    this.pendingEvents = new ArrayList<>();
    this.aggregateId = null;
    this.version = 0L;
  }

  /**
   * @return identity of this aggregate or {@code null} if it was not assigned yet
   */
  public final UUID aggregateId() {
    return aggregateId;
  }

  /**
   * @return number of events ever applied to this aggregate, including pending ones
   */
  public final long version() {
    return version;
  }

  /**
   * @return {@code true} if there are events which were not persisted yet
   */
  public final boolean hasPendingEvents() {
    return !pendingEvents.isEmpty();
  }

  /**
   * @return the type of this aggregate, used to tag every event it records
   */
  protected abstract AggregateType<?, E> aggregateType();

  /**
   * Folds a single event into the current state.
   *
   * <p>Invoked both for new events and during replay - must not record new events or call any
   * external services.
   *
   * @param payload of the event to apply
   */
  protected abstract void apply(final E payload);

  /**
   * Assigns identity to a brand-new aggregate. Must be invoked by factory methods before the first
   * event is recorded.
   *
   * @param aggregateId to assign
   * @throws IllegalArgumentException if identity is {@code null}
   * @throws IllegalStateException if a different identity was assigned already
   */
  protected final void assignIdentity(final UUID aggregateId) {
    if (aggregateId == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    if (this.aggregateId != null && !this.aggregateId.equals(aggregateId)) {
      throw new IllegalStateException(
          "Aggregate already has ID '%s', cannot reassign it to '%s'"
              .formatted(this.aggregateId, aggregateId));
    }

    this.aggregateId = aggregateId;
  }

  /**
   * Records a new event: applies it to the current state and queues it for persistence.
   *
   * @param eventType tag of the event, must be declared by {@link #aggregateType()}
   * @param payload describing what happened
   * @param <P> type of the payload
   * @throws IllegalStateException if identity was not assigned yet
   * @throws IllegalArgumentException if the event type is not declared by this aggregate type
   */
  protected final <P extends E> void recordThat(final EventType<P> eventType, final P payload) {
    if (aggregateId == null) {
      throw new IllegalStateException("Aggregate ID must be assigned before recording events");
    }

    final AggregateType<?, E> type = aggregateType();
    if (!type.declares(eventType)) {
      throw new IllegalArgumentException(
          "Event type '%s' is not declared by aggregate type '%s'".formatted(eventType, type));
    }

    final DomainEvent<P> event =
        DomainEvent.occurred(aggregateId, type.name(), version + 1, eventType, payload);

    apply(payload);
    version = event.version();
    pendingEvents.add(event);
  }

  /**
   * Applies an already persisted event. Never produces pending events.
   *
   * @param event from the stream of this aggregate
   * @throws IllegalStateException if the event does not belong to this aggregate or is out of order
   */
  final void replay(final DomainEvent<? extends E> event) {
    if (aggregateId == null) {
      aggregateId = event.aggregateId();
    } else if (!aggregateId.equals(event.aggregateId())) {
      throw new IllegalStateException(
          "Event '%s' belongs to aggregate '%s', not '%s'"
              .formatted(event.messageId(), event.aggregateId(), aggregateId));
    }

    if (event.version() != version + 1) {
      throw new IllegalStateException(
          "Stream of aggregate '%s' is not contiguous: expected version %d, got %d"
              .formatted(aggregateId, version + 1, event.version()));
    }

    apply(event.payload());
    version = event.version();
  }

  /**
   * @return a snapshot of events which were recorded but not persisted yet, oldest first
   */
  final List<DomainEvent<? extends E>> pendingEvents() {
    return List.copyOf(pendingEvents);
  }

  /** Invoked once pending events are durably stored. */
  final void clearPendingEvents() {
    pendingEvents.clear();
  }
}
