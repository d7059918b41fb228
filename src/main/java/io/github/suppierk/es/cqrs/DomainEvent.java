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

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * An immutable fact which happened to an aggregate.
 *
 * <p>Events are the only durable record of the system state: they are never mutated or deleted
 * once appended to the {@link io.github.suppierk.es.store.EventStore}.
 *
 * <p>Timestamps are truncated to milliseconds so that the value survives a round trip through any
 * supported database without losing precision.
 *
 * @param messageId unique identifier of this event
 * @param createdAt when this event occurred
 * @param aggregateId identity of the aggregate, which is also the stream identity
 * @param aggregateType name of the {@link AggregateType} which produced this event
 * @param version sequence number of this event within the stream, starting from {@code 1}
 * @param eventType tag describing the kind of this event
 * @param payload data describing what happened
 * @param <P> type of the payload
 */
public record DomainEvent<P extends EventPayload>(
    UUID messageId,
    Instant createdAt,
    UUID aggregateId,
    String aggregateType,
    long version,
    EventType<P> eventType,
    P payload)
    implements DomainMessage {
  public DomainEvent {
    if (messageId == null) {
      throw new IllegalArgumentException("Event message ID cannot be null");
    }

    if (createdAt == null) {
      throw new IllegalArgumentException("Event creation time cannot be null");
    }

    if (aggregateId == null) {
      throw new IllegalArgumentException("Event aggregate ID cannot be null");
    }

    if (aggregateType == null || aggregateType.isBlank()) {
      throw new IllegalArgumentException("Event aggregate type cannot be null or blank");
    }

    if (version < 1) {
      throw new IllegalArgumentException(
          "Event version must be positive, got %d".formatted(version));
    }

    if (eventType == null) {
      throw new IllegalArgumentException("Event type cannot be null");
    }

    if (!eventType.payloadClass().isInstance(payload)) {
      throw new IllegalArgumentException(
          "Payload of '%s' event must be an instance of %s"
              .formatted(eventType.name(), eventType.payloadClass().getName()));
    }
  }

  /**
   * Creates a new event which just occurred, assigning a random message ID and current time.
   *
   * @param aggregateId identity of the aggregate
   * @param aggregateType name of the {@link AggregateType}
   * @param version sequence number of this event within the stream
   * @param eventType tag describing the kind of this event
   * @param payload data describing what happened
   * @return a new event
   * @param <P> type of the payload
   */
  public static <P extends EventPayload> DomainEvent<P> occurred(
      UUID aggregateId, String aggregateType, long version, EventType<P> eventType, P payload) {
    return new DomainEvent<>(
        UUID.randomUUID(),
        Instant.now().truncatedTo(ChronoUnit.MILLIS),
        aggregateId,
        aggregateType,
        version,
        eventType,
        payload);
  }
}
