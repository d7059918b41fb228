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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Describes one aggregate variant known to the system:
 *
 * <ul>
 *   <li>a stable {@link #name()} persisted alongside every event of the aggregate;
 *   <li>a factory creating a zero-value instance, used before replaying history;
 *   <li>a closed set of {@link EventType}s the aggregate can produce, used to resolve persisted event
 *       tags back to payload classes.
 * </ul>
 *
 * @param <A> the aggregate class
 * @param <E> the sealed family of payloads the aggregate produces
 */
public final class AggregateType<A extends AggregateRoot<E>, E extends EventPayload> {
  private final String name;
  private final Class<A> aggregateClass;
  private final Supplier<A> factory;
  private final Map<String, EventType<? extends E>> eventTypes;

  private AggregateType(
      final String name,
      final Class<A> aggregateClass,
      final Supplier<A> factory,
      final List<EventType<? extends E>> eventTypes) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Aggregate type name cannot be null or blank");
    }

    if (aggregateClass == null) {
      throw new IllegalArgumentException("Aggregate class cannot be null");
    }

    if (factory == null) {
      throw new IllegalArgumentException("Aggregate factory cannot be null");
    }

    if (eventTypes == null || eventTypes.isEmpty()) {
      throw new IllegalArgumentException("Aggregate event types cannot be null or empty");
    }

    final Map<String, EventType<? extends E>> byName = new LinkedHashMap<>();
    for (EventType<? extends E> eventType : eventTypes) {
      if (eventType == null) {
        throw new IllegalArgumentException("Aggregate event type cannot be null");
      }

      if (byName.putIfAbsent(eventType.name(), eventType) != null) {
        throw new IllegalArgumentException(
            "Event type '%s' is declared more than once for aggregate type '%s'"
                .formatted(eventType.name(), name));
      }
    }

    this.name = name;
    this.aggregateClass = aggregateClass;
    this.factory = factory;
    this.eventTypes = Collections.unmodifiableMap(byName);
  }

  /**
   * @param name stable name of the aggregate type
   * @param aggregateClass class of the aggregate
   * @param factory creating zero-value instances
   * @param eventTypes the aggregate can produce
   * @return a new aggregate type
   * @param <A> the aggregate class
   * @param <E> the sealed family of payloads the aggregate produces
   * @throws IllegalArgumentException if any argument is {@code null} or event types are duplicated
   */
  public static <A extends AggregateRoot<E>, E extends EventPayload> AggregateType<A, E> of(
      final String name,
      final Class<A> aggregateClass,
      final Supplier<A> factory,
      final List<EventType<? extends E>> eventTypes) {
    return new AggregateType<>(name, aggregateClass, factory, eventTypes);
  }

  /**
   * @return stable name of this aggregate type
   */
  public String name() {
    return name;
  }

  /**
   * @return class of the aggregate
   */
  public Class<A> aggregateClass() {
    return aggregateClass;
  }

  /**
   * @return all event types declared for this aggregate type, in declaration order
   */
  public Collection<EventType<? extends E>> eventTypes() {
    return eventTypes.values();
  }

  /**
   * @param eventName persisted tag of the event
   * @return matching event type, if declared
   */
  public Optional<EventType<? extends E>> eventType(final String eventName) {
    return Optional.ofNullable(eventTypes.get(eventName));
  }

  /**
   * @param eventType to check
   * @return {@code true} if exactly this event type is declared for this aggregate type
   */
  public boolean declares(final EventType<?> eventType) {
    return eventType != null && eventType.equals(eventTypes.get(eventType.name()));
  }

  /**
   * @return a zero-value aggregate with no identity, no history and no pending events
   * @throws IllegalStateException if the factory misbehaves
   */
  public A newInstance() {
    final A aggregate = factory.get();

    if (aggregate == null) {
      throw new IllegalStateException("Factory of aggregate type '%s' returned null".formatted(name));
    }

    if (aggregate.version() != 0L || aggregate.hasPendingEvents()) {
      throw new IllegalStateException(
          "Factory of aggregate type '%s' must return a zero-value instance".formatted(name));
    }

    return aggregate;
  }

  /**
   * Rebuilds the aggregate state by folding the given history onto a fresh instance.
   *
   * @param history of the aggregate, oldest first
   * @return the aggregate in its current state, with no pending events
   * @throws IllegalArgumentException if history is {@code null} or empty
   * @throws IllegalStateException if history belongs to another aggregate type or is out of order
   */
  public A reconstitute(final List<? extends DomainEvent<? extends E>> history) {
    if (history == null || history.isEmpty()) {
      throw new IllegalArgumentException("History cannot be null or empty");
    }

    final A aggregate = newInstance();

    for (DomainEvent<? extends E> event : history) {
      if (!name.equals(event.aggregateType())) {
        throw new IllegalStateException(
            "Event '%s' belongs to aggregate type '%s', not '%s'"
                .formatted(event.messageId(), event.aggregateType(), name));
      }

      aggregate.replay(event);
    }

    return aggregate;
  }

  @Override
  public String toString() {
    return name;
  }
}
