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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers a committed {@link DomainEvent} to the {@link DomainEventHandler}s registered for its
 * {@link EventType}.
 *
 * <p>For every event all projectors run first, in registration order, followed by all listeners,
 * in registration order. Delivery is fail-fast: the first handler to fail aborts the remaining ones
 * and its exception reaches the caller. Events without any handlers are silently ignored.
 *
 * <p>Handlers are registered through {@link Builder} once at startup. The router itself is
 * immutable and can be shared between threads without synchronization.
 */
public final class EventRouter extends Suspicious {
  private static final Logger logger = LoggerFactory.getLogger(EventRouter.class);

  private final Map<EventType<?>, List<DomainEventHandler<?>>> projectors;
  private final Map<EventType<?>, List<DomainEventHandler<?>>> listeners;

  private EventRouter(
      final Map<EventType<?>, List<DomainEventHandler<?>>> projectors,
      final Map<EventType<?>, List<DomainEventHandler<?>>> listeners) {
    this.projectors = immutableCopy(projectors);
    this.listeners = immutableCopy(listeners);
  }

  /**
   * @return a new builder to register handlers with
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return a router without any handlers
   */
  public static EventRouter empty() {
    return builder().build();
  }

  /**
   * Invokes projectors and then listeners registered for the event type.
   *
   * @param event to deliver
   * @throws IllegalArgumentException if the event is {@code null}
   * @throws DomainHandlerException if a handler failed with a checked exception
   */
  public void dispatch(final DomainEvent<?> event) {
    route(throwIllegalArgumentIfNull(event, "Event"));
  }

  /**
   * @param eventType to look up
   * @return projectors registered for the event type, in invocation order
   */
  public List<DomainEventHandler<?>> getProjectors(final EventType<?> eventType) {
    return projectors.getOrDefault(eventType, List.of());
  }

  /**
   * @param eventType to look up
   * @return listeners registered for the event type, in invocation order
   */
  public List<DomainEventHandler<?>> getListeners(final EventType<?> eventType) {
    return listeners.getOrDefault(eventType, List.of());
  }

  /**
   * @return event types having at least one projector or listener
   */
  public Set<EventType<?>> getSupportedEventTypes() {
    final Set<EventType<?>> eventTypes = new HashSet<>(projectors.keySet());
    eventTypes.addAll(listeners.keySet());
    return Collections.unmodifiableSet(eventTypes);
  }

  private <P extends EventPayload> void route(final DomainEvent<P> event) {
    final List<DomainEventHandler<?>> eventProjectors = getProjectors(event.eventType());
    final List<DomainEventHandler<?>> eventListeners = getListeners(event.eventType());

    if (eventProjectors.isEmpty() && eventListeners.isEmpty()) {
      logger.trace("No handlers for '{}' event {}", event.eventType(), event.messageId());
      return;
    }

    logger.debug(
        "Dispatching '{}' event {} to {} projectors and {} listeners",
        event.eventType(),
        event.messageId(),
        eventProjectors.size(),
        eventListeners.size());

    for (DomainEventHandler<?> projector : eventProjectors) {
      invoke(projector, event);
    }

    for (DomainEventHandler<?> listener : eventListeners) {
      invoke(listener, event);
    }
  }

  /**
   * Handlers are stored per {@link EventType}, and {@link Builder} accepts only handlers matching
   * the payload type of the event type, which makes the cast safe.
   */
  @SuppressWarnings("unchecked")
  private static <P extends EventPayload> void invoke(
      final DomainEventHandler<?> handler, final DomainEvent<P> event) {
    try {
      ((DomainEventHandler<P>) handler).handle(event);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new DomainHandlerException(
          "Handler of '%s' event %s failed".formatted(event.eventType(), event.messageId()), e);
    }
  }

  private static Map<EventType<?>, List<DomainEventHandler<?>>> immutableCopy(
      final Map<EventType<?>, List<DomainEventHandler<?>>> handlers) {
    final Map<EventType<?>, List<DomainEventHandler<?>>> copy = new LinkedHashMap<>();
    handlers.forEach((eventType, list) -> copy.put(eventType, List.copyOf(list)));
    return Collections.unmodifiableMap(copy);
  }

  /** Collects projectors and listeners before the {@link EventRouter} is built. */
  public static final class Builder extends Suspicious {
    private final Map<EventType<?>, List<DomainEventHandler<?>>> projectors;
    private final Map<EventType<?>, List<DomainEventHandler<?>>> listeners;

    private Builder() {
      this.projectors = new LinkedHashMap<>();
      this.listeners = new LinkedHashMap<>();
    }

    /**
     * Adds a projector which runs before any listener of the same event type.
     *
     * @param eventType to react to
     * @param projector to invoke
     * @param <P> type of the event payload
     * @return this builder
     * @throws IllegalArgumentException if any argument is {@code null}
     */
    public <P extends EventPayload> Builder registerProjector(
        final EventType<P> eventType, final DomainEventHandler<P> projector) {
      register(projectors, eventType, projector, "Projector");
      return this;
    }

    /**
     * Adds a listener which runs after all projectors of the same event type.
     *
     * @param eventType to react to
     * @param listener to invoke
     * @param <P> type of the event payload
     * @return this builder
     * @throws IllegalArgumentException if any argument is {@code null}
     */
    public <P extends EventPayload> Builder registerListener(
        final EventType<P> eventType, final DomainEventHandler<P> listener) {
      register(listeners, eventType, listener, "Listener");
      return this;
    }

    /**
     * @return an immutable router with handlers registered so far
     */
    public EventRouter build() {
      return new EventRouter(projectors, listeners);
    }

    private void register(
        final Map<EventType<?>, List<DomainEventHandler<?>>> handlers,
        final EventType<?> eventType,
        final DomainEventHandler<?> handler,
        final String role) {
      final EventType<?> nonNullEventType = throwIllegalArgumentIfNull(eventType, "Event type");
      final DomainEventHandler<?> nonNullHandler = throwIllegalArgumentIfNull(handler, role);

      handlers.computeIfAbsent(nonNullEventType, ignored -> new ArrayList<>()).add(nonNullHandler);
    }
  }
}
