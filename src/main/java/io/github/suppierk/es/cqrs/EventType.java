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

import java.io.Serializable;

/**
 * Explicit tag of a {@link DomainEvent} kind.
 *
 * <p>Event types are declared once, as constants next to the payload they describe, and then used
 * in three places:
 *
 * <ul>
 *   <li>by the aggregate when it records a new event;
 *   <li>by {@link EventRouter} as a routing key for projectors and listeners;
 *   <li>by the event store which persists {@link #name()} and resolves it back through {@link
 *       AggregateType#eventType(String)} when loading.
 * </ul>
 *
 * <p>The {@link #name()} becomes part of the persisted data and therefore must never change once
 * events with it were stored.
 *
 * @param name stable identifier of the event kind
 * @param payloadClass class of the payload carried by events of this kind
 * @param <P> type of the payload
 */
public record EventType<P extends EventPayload>(String name, Class<P> payloadClass)
    implements Serializable {
  public EventType {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Event type name cannot be null or blank");
    }

    if (payloadClass == null) {
      throw new IllegalArgumentException("Event payload class cannot be null");
    }
  }

  /**
   * @param name stable identifier of the event kind
   * @param payloadClass class of the payload carried by events of this kind
   * @return a new event type
   * @param <P> type of the payload
   */
  public static <P extends EventPayload> EventType<P> of(String name, Class<P> payloadClass) {
    return new EventType<>(name, payloadClass);
  }

  @Override
  public String toString() {
    return name;
  }
}
