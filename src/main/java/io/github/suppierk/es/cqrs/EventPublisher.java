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

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges the event store and the {@link EventRouter}: events persisted by {@link
 * AggregateRepository#save(AggregateRoot)} are handed over one by one, strictly in the order they
 * were persisted, waiting for each to be fully dispatched before the next one.
 *
 * <p>No delivery checkpoint is kept. If the process stops after the events were committed, but
 * before dispatching finished, the remaining events are not redelivered.
 */
public final class EventPublisher extends Suspicious {
  private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

  private final EventRouter eventRouter;

  /**
   * @param eventRouter to forward events to
   * @throws IllegalArgumentException if the router is {@code null}
   */
  public EventPublisher(final EventRouter eventRouter) {
    this.eventRouter = throwIllegalArgumentIfNull(eventRouter, "Event router");
  }

  /**
   * @return a publisher which forwards events to a router without handlers
   */
  public static EventPublisher empty() {
    return new EventPublisher(EventRouter.empty());
  }

  /**
   * @param events which were just persisted, oldest first
   * @throws IllegalArgumentException if events are {@code null}
   */
  public void publish(final List<? extends DomainEvent<?>> events) {
    final List<? extends DomainEvent<?>> nonNullEvents = throwIllegalArgumentIfNull(events, "Events");

    for (DomainEvent<?> event : nonNullEvents) {
      eventRouter.dispatch(event);
    }

    if (!nonNullEvents.isEmpty()) {
      logger.debug("Published {} events", nonNullEvents.size());
    }
  }
}
