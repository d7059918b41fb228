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

/**
 * Reacts to a committed {@link DomainEvent}.
 *
 * <p>The same contract serves two roles in {@link EventRouter}:
 *
 * <ul>
 *   <li><b>projectors</b> build read-optimized state and always run first;
 *   <li><b>listeners</b> perform side effects, such as notifications, and may rely on projections
 *       being up to date.
 * </ul>
 *
 * <p>Handlers run synchronously within the command which produced the event. The event is already
 * durable at that point, so a failing handler does not undo it.
 *
 * @param <P> type of the event payload
 */
@FunctionalInterface
public interface DomainEventHandler<P extends EventPayload> {
  /**
   * @param event which was committed to the event store
   * @throws Exception if handling failed, which aborts the remaining handlers for this event
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  void handle(final DomainEvent<P> event) throws Exception;
}
