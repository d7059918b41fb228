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

import java.util.UUID;

/**
 * Represents an immutable command which must update the underlying aggregate as per CQRS paradigm.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Check In Person' instead of 'Set
 * Building occupants to X'.
 *
 * <p>Commands are routed by their class: exactly one {@link DomainCommandHandler} can be registered
 * for a command class in a {@link CommandBus}.
 *
 * <p>An aggregate is either being born or being changed, so we leverage Java {@code sealed}
 * feature, enforcing users to pick one of the two rather than defining a command completely on
 * their own.
 */
// @formatter:off
public sealed interface DomainCommand extends DomainMessage
permits
  DomainCommand.Create, DomainCommand.Update
{
// @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to create a new
   * aggregate in the system.
   *
   * <p>Identity of the new aggregate is decided by the command payload, typically supplied by the
   * caller.
   */
  non-sealed interface Create extends DomainCommand {}

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to change an
   * existing aggregate in the system.
   */
  non-sealed interface Update extends DomainCommand {

    /**
     * @return identity of the aggregate this command targets
     */
    UUID aggregateId();
  }
}
