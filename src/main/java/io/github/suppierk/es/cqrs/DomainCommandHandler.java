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
import java.util.UUID;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Obtain the aggregate - either create a new one or load it from the {@link
 *       AggregateRepository}.
 *   <li>Invoke aggregate behavior, recording new events.
 *   <li>Save the aggregate, which persists and publishes the events.
 * </ul>
 *
 * <p>Because {@link DomainCommand} leverages new Java {@code sealed} feature, for more type safety
 * this class also makes use of the same feature.
 *
 * <p>Exceptions thrown by the business logic are propagated to the caller of {@link
 * CommandBus#dispatch(DomainCommand)}: unchecked ones as is, checked ones wrapped into {@link
 * DomainHandlerException}. No retries are performed - in case of {@link
 * ConcurrencyConflictException} the caller decides whether to dispatch the command again.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<COMMAND extends DomainCommand>
extends
        Suspicious
permits
  DomainCommandHandler.Create, DomainCommandHandler.Update
{
// @formatter:on
  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * Returns the class type of the command being handled by this {@link DomainCommandHandler}.
   *
   * @return the class type of the command
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Executes the core logic of the command.
   *
   * @param command being executed
   * @throws Exception if the business logic failed
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract void internalHandle(final COMMAND command) throws Exception;

  /**
   * Executes the given command.
   *
   * @param command to be executed
   * @throws IllegalArgumentException if the command is null
   * @throws DomainHandlerException if the business logic failed with a checked exception
   */
  final void handle(final COMMAND command) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    try {
      internalHandle(nonNullCommand);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new DomainHandlerException(
          "Handler of '%s' command %s failed"
              .formatted(commandClass.getSimpleName(), nonNullCommand.messageId()),
          e);
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   * @param <A> the aggregate class
   * @param <E> the sealed family of payloads the aggregate produces
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create,
    A extends AggregateRoot<E>,
    E extends EventPayload
  > extends DomainCommandHandler<CREATE> {
  // @formatter:on
    private final AggregateRepository<A, E> repository;

    protected Create(final Class<CREATE> commandClass, final AggregateRepository<A, E> repository) {
      super(commandClass);
      this.repository = throwIllegalArgumentIfNull(repository, "Aggregate repository");
    }

    /**
     * Business logic to build a brand-new aggregate, which must record at least one event.
     *
     * @param command containing the data required to create the aggregate
     * @return the new aggregate with pending events
     * @throws Exception if any error occurs during the execution of the command
     * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
     *     more flexibility</a>
     */
    @SuppressWarnings("squid:S112")
    protected abstract A createAggregate(final CREATE command) throws Exception;

    /** {@inheritDoc} */
    @Override
    protected final void internalHandle(final CREATE command) throws Exception {
      final A aggregate = throwIllegalStateIfNull(createAggregate(command), "New aggregate");

      if (!aggregate.hasPendingEvents() || aggregate.version() != aggregate.pendingEvents().size()) {
        throw new IllegalStateException(
            "New aggregate must only have pending events, got version %d"
                .formatted(aggregate.version()));
      }

      repository.save(aggregate);
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Update}.
   *
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <A> the aggregate class
   * @param <E> the sealed family of payloads the aggregate produces
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update,
    A extends AggregateRoot<E>,
    E extends EventPayload
  > extends DomainCommandHandler<UPDATE> {
  // @formatter:on
    private final AggregateRepository<A, E> repository;

    protected Update(final Class<UPDATE> commandClass, final AggregateRepository<A, E> repository) {
      super(commandClass);
      this.repository = throwIllegalArgumentIfNull(repository, "Aggregate repository");
    }

    /**
     * Business logic to change an existing aggregate by invoking its behavior methods.
     *
     * @param command containing the data required to change the aggregate
     * @param aggregate loaded from its history
     * @throws Exception if any error occurs during the execution of the command
     * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
     *     more flexibility</a>
     */
    @SuppressWarnings("squid:S112")
    protected abstract void updateAggregate(final UPDATE command, final A aggregate)
        throws Exception;

    /** {@inheritDoc} */
    @Override
    protected final void internalHandle(final UPDATE command) throws Exception {
      final UUID aggregateId = throwIllegalStateIfNull(command.aggregateId(), "Command's aggregate ID");
      final A aggregate = repository.load(aggregateId);

      updateAggregate(command, aggregate);

      repository.save(aggregate);
    }
  }
}
