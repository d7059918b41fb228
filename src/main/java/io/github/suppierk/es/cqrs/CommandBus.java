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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes every {@link DomainCommand} to the single {@link DomainCommandHandler} registered for its
 * class and runs it synchronously.
 *
 * <p>{@link #dispatch(DomainCommand)} returns only when the handler, the persistence of the
 * resulting events and their delivery to projectors and listeners are all done. Any failure along
 * the way - {@link AggregateNotFoundException}, {@link ConcurrencyConflictException}, storage or
 * handler errors - reaches the caller unchanged. The bus never retries.
 *
 * <p>Handlers are registered through {@link Builder} once at startup; the bus itself is immutable
 * and can be shared between threads.
 */
public final class CommandBus extends Suspicious {
  private static final Logger logger = LoggerFactory.getLogger(CommandBus.class);

  private final Map<Class<? extends DomainCommand>, DomainCommandHandler<?>> commandHandlers;

  private CommandBus(
      final Map<Class<? extends DomainCommand>, DomainCommandHandler<?>> commandHandlers) {
    this.commandHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(commandHandlers));
  }

  /**
   * @return a new builder to register handlers with
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return command classes this bus can dispatch
   */
  public Set<Class<? extends DomainCommand>> getSupportedCommandClasses() {
    return commandHandlers.keySet();
  }

  /**
   * Runs the handler registered for the command.
   *
   * @param command to execute
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws NoHandlerRegisteredException if no handler exists for the command class
   */
  public void dispatch(final DomainCommand command) {
    final DomainCommand nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler<?> handler = commandHandlers.get(nonNullCommand.getClass());

    if (handler == null) {
      throw new NoHandlerRegisteredException(nonNullCommand.getClass());
    }

    logger.debug(
        "Dispatching '{}' command {}",
        nonNullCommand.getClass().getSimpleName(),
        nonNullCommand.messageId());

    invoke(handler, nonNullCommand);
  }

  private static <C extends DomainCommand> void invoke(
      final DomainCommandHandler<C> handler, final DomainCommand command) {
    handler.handle(handler.getCommandClass().cast(command));
  }

  /** Collects command handlers before the {@link CommandBus} is built. */
  public static final class Builder extends Suspicious {
    private final Map<Class<? extends DomainCommand>, DomainCommandHandler<?>> commandHandlers;

    private Builder() {
      this.commandHandlers = new LinkedHashMap<>();
    }

    /**
     * @param commandClass to route
     * @param commandHandler to route the command class to
     * @param <C> type of the command
     * @return this builder
     * @throws IllegalArgumentException if any argument is {@code null} or the handler is declared
     *     for another command class
     * @throws IllegalStateException if a handler for the command class is already registered
     */
    public <C extends DomainCommand> Builder registerCommandHandler(
        final Class<C> commandClass, final DomainCommandHandler<C> commandHandler) {
      final Class<C> nonNullCommandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
      final DomainCommandHandler<C> nonNullCommandHandler =
          throwIllegalArgumentIfNull(commandHandler, "Command handler");

      if (!nonNullCommandClass.equals(nonNullCommandHandler.getCommandClass())) {
        throw new IllegalArgumentException(
            "Handler of '%s' cannot be registered for '%s'"
                .formatted(
                    nonNullCommandHandler.getCommandClass().getSimpleName(),
                    nonNullCommandClass.getSimpleName()));
      }

      if (commandHandlers.containsKey(nonNullCommandClass)) {
        throw new IllegalStateException(
            "Handler for '%s' command already registered"
                .formatted(nonNullCommandClass.getSimpleName()));
      }

      commandHandlers.put(nonNullCommandClass, nonNullCommandHandler);
      return this;
    }

    /**
     * @return an immutable bus with handlers registered so far
     */
    public CommandBus build() {
      return new CommandBus(commandHandlers);
    }
  }
}
