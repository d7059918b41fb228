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

import java.io.Serial;

/**
 * Thrown by {@link CommandBus} when a command arrives for which no {@link DomainCommandHandler} was
 * registered.
 *
 * <p>Extends {@link UnsupportedOperationException} since the bus simply cannot provide the
 * requested service.
 */
public class NoHandlerRegisteredException extends UnsupportedOperationException {
  @Serial private static final long serialVersionUID = -1760853345361725214L;

  private final Class<?> messageClass;

  /**
   * @param messageClass for which no handler exists
   */
  public NoHandlerRegisteredException(Class<?> messageClass) {
    super("No handler registered for '%s'".formatted(messageClass.getName()));
    this.messageClass = messageClass;
  }

  public Class<?> getMessageClass() {
    return messageClass;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/501">501 Not
   *     Implemented</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 501;
  }
}
