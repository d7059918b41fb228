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
 * Wraps checked exceptions thrown by user-supplied command or event handlers.
 *
 * <p>Unchecked exceptions thrown by handlers are never wrapped and reach the caller as is.
 */
public class DomainHandlerException extends RuntimeException {
  @Serial private static final long serialVersionUID = 8046245305924916130L;

  /**
   * @param message the detail message
   * @param cause thrown by the handler
   */
  public DomainHandlerException(String message, Throwable cause) {
    super(message, cause);
  }
}
