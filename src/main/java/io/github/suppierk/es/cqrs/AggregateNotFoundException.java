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
import java.util.UUID;

/** Thrown when an aggregate is requested, but its stream has no events. */
public class AggregateNotFoundException extends RuntimeException {
  @Serial private static final long serialVersionUID = 5532078318427694961L;

  private final UUID aggregateId;
  private final String aggregateType;

  /**
   * @param aggregateId which was requested
   * @param aggregateType name of the aggregate type which was requested
   */
  public AggregateNotFoundException(UUID aggregateId, String aggregateType) {
    super("Aggregate '%s' of type '%s' does not exist".formatted(aggregateId, aggregateType));
    this.aggregateId = aggregateId;
    this.aggregateType = aggregateType;
  }

  public UUID getAggregateId() {
    return aggregateId;
  }

  public String getAggregateType() {
    return aggregateType;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/404">404 Not Found</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 404;
  }
}
