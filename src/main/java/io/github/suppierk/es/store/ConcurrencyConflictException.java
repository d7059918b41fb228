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

package io.github.suppierk.es.store;

import java.io.Serial;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Thrown when an append to the {@link EventStore} lost the race against another writer of the same
 * stream.
 *
 * <p>The stream is left untouched. Callers are expected to either reload the aggregate and retry
 * the command or fail it.
 */
public class ConcurrencyConflictException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4406316511352866243L;

  private final UUID streamId;
  private final String aggregateType;
  private final long expectedVersion;
  private final Long actualVersion;

  /**
   * Constructs an exception for a stream which was observed at a different version.
   *
   * @param streamId identity of the aggregate
   * @param aggregateType name of the aggregate type
   * @param expectedVersion the writer expected
   * @param actualVersion the stream was at
   */
  public ConcurrencyConflictException(
      UUID streamId, String aggregateType, long expectedVersion, long actualVersion) {
    super(
        "Stream '%s' of '%s' is at version %d, expected %d"
            .formatted(streamId, aggregateType, actualVersion, expectedVersion));
    this.streamId = streamId;
    this.aggregateType = aggregateType;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  /**
   * Constructs an exception for a stream where a concurrent writer was detected by the storage
   * itself, so the actual version is unknown.
   *
   * @param streamId identity of the aggregate
   * @param aggregateType name of the aggregate type
   * @param expectedVersion the writer expected
   * @param cause reported by the storage
   */
  public ConcurrencyConflictException(
      UUID streamId, String aggregateType, long expectedVersion, Throwable cause) {
    super(
        "Stream '%s' of '%s' was modified concurrently, expected version %d"
            .formatted(streamId, aggregateType, expectedVersion),
        cause);
    this.streamId = streamId;
    this.aggregateType = aggregateType;
    this.expectedVersion = expectedVersion;
    this.actualVersion = null;
  }

  public UUID getStreamId() {
    return streamId;
  }

  public String getAggregateType() {
    return aggregateType;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return the version the stream was observed at, if known
   */
  public OptionalLong getActualVersion() {
    return actualVersion == null ? OptionalLong.empty() : OptionalLong.of(actualVersion);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
