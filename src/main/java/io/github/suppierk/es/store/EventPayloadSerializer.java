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

import io.github.suppierk.es.cqrs.EventPayload;
import io.github.suppierk.es.cqrs.EventType;

/**
 * Converts {@link EventPayload}s to and from a self-describing textual form.
 *
 * <p>The {@link EventStore} treats the serialized form as opaque.
 */
public interface EventPayloadSerializer {
  /**
   * @param payload to serialize
   * @return textual form of the payload
   * @throws EventStoreException if the payload cannot be serialized
   */
  String serialize(final EventPayload payload);

  /**
   * @param eventType describing which payload class to produce
   * @param serialized textual form previously produced by {@link #serialize(EventPayload)}
   * @param <P> type of the payload
   * @return restored payload
   * @throws EventStoreException if the payload cannot be deserialized
   */
  <P extends EventPayload> P deserialize(final EventType<P> eventType, final String serialized);
}
