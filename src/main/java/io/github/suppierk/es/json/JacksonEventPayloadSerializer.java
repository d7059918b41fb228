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

package io.github.suppierk.es.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.suppierk.es.cqrs.EventPayload;
import io.github.suppierk.es.cqrs.EventType;
import io.github.suppierk.es.store.EventPayloadSerializer;
import io.github.suppierk.es.store.EventStoreException;

/**
 * Stores {@link EventPayload}s as JSON documents.
 *
 * <p>Payload class is not written into the document: it is resolved from the {@link EventType}
 * persisted next to it, so payload classes can be moved between packages freely.
 */
public final class JacksonEventPayloadSerializer implements EventPayloadSerializer {
  private final ObjectMapper objectMapper;

  /** Creates a serializer with the default {@link ObjectMapper} configuration. */
  public JacksonEventPayloadSerializer() {
    this(defaultObjectMapper());
  }

  /**
   * @param objectMapper to use, must be able to handle all payload records
   * @throws IllegalArgumentException if object mapper is {@code null}
   */
  public JacksonEventPayloadSerializer(final ObjectMapper objectMapper) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("ObjectMapper cannot be null");
    }

    this.objectMapper = objectMapper;
  }

  /**
   * @return a mapper which writes dates as ISO-8601 strings and tolerates payload fields removed
   *     from the code since the event was stored
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /** {@inheritDoc} */
  @Override
  public String serialize(final EventPayload payload) {
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }

    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new EventStoreException(
          "Cannot serialize payload %s".formatted(payload.getClass().getName()), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public <P extends EventPayload> P deserialize(
      final EventType<P> eventType, final String serialized) {
    if (eventType == null) {
      throw new IllegalArgumentException("Event type cannot be null");
    }

    if (serialized == null) {
      throw new IllegalArgumentException("Serialized payload cannot be null");
    }

    try {
      return objectMapper.readValue(serialized, eventType.payloadClass());
    } catch (JsonProcessingException e) {
      throw new EventStoreException(
          "Cannot deserialize payload of '%s' event".formatted(eventType.name()), e);
    }
  }
}
