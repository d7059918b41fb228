package io.github.suppierk.es.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.es.cqrs.EventPayload;
import io.github.suppierk.es.cqrs.EventType;
import io.github.suppierk.es.store.EventStoreException;
import io.github.suppierk.test.Widget;
import io.github.suppierk.test.WidgetEvent;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class JacksonEventPayloadSerializerTest {
  private final JacksonEventPayloadSerializer serializer = new JacksonEventPayloadSerializer();

  record Scheduled(UUID id, Instant at) implements EventPayload {}

  /** Jackson has nothing to serialize here. */
  static final class Opaque implements EventPayload {
    private final Object secret = new Object();
  }

  @Test
  void when_payload_is_serialized_it_must_be_restored_by_event_type() {
    final var payload = new WidgetEvent.Created(UUID.randomUUID(), "gear");

    final var json = serializer.serialize(payload);

    assertTrue(json.contains("\"name\":\"gear\""));
    assertEquals(payload, serializer.deserialize(Widget.CREATED, json));
  }

  @Test
  void when_payload_has_time_it_must_be_written_as_iso_text() {
    final var payload = new Scheduled(UUID.randomUUID(), Instant.parse("2024-05-01T10:15:30.123Z"));
    final var type = EventType.of("Scheduled", Scheduled.class);

    final var json = serializer.serialize(payload);

    assertTrue(json.contains("2024-05-01T10:15:30.123Z"));
    assertEquals(payload, serializer.deserialize(type, json));
  }

  @Test
  void when_stored_payload_has_extra_properties_they_must_be_ignored() {
    final var id = UUID.randomUUID();
    final var json = "{\"id\":\"%s\",\"name\":\"gear\",\"color\":\"red\"}".formatted(id);

    assertEquals(
        new WidgetEvent.Created(id, "gear"), serializer.deserialize(Widget.CREATED, json));
  }

  @Test
  void when_stored_payload_is_malformed_event_store_exception_must_be_thrown() {
    assertThrows(
        EventStoreException.class, () -> serializer.deserialize(Widget.CREATED, "{not json"));
  }

  @Test
  void when_payload_cannot_be_serialized_event_store_exception_must_be_thrown() {
    final var opaque = new Opaque();

    assertThrows(EventStoreException.class, () -> serializer.serialize(opaque));
  }

  @Test
  void when_arguments_are_null_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> serializer.serialize(null));
    assertThrows(IllegalArgumentException.class, () -> serializer.deserialize(null, "{}"));
    assertThrows(
        IllegalArgumentException.class, () -> serializer.deserialize(Widget.CREATED, null));
    assertThrows(
        IllegalArgumentException.class, () -> new JacksonEventPayloadSerializer((ObjectMapper) null));
  }

  @Test
  void when_default_mapper_is_built_it_is_not_shared() {
    assertFalse(
        JacksonEventPayloadSerializer.defaultObjectMapper()
            == JacksonEventPayloadSerializer.defaultObjectMapper());
  }
}
