package io.github.suppierk.es.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.Widget;
import io.github.suppierk.test.WidgetEvent;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AggregateTypeTest {
  @Test
  void when_event_types_are_declared_they_must_be_resolvable_by_name() {
    assertEquals("widget", Widget.TYPE.name());
    assertEquals(Widget.class, Widget.TYPE.aggregateClass());
    assertEquals(List.of(Widget.CREATED, Widget.RENAMED), List.copyOf(Widget.TYPE.eventTypes()));
    assertEquals(Widget.RENAMED, Widget.TYPE.eventType("WidgetRenamed").orElseThrow());
    assertTrue(Widget.TYPE.eventType("WidgetDeleted").isEmpty());
  }

  @Test
  void when_event_type_has_same_name_but_other_payload_it_is_not_declared() {
    assertTrue(Widget.TYPE.declares(Widget.CREATED));
    assertTrue(Widget.TYPE.declares(EventType.of("WidgetCreated", WidgetEvent.Created.class)));
    assertFalse(Widget.TYPE.declares(EventType.of("WidgetCreated", WidgetEvent.Renamed.class)));
    assertFalse(Widget.TYPE.declares(null));
  }

  @Test
  void when_arguments_are_invalid_illegal_argument_must_be_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AggregateType.<Widget, WidgetEvent>of(
                " ", Widget.class, () -> null, List.of(Widget.CREATED)));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AggregateType.<Widget, WidgetEvent>of(
                "widget", null, () -> null, List.of(Widget.CREATED)));
    assertThrows(
        IllegalArgumentException.class,
        () -> AggregateType.<Widget, WidgetEvent>of("widget", Widget.class, null, List.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> AggregateType.<Widget, WidgetEvent>of("widget", Widget.class, () -> null, List.of()));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AggregateType.<Widget, WidgetEvent>of(
                "widget",
                Widget.class,
                () -> null,
                List.of(Widget.CREATED, EventType.of("WidgetCreated", WidgetEvent.Renamed.class))));
  }

  @Test
  void when_factory_misbehaves_illegal_state_must_be_thrown() {
    final AggregateType<Widget, WidgetEvent> returnsNull =
        AggregateType.of("widget", Widget.class, () -> null, List.of(Widget.CREATED));
    final AggregateType<Widget, WidgetEvent> returnsUsed =
        AggregateType.of(
            "widget",
            Widget.class,
            () -> Widget.create(UUID.randomUUID(), "used"),
            List.of(Widget.CREATED));

    assertThrows(IllegalStateException.class, returnsNull::newInstance);
    assertThrows(IllegalStateException.class, returnsUsed::newInstance);
  }

  @Test
  void when_history_is_empty_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> Widget.TYPE.reconstitute(List.of()));
    assertThrows(IllegalArgumentException.class, () -> Widget.TYPE.reconstitute(null));
  }

  @Test
  void when_history_belongs_to_another_aggregate_type_illegal_state_must_be_thrown() {
    final var id = UUID.randomUUID();
    final DomainEvent<WidgetEvent.Created> foreign =
        DomainEvent.occurred(id, "gadget", 1L, Widget.CREATED, new WidgetEvent.Created(id, "x"));

    assertThrows(IllegalStateException.class, () -> Widget.TYPE.reconstitute(List.of(foreign)));
  }
}
