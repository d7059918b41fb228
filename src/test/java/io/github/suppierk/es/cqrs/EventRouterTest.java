package io.github.suppierk.es.cqrs;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.Widget;
import io.github.suppierk.test.WidgetEvent;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventRouterTest {
  private static DomainEvent<WidgetEvent.Created> created() {
    final var id = UUID.randomUUID();
    return DomainEvent.occurred(
        id, Widget.TYPE.name(), 1L, Widget.CREATED, new WidgetEvent.Created(id, "gear"));
  }

  @Nested
  class Registration {
    @Test
    void when_arguments_are_null_illegal_argument_must_be_thrown() {
      final var builder = EventRouter.builder();

      assertThrows(
          IllegalArgumentException.class, () -> builder.registerProjector(null, event -> {}));
      assertThrows(
          IllegalArgumentException.class, () -> builder.registerProjector(Widget.CREATED, null));
      assertThrows(
          IllegalArgumentException.class, () -> builder.registerListener(null, event -> {}));
      assertThrows(
          IllegalArgumentException.class, () -> builder.registerListener(Widget.CREATED, null));
    }

    @Test
    void when_router_is_built_later_registrations_must_not_affect_it() {
      final var builder = EventRouter.builder();
      final DomainEventHandler<WidgetEvent.Created> projector = event -> {};
      builder.registerProjector(Widget.CREATED, projector);

      final var router = builder.build();
      builder.registerListener(Widget.RENAMED, event -> {});

      assertEquals(List.of(projector), router.getProjectors(Widget.CREATED));
      assertTrue(router.getListeners(Widget.RENAMED).isEmpty());
      assertEquals(Set.of(Widget.CREATED), router.getSupportedEventTypes());
      assertThrows(
          UnsupportedOperationException.class,
          () -> router.getProjectors(Widget.CREATED).add(event -> {}));
    }
  }

  @Nested
  class Dispatching {
    @Test
    void when_event_is_dispatched_projectors_run_before_listeners_in_registration_order() {
      final List<String> calls = new ArrayList<>();

      final var router =
          EventRouter.builder()
              .registerListener(Widget.CREATED, event -> calls.add("L1"))
              .registerProjector(Widget.CREATED, event -> calls.add("P1"))
              .registerListener(Widget.CREATED, event -> calls.add("L2"))
              .registerProjector(Widget.CREATED, event -> calls.add("P2"))
              .registerProjector(Widget.RENAMED, event -> calls.add("other"))
              .build();

      router.dispatch(created());

      assertEquals(List.of("P1", "P2", "L1", "L2"), calls);
    }

    @Test
    void when_handler_receives_event_it_must_be_the_dispatched_one() {
      final var event = created();
      final List<DomainEvent<WidgetEvent.Created>> received = new ArrayList<>();

      EventRouter.builder().registerListener(Widget.CREATED, received::add).build().dispatch(event);

      assertEquals(1, received.size());
      assertSame(event, received.get(0));
    }

    @Test
    void when_no_handlers_are_registered_dispatch_is_a_no_op() {
      assertDoesNotThrow(() -> EventRouter.empty().dispatch(created()));
      assertTrue(EventRouter.empty().getSupportedEventTypes().isEmpty());
    }

    @Test
    void when_event_is_null_illegal_argument_must_be_thrown() {
      assertThrows(IllegalArgumentException.class, () -> EventRouter.empty().dispatch(null));
    }

    @Test
    void when_projector_fails_remaining_handlers_must_not_run() {
      final List<String> calls = new ArrayList<>();
      final var failure = new IllegalStateException("projection broken");

      final var router =
          EventRouter.builder()
              .registerProjector(Widget.CREATED, event -> calls.add("P1"))
              .registerProjector(
                  Widget.CREATED,
                  event -> {
                    throw failure;
                  })
              .registerProjector(Widget.CREATED, event -> calls.add("P3"))
              .registerListener(Widget.CREATED, event -> calls.add("L1"))
              .build();

      final var event = created();
      final var thrown = assertThrows(IllegalStateException.class, () -> router.dispatch(event));

      assertSame(failure, thrown);
      assertEquals(List.of("P1"), calls);
    }

    @Test
    void when_listener_fails_with_checked_exception_it_must_be_wrapped() {
      final var failure = new IOException("mail server down");

      final var router =
          EventRouter.builder()
              .registerListener(
                  Widget.CREATED,
                  event -> {
                    throw failure;
                  })
              .build();

      final var event = created();
      final var thrown = assertThrows(DomainHandlerException.class, () -> router.dispatch(event));

      assertInstanceOf(IOException.class, thrown.getCause());
      assertSame(failure, thrown.getCause());
    }
  }
}
