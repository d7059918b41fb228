package io.github.suppierk.es;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.cqrs.AggregateRepository;
import io.github.suppierk.es.cqrs.CommandBus;
import io.github.suppierk.es.cqrs.DomainCommandHandler;
import io.github.suppierk.es.cqrs.EventPublisher;
import io.github.suppierk.es.cqrs.EventRouter;
import io.github.suppierk.es.jooq.JooqEventStore;
import io.github.suppierk.es.json.JacksonEventPayloadSerializer;
import io.github.suppierk.es.store.ConcurrencyConflictException;
import io.github.suppierk.test.CreateWidget;
import io.github.suppierk.test.CreateWidgetHandler;
import io.github.suppierk.test.RenameWidget;
import io.github.suppierk.test.TestDatabase;
import io.github.suppierk.test.Widget;
import io.github.suppierk.test.WidgetEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jooq.DSLContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventSourcingScenarioTest {
  private static DSLContext dslContext;
  private static JooqEventStore eventStore;

  private Map<UUID, String> widgetNames;
  private List<String> notifications;
  private EventPublisher eventPublisher;
  private AggregateRepository<Widget, WidgetEvent> repository;

  @BeforeAll
  static void setUpDatabase() {
    dslContext = TestDatabase.create("event_sourcing_scenario_test");
    eventStore = new JooqEventStore(dslContext, new JacksonEventPayloadSerializer());
    eventStore.createSchema();
  }

  @BeforeEach
  void setUp() {
    widgetNames = new ConcurrentHashMap<>();
    notifications = new ArrayList<>();

    final var router =
        EventRouter.builder()
            .registerProjector(
                Widget.CREATED,
                event -> widgetNames.put(event.aggregateId(), event.payload().name()))
            .registerProjector(
                Widget.RENAMED,
                event -> widgetNames.put(event.aggregateId(), event.payload().name()))
            .registerListener(
                Widget.CREATED,
                event -> notifications.add("created " + widgetNames.get(event.aggregateId())))
            .build();

    eventPublisher = new EventPublisher(router);
    repository = new AggregateRepository<>(Widget.TYPE, eventStore, eventPublisher);
  }

  @AfterEach
  void tearDown() {
    TestDatabase.clear(dslContext);
  }

  @Test
  void when_widget_is_created_stream_projection_and_listener_are_updated() {
    final var id = UUID.randomUUID();
    final var commandBus =
        CommandBus.builder()
            .registerCommandHandler(CreateWidget.class, new CreateWidgetHandler(repository))
            .build();

    commandBus.dispatch(new CreateWidget(id, "gear"));

    final var stream = eventStore.load(id, Widget.TYPE);
    assertEquals(1, stream.size());
    assertEquals(1L, stream.get(0).version());
    assertEquals(Widget.CREATED, stream.get(0).eventType());
    assertEquals("gear", widgetNames.get(id));
    assertEquals(List.of("created gear"), notifications);
  }

  @Test
  void when_two_renames_race_exactly_one_must_lose_with_conflict() throws Exception {
    final var id = UUID.randomUUID();
    repository.save(Widget.create(id, "gear"));

    final var bothLoaded = new CyclicBarrier(2);
    final var firstSaved = new CountDownLatch(1);
    final var handler = new RacingRenameHandler(repository, bothLoaded, firstSaved);
    final var commandBus =
        CommandBus.builder().registerCommandHandler(RenameWidget.class, handler).build();

    final var executor = Executors.newFixedThreadPool(2);
    try {
      final Future<?> first =
          executor.submit(
              () -> {
                try {
                  commandBus.dispatch(new RenameWidget(id, "first"));
                } finally {
                  firstSaved.countDown();
                }
              });
      final Future<?> second =
          executor.submit(() -> commandBus.dispatch(new RenameWidget(id, "second")));

      first.get(10, TimeUnit.SECONDS);

      final var thrown =
          assertThrows(ExecutionException.class, () -> second.get(10, TimeUnit.SECONDS));
      assertInstanceOf(ConcurrencyConflictException.class, thrown.getCause());
    } finally {
      executor.shutdownNow();
    }

    assertEquals(2, handler.invocations.get());
    assertEquals(2, eventStore.load(id, Widget.TYPE).size());
    assertEquals("first", repository.load(id).name());
    assertEquals("first", widgetNames.get(id));
    assertTrue(repository.exists(id));
  }

  /**
   * Lets both commands load the same version before either saves, then lets the "first" one save
   * before the other.
   */
  private static final class RacingRenameHandler
      extends DomainCommandHandler.Update<RenameWidget, Widget, WidgetEvent> {
    private final AtomicInteger invocations;
    private final CyclicBarrier bothLoaded;
    private final CountDownLatch firstSaved;

    RacingRenameHandler(
        AggregateRepository<Widget, WidgetEvent> repository,
        CyclicBarrier bothLoaded,
        CountDownLatch firstSaved) {
      super(RenameWidget.class, repository);
      this.invocations = new AtomicInteger(0);
      this.bothLoaded = bothLoaded;
      this.firstSaved = firstSaved;
    }

    @Override
    protected void updateAggregate(RenameWidget command, Widget aggregate) throws Exception {
      invocations.incrementAndGet();
      aggregate.rename(command.name());
      bothLoaded.await(10, TimeUnit.SECONDS);

      if (!"first".equals(command.name())) {
        firstSaved.await(10, TimeUnit.SECONDS);
      }
    }
  }
}
