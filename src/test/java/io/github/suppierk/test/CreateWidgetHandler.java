package io.github.suppierk.test;

import io.github.suppierk.es.cqrs.AggregateRepository;
import io.github.suppierk.es.cqrs.DomainCommandHandler;
import java.util.concurrent.atomic.AtomicInteger;

public class CreateWidgetHandler
    extends DomainCommandHandler.Create<CreateWidget, Widget, WidgetEvent> {
  public final AtomicInteger invocations;

  public CreateWidgetHandler(AggregateRepository<Widget, WidgetEvent> repository) {
    super(CreateWidget.class, repository);
    this.invocations = new AtomicInteger(0);
  }

  @Override
  protected Widget createAggregate(CreateWidget command) throws Exception {
    invocations.incrementAndGet();
    return Widget.create(command.widgetId(), command.name());
  }
}
