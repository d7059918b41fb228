package io.github.suppierk.test;

import io.github.suppierk.es.cqrs.AggregateRoot;
import io.github.suppierk.es.cqrs.AggregateType;
import io.github.suppierk.es.cqrs.EventType;
import java.util.List;
import java.util.UUID;

/** A sample aggregate for tests: a named thing which can be renamed. */
public final class Widget extends AggregateRoot<WidgetEvent> {
  public static final EventType<WidgetEvent.Created> CREATED =
      EventType.of("WidgetCreated", WidgetEvent.Created.class);
  public static final EventType<WidgetEvent.Renamed> RENAMED =
      EventType.of("WidgetRenamed", WidgetEvent.Renamed.class);

  public static final AggregateType<Widget, WidgetEvent> TYPE =
      AggregateType.<Widget, WidgetEvent>of(
          "widget", Widget.class, Widget::new, List.of(CREATED, RENAMED));

  private String name;
  private int renameCount;

  private Widget() {
    this.name = null;
    this.renameCount = 0;
  }

  public static Widget create(UUID id, String name) {
    final var widget = new Widget();
    widget.assignIdentity(id);
    widget.recordThat(CREATED, new WidgetEvent.Created(id, name));
    return widget;
  }

  public void rename(String newName) {
    if (newName == null || newName.isBlank()) {
      throw new IllegalArgumentException("Widget name cannot be blank");
    }

    recordThat(RENAMED, new WidgetEvent.Renamed(aggregateId(), newName));
  }

  public String name() {
    return name;
  }

  public int renameCount() {
    return renameCount;
  }

  @Override
  protected AggregateType<?, WidgetEvent> aggregateType() {
    return TYPE;
  }

  @Override
  protected void apply(WidgetEvent payload) {
    if (payload instanceof WidgetEvent.Created created) {
      name = created.name();
    } else if (payload instanceof WidgetEvent.Renamed renamed) {
      name = renamed.name();
      renameCount++;
    }
  }
}
