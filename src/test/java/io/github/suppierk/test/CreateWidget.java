package io.github.suppierk.test;

import io.github.suppierk.es.cqrs.DomainCommand;
import java.time.Instant;
import java.util.UUID;

public record CreateWidget(UUID messageId, Instant createdAt, UUID widgetId, String name)
    implements DomainCommand.Create {
  public CreateWidget(UUID widgetId, String name) {
    this(UUID.randomUUID(), Instant.now(), widgetId, name);
  }
}
