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

package io.github.suppierk.es.jooq;

import io.github.suppierk.es.cqrs.AggregateType;
import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.cqrs.EventPayload;
import io.github.suppierk.es.cqrs.EventType;
import io.github.suppierk.es.store.ConcurrencyConflictException;
import io.github.suppierk.es.store.EventPayloadSerializer;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.EventStoreException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.InsertValuesStep7;
import org.jooq.Record;
import org.jooq.Record1;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} keeping all streams in a single table.
 *
 * <p>Table layout:
 *
 * <ul>
 *   <li>{@code event_id} - {@link DomainEvent#messageId()}, primary key;
 *   <li>{@code event_name} - {@link EventType#name()};
 *   <li>{@code payload} - serialized {@link DomainEvent#payload()};
 *   <li>{@code created_at} - {@link DomainEvent#createdAt()} in UTC;
 *   <li>{@code aggregate_id} and {@code aggregate_type} - stream identity;
 *   <li>{@code version} - {@link DomainEvent#version()}, unique within the stream.
 * </ul>
 *
 * <p>Version check happens inside the append transaction, while the unique constraint on the stream
 * version catches writers which raced past the check at the same time.
 *
 * <p>Like the command handlers of this library, the store distinguishes between the read-write
 * {@link DSLContext} used for appends and the read-only one used for loading streams.
 */
public final class JooqEventStore implements EventStore {
  private static final Logger logger = LoggerFactory.getLogger(JooqEventStore.class);

  /** Name of the table used when none is specified. */
  public static final String DEFAULT_TABLE_NAME = "event_stream";

  private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

  static final Field<UUID> EVENT_ID =
      DSL.field(DSL.name("event_id"), SQLDataType.UUID.nullable(false));
  static final Field<String> EVENT_NAME =
      DSL.field(DSL.name("event_name"), SQLDataType.VARCHAR(100).nullable(false));
  static final Field<String> PAYLOAD =
      DSL.field(DSL.name("payload"), SQLDataType.VARCHAR.nullable(false));
  static final Field<LocalDateTime> CREATED_AT =
      DSL.field(DSL.name("created_at"), SQLDataType.LOCALDATETIME(3).nullable(false));
  static final Field<UUID> AGGREGATE_ID =
      DSL.field(DSL.name("aggregate_id"), SQLDataType.UUID.nullable(false));
  static final Field<String> AGGREGATE_TYPE =
      DSL.field(DSL.name("aggregate_type"), SQLDataType.VARCHAR(150).nullable(false));
  static final Field<Long> VERSION =
      DSL.field(DSL.name("version"), SQLDataType.BIGINT.nullable(false));

  private final DSLContext readWriteDsl;
  private final DSLContext readOnlyDsl;
  private final EventPayloadSerializer payloadSerializer;
  private final String tableName;
  private final String streamVersionConstraint;
  private final Table<Record> table;

  /**
   * Creates a store using the same {@link DSLContext} for reads and writes and the default table.
   *
   * @param dsl for read and write operations
   * @param payloadSerializer to convert payloads
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public JooqEventStore(final DSLContext dsl, final EventPayloadSerializer payloadSerializer) {
    this(dsl, dsl, payloadSerializer, DEFAULT_TABLE_NAME);
  }

  /**
   * @param readWriteDsl for appends and schema creation
   * @param readOnlyDsl for loading streams
   * @param payloadSerializer to convert payloads
   * @param tableName to keep events in
   * @throws IllegalArgumentException if any argument is {@code null} or table name is blank
   */
  public JooqEventStore(
      final DSLContext readWriteDsl,
      final DSLContext readOnlyDsl,
      final EventPayloadSerializer payloadSerializer,
      final String tableName) {
    if (readWriteDsl == null) {
      throw new IllegalArgumentException("Read-write DSL cannot be null");
    }

    if (readOnlyDsl == null) {
      throw new IllegalArgumentException("Read-only DSL cannot be null");
    }

    if (payloadSerializer == null) {
      throw new IllegalArgumentException("Payload serializer cannot be null");
    }

    if (tableName == null || tableName.isBlank()) {
      throw new IllegalArgumentException("Table name cannot be null or blank");
    }

    this.readWriteDsl = readWriteDsl;
    this.readOnlyDsl = readOnlyDsl;
    this.payloadSerializer = payloadSerializer;
    this.tableName = tableName;
    this.streamVersionConstraint = "uk_" + tableName + "_stream_version";
    this.table = DSL.table(DSL.name(tableName));
  }

  /** {@inheritDoc} */
  @Override
  public void createSchema() {
    try {
      readWriteDsl
          .createTableIfNotExists(table)
          .columns(EVENT_ID, EVENT_NAME, PAYLOAD, CREATED_AT, AGGREGATE_ID, AGGREGATE_TYPE, VERSION)
          .constraints(
              DSL.constraint(DSL.name("pk_" + tableName)).primaryKey(EVENT_ID),
              DSL.constraint(DSL.name(streamVersionConstraint))
                  .unique(AGGREGATE_TYPE, AGGREGATE_ID, VERSION))
          .execute();
    } catch (DataAccessException e) {
      throw new EventStoreException("Cannot create table '%s'".formatted(tableName), e);
    }

    logger.info("Event store table '{}' is ready", tableName);
  }

  /** {@inheritDoc} */
  @Override
  public <E extends EventPayload> void append(
      final UUID streamId,
      final AggregateType<?, E> aggregateType,
      final long expectedVersion,
      final List<? extends DomainEvent<? extends E>> events) {
    verifyStream(streamId, aggregateType);

    if (expectedVersion < 0) {
      throw new IllegalArgumentException(
          "Expected version cannot be negative, got %d".formatted(expectedVersion));
    }

    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    if (events.isEmpty()) {
      return;
    }

    verifyEvents(streamId, aggregateType, expectedVersion, events);

    // Serialization failures must surface before anything touches the database
    final List<String> payloads = new ArrayList<>(events.size());
    for (DomainEvent<? extends E> event : events) {
      final String payload = payloadSerializer.serialize(event.payload());
      if (payload == null) {
        throw new EventStoreException(
            "Serializer returned no payload for event '%s'".formatted(event.messageId()));
      }

      payloads.add(payload);
    }

    try {
      readWriteDsl.transaction(
          (final Configuration trx) -> {
            final DSLContext dsl = trx.dsl();

            final long actualVersion = currentVersion(dsl, streamId, aggregateType);
            if (actualVersion != expectedVersion) {
              throw new ConcurrencyConflictException(
                  streamId, aggregateType.name(), expectedVersion, actualVersion);
            }

            InsertValuesStep7<Record, UUID, String, String, LocalDateTime, UUID, String, Long>
                insert =
                    dsl.insertInto(
                        table,
                        EVENT_ID,
                        EVENT_NAME,
                        PAYLOAD,
                        CREATED_AT,
                        AGGREGATE_ID,
                        AGGREGATE_TYPE,
                        VERSION);

            for (int i = 0; i < events.size(); i++) {
              final DomainEvent<? extends E> event = events.get(i);
              insert =
                  insert.values(
                      event.messageId(),
                      event.eventType().name(),
                      payloads.get(i),
                      LocalDateTime.ofInstant(event.createdAt(), ZoneOffset.UTC),
                      streamId,
                      aggregateType.name(),
                      event.version());
            }

            insert.execute();
          });
    } catch (ConcurrencyConflictException e) {
      logger.warn("Rejected append to stream '{}' of '{}': {}", streamId, aggregateType, e.getMessage());
      throw e;
    } catch (DataAccessException e) {
      if (isStreamVersionViolation(e)) {
        logger.warn(
            "Rejected append to stream '{}' of '{}': concurrent writer detected",
            streamId,
            aggregateType);
        throw new ConcurrencyConflictException(
            streamId, aggregateType.name(), expectedVersion, e);
      }

      throw new EventStoreException(
          "Cannot append %d events to stream '%s' of '%s'"
              .formatted(events.size(), streamId, aggregateType),
          e);
    }

    logger.debug(
        "Appended {} events to stream '{}' of '{}', now at version {}",
        events.size(),
        streamId,
        aggregateType,
        expectedVersion + events.size());
  }

  /** {@inheritDoc} */
  @Override
  public <E extends EventPayload> List<DomainEvent<? extends E>> load(
      final UUID streamId, final AggregateType<?, E> aggregateType) {
    verifyStream(streamId, aggregateType);

    final List<Record> rows;
    try {
      rows =
          new ArrayList<>(
              readOnlyDsl
                  .select(EVENT_ID, EVENT_NAME, PAYLOAD, CREATED_AT, VERSION)
                  .from(table)
                  .where(streamCondition(streamId, aggregateType))
                  .orderBy(VERSION.asc())
                  .fetch());
    } catch (DataAccessException e) {
      throw new EventStoreException(
          "Cannot load stream '%s' of '%s'".formatted(streamId, aggregateType), e);
    }

    final List<DomainEvent<? extends E>> events = new ArrayList<>(rows.size());
    for (Record row : rows) {
      final String eventName = row.get(EVENT_NAME);
      final EventType<? extends E> eventType =
          aggregateType
              .eventType(eventName)
              .orElseThrow(
                  () ->
                      new EventStoreException(
                          "Event '%s' in stream '%s' is not declared by '%s'"
                              .formatted(eventName, streamId, aggregateType)));

      events.add(restore(row, eventType, streamId, aggregateType.name()));
    }

    return List.copyOf(events);
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final UUID streamId, final AggregateType<?, ?> aggregateType) {
    verifyStream(streamId, aggregateType);

    try {
      return currentVersion(readOnlyDsl, streamId, aggregateType);
    } catch (DataAccessException e) {
      throw new EventStoreException(
          "Cannot read version of stream '%s' of '%s'".formatted(streamId, aggregateType), e);
    }
  }

  private long currentVersion(
      final DSLContext dsl, final UUID streamId, final AggregateType<?, ?> aggregateType) {
    final Record1<Long> row =
        dsl.select(DSL.max(VERSION))
            .from(table)
            .where(streamCondition(streamId, aggregateType))
            .fetchOne();

    if (row == null || row.value1() == null) {
      return 0L;
    }

    return row.value1();
  }

  /**
   * Tells a duplicate version within a stream, left by a racing writer, apart from other integrity
   * violations such as a duplicate event ID.
   */
  private boolean isStreamVersionViolation(final DataAccessException e) {
    if (!UNIQUE_VIOLATION_SQL_STATE.equals(e.sqlState())) {
      return false;
    }

    final String constraint = streamVersionConstraint.toLowerCase(Locale.ROOT);
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      final String message = cause.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains(constraint)) {
        return true;
      }
    }

    return false;
  }

  private Condition streamCondition(final UUID streamId, final AggregateType<?, ?> aggregateType) {
    return AGGREGATE_TYPE.eq(aggregateType.name()).and(AGGREGATE_ID.eq(streamId));
  }

  private <P extends EventPayload> DomainEvent<P> restore(
      final Record row,
      final EventType<P> eventType,
      final UUID streamId,
      final String aggregateTypeName) {
    return new DomainEvent<>(
        row.get(EVENT_ID),
        row.get(CREATED_AT).toInstant(ZoneOffset.UTC),
        streamId,
        aggregateTypeName,
        row.get(VERSION),
        eventType,
        payloadSerializer.deserialize(eventType, row.get(PAYLOAD)));
  }

  private static void verifyStream(final UUID streamId, final AggregateType<?, ?> aggregateType) {
    if (streamId == null) {
      throw new IllegalArgumentException("Stream ID cannot be null");
    }

    if (aggregateType == null) {
      throw new IllegalArgumentException("Aggregate type cannot be null");
    }
  }

  private static <E extends EventPayload> void verifyEvents(
      final UUID streamId,
      final AggregateType<?, E> aggregateType,
      final long expectedVersion,
      final List<? extends DomainEvent<? extends E>> events) {
    long nextVersion = expectedVersion + 1;

    for (DomainEvent<? extends E> event : events) {
      if (event == null) {
        throw new IllegalArgumentException("Event cannot be null");
      }

      if (!streamId.equals(event.aggregateId())
          || !aggregateType.name().equals(event.aggregateType())) {
        throw new IllegalArgumentException(
            "Event '%s' does not belong to stream '%s' of '%s'"
                .formatted(event.messageId(), streamId, aggregateType));
      }

      if (!aggregateType.declares(event.eventType())) {
        throw new IllegalArgumentException(
            "Event type '%s' is not declared by '%s'".formatted(event.eventType(), aggregateType));
      }

      if (event.version() != nextVersion) {
        throw new IllegalArgumentException(
            "Event '%s' must have version %d, got %d"
                .formatted(event.messageId(), nextVersion, event.version()));
      }

      nextVersion++;
    }
  }
}
