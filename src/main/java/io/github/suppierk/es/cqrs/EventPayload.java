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

package io.github.suppierk.es.cqrs;

import java.io.Serializable;

/**
 * Marker for the data describing what happened in a {@link DomainEvent}.
 *
 * <p>Each aggregate is expected to declare its own {@code sealed} sub-interface permitting a closed
 * set of {@link Record}s, so that {@link AggregateRoot#apply(EventPayload)} can exhaustively fold
 * every event the aggregate may ever see.
 *
 * <p>Payloads are persisted by an {@link io.github.suppierk.es.store.EventPayloadSerializer}, which
 * means they must be plain data - no references to services or other aggregates.
 */
public interface EventPayload extends Serializable {}
