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

/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we are keeping track of people entering and leaving a building:
 *
 * <ul>
 *   <li>The building is an {@link io.github.suppierk.es.cqrs.AggregateRoot} - it decides whether a
 *       person may enter or leave, and its state is nothing more than everything that happened to
 *       it so far.
 *   <li>A receptionist sends {@link io.github.suppierk.es.cqrs.DomainCommand}s:
 *       <ul>
 *         <li>{@code Register New Building} is a {@link
 *             io.github.suppierk.es.cqrs.DomainCommand.Create} - there is no building yet.
 *         <li>{@code Check In} is a {@link io.github.suppierk.es.cqrs.DomainCommand.Update} - it
 *             targets an existing building by its ID.
 *       </ul>
 *   <li>Each command reaches exactly one {@link io.github.suppierk.es.cqrs.DomainCommandHandler}
 *       via the {@link io.github.suppierk.es.cqrs.CommandBus}, which loads the building through
 *       {@link io.github.suppierk.es.cqrs.AggregateRepository}, asks it to check the person in and
 *       saves it.
 *   <li>The building answers with {@link io.github.suppierk.es.cqrs.DomainEvent}s, such as {@code
 *       Person Checked In}, which are appended to the {@link
 *       io.github.suppierk.es.store.EventStore} and then handed to the {@link
 *       io.github.suppierk.es.cqrs.EventRouter} by the {@link
 *       io.github.suppierk.es.cqrs.EventPublisher}:
 *       <ul>
 *         <li>projectors update the list of people currently inside;
 *         <li>listeners, running after projectors, may notify security when someone checks in
 *             twice.
 *       </ul>
 * </ul>
 */
package io.github.suppierk.es.cqrs;
