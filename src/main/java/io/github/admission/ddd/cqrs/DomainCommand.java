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

package io.github.admission.ddd.cqrs;

import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * Represents an immutable command which must change the state of an aggregate as per CQRS
 * paradigm.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>In terms of 'read-write' {@link DomainCommand} is a 'write' representation, whereas {@link
 * DomainQuery} is its 'read' counterpart.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Approve Proposition' instead of 'Set
 * signature state to APPROVED'.
 *
 * <p>Commands are {@link java.io.Serializable} through {@link DomainMessage}, so they can be placed
 * in a queue rather than processed synchronously.
 *
 * <p>Aggregates are created once and then evolve, they are never physically deleted by a command.
 * The {@code sealed} hierarchy makes each command declare which of the two it does.
 *
 * @param <I> is the type of the command identifier
 * @param <T> is the type of the timestamp when this command was created
 */
// @formatter:off
public sealed interface DomainCommand<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T>
permits
  DomainCommand.Create, DomainCommand.Update
{
// @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to create a new
   * aggregate in the system.
   */
  // @formatter:off
  non-sealed interface Create<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {}
  // @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to change an
   * existing aggregate in the system.
   *
   * @param <ID> is the type of the identifier of the targeted aggregate
   */
  // @formatter:off
  non-sealed interface Update<
    I extends Serializable,
    T extends Temporal & Serializable,
    ID extends Serializable
  > extends DomainCommand<I, T> {
  // @formatter:on

    /**
     * @return an identifier of the aggregate to load, change and save
     */
    ID aggregateId();
  }
}
