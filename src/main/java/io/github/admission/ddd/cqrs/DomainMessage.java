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

import io.github.admission.ddd.authorization.AnonymousDomainClient;
import io.github.admission.ddd.authorization.DomainClient;
import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * Common properties of every interaction with a bounded context - commands, queries and
 * notifications - which make each of them traceable in logs and in the notification outbox.
 *
 * <p>Java {@link Record}s are the intended implementations: a record component named like one of
 * the methods below fulfills the contract without any extra code.
 *
 * @param <I> is the type of the interaction identifier
 * @param <T> is the type of the timestamp when this interaction was created
 */
// @formatter:off
public interface DomainMessage<
  I extends Serializable,
  T extends Temporal & Serializable
> extends Serializable {
// @formatter:on

  /**
   * Named {@code messageId()} rather than {@code id()} because messages usually also carry the
   * identifier of the aggregate they target.
   *
   * @return an identifier for the current interaction
   */
  I messageId();

  /**
   * @return the time when this interaction was created
   */
  T createdAt();

  /**
   * @return the client who sent this interaction, {@link AnonymousDomainClient} unless stated
   */
  default DomainClient domainClient() {
    return AnonymousDomainClient.getInstance();
  }
}
