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

package io.github.admission.ddd.async;

import org.jooq.DSLContext;

/**
 * Abstract contract for an entity which is able to store {@link DomainNotification}s for later
 * delivery.
 *
 * <p>Implementations must write the notification with the given {@link DSLContext}, so that it
 * becomes part of the transaction of the handler emitting it: either both the aggregate change and
 * the notification are committed, or none of them.
 *
 * @see <a href="https://microservices.io/patterns/data/transactional-outbox.html">Transactional
 *     outbox</a>
 */
public interface DomainNotificationProducer {
  /**
   * @return an instance of producer which does not perform any operations
   */
  static DomainNotificationProducer empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Saves {@link DomainNotification} to its own table for delivery.
   *
   * @param readWriteDsl is a transactional context with writing capability at the time when the
   *     operation takes place
   * @param notification to store
   * @param <E> is a generic {@link DomainNotification} type
   */
  <E extends DomainNotification<?, ?>> void store(
      final DSLContext readWriteDsl, final E notification);

  /** Producer discarding every notification. */
  final class NoOp implements DomainNotificationProducer {
    private static final DomainNotificationProducer INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public <E extends DomainNotification<?, ?>> void store(
        final DSLContext readWriteDsl, final E notification) {
      // Do nothing
    }
  }
}
