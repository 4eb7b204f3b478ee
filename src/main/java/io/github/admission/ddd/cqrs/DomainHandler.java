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

import io.github.admission.ddd.async.DomainNotification;
import io.github.admission.ddd.async.DomainNotificationProducer;
import io.github.admission.ddd.authorization.DomainClient;
import java.util.Optional;

/**
 * Hooks shared by command and query handlers: who may use them and what to notify afterwards.
 *
 * @param <OPERATION> supported by the current handler
 * @param <OUTPUT> of the handler operation
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
abstract sealed class DomainHandler<OPERATION, OUTPUT> extends Suspicious
    permits DomainCommandHandler, DomainQueryHandler {
  /**
   * @param domainClient invoking the operation
   * @return {@code true} if the client can invoke current handler, {@code false} otherwise
   */
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return true;
  }

  /**
   * Variant for handlers whose authorization depends on the content of the operation, such as a
   * person only allowed to act on their own behalf.
   *
   * @param domainClient invoking the operation
   * @param operation being invoked
   * @return {@link #canBeUsedBy(DomainClient)} unless overridden
   */
  protected boolean canBeUsedBy(final DomainClient domainClient, final OPERATION operation) {
    return canBeUsedBy(domainClient);
  }

  /**
   * Defines a {@link DomainNotification} to store when the operation succeeds.
   *
   * <p>For commands the notification is stored in the same transaction as the aggregate.
   *
   * @param operation being invoked
   * @param output produced by the operation
   * @return an {@link Optional} {@link DomainNotification} to store via {@link
   *     DomainNotificationProducer}
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-1452/">Suppressed Sonar rule to denote
   *     that it doesn't matter much which exact types notification uses</a>
   */
  @SuppressWarnings("squid:S1452")
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final OPERATION operation, final OUTPUT output) {
    return Optional.empty();
  }

  /**
   * Defines a {@link DomainNotification} to store when the operation fails.
   *
   * <p>The notification is stored in a transaction of its own, so it survives the rollback of the
   * failed operation.
   *
   * @param operation being invoked
   * @param cause is an exception that happened during processing
   * @return an {@link Optional} {@link DomainNotification} to store via {@link
   *     DomainNotificationProducer}
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-1452/">Suppressed Sonar rule to denote
   *     that it doesn't matter much which exact types notification uses</a>
   */
  @SuppressWarnings("squid:S1452")
  protected Optional<DomainNotification<?, ?>> onFailure(
      final OPERATION operation, final Throwable cause) {
    return Optional.empty();
  }
}
