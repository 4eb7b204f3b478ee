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

package io.github.admission.supervision.handler;

import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.cqrs.DomainCommand;
import io.github.admission.ddd.cqrs.DomainCommandHandler;
import io.github.admission.supervision.SupervisionClient;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import io.github.admission.supervision.repository.SupervisionGroupRepository;

/**
 * Load-change-save handler of an existing {@link SupervisionGroup}, reserved to the candidate and
 * to managers acting on the candidate's behalf unless a handler says otherwise.
 *
 * @param <C> the type of the handled command
 */
// @formatter:off
abstract class SupervisionCommandHandler<
  C extends DomainCommand.Update<?, ?, SupervisionGroupIdentity>
> extends DomainCommandHandler.Update<
  C, SupervisionGroupIdentity, SupervisionGroup, SupervisionGroupRepository
> {
// @formatter:on
  protected SupervisionCommandHandler(final Class<C> commandClass) {
    super(commandClass);
  }

  /** {@inheritDoc} */
  @Override
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return actsForCandidate(domainClient);
  }

  static boolean actsForCandidate(final DomainClient domainClient) {
    return domainClient instanceof SupervisionClient client && client.actsForCandidate();
  }

  static boolean isSignatory(final DomainClient domainClient, final String signatoryId) {
    return domainClient instanceof SupervisionClient client && client.isSignatory(signatoryId);
  }
}
