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

import io.github.admission.ddd.async.DomainNotification;
import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.cqrs.DomainCommandHandler;
import io.github.admission.supervision.command.InitiateSupervisionGroup;
import io.github.admission.supervision.domain.exception.SupervisionGroupAlreadyExistsException;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import io.github.admission.supervision.notification.SupervisionNotification;
import io.github.admission.supervision.repository.SupervisionGroupRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates the group of a proposition, once per proposition. */
public final class InitiateSupervisionGroupHandler
    extends DomainCommandHandler.Create<
        InitiateSupervisionGroup,
        SupervisionGroupIdentity,
        SupervisionGroup,
        SupervisionGroupRepository> {
  private static final Logger LOG = LoggerFactory.getLogger(InitiateSupervisionGroupHandler.class);

  public InitiateSupervisionGroupHandler() {
    super(InitiateSupervisionGroup.class);
  }

  /** {@inheritDoc} */
  @Override
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return SupervisionCommandHandler.actsForCandidate(domainClient);
  }

  /**
   * {@inheritDoc}
   *
   * @throws SupervisionGroupAlreadyExistsException if the proposition already has a group
   */
  @Override
  protected SupervisionGroup newAggregate(
      final InitiateSupervisionGroup command, final SupervisionGroupRepository repository) {
    if (repository.findByPropositionId(command.propositionId()).isPresent()) {
      throw new SupervisionGroupAlreadyExistsException();
    }

    return SupervisionGroup.initiate(command.groupId(), command.propositionId());
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final InitiateSupervisionGroup command, final SupervisionGroup group) {
    LOG.info(
        "Supervision group '{}' initiated for proposition '{}'",
        group.getId().uuid(),
        group.getPropositionId().uuid());
    return Optional.of(
        SupervisionNotification.of(
            group.getId(), SupervisionNotification.Event.GROUP_INITIATED));
  }
}
