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
import io.github.admission.supervision.command.Refuse;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.notification.SupervisionNotification;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Refusal given by the signatory in person. */
public final class RefuseHandler extends SupervisionCommandHandler<Refuse> {
  private static final Logger LOG = LoggerFactory.getLogger(RefuseHandler.class);

  public RefuseHandler() {
    super(Refuse.class);
  }

  /** Only the signatory named by the command may refuse. */
  @Override
  protected boolean canBeUsedBy(final DomainClient domainClient, final Refuse command) {
    return isSignatory(domainClient, command.signatoryId());
  }

  /** {@inheritDoc} */
  @Override
  protected SupervisionGroup updateAggregate(final Refuse command, final SupervisionGroup group) {
    group.refuse(
        group.getSignatory(command.signatoryId()),
        command.internalComment(),
        command.externalComment(),
        command.refusalReason());
    return group;
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final Refuse command, final SupervisionGroup group) {
    LOG.info(
        "Signatory '{}' refused supervision group '{}'",
        command.signatoryId(),
        group.getId().uuid());
    return Optional.of(
        SupervisionNotification.of(
            group.getId(),
            SupervisionNotification.Event.SIGNATORY_REFUSED,
            command.signatoryId()));
  }
}
