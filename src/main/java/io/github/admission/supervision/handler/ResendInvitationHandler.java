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
import io.github.admission.supervision.command.ResendInvitation;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.notification.SupervisionNotification;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Leaves the group as it is and emits a notification, so that the invitation is mailed again to
 * the external signatory.
 */
public final class ResendInvitationHandler extends SupervisionCommandHandler<ResendInvitation> {
  private static final Logger LOG = LoggerFactory.getLogger(ResendInvitationHandler.class);

  public ResendInvitationHandler() {
    super(ResendInvitation.class);
  }

  /** {@inheritDoc} */
  @Override
  protected SupervisionGroup updateAggregate(
      final ResendInvitation command, final SupervisionGroup group) {
    group.resendInvitation(group.getSignatory(command.signatoryId()));
    return group;
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final ResendInvitation command, final SupervisionGroup group) {
    LOG.info(
        "Invitation resent to signatory '{}' of supervision group '{}'",
        command.signatoryId(),
        group.getId().uuid());
    return Optional.of(
        SupervisionNotification.of(
            group.getId(),
            SupervisionNotification.Event.INVITATION_RESENT,
            command.signatoryId()));
  }
}
