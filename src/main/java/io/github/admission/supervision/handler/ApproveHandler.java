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
import io.github.admission.supervision.command.Approve;
import io.github.admission.supervision.domain.model.SignatoryIdentity;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.notification.SupervisionNotification;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approval given by the signatory in person. The reference promoter cannot approve before the
 * thesis institute of the proposition is known.
 */
public final class ApproveHandler extends SupervisionCommandHandler<Approve> {
  private static final Logger LOG = LoggerFactory.getLogger(ApproveHandler.class);

  public ApproveHandler() {
    super(Approve.class);
  }

  /** Only the signatory named by the command may approve. */
  @Override
  protected boolean canBeUsedBy(final DomainClient domainClient, final Approve command) {
    return isSignatory(domainClient, command.signatoryId());
  }

  /** {@inheritDoc} */
  @Override
  protected SupervisionGroup updateAggregate(final Approve command, final SupervisionGroup group) {
    final SignatoryIdentity signatory = group.getSignatory(command.signatoryId());
    group.verifyReferencePromoterDocumentsThesisInstitute(
        signatory,
        group.getReferencePromoter().orElse(null),
        command.propositionThesisInstitute(),
        command.thesisInstituteFreeText());
    group.approve(signatory, command.internalComment(), command.externalComment());
    return group;
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final Approve command, final SupervisionGroup group) {
    LOG.info(
        "Signatory '{}' approved supervision group '{}'",
        command.signatoryId(),
        group.getId().uuid());
    return Optional.of(
        SupervisionNotification.of(
            group.getId(),
            SupervisionNotification.Event.SIGNATORY_APPROVED,
            command.signatoryId()));
  }
}
