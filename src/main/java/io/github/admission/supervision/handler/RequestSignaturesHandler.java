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
import io.github.admission.ddd.validation.MultipleBusinessExceptions;
import io.github.admission.supervision.command.RequestSignatures;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.domain.service.PromoterDirectory;
import io.github.admission.supervision.domain.validator.SupervisionValidators;
import io.github.admission.supervision.notification.SupervisionNotification;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the proposition to the signatories: every rule of the composition is checked at once, then
 * pending signatories are invited and the group is locked.
 */
public final class RequestSignaturesHandler extends SupervisionCommandHandler<RequestSignatures> {
  private static final Logger LOG = LoggerFactory.getLogger(RequestSignaturesHandler.class);

  private final PromoterDirectory promoterDirectory;

  /**
   * @param promoterDirectory telling external promoters apart
   * @throws IllegalArgumentException if promoterDirectory is {@code null}
   */
  public RequestSignaturesHandler(final PromoterDirectory promoterDirectory) {
    super(RequestSignatures.class);
    if (promoterDirectory == null) {
      throw new IllegalArgumentException("Promoter directory is null");
    }

    this.promoterDirectory = promoterDirectory;
  }

  /**
   * {@inheritDoc}
   *
   * @throws MultipleBusinessExceptions listing every broken rule of the composition
   */
  @Override
  protected SupervisionGroup updateAggregate(
      final RequestSignatures command, final SupervisionGroup group) {
    SupervisionValidators.fullSignatureRequest(promoterDirectory).accumulate(group);
    group.inviteAllPendingToSign();
    group.lockForSignature();
    return group;
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final RequestSignatures command, final SupervisionGroup group) {
    LOG.info(
        "Signatures requested for supervision group '{}' ({} signatories)",
        group.getId().uuid(),
        group.getSignatures().size());
    return Optional.of(
        SupervisionNotification.of(
            group.getId(), SupervisionNotification.Event.SIGNATURES_REQUESTED));
  }
}
