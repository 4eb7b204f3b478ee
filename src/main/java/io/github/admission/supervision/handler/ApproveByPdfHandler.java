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
import io.github.admission.supervision.command.ApproveByPdf;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.notification.SupervisionNotification;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Approval signed on paper, recorded by the candidate or a manager. */
public final class ApproveByPdfHandler extends SupervisionCommandHandler<ApproveByPdf> {
  private static final Logger LOG = LoggerFactory.getLogger(ApproveByPdfHandler.class);

  public ApproveByPdfHandler() {
    super(ApproveByPdf.class);
  }

  /** {@inheritDoc} */
  @Override
  protected SupervisionGroup updateAggregate(
      final ApproveByPdf command, final SupervisionGroup group) {
    group.approveByPdf(group.getSignatory(command.signatoryId()), command.proofDocuments());
    return group;
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<DomainNotification<?, ?>> onSuccess(
      final ApproveByPdf command, final SupervisionGroup group) {
    LOG.info(
        "Approval of signatory '{}' recorded from {} document(s) in supervision group '{}'",
        command.signatoryId(),
        command.proofDocuments().size(),
        group.getId().uuid());
    return Optional.of(
        SupervisionNotification.of(
            group.getId(),
            SupervisionNotification.Event.SIGNATORY_APPROVED,
            command.signatoryId()));
  }
}
