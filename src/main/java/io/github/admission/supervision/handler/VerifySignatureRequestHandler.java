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

import io.github.admission.ddd.cqrs.DomainQueryHandler;
import io.github.admission.supervision.domain.service.PromoterDirectory;
import io.github.admission.supervision.domain.validator.SupervisionValidators;
import io.github.admission.supervision.query.SupervisionViolation;
import io.github.admission.supervision.query.VerifySignatureRequest;
import io.github.admission.supervision.repository.SupervisionGroupRepository;
import java.util.List;

/**
 * Runs the checks of {@link RequestSignaturesHandler} without changing anything, so that the
 * candidate sees everything left to do. An empty answer means signatures can be requested.
 */
public final class VerifySignatureRequestHandler
    extends DomainQueryHandler.Many<
        VerifySignatureRequest, SupervisionGroupRepository, SupervisionViolation> {
  private final PromoterDirectory promoterDirectory;

  /**
   * @param promoterDirectory telling external promoters apart
   * @throws IllegalArgumentException if promoterDirectory is {@code null}
   */
  public VerifySignatureRequestHandler(final PromoterDirectory promoterDirectory) {
    super(VerifySignatureRequest.class);
    if (promoterDirectory == null) {
      throw new IllegalArgumentException("Promoter directory is null");
    }

    this.promoterDirectory = promoterDirectory;
  }

  /** {@inheritDoc} */
  @Override
  protected List<SupervisionViolation> run(
      final VerifySignatureRequest query, final SupervisionGroupRepository repository) {
    return SupervisionValidators.fullSignatureRequest(promoterDirectory)
        .violations(repository.load(query.groupId()))
        .stream()
        .map(SupervisionViolation::of)
        .toList();
  }
}
