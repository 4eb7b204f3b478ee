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

package io.github.admission.supervision.query;

import io.github.admission.supervision.domain.model.Cotutelle;
import io.github.admission.supervision.domain.model.GroupSignatureStatus;
import io.github.admission.supervision.domain.model.PromoterIdentity;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import java.util.List;
import java.util.UUID;

/**
 * Read model of a {@link SupervisionGroup}.
 *
 * @param groupId of the group
 * @param propositionId owning the group
 * @param status of the group
 * @param referencePromoterId {@code null} until designated
 * @param promoters in display order
 * @param caMembers in display order
 * @param cotutelle {@code null} while the candidate did not answer
 * @param version stored with the group
 */
public record SupervisionGroupView(
    UUID groupId,
    UUID propositionId,
    GroupSignatureStatus status,
    String referencePromoterId,
    List<SignatureView> promoters,
    List<SignatureView> caMembers,
    Cotutelle cotutelle,
    long version) {
  public static SupervisionGroupView of(final SupervisionGroup group) {
    final PromoterIdentity referencePromoter = group.getReferencePromoter().orElse(null);

    return new SupervisionGroupView(
        group.getId().uuid(),
        group.getPropositionId().uuid(),
        group.getStatus(),
        referencePromoter == null ? null : referencePromoter.id(),
        group.getPromoterSignatures().stream()
            .map(
                signature ->
                    SignatureView.of(
                        signature,
                        signature.signatory().equals(referencePromoter),
                        group.getExternalMember(signature.signatory()).orElse(null)))
            .toList(),
        group.getCaMemberSignatures().stream()
            .map(
                signature ->
                    SignatureView.of(
                        signature,
                        false,
                        group.getExternalMember(signature.signatory()).orElse(null)))
            .toList(),
        group.getCotutelle().orElse(null),
        group.getVersion());
  }
}
