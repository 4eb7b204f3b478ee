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

import io.github.admission.supervision.domain.model.ExternalMember;
import io.github.admission.supervision.domain.model.SignatoryRole;
import io.github.admission.supervision.domain.model.SignatureEntry;
import io.github.admission.supervision.domain.model.SignatureState;
import java.util.List;

/**
 * Flattened signature, whatever the role of the signatory. {@code external} is {@code null} for
 * signatories found in the person registry.
 */
public record SignatureView(
    String personId,
    SignatoryRole role,
    SignatureState state,
    String internalComment,
    String externalComment,
    String refusalReason,
    List<String> approvalProof,
    boolean referencePromoter,
    ExternalMember external) {
  public static SignatureView of(
      final SignatureEntry<?, ?> signature,
      final boolean referencePromoter,
      final ExternalMember external) {
    return new SignatureView(
        signature.signatory().id(),
        signature.signatory().role(),
        signature.state(),
        signature.internalComment(),
        signature.externalComment(),
        signature.refusalReason(),
        signature.approvalProof(),
        referencePromoter,
        external);
  }
}
