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

package io.github.admission.supervision.domain.model;

import java.io.Serial;
import java.util.List;

/**
 * Signature of a promoter.
 *
 * <p>Missing comments and reason are stored as empty strings.
 */
public record PromoterSignature(
    PromoterIdentity signatory,
    SignatureState state,
    String internalComment,
    String externalComment,
    String refusalReason,
    List<String> approvalProof)
    implements SignatureEntry<PromoterIdentity, PromoterSignature> {
  @Serial private static final long serialVersionUID = 4471006395182237310L;

  public PromoterSignature {
    if (signatory == null) {
      throw new IllegalArgumentException("Signatory cannot be null");
    }

    if (state == null) {
      throw new IllegalArgumentException("Signature state cannot be null");
    }

    internalComment = internalComment == null ? "" : internalComment;
    externalComment = externalComment == null ? "" : externalComment;
    refusalReason = refusalReason == null ? "" : refusalReason;
    approvalProof = approvalProof == null ? List.of() : List.copyOf(approvalProof);
  }

  /**
   * @param signatory just added to a group
   * @return a blank signature waiting for an invitation
   */
  public static PromoterSignature notInvited(final PromoterIdentity signatory) {
    return new PromoterSignature(signatory, SignatureState.NOT_INVITED, "", "", "", List.of());
  }

  @Override
  public PromoterSignature withState(
      final SignatureState state,
      final String internalComment,
      final String externalComment,
      final String refusalReason,
      final List<String> approvalProof) {
    return new PromoterSignature(
        signatory, state, internalComment, externalComment, refusalReason, approvalProof);
  }
}
