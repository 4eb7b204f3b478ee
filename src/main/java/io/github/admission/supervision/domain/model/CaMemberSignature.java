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

/** Signature of a member of the accompanying committee. */
public record CaMemberSignature(
    CaMemberIdentity signatory,
    SignatureState state,
    String internalComment,
    String externalComment,
    String refusalReason,
    List<String> approvalProof)
    implements SignatureEntry<CaMemberIdentity, CaMemberSignature> {
  @Serial private static final long serialVersionUID = -6093848215738520413L;

  public CaMemberSignature {
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
  public static CaMemberSignature notInvited(final CaMemberIdentity signatory) {
    return new CaMemberSignature(signatory, SignatureState.NOT_INVITED, "", "", "", List.of());
  }

  @Override
  public CaMemberSignature withState(
      final SignatureState state,
      final String internalComment,
      final String externalComment,
      final String refusalReason,
      final List<String> approvalProof) {
    return new CaMemberSignature(
        signatory, state, internalComment, externalComment, refusalReason, approvalProof);
  }
}
