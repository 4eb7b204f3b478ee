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

import java.io.Serializable;
import java.util.List;

/**
 * Signature of one signatory within a supervision group.
 *
 * <p>Entries are immutable: each transition returns a new entry of the same kind, which the group
 * stores in place of the previous one.
 *
 * @param <S> is the type of the signatory
 * @param <E> is the type of the entry itself, returned by transitions
 */
// @formatter:off
public sealed interface SignatureEntry<
  S extends SignatoryIdentity,
  E extends SignatureEntry<S, E>
> extends Serializable
permits
  PromoterSignature, CaMemberSignature
{
// @formatter:on

  S signatory();

  SignatureState state();

  /**
   * @return comment addressed to the managers, empty when none
   */
  String internalComment();

  /**
   * @return comment addressed to the candidate, empty when none
   */
  String externalComment();

  /**
   * @return reason of the refusal, empty unless {@link SignatureState#DECLINED}
   */
  String refusalReason();

  /**
   * @return references of the documents proving an approval given outside the platform
   */
  List<String> approvalProof();

  /**
   * @return a copy of this entry for the same signatory with the given values
   */
  E withState(
      final SignatureState state,
      final String internalComment,
      final String externalComment,
      final String refusalReason,
      final List<String> approvalProof);

  default E invite() {
    return withState(SignatureState.INVITED, "", "", "", List.of());
  }

  default E approve(final String internalComment, final String externalComment) {
    return withState(SignatureState.APPROVED, internalComment, externalComment, "", List.of());
  }

  default E approveByPdf(final List<String> proofDocuments) {
    return withState(SignatureState.APPROVED, "", "", "", proofDocuments);
  }

  default E decline(
      final String internalComment, final String externalComment, final String refusalReason) {
    return withState(
        SignatureState.DECLINED, internalComment, externalComment, refusalReason, List.of());
  }

  /**
   * Sends the signatory back to the next invitation round. Previous comments are kept for history.
   */
  default E reset() {
    return withState(
        SignatureState.NOT_INVITED,
        internalComment(),
        externalComment(),
        refusalReason(),
        approvalProof());
  }
}
