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

package io.github.admission.supervision.domain.validator;

import static io.github.admission.supervision.domain.validator.SupervisionRules.atLeastOneCaMember;
import static io.github.admission.supervision.domain.validator.SupervisionRules.atLeastOnePromoter;
import static io.github.admission.supervision.domain.validator.SupervisionRules.caMemberLimitNotReached;
import static io.github.admission.supervision.domain.validator.SupervisionRules.caMembersApproved;
import static io.github.admission.supervision.domain.validator.SupervisionRules.cotutelleComplete;
import static io.github.admission.supervision.domain.validator.SupervisionRules.externalPromoterForCotutelle;
import static io.github.admission.supervision.domain.validator.SupervisionRules.notAlreadyCaMember;
import static io.github.admission.supervision.domain.validator.SupervisionRules.notAlreadyPromoter;
import static io.github.admission.supervision.domain.validator.SupervisionRules.promoterLimitNotReached;
import static io.github.admission.supervision.domain.validator.SupervisionRules.promotersApproved;
import static io.github.admission.supervision.domain.validator.SupervisionRules.referencePromoterDesignated;
import static io.github.admission.supervision.domain.validator.SupervisionRules.referencePromoterInGroup;
import static io.github.admission.supervision.domain.validator.SupervisionRules.signaturesNotYetSent;
import static io.github.admission.supervision.domain.validator.SupervisionRules.signatoryExternal;
import static io.github.admission.supervision.domain.validator.SupervisionRules.signatoryInGroup;
import static io.github.admission.supervision.domain.validator.SupervisionRules.signatoryInvited;
import static io.github.admission.supervision.domain.validator.SupervisionRules.signatoryNotAlreadyInvited;
import static io.github.admission.supervision.domain.validator.SupervisionRules.thesisInstituteDocumentedByReferencePromoter;

import io.github.admission.ddd.validation.ValidatorList;
import io.github.admission.supervision.SupervisionSettings;
import io.github.admission.supervision.domain.model.CaMemberIdentity;
import io.github.admission.supervision.domain.model.PromoterIdentity;
import io.github.admission.supervision.domain.model.SignatoryIdentity;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.domain.model.ThesisInstituteIdentity;
import io.github.admission.supervision.domain.service.PromoterDirectory;

/** Ordered rule lists, one per business action on a {@link SupervisionGroup}. */
public final class SupervisionValidators {
  private SupervisionValidators() {
    // Cannot be instantiated
  }

  public static ValidatorList<SupervisionGroup> addPromoter(
      final PromoterIdentity promoter, final SupervisionSettings settings) {
    return ValidatorList.of(
        promoterLimitNotReached(settings.maxPromoters()),
        notAlreadyPromoter(promoter.id()),
        notAlreadyCaMember(promoter.id()));
  }

  public static ValidatorList<SupervisionGroup> addCaMember(
      final CaMemberIdentity caMember, final SupervisionSettings settings) {
    return ValidatorList.of(
        caMemberLimitNotReached(settings.maxCaMembers()),
        notAlreadyPromoter(caMember.id()),
        notAlreadyCaMember(caMember.id()));
  }

  public static ValidatorList<SupervisionGroup> designateReferencePromoter(
      final PromoterIdentity promoter) {
    return ValidatorList.of(referencePromoterInGroup(promoter));
  }

  public static ValidatorList<SupervisionGroup> inviteToSign(final SignatoryIdentity signatory) {
    return ValidatorList.of(signatoryInGroup(signatory), signatoryNotAlreadyInvited(signatory));
  }

  /** Shared by approvals and refusals. */
  public static ValidatorList<SupervisionGroup> decide(final SignatoryIdentity signatory) {
    return ValidatorList.of(signatoryInGroup(signatory), signatoryInvited(signatory));
  }

  public static ValidatorList<SupervisionGroup> editExternalMember(
      final SignatoryIdentity signatory) {
    return ValidatorList.of(signatoryInGroup(signatory), signatoryExternal(signatory));
  }

  /** External signatories only, while their answer is still awaited. */
  public static ValidatorList<SupervisionGroup> resendInvitation(
      final SignatoryIdentity signatory) {
    return ValidatorList.of(
        signatoryInGroup(signatory), signatoryExternal(signatory), signatoryInvited(signatory));
  }

  public static ValidatorList<SupervisionGroup> everyoneApproved() {
    return ValidatorList.of(promotersApproved(), caMembersApproved());
  }

  public static ValidatorList<SupervisionGroup> cotutelle() {
    return ValidatorList.of(cotutelleComplete());
  }

  public static ValidatorList<SupervisionGroup> signatoriesComplete() {
    return ValidatorList.of(atLeastOneCaMember());
  }

  /**
   * Checks which only matter when the candidate asks for signatures, on top of {@link
   * #signatoriesComplete()} and {@link #cotutelle()}.
   *
   * @param directory telling which promoters come from another institution
   * @return the submission-specific rules
   */
  public static ValidatorList<SupervisionGroup> signatureRequest(
      final PromoterDirectory directory) {
    return ValidatorList.of(
        atLeastOnePromoter(),
        referencePromoterDesignated(),
        externalPromoterForCotutelle(directory));
  }

  /**
   * @param directory telling which promoters come from another institution
   * @return every rule to satisfy before signatures can be requested, in display order
   */
  public static ValidatorList<SupervisionGroup> fullSignatureRequest(
      final PromoterDirectory directory) {
    return signatoriesComplete().andThen(signatureRequest(directory)).andThen(cotutelle());
  }

  public static ValidatorList<SupervisionGroup> referencePromoterThesisInstitute(
      final SignatoryIdentity signatory,
      final PromoterIdentity referencePromoter,
      final ThesisInstituteIdentity propositionThesisInstitute,
      final String thesisInstituteFreeText) {
    return ValidatorList.of(
        thesisInstituteDocumentedByReferencePromoter(
            signatory, referencePromoter, propositionThesisInstitute, thesisInstituteFreeText));
  }

  public static ValidatorList<SupervisionGroup> compositionOpen() {
    return ValidatorList.of(signaturesNotYetSent());
  }
}
