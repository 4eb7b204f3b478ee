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

import io.github.admission.ddd.validation.BusinessValidator;
import io.github.admission.supervision.domain.exception.CaMemberLimitReachedException;
import io.github.admission.supervision.domain.exception.CaMembersNotApprovedException;
import io.github.admission.supervision.domain.exception.CotutelleIncompleteException;
import io.github.admission.supervision.domain.exception.CotutelleRequiresExternalPromoterException;
import io.github.admission.supervision.domain.exception.MissingCaMemberException;
import io.github.admission.supervision.domain.exception.MissingPromoterException;
import io.github.admission.supervision.domain.exception.MissingReferencePromoterException;
import io.github.admission.supervision.domain.exception.PromoterLimitReachedException;
import io.github.admission.supervision.domain.exception.PromotersNotApprovedException;
import io.github.admission.supervision.domain.exception.ReferencePromoterNotInGroupException;
import io.github.admission.supervision.domain.exception.SignatoryAlreadyInvitedException;
import io.github.admission.supervision.domain.exception.SignatoryAlreadyMemberException;
import io.github.admission.supervision.domain.exception.SignatoryNotExternalException;
import io.github.admission.supervision.domain.exception.SignatoryNotFoundException;
import io.github.admission.supervision.domain.exception.SignatoryNotInvitedException;
import io.github.admission.supervision.domain.exception.SignaturesAlreadySentException;
import io.github.admission.supervision.domain.exception.ThesisInstituteRequiredException;
import io.github.admission.supervision.domain.model.Cotutelle;
import io.github.admission.supervision.domain.model.GroupSignatureStatus;
import io.github.admission.supervision.domain.model.PromoterIdentity;
import io.github.admission.supervision.domain.model.SignatoryIdentity;
import io.github.admission.supervision.domain.model.SignatureEntry;
import io.github.admission.supervision.domain.model.SignatureState;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.domain.model.ThesisInstituteIdentity;
import io.github.admission.supervision.domain.service.PromoterDirectory;

/**
 * Single-purpose rules over a {@link SupervisionGroup}.
 *
 * <p>Rules are composed per business action by {@link SupervisionValidators}.
 */
public final class SupervisionRules {
  private SupervisionRules() {
    // Cannot be instantiated
  }

  public static BusinessValidator<SupervisionGroup> promoterLimitNotReached(final int maximum) {
    return BusinessValidator.of(
        group -> group.getPromoterSignatures().size() < maximum,
        PromoterLimitReachedException::new);
  }

  public static BusinessValidator<SupervisionGroup> caMemberLimitNotReached(final int maximum) {
    return BusinessValidator.of(
        group -> group.getCaMemberSignatures().size() < maximum,
        CaMemberLimitReachedException::new);
  }

  /**
   * @param personId to add to the group
   * @return rule failing when the person already is a promoter of the group
   */
  public static BusinessValidator<SupervisionGroup> notAlreadyPromoter(final String personId) {
    return BusinessValidator.of(
        group -> !group.hasPromoter(personId), SignatoryAlreadyMemberException::new);
  }

  /**
   * @param personId to add to the group
   * @return rule failing when the person already is a CA member of the group
   */
  public static BusinessValidator<SupervisionGroup> notAlreadyCaMember(final String personId) {
    return BusinessValidator.of(
        group -> !group.hasCaMember(personId), SignatoryAlreadyMemberException::new);
  }

  public static BusinessValidator<SupervisionGroup> referencePromoterInGroup(
      final PromoterIdentity promoter) {
    return BusinessValidator.of(
        group -> group.findSignature(promoter).isPresent(),
        ReferencePromoterNotInGroupException::new);
  }

  public static BusinessValidator<SupervisionGroup> signatoryInGroup(
      final SignatoryIdentity signatory) {
    return BusinessValidator.of(
        group -> group.findSignature(signatory).isPresent(), SignatoryNotFoundException::new);
  }

  /**
   * Signatories missing from the group are left to {@link #signatoryInGroup(SignatoryIdentity)}.
   */
  public static BusinessValidator<SupervisionGroup> signatoryNotAlreadyInvited(
      final SignatoryIdentity signatory) {
    return BusinessValidator.of(
        group ->
            group
                .findSignature(signatory)
                .map(SignatureEntry::state)
                .filter(SignatureState.INVITED::equals)
                .isEmpty(),
        SignatoryAlreadyInvitedException::new);
  }

  public static BusinessValidator<SupervisionGroup> signatoryInvited(
      final SignatoryIdentity signatory) {
    return BusinessValidator.of(
        group ->
            group
                .findSignature(signatory)
                .map(SignatureEntry::state)
                .filter(SignatureState.INVITED::equals)
                .isPresent(),
        SignatoryNotInvitedException::new);
  }

  public static BusinessValidator<SupervisionGroup> promotersApproved() {
    return BusinessValidator.of(
        group ->
            group.getPromoterSignatures().stream()
                .allMatch(signature -> signature.state() == SignatureState.APPROVED),
        PromotersNotApprovedException::new);
  }

  public static BusinessValidator<SupervisionGroup> caMembersApproved() {
    return BusinessValidator.of(
        group ->
            group.getCaMemberSignatures().stream()
                .allMatch(signature -> signature.state() == SignatureState.APPROVED),
        CaMembersNotApprovedException::new);
  }

  /** An undefined cotutelle counts as incomplete, {@code Cotutelle.NONE} is accepted. */
  public static BusinessValidator<SupervisionGroup> cotutelleComplete() {
    return BusinessValidator.of(
        group -> group.getCotutelle().filter(Cotutelle::isComplete).isPresent(),
        CotutelleIncompleteException::new);
  }

  public static BusinessValidator<SupervisionGroup> atLeastOneCaMember() {
    return BusinessValidator.of(
        group -> !group.getCaMemberSignatures().isEmpty(), MissingCaMemberException::new);
  }

  public static BusinessValidator<SupervisionGroup> atLeastOnePromoter() {
    return BusinessValidator.of(
        group -> !group.getPromoterSignatures().isEmpty(), MissingPromoterException::new);
  }

  public static BusinessValidator<SupervisionGroup> referencePromoterDesignated() {
    return BusinessValidator.of(
        group -> group.getReferencePromoter().isPresent(),
        MissingReferencePromoterException::new);
  }

  /**
   * @param directory telling which registered promoters come from another institution
   * @return rule failing when a cotutelle is defined but every promoter is internal
   */
  public static BusinessValidator<SupervisionGroup> externalPromoterForCotutelle(
      final PromoterDirectory directory) {
    return BusinessValidator.of(
        group ->
            group.getCotutelle().filter(Cotutelle::isDefined).isEmpty()
                || group.getPromoters().stream()
                    .anyMatch(
                        promoter -> group.isExternal(promoter) || directory.isExternal(promoter)),
        CotutelleRequiresExternalPromoterException::new);
  }

  public static BusinessValidator<SupervisionGroup> signatoryExternal(
      final SignatoryIdentity signatory) {
    return BusinessValidator.of(
        group -> group.isExternal(signatory), SignatoryNotExternalException::new);
  }

  /**
   * @param signatory about to approve
   * @param referencePromoter designated for the group, {@code null} when none is
   * @param propositionThesisInstitute catalog reference stored on the proposition, if any
   * @param thesisInstituteFreeText given by the signatory when the catalog has no match
   * @return rule failing when the reference promoter approves without a thesis institute
   */
  public static BusinessValidator<SupervisionGroup> thesisInstituteDocumentedByReferencePromoter(
      final SignatoryIdentity signatory,
      final PromoterIdentity referencePromoter,
      final ThesisInstituteIdentity propositionThesisInstitute,
      final String thesisInstituteFreeText) {
    return BusinessValidator.of(
        group ->
            referencePromoter == null
                || !referencePromoter.equals(signatory)
                || propositionThesisInstitute != null
                || (thesisInstituteFreeText != null && !thesisInstituteFreeText.isBlank()),
        ThesisInstituteRequiredException::new);
  }

  public static BusinessValidator<SupervisionGroup> signaturesNotYetSent() {
    return BusinessValidator.of(
        group -> group.getStatus() != GroupSignatureStatus.SIGNING_IN_PROGRESS,
        SignaturesAlreadySentException::new);
  }
}
