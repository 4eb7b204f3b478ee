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

import io.github.admission.ddd.validation.BusinessException;
import io.github.admission.ddd.validation.MultipleBusinessExceptions;
import io.github.admission.supervision.SupervisionSettings;
import io.github.admission.supervision.domain.exception.CaMemberNotFoundException;
import io.github.admission.supervision.domain.exception.PromoterNotFoundException;
import io.github.admission.supervision.domain.exception.SignatoryNotFoundException;
import io.github.admission.supervision.domain.validator.SupervisionValidators;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Signatories who must approve a doctoral proposition before it can be submitted, with the state
 * of each signature.
 *
 * <p>Signatures are kept in insertion order and keyed by signatory, so that replacing an entry
 * keeps its position. An identifier appears at most once in the group, whatever its role.
 *
 * <p>Every mutation validates its preconditions before changing anything: a rejected call leaves
 * the group untouched. Instances are not thread-safe, they are meant to live within a single
 * load-change-save unit of work.
 */
public final class SupervisionGroup {
  private final SupervisionGroupIdentity id;
  private final PropositionIdentity propositionId;
  private final Map<PromoterIdentity, PromoterSignature> promoterSignatures;
  private final Map<CaMemberIdentity, CaMemberSignature> caMemberSignatures;
  private final Map<SignatoryIdentity, ExternalMember> externalMembers;
  private Cotutelle cotutelle;
  private GroupSignatureStatus status;
  private PromoterIdentity referencePromoter;
  private long version;

  private SupervisionGroup(
      final SupervisionGroupIdentity id,
      final PropositionIdentity propositionId,
      final List<PromoterSignature> promoterSignatures,
      final List<CaMemberSignature> caMemberSignatures,
      final Map<SignatoryIdentity, ExternalMember> externalMembers,
      final Cotutelle cotutelle,
      final GroupSignatureStatus status,
      final PromoterIdentity referencePromoter,
      final long version) {
    if (id == null) {
      throw new IllegalArgumentException("Supervision group ID cannot be null");
    }

    if (propositionId == null) {
      throw new IllegalArgumentException("Proposition ID cannot be null");
    }

    if (status == null) {
      throw new IllegalArgumentException("Signature status cannot be null");
    }

    if (version < 0) {
      throw new IllegalArgumentException("Version cannot be negative");
    }

    this.id = id;
    this.propositionId = propositionId;
    this.promoterSignatures = new LinkedHashMap<>();
    this.caMemberSignatures = new LinkedHashMap<>();
    this.externalMembers = new LinkedHashMap<>();
    this.cotutelle = cotutelle;
    this.status = status;
    this.version = version;

    final var personIds = new HashSet<String>();
    for (PromoterSignature signature : promoterSignatures) {
      if (!personIds.add(signature.signatory().id())) {
        throw new IllegalArgumentException(
            "'%s' appears twice in the group".formatted(signature.signatory().id()));
      }
      this.promoterSignatures.put(signature.signatory(), signature);
    }
    for (CaMemberSignature signature : caMemberSignatures) {
      if (!personIds.add(signature.signatory().id())) {
        throw new IllegalArgumentException(
            "'%s' appears twice in the group".formatted(signature.signatory().id()));
      }
      this.caMemberSignatures.put(signature.signatory(), signature);
    }

    if (referencePromoter != null && !this.promoterSignatures.containsKey(referencePromoter)) {
      throw new IllegalArgumentException(
          "Reference promoter '%s' is not part of the group".formatted(referencePromoter.id()));
    }
    this.referencePromoter = referencePromoter;

    externalMembers.forEach(
        (signatory, details) -> {
          if (findSignature(signatory).isEmpty()) {
            throw new IllegalArgumentException(
                "External member '%s' is not part of the group".formatted(signatory.id()));
          }

          if (details == null) {
            throw new IllegalArgumentException(
                "External member '%s' has no details".formatted(signatory.id()));
          }

          this.externalMembers.put(signatory, details);
        });
  }

  /**
   * @param id of the new group
   * @param propositionId owning the group
   * @return an empty group, never saved yet
   */
  public static SupervisionGroup initiate(
      final SupervisionGroupIdentity id, final PropositionIdentity propositionId) {
    return new SupervisionGroup(
        id,
        propositionId,
        List.of(),
        List.of(),
        Map.of(),
        null,
        GroupSignatureStatus.IN_PROGRESS,
        null,
        0L);
  }

  /**
   * Rebuilds a group without external members from storage.
   *
   * @throws IllegalArgumentException if the stored state breaks an invariant of the group
   */
  public static SupervisionGroup restore(
      final SupervisionGroupIdentity id,
      final PropositionIdentity propositionId,
      final List<PromoterSignature> promoterSignatures,
      final List<CaMemberSignature> caMemberSignatures,
      final Cotutelle cotutelle,
      final GroupSignatureStatus status,
      final PromoterIdentity referencePromoter,
      final long version) {
    return restore(
        id,
        propositionId,
        promoterSignatures,
        caMemberSignatures,
        Map.of(),
        cotutelle,
        status,
        referencePromoter,
        version);
  }

  /**
   * Rebuilds a group from storage.
   *
   * @param externalMembers details keyed by signatory, every signatory must be part of the group
   * @throws IllegalArgumentException if the stored state breaks an invariant of the group
   */
  public static SupervisionGroup restore(
      final SupervisionGroupIdentity id,
      final PropositionIdentity propositionId,
      final List<PromoterSignature> promoterSignatures,
      final List<CaMemberSignature> caMemberSignatures,
      final Map<SignatoryIdentity, ExternalMember> externalMembers,
      final Cotutelle cotutelle,
      final GroupSignatureStatus status,
      final PromoterIdentity referencePromoter,
      final long version) {
    return new SupervisionGroup(
        id,
        propositionId,
        promoterSignatures == null ? List.of() : promoterSignatures,
        caMemberSignatures == null ? List.of() : caMemberSignatures,
        externalMembers == null ? Map.of() : externalMembers,
        cotutelle,
        status,
        referencePromoter,
        version);
  }

  /**
   * @param promoter to add with a {@link SignatureState#NOT_INVITED} signature
   * @param settings capping the number of promoters
   * @throws BusinessException if the group is full or the person already belongs to it
   */
  public void addPromoter(final PromoterIdentity promoter, final SupervisionSettings settings) {
    addPromoter(promoter, null, settings);
  }

  /**
   * @param promoter to add with a {@link SignatureState#NOT_INVITED} signature
   * @param external contact details when the promoter is not in the person registry, {@code null}
   *     otherwise
   * @param settings capping the number of promoters
   * @throws BusinessException if the group is full or the person already belongs to it
   */
  public void addPromoter(
      final PromoterIdentity promoter,
      final ExternalMember external,
      final SupervisionSettings settings) {
    SupervisionValidators.addPromoter(promoter, settings).failFast(this);
    promoterSignatures.put(promoter, PromoterSignature.notInvited(promoter));
    if (external != null) {
      externalMembers.put(promoter, external);
    }
  }

  /**
   * @param caMember to add with a {@link SignatureState#NOT_INVITED} signature
   * @param settings capping the number of CA members
   * @throws BusinessException if the group is full or the person already belongs to it
   */
  public void addCaMember(final CaMemberIdentity caMember, final SupervisionSettings settings) {
    addCaMember(caMember, null, settings);
  }

  /**
   * @param caMember to add with a {@link SignatureState#NOT_INVITED} signature
   * @param external contact details when the member is not in the person registry, {@code null}
   *     otherwise
   * @param settings capping the number of CA members
   * @throws BusinessException if the group is full or the person already belongs to it
   */
  public void addCaMember(
      final CaMemberIdentity caMember,
      final ExternalMember external,
      final SupervisionSettings settings) {
    SupervisionValidators.addCaMember(caMember, settings).failFast(this);
    caMemberSignatures.put(caMember, CaMemberSignature.notInvited(caMember));
    if (external != null) {
      externalMembers.put(caMember, external);
    }
  }

  /**
   * @param signatory from another institution
   * @param details replacing the current ones
   * @throws SignatoryNotFoundException if the signatory is not part of the group
   * @throws io.github.admission.supervision.domain.exception.SignatoryNotExternalException if the
   *     signatory is in the person registry
   */
  public void editExternalMember(final SignatoryIdentity signatory, final ExternalMember details) {
    if (details == null) {
      throw new IllegalArgumentException("External member details cannot be null");
    }

    SupervisionValidators.editExternalMember(signatory).failFast(this);
    externalMembers.put(signatory, details);
  }

  /**
   * Checks that a new invitation can be sent to an external signatory who did not answer yet. The
   * signature itself does not change.
   *
   * @param signatory from another institution, already invited
   * @throws SignatoryNotFoundException if the signatory is not part of the group
   * @throws io.github.admission.supervision.domain.exception.SignatoryNotExternalException if the
   *     signatory is in the person registry
   * @throws io.github.admission.supervision.domain.exception.SignatoryNotInvitedException if the
   *     signatory is not waiting for an answer
   */
  public void resendInvitation(final SignatoryIdentity signatory) {
    SupervisionValidators.resendInvitation(signatory).failFast(this);
  }

  /** Replaces the previous reference promoter, if any. */
  public void designateReferencePromoter(final PromoterIdentity promoter) {
    SupervisionValidators.designateReferencePromoter(promoter).failFast(this);
    referencePromoter = promoter;
  }

  /**
   * Looks the identifier up among promoters first, then among CA members.
   *
   * @param personId of the signatory
   * @return the signatory with its role
   * @throws SignatoryNotFoundException if nobody in the group has this identifier
   */
  public SignatoryIdentity getSignatory(final String personId) {
    return Stream.<SignatoryIdentity>concat(
            promoterSignatures.keySet().stream(), caMemberSignatures.keySet().stream())
        .filter(signatory -> signatory.id().equals(personId))
        .findFirst()
        .orElseThrow(SignatoryNotFoundException::new);
  }

  /**
   * @throws SignatoryNotFoundException if nobody in the group has this identifier
   * @throws PromoterNotFoundException if the identifier belongs to a CA member
   */
  public PromoterIdentity getPromoter(final String personId) {
    if (getSignatory(personId) instanceof PromoterIdentity promoter) {
      return promoter;
    }

    throw new PromoterNotFoundException();
  }

  /**
   * @throws SignatoryNotFoundException if nobody in the group has this identifier
   * @throws CaMemberNotFoundException if the identifier belongs to a promoter
   */
  public CaMemberIdentity getCaMember(final String personId) {
    if (getSignatory(personId) instanceof CaMemberIdentity caMember) {
      return caMember;
    }

    throw new CaMemberNotFoundException();
  }

  /**
   * Invites every signatory not invited yet or who declined. Each of them is validated before any
   * signature changes, so a rejected call invites nobody.
   */
  public void inviteAllPendingToSign() {
    signatures()
        .filter(signature -> signature.state().isAwaitingInvitation())
        .<SignatoryIdentity>map(SignatureEntry::signatory)
        .toList()
        .forEach(signatory -> SupervisionValidators.inviteToSign(signatory).failFast(this));

    promoterSignatures.replaceAll(
        (promoter, signature) ->
            signature.state().isAwaitingInvitation() ? signature.invite() : signature);
    caMemberSignatures.replaceAll(
        (caMember, signature) ->
            signature.state().isAwaitingInvitation() ? signature.invite() : signature);
  }

  /** Removing the reference promoter leaves the group without one. */
  public void removePromoter(final PromoterIdentity promoter) {
    promoterSignatures.remove(promoter);
    externalMembers.remove(promoter);

    if (promoter != null && promoter.equals(referencePromoter)) {
      referencePromoter = null;
    }
  }

  public void removeCaMember(final CaMemberIdentity caMember) {
    caMemberSignatures.remove(caMember);
    externalMembers.remove(caMember);
  }

  /**
   * @throws SignatoryNotFoundException if the signatory is not part of the group
   * @throws io.github.admission.supervision.domain.exception.SignatoryNotInvitedException if the
   *     signatory was not invited
   */
  public void approve(
      final SignatoryIdentity signatory,
      final String internalComment,
      final String externalComment) {
    SupervisionValidators.decide(signatory).failFast(this);

    if (signatory instanceof PromoterIdentity promoter) {
      promoterSignatures.computeIfPresent(
          promoter, (key, signature) -> signature.approve(internalComment, externalComment));
    } else if (signatory instanceof CaMemberIdentity caMember) {
      caMemberSignatures.computeIfPresent(
          caMember, (key, signature) -> signature.approve(internalComment, externalComment));
    }
  }

  /**
   * Records an approval signed on paper, the documents standing in for comments.
   *
   * @param signatory who signed
   * @param proofDocuments references of the scanned approval
   */
  public void approveByPdf(final SignatoryIdentity signatory, final List<String> proofDocuments) {
    SupervisionValidators.decide(signatory).failFast(this);

    if (signatory instanceof PromoterIdentity promoter) {
      promoterSignatures.computeIfPresent(
          promoter, (key, signature) -> signature.approveByPdf(proofDocuments));
    } else if (signatory instanceof CaMemberIdentity caMember) {
      caMemberSignatures.computeIfPresent(
          caMember, (key, signature) -> signature.approveByPdf(proofDocuments));
    }
  }

  /**
   * A refusing promoter declines and sends every other promoter back to {@link
   * SignatureState#NOT_INVITED}. A refusing CA member leaves the group.
   */
  public void refuse(
      final SignatoryIdentity signatory,
      final String internalComment,
      final String externalComment,
      final String refusalReason) {
    SupervisionValidators.decide(signatory).failFast(this);

    if (signatory instanceof PromoterIdentity promoter) {
      promoterSignatures.replaceAll(
          (key, signature) ->
              key.equals(promoter)
                  ? signature.decline(internalComment, externalComment, refusalReason)
                  : signature.reset());
    } else if (signatory instanceof CaMemberIdentity caMember) {
      removeCaMember(caMember);
    }
  }

  /**
   * @throws MultipleBusinessExceptions listing the roles which did not fully approve
   */
  public void verifyEveryoneApproved() {
    SupervisionValidators.everyoneApproved().accumulate(this);
  }

  /**
   * @throws MultipleBusinessExceptions if the cotutelle is undefined or incomplete
   */
  public void verifyCotutelle() {
    SupervisionValidators.cotutelle().accumulate(this);
  }

  /** Missing values are stored as blank ones. */
  public void defineCotutelle(
      final String motivation,
      final Boolean partnerConsortiumInstitution,
      final String institution,
      final String otherInstitutionName,
      final String otherInstitutionAddress,
      final List<String> openingRequestDocuments,
      final List<String> conventionDocuments,
      final List<String> otherDocuments) {
    cotutelle =
        new Cotutelle(
            motivation,
            partnerConsortiumInstitution,
            institution,
            otherInstitutionName,
            otherInstitutionAddress,
            openingRequestDocuments,
            conventionDocuments,
            otherDocuments);
  }

  public void lockForSignature() {
    status = GroupSignatureStatus.SIGNING_IN_PROGRESS;
  }

  /**
   * @throws MultipleBusinessExceptions if the group has no CA member
   */
  public void verifySignatoriesComplete() {
    SupervisionValidators.signatoriesComplete().accumulate(this);
  }

  /**
   * @throws io.github.admission.supervision.domain.exception.SignaturesAlreadySentException once
   *     the group is locked for signature
   */
  public void verifySignaturesNotYetSent() {
    SupervisionValidators.compositionOpen().failFast(this);
  }

  /**
   * @param signatory about to approve
   * @param referencePromoter of the group, {@code null} when none is designated
   * @param propositionThesisInstitute catalog reference stored on the proposition, if any
   * @param thesisInstituteFreeText given by the signatory when the catalog has no match
   * @throws io.github.admission.supervision.domain.exception.ThesisInstituteRequiredException if
   *     the reference promoter approves without any thesis institute
   */
  public void verifyReferencePromoterDocumentsThesisInstitute(
      final SignatoryIdentity signatory,
      final PromoterIdentity referencePromoter,
      final ThesisInstituteIdentity propositionThesisInstitute,
      final String thesisInstituteFreeText) {
    SupervisionValidators.referencePromoterThesisInstitute(
            signatory, referencePromoter, propositionThesisInstitute, thesisInstituteFreeText)
        .failFast(this);
  }

  /**
   * @return the signature of the signatory, matching both role and identifier
   */
  public Optional<SignatureEntry<?, ?>> findSignature(final SignatoryIdentity signatory) {
    if (signatory instanceof PromoterIdentity promoter) {
      return Optional.ofNullable(promoterSignatures.get(promoter));
    } else if (signatory instanceof CaMemberIdentity caMember) {
      return Optional.ofNullable(caMemberSignatures.get(caMember));
    }

    return Optional.empty();
  }

  public boolean hasPromoter(final String personId) {
    return promoterSignatures.keySet().stream().anyMatch(p -> p.id().equals(personId));
  }

  public boolean hasCaMember(final String personId) {
    return caMemberSignatures.keySet().stream().anyMatch(c -> c.id().equals(personId));
  }

  /**
   * @return {@code true} when contact details are kept for the signatory
   */
  public boolean isExternal(final SignatoryIdentity signatory) {
    return externalMembers.containsKey(signatory);
  }

  public Optional<ExternalMember> getExternalMember(final SignatoryIdentity signatory) {
    return Optional.ofNullable(externalMembers.get(signatory));
  }

  /**
   * @return details of external signatories, in the order they were added
   */
  public Map<SignatoryIdentity, ExternalMember> getExternalMembers() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(externalMembers));
  }

  public SupervisionGroupIdentity getId() {
    return id;
  }

  public PropositionIdentity getPropositionId() {
    return propositionId;
  }

  public List<PromoterSignature> getPromoterSignatures() {
    return List.copyOf(promoterSignatures.values());
  }

  public List<CaMemberSignature> getCaMemberSignatures() {
    return List.copyOf(caMemberSignatures.values());
  }

  public List<PromoterIdentity> getPromoters() {
    return List.copyOf(promoterSignatures.keySet());
  }

  public List<CaMemberIdentity> getCaMembers() {
    return List.copyOf(caMemberSignatures.keySet());
  }

  /**
   * @return promoters' signatures followed by CA members' ones
   */
  public List<SignatureEntry<?, ?>> getSignatures() {
    final var all = new ArrayList<SignatureEntry<?, ?>>(promoterSignatures.values());
    all.addAll(caMemberSignatures.values());
    return List.copyOf(all);
  }

  /**
   * @return the cotutelle, empty while the candidate did not answer
   */
  public Optional<Cotutelle> getCotutelle() {
    return Optional.ofNullable(cotutelle);
  }

  public GroupSignatureStatus getStatus() {
    return status;
  }

  public Optional<PromoterIdentity> getReferencePromoter() {
    return Optional.ofNullable(referencePromoter);
  }

  /**
   * @return version stored with the group, {@code 0} until first saved
   */
  public long getVersion() {
    return version;
  }

  /**
   * Called by repositories once the group was stored under a new version.
   *
   * @param savedVersion which must be greater than the current one
   */
  public void markSaved(final long savedVersion) {
    if (savedVersion <= version) {
      throw new IllegalArgumentException(
          "Saved version %d must be greater than %d".formatted(savedVersion, version));
    }

    version = savedVersion;
  }

  private Stream<SignatureEntry<?, ?>> signatures() {
    return Stream.<SignatureEntry<?, ?>>concat(
        promoterSignatures.values().stream(), caMemberSignatures.values().stream());
  }

  @Override
  public String toString() {
    return ("SupervisionGroup{id=%s, proposition=%s, status=%s, promoters=%d, caMembers=%d,"
            + " version=%d}")
        .formatted(
            id.uuid(),
            propositionId.uuid(),
            status,
            promoterSignatures.size(),
            caMemberSignatures.size(),
            version);
  }
}
