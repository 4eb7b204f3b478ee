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

package io.github.admission.supervision.repository;

import static io.github.admission.supervision.repository.SupervisionTables.DOCUMENT_GROUP_ID;
import static io.github.admission.supervision.repository.SupervisionTables.DOCUMENT_KIND;
import static io.github.admission.supervision.repository.SupervisionTables.DOCUMENT_OWNER;
import static io.github.admission.supervision.repository.SupervisionTables.DOCUMENT_REFERENCE;
import static io.github.admission.supervision.repository.SupervisionTables.DOCUMENT_SORT_INDEX;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_CITY;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_COUNTRY;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_DOCTOR;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_EMAIL;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_FIELDS;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_FIRST_NAME;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_GROUP_ID;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_INSTITUTION;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_LANGUAGE;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_LAST_NAME;
import static io.github.admission.supervision.repository.SupervisionTables.EXTERNAL_SIGNATORY_ID;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_COTUTELLE_ANSWERED;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_COTUTELLE_INSTITUTION;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_COTUTELLE_MOTIVATION;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_COTUTELLE_OTHER_INSTITUTION_ADDRESS;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_COTUTELLE_OTHER_INSTITUTION_NAME;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_COTUTELLE_PARTNER_CONSORTIUM;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_FIELDS;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_ID;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_PROPOSITION_ID;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_REFERENCE_PROMOTER_ID;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_STATUS;
import static io.github.admission.supervision.repository.SupervisionTables.GROUP_VERSION;
import static io.github.admission.supervision.repository.SupervisionTables.SIGNATURE_EXTERNAL_COMMENT;
import static io.github.admission.supervision.repository.SupervisionTables.SIGNATURE_GROUP_ID;
import static io.github.admission.supervision.repository.SupervisionTables.SIGNATURE_INTERNAL_COMMENT;
import static io.github.admission.supervision.repository.SupervisionTables.SIGNATURE_REFUSAL_REASON;
import static io.github.admission.supervision.repository.SupervisionTables.SIGNATURE_ROLE;
import static io.github.admission.supervision.repository.SupervisionTables.SIGNATURE_SIGNATORY_ID;
import static io.github.admission.supervision.repository.SupervisionTables.SIGNATURE_SORT_INDEX;
import static io.github.admission.supervision.repository.SupervisionTables.SIGNATURE_STATE;
import static io.github.admission.supervision.repository.SupervisionTables.SUPERVISION_DOCUMENT;
import static io.github.admission.supervision.repository.SupervisionTables.SUPERVISION_EXTERNAL_MEMBER;
import static io.github.admission.supervision.repository.SupervisionTables.SUPERVISION_GROUP;
import static io.github.admission.supervision.repository.SupervisionTables.SUPERVISION_SIGNATURE;

import io.github.admission.supervision.domain.exception.SupervisionGroupNotFoundException;
import io.github.admission.supervision.domain.model.CaMemberIdentity;
import io.github.admission.supervision.domain.model.CaMemberSignature;
import io.github.admission.supervision.domain.model.Cotutelle;
import io.github.admission.supervision.domain.model.ExternalMember;
import io.github.admission.supervision.domain.model.GroupSignatureStatus;
import io.github.admission.supervision.domain.model.PromoterIdentity;
import io.github.admission.supervision.domain.model.PromoterSignature;
import io.github.admission.supervision.domain.model.PropositionIdentity;
import io.github.admission.supervision.domain.model.SignatoryIdentity;
import io.github.admission.supervision.domain.model.SignatoryRole;
import io.github.admission.supervision.domain.model.SignatureEntry;
import io.github.admission.supervision.domain.model.SignatureState;
import io.github.admission.supervision.domain.model.SupervisionGroup;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Query;
import org.jooq.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores a {@link SupervisionGroup} as one row, one row per signature, one row per external
 * member and one row per document reference, using the {@link DSLContext} of the running
 * transaction.
 *
 * <p>The group row carries a version stamp: a group is inserted at version 1 and every later save
 * only succeeds if the stored version is still the one the group was loaded with.
 */
public final class JooqSupervisionGroupRepository implements SupervisionGroupRepository {
  private static final Logger LOG = LoggerFactory.getLogger(JooqSupervisionGroupRepository.class);

  private static final String GROUP_OWNER = "";

  private enum DocumentKind {
    APPROVAL_PROOF,
    COTUTELLE_OPENING_REQUEST,
    COTUTELLE_CONVENTION,
    COTUTELLE_OTHER
  }

  private record DocumentOwner(DocumentKind kind, String ownerId) {}

  private final DSLContext dsl;

  /**
   * @param dsl bound to the transaction the repository takes part in
   * @throws IllegalArgumentException if dsl is {@code null}
   */
  public JooqSupervisionGroupRepository(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    this.dsl = dsl;
  }

  /** {@inheritDoc} */
  @Override
  public SupervisionGroup load(final SupervisionGroupIdentity id) {
    if (id == null) {
      throw new IllegalArgumentException("Supervision group ID is null");
    }

    return dsl.select(GROUP_FIELDS)
        .from(SUPERVISION_GROUP)
        .where(GROUP_ID.eq(id.uuid()))
        .fetchOptional()
        .map(this::toSupervisionGroup)
        .orElseThrow(SupervisionGroupNotFoundException::new);
  }

  /** {@inheritDoc} */
  @Override
  public Optional<SupervisionGroup> findByPropositionId(final PropositionIdentity propositionId) {
    if (propositionId == null) {
      throw new IllegalArgumentException("Proposition ID is null");
    }

    return dsl.select(GROUP_FIELDS)
        .from(SUPERVISION_GROUP)
        .where(GROUP_PROPOSITION_ID.eq(propositionId.uuid()))
        .fetchOptional()
        .map(this::toSupervisionGroup);
  }

  /** {@inheritDoc} */
  @Override
  public List<SupervisionGroup> findBySignatory(final String personId) {
    if (personId == null) {
      throw new IllegalArgumentException("Person ID is null");
    }

    return dsl.select(GROUP_FIELDS)
        .from(SUPERVISION_GROUP)
        .where(
            GROUP_ID.in(
                dsl.select(SIGNATURE_GROUP_ID)
                    .from(SUPERVISION_SIGNATURE)
                    .where(SIGNATURE_SIGNATORY_ID.eq(personId))))
        .orderBy(GROUP_PROPOSITION_ID)
        .fetch(this::toSupervisionGroup);
  }

  /**
   * {@inheritDoc}
   *
   * @throws SupervisionGroupConflictException if the stored group has a newer version
   */
  @Override
  public void save(final SupervisionGroup group) {
    if (group == null) {
      throw new IllegalArgumentException("Supervision group is null");
    }

    final UUID groupId = group.getId().uuid();
    final long loadedVersion = group.getVersion();
    final long savedVersion = loadedVersion + 1;

    if (loadedVersion == 0) {
      dsl.insertInto(SUPERVISION_GROUP)
          .set(GROUP_ID, groupId)
          .set(GROUP_PROPOSITION_ID, group.getPropositionId().uuid())
          .set(mutableColumns(group))
          .set(GROUP_VERSION, savedVersion)
          .execute();
    } else {
      final int updated =
          dsl.update(SUPERVISION_GROUP)
              .set(mutableColumns(group))
              .set(GROUP_VERSION, savedVersion)
              .where(GROUP_ID.eq(groupId))
              .and(GROUP_VERSION.eq(loadedVersion))
              .execute();

      if (updated == 0) {
        LOG.warn(
            "Supervision group '{}' was changed concurrently, version {} is stale",
            groupId,
            loadedVersion);
        throw new SupervisionGroupConflictException(group.getId(), loadedVersion);
      }

      dsl.deleteFrom(SUPERVISION_DOCUMENT).where(DOCUMENT_GROUP_ID.eq(groupId)).execute();
      dsl.deleteFrom(SUPERVISION_EXTERNAL_MEMBER).where(EXTERNAL_GROUP_ID.eq(groupId)).execute();
      dsl.deleteFrom(SUPERVISION_SIGNATURE).where(SIGNATURE_GROUP_ID.eq(groupId)).execute();
    }

    childInserts(groupId, group).forEach(Query::execute);

    group.markSaved(savedVersion);
    LOG.debug("Saved supervision group '{}' at version {}", groupId, savedVersion);
  }

  private static Map<Field<?>, Object> mutableColumns(final SupervisionGroup group) {
    final Cotutelle cotutelle = group.getCotutelle().orElse(Cotutelle.NONE);

    final Map<Field<?>, Object> columns = new LinkedHashMap<>();
    columns.put(GROUP_STATUS, group.getStatus().name());
    columns.put(
        GROUP_REFERENCE_PROMOTER_ID,
        group.getReferencePromoter().map(PromoterIdentity::id).orElse(null));
    columns.put(GROUP_COTUTELLE_ANSWERED, group.getCotutelle().isPresent());
    columns.put(GROUP_COTUTELLE_MOTIVATION, cotutelle.motivation());
    columns.put(GROUP_COTUTELLE_PARTNER_CONSORTIUM, cotutelle.partnerConsortiumInstitution());
    columns.put(GROUP_COTUTELLE_INSTITUTION, cotutelle.institution());
    columns.put(GROUP_COTUTELLE_OTHER_INSTITUTION_NAME, cotutelle.otherInstitutionName());
    columns.put(GROUP_COTUTELLE_OTHER_INSTITUTION_ADDRESS, cotutelle.otherInstitutionAddress());
    return columns;
  }

  private List<Query> childInserts(final UUID groupId, final SupervisionGroup group) {
    final List<Query> inserts = new ArrayList<>();

    int sortIndex = 0;
    for (SignatureEntry<?, ?> signature : group.getSignatures()) {
      inserts.add(
          dsl.insertInto(SUPERVISION_SIGNATURE)
              .set(SIGNATURE_GROUP_ID, groupId)
              .set(SIGNATURE_SIGNATORY_ID, signature.signatory().id())
              .set(SIGNATURE_ROLE, signature.signatory().role().name())
              .set(SIGNATURE_SORT_INDEX, sortIndex++)
              .set(SIGNATURE_STATE, signature.state().name())
              .set(SIGNATURE_INTERNAL_COMMENT, signature.internalComment())
              .set(SIGNATURE_EXTERNAL_COMMENT, signature.externalComment())
              .set(SIGNATURE_REFUSAL_REASON, signature.refusalReason()));
      addDocumentInserts(
          inserts,
          groupId,
          new DocumentOwner(DocumentKind.APPROVAL_PROOF, signature.signatory().id()),
          signature.approvalProof());
    }

    group
        .getExternalMembers()
        .forEach(
            (signatory, details) ->
                inserts.add(
                    dsl.insertInto(SUPERVISION_EXTERNAL_MEMBER)
                        .set(EXTERNAL_GROUP_ID, groupId)
                        .set(EXTERNAL_SIGNATORY_ID, signatory.id())
                        .set(EXTERNAL_FIRST_NAME, details.firstName())
                        .set(EXTERNAL_LAST_NAME, details.lastName())
                        .set(EXTERNAL_EMAIL, details.email())
                        .set(EXTERNAL_DOCTOR, details.doctor())
                        .set(EXTERNAL_INSTITUTION, details.institution())
                        .set(EXTERNAL_CITY, details.city())
                        .set(EXTERNAL_COUNTRY, details.country())
                        .set(EXTERNAL_LANGUAGE, details.language())));

    group
        .getCotutelle()
        .ifPresent(
            cotutelle -> {
              addDocumentInserts(
                  inserts,
                  groupId,
                  new DocumentOwner(DocumentKind.COTUTELLE_OPENING_REQUEST, GROUP_OWNER),
                  cotutelle.openingRequestDocuments());
              addDocumentInserts(
                  inserts,
                  groupId,
                  new DocumentOwner(DocumentKind.COTUTELLE_CONVENTION, GROUP_OWNER),
                  cotutelle.conventionDocuments());
              addDocumentInserts(
                  inserts,
                  groupId,
                  new DocumentOwner(DocumentKind.COTUTELLE_OTHER, GROUP_OWNER),
                  cotutelle.otherDocuments());
            });

    return inserts;
  }

  private void addDocumentInserts(
      final List<Query> inserts,
      final UUID groupId,
      final DocumentOwner owner,
      final List<String> references) {
    for (int i = 0; i < references.size(); i++) {
      inserts.add(
          dsl.insertInto(SUPERVISION_DOCUMENT)
              .set(DOCUMENT_GROUP_ID, groupId)
              .set(DOCUMENT_KIND, owner.kind().name())
              .set(DOCUMENT_OWNER, owner.ownerId())
              .set(DOCUMENT_SORT_INDEX, i)
              .set(DOCUMENT_REFERENCE, references.get(i)));
    }
  }

  private SupervisionGroup toSupervisionGroup(final Record groupRecord) {
    final UUID groupId = groupRecord.get(GROUP_ID);

    final Map<DocumentOwner, List<String>> documents =
        dsl.select(DOCUMENT_KIND, DOCUMENT_OWNER, DOCUMENT_REFERENCE)
            .from(SUPERVISION_DOCUMENT)
            .where(DOCUMENT_GROUP_ID.eq(groupId))
            .orderBy(DOCUMENT_SORT_INDEX)
            .fetch()
            .stream()
            .collect(
                Collectors.groupingBy(
                    row -> new DocumentOwner(DocumentKind.valueOf(row.value1()), row.value2()),
                    Collectors.mapping(row -> row.value3(), Collectors.toList())));

    final Map<String, SignatoryIdentity> signatories = new LinkedHashMap<>();
    final List<PromoterSignature> promoterSignatures = new ArrayList<>();
    final List<CaMemberSignature> caMemberSignatures = new ArrayList<>();
    dsl.select(
            SIGNATURE_SIGNATORY_ID,
            SIGNATURE_ROLE,
            SIGNATURE_STATE,
            SIGNATURE_INTERNAL_COMMENT,
            SIGNATURE_EXTERNAL_COMMENT,
            SIGNATURE_REFUSAL_REASON)
        .from(SUPERVISION_SIGNATURE)
        .where(SIGNATURE_GROUP_ID.eq(groupId))
        .orderBy(SIGNATURE_SORT_INDEX)
        .fetch()
        .forEach(
            row -> {
              final SignatoryIdentity signatory =
                  SignatoryIdentity.of(SignatoryRole.valueOf(row.value2()), row.value1());
              final SignatureState state = SignatureState.valueOf(row.value3());
              final List<String> proof =
                  documents.getOrDefault(
                      new DocumentOwner(DocumentKind.APPROVAL_PROOF, signatory.id()), List.of());

              signatories.put(signatory.id(), signatory);
              if (signatory instanceof PromoterIdentity promoter) {
                promoterSignatures.add(
                    new PromoterSignature(
                        promoter, state, row.value4(), row.value5(), row.value6(), proof));
              } else if (signatory instanceof CaMemberIdentity caMember) {
                caMemberSignatures.add(
                    new CaMemberSignature(
                        caMember, state, row.value4(), row.value5(), row.value6(), proof));
              }
            });

    final Map<SignatoryIdentity, ExternalMember> externalMembers = new LinkedHashMap<>();
    dsl.select(EXTERNAL_FIELDS)
        .from(SUPERVISION_EXTERNAL_MEMBER)
        .where(EXTERNAL_GROUP_ID.eq(groupId))
        .orderBy(EXTERNAL_SIGNATORY_ID)
        .fetch()
        .forEach(
            row -> {
              final String signatoryId = row.get(EXTERNAL_SIGNATORY_ID);
              final SignatoryIdentity signatory = signatories.get(signatoryId);
              if (signatory == null) {
                throw new IllegalStateException(
                    "External member '%s' has no signature in supervision group '%s'"
                        .formatted(signatoryId, groupId));
              }

              externalMembers.put(
                  signatory,
                  new ExternalMember(
                      row.get(EXTERNAL_FIRST_NAME),
                      row.get(EXTERNAL_LAST_NAME),
                      row.get(EXTERNAL_EMAIL),
                      row.get(EXTERNAL_DOCTOR),
                      row.get(EXTERNAL_INSTITUTION),
                      row.get(EXTERNAL_CITY),
                      row.get(EXTERNAL_COUNTRY),
                      row.get(EXTERNAL_LANGUAGE)));
            });

    final Cotutelle cotutelle =
        Boolean.TRUE.equals(groupRecord.get(GROUP_COTUTELLE_ANSWERED))
            ? new Cotutelle(
                groupRecord.get(GROUP_COTUTELLE_MOTIVATION),
                groupRecord.get(GROUP_COTUTELLE_PARTNER_CONSORTIUM),
                groupRecord.get(GROUP_COTUTELLE_INSTITUTION),
                groupRecord.get(GROUP_COTUTELLE_OTHER_INSTITUTION_NAME),
                groupRecord.get(GROUP_COTUTELLE_OTHER_INSTITUTION_ADDRESS),
                cotutelleDocuments(documents, DocumentKind.COTUTELLE_OPENING_REQUEST),
                cotutelleDocuments(documents, DocumentKind.COTUTELLE_CONVENTION),
                cotutelleDocuments(documents, DocumentKind.COTUTELLE_OTHER))
            : null;

    final String referencePromoterId = groupRecord.get(GROUP_REFERENCE_PROMOTER_ID);

    return SupervisionGroup.restore(
        new SupervisionGroupIdentity(groupId),
        new PropositionIdentity(groupRecord.get(GROUP_PROPOSITION_ID)),
        promoterSignatures,
        caMemberSignatures,
        externalMembers,
        cotutelle,
        GroupSignatureStatus.valueOf(groupRecord.get(GROUP_STATUS)),
        referencePromoterId == null ? null : new PromoterIdentity(referencePromoterId),
        groupRecord.get(GROUP_VERSION));
  }

  private static List<String> cotutelleDocuments(
      final Map<DocumentOwner, List<String>> documents, final DocumentKind kind) {
    return documents.getOrDefault(new DocumentOwner(kind, GROUP_OWNER), List.of());
  }
}
