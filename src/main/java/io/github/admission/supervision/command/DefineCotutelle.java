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

package io.github.admission.supervision.command;

import static io.github.admission.supervision.command.CommandPreconditions.copyOrEmpty;
import static io.github.admission.supervision.command.CommandPreconditions.throwIllegalArgumentIfNull;

import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.cqrs.DomainCommand;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.io.Serial;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Replaces the joint supervision arrangement of the group.
 *
 * @param messageId of the command
 * @param createdAt when the command was issued
 * @param domainClient issuing the command
 * @param groupId of the targeted supervision group
 * @param motivation of the joint supervision
 * @param partnerConsortiumInstitution whether the partner belongs to the consortium
 * @param institution catalog reference of the partner, when in the consortium
 * @param otherInstitutionName of the partner, when outside of the consortium
 * @param otherInstitutionAddress of the partner, when outside of the consortium
 * @param openingRequestDocuments references of the opening request
 * @param conventionDocuments references of the convention
 * @param otherDocuments references of any other document
 */
public record DefineCotutelle(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    SupervisionGroupIdentity groupId,
    String motivation,
    Boolean partnerConsortiumInstitution,
    String institution,
    String otherInstitutionName,
    String otherInstitutionAddress,
    List<String> openingRequestDocuments,
    List<String> conventionDocuments,
    List<String> otherDocuments)
    implements DomainCommand.Update<UUID, Instant, SupervisionGroupIdentity> {
  @Serial private static final long serialVersionUID = -445388208148153191L;

  public DefineCotutelle {
    throwIllegalArgumentIfNull(messageId, "Message ID");
    throwIllegalArgumentIfNull(createdAt, "Creation time");
    throwIllegalArgumentIfNull(domainClient, "Domain client");
    throwIllegalArgumentIfNull(groupId, "Supervision group ID");
    openingRequestDocuments = copyOrEmpty(openingRequestDocuments);
    conventionDocuments = copyOrEmpty(conventionDocuments);
    otherDocuments = copyOrEmpty(otherDocuments);
  }

  public static DefineCotutelle of(
      final DomainClient domainClient,
      final SupervisionGroupIdentity groupId,
      final String motivation,
      final Boolean partnerConsortiumInstitution,
      final String institution,
      final String otherInstitutionName,
      final String otherInstitutionAddress,
      final List<String> openingRequestDocuments,
      final List<String> conventionDocuments,
      final List<String> otherDocuments) {
    return new DefineCotutelle(
        UUID.randomUUID(),
        Instant.now(),
        domainClient,
        groupId,
        motivation,
        partnerConsortiumInstitution,
        institution,
        otherInstitutionName,
        otherInstitutionAddress,
        openingRequestDocuments,
        conventionDocuments,
        otherDocuments);
  }

  /** {@inheritDoc} */
  @Override
  public SupervisionGroupIdentity aggregateId() {
    return groupId;
  }
}
