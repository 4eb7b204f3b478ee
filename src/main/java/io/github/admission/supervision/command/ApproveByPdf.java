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
import static io.github.admission.supervision.command.CommandPreconditions.throwIllegalArgumentIfBlank;
import static io.github.admission.supervision.command.CommandPreconditions.throwIllegalArgumentIfNull;

import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.cqrs.DomainCommand;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.io.Serial;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Approval signed on paper and uploaded on behalf of the signatory.
 *
 * @param messageId of the command
 * @param createdAt when the command was issued
 * @param domainClient issuing the command
 * @param groupId of the targeted supervision group
 * @param signatoryId of the approving person
 * @param proofDocuments references of the scanned approval
 */
public record ApproveByPdf(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    SupervisionGroupIdentity groupId,
    String signatoryId,
    List<String> proofDocuments)
    implements DomainCommand.Update<UUID, Instant, SupervisionGroupIdentity> {
  @Serial private static final long serialVersionUID = -7534175551154232772L;

  public ApproveByPdf {
    throwIllegalArgumentIfNull(messageId, "Message ID");
    throwIllegalArgumentIfNull(createdAt, "Creation time");
    throwIllegalArgumentIfNull(domainClient, "Domain client");
    throwIllegalArgumentIfNull(groupId, "Supervision group ID");
    throwIllegalArgumentIfBlank(signatoryId, "Signatory ID");
    proofDocuments = copyOrEmpty(proofDocuments);
  }

  public static ApproveByPdf of(
      final DomainClient domainClient,
      final SupervisionGroupIdentity groupId,
      final String signatoryId,
      final List<String> proofDocuments) {
    return new ApproveByPdf(
        UUID.randomUUID(), Instant.now(), domainClient, groupId, signatoryId, proofDocuments);
  }

  /** {@inheritDoc} */
  @Override
  public SupervisionGroupIdentity aggregateId() {
    return groupId;
  }
}
