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

import static io.github.admission.supervision.command.CommandPreconditions.throwIllegalArgumentIfNull;

import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.cqrs.DomainCommand;
import io.github.admission.supervision.domain.model.PropositionIdentity;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Creates the empty supervision group of a doctoral proposition.
 *
 * @param messageId of the command
 * @param createdAt when the command was issued
 * @param domainClient issuing the command
 * @param groupId to give to the new group
 * @param propositionId owning the group
 */
public record InitiateSupervisionGroup(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    SupervisionGroupIdentity groupId,
    PropositionIdentity propositionId)
    implements DomainCommand.Create<UUID, Instant> {
  @Serial private static final long serialVersionUID = 7301985547226714183L;

  public InitiateSupervisionGroup {
    throwIllegalArgumentIfNull(messageId, "Message ID");
    throwIllegalArgumentIfNull(createdAt, "Creation time");
    throwIllegalArgumentIfNull(domainClient, "Domain client");
    throwIllegalArgumentIfNull(groupId, "Supervision group ID");
    throwIllegalArgumentIfNull(propositionId, "Proposition ID");
  }

  public static InitiateSupervisionGroup of(
      final DomainClient domainClient, final PropositionIdentity propositionId) {
    return new InitiateSupervisionGroup(
        UUID.randomUUID(),
        Instant.now(),
        domainClient,
        SupervisionGroupIdentity.random(),
        propositionId);
  }
}
