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

import static io.github.admission.supervision.command.CommandPreconditions.throwIllegalArgumentIfBlank;
import static io.github.admission.supervision.command.CommandPreconditions.throwIllegalArgumentIfNull;

import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.cqrs.DomainCommand;
import io.github.admission.supervision.domain.model.ExternalMember;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Adds a member of the accompanying committee to the group, not invited yet.
 *
 * @param messageId of the command
 * @param createdAt when the command was issued
 * @param domainClient issuing the command
 * @param groupId of the targeted supervision group
 * @param caMemberId of the person to add
 * @param externalMember contact details when the person is not in the registry, may be {@code
 *     null}
 */
public record AddCaMember(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    SupervisionGroupIdentity groupId,
    String caMemberId,
    ExternalMember externalMember)
    implements DomainCommand.Update<UUID, Instant, SupervisionGroupIdentity> {
  @Serial private static final long serialVersionUID = 6664700317077538461L;

  public AddCaMember {
    throwIllegalArgumentIfNull(messageId, "Message ID");
    throwIllegalArgumentIfNull(createdAt, "Creation time");
    throwIllegalArgumentIfNull(domainClient, "Domain client");
    throwIllegalArgumentIfNull(groupId, "Supervision group ID");
    throwIllegalArgumentIfBlank(caMemberId, "CA member ID");
  }

  public static AddCaMember of(
      final DomainClient domainClient,
      final SupervisionGroupIdentity groupId,
      final String caMemberId) {
    return new AddCaMember(
        UUID.randomUUID(), Instant.now(), domainClient, groupId, caMemberId, null);
  }

  /**
   * @return a command adding a CA member from another institution
   */
  public static AddCaMember external(
      final DomainClient domainClient,
      final SupervisionGroupIdentity groupId,
      final String caMemberId,
      final ExternalMember externalMember) {
    throwIllegalArgumentIfNull(externalMember, "External member");
    return new AddCaMember(
        UUID.randomUUID(), Instant.now(), domainClient, groupId, caMemberId, externalMember);
  }

  /** {@inheritDoc} */
  @Override
  public SupervisionGroupIdentity aggregateId() {
    return groupId;
  }
}
