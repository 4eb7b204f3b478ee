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
 * Adds a promoter to the group, not invited yet.
 *
 * @param messageId of the command
 * @param createdAt when the command was issued
 * @param domainClient issuing the command
 * @param groupId of the targeted supervision group
 * @param promoterId of the person to add
 * @param externalMember contact details when the person is not in the registry, may be {@code
 *     null}
 */
public record AddPromoter(
    UUID messageId,
    Instant createdAt,
    DomainClient domainClient,
    SupervisionGroupIdentity groupId,
    String promoterId,
    ExternalMember externalMember)
    implements DomainCommand.Update<UUID, Instant, SupervisionGroupIdentity> {
  @Serial private static final long serialVersionUID = 953732562859533069L;

  public AddPromoter {
    throwIllegalArgumentIfNull(messageId, "Message ID");
    throwIllegalArgumentIfNull(createdAt, "Creation time");
    throwIllegalArgumentIfNull(domainClient, "Domain client");
    throwIllegalArgumentIfNull(groupId, "Supervision group ID");
    throwIllegalArgumentIfBlank(promoterId, "Promoter ID");
  }

  public static AddPromoter of(
      final DomainClient domainClient,
      final SupervisionGroupIdentity groupId,
      final String promoterId) {
    return new AddPromoter(
        UUID.randomUUID(), Instant.now(), domainClient, groupId, promoterId, null);
  }

  /**
   * @return a command adding a promoter from another institution
   */
  public static AddPromoter external(
      final DomainClient domainClient,
      final SupervisionGroupIdentity groupId,
      final String promoterId,
      final ExternalMember externalMember) {
    throwIllegalArgumentIfNull(externalMember, "External member");
    return new AddPromoter(
        UUID.randomUUID(), Instant.now(), domainClient, groupId, promoterId, externalMember);
  }

  /** {@inheritDoc} */
  @Override
  public SupervisionGroupIdentity aggregateId() {
    return groupId;
  }
}
