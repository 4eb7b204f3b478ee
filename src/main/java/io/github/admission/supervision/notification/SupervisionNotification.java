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

package io.github.admission.supervision.notification;

import io.github.admission.ddd.async.DomainNotification;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Fact stored in the outbox after a successful supervision command.
 *
 * @param messageId of the notification
 * @param createdAt when the command succeeded
 * @param groupId of the changed group
 * @param event which happened
 * @param signatoryId of the signatory concerned, {@code null} for group-wide events
 */
public record SupervisionNotification(
    UUID messageId,
    Instant createdAt,
    SupervisionGroupIdentity groupId,
    Event event,
    String signatoryId)
    implements DomainNotification<UUID, Instant> {
  @Serial private static final long serialVersionUID = 5524780393046219917L;

  public enum Event {
    GROUP_INITIATED,
    SIGNATURES_REQUESTED,
    SIGNATORY_APPROVED,
    SIGNATORY_REFUSED,
    INVITATION_RESENT
  }

  public SupervisionNotification {
    if (messageId == null || createdAt == null || groupId == null || event == null) {
      throw new IllegalArgumentException("Notification is missing mandatory values");
    }
  }

  public static SupervisionNotification of(
      final SupervisionGroupIdentity groupId, final Event event, final String signatoryId) {
    return new SupervisionNotification(
        UUID.randomUUID(), Instant.now(), groupId, event, signatoryId);
  }

  public static SupervisionNotification of(
      final SupervisionGroupIdentity groupId, final Event event) {
    return of(groupId, event, null);
  }
}
