package io.github.admission.test;

import io.github.admission.ddd.async.DomainNotification;
import java.time.Instant;
import java.util.UUID;

/**
 * @param messageId of the notification
 * @param createdAt of the notification
 * @param label telling notifications apart in assertions
 */
public record EmptyDomainNotification(UUID messageId, Instant createdAt, String label)
    implements DomainNotification<UUID, Instant> {
  public static EmptyDomainNotification labelled(final String label) {
    return new EmptyDomainNotification(UUID.randomUUID(), Instant.now(), label);
  }
}
