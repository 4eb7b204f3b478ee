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

package io.github.admission.ddd.jooq;

import io.github.admission.ddd.async.DomainNotification;
import io.github.admission.ddd.async.DomainNotificationProducer;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transactional outbox writing Java-serialized notifications to the {@code domain_notification}
 * table, in the transaction of the handler emitting them.
 *
 * <p>Delivery is left to a relay reading the table in insertion order, see {@link
 * #fetchStored(DSLContext)}.
 */
public final class JooqDomainNotificationProducer implements DomainNotificationProducer {
  private static final Logger LOG = LoggerFactory.getLogger(JooqDomainNotificationProducer.class);

  static final Table<Record> DOMAIN_NOTIFICATION = DSL.table(DSL.name("domain_notification"));
  static final Field<Long> SEQUENCE_NUMBER =
      DSL.field(DSL.name("sequence_number"), SQLDataType.BIGINT);
  static final Field<String> MESSAGE_ID =
      DSL.field(DSL.name("message_id"), SQLDataType.VARCHAR(64));
  static final Field<String> NOTIFICATION_TYPE =
      DSL.field(DSL.name("notification_type"), SQLDataType.VARCHAR(255));
  static final Field<byte[]> PAYLOAD = DSL.field(DSL.name("payload"), SQLDataType.VARBINARY);
  static final Field<OffsetDateTime> STORED_AT =
      DSL.field(DSL.name("stored_at"), SQLDataType.TIMESTAMPWITHTIMEZONE);

  /** Deepest object graph a stored notification may have. */
  static final long MAX_DEPTH = 16;

  private static final Set<Class<?>> ALLOWED_VALUE_TYPES =
      Set.of(
          String.class,
          UUID.class,
          Enum.class,
          Number.class,
          Boolean.class,
          Character.class,
          Byte.class,
          Short.class,
          Integer.class,
          Long.class,
          Float.class,
          Double.class);

  /**
   * Only notifications and the value types they are made of are read back: records, enums, boxed
   * primitives, strings, UUIDs, {@code java.time} values and their arrays.
   */
  static final ObjectInputFilter NOTIFICATION_FILTER =
      (final ObjectInputFilter.FilterInfo info) -> {
        if (info.depth() > MAX_DEPTH) {
          return ObjectInputFilter.Status.REJECTED;
        }

        Class<?> type = info.serialClass();
        if (type == null) {
          return ObjectInputFilter.Status.UNDECIDED;
        }

        while (type.isArray()) {
          type = type.getComponentType();
        }

        return isAllowed(type)
            ? ObjectInputFilter.Status.ALLOWED
            : ObjectInputFilter.Status.REJECTED;
      };

  private final Clock clock;

  public JooqDomainNotificationProducer() {
    this(Clock.systemUTC());
  }

  /**
   * @param clock used to stamp stored notifications
   * @throws IllegalArgumentException if clock is {@code null}
   */
  public JooqDomainNotificationProducer(final Clock clock) {
    if (clock == null) {
      throw new IllegalArgumentException("Clock is null");
    }

    this.clock = clock;
  }

  /** {@inheritDoc} */
  @Override
  public <E extends DomainNotification<?, ?>> void store(
      final DSLContext readWriteDsl, final E notification) {
    if (readWriteDsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    if (notification == null) {
      throw new IllegalArgumentException("Notification is null");
    }

    readWriteDsl
        .insertInto(DOMAIN_NOTIFICATION)
        .set(MESSAGE_ID, String.valueOf(notification.messageId()))
        .set(NOTIFICATION_TYPE, notification.getClass().getName())
        .set(PAYLOAD, serialize(notification))
        .set(STORED_AT, OffsetDateTime.now(clock))
        .execute();

    LOG.debug(
        "Stored notification '{}' ({})",
        notification.getClass().getSimpleName(),
        notification.messageId());
  }

  /**
   * @param readOnlyDsl to read the outbox with
   * @return every stored notification in insertion order
   */
  public List<DomainNotification<?, ?>> fetchStored(final DSLContext readOnlyDsl) {
    return readOnlyDsl
        .select(PAYLOAD)
        .from(DOMAIN_NOTIFICATION)
        .orderBy(SEQUENCE_NUMBER.asc())
        .fetch(PAYLOAD)
        .stream()
        .<DomainNotification<?, ?>>map(JooqDomainNotificationProducer::deserialize)
        .toList();
  }

  private static byte[] serialize(final DomainNotification<?, ?> notification) {
    final var bytes = new ByteArrayOutputStream();
    try (var output = new ObjectOutputStream(bytes)) {
      output.writeObject(notification);
    } catch (IOException e) {
      throw new UncheckedIOException(
          "Notification '%s' cannot be serialized".formatted(notification.getClass().getName()),
          e);
    }

    return bytes.toByteArray();
  }

  private static DomainNotification<?, ?> deserialize(final byte[] payload) {
    final Object stored;
    try (var input = new ObjectInputStream(new ByteArrayInputStream(payload))) {
      input.setObjectInputFilter(NOTIFICATION_FILTER);
      stored = input.readObject();
    } catch (InvalidClassException e) {
      throw new IllegalStateException("Stored notification type is not allowed", e);
    } catch (IOException e) {
      throw new UncheckedIOException("Stored notification cannot be read", e);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Stored notification type is unknown", e);
    }

    if (stored instanceof DomainNotification<?, ?> notification) {
      return notification;
    }

    final String storedType = stored == null ? "null" : stored.getClass().getName();
    throw new IllegalStateException(
        "Stored payload of type '%s' is not a notification".formatted(storedType));
  }

  private static boolean isAllowed(final Class<?> type) {
    return type.isPrimitive()
        || DomainNotification.class.isAssignableFrom(type)
        || type.isRecord()
        || type.isEnum()
        || ALLOWED_VALUE_TYPES.contains(type)
        || type.getName().startsWith("java.time.");
  }
}
