package io.github.admission.ddd.jooq;

import static io.github.admission.ddd.jooq.JooqDomainNotificationProducer.DOMAIN_NOTIFICATION;
import static io.github.admission.ddd.jooq.JooqDomainNotificationProducer.MESSAGE_ID;
import static io.github.admission.ddd.jooq.JooqDomainNotificationProducer.NOTIFICATION_TYPE;
import static io.github.admission.ddd.jooq.JooqDomainNotificationProducer.PAYLOAD;
import static io.github.admission.ddd.jooq.JooqDomainNotificationProducer.STORED_AT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.admission.test.EmptyDomainNotification;
import io.github.admission.test.H2Database;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serial;
import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqDomainNotificationProducerTest {
  static final DSLContext DSL_CONTEXT = H2Database.dslContext();
  static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

  JooqDomainNotificationProducer producer;

  @BeforeEach
  void setUp() {
    H2Database.clean();
    producer = new JooqDomainNotificationProducer(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void when_clock_is_null_illegal_argument_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new JooqDomainNotificationProducer(null));
  }

  @Test
  void when_arguments_are_null_illegal_argument_is_thrown() {
    final var notification = EmptyDomainNotification.labelled("first");

    assertThrows(IllegalArgumentException.class, () -> producer.store(null, notification));
    assertThrows(IllegalArgumentException.class, () -> producer.store(DSL_CONTEXT, null));
  }

  @Test
  void stored_notifications_are_read_back_in_insertion_order() {
    final var first = EmptyDomainNotification.labelled("first");
    final var second = EmptyDomainNotification.labelled("second");

    producer.store(DSL_CONTEXT, first);
    producer.store(DSL_CONTEXT, second);

    assertEquals(List.of(first, second), producer.fetchStored(DSL_CONTEXT));
  }

  @Test
  void stored_row_describes_the_notification() {
    final var notification = EmptyDomainNotification.labelled("described");

    producer.store(DSL_CONTEXT, notification);

    final var row =
        DSL_CONTEXT
            .select(MESSAGE_ID, NOTIFICATION_TYPE, STORED_AT)
            .from(DOMAIN_NOTIFICATION)
            .fetchOne();

    assertEquals(notification.messageId().toString(), row.value1());
    assertEquals(EmptyDomainNotification.class.getName(), row.value2());
    assertEquals(NOW, row.value3().toInstant());
  }

  @Test
  void notification_stored_in_a_rolled_back_transaction_is_discarded() {
    final var notification = EmptyDomainNotification.labelled("discarded");

    assertThrows(
        IllegalStateException.class,
        () ->
            DSL_CONTEXT.transaction(
                trx -> {
                  producer.store(trx.dsl(), notification);
                  throw new IllegalStateException("Rolled back");
                }));

    assertTrue(producer.fetchStored(DSL_CONTEXT).isEmpty());
  }

  @Nested
  class ForeignPayloads {
    @BeforeEach
    void setUp() {
      Intruder.READ.set(false);
    }

    @Test
    void serializable_class_outside_notifications_is_never_instantiated() {
      insertRaw(new Intruder());

      final var exception =
          assertThrows(IllegalStateException.class, () -> producer.fetchStored(DSL_CONTEXT));

      assertFalse(Intruder.READ.get());
      assertInstanceOf(InvalidClassException.class, exception.getCause());
    }

    @Test
    void value_which_is_not_a_notification_is_reported_as_illegal_state() {
      insertRaw(new Bystander("not a notification"));

      final var exception =
          assertThrows(IllegalStateException.class, () -> producer.fetchStored(DSL_CONTEXT));

      assertTrue(exception.getMessage().contains(Bystander.class.getName()));
    }

    private void insertRaw(final Object payload) {
      final var bytes = new ByteArrayOutputStream();
      try (var output = new ObjectOutputStream(bytes)) {
        output.writeObject(payload);
      } catch (IOException e) {
        throw new IllegalStateException(e);
      }

      DSL_CONTEXT
          .insertInto(DOMAIN_NOTIFICATION)
          .set(MESSAGE_ID, UUID.randomUUID().toString())
          .set(NOTIFICATION_TYPE, payload.getClass().getName())
          .set(PAYLOAD, bytes.toByteArray())
          .set(STORED_AT, NOW.atOffset(ZoneOffset.UTC))
          .execute();
    }
  }

  static final class Intruder implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    static final AtomicBoolean READ = new AtomicBoolean();

    @Serial
    private void readObject(final ObjectInputStream input)
        throws IOException, ClassNotFoundException {
      input.defaultReadObject();
      READ.set(true);
    }
  }

  record Bystander(String text) implements Serializable {}
}
