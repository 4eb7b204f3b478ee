package io.github.admission.ddd.cqrs;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.admission.ddd.async.DomainNotification;
import io.github.admission.ddd.authorization.AnonymousDomainClient;
import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.authorization.UnauthorizedException;
import io.github.admission.test.BackOfficeClient;
import io.github.admission.test.EmptyDomainNotification;
import io.github.admission.test.H2Database;
import io.github.admission.test.RecordingDomainNotificationProducer;
import io.github.admission.test.example.CreateNote;
import io.github.admission.test.example.Note;
import io.github.admission.test.example.NoteRepository;
import io.github.admission.test.example.RenameNote;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainCommandHandlerTest {
  static final DSLContext DSL_CONTEXT = H2Database.dslContext();
  static final Function<DSLContext, NoteRepository> REPOSITORY_FACTORY = NoteRepository::new;
  static final RecordingDomainNotificationProducer NOTIFICATION_PRODUCER =
      RecordingDomainNotificationProducer.recording();

  @BeforeEach
  void setUp() {
    H2Database.clean();
    NOTIFICATION_PRODUCER.clear();
  }

  static NoteRepository notes() {
    return new NoteRepository(DSL_CONTEXT);
  }

  @Nested
  class Create {
    static final TestHandler HANDLER = new TestHandler();

    @Test
    void when_command_class_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new TestHandler(null));
    }

    @Test
    void when_command_class_is_present_it_must_be_not_null() {
      assertEquals(CreateNote.class, HANDLER.getCommandClass());
    }

    @Test
    void when_command_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () -> HANDLER.runInContext(null, DSL_CONTEXT, REPOSITORY_FACTORY, NOTIFICATION_PRODUCER));
    }

    @Test
    void when_command_client_is_null_illegal_state_exception_is_thrown() {
      final var command = new CreateNote(UUID.randomUUID(), Instant.now(), null, "Draft");

      assertThrows(
          IllegalStateException.class,
          () ->
              HANDLER.runInContext(
                  command, DSL_CONTEXT, REPOSITORY_FACTORY, NOTIFICATION_PRODUCER));
    }

    @Test
    void when_client_is_not_authorized_unauthorized_exception_must_be_thrown() {
      final var command = CreateNote.of(BackOfficeClient.REGISTRAR, "Draft");

      final var exception =
          assertThrows(
              UnauthorizedException.class,
              () ->
                  HANDLER.runInContext(
                      command, DSL_CONTEXT, REPOSITORY_FACTORY, NOTIFICATION_PRODUCER));

      assertEquals(
          "Client 'REGISTRAR' is not allowed to use 'CreateNote' command", exception.getMessage());
      assertEquals(0, notes().count());
      assertTrue(NOTIFICATION_PRODUCER.stored().isEmpty());
    }

    @Test
    void when_infrastructure_is_missing_illegal_state_exception_is_thrown() {
      final var command = CreateNote.of("Draft");

      assertThrows(
          IllegalStateException.class,
          () -> HANDLER.runInContext(command, null, REPOSITORY_FACTORY, NOTIFICATION_PRODUCER));
      assertThrows(
          IllegalStateException.class,
          () -> HANDLER.runInContext(command, DSL_CONTEXT, null, NOTIFICATION_PRODUCER));
      assertThrows(
          IllegalStateException.class,
          () -> HANDLER.runInContext(command, DSL_CONTEXT, REPOSITORY_FACTORY, null));
      assertThrows(
          IllegalStateException.class,
          () -> HANDLER.runInContext(command, DSL_CONTEXT, dsl -> null, NOTIFICATION_PRODUCER));
    }

    @Test
    void when_new_aggregate_is_null_illegal_state_exception_is_thrown() {
      final var handler = new TestNullAggregateHandler();

      assertThrows(
          IllegalStateException.class,
          () ->
              handler.runInContext(
                  CreateNote.of("Draft"), DSL_CONTEXT, REPOSITORY_FACTORY, NOTIFICATION_PRODUCER));
      assertEquals(0, notes().count());
    }

    @Test
    void when_no_failures_occurred_aggregate_is_saved_and_success_notification_is_stored() {
      final var note =
          assertDoesNotThrow(
              () ->
                  HANDLER.runInContext(
                      CreateNote.of("Draft"),
                      DSL_CONTEXT,
                      REPOSITORY_FACTORY,
                      NOTIFICATION_PRODUCER));

      assertNotNull(note);
      assertEquals("Draft", notes().load(note.getId()).getContent());
      assertEquals(List.of("created"), NOTIFICATION_PRODUCER.labels());
    }

    @Test
    void when_business_logic_fails_nothing_is_saved_and_failure_notification_is_stored() {
      final var exception =
          assertThrows(
              IllegalArgumentException.class,
              () ->
                  HANDLER.runInContext(
                      CreateNote.of(" "), DSL_CONTEXT, REPOSITORY_FACTORY, NOTIFICATION_PRODUCER));

      assertEquals("Note content cannot be blank", exception.getMessage());
      assertEquals(0, notes().count());
      assertEquals(List.of("rejected"), NOTIFICATION_PRODUCER.labels());
    }

    @Test
    void when_success_notification_cannot_be_stored_aggregate_is_not_saved() {
      final var failingProducer = RecordingDomainNotificationProducer.failing();

      assertThrows(
          IllegalStateException.class,
          () ->
              HANDLER.runInContext(
                  CreateNote.of("Draft"), DSL_CONTEXT, REPOSITORY_FACTORY, failingProducer));

      assertEquals(
          0,
          notes().count(),
          "Failure to store the notification must revert the aggregate within the transaction");
    }

    /** Creates notes for anonymous clients only. */
    static class TestHandler
        extends DomainCommandHandler.Create<CreateNote, UUID, Note, NoteRepository> {
      TestHandler() {
        this(CreateNote.class);
      }

      TestHandler(final Class<CreateNote> commandClass) {
        super(commandClass);
      }

      @Override
      protected boolean canBeUsedBy(final DomainClient domainClient) {
        return domainClient instanceof AnonymousDomainClient;
      }

      @Override
      protected Note newAggregate(final CreateNote command, final NoteRepository repository) {
        final var note = new Note(UUID.randomUUID(), "");
        note.rename(command.content());
        return note;
      }

      @Override
      protected Optional<DomainNotification<?, ?>> onSuccess(
          final CreateNote command, final Note note) {
        return Optional.of(EmptyDomainNotification.labelled("created"));
      }

      @Override
      protected Optional<DomainNotification<?, ?>> onFailure(
          final CreateNote command, final Throwable cause) {
        return Optional.of(EmptyDomainNotification.labelled("rejected"));
      }
    }

    /** Forgets to build the aggregate. */
    static class TestNullAggregateHandler
        extends DomainCommandHandler.Create<CreateNote, UUID, Note, NoteRepository> {
      TestNullAggregateHandler() {
        super(CreateNote.class);
      }

      @Override
      protected Note newAggregate(final CreateNote command, final NoteRepository repository) {
        return null;
      }
    }
  }

  @Nested
  class Update {
    static final TestHandler HANDLER = new TestHandler();

    Note existing;

    @BeforeEach
    void setUp() {
      existing = new Note(UUID.randomUUID(), "Draft");
      notes().save(existing);
    }

    @Test
    void when_all_parameters_were_passed_aggregate_is_changed_and_saved() {
      final var renamed =
          HANDLER.runInContext(
              RenameNote.of(existing.getId(), "Final"),
              DSL_CONTEXT,
              REPOSITORY_FACTORY,
              NOTIFICATION_PRODUCER);

      assertEquals(existing.getId(), renamed.getId());
      assertEquals("Final", notes().load(existing.getId()).getContent());
      assertEquals(List.of("renamed"), NOTIFICATION_PRODUCER.labels());
    }

    @Test
    void when_aggregate_id_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              HANDLER.runInContext(
                  RenameNote.of(null, "Final"),
                  DSL_CONTEXT,
                  REPOSITORY_FACTORY,
                  NOTIFICATION_PRODUCER));
    }

    @Test
    void when_aggregate_does_not_exist_repository_exception_is_propagated() {
      assertThrows(
          NoSuchElementException.class,
          () ->
              HANDLER.runInContext(
                  RenameNote.of(UUID.randomUUID(), "Final"),
                  DSL_CONTEXT,
                  REPOSITORY_FACTORY,
                  NOTIFICATION_PRODUCER));

      assertEquals(List.of("rename rejected"), NOTIFICATION_PRODUCER.labels());
    }

    @Test
    void when_business_logic_fails_loaded_aggregate_is_left_unchanged() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              HANDLER.runInContext(
                  RenameNote.of(existing.getId(), ""),
                  DSL_CONTEXT,
                  REPOSITORY_FACTORY,
                  NOTIFICATION_PRODUCER));

      assertEquals("Draft", notes().load(existing.getId()).getContent());
    }

    @Test
    void when_updated_aggregate_is_null_illegal_state_exception_is_thrown() {
      final var handler = new TestNullAggregateHandler();

      assertThrows(
          IllegalStateException.class,
          () ->
              handler.runInContext(
                  RenameNote.of(existing.getId(), "Final"),
                  DSL_CONTEXT,
                  REPOSITORY_FACTORY,
                  NOTIFICATION_PRODUCER));
      assertEquals("Draft", notes().load(existing.getId()).getContent());
    }

    /** Renames a note. */
    static class TestHandler
        extends DomainCommandHandler.Update<RenameNote, UUID, Note, NoteRepository> {
      TestHandler() {
        super(RenameNote.class);
      }

      @Override
      protected Note updateAggregate(final RenameNote command, final Note note) {
        note.rename(command.content());
        return note;
      }

      @Override
      protected Optional<DomainNotification<?, ?>> onSuccess(
          final RenameNote command, final Note note) {
        return Optional.of(EmptyDomainNotification.labelled("renamed"));
      }

      @Override
      protected Optional<DomainNotification<?, ?>> onFailure(
          final RenameNote command, final Throwable cause) {
        return Optional.of(EmptyDomainNotification.labelled("rename rejected"));
      }
    }

    /** Loses the aggregate on the way. */
    static class TestNullAggregateHandler
        extends DomainCommandHandler.Update<RenameNote, UUID, Note, NoteRepository> {
      TestNullAggregateHandler() {
        super(RenameNote.class);
      }

      @Override
      protected Note updateAggregate(final RenameNote command, final Note note) {
        return null;
      }
    }
  }
}
