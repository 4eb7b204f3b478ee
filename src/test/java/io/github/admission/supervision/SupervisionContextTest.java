package io.github.admission.supervision;

import static io.github.admission.supervision.notification.SupervisionNotification.Event.GROUP_INITIATED;
import static io.github.admission.supervision.notification.SupervisionNotification.Event.INVITATION_RESENT;
import static io.github.admission.supervision.notification.SupervisionNotification.Event.SIGNATORY_APPROVED;
import static io.github.admission.supervision.notification.SupervisionNotification.Event.SIGNATORY_REFUSED;
import static io.github.admission.supervision.notification.SupervisionNotification.Event.SIGNATURES_REQUESTED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.admission.ddd.authorization.UnauthorizedException;
import io.github.admission.ddd.jooq.DslContextProvider;
import io.github.admission.ddd.jooq.JooqDomainNotificationProducer;
import io.github.admission.ddd.validation.BusinessException;
import io.github.admission.ddd.validation.MultipleBusinessExceptions;
import io.github.admission.supervision.command.AddCaMember;
import io.github.admission.supervision.command.AddPromoter;
import io.github.admission.supervision.command.Approve;
import io.github.admission.supervision.command.ApproveByPdf;
import io.github.admission.supervision.command.DefineCotutelle;
import io.github.admission.supervision.command.DesignateReferencePromoter;
import io.github.admission.supervision.command.EditExternalMember;
import io.github.admission.supervision.command.InitiateSupervisionGroup;
import io.github.admission.supervision.command.InviteToSign;
import io.github.admission.supervision.command.LockForSignature;
import io.github.admission.supervision.command.Refuse;
import io.github.admission.supervision.command.RemoveCaMember;
import io.github.admission.supervision.command.RemovePromoter;
import io.github.admission.supervision.command.RequestSignatures;
import io.github.admission.supervision.command.ResendInvitation;
import io.github.admission.supervision.domain.exception.PromoterLimitReachedException;
import io.github.admission.supervision.domain.exception.PromoterNotFoundException;
import io.github.admission.supervision.domain.exception.SignatoryNotExternalException;
import io.github.admission.supervision.domain.exception.SignatoryNotInvitedException;
import io.github.admission.supervision.domain.exception.SignaturesAlreadySentException;
import io.github.admission.supervision.domain.exception.SupervisionGroupAlreadyExistsException;
import io.github.admission.supervision.domain.exception.SupervisionGroupNotFoundException;
import io.github.admission.supervision.domain.exception.ThesisInstituteRequiredException;
import io.github.admission.supervision.domain.model.ExternalMember;
import io.github.admission.supervision.domain.model.GroupSignatureStatus;
import io.github.admission.supervision.domain.model.PropositionIdentity;
import io.github.admission.supervision.domain.model.SignatoryRole;
import io.github.admission.supervision.domain.model.SignatureState;
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import io.github.admission.supervision.domain.service.PromoterDirectory;
import io.github.admission.supervision.notification.SupervisionNotification;
import io.github.admission.supervision.query.GetSupervisionGroup;
import io.github.admission.supervision.query.ListSignatoryGroups;
import io.github.admission.supervision.query.SignatureView;
import io.github.admission.supervision.query.SupervisionGroupView;
import io.github.admission.supervision.query.SupervisionViolation;
import io.github.admission.supervision.query.VerifySignatureRequest;
import io.github.admission.test.H2Database;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SupervisionContextTest {
  static final DSLContext DSL_CONTEXT = H2Database.dslContext();
  static final DslContextProvider DSL_CONTEXT_PROVIDER =
      DslContextProvider.dslContextIdentity(DSL_CONTEXT);
  static final JooqDomainNotificationProducer NOTIFICATION_PRODUCER =
      new JooqDomainNotificationProducer();
  static final PromoterDirectory DIRECTORY = promoter -> promoter.id().startsWith("ext-");

  static final SupervisionClient CANDIDATE = SupervisionClient.candidate("candidate");
  static final SupervisionClient MANAGER = SupervisionClient.manager("manager");

  SupervisionContext context;
  PropositionIdentity propositionId;

  @BeforeEach
  void setUp() {
    H2Database.clean();
    context = newContext(SupervisionSettings.defaults());
    propositionId = new PropositionIdentity(UUID.randomUUID());
  }

  static SupervisionContext newContext(final SupervisionSettings settings) {
    return new SupervisionContext(
        DSL_CONTEXT_PROVIDER, DSL_CONTEXT_PROVIDER, NOTIFICATION_PRODUCER, DIRECTORY, settings);
  }

  static List<SupervisionNotification> notifications() {
    return NOTIFICATION_PRODUCER.fetchStored(DSL_CONTEXT).stream()
        .filter(SupervisionNotification.class::isInstance)
        .map(SupervisionNotification.class::cast)
        .toList();
  }

  static List<String> codes(final MultipleBusinessExceptions exception) {
    return exception.getExceptions().stream().map(BusinessException::getCode).toList();
  }

  SupervisionGroupIdentity initiate() {
    return context.createModel(InitiateSupervisionGroup.of(CANDIDATE, propositionId)).getId();
  }

  SupervisionGroupView view() {
    final Optional<SupervisionGroupView> view =
        context.queryOneModel(GetSupervisionGroup.of(CANDIDATE, propositionId));
    return view.orElseThrow();
  }

  /** Two promoters, one of them external, and one CA member; p1 is the reference promoter. */
  SupervisionGroupIdentity readyGroup() {
    final var groupId = initiate();
    context.updateModel(AddPromoter.of(CANDIDATE, groupId, "p1"));
    context.updateModel(AddPromoter.of(CANDIDATE, groupId, "ext-p2"));
    context.updateModel(AddCaMember.of(CANDIDATE, groupId, "c1"));
    context.updateModel(DesignateReferencePromoter.of(CANDIDATE, groupId, "p1"));
    context.updateModel(
        DefineCotutelle.of(
            CANDIDATE, groupId, null, null, null, null, null, List.of(), List.of(), List.of()));
    return groupId;
  }

  @Test
  void when_collaborators_are_missing_illegal_argument_exception_is_thrown() {
    final var settings = SupervisionSettings.defaults();

    assertThrows(
        IllegalArgumentException.class,
        () ->
            new SupervisionContext(
                DSL_CONTEXT_PROVIDER, DSL_CONTEXT_PROVIDER, NOTIFICATION_PRODUCER, null, settings));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new SupervisionContext(
                DSL_CONTEXT_PROVIDER,
                DSL_CONTEXT_PROVIDER,
                NOTIFICATION_PRODUCER,
                DIRECTORY,
                null));
  }

  @Test
  void every_supervision_message_has_a_handler() {
    assertEquals(15, context.getSupportedDomainCommandClasses().size());
    assertEquals(3, context.getSupportedDomainQueryClasses().size());
  }

  @Nested
  class Composition {
    @Test
    void initiated_group_is_stored_and_announced() {
      final var groupId = initiate();

      final var view = view();
      assertEquals(groupId.uuid(), view.groupId());
      assertEquals(GroupSignatureStatus.IN_PROGRESS, view.status());
      assertEquals(1L, view.version());
      assertEquals(List.of(GROUP_INITIATED), notifications().stream().map(n -> n.event()).toList());
      assertEquals(groupId, notifications().get(0).groupId());
    }

    @Test
    void a_proposition_has_a_single_group() {
      initiate();

      assertThrows(SupervisionGroupAlreadyExistsException.class, this::initiateAsManager);
      assertEquals(1, notifications().size());
    }

    void initiateAsManager() {
      context.createModel(InitiateSupervisionGroup.of(MANAGER, propositionId));
    }

    @Test
    void signatories_cannot_compose_the_group() {
      final var signatory = SupervisionClient.signatory("p1");

      assertThrows(
          UnauthorizedException.class,
          () -> context.createModel(InitiateSupervisionGroup.of(signatory, propositionId)));

      final var groupId = initiate();
      assertThrows(
          UnauthorizedException.class,
          () -> context.updateModel(AddPromoter.of(signatory, groupId, "p1")));
    }

    @Test
    void signatories_and_reference_promoter_are_projected() {
      readyGroup();

      final var view = view();
      assertEquals("p1", view.referencePromoterId());
      assertEquals(
          List.of("p1", "ext-p2"), view.promoters().stream().map(SignatureView::personId).toList());
      assertEquals(
          List.of(true, false),
          view.promoters().stream().map(SignatureView::referencePromoter).toList());
      assertEquals(SignatoryRole.CA_MEMBER, view.caMembers().get(0).role());
      assertEquals(SignatureState.NOT_INVITED, view.caMembers().get(0).state());
    }

    @Test
    void removing_needs_the_right_role() {
      final var groupId = readyGroup();

      assertThrows(
          PromoterNotFoundException.class,
          () -> context.updateModel(RemovePromoter.of(CANDIDATE, groupId, "c1")));

      context.updateModel(RemovePromoter.of(MANAGER, groupId, "p1"));
      context.updateModel(RemoveCaMember.of(MANAGER, groupId, "c1"));

      final var view = view();
      assertEquals(
          List.of("ext-p2"), view.promoters().stream().map(SignatureView::personId).toList());
      assertTrue(view.caMembers().isEmpty());
      assertNull(view.referencePromoterId());
    }

    @Test
    void caps_from_the_settings_are_enforced() {
      final var cappedContext = newContext(new SupervisionSettings(1, 1));
      final var groupId =
          cappedContext.createModel(InitiateSupervisionGroup.of(CANDIDATE, propositionId)).getId();
      cappedContext.updateModel(AddPromoter.of(CANDIDATE, groupId, "p1"));

      assertThrows(
          PromoterLimitReachedException.class,
          () -> cappedContext.updateModel(AddPromoter.of(CANDIDATE, groupId, "p2")));
    }

    @Test
    void missing_group_is_not_found() {
      final var missing = SupervisionGroupIdentity.random();

      assertThrows(
          SupervisionGroupNotFoundException.class,
          () -> context.updateModel(AddPromoter.of(CANDIDATE, missing, "p1")));
      assertTrue(
          context
              .<GetSupervisionGroup, SupervisionGroupView>queryOneModel(
                  GetSupervisionGroup.of(CANDIDATE, new PropositionIdentity(UUID.randomUUID())))
              .isEmpty());
    }
  }

  @Nested
  class SignatureRequest {
    @Test
    void incomplete_group_reports_every_missing_item_and_stays_unchanged() {
      final var groupId = initiate();

      final var exception =
          assertThrows(
              MultipleBusinessExceptions.class,
              () -> context.updateModel(RequestSignatures.of(CANDIDATE, groupId)));

      assertEquals(
          List.of("SUPERVISION-12", "SUPERVISION-11", "SUPERVISION-13", "SUPERVISION-10"),
          codes(exception));
      assertEquals(GroupSignatureStatus.IN_PROGRESS, view().status());
      assertEquals(1L, view().version());
    }

    @Test
    void checklist_is_available_without_changing_the_group() {
      final var groupId = initiate();
      context.updateModel(AddCaMember.of(CANDIDATE, groupId, "c1"));
      context.updateModel(AddPromoter.of(CANDIDATE, groupId, "p1"));
      context.updateModel(
          DefineCotutelle.of(
              CANDIDATE,
              groupId,
              "Joint research",
              true,
              "ULB",
              null,
              null,
              List.of("request.pdf"),
              List.of(),
              List.of()));

      final List<SupervisionViolation> violations =
          context.queryManyModels(VerifySignatureRequest.of(CANDIDATE, groupId));

      assertEquals(
          List.of(
              new SupervisionViolation("SUPERVISION-13", "You must set a lead supervisor."),
              new SupervisionViolation(
                  "SUPERVISION-14",
                  "You must add at least one external supervisor in order to request"
                      + " signatures.")),
          violations);
      assertEquals(4L, view().version());
    }

    @Test
    void complete_group_invites_everyone_and_locks() {
      final var groupId = readyGroup();

      context.updateModel(RequestSignatures.of(CANDIDATE, groupId));

      final var view = view();
      assertEquals(GroupSignatureStatus.SIGNING_IN_PROGRESS, view.status());
      view.promoters().forEach(s -> assertEquals(SignatureState.INVITED, s.state()));
      view.caMembers().forEach(s -> assertEquals(SignatureState.INVITED, s.state()));
      assertEquals(SIGNATURES_REQUESTED, notifications().get(notifications().size() - 1).event());
      assertTrue(
          context
              .<VerifySignatureRequest, SupervisionViolation>queryManyModels(
                  VerifySignatureRequest.of(CANDIDATE, groupId))
              .isEmpty());
    }

    @Test
    void once_signatures_are_requested_signatories_cannot_be_added() {
      final var groupId = readyGroup();
      context.updateModel(RequestSignatures.of(CANDIDATE, groupId));

      assertThrows(
          SignaturesAlreadySentException.class,
          () -> context.updateModel(AddCaMember.of(CANDIDATE, groupId, "c2")));
      assertThrows(
          SignaturesAlreadySentException.class,
          () -> context.updateModel(AddPromoter.of(CANDIDATE, groupId, "p3")));
    }

    @Test
    void raw_invitation_and_lock_are_available_to_managers() {
      final var groupId = readyGroup();

      context.updateModel(InviteToSign.of(MANAGER, groupId));
      context.updateModel(LockForSignature.of(MANAGER, groupId));

      final var view = view();
      assertEquals(GroupSignatureStatus.SIGNING_IN_PROGRESS, view.status());
      assertEquals(SignatureState.INVITED, view.caMembers().get(0).state());
    }
  }

  @Nested
  class Decisions {
    SupervisionGroupIdentity groupId;

    @BeforeEach
    void setUp() {
      groupId = readyGroup();
      context.updateModel(RequestSignatures.of(CANDIDATE, groupId));
    }

    Approve approval(final SupervisionClient client, final String signatoryId) {
      return Approve.of(client, groupId, signatoryId, "internal", "external", null, "Institute");
    }

    @Test
    void only_the_named_signatory_can_approve_or_refuse() {
      assertThrows(
          UnauthorizedException.class, () -> context.updateModel(approval(CANDIDATE, "c1")));
      assertThrows(
          UnauthorizedException.class,
          () -> context.updateModel(approval(SupervisionClient.signatory("p1"), "c1")));
      assertThrows(
          UnauthorizedException.class,
          () ->
              context.updateModel(
                  Refuse.of(SupervisionClient.signatory("c1"), groupId, "p1", "", "", "")));
    }

    @Test
    void signatory_approval_is_stored_and_announced() {
      context.updateModel(approval(SupervisionClient.signatory("c1"), "c1"));

      final var caMember = view().caMembers().get(0);
      assertEquals(SignatureState.APPROVED, caMember.state());
      assertEquals("internal", caMember.internalComment());

      final var last = notifications().get(notifications().size() - 1);
      assertEquals(SIGNATORY_APPROVED, last.event());
      assertEquals("c1", last.signatoryId());
    }

    @Test
    void reference_promoter_must_name_the_thesis_institute() {
      final var referencePromoter = SupervisionClient.signatory("p1");

      assertThrows(
          ThesisInstituteRequiredException.class,
          () ->
              context.updateModel(
                  Approve.of(referencePromoter, groupId, "p1", "", "", null, " ")));

      context.updateModel(approval(referencePromoter, "p1"));
      assertEquals(SignatureState.APPROVED, view().promoters().get(0).state());
    }

    @Test
    void refusing_promoter_sends_the_other_promoters_back() {
      context.updateModel(approval(SupervisionClient.signatory("ext-p2"), "ext-p2"));

      context.updateModel(
          Refuse.of(SupervisionClient.signatory("p1"), groupId, "p1", "", "", "Too broad"));

      final var view = view();
      assertEquals(SignatureState.DECLINED, view.promoters().get(0).state());
      assertEquals("Too broad", view.promoters().get(0).refusalReason());
      assertEquals(SignatureState.NOT_INVITED, view.promoters().get(1).state());
      assertEquals(SignatureState.INVITED, view.caMembers().get(0).state());
      assertEquals(SIGNATORY_REFUSED, notifications().get(notifications().size() - 1).event());
    }

    @Test
    void paper_approval_is_recorded_for_the_candidate() {
      context.updateModel(ApproveByPdf.of(MANAGER, groupId, "c1", List.of("signed.pdf")));

      final var caMember = view().caMembers().get(0);
      assertEquals(SignatureState.APPROVED, caMember.state());
      assertEquals(List.of("signed.pdf"), caMember.approvalProof());
      assertFalse(caMember.referencePromoter());
    }

    @Test
    void signatory_finds_the_groups_to_sign() {
      final List<SupervisionGroupView> groups =
          context.queryManyModels(
              ListSignatoryGroups.of(SupervisionClient.signatory("c1"), "c1"));

      assertEquals(List.of(groupId.uuid()), groups.stream().map(g -> g.groupId()).toList());
      assertTrue(
          context
              .<ListSignatoryGroups, SupervisionGroupView>queryManyModels(
                  ListSignatoryGroups.of(CANDIDATE, "nobody"))
              .isEmpty());
    }
  }

  @Nested
  class ExternalMembers {
    final ExternalMember details =
        new ExternalMember("Ada", "Lovelace", "ada@ulb.example", true, "ULB", "", "BE", "fr");

    SupervisionGroupIdentity groupId;

    @BeforeEach
    void setUp() {
      groupId = readyGroup();
      context.updateModel(AddCaMember.external(CANDIDATE, groupId, "c2", details));
    }

    @Test
    void details_are_projected_with_the_signature() {
      final var caMembers = view().caMembers();

      assertNull(caMembers.get(0).external());
      assertEquals(details, caMembers.get(1).external());
    }

    @Test
    void details_can_be_corrected_after_signatures_were_requested() {
      context.updateModel(RequestSignatures.of(CANDIDATE, groupId));
      final var corrected =
          new ExternalMember("Ada", "King", "ada@ucl.example", true, "UCL", "", "BE", "en");

      context.updateModel(EditExternalMember.of(MANAGER, groupId, "c2", corrected));

      assertEquals(corrected, view().caMembers().get(1).external());
      assertThrows(
          SignatoryNotExternalException.class,
          () -> context.updateModel(EditExternalMember.of(CANDIDATE, groupId, "c1", corrected)));
    }

    @Test
    void invitation_is_resent_once_signatures_were_requested() {
      final var resend = ResendInvitation.of(CANDIDATE, groupId, "c2");
      assertThrows(SignatoryNotInvitedException.class, () -> context.updateModel(resend));

      context.updateModel(RequestSignatures.of(CANDIDATE, groupId));
      final long version = view().version();
      context.updateModel(ResendInvitation.of(CANDIDATE, groupId, "c2"));

      final var last = notifications().get(notifications().size() - 1);
      assertEquals(INVITATION_RESENT, last.event());
      assertEquals("c2", last.signatoryId());
      assertEquals(SignatureState.INVITED, view().caMembers().get(1).state());
      assertEquals(version + 1, view().version());
    }

    @Test
    void invitation_is_resent_to_external_signatories_by_the_candidate_side_only() {
      context.updateModel(RequestSignatures.of(CANDIDATE, groupId));

      assertThrows(
          SignatoryNotExternalException.class,
          () -> context.updateModel(ResendInvitation.of(CANDIDATE, groupId, "c1")));
      assertThrows(
          UnauthorizedException.class,
          () ->
              context.updateModel(
                  ResendInvitation.of(SupervisionClient.signatory("c2"), groupId, "c2")));
    }
  }
}
