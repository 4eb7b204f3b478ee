package io.github.admission.supervision.domain.model;

import static io.github.admission.supervision.domain.model.SignatureState.APPROVED;
import static io.github.admission.supervision.domain.model.SignatureState.DECLINED;
import static io.github.admission.supervision.domain.model.SignatureState.INVITED;
import static io.github.admission.supervision.domain.model.SignatureState.NOT_INVITED;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.admission.ddd.validation.BusinessException;
import io.github.admission.ddd.validation.MultipleBusinessExceptions;
import io.github.admission.supervision.SupervisionSettings;
import io.github.admission.supervision.domain.exception.CaMemberLimitReachedException;
import io.github.admission.supervision.domain.exception.CaMemberNotFoundException;
import io.github.admission.supervision.domain.exception.PromoterLimitReachedException;
import io.github.admission.supervision.domain.exception.PromoterNotFoundException;
import io.github.admission.supervision.domain.exception.ReferencePromoterNotInGroupException;
import io.github.admission.supervision.domain.exception.SignatoryAlreadyMemberException;
import io.github.admission.supervision.domain.exception.SignatoryNotExternalException;
import io.github.admission.supervision.domain.exception.SignatoryNotFoundException;
import io.github.admission.supervision.domain.exception.SignatoryNotInvitedException;
import io.github.admission.supervision.domain.exception.SignaturesAlreadySentException;
import io.github.admission.supervision.domain.exception.ThesisInstituteRequiredException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SupervisionGroupTest {
  static final SupervisionSettings SETTINGS = SupervisionSettings.defaults();

  static final PromoterIdentity P1 = new PromoterIdentity("p1");
  static final PromoterIdentity P2 = new PromoterIdentity("p2");
  static final PromoterIdentity P3 = new PromoterIdentity("p3");
  static final CaMemberIdentity C1 = new CaMemberIdentity("c1");
  static final CaMemberIdentity C2 = new CaMemberIdentity("c2");

  static SupervisionGroup emptyGroup() {
    return SupervisionGroup.initiate(
        SupervisionGroupIdentity.random(), new PropositionIdentity(UUID.randomUUID()));
  }

  static SupervisionGroup group(
      final List<PromoterSignature> promoters,
      final List<CaMemberSignature> caMembers,
      final PromoterIdentity referencePromoter) {
    return SupervisionGroup.restore(
        SupervisionGroupIdentity.random(),
        new PropositionIdentity(UUID.randomUUID()),
        promoters,
        caMembers,
        null,
        GroupSignatureStatus.IN_PROGRESS,
        referencePromoter,
        1L);
  }

  static PromoterSignature promoter(final PromoterIdentity promoter, final SignatureState state) {
    return new PromoterSignature(promoter, state, "", "", "", List.of());
  }

  static CaMemberSignature caMember(final CaMemberIdentity caMember, final SignatureState state) {
    return new CaMemberSignature(caMember, state, "", "", "", List.of());
  }

  static SignatureState stateOf(final SupervisionGroup group, final SignatoryIdentity signatory) {
    return group.findSignature(signatory).map(SignatureEntry::state).orElseThrow();
  }

  static List<String> codes(final MultipleBusinessExceptions exception) {
    return exception.getExceptions().stream().map(BusinessException::getCode).toList();
  }

  @Nested
  class Creation {
    @Test
    void initiated_group_is_empty_and_open() {
      final var group = emptyGroup();

      assertEquals(GroupSignatureStatus.IN_PROGRESS, group.getStatus());
      assertTrue(group.getSignatures().isEmpty());
      assertTrue(group.getReferencePromoter().isEmpty());
      assertTrue(group.getCotutelle().isEmpty());
      assertEquals(0L, group.getVersion());
    }

    @Test
    void when_an_identifier_appears_under_both_roles_restoring_fails() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              group(
                  List.of(promoter(P1, INVITED)),
                  List.of(caMember(new CaMemberIdentity("p1"), INVITED)),
                  null));
    }

    @Test
    void when_reference_promoter_is_not_a_promoter_restoring_fails() {
      assertThrows(
          IllegalArgumentException.class, () -> group(List.of(promoter(P1, INVITED)), null, P2));
    }

    @Test
    void when_mandatory_state_is_missing_illegal_argument_exception_is_thrown() {
      final var propositionId = new PropositionIdentity(UUID.randomUUID());

      assertThrows(
          IllegalArgumentException.class, () -> SupervisionGroup.initiate(null, propositionId));
      assertThrows(
          IllegalArgumentException.class,
          () -> SupervisionGroup.initiate(SupervisionGroupIdentity.random(), null));
      assertThrows(
          IllegalArgumentException.class,
          () ->
              SupervisionGroup.restore(
                  SupervisionGroupIdentity.random(),
                  propositionId,
                  null,
                  null,
                  null,
                  GroupSignatureStatus.IN_PROGRESS,
                  null,
                  -1L));
    }

    @Test
    void saved_version_must_grow() {
      final var group = emptyGroup();
      group.markSaved(1L);

      assertEquals(1L, group.getVersion());
      assertThrows(IllegalArgumentException.class, () -> group.markSaved(1L));
    }
  }

  @Nested
  class AddingSignatories {
    @Test
    void added_signatories_are_not_invited_in_insertion_order() {
      final var group = emptyGroup();
      group.addPromoter(P2, SETTINGS);
      group.addPromoter(P1, SETTINGS);
      group.addCaMember(C1, SETTINGS);

      assertEquals(List.of(P2, P1), group.getPromoters());
      assertEquals(List.of(C1), group.getCaMembers());
      group.getSignatures().forEach(signature -> assertEquals(NOT_INVITED, signature.state()));
    }

    @Test
    void an_identifier_appears_at_most_once_whatever_the_role() {
      final var group = emptyGroup();
      group.addPromoter(P1, SETTINGS);
      group.addCaMember(C1, SETTINGS);

      assertThrows(SignatoryAlreadyMemberException.class, () -> group.addPromoter(P1, SETTINGS));
      assertThrows(
          SignatoryAlreadyMemberException.class,
          () -> group.addCaMember(new CaMemberIdentity("p1"), SETTINGS));
      assertThrows(
          SignatoryAlreadyMemberException.class,
          () -> group.addPromoter(new PromoterIdentity("c1"), SETTINGS));

      final var identifiers = new HashSet<String>();
      group.getSignatures().forEach(s -> assertTrue(identifiers.add(s.signatory().id())));
      assertEquals(2, identifiers.size());
    }

    @Test
    void when_role_is_full_adding_fails() {
      final var group = emptyGroup();
      final var capped = new SupervisionSettings(1, 1);
      group.addPromoter(P1, capped);
      group.addCaMember(C1, capped);

      assertThrows(PromoterLimitReachedException.class, () -> group.addPromoter(P2, capped));
      assertThrows(CaMemberLimitReachedException.class, () -> group.addCaMember(C2, capped));
      assertEquals(2, group.getSignatures().size());
    }

    @Test
    void cap_is_checked_before_membership() {
      final var group = emptyGroup();
      final var capped = new SupervisionSettings(1, 1);
      group.addPromoter(P1, capped);

      assertThrows(PromoterLimitReachedException.class, () -> group.addPromoter(P1, capped));
    }
  }

  @Nested
  class ReferencePromoter {
    @Test
    void designating_replaces_the_previous_reference() {
      final var group = group(List.of(promoter(P1, NOT_INVITED), promoter(P2, INVITED)), null, P1);

      group.designateReferencePromoter(P2);

      assertEquals(P2, group.getReferencePromoter().orElseThrow());
    }

    @Test
    void when_promoter_is_not_in_group_designation_fails_and_reference_is_unchanged() {
      final var group = group(List.of(promoter(P1, INVITED), promoter(P2, INVITED)), null, P1);

      assertThrows(
          ReferencePromoterNotInGroupException.class, () -> group.designateReferencePromoter(P3));
      assertEquals(P1, group.getReferencePromoter().orElseThrow());
    }

    @Test
    void removing_the_reference_promoter_clears_the_reference() {
      final var group = group(List.of(promoter(P1, INVITED), promoter(P2, INVITED)), null, P1);

      group.removePromoter(P1);

      assertTrue(group.getReferencePromoter().isEmpty());
      assertEquals(List.of(P2), group.getPromoters());
    }

    @Test
    void removing_another_promoter_keeps_the_reference() {
      final var group = group(List.of(promoter(P1, INVITED), promoter(P2, INVITED)), null, P1);

      group.removePromoter(P2);

      assertEquals(P1, group.getReferencePromoter().orElseThrow());
    }
  }

  @Nested
  class Lookup {
    final SupervisionGroup group =
        group(List.of(promoter(P1, INVITED)), List.of(caMember(C1, INVITED)), null);

    @Test
    void signatory_is_found_with_its_role() {
      assertEquals(P1, group.getSignatory("p1"));
      assertEquals(C1, group.getSignatory("c1"));
      assertEquals(P1, group.getPromoter("p1"));
      assertEquals(C1, group.getCaMember("c1"));
    }

    @Test
    void unknown_identifier_is_not_found() {
      assertThrows(SignatoryNotFoundException.class, () -> group.getSignatory("x"));
      assertThrows(SignatoryNotFoundException.class, () -> group.getPromoter("x"));
      assertThrows(SignatoryNotFoundException.class, () -> group.getCaMember("x"));
    }

    @Test
    void identifier_with_the_other_role_is_reported_precisely() {
      assertThrows(PromoterNotFoundException.class, () -> group.getPromoter("c1"));
      assertThrows(CaMemberNotFoundException.class, () -> group.getCaMember("p1"));
    }
  }

  @Nested
  class Invitation {
    @Test
    void pending_signatories_are_invited_and_decided_ones_are_kept() {
      final var group =
          group(
              List.of(promoter(P1, NOT_INVITED), promoter(P2, DECLINED), promoter(P3, APPROVED)),
              List.of(caMember(C1, INVITED)),
              null);

      group.inviteAllPendingToSign();

      assertEquals(INVITED, stateOf(group, P1));
      assertEquals(INVITED, stateOf(group, P2));
      assertEquals(APPROVED, stateOf(group, P3));
      assertEquals(INVITED, stateOf(group, C1));
    }

    @Test
    void inviting_twice_gives_the_same_signatures() {
      final var group =
          group(List.of(promoter(P1, NOT_INVITED)), List.of(caMember(C1, DECLINED)), null);

      group.inviteAllPendingToSign();
      final var once = group.getSignatures();
      group.inviteAllPendingToSign();

      assertEquals(once, group.getSignatures());
    }

    @Test
    void removing_a_ca_member_needs_no_precondition() {
      final var group = group(null, List.of(caMember(C1, APPROVED), caMember(C2, INVITED)), null);

      group.removeCaMember(C1);
      group.removeCaMember(new CaMemberIdentity("unknown"));

      assertEquals(List.of(C2), group.getCaMembers());
    }

    @Test
    void once_locked_composition_is_closed() {
      final var group = emptyGroup();
      assertDoesNotThrow(group::verifySignaturesNotYetSent);

      group.lockForSignature();

      assertEquals(GroupSignatureStatus.SIGNING_IN_PROGRESS, group.getStatus());
      assertThrows(SignaturesAlreadySentException.class, group::verifySignaturesNotYetSent);
    }
  }

  @Nested
  class Decisions {
    @Test
    void approval_of_an_invited_signatory_stores_the_comments() {
      final var group = group(List.of(promoter(P1, INVITED)), null, null);

      group.approve(group.getSignatory("p1"), "internal", null);

      final var signature = group.findSignature(P1).orElseThrow();
      assertEquals(APPROVED, signature.state());
      assertEquals("internal", signature.internalComment());
      assertEquals("", signature.externalComment());
    }

    @Test
    void approval_by_pdf_stores_the_proof() {
      final var group = group(null, List.of(caMember(C1, INVITED)), null);

      group.approveByPdf(C1, List.of("signed.pdf"));

      assertEquals(List.of("signed.pdf"), group.findSignature(C1).orElseThrow().approvalProof());
      assertEquals(APPROVED, stateOf(group, C1));
    }

    @Test
    void signatory_who_is_not_invited_cannot_decide() {
      final var group =
          group(List.of(promoter(P1, NOT_INVITED), promoter(P2, DECLINED)), null, null);

      assertThrows(SignatoryNotInvitedException.class, () -> group.approve(P1, "", ""));
      assertThrows(SignatoryNotInvitedException.class, () -> group.approve(P2, "", ""));
      assertThrows(
          SignatoryNotInvitedException.class, () -> group.approveByPdf(P1, List.of("x.pdf")));
      assertThrows(SignatoryNotInvitedException.class, () -> group.refuse(P1, "", "", ""));

      assertEquals(NOT_INVITED, stateOf(group, P1));
      assertEquals(DECLINED, stateOf(group, P2));
    }

    @Test
    void signatory_outside_the_group_cannot_decide() {
      final var group = group(List.of(promoter(P1, INVITED)), null, null);

      assertThrows(SignatoryNotFoundException.class, () -> group.approve(P2, "", ""));
      assertThrows(
          SignatoryNotFoundException.class,
          () -> group.approve(new CaMemberIdentity("p1"), "", ""));
    }

    @Test
    void refusing_promoter_declines_and_sends_other_promoters_back() {
      final var group =
          group(
              List.of(promoter(P1, INVITED), promoter(P2, APPROVED)),
              List.of(caMember(C1, INVITED)),
              null);

      group.refuse(P1, "internal", "external", "Project too broad");

      final var declined = group.findSignature(P1).orElseThrow();
      assertEquals(DECLINED, declined.state());
      assertEquals("Project too broad", declined.refusalReason());
      assertEquals("external", declined.externalComment());
      assertEquals(NOT_INVITED, stateOf(group, P2));
      assertEquals(List.of(caMember(C1, INVITED)), group.getCaMemberSignatures());
    }

    @Test
    void refusing_ca_member_leaves_the_group() {
      final var group = group(null, List.of(caMember(C1, INVITED)), null);

      group.refuse(C1, "", "", "Not available");

      assertTrue(group.getCaMemberSignatures().isEmpty());
      assertTrue(group.getPromoterSignatures().isEmpty());
    }

    @Test
    void refusing_ca_member_leaves_promoters_untouched() {
      final var promoters = List.of(promoter(P1, APPROVED), promoter(P2, INVITED));
      final var group =
          group(promoters, List.of(caMember(C1, INVITED), caMember(C2, APPROVED)), null);

      group.refuse(C1, "", "", "");

      assertEquals(promoters, group.getPromoterSignatures());
      assertEquals(List.of(C2), group.getCaMembers());
    }
  }

  @Nested
  class Verification {
    @Test
    void every_role_not_fully_approved_is_reported() {
      final var group =
          group(
              List.of(promoter(P1, APPROVED), promoter(P2, INVITED)),
              List.of(caMember(C1, DECLINED)),
              null);

      final var exception =
          assertThrows(MultipleBusinessExceptions.class, group::verifyEveryoneApproved);

      assertEquals(List.of("SUPERVISION-15", "SUPERVISION-16"), codes(exception));
    }

    @Test
    void approved_group_passes() {
      final var group =
          group(List.of(promoter(P1, APPROVED)), List.of(caMember(C1, APPROVED)), null);

      assertDoesNotThrow(group::verifyEveryoneApproved);
    }

    @Test
    void signatories_are_complete_with_at_least_one_ca_member() {
      final var withoutCaMember = group(List.of(promoter(P1, INVITED)), null, P1);
      final var withCaMember = group(null, List.of(caMember(C1, NOT_INVITED)), null);

      final var exception =
          assertThrows(
              MultipleBusinessExceptions.class, withoutCaMember::verifySignatoriesComplete);
      assertEquals(List.of("SUPERVISION-12"), codes(exception));
      assertDoesNotThrow(withCaMember::verifySignatoriesComplete);
    }

    @Test
    void unanswered_cotutelle_is_incomplete_and_no_cotutelle_is_accepted() {
      final var group = emptyGroup();

      final var exception = assertThrows(MultipleBusinessExceptions.class, group::verifyCotutelle);
      assertEquals(List.of("SUPERVISION-10"), codes(exception));

      group.defineCotutelle(null, null, null, null, null, null, null, null);
      assertEquals(Cotutelle.NONE, group.getCotutelle().orElseThrow());
      assertDoesNotThrow(group::verifyCotutelle);
    }

    @Test
    void defining_the_cotutelle_replaces_the_previous_answer() {
      final var group = emptyGroup();
      group.defineCotutelle("Draft", true, "", "", "", List.of(), List.of(), List.of());
      assertThrows(MultipleBusinessExceptions.class, group::verifyCotutelle);

      group.defineCotutelle(
          "Joint research",
          true,
          "ULB",
          "",
          "",
          List.of("request.pdf"),
          List.of("convention.pdf"),
          List.of());

      assertEquals("Joint research", group.getCotutelle().orElseThrow().motivation());
      assertDoesNotThrow(group::verifyCotutelle);
    }
  }

  @Nested
  class ThesisInstitute {
    final SupervisionGroup group =
        group(List.of(promoter(P1, INVITED), promoter(P2, INVITED)), null, P1);

    @Test
    void reference_promoter_must_document_the_thesis_institute() {
      assertThrows(
          ThesisInstituteRequiredException.class,
          () -> group.verifyReferencePromoterDocumentsThesisInstitute(P1, P1, null, " "));
    }

    @Test
    void catalog_reference_or_free_text_is_enough() {
      final var institute = new ThesisInstituteIdentity(UUID.randomUUID());

      assertDoesNotThrow(
          () -> group.verifyReferencePromoterDocumentsThesisInstitute(P1, P1, institute, null));
      assertDoesNotThrow(
          () -> group.verifyReferencePromoterDocumentsThesisInstitute(P1, P1, null, "Institute"));
    }

    @Test
    void other_signatories_are_not_asked() {
      assertDoesNotThrow(
          () -> group.verifyReferencePromoterDocumentsThesisInstitute(P2, P1, null, ""));
    }

    @Test
    void given_reference_promoter_is_the_one_checked() {
      assertThrows(
          ThesisInstituteRequiredException.class,
          () -> group.verifyReferencePromoterDocumentsThesisInstitute(P2, P2, null, ""));
      assertDoesNotThrow(
          () -> group.verifyReferencePromoterDocumentsThesisInstitute(P1, P2, null, ""));
    }

    @Test
    void without_reference_promoter_nobody_is_asked() {
      assertDoesNotThrow(
          () -> group.verifyReferencePromoterDocumentsThesisInstitute(P1, null, null, ""));
    }
  }

  @Nested
  class ExternalMembers {
    final ExternalMember details =
        new ExternalMember(
            "Ada", "Lovelace", "ada@uclouvain.example", true, "UCL", "Leuven", "BE", "fr");

    @Test
    void details_are_kept_with_the_added_signatory() {
      final var group = emptyGroup();

      group.addPromoter(P1, details, SETTINGS);
      group.addCaMember(C1, SETTINGS);

      assertTrue(group.isExternal(P1));
      assertFalse(group.isExternal(C1));
      assertEquals(details, group.getExternalMember(P1).orElseThrow());
      assertEquals(NOT_INVITED, stateOf(group, P1));
    }

    @Test
    void rejected_addition_keeps_no_details() {
      final var group = emptyGroup();
      group.addCaMember(C1, SETTINGS);

      assertThrows(
          SignatoryAlreadyMemberException.class,
          () -> group.addPromoter(new PromoterIdentity("c1"), details, SETTINGS));
      assertTrue(group.getExternalMembers().isEmpty());
    }

    @Test
    void editing_replaces_the_details() {
      final var group = emptyGroup();
      group.addCaMember(C1, details, SETTINGS);
      final var corrected =
          new ExternalMember("Ada", "King", "ada@ulb.example", true, "ULB", "Brussels", "BE", "en");

      group.editExternalMember(C1, corrected);

      assertEquals(corrected, group.getExternalMember(C1).orElseThrow());
    }

    @Test
    void registered_or_unknown_signatory_cannot_be_edited() {
      final var group = emptyGroup();
      group.addPromoter(P1, SETTINGS);

      assertThrows(
          SignatoryNotExternalException.class, () -> group.editExternalMember(P1, details));
      assertThrows(
          SignatoryNotFoundException.class, () -> group.editExternalMember(C2, details));
      assertThrows(IllegalArgumentException.class, () -> group.editExternalMember(P1, null));
    }

    @Test
    void removed_or_refusing_signatory_loses_its_details() {
      final var group = emptyGroup();
      group.addPromoter(P1, details, SETTINGS);
      group.addCaMember(C1, details, SETTINGS);
      group.addCaMember(C2, details, SETTINGS);
      group.inviteAllPendingToSign();

      group.removePromoter(P1);
      group.refuse(C1, "", "", "Not my field");

      assertEquals(List.of(C2), List.copyOf(group.getExternalMembers().keySet()));
    }

    @Test
    void invitation_is_resent_to_invited_external_signatory_only() {
      final var group = emptyGroup();
      group.addPromoter(P1, details, SETTINGS);
      group.addPromoter(P2, SETTINGS);
      group.addCaMember(C1, details, SETTINGS);

      assertThrows(SignatoryNotInvitedException.class, () -> group.resendInvitation(P1));

      group.inviteAllPendingToSign();
      group.approve(C1, "", "");

      assertDoesNotThrow(() -> group.resendInvitation(P1));
      assertEquals(INVITED, stateOf(group, P1));
      assertThrows(SignatoryNotExternalException.class, () -> group.resendInvitation(P2));
      assertThrows(SignatoryNotInvitedException.class, () -> group.resendInvitation(C1));
      assertThrows(SignatoryNotFoundException.class, () -> group.resendInvitation(C2));
    }

    @Test
    void restoring_details_of_a_stranger_fails() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              SupervisionGroup.restore(
                  SupervisionGroupIdentity.random(),
                  new PropositionIdentity(UUID.randomUUID()),
                  List.of(promoter(P1, INVITED)),
                  List.of(),
                  Map.of(C1, details),
                  null,
                  GroupSignatureStatus.IN_PROGRESS,
                  null,
                  1L));
    }
  }
}
