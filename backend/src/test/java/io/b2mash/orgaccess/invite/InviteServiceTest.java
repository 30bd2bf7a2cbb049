package io.b2mash.orgaccess.invite;

import static io.b2mash.orgaccess.testutil.TestEntities.invite;
import static io.b2mash.orgaccess.testutil.TestEntities.membership;
import static io.b2mash.orgaccess.testutil.TestEntities.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.orgaccess.audit.AuditEventRecord;
import io.b2mash.orgaccess.audit.AuditService;
import io.b2mash.orgaccess.config.OrgAccessProperties;
import io.b2mash.orgaccess.exception.ForbiddenException;
import io.b2mash.orgaccess.exception.ResourceConflictException;
import io.b2mash.orgaccess.exception.ResourceNotFoundException;
import io.b2mash.orgaccess.membership.MembershipLevel;
import io.b2mash.orgaccess.membership.MembershipService;
import io.b2mash.orgaccess.membership.OrganizationMembershipRepository;
import io.b2mash.orgaccess.user.UserService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class InviteServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
  private static final UUID ORG = UUID.randomUUID();

  @Mock private OrganizationInviteRepository inviteRepository;
  @Mock private OrganizationMembershipRepository membershipRepository;
  @Mock private MembershipService membershipService;
  @Mock private UserService userService;
  @Mock private AuditService auditService;

  private InviteService service;

  @BeforeEach
  void setUp() {
    service =
        new InviteService(
            inviteRepository,
            membershipRepository,
            membershipService,
            userService,
            auditService,
            Clock.fixed(NOW, ZoneOffset.UTC),
            new OrgAccessProperties(
                "https://app.example.com", 3, new OrgAccessProperties.Billing(false)));
  }

  // --- validate ---

  @Test
  void validate_wrongRecipientFailsWithMaskedTargetEmail() {
    var invite = invite(ORG, "alice@example.com", NOW);
    var bob = user("bob@example.com");

    assertThatThrownBy(() -> service.validate(invite, bob, null))
        .isInstanceOfSatisfying(
            InviteValidationException.class,
            ex -> {
              assertThat(ex.getCode()).isEqualTo(InviteErrorCode.INVALID_RECIPIENT);
              assertThat(ex.getBody().getProperties()).containsEntry("code", "invalid_recipient");
              assertThat(ex.getMessage())
                  .contains("a***e@example.com")
                  .doesNotContain("alice@example.com")
                  .doesNotContain("bob@example.com");
            });
  }

  @Test
  void validate_explicitEmailTakesPrecedenceOverUserEmail() {
    var invite = invite(ORG, "alice@example.com", NOW);
    var alice = user("alice@example.com");

    assertThatThrownBy(() -> service.validate(invite, alice, "carol@example.com"))
        .isInstanceOfSatisfying(
            InviteValidationException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(InviteErrorCode.INVALID_RECIPIENT));
  }

  @Test
  void validate_blankExplicitEmailFallsBackToUserEmail() {
    var invite = invite(ORG, "alice@example.com", NOW);
    var bob = user("bob@example.com");

    assertThatThrownBy(() -> service.validate(invite, bob, "  "))
        .isInstanceOfSatisfying(
            InviteValidationException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(InviteErrorCode.INVALID_RECIPIENT));
  }

  @Test
  void validate_recipientMatchIgnoresCase() {
    var invite = invite(ORG, "Alice@Example.com", NOW);

    assertThatCode(() -> service.validate(invite, null, "alice@example.com"))
        .doesNotThrowAnyException();
  }

  @Test
  void validate_recipientIsCheckedBeforeExpiry() {
    var invite = invite(ORG, "alice@example.com", NOW.minus(Duration.ofDays(10)));

    assertThatThrownBy(() -> service.validate(invite, null, "bob@example.com"))
        .isInstanceOfSatisfying(
            InviteValidationException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(InviteErrorCode.INVALID_RECIPIENT));
  }

  @Test
  void validate_expiredInviteFails() {
    var invite = invite(ORG, "alice@example.com", NOW.minus(Duration.ofDays(3)));

    assertThatThrownBy(() -> service.validate(invite, null, "alice@example.com"))
        .isInstanceOfSatisfying(
            InviteValidationException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(InviteErrorCode.EXPIRED));
  }

  @Test
  void validate_existingMemberFails() {
    var invite = invite(ORG, "alice@example.com", NOW);
    var alice = user("alice@example.com");
    when(membershipRepository.existsByOrganizationIdAndUserId(ORG, alice.getId()))
        .thenReturn(true);

    assertThatThrownBy(() -> service.validate(invite, alice, null))
        .isInstanceOfSatisfying(
            InviteValidationException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(InviteErrorCode.USER_ALREADY_MEMBER));
  }

  @Test
  void validate_targetEmailAlreadyTakenByAnotherAccountFails() {
    var invite = invite(ORG, "alice@example.com", NOW);
    var alice = user("alice@example.com");
    when(membershipRepository.existsByOrganizationIdAndUserId(ORG, alice.getId()))
        .thenReturn(false);
    when(membershipRepository.existsByOrganizationIdAndUserEmail(ORG, "alice@example.com"))
        .thenReturn(true);

    assertThatThrownBy(() -> service.validate(invite, alice, null))
        .isInstanceOfSatisfying(
            InviteValidationException.class,
            ex -> assertThat(ex.getCode()).isEqualTo(InviteErrorCode.EXISTING_EMAIL_ADDRESS));
  }

  @Test
  void validate_openInviteAcceptsAnyEmail() {
    var invite = invite(ORG, null, NOW);
    var bob = user("bob@example.com");
    when(membershipRepository.existsByOrganizationIdAndUserId(ORG, bob.getId())).thenReturn(false);

    assertThatCode(() -> service.validate(invite, bob, null)).doesNotThrowAnyException();
    verify(membershipRepository, never()).existsByOrganizationIdAndUserEmail(any(), any());
  }

  // --- use ---

  @Test
  void use_joinsThenSweepsInvitesForSameEmail() {
    var invite = invite(ORG, "Alice@Example.com", NOW);
    var alice = user("alice@example.com");
    var membership = membership(ORG, alice.getId(), MembershipLevel.MEMBER);
    when(userService.join(alice, ORG)).thenReturn(membership);
    when(inviteRepository.deleteByTargetEmailIgnoreCase("Alice@Example.com")).thenReturn(2);

    var result = service.use(invite, alice, true);

    assertThat(result).isSameAs(membership);
    var ordered = inOrder(userService, inviteRepository);
    ordered.verify(userService).join(alice, ORG);
    ordered.verify(inviteRepository).deleteByTargetEmailIgnoreCase("Alice@Example.com");
    verify(membershipRepository, never()).existsByOrganizationIdAndUserId(any(), any());

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("invite.used");
  }

  @Test
  void use_validatesUnlessPrevalidated() {
    var invite = invite(ORG, "alice@example.com", NOW.minus(Duration.ofDays(5)));
    var alice = user("alice@example.com");

    assertThatThrownBy(() -> service.use(invite, alice))
        .isInstanceOf(InviteValidationException.class);
    verify(userService, never()).join(any(), any());
    verify(inviteRepository, never()).deleteByTargetEmailIgnoreCase(any());
  }

  @Test
  void use_openInviteDeletesOnlyItself() {
    var invite = invite(ORG, null, NOW);
    var bob = user("bob@example.com");
    when(userService.join(bob, ORG))
        .thenReturn(membership(ORG, bob.getId(), MembershipLevel.MEMBER));

    service.use(invite, bob, true);

    verify(inviteRepository).deleteById(invite.getId());
    verify(inviteRepository, never()).deleteByTargetEmailIgnoreCase(any());
  }

  @Test
  void use_duplicateMembershipBecomesConflict() {
    var invite = invite(ORG, "alice@example.com", NOW);
    var alice = user("alice@example.com");
    when(userService.join(alice, ORG))
        .thenThrow(new DataIntegrityViolationException("unique_organization_membership"));

    assertThatThrownBy(() -> service.use(invite, alice, true))
        .isInstanceOf(ResourceConflictException.class);
    verify(inviteRepository, never()).deleteByTargetEmailIgnoreCase(any());
  }

  // --- invite management ---

  @Test
  void createInvite_requiresAdmin() {
    var member = membership(ORG, MembershipLevel.MEMBER);
    when(membershipService.findMembership(member.getId())).thenReturn(member);

    assertThatThrownBy(() -> service.createInvite(member.getId(), "dave@example.com", "Dave"))
        .isInstanceOf(ForbiddenException.class);
    verify(inviteRepository, never()).save(any());
  }

  @Test
  void createInvite_storesCreatorAndClockTime() {
    var admin = membership(ORG, MembershipLevel.ADMIN);
    when(membershipService.findMembership(admin.getId())).thenReturn(admin);
    when(inviteRepository.save(any(OrganizationInvite.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var invite =
        service.createInvite(
            admin.getId(), "dave@example.com", "Bartholomew-Alexander Featherstonehaugh");

    assertThat(invite.getOrganizationId()).isEqualTo(ORG);
    assertThat(invite.getCreatedBy()).isEqualTo(admin.getUserId());
    assertThat(invite.getCreatedAt()).isEqualTo(NOW);
    assertThat(invite.getFirstName()).hasSize(OrganizationInvite.MAX_FIRST_NAME_LENGTH);
    verify(auditService).log(any(AuditEventRecord.class));
  }

  @Test
  void revokeInvite_deniedForOtherOrganization() {
    var admin = membership(UUID.randomUUID(), MembershipLevel.ADMIN);
    var invite = invite(ORG, "alice@example.com", NOW);
    when(membershipService.findMembership(admin.getId())).thenReturn(admin);
    when(inviteRepository.findById(invite.getId())).thenReturn(Optional.of(invite));

    assertThatThrownBy(() -> service.revokeInvite(admin.getId(), invite.getId()))
        .isInstanceOf(ForbiddenException.class);
    verify(inviteRepository, never()).delete(any());
  }

  @Test
  void markEmailingAttempted_flagsInviteAtClockTime() {
    var invite = invite(ORG, "alice@example.com", NOW.minus(Duration.ofHours(1)));
    when(inviteRepository.findById(invite.getId())).thenReturn(Optional.of(invite));
    when(inviteRepository.save(invite)).thenReturn(invite);

    var marked = service.markEmailingAttempted(invite.getId());

    assertThat(marked.isEmailingAttemptMade()).isTrue();
    assertThat(marked.getUpdatedAt()).isEqualTo(NOW);
  }

  @Test
  void markEmailingAttempted_unknownInviteIsNotFound() {
    var missing = UUID.randomUUID();
    when(inviteRepository.findById(missing)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.markEmailingAttempted(missing))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(inviteRepository, never()).save(any());
  }

  @Test
  void activeInvites_queriesValidityWindow() {
    var fresh = invite(ORG, "alice@example.com", NOW);
    when(inviteRepository.findByOrganizationIdAndCreatedAtAfterOrderByCreatedAtDesc(
            ORG, NOW.minus(Duration.ofDays(3))))
        .thenReturn(List.of(fresh));

    assertThat(service.activeInvites(ORG)).containsExactly(fresh);
  }

  @Test
  void signupUrlUsesConfiguredSite() {
    var invite = invite(ORG, "alice@example.com", NOW);

    assertThat(service.signupUrl(invite))
        .isEqualTo("https://app.example.com/signup/" + invite.getId());
  }
}
