package io.b2mash.orgaccess.invite;

import io.b2mash.orgaccess.audit.AuditEventBuilder;
import io.b2mash.orgaccess.audit.AuditService;
import io.b2mash.orgaccess.config.OrgAccessProperties;
import io.b2mash.orgaccess.exception.ForbiddenException;
import io.b2mash.orgaccess.exception.ResourceConflictException;
import io.b2mash.orgaccess.exception.ResourceNotFoundException;
import io.b2mash.orgaccess.membership.MembershipLevel;
import io.b2mash.orgaccess.membership.MembershipService;
import io.b2mash.orgaccess.membership.OrganizationMembership;
import io.b2mash.orgaccess.membership.OrganizationMembershipRepository;
import io.b2mash.orgaccess.user.AppUser;
import io.b2mash.orgaccess.user.UserService;
import io.b2mash.orgaccess.util.EmailMasking;
import jakarta.validation.constraints.Email;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class InviteService {

  private static final Logger log = LoggerFactory.getLogger(InviteService.class);

  private final OrganizationInviteRepository inviteRepository;
  private final OrganizationMembershipRepository membershipRepository;
  private final MembershipService membershipService;
  private final UserService userService;
  private final AuditService auditService;
  private final Clock clock;
  private final Duration validity;
  private final String siteUrl;

  public InviteService(
      OrganizationInviteRepository inviteRepository,
      OrganizationMembershipRepository membershipRepository,
      MembershipService membershipService,
      UserService userService,
      AuditService auditService,
      Clock clock,
      OrgAccessProperties properties) {
    this.inviteRepository = inviteRepository;
    this.membershipRepository = membershipRepository;
    this.membershipService = membershipService;
    this.userService = userService;
    this.auditService = auditService;
    this.clock = clock;
    this.validity = Duration.ofDays(properties.inviteDaysValidity());
    this.siteUrl = properties.siteUrl();
  }

  @Transactional(readOnly = true)
  public OrganizationInvite findInvite(UUID inviteId) {
    return inviteRepository
        .findById(inviteId)
        .orElseThrow(() -> new ResourceNotFoundException("Invite", inviteId));
  }

  /** Invites created within the validity window, newest first. */
  @Transactional(readOnly = true)
  public List<OrganizationInvite> activeInvites(UUID organizationId) {
    return inviteRepository.findByOrganizationIdAndCreatedAtAfterOrderByCreatedAtDesc(
        organizationId, clock.instant().minus(validity));
  }

  /** Creates an invite to the actor's organization. Only admins and the owner may invite. */
  @Transactional
  public OrganizationInvite createInvite(
      UUID actorMembershipId, @Email String targetEmail, String firstName) {
    var actor = membershipService.findMembership(actorMembershipId);
    requireAdmin(actor, "You can only invite others if you are an admin.");

    var invite =
        inviteRepository.save(
            new OrganizationInvite(
                actor.getOrganizationId(),
                targetEmail,
                truncate(firstName, OrganizationInvite.MAX_FIRST_NAME_LENGTH),
                actor.getUserId(),
                clock.instant()));
    log.info(
        "Created invite {} to organization {} for {}",
        invite.getId(),
        invite.getOrganizationId(),
        maskOrNone(targetEmail));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invite.created")
            .entityType("invite")
            .entityId(invite.getId())
            .actorId(actor.getUserId())
            .details(
                Map.of(
                    "organization_id", invite.getOrganizationId().toString(),
                    "target_email", maskOrNone(targetEmail)))
            .build());
    return invite;
  }

  /** Revokes a pending invite. The actor must be an admin of the invite's organization. */
  @Transactional
  public void revokeInvite(UUID actorMembershipId, UUID inviteId) {
    var actor = membershipService.findMembership(actorMembershipId);
    var invite = findInvite(inviteId);
    if (!invite.getOrganizationId().equals(actor.getOrganizationId())) {
      throw new ForbiddenException(
          "Permission denied", "You both need to belong to the same organization.");
    }
    requireAdmin(actor, "You can only revoke invites if you are an admin.");

    inviteRepository.delete(invite);
    log.info("Revoked invite {} of organization {}", invite.getId(), invite.getOrganizationId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invite.revoked")
            .entityType("invite")
            .entityId(invite.getId())
            .actorId(actor.getUserId())
            .details(Map.of("organization_id", invite.getOrganizationId().toString()))
            .build());
  }

  @Transactional
  public OrganizationInvite markEmailingAttempted(UUID inviteId) {
    var invite = findInvite(inviteId);
    invite.markEmailingAttemptMade(clock.instant());
    return inviteRepository.save(invite);
  }

  public boolean isExpired(OrganizationInvite invite) {
    return invite.isExpired(clock.instant(), validity);
  }

  public String signupUrl(OrganizationInvite invite) {
    return siteUrl + invite.getSignupPath();
  }

  /**
   * Checks that the invite can be redeemed, by {@code user} and/or for {@code email}. Checks run in
   * order: recipient, expiry, existing membership of the user, existing member with the target
   * email. Throws {@link InviteValidationException} carrying the failing {@link InviteErrorCode}.
   *
   * @param user the candidate user; may be null before signup
   * @param email explicit email to check; null or blank defaults to the user's email
   */
  @Transactional(readOnly = true)
  public void validate(OrganizationInvite invite, AppUser user, String email) {
    String candidateEmail =
        email != null && !email.isBlank() ? email : user != null ? user.getEmail() : null;

    if (candidateEmail != null
        && !candidateEmail.isBlank()
        && invite.getTargetEmail() != null
        && !candidateEmail.equalsIgnoreCase(invite.getTargetEmail())) {
      throw new InviteValidationException(
          InviteErrorCode.INVALID_RECIPIENT,
          "This invite is intended for another email address: "
              + EmailMasking.mask(invite.getTargetEmail())
              + ".");
    }

    if (isExpired(invite)) {
      throw new InviteValidationException(
          InviteErrorCode.EXPIRED, "This invite has expired. Please ask your admin for a new one.");
    }

    if (user != null
        && membershipRepository.existsByOrganizationIdAndUserId(
            invite.getOrganizationId(), user.getId())) {
      throw new InviteValidationException(
          InviteErrorCode.USER_ALREADY_MEMBER, "You already are a member of this organization.");
    }

    if (invite.getTargetEmail() != null
        && membershipRepository.existsByOrganizationIdAndUserEmail(
            invite.getOrganizationId(), invite.getTargetEmail())) {
      throw new InviteValidationException(
          InviteErrorCode.EXISTING_EMAIL_ADDRESS,
          "Another user with this email address already belongs to this organization.");
    }
  }

  @Transactional
  public OrganizationMembership use(OrganizationInvite invite, AppUser user) {
    return use(invite, user, false);
  }

  /**
   * Redeems the invite: the user joins the organization as a member, then every invite addressed
   * to the same email, in any organization, is deleted together with this one.
   */
  @Transactional
  public OrganizationMembership use(OrganizationInvite invite, AppUser user, boolean prevalidated) {
    if (!prevalidated) {
      validate(invite, user, null);
    }

    OrganizationMembership membership;
    try {
      membership = userService.join(user, invite.getOrganizationId());
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Already a member", "You already are a member of this organization.", ex);
    }

    int swept;
    if (invite.getTargetEmail() != null) {
      swept = inviteRepository.deleteByTargetEmailIgnoreCase(invite.getTargetEmail());
    } else {
      inviteRepository.deleteById(invite.getId());
      swept = 1;
    }
    log.info(
        "Invite {} used by user {}; {} invite(s) for {} removed",
        invite.getId(),
        user.getId(),
        swept,
        maskOrNone(invite.getTargetEmail()));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invite.used")
            .entityType("invite")
            .entityId(invite.getId())
            .actorId(user.getId())
            .details(
                Map.of(
                    "organization_id", invite.getOrganizationId().toString(),
                    "membership_id", membership.getId().toString()))
            .build());
    return membership;
  }

  private static void requireAdmin(OrganizationMembership actor, String detail) {
    if (!actor.getLevel().isAtLeast(MembershipLevel.ADMIN)) {
      throw new ForbiddenException("Permission denied", detail);
    }
  }

  private static String maskOrNone(String email) {
    return email != null ? EmailMasking.mask(email) : "(no email)";
  }

  private static String truncate(String value, int maxLength) {
    if (value == null) {
      return "";
    }
    if (value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
