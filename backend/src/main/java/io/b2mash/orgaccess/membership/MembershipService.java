package io.b2mash.orgaccess.membership;

import io.b2mash.orgaccess.audit.AuditEventBuilder;
import io.b2mash.orgaccess.audit.AuditService;
import io.b2mash.orgaccess.exception.ForbiddenException;
import io.b2mash.orgaccess.exception.InvalidStateException;
import io.b2mash.orgaccess.exception.ResourceConflictException;
import io.b2mash.orgaccess.exception.ResourceNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MembershipService {

  private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

  private static final String PERMISSION_DENIED = "Permission denied";

  private final OrganizationMembershipRepository membershipRepository;
  private final MembershipRemovalHandler removalHandler;
  private final AuditService auditService;

  public MembershipService(
      OrganizationMembershipRepository membershipRepository,
      MembershipRemovalHandler removalHandler,
      AuditService auditService) {
    this.membershipRepository = membershipRepository;
    this.removalHandler = removalHandler;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public OrganizationMembership findMembership(UUID membershipId) {
    return membershipRepository
        .findById(membershipId)
        .orElseThrow(() -> new ResourceNotFoundException("Membership", membershipId));
  }

  @Transactional(readOnly = true)
  public List<OrganizationMembership> listMemberships(UUID organizationId) {
    return membershipRepository.findByOrganizationIdOrderByJoinedAtAsc(organizationId);
  }

  /**
   * Checks whether {@code actor} may edit {@code target}, optionally setting its level to {@code
   * newLevel}. Throws {@link ForbiddenException} on denial.
   *
   * <p>With a new level: nobody changes their own level; granting OWNER needs the actor to be the
   * owner; any other level may not exceed the actor's. Editing someone else additionally needs the
   * same organization, at least ADMIN, and a target not ranked above the actor.
   *
   * <p>Granting OWNER transfers ownership: once every check passes the actor is demoted to ADMIN
   * and flushed, so that the target can be promoted without breaking the one-owner index.
   */
  @Transactional
  public void validateUpdate(
      OrganizationMembership actor, OrganizationMembership target, MembershipLevel newLevel) {
    boolean transfersOwnership = false;
    if (newLevel != null) {
      if (target.getId().equals(actor.getId())) {
        throw new ForbiddenException(PERMISSION_DENIED, "You can't change your own access level.");
      }
      if (newLevel == MembershipLevel.OWNER) {
        if (!actor.isOwner()) {
          throw new ForbiddenException(
              PERMISSION_DENIED,
              "You can only pass on organization ownership if you're its owner.");
        }
        transfersOwnership = true;
      } else if (newLevel.isHigherThan(actor.getLevel())) {
        throw new ForbiddenException(
            PERMISSION_DENIED,
            "You can only change access level of others to lower or equal to your current one.");
      }
    }
    if (!target.getId().equals(actor.getId())) {
      if (!target.getOrganizationId().equals(actor.getOrganizationId())) {
        throw new ForbiddenException(
            PERMISSION_DENIED, "You both need to belong to the same organization.");
      }
      if (!actor.getLevel().isAtLeast(MembershipLevel.ADMIN)) {
        throw new ForbiddenException(
            PERMISSION_DENIED, "You can only edit others if you are an admin.");
      }
      if (target.getLevel().isHigherThan(actor.getLevel())) {
        throw new ForbiddenException(
            PERMISSION_DENIED, "You can only edit others with level lower or equal to you.");
      }
    }
    if (transfersOwnership) {
      actor.changeLevel(MembershipLevel.ADMIN);
      saveAndFlush(actor);
      log.info(
          "Owner membership {} demoted to admin while passing on ownership of organization {}",
          actor.getId(),
          actor.getOrganizationId());
    }
  }

  /** Validates and applies a level change requested by {@code actorId} on {@code targetId}. */
  @Transactional
  public OrganizationMembership changeLevel(
      UUID actorId, UUID targetId, MembershipLevel newLevel) {
    var actor = findMembership(actorId);
    var target = findMembership(targetId);
    var oldLevel = target.getLevel();

    validateUpdate(actor, target, newLevel);

    target.changeLevel(newLevel);
    target = saveAndFlush(target);
    log.info(
        "Changed level of membership {} from {} to {}",
        target.getId(),
        oldLevel.label(),
        newLevel.label());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("membership.level_changed")
            .entityType("membership")
            .entityId(target.getId())
            .actorId(actor.getUserId())
            .details(
                Map.of(
                    "organization_id", target.getOrganizationId().toString(),
                    "level", Map.of("from", oldLevel.label(), "to", newLevel.label())))
            .build());
    return target;
  }

  /**
   * Removes {@code targetId} from its organization on behalf of {@code actorId}. Members may always
   * leave on their own, except the owner, who has to pass on ownership first.
   */
  @Transactional
  public void removeMembership(UUID actorId, UUID targetId) {
    var actor = findMembership(actorId);
    var target = findMembership(targetId);

    if (target.getId().equals(actor.getId())) {
      if (target.isOwner()) {
        throw new InvalidStateException(
            "Cannot leave organization",
            "Pass on organization ownership before leaving the organization.");
      }
    } else {
      validateUpdate(actor, target, null);
    }

    deleteMembership(target);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("membership.removed")
            .entityType("membership")
            .entityId(target.getId())
            .actorId(actor.getUserId())
            .details(
                Map.of(
                    "organization_id", target.getOrganizationId().toString(),
                    "user_id", target.getUserId().toString()))
            .build());
  }

  /**
   * The single deletion path for memberships. Clears the user's current organization/team via
   * {@link MembershipRemovalHandler} before the row goes away.
   */
  @Transactional
  public void deleteMembership(OrganizationMembership membership) {
    removalHandler.beforeMembershipRemoved(membership);
    membershipRepository.delete(membership);
    membershipRepository.flush();
    log.info(
        "Deleted membership {} of user {} in organization {}",
        membership.getId(),
        membership.getUserId(),
        membership.getOrganizationId());
  }

  private OrganizationMembership saveAndFlush(OrganizationMembership membership) {
    try {
      return membershipRepository.saveAndFlush(membership);
    } catch (DataIntegrityViolationException ex) {
      log.warn(
          "Membership {} conflicts with a concurrent change in organization {}",
          membership.getId(),
          membership.getOrganizationId());
      throw new ResourceConflictException(
          "Membership conflict",
          "The organization's memberships were changed concurrently. Reload and try again.",
          ex);
    }
  }
}
