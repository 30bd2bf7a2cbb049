package io.b2mash.orgaccess.organization;

import io.b2mash.orgaccess.audit.AuditEventBuilder;
import io.b2mash.orgaccess.audit.AuditService;
import io.b2mash.orgaccess.billing.SubscriptionRepository;
import io.b2mash.orgaccess.exception.ResourceNotFoundException;
import io.b2mash.orgaccess.feature.FeatureResolver;
import io.b2mash.orgaccess.invite.InviteService;
import io.b2mash.orgaccess.invite.OrganizationInvite;
import io.b2mash.orgaccess.invite.OrganizationInviteRepository;
import io.b2mash.orgaccess.membership.MembershipLevel;
import io.b2mash.orgaccess.membership.MembershipService;
import io.b2mash.orgaccess.membership.OrganizationMembership;
import io.b2mash.orgaccess.membership.OrganizationMembershipRepository;
import io.b2mash.orgaccess.team.Team;
import io.b2mash.orgaccess.team.TeamFields;
import io.b2mash.orgaccess.team.TeamRepository;
import io.b2mash.orgaccess.user.AppUser;
import io.b2mash.orgaccess.user.AppUserRepository;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class OrganizationService {

  private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

  private final OrganizationRepository organizationRepository;
  private final TeamRepository teamRepository;
  private final OrganizationMembershipRepository membershipRepository;
  private final OrganizationInviteRepository inviteRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final AppUserRepository userRepository;
  private final MembershipService membershipService;
  private final InviteService inviteService;
  private final FeatureResolver featureResolver;
  private final AuditService auditService;

  public OrganizationService(
      OrganizationRepository organizationRepository,
      TeamRepository teamRepository,
      OrganizationMembershipRepository membershipRepository,
      OrganizationInviteRepository inviteRepository,
      SubscriptionRepository subscriptionRepository,
      AppUserRepository userRepository,
      MembershipService membershipService,
      InviteService inviteService,
      FeatureResolver featureResolver,
      AuditService auditService) {
    this.organizationRepository = organizationRepository;
    this.teamRepository = teamRepository;
    this.membershipRepository = membershipRepository;
    this.inviteRepository = inviteRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.userRepository = userRepository;
    this.membershipService = membershipService;
    this.inviteService = inviteService;
    this.featureResolver = featureResolver;
    this.auditService = auditService;
  }

  /**
   * Creates an organization with its default team and, when {@code user} is given, makes that user
   * its owner and switches the user's current organization and team to the new ones. All of it
   * commits together or not at all.
   *
   * @param user the founding user; null creates an organization without members
   * @param teamFields fields of the default team; null uses {@link TeamFields#defaults()}
   * @param organizationFields fields of the organization
   */
  @Transactional
  public BootstrapResult bootstrap(
      AppUser user, @Valid TeamFields teamFields, @Valid OrganizationFields organizationFields) {
    var organization = organizationRepository.save(organizationFields.toOrganization());
    var fields = teamFields != null ? teamFields : TeamFields.defaults();
    var team = teamRepository.save(new Team(organization.getId(), fields.name()));

    OrganizationMembership membership = null;
    if (user != null) {
      membership =
          membershipRepository.save(
              new OrganizationMembership(organization.getId(), user.getId(), MembershipLevel.OWNER));
      user.switchContext(organization.getId(), team.getId());
      userRepository.save(user);
    }
    log.info(
        "Bootstrapped organization {} with team {}{}",
        organization.getId(),
        team.getId(),
        user != null ? " owned by user " + user.getId() : "");

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("organization.bootstrapped")
            .entityType("organization")
            .entityId(organization.getId())
            .actorId(user != null ? user.getId() : null)
            .details(Map.of("name", organization.getName(), "team_id", team.getId().toString()))
            .build());
    return new BootstrapResult(organization, membership, team);
  }

  @Transactional(readOnly = true)
  public Organization findOrganization(UUID organizationId) {
    return organizationRepository
        .findById(organizationId)
        .orElseThrow(() -> new ResourceNotFoundException("Organization", organizationId));
  }

  @Transactional(readOnly = true)
  public String billingPlan(UUID organizationId) {
    return featureResolver.billingPlan(findOrganization(organizationId));
  }

  @Transactional(readOnly = true)
  public List<String> availableFeatures(UUID organizationId) {
    return featureResolver.availableFeatures(findOrganization(organizationId));
  }

  @Transactional(readOnly = true)
  public boolean isFeatureAvailable(UUID organizationId, String feature) {
    return featureResolver.isFeatureAvailable(findOrganization(organizationId), feature);
  }

  @Transactional(readOnly = true)
  public boolean isOnboardingActive(UUID organizationId) {
    return findOrganization(organizationId).isOnboardingActive();
  }

  @Transactional
  public Organization completeOnboarding(UUID organizationId) {
    var organization = findOrganization(organizationId);
    organization.completeOnboarding();
    log.info("Completed onboarding of organization {}", organizationId);
    return organizationRepository.save(organization);
  }

  @Transactional(readOnly = true)
  public List<OrganizationInvite> activeInvites(UUID organizationId) {
    return inviteService.activeInvites(findOrganization(organizationId).getId());
  }

  /**
   * Deletes the organization together with its invites, memberships, subscription and teams. Each
   * membership goes through {@link MembershipService#deleteMembership} so members' current context
   * is cleared.
   */
  @Transactional
  public void deleteOrganization(UUID organizationId) {
    var organization = findOrganization(organizationId);

    int invites = inviteRepository.deleteByOrganizationId(organizationId);
    var memberships = membershipRepository.findByOrganizationIdOrderByJoinedAtAsc(organizationId);
    memberships.forEach(membershipService::deleteMembership);
    subscriptionRepository.deleteByOrganizationId(organizationId);
    teamRepository.deleteByOrganizationId(organizationId);
    organizationRepository.deleteById(organizationId);
    log.info(
        "Deleted organization {} with {} membership(s) and {} invite(s)",
        organizationId,
        memberships.size(),
        invites);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("organization.deleted")
            .entityType("organization")
            .entityId(organizationId)
            .details(Map.of("name", organization.getName()))
            .build());
  }
}
