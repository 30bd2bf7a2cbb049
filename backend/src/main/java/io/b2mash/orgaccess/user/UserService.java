package io.b2mash.orgaccess.user;

import io.b2mash.orgaccess.exception.ResourceNotFoundException;
import io.b2mash.orgaccess.membership.MembershipLevel;
import io.b2mash.orgaccess.membership.OrganizationMembership;
import io.b2mash.orgaccess.membership.OrganizationMembershipRepository;
import io.b2mash.orgaccess.team.Team;
import io.b2mash.orgaccess.team.TeamRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final AppUserRepository userRepository;
  private final OrganizationMembershipRepository membershipRepository;
  private final TeamRepository teamRepository;

  public UserService(
      AppUserRepository userRepository,
      OrganizationMembershipRepository membershipRepository,
      TeamRepository teamRepository) {
    this.userRepository = userRepository;
    this.membershipRepository = membershipRepository;
    this.teamRepository = teamRepository;
  }

  @Transactional(readOnly = true)
  public AppUser findUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  /** Joins the organization as a plain member. */
  @Transactional
  public OrganizationMembership join(AppUser user, UUID organizationId) {
    return join(user, organizationId, MembershipLevel.MEMBER);
  }

  /**
   * Creates the user's membership in the organization and makes that organization, and its oldest
   * team, the user's current context. The membership is flushed right away so a duplicate surfaces
   * here as a constraint violation.
   */
  @Transactional
  public OrganizationMembership join(AppUser user, UUID organizationId, MembershipLevel level) {
    var membership =
        membershipRepository.saveAndFlush(
            new OrganizationMembership(organizationId, user.getId(), level));
    UUID teamId =
        teamRepository
            .findFirstByOrganizationIdOrderByCreatedAtAsc(organizationId)
            .map(Team::getId)
            .orElse(null);
    user.switchContext(organizationId, teamId);
    userRepository.save(user);
    log.info(
        "User {} joined organization {} as {}", user.getId(), organizationId, level.label());
    return membership;
  }
}
