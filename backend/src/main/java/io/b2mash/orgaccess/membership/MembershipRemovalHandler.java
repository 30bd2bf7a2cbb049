package io.b2mash.orgaccess.membership;

import io.b2mash.orgaccess.exception.ResourceNotFoundException;
import io.b2mash.orgaccess.team.TeamRepository;
import io.b2mash.orgaccess.user.AppUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps a user's current organization and current team pointing at something they belong to.
 * Invoked by {@link MembershipService#deleteMembership} right before the row is removed.
 */
@Component
public class MembershipRemovalHandler {

  private static final Logger log = LoggerFactory.getLogger(MembershipRemovalHandler.class);

  private final AppUserRepository userRepository;
  private final TeamRepository teamRepository;

  public MembershipRemovalHandler(AppUserRepository userRepository, TeamRepository teamRepository) {
    this.userRepository = userRepository;
    this.teamRepository = teamRepository;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void beforeMembershipRemoved(OrganizationMembership membership) {
    var user =
        userRepository
            .findById(membership.getUserId())
            .orElseThrow(() -> new ResourceNotFoundException("User", membership.getUserId()));

    boolean changed = false;
    if (membership.getOrganizationId().equals(user.getCurrentOrganizationId())) {
      user.clearCurrentOrganization();
      changed = true;
    }
    if (user.getCurrentTeamId() != null
        && teamRepository.existsByIdAndOrganizationId(
            user.getCurrentTeamId(), membership.getOrganizationId())) {
      user.clearCurrentTeam();
      changed = true;
    }
    if (changed) {
      userRepository.save(user);
      log.info(
          "Cleared current context of user {} leaving organization {}",
          user.getId(),
          membership.getOrganizationId());
    }
  }
}
