package io.b2mash.orgaccess.membership;

import static io.b2mash.orgaccess.testutil.TestEntities.membership;
import static io.b2mash.orgaccess.testutil.TestEntities.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.orgaccess.team.TeamRepository;
import io.b2mash.orgaccess.user.AppUserRepository;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MembershipRemovalHandlerTest {

  private static final UUID ORG = UUID.randomUUID();
  private static final UUID OTHER_ORG = UUID.randomUUID();

  @Mock private AppUserRepository userRepository;
  @Mock private TeamRepository teamRepository;

  private MembershipRemovalHandler handler;

  @BeforeEach
  void setUp() {
    handler = new MembershipRemovalHandler(userRepository, teamRepository);
  }

  @Test
  void clearsCurrentOrganizationAndTeamOfRemovedOrganization() {
    var user = user("alice@example.com");
    var teamId = UUID.randomUUID();
    user.switchContext(ORG, teamId);
    var membership = membership(ORG, user.getId(), MembershipLevel.MEMBER);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    when(teamRepository.existsByIdAndOrganizationId(teamId, ORG)).thenReturn(true);

    handler.beforeMembershipRemoved(membership);

    assertThat(user.getCurrentOrganizationId()).isNull();
    assertThat(user.getCurrentTeamId()).isNull();
    verify(userRepository).save(user);
  }

  @Test
  void clearsCurrentTeamEvenWhenCurrentOrganizationDiffers() {
    var user = user("alice@example.com");
    var teamId = UUID.randomUUID();
    user.switchContext(OTHER_ORG, teamId);
    var membership = membership(ORG, user.getId(), MembershipLevel.MEMBER);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    when(teamRepository.existsByIdAndOrganizationId(teamId, ORG)).thenReturn(true);

    handler.beforeMembershipRemoved(membership);

    assertThat(user.getCurrentOrganizationId()).isEqualTo(OTHER_ORG);
    assertThat(user.getCurrentTeamId()).isNull();
    verify(userRepository).save(user);
  }

  @Test
  void leavesUserUntouchedWhenWorkingInAnotherOrganization() {
    var user = user("alice@example.com");
    var teamId = UUID.randomUUID();
    user.switchContext(OTHER_ORG, teamId);
    var membership = membership(ORG, user.getId(), MembershipLevel.ADMIN);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
    when(teamRepository.existsByIdAndOrganizationId(teamId, ORG)).thenReturn(false);

    handler.beforeMembershipRemoved(membership);

    assertThat(user.getCurrentOrganizationId()).isEqualTo(OTHER_ORG);
    assertThat(user.getCurrentTeamId()).isEqualTo(teamId);
    verify(userRepository, never()).save(any());
  }

  @Test
  void userWithoutCurrentContextIsNotSaved() {
    var user = user("alice@example.com");
    var membership = membership(ORG, user.getId(), MembershipLevel.MEMBER);
    when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

    handler.beforeMembershipRemoved(membership);

    verify(teamRepository, never()).existsByIdAndOrganizationId(any(), any());
    verify(userRepository, never()).save(any());
  }
}
