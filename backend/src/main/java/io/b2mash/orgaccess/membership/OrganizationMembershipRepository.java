package io.b2mash.orgaccess.membership;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrganizationMembershipRepository
    extends JpaRepository<OrganizationMembership, UUID> {

  List<OrganizationMembership> findByOrganizationIdOrderByJoinedAtAsc(UUID organizationId);

  List<OrganizationMembership> findByUserId(UUID userId);

  Optional<OrganizationMembership> findByOrganizationIdAndUserId(UUID organizationId, UUID userId);

  boolean existsByOrganizationIdAndUserId(UUID organizationId, UUID userId);

  long countByOrganizationIdAndLevel(UUID organizationId, MembershipLevel level);

  /** Whether any member of the organization is a user with the given email, ignoring case. */
  @Query(
      """
      SELECT CASE WHEN COUNT(m) > 0 THEN true ELSE false END
      FROM OrganizationMembership m JOIN AppUser u ON m.userId = u.id
      WHERE m.organizationId = :organizationId AND LOWER(u.email) = LOWER(:email)
      """)
  boolean existsByOrganizationIdAndUserEmail(
      @Param("organizationId") UUID organizationId, @Param("email") String email);
}
