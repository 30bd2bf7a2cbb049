package io.b2mash.orgaccess.invite;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrganizationInviteRepository extends JpaRepository<OrganizationInvite, UUID> {

  List<OrganizationInvite> findByOrganizationIdAndCreatedAtAfterOrderByCreatedAtDesc(
      UUID organizationId, Instant createdAfter);

  /** Deletes every invite, in any organization, addressed to the given email ignoring case. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM OrganizationInvite i WHERE LOWER(i.targetEmail) = LOWER(:email)")
  int deleteByTargetEmailIgnoreCase(@Param("email") String email);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM OrganizationInvite i WHERE i.organizationId = :organizationId")
  int deleteByOrganizationId(@Param("organizationId") UUID organizationId);
}
