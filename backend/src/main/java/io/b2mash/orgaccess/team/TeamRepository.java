package io.b2mash.orgaccess.team;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamRepository extends JpaRepository<Team, UUID> {

  List<Team> findByOrganizationId(UUID organizationId);

  Optional<Team> findFirstByOrganizationIdOrderByCreatedAtAsc(UUID organizationId);

  boolean existsByIdAndOrganizationId(UUID id, UUID organizationId);

  void deleteByOrganizationId(UUID organizationId);
}
