package io.b2mash.orgaccess.billing;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

  Optional<Subscription> findByOrganizationId(UUID organizationId);

  void deleteByOrganizationId(UUID organizationId);
}
