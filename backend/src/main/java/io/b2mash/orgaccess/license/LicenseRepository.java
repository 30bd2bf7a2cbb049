package io.b2mash.orgaccess.license;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LicenseRepository extends JpaRepository<License, UUID> {

  Optional<License> findFirstByValidUntilGreaterThanEqualOrderByValidUntilDesc(Instant now);
}
