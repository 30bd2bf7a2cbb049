package io.b2mash.orgaccess.license;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DatabaseLicenseProvider implements LicenseProvider {

  private final LicenseRepository licenseRepository;
  private final Clock clock;

  public DatabaseLicenseProvider(LicenseRepository licenseRepository, Clock clock) {
    this.licenseRepository = licenseRepository;
    this.clock = clock;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<License> firstValid() {
    return licenseRepository.findFirstByValidUntilGreaterThanEqualOrderByValidUntilDesc(
        clock.instant());
  }

  @Override
  public List<String> featuresForPlan(String plan) {
    return LicensePlans.featuresFor(plan);
  }
}
