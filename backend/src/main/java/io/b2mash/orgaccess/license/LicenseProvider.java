package io.b2mash.orgaccess.license;

import java.util.List;
import java.util.Optional;

/** Instance-wide license lookup used when an organization has no billing relation. */
public interface LicenseProvider {

  /** The first license still valid now, if any. */
  Optional<License> firstValid();

  List<String> featuresForPlan(String plan);
}
