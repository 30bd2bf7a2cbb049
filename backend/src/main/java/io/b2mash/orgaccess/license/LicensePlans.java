package io.b2mash.orgaccess.license;

import java.util.List;
import java.util.Map;

/** Static plan to feature table for instance licenses. */
public final class LicensePlans {

  public static final String STARTER = "starter";
  public static final String ENTERPRISE = "enterprise";

  private static final Map<String, List<String>> PLANS =
      Map.of(
          STARTER,
          List.of("zapier", "organizations_projects"),
          ENTERPRISE,
          List.of(
              "zapier",
              "organizations_projects",
              "google_login",
              "dashboard_collaboration",
              "ingestion_taxonomy"));

  private LicensePlans() {}

  /** Returns the features a plan unlocks, or an empty list for an unknown plan. */
  public static List<String> featuresFor(String plan) {
    return PLANS.getOrDefault(plan, List.of());
  }
}
