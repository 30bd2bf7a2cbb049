package io.b2mash.orgaccess.feature;

import java.util.List;

/**
 * Resolved plan of an organization. {@code planKey} and {@code realm} are both null when no plan
 * applies. {@code cloudFeatures} is only populated for the {@link BillingRealm#CLOUD} realm.
 */
public record BillingPlanDetails(String planKey, BillingRealm realm, List<String> cloudFeatures) {

  public static BillingPlanDetails none() {
    return new BillingPlanDetails(null, null, List.of());
  }

  public boolean hasPlan() {
    return planKey != null && !planKey.isEmpty();
  }
}
