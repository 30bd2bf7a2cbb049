package io.b2mash.orgaccess.billing;

import java.util.List;

/**
 * What an organization's billing relation looks like. Hosted deployments attach one to every
 * organization, possibly without a plan; self-managed deployments have none at all and fall back
 * to the instance license.
 */
public sealed interface BillingRelation
    permits BillingRelation.Attached, BillingRelation.AttachedNone, BillingRelation.Absent {

  /** A billing relation with a resolved plan and the features it unlocks. */
  record Attached(String planKey, List<String> availableFeatures) implements BillingRelation {

    public Attached {
      availableFeatures = availableFeatures != null ? List.copyOf(availableFeatures) : List.of();
    }
  }

  /** The relation exists but carries no plan. */
  record AttachedNone() implements BillingRelation {}

  /** No billing relation is available for organizations on this deployment. */
  record Absent() implements BillingRelation {}
}
