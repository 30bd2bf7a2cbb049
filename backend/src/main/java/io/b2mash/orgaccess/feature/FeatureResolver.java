package io.b2mash.orgaccess.feature;

import io.b2mash.orgaccess.billing.BillingRelation;
import io.b2mash.orgaccess.billing.BillingRelationProvider;
import io.b2mash.orgaccess.license.LicenseProvider;
import io.b2mash.orgaccess.organization.Organization;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves which features an organization may use.
 *
 * <p>The plan comes from the organization's own billing relation when one exists (realm {@code
 * cloud}); an attached relation without a plan means no plan at all. Only when the relation is
 * absent is the instance-wide license consulted (realm {@code ee}).
 */
@Service
public class FeatureResolver {

  private static final Logger log = LoggerFactory.getLogger(FeatureResolver.class);

  private final BillingRelationProvider billingRelationProvider;
  private final LicenseProvider licenseProvider;

  public FeatureResolver(
      BillingRelationProvider billingRelationProvider, LicenseProvider licenseProvider) {
    this.billingRelationProvider = billingRelationProvider;
    this.licenseProvider = licenseProvider;
  }

  @Transactional(readOnly = true)
  public BillingPlanDetails billingPlanDetails(Organization organization) {
    BillingRelation relation = billingRelationProvider.findFor(organization.getId());
    if (relation instanceof BillingRelation.Attached attached) {
      return new BillingPlanDetails(
          attached.planKey(), BillingRealm.CLOUD, attached.availableFeatures());
    }
    if (relation instanceof BillingRelation.AttachedNone) {
      return BillingPlanDetails.none();
    }
    return licenseProvider
        .firstValid()
        .map(license -> new BillingPlanDetails(license.getPlan(), BillingRealm.EE, List.of()))
        .orElseGet(BillingPlanDetails::none);
  }

  @Transactional(readOnly = true)
  public String billingPlan(Organization organization) {
    return billingPlanDetails(organization).planKey();
  }

  @Transactional(readOnly = true)
  public List<String> availableFeatures(Organization organization) {
    var details = billingPlanDetails(organization);
    if (!details.hasPlan()) {
      return List.of();
    }
    log.debug(
        "Resolved plan {} ({}) for organization {}",
        details.planKey(),
        details.realm().key(),
        organization.getId());
    if (details.realm() == BillingRealm.EE) {
      return licenseProvider.featuresForPlan(details.planKey());
    }
    return details.cloudFeatures();
  }

  @Transactional(readOnly = true)
  public boolean isFeatureAvailable(Organization organization, String feature) {
    return availableFeatures(organization).contains(feature);
  }
}
