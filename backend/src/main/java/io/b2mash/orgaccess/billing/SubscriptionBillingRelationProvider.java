package io.b2mash.orgaccess.billing;

import io.b2mash.orgaccess.config.OrgAccessProperties;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves the billing relation from the {@code subscriptions} table. With hosted billing disabled
 * every organization reports {@link BillingRelation.Absent}, as does an organization without a
 * subscription row. A cancelled or plan-less subscription counts as attached but empty.
 */
@Service
public class SubscriptionBillingRelationProvider implements BillingRelationProvider {

  private final SubscriptionRepository subscriptionRepository;
  private final boolean cloudEnabled;

  public SubscriptionBillingRelationProvider(
      SubscriptionRepository subscriptionRepository, OrgAccessProperties properties) {
    this.subscriptionRepository = subscriptionRepository;
    this.cloudEnabled = properties.billing().cloudEnabled();
  }

  @Override
  @Transactional(readOnly = true)
  public BillingRelation findFor(UUID organizationId) {
    if (!cloudEnabled) {
      return new BillingRelation.Absent();
    }
    var subscription = subscriptionRepository.findByOrganizationId(organizationId);
    if (subscription.isEmpty()) {
      return new BillingRelation.Absent();
    }
    var sub = subscription.get();
    if (sub.getStatus() != Subscription.SubscriptionStatus.ACTIVE || sub.getPlanKey() == null) {
      return new BillingRelation.AttachedNone();
    }
    return new BillingRelation.Attached(sub.getPlanKey(), sub.getAvailableFeatures());
  }
}
