package io.b2mash.orgaccess.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for organization access.
 *
 * @param siteUrl public base URL used to build invite signup links
 * @param inviteDaysValidity number of days an invite stays redeemable
 * @param billing billing relation settings
 */
@ConfigurationProperties(prefix = "orgaccess")
public record OrgAccessProperties(String siteUrl, Integer inviteDaysValidity, Billing billing) {

  public static final int DEFAULT_INVITE_DAYS_VALIDITY = 3;

  public OrgAccessProperties {
    if (siteUrl == null) {
      siteUrl = "http://localhost:8000";
    }
    if (inviteDaysValidity == null) {
      inviteDaysValidity = DEFAULT_INVITE_DAYS_VALIDITY;
    }
    if (billing == null) {
      billing = new Billing(false);
    }
  }

  /**
   * @param cloudEnabled whether organizations carry a billing relation (hosted deployments). When
   *     false, plans are resolved from the instance-wide license instead.
   */
  public record Billing(boolean cloudEnabled) {}
}
