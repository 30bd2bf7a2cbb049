package io.b2mash.orgaccess.feature;

/** Which resolution path produced an organization's plan. */
public enum BillingRealm {
  /** Plan attached to the organization by hosted billing. */
  CLOUD("cloud"),
  /** Plan taken from the instance-wide license. */
  EE("ee");

  private final String key;

  BillingRealm(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
