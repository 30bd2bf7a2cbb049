package io.b2mash.orgaccess.billing;

import java.util.UUID;

public interface BillingRelationProvider {

  BillingRelation findFor(UUID organizationId);
}
