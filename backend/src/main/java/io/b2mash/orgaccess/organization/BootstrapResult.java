package io.b2mash.orgaccess.organization;

import io.b2mash.orgaccess.membership.OrganizationMembership;
import io.b2mash.orgaccess.team.Team;

/**
 * Outcome of {@link OrganizationService#bootstrap}. {@code membership} is null when the
 * organization was bootstrapped without a user.
 */
public record BootstrapResult(
    Organization organization, OrganizationMembership membership, Team team) {}
