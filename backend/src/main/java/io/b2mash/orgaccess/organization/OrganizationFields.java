package io.b2mash.orgaccess.organization;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * Fields for a new organization. A null {@code setupSection2Completed} means onboarding section 2
 * is already done.
 */
public record OrganizationFields(
    @NotBlank @Size(max = Organization.MAX_NAME_LENGTH) String name,
    Boolean setupSection2Completed,
    Map<String, Object> personalization) {

  public static OrganizationFields named(String name) {
    return new OrganizationFields(name, null, null);
  }

  Organization toOrganization() {
    return new Organization(
        name, setupSection2Completed == null || setupSection2Completed, personalization);
  }
}
