package io.b2mash.orgaccess.team;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Fields for the default team created alongside a new organization. */
public record TeamFields(@NotBlank @Size(max = 200) String name) {

  public static TeamFields defaults() {
    return new TeamFields(Team.DEFAULT_NAME);
  }
}
