package io.b2mash.orgaccess.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * The slice of a user account this module reads and writes: the email used to match invites and
 * the pointers to the organization and team the user is currently working in.
 */
@Entity
@Table(name = "users")
public class AppUser {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", nullable = false, unique = true, length = 254)
  private String email;

  @Column(name = "first_name", length = 150)
  private String firstName;

  @Column(name = "current_organization_id")
  private UUID currentOrganizationId;

  @Column(name = "current_team_id")
  private UUID currentTeamId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected AppUser() {}

  public AppUser(String email, String firstName) {
    this.email = email;
    this.firstName = firstName;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getFirstName() {
    return firstName;
  }

  public UUID getCurrentOrganizationId() {
    return currentOrganizationId;
  }

  public UUID getCurrentTeamId() {
    return currentTeamId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void switchContext(UUID organizationId, UUID teamId) {
    this.currentOrganizationId = organizationId;
    this.currentTeamId = teamId;
    this.updatedAt = Instant.now();
  }

  public void clearCurrentOrganization() {
    this.currentOrganizationId = null;
    this.updatedAt = Instant.now();
  }

  public void clearCurrentTeam() {
    this.currentTeamId = null;
    this.updatedAt = Instant.now();
  }
}
