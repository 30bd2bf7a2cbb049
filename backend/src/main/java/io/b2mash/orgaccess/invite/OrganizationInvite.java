package io.b2mash.orgaccess.invite;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A redeemable token that turns into an organization membership. Optionally bound to a target
 * email. Expiry is a predicate over {@code createdAt}; expired rows are never removed
 * automatically.
 */
@Entity
@Table(
    name = "organization_invites",
    indexes = @Index(name = "idx_organization_invites_target_email", columnList = "target_email"))
public class OrganizationInvite {

  public static final int MAX_FIRST_NAME_LENGTH = 30;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "target_email", length = 254)
  private String targetEmail;

  @Column(name = "first_name", nullable = false, length = MAX_FIRST_NAME_LENGTH)
  private String firstName;

  // Nulled by the database when the creating user is deleted
  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "emailing_attempt_made", nullable = false)
  private boolean emailingAttemptMade;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected OrganizationInvite() {}

  public OrganizationInvite(
      UUID organizationId,
      String targetEmail,
      String firstName,
      UUID createdBy,
      Instant createdAt) {
    this.organizationId = organizationId;
    this.targetEmail = targetEmail;
    this.firstName = firstName != null ? firstName : "";
    this.createdBy = createdBy;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getTargetEmail() {
    return targetEmail;
  }

  public String getFirstName() {
    return firstName;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public boolean isEmailingAttemptMade() {
    return emailingAttemptMade;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /**
   * Returns true once {@code createdAt} is at or before {@code now - validity}.
   *
   * @param now current instant
   * @param validity how long an invite stays redeemable
   */
  public boolean isExpired(Instant now, Duration validity) {
    return !createdAt.isAfter(now.minus(validity));
  }

  public void markEmailingAttemptMade(Instant now) {
    this.emailingAttemptMade = true;
    this.updatedAt = now;
  }

  /** Relative signup link for this invite; prefix with the public site URL. */
  public String getSignupPath() {
    return "/signup/" + id;
  }
}
