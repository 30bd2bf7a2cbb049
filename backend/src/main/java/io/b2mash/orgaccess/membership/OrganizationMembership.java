package io.b2mash.orgaccess.membership;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Binds a user to an organization with a {@link MembershipLevel}. The database enforces one
 * membership per (organization, user) and a single OWNER per organization (partial unique index
 * {@code only_one_owner_per_organization}, see the Flyway migrations).
 */
@Entity
@Table(
    name = "organization_memberships",
    uniqueConstraints =
        @UniqueConstraint(
            name = "unique_organization_membership",
            columnNames = {"organization_id", "user_id"}))
public class OrganizationMembership {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Convert(converter = MembershipLevelConverter.class)
  @Column(name = "level", nullable = false)
  private MembershipLevel level;

  @Column(name = "joined_at", nullable = false, updatable = false)
  private Instant joinedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected OrganizationMembership() {}

  public OrganizationMembership(UUID organizationId, UUID userId, MembershipLevel level) {
    this.organizationId = organizationId;
    this.userId = userId;
    this.level = level;
    this.joinedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public UUID getUserId() {
    return userId;
  }

  public MembershipLevel getLevel() {
    return level;
  }

  public Instant getJoinedAt() {
    return joinedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isOwner() {
    return level == MembershipLevel.OWNER;
  }

  public void changeLevel(MembershipLevel level) {
    this.level = level;
    this.updatedAt = Instant.now();
  }

  @Override
  public String toString() {
    return level.label();
  }
}
