package io.b2mash.orgaccess.billing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Hosted billing relation of an organization. A null plan key means no plan is attached. */
@Entity
@Table(name = "subscriptions")
public class Subscription {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, unique = true)
  private UUID organizationId;

  @Column(name = "plan_key")
  private String planKey;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "available_features", columnDefinition = "jsonb", nullable = false)
  private List<String> availableFeatures = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false)
  private SubscriptionStatus status;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Subscription() {}

  public Subscription(UUID organizationId, String planKey, List<String> availableFeatures) {
    this.organizationId = organizationId;
    this.planKey = planKey;
    this.availableFeatures =
        availableFeatures != null ? new ArrayList<>(availableFeatures) : new ArrayList<>();
    this.status = SubscriptionStatus.ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getPlanKey() {
    return planKey;
  }

  public List<String> getAvailableFeatures() {
    return availableFeatures;
  }

  public SubscriptionStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void cancel() {
    this.status = SubscriptionStatus.CANCELLED;
    this.updatedAt = Instant.now();
  }

  public enum SubscriptionStatus {
    ACTIVE,
    CANCELLED
  }
}
