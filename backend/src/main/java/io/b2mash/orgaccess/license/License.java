package io.b2mash.orgaccess.license;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Instance-wide license for self-managed deployments. */
@Entity
@Table(name = "licenses")
public class License {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "license_key", nullable = false, unique = true, length = 200)
  private String key;

  @Column(name = "plan", nullable = false, length = 200)
  private String plan;

  @Column(name = "valid_until", nullable = false)
  private Instant validUntil;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected License() {}

  public License(String key, String plan, Instant validUntil) {
    this.key = key;
    this.plan = plan;
    this.validUntil = validUntil;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getKey() {
    return key;
  }

  public String getPlan() {
    return plan;
  }

  public Instant getValidUntil() {
    return validUntil;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isValidAt(Instant now) {
    return !validUntil.isBefore(now);
  }
}
