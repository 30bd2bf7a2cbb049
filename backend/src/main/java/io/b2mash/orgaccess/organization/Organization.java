package io.b2mash.orgaccess.organization;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "organizations")
public class Organization {

  public static final int MAX_NAME_LENGTH = 64;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = MAX_NAME_LENGTH)
  private String name;

  // Onboarding section 2 is marked done for every new organization unless bootstrap says otherwise
  @Column(name = "setup_section_2_completed", nullable = false)
  private boolean setupSection2Completed;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "personalization", columnDefinition = "jsonb", nullable = false)
  private Map<String, Object> personalization = new HashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Organization() {}

  public Organization(
      String name, boolean setupSection2Completed, Map<String, Object> personalization) {
    this.name = name;
    this.setupSection2Completed = setupSection2Completed;
    this.personalization =
        personalization != null ? new HashMap<>(personalization) : new HashMap<>();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public boolean isSetupSection2Completed() {
    return setupSection2Completed;
  }

  public Map<String, Object> getPersonalization() {
    return personalization;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isOnboardingActive() {
    return !setupSection2Completed;
  }

  public void completeOnboarding() {
    this.setupSection2Completed = true;
    this.updatedAt = Instant.now();
  }

  @Override
  public String toString() {
    return name;
  }
}
