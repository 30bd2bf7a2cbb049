package io.b2mash.orgaccess.audit;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditEventRecord}. The actor type is derived from the actor:
 * "USER" when an actor ID is set, "SYSTEM" otherwise.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("membership.level_changed")
 *     .entityType("membership")
 *     .entityId(membership.getId())
 *     .actorId(actor.getUserId())
 *     .details(Map.of("level", Map.of("from", "member", "to", "administrator")))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(entityId, "entityId");
    return new AuditEventRecord(
        eventType, entityType, entityId, actorId, actorId != null ? "USER" : "SYSTEM", details);
  }
}
