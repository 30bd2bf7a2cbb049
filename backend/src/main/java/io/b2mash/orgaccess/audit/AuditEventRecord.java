package io.b2mash.orgaccess.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Built with {@link
 * AuditEventBuilder}.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "membership", "invite")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param actorId user ID of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param details key field changes as JSONB; nullable. Never holds raw email addresses.
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    Map<String, Object> details) {}
